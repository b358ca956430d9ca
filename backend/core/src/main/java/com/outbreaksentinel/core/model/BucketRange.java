package com.outbreaksentinel.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inclusive range of buckets of one granularity.
 */
public record BucketRange(TimeBucket from, TimeBucket to) {
    public BucketRange {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
        from.requireSameGranularity(to);
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Range end " + to + " precedes start " + from);
        }
    }

    public static BucketRange single(TimeBucket bucket) {
        return new BucketRange(bucket, bucket);
    }

    public static BucketRange trailing(TimeBucket end, int buckets) {
        return new BucketRange(end.plus(-(Math.max(1, buckets) - 1L)), end);
    }

    public boolean contains(TimeBucket bucket) {
        return !bucket.isBefore(from) && !bucket.isAfter(to);
    }

    public long size() {
        return from.bucketsUntil(to) + 1;
    }

    public List<TimeBucket> buckets() {
        List<TimeBucket> buckets = new ArrayList<>();
        for (TimeBucket cursor = from; !cursor.isAfter(to); cursor = cursor.next()) {
            buckets.add(cursor);
        }
        return buckets;
    }

    public BucketRange union(BucketRange other) {
        TimeBucket start = from.isBefore(other.from) ? from : other.from;
        TimeBucket end = to.isAfter(other.to) ? to : other.to;
        return new BucketRange(start, end);
    }
}
