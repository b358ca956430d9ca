package com.outbreaksentinel.service.config;

import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.core.model.TimeBucket;

import java.util.List;

/**
 * What the scheduler polls on every tick: every enabled source, for each region and disease, over the
 * trailing {@code lookbackBuckets} buckets ending at the current one.
 */
public record WatchConfig(
        List<String> regions,
        List<String> diseases,
        int lookbackBuckets,
        TimeBucket.Granularity granularity,
        FusionMethod fusionMethod,
        Boolean enabled
) {
    public WatchConfig {
        regions = regions == null ? List.of() : List.copyOf(regions);
        diseases = diseases == null ? List.of() : List.copyOf(diseases);
        lookbackBuckets = lookbackBuckets <= 0 ? 2 : lookbackBuckets;
        granularity = granularity == null ? TimeBucket.Granularity.ISO_WEEK : granularity;
    }

    public static WatchConfig empty() {
        return new WatchConfig(List.of(), List.of(), 0, null, null, false);
    }

    public boolean isEnabled() {
        return (enabled == null || enabled) && !regions.isEmpty() && !diseases.isEmpty();
    }
}
