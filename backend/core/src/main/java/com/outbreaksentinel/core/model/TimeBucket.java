package com.outbreaksentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * An ISO period used as the time axis of a surveillance series: a day ({@code 2025-01-15}),
 * an ISO week ({@code 2025-W03}) or a month ({@code 2025-01}). The start date is always normalized
 * to the first day of the period.
 */
public record TimeBucket(Granularity granularity, LocalDate start) implements Comparable<TimeBucket> {
    private static final Pattern WEEK = Pattern.compile("^(\\d{4})-W(\\d{1,2})$");
    private static final Pattern MONTH = Pattern.compile("^\\d{4}-\\d{2}$");
    private static final Comparator<TimeBucket> ORDER = Comparator
            .comparing(TimeBucket::start)
            .thenComparing(TimeBucket::granularity);

    public enum Granularity {
        DAY(ChronoUnit.DAYS),
        ISO_WEEK(ChronoUnit.WEEKS),
        MONTH(ChronoUnit.MONTHS);

        private final ChronoUnit unit;

        Granularity(ChronoUnit unit) {
            this.unit = unit;
        }

        public ChronoUnit unit() {
            return unit;
        }

        LocalDate align(LocalDate date) {
            return switch (this) {
                case DAY -> date;
                case ISO_WEEK -> date.with(DayOfWeek.MONDAY);
                case MONTH -> date.withDayOfMonth(1);
            };
        }
    }

    public TimeBucket {
        Objects.requireNonNull(granularity, "granularity is required");
        Objects.requireNonNull(start, "start is required");
        start = granularity.align(start);
    }

    public static TimeBucket of(Granularity granularity, Instant instant) {
        return new TimeBucket(granularity, LocalDate.ofInstant(instant, ZoneOffset.UTC));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TimeBucket parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Time bucket is blank");
        }
        String value = text.trim().toUpperCase(Locale.ROOT);
        try {
            var week = WEEK.matcher(value);
            if (week.matches()) {
                String iso = week.group(1) + "-W" + String.format(Locale.ROOT, "%02d", Integer.parseInt(week.group(2))) + "-1";
                return new TimeBucket(Granularity.ISO_WEEK, LocalDate.parse(iso, DateTimeFormatter.ISO_WEEK_DATE));
            }
            if (MONTH.matcher(value).matches()) {
                return new TimeBucket(Granularity.MONTH, YearMonth.parse(value).atDay(1));
            }
            return new TimeBucket(Granularity.DAY, LocalDate.parse(value));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unparsable time bucket: " + text, e);
        }
    }

    public TimeBucket plus(long buckets) {
        return new TimeBucket(granularity, start.plus(buckets, granularity.unit()));
    }

    public TimeBucket next() {
        return plus(1);
    }

    public TimeBucket previous() {
        return plus(-1);
    }

    /**
     * Signed number of buckets from this bucket to {@code other}; both must share a granularity.
     */
    public long bucketsUntil(TimeBucket other) {
        requireSameGranularity(other);
        return granularity.unit().between(start, other.start);
    }

    public boolean isBefore(TimeBucket other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(TimeBucket other) {
        return compareTo(other) > 0;
    }

    public Instant startInstant() {
        return start.atStartOfDay(ZoneOffset.UTC).toInstant();
    }

    public Instant endInstant() {
        return next().startInstant();
    }

    public void requireSameGranularity(TimeBucket other) {
        if (other.granularity != granularity) {
            throw new IllegalArgumentException("Mixed bucket granularity: " + this + " vs " + other);
        }
    }

    @Override
    public int compareTo(TimeBucket other) {
        return ORDER.compare(this, other);
    }

    @JsonValue
    @Override
    public String toString() {
        return switch (granularity) {
            case DAY -> start.toString();
            case ISO_WEEK -> String.format(
                    Locale.ROOT,
                    "%d-W%02d",
                    start.get(IsoFields.WEEK_BASED_YEAR),
                    start.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR)
            );
            case MONTH -> YearMonth.from(start).toString();
        };
    }
}
