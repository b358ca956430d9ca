package com.outbreaksentinel.collectors.normalize;

import com.outbreaksentinel.collectors.api.RawRecord;
import com.outbreaksentinel.collectors.api.SourceQuery;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.RegionProfile;
import com.outbreaksentinel.core.model.SourceEstimate;
import com.outbreaksentinel.core.model.SourceStatus;
import com.outbreaksentinel.core.model.TimeBucket;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts raw adapter output into canonical {@link SourceEstimate}s. Rejected records are reported as
 * {@link NormalizationError}s and never reach fusion. Performs no I/O.
 */
public class SourceNormalizer {
    private static final Logger LOGGER = Logger.getLogger(SourceNormalizer.class.getName());
    private static final double PER_100K = 100_000.0;

    private final Map<String, SourceProfile> profiles;
    private final Map<String, RegionProfile> regions;
    private final Clock clock;

    /**
     * @param regions region registry; when empty every region code is accepted, but rates cannot be
     *                converted to counts
     */
    public SourceNormalizer(Map<String, SourceProfile> profiles, Map<String, RegionProfile> regions, Clock clock) {
        this.profiles = Map.copyOf(profiles);
        this.regions = Map.copyOf(regions);
        this.clock = clock;
    }

    public SourceProfile profile(String sourceId) {
        return profiles.getOrDefault(sourceId, SourceProfile.defaults(sourceId));
    }

    public NormalizationResult normalize(List<RawRecord> rawRecords, String sourceId) {
        return normalize(rawRecords, sourceId, clock.instant());
    }

    public NormalizationResult normalize(List<RawRecord> rawRecords, String sourceId, Instant fetchedAt) {
        SourceProfile profile = profile(sourceId);
        Instant now = clock.instant();
        List<SourceEstimate> estimates = new ArrayList<>();
        List<NormalizationError> errors = new ArrayList<>();
        for (RawRecord record : rawRecords) {
            try {
                estimates.add(toEstimate(record, profile, fetchedAt, now));
            } catch (RecordRejected rejected) {
                errors.add(new NormalizationError(sourceId, rejected.reason, rejected.getMessage(), record));
                LOGGER.fine(() -> "Rejected record from " + sourceId + " (" + rejected.reason + "): " + rejected.getMessage());
            }
        }
        if (!errors.isEmpty()) {
            LOGGER.log(Level.WARNING, "Source {0}: {1} of {2} records rejected during normalization",
                    new Object[]{sourceId, errors.size(), rawRecords.size()});
        }
        return new NormalizationResult(estimates, errors);
    }

    /**
     * One {@code missing} sentinel per requested cell, so fusion can list the source as failed without
     * guessing a value.
     */
    public List<SourceEstimate> transportFailure(String sourceId, SourceQuery query) {
        SourceProfile profile = profile(sourceId);
        Instant now = clock.instant();
        List<SourceEstimate> sentinels = new ArrayList<>();
        for (CellKey cell : query.cells()) {
            sentinels.add(SourceEstimate.missing(sourceId, cell, profile.reliability(), now));
        }
        return sentinels;
    }

    private SourceEstimate toEstimate(RawRecord record, SourceProfile profile, Instant fetchedAt, Instant now) {
        String region = record.region() == null ? "" : record.region().trim();
        if (region.isEmpty()) {
            throw new RecordRejected(NormalizationError.MISSING_REGION, "record has no region");
        }
        if (!regions.isEmpty() && !regions.containsKey(region)) {
            throw new RecordRejected(NormalizationError.UNKNOWN_REGION, "region " + region + " is not registered");
        }
        if (record.disease() == null || record.disease().isBlank()) {
            throw new RecordRejected(NormalizationError.MISSING_DISEASE, "record has no disease code");
        }
        String disease = profile.canonicalDisease(record.disease());
        TimeBucket bucket = parsePeriod(record.period());
        Instant observedAt = parseObservedAt(record.observedAt(), fetchedAt);
        SourceStatus status = parseStatus(record.status());
        CellKey cell = new CellKey(region, disease, bucket);

        if (status == SourceStatus.MISSING) {
            return SourceEstimate.missing(profile.sourceId(), cell, profile.reliability(), observedAt);
        }
        double value = toCount(parseValue(record.value()), region, profile);
        if (Duration.between(observedAt, now).compareTo(profile.staleAfter()) > 0) {
            status = SourceStatus.STALE;
        }
        return new SourceEstimate(profile.sourceId(), region, disease, bucket, value, profile.reliability(), observedAt, status);
    }

    private static TimeBucket parsePeriod(String period) {
        try {
            return TimeBucket.parse(period);
        } catch (IllegalArgumentException e) {
            throw new RecordRejected(NormalizationError.UNPARSABLE_PERIOD, "period '" + period + "' is not an ISO period");
        }
    }

    private static Instant parseObservedAt(String observedAt, Instant fallback) {
        if (observedAt == null || observedAt.isBlank()) {
            return fallback;
        }
        try {
            return Instant.parse(observedAt.trim());
        } catch (DateTimeParseException e) {
            LOGGER.fine(() -> "Unparsable observedAt '" + observedAt + "', using fetch time");
            return fallback;
        }
    }

    private static SourceStatus parseStatus(String status) {
        try {
            return SourceStatus.fromWireName(status);
        } catch (IllegalArgumentException e) {
            LOGGER.fine(() -> "Unknown status '" + status + "', treating record as ok");
            return SourceStatus.OK;
        }
    }

    private static double parseValue(Object raw) {
        if (raw == null) {
            throw new RecordRejected(NormalizationError.MISSING_VALUE, "record has no value");
        }
        double value;
        if (raw instanceof Number number) {
            value = number.doubleValue();
        } else if (raw instanceof String text) {
            if (text.isBlank()) {
                throw new RecordRejected(NormalizationError.MISSING_VALUE, "record value is blank");
            }
            try {
                value = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                throw new RecordRejected(NormalizationError.NON_NUMERIC_VALUE, "value '" + text + "' is not numeric");
            }
        } else {
            throw new RecordRejected(NormalizationError.NON_NUMERIC_VALUE, "value of type " + raw.getClass().getSimpleName());
        }
        if (!Double.isFinite(value)) {
            throw new RecordRejected(NormalizationError.NON_NUMERIC_VALUE, "value " + raw + " is not finite");
        }
        if (value < 0) {
            throw new RecordRejected(NormalizationError.NEGATIVE_VALUE, "value " + value + " is negative");
        }
        return value;
    }

    private double toCount(double value, String region, SourceProfile profile) {
        if (profile.valueUnit() == ValueUnit.COUNT) {
            return value;
        }
        RegionProfile regionProfile = regions.get(region);
        if (regionProfile == null || regionProfile.population() <= 0) {
            throw new RecordRejected(
                    NormalizationError.UNIT_CONVERSION_UNAVAILABLE,
                    "no population for " + region + " to convert " + profile.valueUnit().wireName()
            );
        }
        return value * regionProfile.population() / PER_100K;
    }

    private static final class RecordRejected extends RuntimeException {
        private final String reason;

        private RecordRejected(String reason, String message) {
            super(message, null, false, false);
            this.reason = reason;
        }
    }
}
