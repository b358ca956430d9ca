package com.outbreaksentinel.collectors.normalize;

import com.outbreaksentinel.collectors.api.RawRecord;

public record NormalizationError(String sourceId, String reason, String detail, RawRecord record) {
    public static final String MISSING_REGION = "missing_region";
    public static final String UNKNOWN_REGION = "unknown_region";
    public static final String MISSING_DISEASE = "missing_disease";
    public static final String UNPARSABLE_PERIOD = "unparsable_period";
    public static final String MISSING_VALUE = "missing_value";
    public static final String NON_NUMERIC_VALUE = "non_numeric_value";
    public static final String NEGATIVE_VALUE = "negative_value";
    public static final String UNIT_CONVERSION_UNAVAILABLE = "unit_conversion_unavailable";
}
