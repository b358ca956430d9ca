package com.outbreaksentinel.collectors.api;

/**
 * One record as a source reports it, before validation. {@code value} is left untyped so that
 * non-numeric payloads can be rejected with a reason rather than a parse failure.
 */
public record RawRecord(
        String region,
        String disease,
        String period,
        Object value,
        String observedAt,
        String status
) {
}
