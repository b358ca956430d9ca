package com.outbreaksentinel.collectors.api;

/**
 * Source-specific transport. Implementations fetch raw records for a query and leave validation and
 * canonicalization to the normalizer. Any exception counts as a transport failure for that source.
 */
public interface SourceAdapter {
    String sourceId();

    RawSourceBatch fetch(SourceQuery query, SourceContext ctx) throws Exception;
}
