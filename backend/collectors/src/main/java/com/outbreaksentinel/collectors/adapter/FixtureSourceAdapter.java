package com.outbreaksentinel.collectors.adapter;

import com.outbreaksentinel.collectors.api.RawRecord;
import com.outbreaksentinel.collectors.api.RawSourceBatch;
import com.outbreaksentinel.collectors.api.SourceAdapter;
import com.outbreaksentinel.collectors.api.SourceContext;
import com.outbreaksentinel.collectors.api.SourceQuery;
import com.outbreaksentinel.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Serves a source's records from a JSON file of the form {@code {"records": [...]}}. Used for local
 * runs and tests in place of a live feed.
 */
public class FixtureSourceAdapter implements SourceAdapter {
    private final String sourceId;
    private final List<RawRecord> records;

    public FixtureSourceAdapter(String sourceId, Path jsonFile) {
        this.sourceId = sourceId;
        try (InputStream in = Files.newInputStream(jsonFile)) {
            SourceFixture fixture = JsonUtils.objectMapper().readValue(in, SourceFixture.class);
            this.records = fixture.records() == null ? List.of() : List.copyOf(fixture.records());
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed reading source fixture: " + jsonFile, e);
        }
    }

    public FixtureSourceAdapter(String sourceId, List<RawRecord> records) {
        this.sourceId = sourceId;
        this.records = List.copyOf(records);
    }

    @Override
    public String sourceId() {
        return sourceId;
    }

    @Override
    public RawSourceBatch fetch(SourceQuery query, SourceContext ctx) {
        return new RawSourceBatch(sourceId, records, ctx.clock().instant());
    }

    private record SourceFixture(List<RawRecord> records) {
    }
}
