package com.outbreaksentinel.collectors.adapter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.outbreaksentinel.collectors.api.RawRecord;
import com.outbreaksentinel.collectors.api.RawSourceBatch;
import com.outbreaksentinel.collectors.api.SourceAdapter;
import com.outbreaksentinel.collectors.api.SourceContext;
import com.outbreaksentinel.collectors.api.SourceQuery;
import com.outbreaksentinel.core.error.SourceUnavailableException;
import com.outbreaksentinel.core.util.JsonUtils;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Fetches records from an HTTP endpoint that already speaks the canonical raw-record shape, either a
 * bare JSON array or {@code {"records": [...]}}. Query cells are passed as request parameters.
 */
public class HttpJsonSourceAdapter implements SourceAdapter {
    private static final TypeReference<List<RawRecord>> RECORDS = new TypeReference<>() {
    };

    private final String sourceId;
    private final URI endpoint;
    private final String userAgent;

    public HttpJsonSourceAdapter(String sourceId, URI endpoint, String userAgent) {
        this.sourceId = sourceId;
        this.endpoint = endpoint;
        this.userAgent = userAgent;
    }

    @Override
    public String sourceId() {
        return sourceId;
    }

    @Override
    public RawSourceBatch fetch(SourceQuery query, SourceContext ctx) throws Exception {
        URI uri = requestUri(query);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .GET()
                .timeout(ctx.requestTimeout())
                .header("Accept", "application/json")
                .header("User-Agent", userAgent)
                .build();
        HttpResponse<String> response = ctx.httpClient().send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() / 100 != 2) {
            throw new SourceUnavailableException(
                    sourceId,
                    "request failed with status " + response.statusCode() + " for " + uri,
                    null
            );
        }
        JsonNode body = JsonUtils.objectMapper().readTree(response.body());
        JsonNode records = body.isArray() ? body : body.path("records");
        if (!records.isArray()) {
            throw new SourceUnavailableException(sourceId, "response from " + uri + " has no records array", null);
        }
        List<RawRecord> parsed = JsonUtils.objectMapper().convertValue(records, RECORDS);
        return new RawSourceBatch(sourceId, parsed, ctx.clock().instant());
    }

    URI requestUri(SourceQuery query) {
        String separator = endpoint.getRawQuery() == null ? "?" : "&";
        String params = "regions=" + encode(String.join(",", query.regions()))
                + "&diseases=" + encode(String.join(",", query.diseases()))
                + "&from=" + encode(query.range().from().toString())
                + "&to=" + encode(query.range().to().toString());
        return URI.create(endpoint + separator + params);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
