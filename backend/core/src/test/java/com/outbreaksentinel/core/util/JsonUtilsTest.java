package com.outbreaksentinel.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.core.model.TimeBucket;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndConfigured() {
        ObjectMapper first = JsonUtils.objectMapper();
        ObjectMapper second = JsonUtils.objectMapper();

        assertSame(first, second);
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
        assertTrue(JsonUtils.toJson(new Payload("ok", null, Instant.parse("2025-02-01T00:00:00Z")))
                .contains("\"createdAt\":\"2025-02-01T00:00:00Z\""));
    }

    @Test
    void fusedEstimateTravelsWithWireNames() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();
        FusedEstimate estimate = new FusedEstimate(
                "US-CA",
                "influenza",
                TimeBucket.parse("2025-W03"),
                135.1,
                0.35,
                FusionMethod.BAYESIAN,
                Set.of("WHO", "CDC"),
                Set.of(),
                0.97,
                Instant.parse("2025-01-20T00:00:00Z"),
                List.of()
        );

        var tree = mapper.readTree(JsonUtils.toJson(estimate));
        assertEquals("2025-W03", tree.get("timeBucket").asText());
        assertEquals("bayesian", tree.get("method").asText());
        assertEquals("CDC", tree.get("sourcesUsed").get(0).asText());
        assertFalse(tree.has("cellKey"));

        FusedEstimate parsed = mapper.readValue(
                "{\"region\":\"US-CA\",\"disease\":\"Influenza\",\"timeBucket\":\"2025-W03\",\"mean\":1.5,"
                        + "\"variance\":0.2,\"method\":\"bayesian_fusion\",\"agreementScore\":1.0,"
                        + "\"computedAt\":\"2025-01-20T00:00:00Z\",\"extra\":true}",
                FusedEstimate.class
        );
        assertEquals("influenza", parsed.disease());
        assertEquals(FusionMethod.BAYESIAN, parsed.method());
        assertTrue(parsed.sourcesUsed().isEmpty());
        assertTrue(parsed.warnings().isEmpty());
    }

    @Test
    void configStyleInputAllowsCommentsAndIsoDurations() throws Exception {
        Settings settings = JsonUtils.objectMapper().readValue("""
                {
                  // poll hourly
                  "pollInterval": "PT1H",
                  "regions": ["US-CA", "US-NV",],
                }
                """, Settings.class);

        assertEquals(Duration.ofHours(1), settings.pollInterval());
        assertEquals(List.of("US-CA", "US-NV"), settings.regions());
        assertTrue(JsonUtils.toJson(settings).contains("\"pollInterval\":\"PT1H\""));
    }

    record Settings(Duration pollInterval, List<String> regions) {
    }

    private record Payload(String name, String optional, Instant createdAt) {
    }
}
