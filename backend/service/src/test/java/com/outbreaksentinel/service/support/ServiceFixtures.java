package com.outbreaksentinel.service.support;

import com.outbreaksentinel.core.model.Alert;
import com.outbreaksentinel.core.model.BucketRange;
import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.core.model.Severity;
import com.outbreaksentinel.core.model.TimeBucket;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

public final class ServiceFixtures {
    public static final Instant NOW = Instant.parse("2025-01-22T12:00:00Z");
    public static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

    private static final List<String> CONFIG_FILES = List.of(
            "engine.json", "sources.json", "regions.json", "watch.json", "who-influenza.json", "cdc-influenza.json"
    );

    private ServiceFixtures() {
    }

    /**
     * Copies the test config directory into a fresh temp directory.
     */
    public static Path configDir() throws IOException {
        Path dir = Files.createTempDirectory("surveillance-config-");
        for (String name : CONFIG_FILES) {
            try (InputStream in = ServiceFixtures.class.getResourceAsStream("/fixtures/config/" + name)) {
                if (in == null) {
                    throw new IllegalStateException("Missing test resource " + name);
                }
                Files.copy(in, dir.resolve(name));
            }
        }
        return dir;
    }

    public static Alert alert(String id, String region, String disease, Instant detectedAt) {
        TimeBucket bucket = TimeBucket.parse("2025-W03");
        return new Alert(
                id,
                region,
                disease,
                detectedAt,
                bucket,
                BucketRange.trailing(bucket, 3),
                Set.of(DetectionMethod.CUSUM),
                Severity.MODERATE,
                0.7,
                null,
                0.25,
                1_000L
        );
    }

    public static FusedEstimate estimate(String region, String disease, String bucket, double mean) {
        return new FusedEstimate(region, disease, TimeBucket.parse(bucket), mean, 4.0, FusionMethod.BAYESIAN,
                Set.of("who"), Set.of(), 0.9, NOW, List.of());
    }
}
