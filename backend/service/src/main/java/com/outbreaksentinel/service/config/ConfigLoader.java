package com.outbreaksentinel.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.outbreaksentinel.collectors.config.SourcesConfig;
import com.outbreaksentinel.core.model.RegionProfile;
import com.outbreaksentinel.core.util.JsonUtils;
import com.outbreaksentinel.engine.config.EngineConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    /**
     * Engine settings from {@code engine.json}; defaults when the file is absent.
     */
    public static EngineConfig loadEngine(Path configDir) {
        Path path = configDir.resolve("engine.json");
        if (!Files.exists(path)) {
            return EngineConfig.defaults();
        }
        return read(path, new TypeReference<>() {
        });
    }

    public static SourcesConfig loadSources(Path configDir) {
        return read(configDir.resolve("sources.json"), new TypeReference<>() {
        });
    }

    /**
     * Region registry keyed by region code, in file order.
     */
    public static Map<String, RegionProfile> loadRegions(Path configDir) {
        List<RegionProfile> profiles = read(configDir.resolve("regions.json"), new TypeReference<>() {
        });
        Map<String, RegionProfile> regions = new LinkedHashMap<>();
        for (RegionProfile profile : profiles) {
            if (regions.putIfAbsent(profile.region(), profile) != null) {
                throw new IllegalStateException("Duplicate region " + profile.region() + " in "
                        + configDir.resolve("regions.json"));
            }
        }
        return regions;
    }

    /**
     * Scheduled watch list from {@code watch.json}; disabled when the file is absent.
     */
    public static WatchConfig loadWatch(Path configDir) {
        Path path = configDir.resolve("watch.json");
        if (!Files.exists(path)) {
            return WatchConfig.empty();
        }
        return read(path, new TypeReference<>() {
        });
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | RuntimeException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
