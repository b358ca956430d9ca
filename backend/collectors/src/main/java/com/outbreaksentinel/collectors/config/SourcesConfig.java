package com.outbreaksentinel.collectors.config;

import java.time.Duration;
import java.util.List;

public record SourcesConfig(
        Duration pollInterval,
        Duration requestTimeout,
        ResilienceConfig resilience,
        List<SourceConfig> sources
) {
    public SourcesConfig {
        pollInterval = pollInterval == null ? Duration.ofMinutes(15) : pollInterval;
        requestTimeout = requestTimeout == null ? Duration.ofSeconds(10) : requestTimeout;
        resilience = resilience == null ? ResilienceConfig.defaults() : resilience;
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public List<SourceConfig> enabledSources() {
        return sources.stream().filter(SourceConfig::isEnabled).toList();
    }
}
