package com.outbreaksentinel.collectors.config;

import com.outbreaksentinel.collectors.normalize.SourceProfile;
import com.outbreaksentinel.collectors.normalize.ValueUnit;

import java.time.Duration;
import java.util.Map;

/**
 * One configured feed. {@code type} is {@code fixture} (location is a JSON file path) or {@code http}
 * (location is the endpoint URL).
 */
public record SourceConfig(
        String id,
        String type,
        String location,
        double reliability,
        Map<String, String> diseaseAliases,
        ValueUnit valueUnit,
        Duration staleAfter,
        Boolean enabled
) {
    public boolean isEnabled() {
        return enabled == null || enabled;
    }

    public SourceProfile toProfile() {
        return new SourceProfile(id, reliability, diseaseAliases, valueUnit, staleAfter);
    }
}
