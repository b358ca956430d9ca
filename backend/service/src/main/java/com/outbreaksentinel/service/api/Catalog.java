package com.outbreaksentinel.service.api;

import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.core.model.Sensitivity;
import com.outbreaksentinel.engine.config.EngineConfig;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class Catalog {
    private Catalog() {
    }

    public static Map<String, Object> describe(EngineConfig config, List<String> sourceIds) {
        List<Map<String, Object>> fusion = new ArrayList<>();
        for (FusionMethod method : FusionMethod.values()) {
            Map<String, Object> item = new HashMap<>();
            item.put("name", method.wireName());
            item.put("description", method.description());
            item.put("default", method == config.fusion().defaultMethod());
            fusion.add(item);
        }

        List<Map<String, Object>> detection = new ArrayList<>();
        for (DetectionMethod method : DetectionMethod.values()) {
            Map<String, Object> item = new HashMap<>();
            item.put("name", method.wireName());
            item.put("description", method.description());
            item.put("enabled", config.detection().enabled(method));
            detection.add(item);
        }

        List<Map<String, Object>> sensitivities = new ArrayList<>();
        for (Sensitivity sensitivity : Sensitivity.values()) {
            Map<String, Object> item = new HashMap<>();
            item.put("name", sensitivity.wireName());
            item.put("thresholdScale", sensitivity.thresholdScale());
            item.put("scanAlpha", sensitivity.scanAlpha());
            sensitivities.add(item);
        }

        Map<String, Object> catalog = new HashMap<>();
        catalog.put("defaultFusionMethod", config.fusion().defaultMethod().wireName());
        catalog.put("fusionMethods", fusion);
        catalog.put("detectionMethods", detection);
        catalog.put("sensitivities", sensitivities);
        catalog.put("defaultSensitivity", config.detection().sensitivity().wireName());
        catalog.put("sources", List.copyOf(sourceIds));
        return catalog;
    }
}
