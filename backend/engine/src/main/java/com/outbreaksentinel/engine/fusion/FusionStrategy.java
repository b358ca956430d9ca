package com.outbreaksentinel.engine.fusion;

import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.engine.config.EngineConfig;

/**
 * One fusion algorithm. Implementations are stateless: the result depends only on the input and the
 * settings.
 */
public interface FusionStrategy {
    FusionMethod method();

    FusionResult fuse(FusionInput input, EngineConfig.Fusion settings);
}
