package com.outbreaksentinel.engine.fusion;

import com.outbreaksentinel.core.error.InsufficientDataException;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.core.model.SourceEstimate;
import com.outbreaksentinel.core.model.SourceStatus;
import com.outbreaksentinel.engine.config.EngineConfig;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Reconciles all source estimates for one cell into a {@link FusedEstimate}.
 *
 * <ul>
 *     <li>Only the latest estimate per source counts.</li>
 *     <li>{@code missing} estimates only populate {@code sourcesFailed}.</li>
 *     <li>{@code stale} estimates keep participating with a discounted reliability.</li>
 *     <li>An empty estimate list carries the prior forward with zero agreement.</li>
 * </ul>
 */
public class FusionEngine {
    private static final Logger LOGGER = Logger.getLogger(FusionEngine.class.getName());
    static final String ZERO_RELIABILITY = "zero_reliability_ignored";

    private final EngineConfig.Fusion settings;
    private final Clock clock;
    private final Map<FusionMethod, FusionStrategy> strategies = new EnumMap<>(FusionMethod.class);

    public FusionEngine(EngineConfig config, Clock clock) {
        this(config, clock, List.of(
                new WeightedAverageFusion(),
                new BayesianFusion(),
                new KalmanFilterFusion(),
                new DempsterShaferFusion(),
                new EnsembleFusion(),
                new ConsensusFusion()
        ));
    }

    FusionEngine(EngineConfig config, Clock clock, List<FusionStrategy> strategies) {
        this.settings = config.fusion();
        this.clock = clock;
        strategies.forEach(strategy -> this.strategies.put(strategy.method(), strategy));
    }

    public FusionMethod defaultMethod() {
        return settings.defaultMethod();
    }

    public FusedEstimate fuse(CellKey cell, List<SourceEstimate> estimates, String methodName, FusedEstimate prior) {
        return fuse(cell, estimates, FusionMethod.fromWireName(methodName), prior);
    }

    /**
     * @param method fusion method, or {@code null} for the configured default
     * @param prior  latest fused estimate of the series, if any
     * @throws InsufficientDataException when there is nothing to fuse and nothing to carry forward, or
     *                                   when every estimate is {@code missing}
     */
    public FusedEstimate fuse(CellKey cell, List<SourceEstimate> estimates, FusionMethod method, FusedEstimate prior) {
        FusionMethod selected = method == null ? settings.defaultMethod() : method;
        FusionStrategy strategy = strategies.get(selected);
        if (strategy == null) {
            throw new IllegalStateException("No strategy registered for " + selected.wireName());
        }

        if (estimates == null || estimates.isEmpty()) {
            if (prior == null) {
                throw new InsufficientDataException(cell, "no estimates and no prior to carry forward");
            }
            LOGGER.fine(() -> "Carrying " + prior.cellKey() + " forward to " + cell);
            return prior.carriedForwardTo(cell.timeBucket(), Set.of(), clock.instant());
        }

        Set<String> failed = new TreeSet<>();
        Set<String> used = new TreeSet<>();
        List<Observation> observations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (SourceEstimate estimate : latestPerSource(cell, estimates)) {
            if (!estimate.usable()) {
                failed.add(estimate.sourceId());
                continue;
            }
            double weight = estimate.reliability();
            if (estimate.status() == SourceStatus.STALE) {
                weight *= settings.staleReliabilityFactor();
            }
            if (weight <= 0.0) {
                warnings.add(ZERO_RELIABILITY + ":" + estimate.sourceId());
                continue;
            }
            used.add(estimate.sourceId());
            observations.add(new Observation(estimate.sourceId(), estimate.value(), weight, estimate.observedAt()));
        }
        if (observations.isEmpty()) {
            throw new InsufficientDataException(cell, failed.isEmpty()
                    ? "no source carries positive reliability"
                    : "all sources missing " + failed);
        }

        FusionResult result = strategy.fuse(new FusionInput(cell, observations, prior), settings);
        warnings.addAll(result.warnings());
        return new FusedEstimate(
                cell.region(),
                cell.disease(),
                cell.timeBucket(),
                result.mean(),
                result.variance(),
                selected,
                used,
                failed,
                result.agreement(),
                clock.instant(),
                warnings
        );
    }

    private static List<SourceEstimate> latestPerSource(CellKey cell, List<SourceEstimate> estimates) {
        Map<String, SourceEstimate> latest = new LinkedHashMap<>();
        Comparator<SourceEstimate> newer = Comparator.comparing(SourceEstimate::observedAt)
                .thenComparing(SourceEstimate::usable);
        for (SourceEstimate estimate : estimates) {
            if (!estimate.cellKey().equals(cell)) {
                throw new IllegalArgumentException("Estimate for " + estimate.cellKey() + " passed to fusion of " + cell);
            }
            latest.merge(estimate.sourceId(), estimate, (current, candidate) ->
                    newer.compare(candidate, current) > 0 ? candidate : current);
        }
        return List.copyOf(latest.values());
    }
}
