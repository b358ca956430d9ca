package com.outbreaksentinel.service.surveillance;

import com.outbreaksentinel.collectors.SourceFanOut;
import com.outbreaksentinel.collectors.api.FanOutResult;
import com.outbreaksentinel.collectors.api.SourceContext;
import com.outbreaksentinel.collectors.api.SourceQuery;
import com.outbreaksentinel.collectors.normalize.SourceProfile;
import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.error.SurveillanceException;
import com.outbreaksentinel.core.events.AlertResolved;
import com.outbreaksentinel.core.model.Alert;
import com.outbreaksentinel.core.model.BucketRange;
import com.outbreaksentinel.core.model.CellKey;
import com.outbreaksentinel.core.model.DetectionMethod;
import com.outbreaksentinel.core.model.FusedEstimate;
import com.outbreaksentinel.core.model.FusionMethod;
import com.outbreaksentinel.core.model.Sensitivity;
import com.outbreaksentinel.core.model.SeriesKey;
import com.outbreaksentinel.core.model.SourceEstimate;
import com.outbreaksentinel.core.model.TimeBucket;
import com.outbreaksentinel.engine.alert.AlertAggregator;
import com.outbreaksentinel.engine.alert.RiskAssessment;
import com.outbreaksentinel.engine.config.EngineConfig;
import com.outbreaksentinel.engine.detection.DetectorResult;
import com.outbreaksentinel.engine.detection.DetectorSignal;
import com.outbreaksentinel.engine.pipeline.CellOutcome;
import com.outbreaksentinel.engine.pipeline.DetectionCoordinator;
import com.outbreaksentinel.engine.pipeline.DetectionReport;
import com.outbreaksentinel.engine.pipeline.IngestReport;
import com.outbreaksentinel.engine.pipeline.SurveillanceEngine;
import com.outbreaksentinel.engine.quality.ConfidenceScore;
import com.outbreaksentinel.engine.quality.CrossSourceOutlierScreen;
import com.outbreaksentinel.engine.quality.SourceAnomaly;
import com.outbreaksentinel.engine.quality.SourceQuality;
import com.outbreaksentinel.engine.quality.SourceQualityAssessor;
import com.outbreaksentinel.service.config.WatchConfig;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Request-level operations over the engine: polling sources into the store ({@code aggregate}),
 * quality-filtered fusion ({@code fuse}) and on-demand outbreak detection ({@code detectOutbreaks}).
 *
 * <p>Every response reports {@code partialData} and {@code fallbackUsed}; per-cell failures are listed
 * in the response and never fail the request. Unknown method names raise
 * {@link com.outbreaksentinel.core.error.InvalidMethodException}, malformed arguments
 * {@link IllegalArgumentException}.
 */
public class SurveillanceService {
    private static final Logger LOGGER = Logger.getLogger(SurveillanceService.class.getName());

    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.6;
    static final int MAX_TIMEFRAME_BUCKETS = 366;

    private final EngineConfig config;
    private final SurveillanceEngine engine;
    private final SourceFanOut fanOut;
    private final DetectionCoordinator coordinator;
    private final AlertAggregator aggregator;
    private final Map<String, Double> reliabilities;
    private final SourceContext context;
    private final WatchConfig watch;
    private final EventBus eventBus;
    private final Clock clock;
    private final SourceQualityAssessor assessor;
    private final CrossSourceOutlierScreen outlierScreen = new CrossSourceOutlierScreen();
    private final Supplier<Map<String, String>> circuitStates;

    public SurveillanceService(
            EngineConfig config,
            SurveillanceEngine engine,
            SourceFanOut fanOut,
            DetectionCoordinator coordinator,
            AlertAggregator aggregator,
            Map<String, Double> reliabilities,
            SourceContext context,
            WatchConfig watch,
            Supplier<Map<String, String>> circuitStates
    ) {
        this.config = config;
        this.engine = engine;
        this.fanOut = fanOut;
        this.coordinator = coordinator;
        this.aggregator = aggregator;
        this.reliabilities = Map.copyOf(reliabilities);
        this.context = context;
        this.watch = watch;
        this.eventBus = context.eventBus();
        this.clock = context.clock();
        this.assessor = new SourceQualityAssessor(clock);
        this.circuitStates = circuitStates;
    }

    public EngineConfig config() {
        return config;
    }

    public WatchConfig watch() {
        return watch;
    }

    public List<String> sourceIds() {
        return fanOut.sourceIds();
    }

    /**
     * Polls the sources for every requested cell, fuses and stores the results. Stored appends trigger
     * detection through the coordinator.
     */
    public AggregateResponse aggregate(AggregateRequest request) {
        FusionMethod method = method(request.method());
        SourceQuery query = query(request.regions(), request.diseases(), request.from(), request.to());
        FanOutResult polled = poll(query, request.sources());
        IngestReport report = engine.ingest(polled.estimates(), query.cells(), method);

        Map<String, Map<String, FusedEstimate>> data = new TreeMap<>();
        Map<CellKey, FusedEstimate> fused = new HashMap<>();
        int covered = 0;
        for (CellOutcome outcome : report.cells()) {
            if (!outcome.ok() || outcome.estimate() == null) {
                continue;
            }
            FusedEstimate estimate = outcome.estimate();
            fused.put(outcome.cell(), estimate);
            if (!estimate.sourcesUsed().isEmpty()) {
                covered++;
            }
            data.computeIfAbsent(estimate.region(), ignored -> new TreeMap<>())
                    .merge(estimate.disease(), estimate, (current, candidate) ->
                            candidate.timeBucket().isAfter(current.timeBucket()) ? candidate : current);
        }

        List<SourceQuality> qualities = assessor.assess(
                reliabilitiesOf(polled.sourcesQueried()), polled.estimates(), query.cells().size(), fused);
        double quality = qualities.stream().mapToDouble(SourceQuality::overallQuality).average().orElse(0.0);
        double coverage = query.cells().isEmpty() ? 0.0 : 100.0 * covered / query.cells().size();

        AggregateResponse.Metadata metadata = new AggregateResponse.Metadata(
                round(quality), round(coverage), method.wireName(), query.range(), polled.errors().size());
        return new AggregateResponse(
                polled.sourcesQueried().size(),
                polled.successfulSources().size(),
                polled.failedSources().size(),
                polled.failedSources(),
                data,
                metadata,
                polled.partial() || report.partial(),
                carriedForward(report.fused()),
                errors(report)
        );
    }

    /**
     * Fuses with only the sources whose quality for this request meets {@code confidenceThreshold}. When
     * none does, the best-scoring source is kept and {@code fallbackUsed} is set.
     */
    public FuseResponse fuse(FuseRequest request) {
        FusionMethod method = method(request.fusionMethod());
        double threshold = request.confidenceThreshold() == null
                ? DEFAULT_CONFIDENCE_THRESHOLD
                : request.confidenceThreshold();
        if (!(threshold >= 0.0 && threshold <= 1.0)) {
            throw new IllegalArgumentException("confidenceThreshold must be within [0, 1]: " + threshold);
        }
        SourceQuery query = query(request.regions(), request.diseases(), request.from(), request.to());
        FanOutResult polled = poll(query, request.sources());
        List<SourceEstimate> estimates = polled.estimates();

        List<SourceQuality> qualities = assessor.assess(
                reliabilitiesOf(polled.sourcesQueried()), estimates, query.cells().size(),
                preview(query.cells(), estimates, method));
        Map<String, SourceQuality> byId = new LinkedHashMap<>();
        qualities.forEach(quality -> byId.put(quality.sourceId(), quality));

        Set<String> kept = new LinkedHashSet<>();
        for (SourceQuality quality : qualities) {
            if (quality.overallQuality() >= threshold) {
                kept.add(quality.sourceId());
            }
        }
        boolean fallbackUsed = false;
        if (kept.isEmpty() && !qualities.isEmpty()) {
            SourceQuality best = qualities.stream()
                    .max(Comparator.comparingDouble(SourceQuality::overallQuality))
                    .orElseThrow();
            kept.add(best.sourceId());
            fallbackUsed = true;
            LOGGER.warning("No source met confidence threshold " + threshold + "; falling back to " + best.sourceId());
        }
        List<String> excluded = polled.sourcesQueried().stream().filter(id -> !kept.contains(id)).toList();

        List<SourceEstimate> selected = estimates.stream()
                .filter(estimate -> kept.contains(estimate.sourceId()))
                .toList();
        IngestReport report = engine.ingest(selected, query.cells(), method, kept);
        List<FusedEstimate> fused = report.fused();
        List<SourceQuality> keptQualities = kept.stream().map(byId::get).toList();

        return new FuseResponse(
                method.wireName(),
                round(ConfidenceScore.of(keptQualities, fused, kept.size())),
                fused,
                outlierScreen.screen(estimates),
                byId,
                List.copyOf(kept),
                excluded,
                polled.partial() || report.partial(),
                fallbackUsed || carriedForward(fused),
                errors(report)
        );
    }

    /**
     * Re-runs detection over stored series with the requested methods and sensitivity. Alerts go through
     * the aggregator, so cooldown suppression applies exactly as for scheduled detection.
     */
    public DetectResponse detectOutbreaks(DetectRequest request) {
        Set<DetectionMethod> methods = detectionMethods(request.detectionMethods());
        Sensitivity sensitivity = Sensitivity.fromWireName(request.sensitivity());
        int window = request.temporalWindow() == null ? 1 : request.temporalWindow();
        if (window < 1 || window > engine.store().retentionBuckets()) {
            throw new IllegalArgumentException("temporalWindow must be within [1, "
                    + engine.store().retentionBuckets() + "]: " + window);
        }
        EngineConfig.Detection settings = config.detection().withEnabledMethods(methods).withSensitivity(sensitivity);
        List<SeriesKey> series = selectSeries(request.regions(), request.diseases());

        List<DetectionReport> reports = new ArrayList<>();
        for (SeriesKey key : series) {
            reports.addAll(coordinator.evaluateSeries(key, settings, window));
        }

        List<Alert> emitted = new ArrayList<>();
        List<DetectorSignal> anomalies = new ArrayList<>();
        int suppressed = 0;
        for (DetectionReport report : reports) {
            report.outcome().emittedAlert().ifPresent(emitted::add);
            if (report.outcome().suppressed()) {
                suppressed++;
            }
            anomalies.addAll(report.anomalies());
        }
        List<Alert> active = series.stream()
                .map(aggregator::openAlert)
                .flatMap(Optional::stream)
                .toList();

        RiskAssessment risk = RiskAssessment.of(active, methods.size(), notices(reports));
        LOGGER.info("Detection over " + series.size() + " series at " + sensitivity.wireName()
                + " sensitivity emitted " + emitted.size() + " alerts");
        return new DetectResponse(
                emitted.size(),
                emitted,
                active,
                suppressed,
                anomalies,
                round(risk.riskScore()),
                risk.riskLevel(),
                round(risk.geographicSpread()),
                risk.recommendations(),
                series.size(),
                List.copyOf(methods),
                sensitivity
        );
    }

    /**
     * Scheduled poll of the configured watch list over its trailing lookback window.
     */
    public AggregateResponse pollWatchList() {
        TimeBucket current = TimeBucket.of(watch.granularity(), clock.instant());
        BucketRange range = BucketRange.trailing(current, watch.lookbackBuckets());
        String method = watch.fusionMethod() == null ? null : watch.fusionMethod().wireName();
        return aggregate(new AggregateRequest(
                List.of(), watch.regions(), watch.diseases(), range.from().toString(), range.to().toString(), method));
    }

    /**
     * Stored estimates of one series, the whole retained window when {@code from} and {@code to} are absent.
     */
    public List<FusedEstimate> estimates(String region, String disease, String from, String to) {
        if (region == null || region.isBlank() || disease == null || disease.isBlank()) {
            throw new IllegalArgumentException("region and disease are required");
        }
        SeriesKey series = new SeriesKey(region, disease);
        Optional<FusedEstimate> latest = engine.store().latest(series);
        if (latest.isEmpty()) {
            return List.of();
        }
        TimeBucket end = to == null || to.isBlank() ? latest.get().timeBucket() : TimeBucket.parse(to);
        TimeBucket start = from == null || from.isBlank()
                ? end.plus(-(engine.store().retentionBuckets() - 1L))
                : TimeBucket.parse(from);
        return engine.store().window(series, start, end);
    }

    public List<Alert> openAlerts() {
        return aggregator.openAlerts();
    }

    public Optional<Alert> resolveAlert(String region, String disease) {
        if (region == null || region.isBlank() || disease == null || disease.isBlank()) {
            throw new IllegalArgumentException("region and disease are required");
        }
        Optional<Alert> resolved = aggregator.resolve(region, disease);
        resolved.ifPresent(alert -> eventBus.publish(new AlertResolved(clock.instant(), alert)));
        return resolved;
    }

    private FanOutResult poll(SourceQuery query, List<String> sources) {
        return fanOut.poll(query, sources, context).join();
    }

    private FusionMethod method(String name) {
        if (name == null || name.isBlank()) {
            return config.fusion().defaultMethod();
        }
        return FusionMethod.fromWireName(name);
    }

    private Set<DetectionMethod> detectionMethods(List<String> names) {
        if (names.isEmpty()) {
            return EnumSet.copyOf(config.detection().enabledMethods());
        }
        Set<DetectionMethod> methods = EnumSet.noneOf(DetectionMethod.class);
        for (String name : names) {
            methods.add(DetectionMethod.fromWireName(name));
        }
        return methods;
    }

    private SourceQuery query(List<String> regions, List<String> diseases, String from, String to) {
        List<String> selectedRegions = regions.isEmpty() ? watch.regions() : regions;
        List<String> selectedDiseases = diseases.isEmpty() ? watch.diseases() : diseases;
        if (selectedRegions.isEmpty() || selectedDiseases.isEmpty()) {
            throw new IllegalArgumentException("regions and diseases are required");
        }
        BucketRange range = timeframe(from, to);
        if (range.size() > MAX_TIMEFRAME_BUCKETS) {
            throw new IllegalArgumentException("timeframe spans " + range.size() + " buckets, at most "
                    + MAX_TIMEFRAME_BUCKETS + " are allowed");
        }
        return new SourceQuery(selectedRegions, selectedDiseases, range);
    }

    private BucketRange timeframe(String from, String to) {
        boolean hasFrom = from != null && !from.isBlank();
        boolean hasTo = to != null && !to.isBlank();
        if (!hasFrom && !hasTo) {
            return BucketRange.single(TimeBucket.of(watch.granularity(), clock.instant()));
        }
        TimeBucket start = TimeBucket.parse(hasFrom ? from : to);
        TimeBucket end = TimeBucket.parse(hasTo ? to : from);
        return new BucketRange(start, end);
    }

    private List<SeriesKey> selectSeries(List<String> regions, List<String> diseases) {
        Set<String> wantedRegions = new LinkedHashSet<>();
        regions.forEach(region -> wantedRegions.add(region.trim()));
        Set<String> wantedDiseases = new LinkedHashSet<>();
        diseases.forEach(disease -> wantedDiseases.add(disease.trim().toLowerCase(Locale.ROOT)));
        return engine.store().seriesKeys().stream()
                .filter(key -> wantedRegions.isEmpty() || wantedRegions.contains(key.region()))
                .filter(key -> wantedDiseases.isEmpty() || wantedDiseases.contains(key.disease()))
                .toList();
    }

    private Map<CellKey, FusedEstimate> preview(List<CellKey> cells, List<SourceEstimate> estimates, FusionMethod method) {
        Map<CellKey, List<SourceEstimate>> byCell = new HashMap<>();
        for (SourceEstimate estimate : estimates) {
            byCell.computeIfAbsent(estimate.cellKey(), ignored -> new ArrayList<>()).add(estimate);
        }
        Map<CellKey, FusedEstimate> preliminary = new HashMap<>();
        for (CellKey cell : cells) {
            List<SourceEstimate> forCell = byCell.get(cell);
            if (forCell == null) {
                continue;
            }
            try {
                preliminary.put(cell, engine.preview(cell, forCell, method));
            } catch (SurveillanceException e) {
                LOGGER.log(Level.FINE, "No preliminary estimate for " + cell + ": " + e.code());
            }
        }
        return preliminary;
    }

    private List<String> notices(List<DetectionReport> reports) {
        Map<String, Integer> skipped = new TreeMap<>();
        for (DetectionReport report : reports) {
            for (DetectorResult result : report.skipped()) {
                skipped.merge(result.method().wireName() + " (" + result.skipReason() + ")", 1, Integer::sum);
            }
        }
        List<String> notices = new ArrayList<>();
        skipped.forEach((reason, count) -> notices.add("Detector " + reason + " skipped for " + count + " cells"));
        circuitStates.get().forEach((sourceId, state) -> {
            if ("OPEN".equals(state) || "FORCED_OPEN".equals(state)) {
                notices.add("Source " + sourceId + " is unavailable; estimates rely on the remaining sources");
            }
        });
        return notices;
    }

    private Map<String, Double> reliabilitiesOf(List<String> sourceIds) {
        Map<String, Double> selected = new LinkedHashMap<>();
        for (String id : sourceIds) {
            selected.put(id, reliabilities.getOrDefault(id, SourceProfile.DEFAULT_RELIABILITY));
        }
        return selected;
    }

    private static boolean carriedForward(List<FusedEstimate> fused) {
        return fused.stream().anyMatch(estimate -> estimate.warnings().contains(FusedEstimate.CARRIED_FORWARD));
    }

    private static List<CellError> errors(IngestReport report) {
        return report.errors().stream().map(CellError::of).toList();
    }

    private static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
