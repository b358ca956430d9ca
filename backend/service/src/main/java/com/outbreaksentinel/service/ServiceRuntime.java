package com.outbreaksentinel.service;

import com.outbreaksentinel.collectors.SourceFanOut;
import com.outbreaksentinel.collectors.adapter.FixtureSourceAdapter;
import com.outbreaksentinel.collectors.adapter.HttpJsonSourceAdapter;
import com.outbreaksentinel.collectors.api.SourceAdapter;
import com.outbreaksentinel.collectors.api.SourceContext;
import com.outbreaksentinel.collectors.config.SourceConfig;
import com.outbreaksentinel.collectors.config.SourcesConfig;
import com.outbreaksentinel.collectors.normalize.SourceNormalizer;
import com.outbreaksentinel.collectors.normalize.SourceProfile;
import com.outbreaksentinel.collectors.resilience.ResilientSourceCaller;
import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.events.EstimateAppended;
import com.outbreaksentinel.core.model.RegionProfile;
import com.outbreaksentinel.engine.alert.AlertAggregator;
import com.outbreaksentinel.engine.alert.EventBusAlertSink;
import com.outbreaksentinel.engine.config.EngineConfig;
import com.outbreaksentinel.engine.detection.OutbreakDetector;
import com.outbreaksentinel.engine.fusion.FusionEngine;
import com.outbreaksentinel.engine.pipeline.DetectionCoordinator;
import com.outbreaksentinel.engine.pipeline.SurveillanceEngine;
import com.outbreaksentinel.engine.store.CellLedger;
import com.outbreaksentinel.engine.store.WindowedSeriesStore;
import com.outbreaksentinel.service.api.ApiServer;
import com.outbreaksentinel.service.api.Catalog;
import com.outbreaksentinel.service.api.DiagnosticsTracker;
import com.outbreaksentinel.service.api.SseBroadcaster;
import com.outbreaksentinel.service.config.ConfigLoader;
import com.outbreaksentinel.service.config.WatchConfig;
import com.outbreaksentinel.service.runtime.SchedulerService;
import com.outbreaksentinel.service.store.AlertTrail;
import com.outbreaksentinel.service.store.EventCodec;
import com.outbreaksentinel.service.store.JsonFileEstimateStore;
import com.outbreaksentinel.service.store.JsonlEventStore;
import com.outbreaksentinel.service.surveillance.SurveillanceService;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Everything the process runs, wired from a config directory and a state directory. Persisted
 * estimates and still-open alerts are restored before any subscriber that could react to them is
 * attached.
 */
public final class ServiceRuntime {
    private static final Logger LOGGER = Logger.getLogger(ServiceRuntime.class.getName());
    static final String USER_AGENT = "outbreak-sentinel/0.1";

    private final EventBus eventBus;
    private final SurveillanceService surveillance;
    private final SurveillanceEngine engine;
    private final SchedulerService scheduler;
    private final ApiServer apiServer;
    private final ExecutorService sourceExecutor;

    private ServiceRuntime(
            EventBus eventBus,
            SurveillanceService surveillance,
            SurveillanceEngine engine,
            SchedulerService scheduler,
            ApiServer apiServer,
            ExecutorService sourceExecutor
    ) {
        this.eventBus = eventBus;
        this.surveillance = surveillance;
        this.engine = engine;
        this.scheduler = scheduler;
        this.apiServer = apiServer;
        this.sourceExecutor = sourceExecutor;
    }

    public static ServiceRuntime assemble(Path configDir, Path stateDir, int port, Clock clock, HttpClient httpClient) {
        return assemble(configDir, stateDir, port, clock, httpClient, new EventBus());
    }

    public static ServiceRuntime assemble(
            Path configDir,
            Path stateDir,
            int port,
            Clock clock,
            HttpClient httpClient,
            EventBus eventBus
    ) {
        EngineConfig engineConfig = ConfigLoader.loadEngine(configDir);
        SourcesConfig sourcesConfig = ConfigLoader.loadSources(configDir);
        Map<String, RegionProfile> regions = ConfigLoader.loadRegions(configDir);
        WatchConfig watch = ConfigLoader.loadWatch(configDir);

        JsonlEventStore eventStore = new JsonlEventStore(stateDir.resolve("events.jsonl"));
        JsonFileEstimateStore snapshot = new JsonFileEstimateStore(
                stateDir.resolve("estimates.json"), engineConfig.store().retentionBuckets());

        WindowedSeriesStore store = new WindowedSeriesStore(engineConfig.store(), eventBus, clock);
        int restoredRows = store.restore(snapshot.rows());
        AlertAggregator aggregator = new AlertAggregator(
                engineConfig, clock, new EventBusAlertSink(eventBus, clock), regions);
        aggregator.restore(new AlertTrail(eventStore).stillOpen());
        LOGGER.info("Restored " + restoredRows + " estimates and " + aggregator.openAlerts().size() + " open alerts");

        EventCodec.subscribeAll(eventBus, eventStore::append);
        eventBus.subscribe(EstimateAppended.class, snapshot::onAppended);
        DetectionCoordinator coordinator = new DetectionCoordinator(
                store, new OutbreakDetector(engineConfig), aggregator, regions, eventBus, clock);
        coordinator.subscribe();

        SurveillanceEngine engine = new SurveillanceEngine(
                engineConfig, new FusionEngine(engineConfig, clock), store, new CellLedger(), eventBus, clock);
        engine.addBatchListener(coordinator::onBatchFused);

        Map<String, SourceProfile> profiles = new LinkedHashMap<>();
        Map<String, Double> reliabilities = new LinkedHashMap<>();
        List<SourceAdapter> adapters = new ArrayList<>();
        for (SourceConfig source : sourcesConfig.enabledSources()) {
            profiles.put(source.id(), source.toProfile());
            reliabilities.put(source.id(), source.reliability());
            adapters.add(adapterFor(source, configDir));
        }
        ResilientSourceCaller caller = new ResilientSourceCaller(sourcesConfig.resilience());
        ExecutorService sourceExecutor = Executors.newFixedThreadPool(
                engineConfig.workers().sourceWorkers(), SurveillanceEngine.namedThreads("source-worker"));
        SourceFanOut fanOut = new SourceFanOut(
                adapters, new SourceNormalizer(profiles, regions, clock), caller, sourceExecutor);
        SourceContext context = new SourceContext(httpClient, eventBus, clock, sourcesConfig.requestTimeout());

        Supplier<Map<String, String>> circuitStates = () -> {
            Map<String, String> states = new LinkedHashMap<>();
            caller.states().forEach((sourceId, state) -> states.put(sourceId, state.name()));
            return states;
        };
        SurveillanceService surveillance = new SurveillanceService(
                engineConfig, engine, fanOut, coordinator, aggregator, reliabilities, context, watch, circuitStates);

        SchedulerService scheduler = new SchedulerService(List.of(new SchedulerService.ScheduledPoll(
                "watchList", sourcesConfig.pollInterval(), watch.isEnabled(), surveillance::pollWatchList
        )), eventBus, clock);
        SseBroadcaster broadcaster = new SseBroadcaster(eventBus);
        DiagnosticsTracker diagnostics = new DiagnosticsTracker(eventBus, clock, broadcaster::clientCount, circuitStates);
        ApiServer apiServer = new ApiServer(
                port,
                surveillance,
                eventStore,
                broadcaster,
                diagnostics,
                Catalog.describe(engineConfig, fanOut.sourceIds())
        );
        return new ServiceRuntime(eventBus, surveillance, engine, scheduler, apiServer, sourceExecutor);
    }

    static SourceAdapter adapterFor(SourceConfig source, Path configDir) {
        String type = source.type() == null ? "" : source.type().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "fixture" -> new FixtureSourceAdapter(source.id(), configDir.resolve(source.location()));
            case "http" -> new HttpJsonSourceAdapter(source.id(), URI.create(source.location()), USER_AGENT);
            default -> throw new IllegalStateException(
                    "Unsupported source type '" + source.type() + "' for source " + source.id());
        };
    }

    public void start() {
        scheduler.start();
        apiServer.start();
    }

    public void stop() {
        scheduler.shutdown();
        apiServer.stop();
        engine.close();
        sourceExecutor.shutdownNow();
    }

    public EventBus eventBus() {
        return eventBus;
    }

    public SurveillanceService surveillance() {
        return surveillance;
    }

    public SchedulerService scheduler() {
        return scheduler;
    }

    public int port() {
        return apiServer.actualPort();
    }
}
