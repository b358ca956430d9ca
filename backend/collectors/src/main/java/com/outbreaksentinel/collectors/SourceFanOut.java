package com.outbreaksentinel.collectors;

import com.outbreaksentinel.collectors.api.FanOutResult;
import com.outbreaksentinel.collectors.api.RawSourceBatch;
import com.outbreaksentinel.collectors.api.SourceAdapter;
import com.outbreaksentinel.collectors.api.SourceContext;
import com.outbreaksentinel.collectors.api.SourcePollResult;
import com.outbreaksentinel.collectors.api.SourceQuery;
import com.outbreaksentinel.collectors.normalize.NormalizationResult;
import com.outbreaksentinel.collectors.normalize.SourceNormalizer;
import com.outbreaksentinel.collectors.resilience.ResilientSourceCaller;
import com.outbreaksentinel.core.error.SourceUnavailableException;
import com.outbreaksentinel.core.events.SourcePollCompleted;
import com.outbreaksentinel.core.events.SourcePollStarted;
import com.outbreaksentinel.core.events.WarningRaised;
import com.outbreaksentinel.core.model.SourceEstimate;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Polls the selected sources concurrently, each under its own deadline, circuit breaker and retry
 * policy, and fans the normalized results back in once every source has answered or timed out. A
 * failed source contributes {@code missing} sentinels so downstream fusion runs on the others.
 */
public class SourceFanOut {
    private static final Logger LOGGER = Logger.getLogger(SourceFanOut.class.getName());

    private final Map<String, SourceAdapter> adapters = new LinkedHashMap<>();
    private final SourceNormalizer normalizer;
    private final ResilientSourceCaller caller;
    private final Executor executor;

    public SourceFanOut(
            Collection<? extends SourceAdapter> adapters,
            SourceNormalizer normalizer,
            ResilientSourceCaller caller,
            Executor executor
    ) {
        adapters.forEach(adapter -> this.adapters.put(adapter.sourceId(), adapter));
        this.normalizer = normalizer;
        this.caller = caller;
        this.executor = executor;
    }

    public List<String> sourceIds() {
        return List.copyOf(adapters.keySet());
    }

    public ResilientSourceCaller caller() {
        return caller;
    }

    /**
     * @param sourceIds sources to poll; empty selects every registered source
     * @throws IllegalArgumentException when a requested source is not registered
     */
    public CompletableFuture<FanOutResult> poll(SourceQuery query, Collection<String> sourceIds, SourceContext ctx) {
        List<SourceAdapter> selected = select(sourceIds);
        List<CompletableFuture<SourcePollResult>> tasks = selected.stream()
                .map(adapter -> pollSource(adapter, query, ctx))
                .toList();
        return CompletableFuture.allOf(tasks.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> new FanOutResult(tasks.stream().map(CompletableFuture::join).toList()));
    }

    private List<SourceAdapter> select(Collection<String> sourceIds) {
        if (sourceIds == null || sourceIds.isEmpty()) {
            return List.copyOf(adapters.values());
        }
        List<SourceAdapter> selected = new ArrayList<>();
        for (String id : sourceIds) {
            SourceAdapter adapter = adapters.get(id.trim());
            if (adapter == null) {
                throw new IllegalArgumentException("Unknown source: " + id);
            }
            if (!selected.contains(adapter)) {
                selected.add(adapter);
            }
        }
        return selected;
    }

    private CompletableFuture<SourcePollResult> pollSource(SourceAdapter adapter, SourceQuery query, SourceContext ctx) {
        Instant startedAt = ctx.clock().instant();
        ctx.eventBus().publish(new SourcePollStarted(startedAt, adapter.sourceId()));
        return CompletableFuture.supplyAsync(() -> fetch(adapter, query, ctx), executor)
                .orTimeout(ctx.requestTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .thenApply(batch -> succeeded(adapter.sourceId(), batch, query, ctx, startedAt))
                .exceptionally(error -> failed(adapter.sourceId(), query, ctx, startedAt, error));
    }

    private RawSourceBatch fetch(SourceAdapter adapter, SourceQuery query, SourceContext ctx) {
        try {
            return caller.call(adapter.sourceId(), () -> adapter.fetch(query, ctx));
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new SourceUnavailableException(adapter.sourceId(), rootMessage(e), e);
        }
    }

    private SourcePollResult succeeded(
            String sourceId,
            RawSourceBatch batch,
            SourceQuery query,
            SourceContext ctx,
            Instant startedAt
    ) {
        NormalizationResult normalized = normalizer.normalize(batch.records(), sourceId, batch.fetchedAt());
        List<SourceEstimate> inQuery = normalized.estimates().stream()
                .filter(estimate -> query.matches(estimate.cellKey()))
                .toList();
        if (!normalized.errors().isEmpty()) {
            ctx.eventBus().publish(new WarningRaised(
                    ctx.clock().instant(),
                    WarningRaised.NORMALIZATION,
                    "Source " + sourceId + " had " + normalized.errors().size() + " rejected records",
                    Map.of("sourceId", sourceId, "rejected", normalized.errors().size())
            ));
        }
        long durationMillis = elapsed(ctx, startedAt);
        ctx.eventBus().publish(new SourcePollCompleted(ctx.clock().instant(), sourceId, true, durationMillis, inQuery.size()));
        return SourcePollResult.success(sourceId, durationMillis, inQuery, normalized.errors());
    }

    private SourcePollResult failed(
            String sourceId,
            SourceQuery query,
            SourceContext ctx,
            Instant startedAt,
            Throwable error
    ) {
        String message = rootMessage(error);
        LOGGER.warning("Source " + sourceId + " unavailable: " + message);
        ctx.eventBus().publish(new WarningRaised(
                ctx.clock().instant(),
                WarningRaised.SOURCE,
                "Source " + sourceId + " unavailable: " + message,
                Map.of("sourceId", sourceId, "error", "source_unavailable")
        ));
        long durationMillis = elapsed(ctx, startedAt);
        ctx.eventBus().publish(new SourcePollCompleted(ctx.clock().instant(), sourceId, false, durationMillis, 0));
        return SourcePollResult.failure(sourceId, durationMillis, normalizer.transportFailure(sourceId, query), message);
    }

    private static long elapsed(SourceContext ctx, Instant startedAt) {
        return Math.max(0, Duration.between(startedAt, ctx.clock().instant()).toMillis());
    }

    private static String rootMessage(Throwable throwable) {
        Throwable root = throwable;
        while (root instanceof CompletionException && root.getCause() != null) {
            root = root.getCause();
        }
        if (root instanceof TimeoutException) {
            return "timed out";
        }
        while (root.getCause() != null) {
            root = root.getCause();
        }
        return root.getMessage() == null ? root.getClass().getSimpleName() : root.getMessage();
    }
}
