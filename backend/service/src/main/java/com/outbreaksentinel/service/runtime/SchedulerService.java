package com.outbreaksentinel.service.runtime;

import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.events.WarningRaised;
import com.outbreaksentinel.engine.pipeline.SurveillanceEngine;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the surveillance polls on a single timer thread. Runs of one task never overlap; a failed run is
 * published as a warning and the next run happens on schedule.
 */
public class SchedulerService {
    private static final Logger LOGGER = Logger.getLogger(SchedulerService.class.getName());

    private final List<ScheduledPoll> polls;
    private final EventBus eventBus;
    private final Clock clock;
    private final long minIntervalMillis;
    private final ScheduledExecutorService timerExecutor =
            Executors.newSingleThreadScheduledExecutor(SurveillanceEngine.namedThreads("scheduler"));

    public SchedulerService(List<ScheduledPoll> polls, EventBus eventBus, Clock clock) {
        this(polls, eventBus, clock, 1_000);
    }

    SchedulerService(List<ScheduledPoll> polls, EventBus eventBus, Clock clock, long minIntervalMillis) {
        this.polls = List.copyOf(polls);
        this.eventBus = eventBus;
        this.clock = clock;
        this.minIntervalMillis = minIntervalMillis;
    }

    public void start() {
        for (ScheduledPoll poll : polls) {
            if (!poll.enabled()) {
                LOGGER.info("Scheduled poll " + poll.name() + " is disabled");
                continue;
            }
            long intervalMillis = Math.max(minIntervalMillis, poll.interval().toMillis());
            timerExecutor.scheduleWithFixedDelay(() -> runSafely(poll), 0, intervalMillis, TimeUnit.MILLISECONDS);
            LOGGER.info("Scheduled poll " + poll.name() + " every " + Duration.ofMillis(intervalMillis));
        }
    }

    /**
     * Runs every enabled poll once on the calling thread, in order.
     */
    public List<PollOutcome> runOnceAll() {
        List<PollOutcome> outcomes = new ArrayList<>();
        for (ScheduledPoll poll : polls) {
            if (poll.enabled()) {
                outcomes.add(runSafely(poll));
            }
        }
        return outcomes;
    }

    public void shutdown() {
        timerExecutor.shutdown();
        try {
            if (!timerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                timerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            timerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public List<ScheduledPoll> scheduledPolls() {
        return polls;
    }

    private PollOutcome runSafely(ScheduledPoll poll) {
        try {
            Object result = poll.task().call();
            return PollOutcome.success(poll.name(), result);
        } catch (Exception ex) {
            LOGGER.log(Level.WARNING, "Scheduled poll " + poll.name() + " failed", ex);
            eventBus.publish(new WarningRaised(
                    clock.instant(),
                    WarningRaised.SCHEDULER,
                    "Scheduled poll failed: " + poll.name() + " - " + ex.getMessage(),
                    Map.of("poll", poll.name())
            ));
            return PollOutcome.failure(poll.name(), ex.getMessage());
        }
    }

    public record ScheduledPoll(String name, Duration interval, boolean enabled, Callable<?> task) {
        public ScheduledPoll {
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(interval, "interval is required");
            Objects.requireNonNull(task, "task is required");
        }
    }

    public record PollOutcome(String name, boolean success, Object result, String message) {
        static PollOutcome success(String name, Object result) {
            return new PollOutcome(name, true, result, null);
        }

        static PollOutcome failure(String name, String message) {
            return new PollOutcome(name, false, null, message == null ? "failed" : message);
        }
    }
}
