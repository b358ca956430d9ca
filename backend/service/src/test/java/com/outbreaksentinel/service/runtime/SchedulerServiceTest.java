package com.outbreaksentinel.service.runtime;

import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.events.WarningRaised;
import com.outbreaksentinel.service.support.ServiceFixtures;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulerServiceTest {
    @Test
    void runOnceAllRunsOnlyEnabledPolls() {
        AtomicInteger runsA = new AtomicInteger();
        AtomicInteger runsB = new AtomicInteger();

        SchedulerService scheduler = new SchedulerService(List.of(
                new SchedulerService.ScheduledPoll("a", Duration.ofMillis(10), true, runsA::incrementAndGet),
                new SchedulerService.ScheduledPoll("b", Duration.ofMillis(10), false, runsB::incrementAndGet)
        ), new EventBus(), ServiceFixtures.CLOCK);

        List<SchedulerService.PollOutcome> outcomes = scheduler.runOnceAll();

        assertEquals(1, outcomes.size());
        assertTrue(outcomes.get(0).success());
        assertEquals(1, outcomes.get(0).result());
        assertEquals(1, runsA.get());
        assertEquals(0, runsB.get());
    }

    @Test
    void failedPollPublishesWarningAndOthersStillRun() {
        EventBus bus = new EventBus();
        List<WarningRaised> warnings = new CopyOnWriteArrayList<>();
        bus.subscribe(WarningRaised.class, warnings::add);
        AtomicInteger goodRuns = new AtomicInteger();

        SchedulerService scheduler = new SchedulerService(List.of(
                new SchedulerService.ScheduledPoll("bad", Duration.ofMillis(10), true, () -> {
                    throw new IllegalStateException("boom");
                }),
                new SchedulerService.ScheduledPoll("good", Duration.ofMillis(10), true, goodRuns::incrementAndGet)
        ), bus, ServiceFixtures.CLOCK);

        List<SchedulerService.PollOutcome> outcomes = scheduler.runOnceAll();

        assertFalse(outcomes.get(0).success());
        assertEquals("boom", outcomes.get(0).message());
        assertTrue(outcomes.get(1).success());
        assertEquals(1, goodRuns.get());
        assertEquals(1, warnings.size());
        assertEquals(WarningRaised.SCHEDULER, warnings.get(0).category());
        assertTrue(warnings.get(0).message().contains("Scheduled poll failed: bad"));
        assertEquals("bad", warnings.get(0).details().get("poll"));
    }

    @Test
    void shutdownStopsFutureRuns() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        SchedulerService scheduler = new SchedulerService(List.of(
                new SchedulerService.ScheduledPoll("tick", Duration.ofMillis(5), true, runs::incrementAndGet)
        ), new EventBus(), ServiceFixtures.CLOCK, 5);

        scheduler.start();
        Thread.sleep(60);
        scheduler.shutdown();
        int shortlyAfterShutdown = runs.get();
        Thread.sleep(40);

        assertTrue(shortlyAfterShutdown > 0);
        assertTrue(runs.get() <= shortlyAfterShutdown + 1);
    }

    @Test
    void disabledPollIsNeverScheduled() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        SchedulerService scheduler = new SchedulerService(List.of(
                new SchedulerService.ScheduledPoll("off", Duration.ofMillis(5), false, runs::incrementAndGet)
        ), new EventBus(), ServiceFixtures.CLOCK, 5);

        scheduler.start();
        Thread.sleep(30);
        scheduler.shutdown();

        assertEquals(0, runs.get());
    }
}
