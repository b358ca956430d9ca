package com.outbreaksentinel.core.bus;

import com.outbreaksentinel.core.events.SourcePollCompleted;
import com.outbreaksentinel.core.events.SourcePollStarted;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventBusConcurrencyTest {
    private static final Instant AT = Instant.parse("2025-01-20T00:00:00Z");
    private static final List<String> SOURCES = List.of("who", "cdc", "ecdc", "sentinel-net");

    @Test
    void parallelSourcePollsAreCountedPerSource() throws Exception {
        EventBus bus = new EventBus((event, error) -> {
            throw new AssertionError("Unexpected handler error", error);
        });
        Map<String, LongAdder> completedBySource = new ConcurrentHashMap<>();
        LongAdder everyEvent = new LongAdder();
        bus.subscribe(SourcePollCompleted.class, event ->
                completedBySource.computeIfAbsent(event.sourceId(), ignored -> new LongAdder()).increment());
        bus.subscribeAll(event -> everyEvent.increment());

        int pollsPerSource = 500;
        ExecutorService executor = Executors.newFixedThreadPool(SOURCES.size());
        try {
            List<Callable<Void>> pollers = new ArrayList<>();
            for (String source : SOURCES) {
                pollers.add(() -> {
                    for (int i = 0; i < pollsPerSource; i++) {
                        bus.publish(new SourcePollStarted(AT, source));
                        bus.publish(new SourcePollCompleted(AT, source, true, 3, 1));
                    }
                    return null;
                });
            }
            for (Future<Void> poller : executor.invokeAll(pollers)) {
                poller.get();
            }
        } finally {
            executor.shutdown();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }

        for (String source : SOURCES) {
            assertEquals(pollsPerSource, completedBySource.get(source).sum(), source);
        }
        assertEquals(2L * pollsPerSource * SOURCES.size(), everyEvent.sum());
    }

    @Test
    void subscribingWhilePublishingNeverFailsDelivery() throws Exception {
        AtomicInteger handlerErrors = new AtomicInteger();
        EventBus bus = new EventBus((event, error) -> handlerErrors.incrementAndGet());
        LongAdder seenByFirstSubscriber = new LongAdder();
        bus.subscribe(SourcePollStarted.class, event -> seenByFirstSubscriber.increment());

        int publishes = 2_000;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            Future<?> publisher = executor.submit(() -> {
                start.await();
                for (int i = 0; i < publishes; i++) {
                    bus.publish(new SourcePollStarted(AT, SOURCES.get(i % SOURCES.size())));
                }
                return null;
            });
            Future<?> subscriber = executor.submit(() -> {
                start.await();
                for (int i = 0; i < 300; i++) {
                    bus.subscribeAll(event -> seenByFirstSubscriber.add(0));
                }
                return null;
            });
            start.countDown();
            publisher.get();
            subscriber.get();
        } finally {
            executor.shutdown();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }

        assertEquals(0, handlerErrors.get());
        assertEquals(publishes, seenByFirstSubscriber.sum());
        assertTrue(executor.isShutdown());
    }
}
