package com.outbreaksentinel.collectors.adapter;

import com.outbreaksentinel.collectors.api.RawSourceBatch;
import com.outbreaksentinel.collectors.api.SourceQuery;
import com.outbreaksentinel.collectors.support.FixtureUtils;
import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.error.SourceUnavailableException;
import com.outbreaksentinel.core.model.BucketRange;
import com.outbreaksentinel.core.model.TimeBucket;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpJsonSourceAdapterTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-20T00:00:00Z"), ZoneOffset.UTC);
    private static final SourceQuery QUERY = new SourceQuery(
            List.of("US-CA", "US-NY"),
            List.of("influenza"),
            new BucketRange(TimeBucket.parse("2025-W02"), TimeBucket.parse("2025-W03"))
    );

    private HttpServer server;
    private final AtomicReference<String> lastQuery = new AtomicReference<>();

    @BeforeEach
    void start() throws Exception {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/records", exchange -> {
            lastQuery.set(exchange.getRequestURI().getRawQuery());
            byte[] body = "{\"records\":[{\"region\":\"US-CA\",\"disease\":\"influenza\",\"period\":\"2025-W03\",\"value\":135}]}"
                    .getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(200, body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        server.createContext("/broken", exchange -> {
            exchange.sendResponseHeaders(503, -1);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    @Test
    void fetchesRecordsAndPassesQueryParameters() throws Exception {
        HttpJsonSourceAdapter adapter = new HttpJsonSourceAdapter("CDC", endpoint("/records"), "outbreak-sentinel-test");

        RawSourceBatch batch = adapter.fetch(QUERY, FixtureUtils.context(new EventBus(), CLOCK, Duration.ofSeconds(2)));

        assertEquals(1, batch.records().size());
        assertEquals("US-CA", batch.records().get(0).region());
        assertEquals(135, ((Number) batch.records().get(0).value()).intValue());
        assertTrue(lastQuery.get().contains("regions=US-CA%2CUS-NY"));
        assertTrue(lastQuery.get().contains("from=2025-W02"));
    }

    @Test
    void non2xxIsSourceUnavailable() {
        HttpJsonSourceAdapter adapter = new HttpJsonSourceAdapter("CDC", endpoint("/broken"), "outbreak-sentinel-test");

        SourceUnavailableException error = assertThrows(SourceUnavailableException.class,
                () -> adapter.fetch(QUERY, FixtureUtils.context(new EventBus(), CLOCK, Duration.ofSeconds(2))));

        assertEquals("source_unavailable", error.code());
        assertEquals("CDC", error.sourceId());
        assertTrue(error.getMessage().contains("503"));
    }

    private URI endpoint(String path) {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort() + path);
    }
}
