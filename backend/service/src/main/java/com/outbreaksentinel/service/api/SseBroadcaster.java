package com.outbreaksentinel.service.api;

import com.outbreaksentinel.core.bus.EventBus;
import com.outbreaksentinel.core.events.Event;
import com.outbreaksentinel.service.store.EventCodec;
import com.sun.net.httpserver.HttpExchange;

import java.io.IOException;
import java.io.OutputStream;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Streams bus events to connected clients as server-sent events. {@code ?types=A,B} restricts a client
 * to the listed event types. A client whose write fails is dropped without affecting the others.
 */
public class SseBroadcaster {
    private static final Logger LOGGER = Logger.getLogger(SseBroadcaster.class.getName());

    private final List<SseClient> clients = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Duration keepAlive;

    public SseBroadcaster(EventBus eventBus) {
        this(eventBus, Duration.ofSeconds(15));
    }

    public SseBroadcaster(EventBus eventBus, Duration keepAlive) {
        this.keepAlive = keepAlive;
        EventCodec.subscribeAll(eventBus, this::broadcast);
    }

    public void handle(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(405, -1);
            exchange.close();
            return;
        }

        exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
        exchange.getResponseHeaders().set("Cache-Control", "no-cache");
        exchange.getResponseHeaders().set("Connection", "keep-alive");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(200, 0);

        OutputStream out = exchange.getResponseBody();
        SseClient client = new SseClient(exchange, out, typesFilter(exchange.getRequestURI().getRawQuery()));
        clients.add(client);
        LOGGER.fine("SSE client connected; " + clients.size() + " connected");

        try {
            writeRaw(client, "retry: 5000\n: connected\n\n");
            while (!Thread.currentThread().isInterrupted()) {
                Thread.sleep(keepAlive.toMillis());
                writeRaw(client, ": keepalive\n\n");
            }
        } catch (IOException disconnected) {
            LOGGER.fine("SSE client disconnected: " + disconnected.getMessage());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
        } finally {
            removeClient(client);
        }
    }

    public void broadcast(Event event) {
        if (clients.isEmpty()) {
            return;
        }
        String payload = "id: " + sequence.incrementAndGet() + "\n"
                + "event: " + event.type() + "\n"
                + "data: " + EventCodec.toSseData(event) + "\n\n";

        for (SseClient client : clients) {
            if (!client.accepts(event.type())) {
                continue;
            }
            try {
                writeRaw(client, payload);
            } catch (IOException | RuntimeException e) {
                removeClient(client);
            }
        }
    }

    public int clientCount() {
        return clients.size();
    }

    static Set<String> typesFilter(String rawQuery) {
        Set<String> types = new LinkedHashSet<>();
        if (rawQuery == null || rawQuery.isBlank()) {
            return types;
        }
        for (String entry : rawQuery.split("&")) {
            String[] pair = entry.split("=", 2);
            if (pair.length < 2 || !"types".equals(URLDecoder.decode(pair[0], StandardCharsets.UTF_8))) {
                continue;
            }
            for (String type : URLDecoder.decode(pair[1], StandardCharsets.UTF_8).split(",")) {
                if (!type.isBlank()) {
                    types.add(type.trim());
                }
            }
        }
        return types;
    }

    private void writeRaw(SseClient client, String data) throws IOException {
        synchronized (client) {
            client.outputStream().write(data.getBytes(StandardCharsets.UTF_8));
            client.outputStream().flush();
        }
    }

    private void removeClient(SseClient client) {
        if (clients.remove(client)) {
            client.close();
        }
    }

    private record SseClient(HttpExchange exchange, OutputStream outputStream, Set<String> types) {
        private boolean accepts(String type) {
            return types.isEmpty() || types.contains(type);
        }

        private void close() {
            try {
                outputStream.close();
            } catch (IOException closeError) {
                LOGGER.fine("SSE stream already closed: " + closeError.getMessage());
            }
            exchange.close();
        }
    }
}
