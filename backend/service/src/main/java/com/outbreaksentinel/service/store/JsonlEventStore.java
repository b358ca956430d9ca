package com.outbreaksentinel.service.store;

import com.outbreaksentinel.core.events.Event;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Append-only JSONL audit log of bus events, one {@link EventCodec} envelope per line. Reads stream the
 * file under the append lock; queries keep only the newest {@code limit} matches.
 */
public class JsonlEventStore implements EventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());

    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this.file = file;
    }

    public Path file() {
        return file;
    }

    @Override
    public void append(Event event) {
        String line = EventCodec.toJsonLine(event);
        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending event to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        int max = Math.max(1, limit);
        Deque<Event> newest = new ArrayDeque<>();
        replay(event -> {
            if (event.timestamp().isBefore(since) || type.filter(wanted -> !wanted.equals(event.type())).isPresent()) {
                return;
            }
            newest.addLast(event);
            if (newest.size() > max) {
                newest.removeFirst();
            }
        });
        return new ArrayList<>(newest);
    }

    @Override
    public void replay(Consumer<Event> consumer) {
        lock.lock();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            int lineNumber = 0;
            for (String line = reader.readLine(); line != null; line = reader.readLine()) {
                lineNumber++;
                if (!line.isBlank()) {
                    consumer.accept(decode(line, lineNumber));
                }
            }
        } catch (NoSuchFileException e) {
            LOGGER.fine("No event log at " + file + " yet");
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading events from " + file, e);
        } finally {
            lock.unlock();
        }
    }

    private Event decode(String line, int lineNumber) {
        try {
            return EventCodec.fromJsonLine(line);
        } catch (RuntimeException e) {
            throw new IllegalStateException("Invalid JSONL event at line " + lineNumber + " of " + file, e);
        }
    }
}
