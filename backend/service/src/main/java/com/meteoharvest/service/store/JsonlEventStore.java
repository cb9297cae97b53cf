package com.meteoharvest.service.store;

import com.meteoharvest.core.events.Event;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

public class JsonlEventStore implements EventStore {
    private final Path file;
    private final ReentrantLock lock = new ReentrantLock();

    public JsonlEventStore(Path file) {
        this.file = file;
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
            throw new IllegalStateException("Failed appending " + event.type() + " to " + file, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<String> lines;
        lock.lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed querying events in " + file, e);
        } finally {
            lock.unlock();
        }

        List<Event> events = new ArrayList<>();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            Event event;
            try {
                event = EventCodec.fromJsonLine(line);
            } catch (RuntimeException decodeError) {
                throw new IllegalStateException("Invalid JSONL event at line " + lineNumber + " of " + file, decodeError);
            }
            if (event.timestamp().isBefore(since)) {
                continue;
            }
            if (type.isPresent() && !type.get().equals(event.type())) {
                continue;
            }
            events.add(event);
        }
        if (events.size() <= limit) {
            return events;
        }
        return List.copyOf(events.subList(events.size() - limit, events.size()));
    }
}
