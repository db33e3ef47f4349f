package com.changesentinel.service.store;

import com.changesentinel.core.error.PersistenceException;
import com.changesentinel.core.events.Event;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.logging.Logger;

public class JsonlEventStore implements EventStore {
    private static final Logger LOGGER = Logger.getLogger(JsonlEventStore.class.getName());
    public static final long DEFAULT_MAX_BYTES = 5L * 1024 * 1024;
    public static final int DEFAULT_KEEP_SEGMENTS = 3;

    private final Path active;
    private final long maxBytes;
    private final int keepSegments;
    private final Object monitor = new Object();
    private long activeSize = -1;

    public JsonlEventStore(Path active) {
        this(active, DEFAULT_MAX_BYTES, DEFAULT_KEEP_SEGMENTS);
    }

    public JsonlEventStore(Path active, long maxBytes, int keepSegments) {
        if (maxBytes < 1) {
            throw new IllegalArgumentException("maxBytes must be positive");
        }
        if (keepSegments < 0) {
            throw new IllegalArgumentException("keepSegments must not be negative");
        }
        this.active = active;
        this.maxBytes = maxBytes;
        this.keepSegments = keepSegments;
    }

    @Override
    public void append(Event event) {
        byte[] line = (EventCodec.toJsonLine(event) + "\n").getBytes(StandardCharsets.UTF_8);
        synchronized (monitor) {
            try {
                if (activeSize < 0) {
                    Files.createDirectories(active.toAbsolutePath().getParent());
                    activeSize = Files.exists(active) ? Files.size(active) : 0;
                }
                if (activeSize > 0 && activeSize + line.length > maxBytes) {
                    roll();
                }
                Files.write(active, line, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                activeSize += line.length;
            } catch (IOException e) {
                activeSize = -1;
                throw new PersistenceException("Failed appending " + event.type() + " to " + active, e);
            }
        }
    }

    @Override
    public List<Event> query(Instant since, Optional<String> type, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Deque<Event> window = new ArrayDeque<>(Math.min(limit, 1024));
        synchronized (monitor) {
            for (Path segment : segmentsOldestFirst()) {
                scan(segment, since, type, limit, window);
            }
        }
        return new ArrayList<>(window);
    }

    private void roll() throws IOException {
        Files.deleteIfExists(segment(keepSegments));
        for (int n = keepSegments - 1; n >= 1; n--) {
            Path from = segment(n);
            if (Files.exists(from)) {
                Files.move(from, segment(n + 1), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        if (keepSegments == 0) {
            Files.delete(active);
        } else {
            Files.move(active, segment(1), StandardCopyOption.REPLACE_EXISTING);
        }
        activeSize = 0;
        LOGGER.fine(() -> "Rolled event journal " + active);
    }

    private List<Path> segmentsOldestFirst() {
        List<Path> segments = new ArrayList<>();
        for (int n = keepSegments; n >= 1; n--) {
            if (Files.exists(segment(n))) {
                segments.add(segment(n));
            }
        }
        if (Files.exists(active)) {
            segments.add(active);
        }
        return segments;
    }

    private Path segment(int n) {
        return active.resolveSibling(active.getFileName() + "." + n);
    }

    private static void scan(Path segment, Instant since, Optional<String> type, int limit, Deque<Event> window) {
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(segment, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                Event event;
                try {
                    event = EventCodec.fromJsonLine(line);
                } catch (RuntimeException decodeError) {
                    skipped++;
                    continue;
                }
                if (event.timestamp().isBefore(since) || (type.isPresent() && !type.get().equals(event.type()))) {
                    continue;
                }
                if (window.size() == limit) {
                    window.removeFirst();
                }
                window.addLast(event);
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed reading event journal " + segment, e);
        }
        if (skipped > 0) {
            LOGGER.warning("Skipped " + skipped + " unreadable lines in " + segment);
        }
    }
}
