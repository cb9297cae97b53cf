package com.meteoharvest.ingest.upstream;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Successful upstream bodies keyed by request URI, each valid for a fixed time-to-live. Safe for
 * concurrent readers and writers; nothing here blocks across a network call.
 */
public final class ResponseCache {
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public ResponseCache(Duration ttl, Clock clock) {
        this.ttl = Objects.requireNonNull(ttl, "ttl is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("Cache TTL must not be negative: " + ttl);
        }
    }

    public Optional<byte[]> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry, clock.instant())) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.body().clone());
    }

    public void put(String key, byte[] body) {
        entries.put(key, new Entry(body.clone(), clock.instant()));
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private boolean isExpired(Entry entry, Instant now) {
        return !now.isBefore(entry.storedAt().plus(ttl));
    }

    private record Entry(byte[] body, Instant storedAt) {
    }
}
