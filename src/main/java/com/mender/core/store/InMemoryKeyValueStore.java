package com.mender.core.store;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link KeyValueStore} honouring TTLs. Expired entries are
 * dropped lazily on access.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private record Entry(String value, Instant expiresAt) {}

    private final ConcurrentHashMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (isExpired(entry)) {
            entries.remove(key, entry);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        entries.put(key, new Entry(value, clock.instant().plus(ttl)));
    }

    @Override
    public List<String> listKeys(String prefix) {
        var keys = new ArrayList<String>();
        entries.forEach((key, entry) -> {
            if (!key.startsWith(prefix)) return;
            if (isExpired(entry)) {
                entries.remove(key, entry);
            } else {
                keys.add(key);
            }
        });
        return keys;
    }

    private boolean isExpired(Entry entry) {
        return !clock.instant().isBefore(entry.expiresAt());
    }
}
