package com.example.corprisk.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Registry response cache. Entries remember when they were stored; a read with a TTL
 * treats anything older as absent and evicts it. Backed by Caffeine, so single reads and
 * writes are atomic under concurrent analyzers.
 */
public class RegistryCache {

    private static final Logger log = LoggerFactory.getLogger(RegistryCache.class);

    private record Entry(Instant storedAt, JsonNode payload) {}

    private final Cache<String, Entry> store;
    private final Clock clock;

    public RegistryCache(long maxEntries, Duration maxAge, Clock clock) {
        this.store = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterWrite(maxAge)
                .build();
        this.clock = clock;
    }

    public Optional<JsonNode> get(String key, Duration ttl) {
        Entry entry = store.getIfPresent(key);
        if (entry == null) return Optional.empty();
        Duration age = Duration.between(entry.storedAt(), clock.instant());
        if (age.compareTo(ttl) > 0) {
            // conditional remove: leaves a fresher entry written concurrently in place
            store.asMap().remove(key, entry);
            log.debug("Cache entry expired: {} (age {}s)", key, age.toSeconds());
            return Optional.empty();
        }
        return Optional.of(entry.payload());
    }

    public void put(String key, JsonNode payload) {
        store.put(key, new Entry(clock.instant(), payload));
    }

    public void invalidate(String key) {
        store.invalidate(key);
    }

    /** Drops every entry and returns how many were held. */
    public long clear() {
        long size = size();
        store.invalidateAll();
        store.cleanUp();
        return size;
    }

    public long size() {
        store.cleanUp();
        return store.estimatedSize();
    }
}
