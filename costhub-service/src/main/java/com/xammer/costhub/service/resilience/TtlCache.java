package com.xammer.costhub.service.resilience;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory cache whose entries expire lazily on read. One lock guards every access.
 */
public class TtlCache<V> {

    private static final Logger logger = LoggerFactory.getLogger(TtlCache.class);

    private final Map<String, CacheEntry<V>> entries = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Duration ttl;
    private final Clock clock;

    public TtlCache(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
    }

    public Optional<V> get(String key) {
        lock.lock();
        try {
            CacheEntry<V> entry = entries.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(key);
                logger.debug("--- CACHE ENTRY EXPIRED: {} ---", key);
                return Optional.empty();
            }
            logger.debug("--- LOADING FROM IN-MEMORY CACHE: {} ---", key);
            return Optional.of(entry.getPayload());
        } finally {
            lock.unlock();
        }
    }

    public void put(String key, V value) {
        lock.lock();
        try {
            entries.put(key, new CacheEntry<>(key, value, clock.instant(), ttl));
        } finally {
            lock.unlock();
        }
    }

    public void invalidate(String key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public void invalidateAll() {
        lock.lock();
        try {
            int evicted = entries.size();
            entries.clear();
            logger.info("--- EVICTED {} IN-MEMORY CACHE ENTRIES ---", evicted);
        } finally {
            lock.unlock();
        }
    }

    /** Number of stored entries, expired ones included until they are next read. */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    static final class CacheEntry<V> {
        private final String key;
        private final V payload;
        private final Instant timestamp;
        private final Duration ttl;

        CacheEntry(String key, V payload, Instant timestamp, Duration ttl) {
            this.key = key;
            this.payload = payload;
            this.timestamp = timestamp;
            this.ttl = ttl;
        }

        boolean isExpired(Instant now) {
            return Duration.between(timestamp, now).compareTo(ttl) > 0;
        }

        String getKey() {
            return key;
        }

        V getPayload() {
            return payload;
        }
    }
}
