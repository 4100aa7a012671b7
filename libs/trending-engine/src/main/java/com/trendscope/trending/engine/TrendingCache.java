package com.trendscope.trending.engine;

import com.trendscope.trending.model.TrendingItem;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ranked results keyed by the limit they were requested with, each valid for one TTL.
 * <p>
 * Entries are immutable and replaced whole; {@link #store} writes all of its keys and the
 * refresh timestamp under one lock acquisition so readers never see half a refresh.
 */
final class TrendingCache {

    record CacheEntry(List<TrendingItem> items, Instant expiresAt) {

        CacheEntry {
            items = List.copyOf(items);
        }

        boolean isValidAt(Instant now) {
            return now.isBefore(expiresAt);
        }
    }

    private final Clock clock;
    private final Duration ttl;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Integer, CacheEntry> entries = new HashMap<>();
    private Instant lastStoredAt;

    TrendingCache(Clock clock, Duration ttl) {
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Returns the cached ranking for exactly {@code limit}, if one exists and has not expired.
     */
    Optional<List<TrendingItem>> lookup(int limit) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(limit);
            if (entry == null || !entry.isValidAt(clock.instant())) {
                return Optional.empty();
            }
            return Optional.of(entry.items());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores {@code ranked} under every key in {@code limits}, replacing what was there, and
     * drops other entries that have already expired.
     *
     * @return the expiry of the new entry
     */
    Instant store(List<TrendingItem> ranked, int... limits) {
        lock.lock();
        try {
            Instant now = clock.instant();
            CacheEntry entry = new CacheEntry(ranked, now.plus(ttl));
            entries.values().removeIf(existing -> !existing.isValidAt(now));
            for (int limit : limits) {
                entries.put(limit, entry);
            }
            lastStoredAt = now;
            return entry.expiresAt();
        } finally {
            lock.unlock();
        }
    }

    /** Populated keys, ascending. */
    List<Integer> keys() {
        lock.lock();
        try {
            return List.copyOf(new TreeSet<>(entries.keySet()));
        } finally {
            lock.unlock();
        }
    }

    Optional<Instant> lastStoredAt() {
        lock.lock();
        try {
            return Optional.ofNullable(lastStoredAt);
        } finally {
            lock.unlock();
        }
    }
}
