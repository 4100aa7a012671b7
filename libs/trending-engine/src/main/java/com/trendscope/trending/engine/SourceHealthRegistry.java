package com.trendscope.trending.engine;

import com.trendscope.trending.model.SourceHealth;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Last known fetch outcome per source, in configuration order.
 * <p>
 * Every configured source has an entry from construction on ({@code UNKNOWN} until its first
 * fetch). Updates replace the entry; there is no history.
 */
final class SourceHealthRegistry {

    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SourceHealth> health = new LinkedHashMap<>();

    SourceHealthRegistry(List<String> sourceNames, Clock clock) {
        this.clock = clock;
        for (String name : sourceNames) {
            health.put(name, SourceHealth.unknown(name));
        }
    }

    void recordSuccess(String source) {
        replace(SourceHealth.ok(source, clock.instant()));
    }

    void recordFailure(String source, String message) {
        replace(SourceHealth.error(source, message, clock.instant()));
    }

    Optional<SourceHealth> get(String source) {
        lock.lock();
        try {
            return Optional.ofNullable(health.get(source));
        } finally {
            lock.unlock();
        }
    }

    List<SourceHealth> snapshot() {
        lock.lock();
        try {
            return List.copyOf(new ArrayList<>(health.values()));
        } finally {
            lock.unlock();
        }
    }

    private void replace(SourceHealth next) {
        lock.lock();
        try {
            if (!health.containsKey(next.source())) {
                throw new IllegalArgumentException("unknown source: " + next.source());
            }
            health.put(next.source(), next);
        } finally {
            lock.unlock();
        }
    }
}
