package me.golemcore.toolexec.adapter.outbound.cache;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.SharedCachePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Single-process stand-in for the shared cache. Expired entries are kept so
 * they can be served stale for {@code toolexec.bridge.shared-cache-stale-retention};
 * a periodic cleanup drops them after that.
 */
@Component
@Slf4j
public class InMemorySharedCache implements SharedCachePort {

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration staleRetention;
    private final Duration cleanupInterval;

    private ScheduledExecutorService cacheCleanupExecutor;

    public InMemorySharedCache(Clock clock, ToolExecProperties properties) {
        this.clock = clock;
        this.staleRetention = properties.getBridge().getSharedCacheStaleRetention();
        this.cleanupInterval = properties.getBridge().getSharedCacheCleanupInterval();
    }

    @PostConstruct
    public void init() {
        cacheCleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "shared-cache-cleanup");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = cleanupInterval.toMillis();
        cacheCleanupExecutor.scheduleAtFixedRate(this::cleanup, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void shutdown() {
        if (cacheCleanupExecutor != null) {
            cacheCleanupExecutor.shutdownNow();
        }
    }

    @Override
    public Optional<Entry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    @Override
    public void put(String key, JsonNode value, Duration ttl) {
        entries.put(key, new Entry(value, Instant.now(clock).plus(ttl)));
    }

    @Override
    public void evict(String key) {
        entries.remove(key);
        String versioned = key + "@";
        entries.keySet().removeIf(candidate -> candidate.startsWith(versioned));
    }

    /**
     * Drop entries that expired more than the stale retention ago.
     *
     * @return number of entries dropped
     */
    public int cleanup() {
        Instant cutoff = Instant.now(clock).minus(staleRetention);
        int before = entries.size();
        entries.values().removeIf(entry -> !entry.expiresAt().isAfter(cutoff));
        int removed = before - entries.size();
        if (removed > 0) {
            log.debug("[SharedCache] Dropped {} stale entries", removed);
        }
        return removed;
    }

    int size() {
        return entries.size();
    }
}
