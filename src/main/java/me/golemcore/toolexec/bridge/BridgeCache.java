package me.golemcore.toolexec.bridge;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.model.BridgeChangeEvent;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.SharedCachePort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Two cache tiers in front of the bridge: a bounded in-process LRU for pinned
 * (immutable) results and the shared TTL cache. Write-type change
 * notifications purge a key from both tiers.
 */
@Component
@Slf4j
public class BridgeCache {

    private final SharedCachePort sharedCache;
    private final ToolExecProperties.BridgeProperties config;
    private final Clock clock;
    private final Map<String, JsonNode> local;

    public BridgeCache(SharedCachePort sharedCache, ToolExecProperties properties, Clock clock) {
        this.sharedCache = sharedCache;
        this.config = properties.getBridge();
        this.clock = clock;
        int maxEntries = Math.max(1, config.getLocalCacheMaxEntries());
        this.local = new LinkedHashMap<>(16, 0.75f, true) {
            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<String, JsonNode> eldest) {
                return size() > maxEntries;
            }
        };
    }

    public Optional<BridgeResult> lookupFresh(BridgeRequest request) {
        String key = cacheKey(request);
        if (key == null) {
            return Optional.empty();
        }
        if (request.pinned()) {
            JsonNode pinned;
            synchronized (local) {
                pinned = local.get(key);
            }
            if (pinned != null) {
                return Optional.of(new BridgeResult(pinned, BridgeResult.Tier.LOCAL_CACHE));
            }
        }
        return sharedCache.get(key)
                .filter(entry -> !entry.isStale(Instant.now(clock)))
                .map(entry -> new BridgeResult(entry.value(), BridgeResult.Tier.SHARED_CACHE));
    }

    /**
     * Shared-cache entry regardless of expiry.
     */
    public Optional<BridgeResult> lookupStale(BridgeRequest request) {
        String key = cacheKey(request);
        if (key == null) {
            return Optional.empty();
        }
        return sharedCache.get(key).map(entry -> new BridgeResult(entry.value(), BridgeResult.Tier.STALE_CACHE));
    }

    public void store(BridgeRequest request, JsonNode value) {
        String key = cacheKey(request);
        if (key == null || value == null) {
            return;
        }
        if (request.pinned()) {
            synchronized (local) {
                local.put(key, value);
            }
        }
        sharedCache.put(key, value, config.getSharedCacheTtl());
    }

    public void invalidate(String key) {
        synchronized (local) {
            local.keySet().removeIf(cached -> matches(cached, key));
        }
        sharedCache.evict(key);
        log.debug("[Bridge] Invalidated {}", key);
    }

    @EventListener
    public void onChange(BridgeChangeEvent event) {
        if (event.isWrite() && event.key() != null) {
            invalidate(event.key());
        }
    }

    private static String cacheKey(BridgeRequest request) {
        if (!request.cacheable() || !request.read()) {
            return null;
        }
        return request.key() != null ? request.key() : request.method() + ":" + request.params();
    }

    private static boolean matches(String cached, String key) {
        return cached.equals(key) || cached.startsWith(key + "@");
    }
}
