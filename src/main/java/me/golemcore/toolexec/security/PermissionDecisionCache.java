package me.golemcore.toolexec.security;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.model.PermissionDecision;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Short-lived cache of permission decisions keyed by (subject, tool, version,
 * context hash). Expired entries are dropped on read; when the cache is full
 * the expired entries are purged first and then the entries closest to expiry.
 */
@Component
@Slf4j
public class PermissionDecisionCache {

    private final Map<Key, PermissionDecision> entries = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int maxEntries;

    public PermissionDecisionCache(Clock clock, ToolExecProperties properties) {
        this.clock = clock;
        this.maxEntries = Math.max(1, properties.getSecurity().getDecisionCacheMaxEntries());
    }

    /**
     * Cache key. {@code contextHash} is a digest of the canonical request
     * context.
     */
    public record Key(String subject, String toolId, String version, String contextHash) {
    }

    public Optional<PermissionDecision> get(Key key) {
        PermissionDecision decision = entries.get(key);
        if (decision == null) {
            return Optional.empty();
        }
        if (decision.isExpired(Instant.now(clock))) {
            entries.remove(key, decision);
            return Optional.empty();
        }
        return Optional.of(decision.toBuilder().cached(true).build());
    }

    public void put(Key key, PermissionDecision decision) {
        if (decision.getExpiresAt() == null) {
            return;
        }
        if (entries.size() >= maxEntries) {
            evict();
        }
        entries.put(key, decision);
    }

    /**
     * Drop every decision for the given subjects.
     *
     * @return number of removed entries
     */
    public int purgeSubjects(Collection<String> subjects) {
        int before = entries.size();
        entries.keySet().removeIf(key -> subjects.contains(key.subject()));
        return before - entries.size();
    }

    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    private void evict() {
        Instant now = Instant.now(clock);
        entries.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
        int overflow = entries.size() - maxEntries + 1;
        if (overflow > 0) {
            entries.entrySet().stream()
                    .sorted(Map.Entry.comparingByValue(
                            (a, b) -> a.getExpiresAt().compareTo(b.getExpiresAt())))
                    .limit(overflow)
                    .map(Map.Entry::getKey)
                    .toList()
                    .forEach(entries::remove);
            log.debug("[Permission] Decision cache full, evicted {} entries", overflow);
        }
    }
}
