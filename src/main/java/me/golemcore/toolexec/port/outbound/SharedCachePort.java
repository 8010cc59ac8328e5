package me.golemcore.toolexec.port.outbound;

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

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Cache shared between processes. Entries past their TTL are still returned,
 * flagged as stale, so callers can decide whether a stale read is acceptable.
 */
public interface SharedCachePort {

    Optional<Entry> get(String key);

    void put(String key, JsonNode value, Duration ttl);

    /**
     * Removes {@code key} and its versioned variants ({@code key@<version>}).
     */
    void evict(String key);

    /**
     * Cached value with its expiry.
     */
    record Entry(JsonNode value, Instant expiresAt) {

        public boolean isStale(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
