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

/**
 * Uniform result of a bridge call, whichever tier served it.
 */
public record BridgeResult(JsonNode value, Tier servedBy) {

    public enum Tier {
        LIVE, LOCAL_CACHE, SHARED_CACHE, STALE_CACHE, DIRECT_STORE
    }

    /**
     * True when the answer did not come from the live peer or a fresh cache
     * entry.
     */
    public boolean isDegraded() {
        return servedBy == Tier.STALE_CACHE || servedBy == Tier.DIRECT_STORE;
    }
}
