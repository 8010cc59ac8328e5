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

import java.util.Map;

/**
 * One call to the bridge peer.
 *
 * @param method
 *            peer method, e.g. {@code document.get}
 * @param params
 *            structured parameters
 * @param key
 *            cache and invalidation key; change notifications name this key
 * @param read
 *            reads may be served by fallback tiers, writes only by the live
 *            bridge
 * @param cacheable
 *            results may be cached and served stale
 * @param pinned
 *            result is immutable and kept in the local tier until restart
 */
public record BridgeRequest(String method, Map<String, Object> params, String key, boolean read, boolean cacheable,
        boolean pinned) {

    public static BridgeRequest read(String method, String key, Map<String, Object> params) {
        return new BridgeRequest(method, params, key, true, true, false);
    }

    public static BridgeRequest pinned(String method, String key, Map<String, Object> params) {
        return new BridgeRequest(method, params, key, true, true, true);
    }

    /**
     * Read that must never be answered from a cache.
     */
    public static BridgeRequest authoritative(String method, Map<String, Object> params) {
        return new BridgeRequest(method, params, null, true, false, false);
    }

    public static BridgeRequest write(String method, Map<String, Object> params) {
        return new BridgeRequest(method, params, null, false, false, false);
    }
}
