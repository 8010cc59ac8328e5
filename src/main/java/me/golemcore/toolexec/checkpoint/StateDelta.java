package me.golemcore.toolexec.checkpoint;

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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Structural diff between two state maps.
 *
 * <p>
 * A delta is itself a map with up to three entries: {@code set} (keys whose
 * value was added or replaced), {@code unset} (removed keys) and {@code patch}
 * (nested deltas for keys holding a map on both sides). Null values are
 * preserved as values, never read as removals.
 */
public final class StateDelta {

    static final String SET = "set";
    static final String UNSET = "unset";
    static final String PATCH = "patch";

    private StateDelta() {
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> diff(Map<String, Object> from, Map<String, Object> to) {
        Map<String, Object> set = new LinkedHashMap<>();
        List<String> unset = new ArrayList<>();
        Map<String, Object> patch = new LinkedHashMap<>();

        for (Map.Entry<String, Object> entry : to.entrySet()) {
            String key = entry.getKey();
            Object next = entry.getValue();
            if (!from.containsKey(key)) {
                set.put(key, next);
                continue;
            }
            Object previous = from.get(key);
            if (Objects.equals(previous, next)) {
                continue;
            }
            if (previous instanceof Map<?, ?> p && next instanceof Map<?, ?> n) {
                patch.put(key, diff((Map<String, Object>) p, (Map<String, Object>) n));
            } else {
                set.put(key, next);
            }
        }
        for (String key : from.keySet()) {
            if (!to.containsKey(key)) {
                unset.add(key);
            }
        }

        Map<String, Object> delta = new LinkedHashMap<>();
        if (!set.isEmpty()) {
            delta.put(SET, set);
        }
        if (!unset.isEmpty()) {
            delta.put(UNSET, unset);
        }
        if (!patch.isEmpty()) {
            delta.put(PATCH, patch);
        }
        return delta;
    }

    /**
     * Returns a new map; {@code base} is not modified.
     */
    @SuppressWarnings("unchecked")
    public static Map<String, Object> apply(Map<String, Object> base, Map<String, Object> delta) {
        Map<String, Object> result = new LinkedHashMap<>(base);
        Object unset = delta.get(UNSET);
        if (unset instanceof List<?> keys) {
            keys.forEach(key -> result.remove(String.valueOf(key)));
        }
        Object set = delta.get(SET);
        if (set instanceof Map<?, ?> values) {
            ((Map<String, Object>) values).forEach(result::put);
        }
        Object patch = delta.get(PATCH);
        if (patch instanceof Map<?, ?> nested) {
            ((Map<String, Object>) nested).forEach((key, childDelta) -> {
                Object current = result.get(key);
                Map<String, Object> currentMap = current instanceof Map<?, ?> m
                        ? (Map<String, Object>) m
                        : new LinkedHashMap<>();
                result.put(key, apply(currentMap, (Map<String, Object>) childDelta));
            });
        }
        return result;
    }
}
