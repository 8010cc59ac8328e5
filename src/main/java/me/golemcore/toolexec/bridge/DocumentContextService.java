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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Document retrieval for tools through the bridge ({@code document.get}).
 * Requests naming a version are pinned: that version never changes, so it is
 * kept in the local immutable tier.
 */
@Service
@RequiredArgsConstructor
public class DocumentContextService {

    static final String METHOD_DOCUMENT_GET = "document.get";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final BridgeClient bridgeClient;
    private final ObjectMapper objectMapper;

    /**
     * Fetched document plus whether it came from a degraded tier.
     */
    public record Document(Map<String, Object> content, boolean degraded) {
    }

    public Document fetch(String documentId, String version, Duration budget) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("id", documentId);
        String key = "document:" + documentId;
        BridgeRequest request;
        if (version != null && !version.isBlank()) {
            params.put("version", version);
            request = BridgeRequest.pinned(METHOD_DOCUMENT_GET, key + "@" + version, params);
        } else {
            request = BridgeRequest.read(METHOD_DOCUMENT_GET, key, params);
        }
        BridgeResult result = bridgeClient.call(request, budget);
        Map<String, Object> content = result.value() != null && result.value().isObject()
                ? objectMapper.convertValue(result.value(), MAP_TYPE)
                : new LinkedHashMap<>(Map.of("value", result.value() != null ? result.value().toString() : ""));
        return new Document(content, result.isDegraded());
    }
}
