package me.golemcore.toolexec.adapter.outbound.bridge;

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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.bridge.BridgeClient;
import me.golemcore.toolexec.bridge.BridgeRequest;
import me.golemcore.toolexec.domain.model.Checkpoint;
import me.golemcore.toolexec.port.outbound.CheckpointStorePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable checkpoint store delegated to the bridge peer
 * ({@code checkpoint.append}, {@code checkpoint.list},
 * {@code checkpoint.purge}).
 */
@Component("durableCheckpointStore")
@ConditionalOnProperty(name = "toolexec.checkpoint.durable-store", havingValue = "bridge")
@Slf4j
public class BridgeCheckpointStore implements CheckpointStorePort {

    static final String METHOD_APPEND = "checkpoint.append";
    static final String METHOD_LIST = "checkpoint.list";
    static final String METHOD_PURGE = "checkpoint.purge";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final BridgeClient bridgeClient;
    private final ObjectMapper objectMapper;

    public BridgeCheckpointStore(BridgeClient bridgeClient, ObjectMapper objectMapper) {
        this.bridgeClient = bridgeClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(Checkpoint checkpoint) {
        Map<String, Object> params = objectMapper.convertValue(checkpoint, MAP_TYPE);
        bridgeClient.call(BridgeRequest.write(METHOD_APPEND, params));
        log.debug("[Bridge] Appended checkpoint {} of {}", checkpoint.getCheckpointId(),
                checkpoint.getInvocationId());
    }

    @Override
    public Optional<Checkpoint> get(String invocationId, String checkpointId) {
        return list(invocationId).stream()
                .filter(checkpoint -> checkpointId.equals(checkpoint.getCheckpointId()))
                .findFirst();
    }

    @Override
    public List<Checkpoint> list(String invocationId) {
        JsonNode result = bridgeClient
                .call(BridgeRequest.authoritative(METHOD_LIST, Map.of("invocationId", invocationId)))
                .value();
        List<Checkpoint> checkpoints = new ArrayList<>();
        JsonNode items = result != null && result.has("checkpoints") ? result.get("checkpoints") : result;
        if (items != null && items.isArray()) {
            for (JsonNode item : items) {
                checkpoints.add(objectMapper.convertValue(item, Checkpoint.class));
            }
        }
        checkpoints.sort(Comparator.comparingLong(Checkpoint::getSequence));
        return checkpoints;
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        JsonNode result = bridgeClient
                .call(BridgeRequest.write(METHOD_PURGE, Map.of("before", cutoff.toString())))
                .value();
        return result != null && result.has("purged") ? result.get("purged").asInt() : 0;
    }

    @Override
    public void deleteInvocation(String invocationId) {
        throw new UnsupportedOperationException("Durable checkpoints are retired by retention only");
    }
}
