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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.adapter.outbound.rpc.JsonRpcStdioChannel;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.BridgePeerPort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Bridge peer reached over JSON-RPC on the stdio of a long-lived process
 * started from {@code toolexec.bridge.command}.
 *
 * <p>
 * When the bridge is disabled, or the process cannot be started, the peer
 * reports itself unavailable and every call fails fast so the bridge client
 * moves on to its fallback tiers.
 */
@Component
@Slf4j
public class StdioBridgePeer implements BridgePeerPort {

    private static final Duration ORPHAN_REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final ToolExecProperties.BridgeProperties settings;
    private final ObjectMapper objectMapper;
    private volatile JsonRpcStdioChannel channel;

    public StdioBridgePeer(ToolExecProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getBridge();
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void start() {
        if (!settings.isEnabled()) {
            log.info("[Bridge] Bridge peer disabled");
            return;
        }
        if (settings.getCommand() == null || settings.getCommand().isBlank()) {
            log.warn("[Bridge] Bridge enabled but no command configured, peer unavailable");
            return;
        }
        JsonRpcStdioChannel candidate = new JsonRpcStdioChannel("bridge", objectMapper, ORPHAN_REQUEST_TIMEOUT);
        try {
            candidate.start(settings.getCommand(), settings.getEnv());
            channel = candidate;
            log.info("[Bridge] Bridge peer started");
        } catch (IOException e) {
            log.warn("[Bridge] Failed to start bridge peer, running on fallback tiers: {}", e.getMessage());
            candidate.close();
        }
    }

    /**
     * Use an already-open channel instead of starting a process.
     */
    void attach(JsonRpcStdioChannel openChannel) {
        this.channel = openChannel;
    }

    @Override
    public CompletableFuture<JsonNode> call(String method, Map<String, Object> params) {
        JsonRpcStdioChannel current = channel;
        if (current == null || !current.isRunning()) {
            return CompletableFuture.failedFuture(new IOException("Bridge peer not connected"));
        }
        return current.sendRequest(method, params);
    }

    @Override
    public boolean isAvailable() {
        JsonRpcStdioChannel current = channel;
        return current != null && current.isRunning();
    }

    @PreDestroy
    public void shutdown() {
        JsonRpcStdioChannel current = channel;
        channel = null;
        if (current != null) {
            current.close();
        }
    }
}
