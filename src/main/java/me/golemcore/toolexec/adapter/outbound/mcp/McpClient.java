package me.golemcore.toolexec.adapter.outbound.mcp;

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
import me.golemcore.toolexec.adapter.outbound.rpc.JsonRpcStdioChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Client for a single MCP (Model Context Protocol) server over a
 * {@link JsonRpcStdioChannel}.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>Start the server process (via shell command)
 * <li>Send initialize request (JSON-RPC handshake)
 * <li>Fetch available tools (tools/list)
 * <li>Call tools (tools/call)
 * <li>Close the process
 * </ol>
 *
 * <p>
 * MCP protocol version: 2024-11-05
 *
 * <p>
 * Not a Spring bean; created per server command by {@link McpToolHandler}.
 */
public class McpClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(McpClient.class);
    private static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

    private final String name;
    private final JsonRpcStdioChannel channel;
    private volatile List<String> toolNames = List.of();

    public McpClient(String name, ObjectMapper objectMapper) {
        this(name, new JsonRpcStdioChannel("mcp-" + name, objectMapper, REQUEST_TIMEOUT));
    }

    McpClient(String name, JsonRpcStdioChannel channel) {
        this.name = name;
        this.channel = channel;
    }

    /**
     * Start the MCP server process, send initialize, and fetch available tools.
     */
    public List<String> start(String command, Map<String, String> env, int startupTimeoutSeconds)
            throws IOException, InterruptedException, ExecutionException, TimeoutException {
        channel.start(command, env);
        return initialize(startupTimeoutSeconds);
    }

    /**
     * Handshake over an already-attached channel.
     */
    List<String> initialize(int timeoutSeconds) throws InterruptedException, ExecutionException, TimeoutException {
        try {
            JsonNode initResult = channel.sendRequest("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", "golemcore-tool-execution",
                            "version", "1.0.0")))
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            log.info("[MCP:{}] Initialized: {}", name, initResult);

            channel.sendNotification("notifications/initialized", Map.of());

            JsonNode toolsResult = channel.sendRequest("tools/list", Map.of())
                    .get(timeoutSeconds, TimeUnit.SECONDS);
            toolNames = parseToolNames(toolsResult);
            log.info("[MCP:{}] Available tools: {}", name, toolNames);
            return toolNames;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", name, e.getMessage());
            close();
            throw e;
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", name, e.getMessage());
            close();
            throw e;
        }
    }

    /**
     * Call a tool; the future completes with the raw {@code tools/call} result.
     */
    public CompletableFuture<JsonNode> callTool(String toolName, Map<String, Object> arguments) {
        return channel.sendRequest("tools/call", Map.of(
                "name", toolName,
                "arguments", arguments != null ? arguments : Map.of()));
    }

    public List<String> getToolNames() {
        return toolNames;
    }

    public boolean isRunning() {
        return channel.isRunning();
    }

    private static List<String> parseToolNames(JsonNode result) {
        List<String> names = new ArrayList<>();
        JsonNode toolsNode = result != null ? result.get("tools") : null;
        if (toolsNode == null || !toolsNode.isArray()) {
            return names;
        }
        for (JsonNode toolNode : toolsNode) {
            if (toolNode.has("name")) {
                names.add(toolNode.get("name").asText());
            }
        }
        return names;
    }

    @Override
    public void close() {
        log.info("[MCP:{}] Closing client", name);
        channel.close();
    }
}
