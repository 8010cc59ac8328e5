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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.adapter.outbound.rpc.JsonRpcStdioChannel;
import me.golemcore.toolexec.domain.component.ToolExecutionContext;
import me.golemcore.toolexec.domain.component.ToolHandler;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.ProtocolBinding;
import me.golemcore.toolexec.domain.model.ProtocolKind;
import me.golemcore.toolexec.domain.model.ToolManifest;
import me.golemcore.toolexec.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs MCP-bound tools. One server process per distinct command is started on
 * first use and kept for later invocations; a dead server is restarted.
 *
 * <p>
 * A {@code structuredContent} object in the {@code tools/call} result becomes
 * the tool output; otherwise the text content items are joined into
 * {@code content}.
 */
@Component
@Slf4j
public class McpToolHandler implements ToolHandler {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(60);

    private final ObjectMapper objectMapper;
    private final Map<String, McpClient> clients = new ConcurrentHashMap<>();

    public McpToolHandler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public ProtocolKind getProtocol() {
        return ProtocolKind.MCP;
    }

    @Override
    public ToolResult execute(ToolManifest manifest, ToolExecutionContext context) throws Exception {
        if (!(manifest.getBinding() instanceof ProtocolBinding.McpBinding binding)) {
            throw new ToolExecutionException(ErrorCode.TOOL_UNAVAILABLE,
                    manifest.coordinates() + " has no MCP binding");
        }
        McpClient client = clientFor(binding);
        String remoteTool = binding.remoteTool() != null ? binding.remoteTool() : manifest.getToolId();
        Duration timeout = context.remaining() != null ? context.remaining() : DEFAULT_CALL_TIMEOUT;
        JsonNode result;
        try {
            result = client.callTool(remoteTool, context.getParameters())
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof JsonRpcStdioChannel.JsonRpcException rpcError) {
                return ToolResult.failure("MCP error " + rpcError.getCode() + ": " + rpcError.getMessage());
            }
            throw new ToolExecutionException(ErrorCode.EXECUTION_FAILED,
                    "MCP tool call failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new ToolExecutionException(ErrorCode.TIMEOUT, "MCP tool call timed out", e);
        }
        return parseToolCallResult(remoteTool, result);
    }

    ToolResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null) {
            return ToolResult.failure("No result from MCP tool: " + toolName);
        }
        boolean isError = result.has("isError") && result.get("isError").asBoolean(false);

        StringBuilder text = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if ("text".equals(type) && item.has("text")) {
                    if (!text.isEmpty())
                        text.append("\n");
                    text.append(item.get("text").asText());
                }
            }
        }

        if (isError) {
            return ToolResult.failure(text.isEmpty() ? "MCP tool error" : text.toString());
        }
        JsonNode structured = result.get("structuredContent");
        if (structured != null && structured.isObject()) {
            return ToolResult.success(objectMapper.convertValue(structured, MAP_TYPE));
        }
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("content", text.toString());
        return ToolResult.success(output);
    }

    private McpClient clientFor(ProtocolBinding.McpBinding binding) throws Exception {
        McpClient existing = clients.get(binding.command());
        if (existing != null && existing.isRunning()) {
            return existing;
        }
        synchronized (clients) {
            existing = clients.get(binding.command());
            if (existing != null && existing.isRunning()) {
                return existing;
            }
            if (existing != null) {
                existing.close();
            }
            McpClient client = new McpClient(String.valueOf(clients.size() + 1), objectMapper);
            int startupTimeout = binding.startupTimeoutSeconds() > 0 ? binding.startupTimeoutSeconds() : 30;
            client.start(binding.command(), binding.env(), startupTimeout);
            clients.put(binding.command(), client);
            return client;
        }
    }

    @PreDestroy
    public void shutdown() {
        clients.values().forEach(McpClient::close);
        clients.clear();
    }
}
