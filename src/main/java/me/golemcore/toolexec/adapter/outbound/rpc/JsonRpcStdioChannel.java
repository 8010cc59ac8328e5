package me.golemcore.toolexec.adapter.outbound.rpc;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 channel to a long-lived process over stdio.
 *
 * <p>
 * One request per line on the process stdin, one response per line on its
 * stdout. Responses are matched to requests by id in a reader thread; stderr
 * is drained to DEBUG. Used by both the bridge peer and MCP servers.
 *
 * <p>
 * Not a Spring bean; each peer owns its channel.
 */
public class JsonRpcStdioChannel implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(JsonRpcStdioChannel.class);
    private static final String JSONRPC_VERSION = "2.0";

    private final String name;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    private Process process;
    private BufferedWriter writer;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();

    private volatile boolean running;

    public JsonRpcStdioChannel(String name, ObjectMapper objectMapper, Duration requestTimeout) {
        this.name = name;
        this.objectMapper = objectMapper;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Start {@code command} through the shell and attach to its streams.
     */
    public void start(String command, Map<String, String> env) throws IOException {
        log.info("[RPC:{}] Starting process: {}", name, command);
        ProcessBuilder pb = new ProcessBuilder("/bin/sh", "-c", command);
        pb.redirectErrorStream(false);
        if (env != null) {
            pb.environment().putAll(env);
        }
        process = pb.start();
        attach(process.getInputStream(), process.getOutputStream());

        Process started = process;
        Thread stderrThread = new Thread(() -> stderrDrain(started.getErrorStream()), "rpc-stderr-" + name);
        stderrThread.setDaemon(true);
        stderrThread.start();
    }

    /**
     * Attach to already-open streams. {@link #start} calls this; tests use it
     * with piped streams.
     */
    public void attach(InputStream input, OutputStream output) {
        writer = new BufferedWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
        running = true;
        Thread readerThread = new Thread(() -> readLoop(input), "rpc-reader-" + name);
        readerThread.setDaemon(true);
        readerThread.start();
    }

    /**
     * Send a request; the future completes with the {@code result} member or
     * fails with {@link JsonRpcException}, an I/O error, or a timeout.
     */
    public CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<JsonNode>()
                .orTimeout(requestTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((result, ex) -> pendingRequests.remove(id));
        if (!running || writer == null) {
            future.completeExceptionally(new IOException("Channel " + name + " is not running"));
            return future;
        }
        pendingRequests.put(id, future);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params != null ? params : Map.of());

        try {
            write(objectMapper.writeValueAsString(request));
        } catch (IOException e) {
            pendingRequests.remove(id);
            future.completeExceptionally(e);
        }
        return future;
    }

    /**
     * Send a notification (no id, no response expected).
     */
    public void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }
        try {
            write(objectMapper.writeValueAsString(notification));
        } catch (IOException e) {
            log.warn("[RPC:{}] Failed to send notification {}: {}", name, method, e.getMessage());
        }
    }

    public boolean isRunning() {
        return running && (process == null || process.isAlive());
    }

    public String getName() {
        return name;
    }

    private void write(String json) throws IOException {
        log.debug("[RPC:{}] → {}", name, json);
        synchronized (writer) {
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    private void readLoop(InputStream input) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty())
                    continue;
                log.debug("[RPC:{}] ← {}", name, line);
                dispatch(line);
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[RPC:{}] Reader thread error: {}", name, e.getMessage());
            }
        } finally {
            running = false;
            for (CompletableFuture<JsonNode> pending : pendingRequests.values()) {
                pending.completeExceptionally(new IOException("Process " + name + " closed"));
            }
            pendingRequests.clear();
        }
    }

    private void dispatch(String line) {
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("[RPC:{}] Failed to parse message: {}", name, e.getMessage());
            return;
        }
        JsonNode idNode = message.get("id");
        if (idNode == null || !idNode.canConvertToInt()) {
            String method = message.has("method") ? message.get("method").asText() : "unknown";
            log.debug("[RPC:{}] Peer notification: {}", name, method);
            return;
        }
        CompletableFuture<JsonNode> pending = pendingRequests.remove(idNode.asInt());
        if (pending == null) {
            log.warn("[RPC:{}] Received response for unknown id: {}", name, idNode.asInt());
            return;
        }
        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            pending.completeExceptionally(new JsonRpcException(
                    error.has("code") ? error.get("code").asInt() : -1,
                    error.has("message") ? error.get("message").asText() : "Unknown JSON-RPC error"));
        } else {
            pending.complete(message.get("result"));
        }
    }

    private void stderrDrain(InputStream errorStream) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(errorStream, StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                log.debug("[RPC:{}] stderr: {}", name, line);
            }
        } catch (IOException e) {
            if (running) {
                log.debug("[RPC:{}] Stderr drain ended: {}", name, e.getMessage());
            }
        }
    }

    @Override
    public void close() {
        log.info("[RPC:{}] Closing channel", name);
        running = false;

        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(new IOException("Channel " + name + " closing"));
        }
        pendingRequests.clear();

        if (writer != null) {
            try {
                writer.close();
            } catch (IOException e) {
                log.debug("[RPC:{}] Error closing writer: {}", name, e.getMessage());
            }
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    /**
     * JSON-RPC error returned by the peer.
     */
    public static class JsonRpcException extends Exception {
        private static final long serialVersionUID = 1L;
        private final int code;

        public JsonRpcException(int code, String message) {
            super(message);
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }
}
