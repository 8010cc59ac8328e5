package me.golemcore.toolexec.adapter.outbound.store;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.model.Invocation;
import me.golemcore.toolexec.domain.model.InvocationStatus;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.InvocationStorePort;
import me.golemcore.toolexec.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Invocation records kept in memory and written through to
 * {@code invocations/<id>.json}. Records are reloaded on startup so a new
 * process can pick up approvals and orphaned runs.
 *
 * <p>
 * Finished invocations leave memory once they are older than
 * {@code toolexec.storage.terminal-retention}; lookups by id still find them on
 * disk, scans by status or idempotency key only see what is in memory.
 */
@Component
@Slf4j
public class LocalInvocationStore implements InvocationStorePort {

    static final String DIRECTORY = "invocations";
    private static final long TIMEOUT_SECONDS = 10;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Duration terminalRetention;
    private final Duration cleanupInterval;
    private final Clock clock;
    private final Map<String, Invocation> invocations = new ConcurrentHashMap<>();

    private ScheduledExecutorService cleanupExecutor;

    public LocalInvocationStore(StoragePort storagePort, ObjectMapper objectMapper, ToolExecProperties properties,
            Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.terminalRetention = properties.getStorage().getTerminalRetention();
        this.cleanupInterval = properties.getStorage().getCleanupInterval();
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        load();
        cleanupExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "invocation-store-cleanup");
            t.setDaemon(true);
            return t;
        });
        long intervalMs = cleanupInterval.toMillis();
        cleanupExecutor.scheduleAtFixedRate(this::cleanupSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void shutdown() {
        if (cleanupExecutor != null) {
            cleanupExecutor.shutdownNow();
        }
    }

    public void load() {
        List<String> paths;
        try {
            paths = await(storagePort.listObjects(DIRECTORY, ""));
        } catch (IllegalStateException e) {
            log.warn("Failed to list stored invocations: {}", e.getMessage());
            return;
        }
        for (String path : paths) {
            if (!path.endsWith(".json")) {
                continue;
            }
            try {
                String json = await(storagePort.getText(DIRECTORY, path));
                if (json != null) {
                    Invocation invocation = objectMapper.readValue(json, Invocation.class);
                    if (!isExpired(invocation, Instant.now(clock))) {
                        invocations.put(invocation.getInvocationId(), invocation);
                    }
                }
            } catch (JsonProcessingException | IllegalStateException e) {
                log.warn("Skipping unreadable invocation record {}: {}", path, e.getMessage());
            }
        }
        log.info("Loaded {} invocation records", invocations.size());
    }

    @Override
    public void save(Invocation invocation) {
        Invocation snapshot = invocation.toBuilder().build();
        String json;
        try {
            json = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize invocation " + invocation.getInvocationId(), e);
        }
        await(storagePort.putTextAtomic(DIRECTORY, invocation.getInvocationId() + ".json", json));
        invocations.put(invocation.getInvocationId(), snapshot);
    }

    @Override
    public Optional<Invocation> get(String invocationId) {
        Invocation stored = invocations.get(invocationId);
        if (stored != null) {
            return Optional.of(stored.toBuilder().build());
        }
        return readFromDisk(invocationId);
    }

    @Override
    public Optional<Invocation> findByIdempotencyKey(String tenantId, String idempotencyKey) {
        if (idempotencyKey == null) {
            return Optional.empty();
        }
        return invocations.values().stream()
                .filter(invocation -> idempotencyKey.equals(invocation.idempotencyKey())
                        && Objects.equals(tenantId, invocation.tenantId()))
                .findFirst()
                .map(invocation -> invocation.toBuilder().build());
    }

    @Override
    public List<Invocation> findByStatus(InvocationStatus status) {
        return invocations.values().stream()
                .filter(invocation -> invocation.getStatus() == status)
                .map(invocation -> invocation.toBuilder().build())
                .toList();
    }

    /**
     * Drop finished invocations older than the retention from memory.
     *
     * @return number of records dropped
     */
    public int cleanup() {
        Instant now = Instant.now(clock);
        int before = invocations.size();
        invocations.values().removeIf(invocation -> isExpired(invocation, now));
        int removed = before - invocations.size();
        if (removed > 0) {
            log.debug("Dropped {} finished invocations from memory", removed);
        }
        return removed;
    }

    int cachedCount() {
        return invocations.size();
    }

    private void cleanupSafely() {
        try {
            cleanup();
        } catch (RuntimeException e) {
            log.warn("Invocation store cleanup failed: {}", e.getMessage());
        }
    }

    private boolean isExpired(Invocation invocation, Instant now) {
        if (!invocation.isTerminal()) {
            return false;
        }
        Instant finishedAt = invocation.getCompletedAt() != null ? invocation.getCompletedAt()
                : invocation.getUpdatedAt();
        return finishedAt == null || !now.isBefore(finishedAt.plus(terminalRetention));
    }

    private Optional<Invocation> readFromDisk(String invocationId) {
        if (invocationId == null || invocationId.isBlank() || invocationId.contains("/")
                || invocationId.contains("\\") || invocationId.contains("..")) {
            return Optional.empty();
        }
        String json = await(storagePort.getText(DIRECTORY, invocationId + ".json"));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Invocation.class));
        } catch (JsonProcessingException e) {
            log.warn("Unreadable invocation record {}: {}", invocationId, e.getMessage());
            return Optional.empty();
        }
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while accessing invocation storage", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Invocation storage failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Invocation storage timed out", e);
        }
    }
}
