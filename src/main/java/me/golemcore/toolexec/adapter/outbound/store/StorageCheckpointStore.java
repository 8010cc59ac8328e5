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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.model.Checkpoint;
import me.golemcore.toolexec.domain.model.CheckpointType;
import me.golemcore.toolexec.port.outbound.CheckpointStorePort;
import me.golemcore.toolexec.port.outbound.StoragePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Durable checkpoint store on {@link StoragePort}: one atomically written
 * JSON file per checkpoint under {@code checkpoints/<invocationId>/}. Macro
 * checkpoints past retention move to {@code checkpoints-archive/}; named
 * checkpoints stay.
 */
@Component("durableCheckpointStore")
@ConditionalOnProperty(name = "toolexec.checkpoint.durable-store", havingValue = "local", matchIfMissing = true)
@Slf4j
public class StorageCheckpointStore implements CheckpointStorePort {

    static final String DIRECTORY = "checkpoints";
    static final String ARCHIVE_DIRECTORY = "checkpoints-archive";
    private static final long TIMEOUT_SECONDS = 10;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    public StorageCheckpointStore(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @Override
    public void append(Checkpoint checkpoint) {
        String json;
        try {
            json = objectMapper.writeValueAsString(checkpoint);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint " + checkpoint.getCheckpointId(), e);
        }
        await(storagePort.putTextAtomic(DIRECTORY, fileName(checkpoint), json));
    }

    @Override
    public Optional<Checkpoint> get(String invocationId, String checkpointId) {
        return list(invocationId).stream()
                .filter(checkpoint -> checkpoint.getCheckpointId().equals(checkpointId))
                .findFirst();
    }

    @Override
    public List<Checkpoint> list(String invocationId) {
        List<Checkpoint> checkpoints = new ArrayList<>();
        for (String path : await(storagePort.listObjects(DIRECTORY, invocationId))) {
            read(path).ifPresent(checkpoints::add);
        }
        checkpoints.sort(Comparator.comparingLong(Checkpoint::getSequence));
        return checkpoints;
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        int archived = 0;
        for (String path : await(storagePort.listObjects(DIRECTORY, ""))) {
            Optional<Checkpoint> checkpoint = read(path);
            if (checkpoint.isEmpty() || checkpoint.get().getType() != CheckpointType.MACRO
                    || !checkpoint.get().getCreatedAt().isBefore(cutoff)) {
                continue;
            }
            String json = await(storagePort.getText(DIRECTORY, path));
            await(storagePort.putTextAtomic(ARCHIVE_DIRECTORY, path, json));
            await(storagePort.deleteObject(DIRECTORY, path));
            archived++;
        }
        return archived;
    }

    @Override
    public void deleteInvocation(String invocationId) {
        throw new UnsupportedOperationException("Durable checkpoints are retired by retention only");
    }

    private Optional<Checkpoint> read(String path) {
        if (!path.endsWith(".json")) {
            return Optional.empty();
        }
        String json = await(storagePort.getText(DIRECTORY, path));
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Checkpoint.class));
        } catch (JsonProcessingException e) {
            log.warn("[Checkpoint] Skipping unreadable checkpoint file {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private static String fileName(Checkpoint checkpoint) {
        return checkpoint.getInvocationId() + "/" + String.format("%010d", checkpoint.getSequence()) + "-"
                + checkpoint.getCheckpointId() + ".json";
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while accessing checkpoint storage", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException("Checkpoint storage failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            throw new IllegalStateException("Checkpoint storage timed out", e);
        }
    }
}
