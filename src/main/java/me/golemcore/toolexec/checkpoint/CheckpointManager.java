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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.exception.CheckpointException;
import me.golemcore.toolexec.domain.model.Checkpoint;
import me.golemcore.toolexec.domain.model.CheckpointEncoding;
import me.golemcore.toolexec.domain.model.CheckpointType;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.ResumedState;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.CheckpointStorePort;
import me.golemcore.toolexec.port.outbound.StoragePort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Writes and restores execution-state checkpoints.
 *
 * <p>
 * Micro checkpoints go to a fast store and are best effort. Macro and named
 * checkpoints go to the durable store and failures are raised as
 * {@code checkpoint_failed}. Writes for one invocation are serialized; each
 * checkpoint gets the next sequence number of its invocation.
 *
 * <p>
 * Encoding, in order:
 * <ol>
 * <li>a delta against the previous checkpoint when the full state is at least
 * {@code delta-min-state-size}, the delta is at most {@code delta-max-ratio}
 * of the full size and the parent chain is shorter than
 * {@code max-delta-chain}; durable checkpoints only use durable parents</li>
 * <li>GZIP when the payload exceeds {@code compression-threshold}</li>
 * <li>payloads above {@code external-payload-threshold} are written through
 * {@link StoragePort} and referenced by a {@code storage://} URI</li>
 * </ol>
 */
@Service
@Slf4j
public class CheckpointManager {

    static final String BLOB_DIRECTORY = "checkpoint-blobs";
    static final String STORAGE_SCHEME = "storage://";
    private static final long STORAGE_TIMEOUT_SECONDS = 10;

    private final CheckpointStorePort microStore;
    private final CheckpointStorePort durableStore;
    private final CheckpointCodec codec;
    private final StoragePort storagePort;
    private final ToolExecProperties.CheckpointProperties config;
    private final Clock clock;

    private final Map<String, Object> locks = new ConcurrentHashMap<>();
    private final Map<String, Long> sequences = new ConcurrentHashMap<>();
    private final Map<String, Head> heads = new ConcurrentHashMap<>();

    public CheckpointManager(@Qualifier("microCheckpointStore") CheckpointStorePort microStore,
            @Qualifier("durableCheckpointStore") CheckpointStorePort durableStore, CheckpointCodec codec,
            StoragePort storagePort, ToolExecProperties properties, Clock clock) {
        this.microStore = microStore;
        this.durableStore = durableStore;
        this.codec = codec;
        this.storagePort = storagePort;
        this.config = properties.getCheckpoint();
        this.clock = clock;
    }

    /**
     * Last written checkpoint with its reconstructed state.
     */
    private record Head(Checkpoint checkpoint, Map<String, Object> state, int chainLength) {
    }

    /**
     * Best-effort periodic checkpoint; a failure is logged and swallowed.
     */
    public Optional<Checkpoint> saveMicro(String invocationId, Map<String, Object> state) {
        try {
            return Optional.of(save(invocationId, CheckpointType.MICRO, null, state));
        } catch (RuntimeException e) {
            log.warn("[Checkpoint] Micro checkpoint failed for {}: {}", invocationId, e.getMessage());
            return Optional.empty();
        }
    }

    public Checkpoint saveMacro(String invocationId, Map<String, Object> state) {
        return saveDurable(invocationId, CheckpointType.MACRO, null, state);
    }

    public Checkpoint saveNamed(String invocationId, String label, Map<String, Object> state) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Named checkpoint requires a label");
        }
        return saveDurable(invocationId, CheckpointType.NAMED, label, state);
    }

    /**
     * Reconstruct the state of {@code checkpointId}, or of the latest checkpoint
     * when it is {@code null}.
     */
    public ResumedState resume(String invocationId, String checkpointId) {
        return resume(List.of(invocationId), checkpointId);
    }

    /**
     * Resume across the attempts of one logical execution, newest attempt first.
     * The first attempt that has checkpoints (or holds {@code checkpointId})
     * wins.
     */
    public ResumedState resume(List<String> lineage, String checkpointId) {
        for (String invocationId : lineage) {
            List<Checkpoint> all = listAll(invocationId);
            if (all.isEmpty()) {
                continue;
            }
            if (checkpointId != null
                    && all.stream().noneMatch(checkpoint -> checkpointId.equals(checkpoint.getCheckpointId()))) {
                continue;
            }
            return resolve(invocationId, all, checkpointId);
        }
        throw CheckpointException.notFound(checkpointId != null
                ? "Checkpoint " + checkpointId + " not found"
                : "No checkpoint found for " + lineage.get(0));
    }

    public Optional<Checkpoint> latest(String invocationId) {
        List<Checkpoint> all = listAll(invocationId);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    public List<Checkpoint> list(String invocationId) {
        return listAll(invocationId);
    }

    /**
     * Forget in-memory bookkeeping for a finished invocation. When
     * {@code retain} is false its micro checkpoints are dropped too.
     */
    public void release(String invocationId, boolean retain) {
        sequences.remove(invocationId);
        heads.remove(headKey(invocationId, false));
        heads.remove(headKey(invocationId, true));
        locks.remove(invocationId);
        if (!retain) {
            try {
                microStore.deleteInvocation(invocationId);
            } catch (RuntimeException e) {
                log.debug("[Checkpoint] Failed to drop micro checkpoints of {}: {}", invocationId, e.getMessage());
            }
        }
    }

    /**
     * Retention pass: expire micro checkpoints and archive old macro ones.
     *
     * @return number of retired checkpoints
     */
    public int purgeExpired() {
        Instant now = Instant.now(clock);
        int micro = microStore.purgeOlderThan(now.minus(config.getMicroRetention()));
        int macro = durableStore.purgeOlderThan(now.minus(config.getMacroRetention()));
        if (micro + macro > 0) {
            log.info("[Checkpoint] Retention: expired {} micro, archived {} macro checkpoints", micro, macro);
        }
        return micro + macro;
    }

    private Checkpoint saveDurable(String invocationId, CheckpointType type, String label, Map<String, Object> state) {
        try {
            return save(invocationId, type, label, state);
        } catch (CheckpointException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("[Checkpoint] {} checkpoint failed for {}: {}", type, invocationId, e.getMessage());
            throw CheckpointException.writeFailed(type + " checkpoint failed: " + e.getMessage(), e);
        }
    }

    private Checkpoint save(String invocationId, CheckpointType type, String label, Map<String, Object> state) {
        synchronized (locks.computeIfAbsent(invocationId, id -> new Object())) {
            Map<String, Object> normalized = codec.normalize(state);
            byte[] full = codec.serialize(normalized);
            long sequence = sequences.computeIfAbsent(invocationId, this::highestSequence) + 1;

            Head parent = head(invocationId, type.isDurable());
            CheckpointEncoding encoding = CheckpointEncoding.FULL;
            byte[] payload = full;
            String parentId = null;
            int chainLength = 0;
            if (parent != null && full.length >= config.getDeltaMinStateSize()
                    && parent.chainLength() < config.getMaxDeltaChain()) {
                byte[] delta = codec.serialize(StateDelta.diff(parent.state(), normalized));
                if (delta.length <= full.length * config.getDeltaMaxRatio()) {
                    encoding = CheckpointEncoding.DELTA;
                    payload = delta;
                    parentId = parent.checkpoint().getCheckpointId();
                    chainLength = parent.chainLength() + 1;
                }
            }

            boolean compressed = false;
            if (payload.length > config.getCompressionThreshold()) {
                payload = codec.gzip(payload);
                compressed = true;
            }

            String checkpointId = UUID.randomUUID().toString();
            String externalRef = null;
            byte[] inline = payload;
            if (payload.length > config.getExternalPayloadThreshold()) {
                externalRef = writeBlob(invocationId, checkpointId, payload);
                inline = null;
            }

            Checkpoint checkpoint = Checkpoint.builder()
                    .checkpointId(checkpointId)
                    .invocationId(invocationId)
                    .type(type)
                    .sequence(sequence)
                    .parentCheckpointId(parentId)
                    .label(label)
                    .encoding(encoding)
                    .compressed(compressed)
                    .payload(inline)
                    .externalRef(externalRef)
                    .sizeBytes(payload.length)
                    .createdAt(Instant.now(clock))
                    .build();
            store(type).append(checkpoint);

            sequences.put(invocationId, sequence);
            Head head = new Head(checkpoint, normalized, chainLength);
            heads.put(headKey(invocationId, false), head);
            if (type.isDurable()) {
                heads.put(headKey(invocationId, true), head);
            }
            log.debug("[Checkpoint] {} #{} for {} ({}, {} bytes{})", type, sequence, invocationId, encoding,
                    payload.length, compressed ? ", gzip" : "");
            return checkpoint;
        }
    }

    private CheckpointStorePort store(CheckpointType type) {
        return type.isDurable() ? durableStore : microStore;
    }

    private Head head(String invocationId, boolean durableOnly) {
        Head cached = heads.get(headKey(invocationId, durableOnly));
        if (cached != null) {
            return cached;
        }
        List<Checkpoint> candidates = durableOnly ? listDurable(invocationId) : listAll(invocationId);
        if (candidates.isEmpty()) {
            return null;
        }
        Checkpoint last = candidates.get(candidates.size() - 1);
        try {
            Map<String, Checkpoint> byId = index(candidates);
            Chain chain = reconstruct(last, byId);
            Head head = new Head(last, chain.state(), chain.length());
            heads.put(headKey(invocationId, durableOnly), head);
            return head;
        } catch (BrokenChainException e) {
            // Next checkpoint is written in full.
            return null;
        }
    }

    private ResumedState resolve(String invocationId, List<Checkpoint> all, String checkpointId) {
        Checkpoint target = checkpointId == null
                ? all.get(all.size() - 1)
                : all.stream().filter(c -> checkpointId.equals(c.getCheckpointId())).findFirst()
                        .orElseThrow(() -> CheckpointException.notFound("Checkpoint " + checkpointId + " not found"));
        Map<String, Checkpoint> byId = index(all);
        try {
            return new ResumedState(target, reconstruct(target, byId).state());
        } catch (BrokenChainException e) {
            log.warn("[Checkpoint] Cannot reconstruct {} of {}: {}; falling back to a durable ancestor",
                    target.getCheckpointId(), invocationId, e.getMessage());
        }

        List<Checkpoint> fallbacks = all.stream()
                .filter(c -> c.getType().isDurable() && c.getSequence() < target.getSequence())
                .sorted(Comparator.comparingLong(Checkpoint::getSequence).reversed())
                .toList();
        for (Checkpoint candidate : fallbacks) {
            try {
                Map<String, Object> state = reconstruct(candidate, byId).state();
                log.info("[Checkpoint] Resuming {} from durable ancestor #{}", invocationId, candidate.getSequence());
                return new ResumedState(candidate, state);
            } catch (BrokenChainException e) {
                log.debug("[Checkpoint] Ancestor {} not reconstructible: {}", candidate.getCheckpointId(),
                        e.getMessage());
            }
        }
        throw new CheckpointException(ErrorCode.CHECKPOINT_NOT_FOUND,
                "No reconstructible checkpoint for " + invocationId);
    }

    private record Chain(Map<String, Object> state, int length) {
    }

    private Chain reconstruct(Checkpoint target, Map<String, Checkpoint> byId) {
        List<Checkpoint> deltas = new ArrayList<>();
        Checkpoint current = target;
        while (current.isDelta()) {
            deltas.add(current);
            if (deltas.size() > byId.size()) {
                throw new BrokenChainException("cycle in parent chain at " + current.getCheckpointId());
            }
            Checkpoint parent = current.getParentCheckpointId() != null
                    ? byId.get(current.getParentCheckpointId())
                    : null;
            if (parent == null) {
                throw new BrokenChainException("missing parent " + current.getParentCheckpointId());
            }
            current = parent;
        }
        Map<String, Object> state = decode(current);
        for (int i = deltas.size() - 1; i >= 0; i--) {
            state = StateDelta.apply(state, decode(deltas.get(i)));
        }
        return new Chain(state, deltas.size());
    }

    private Map<String, Object> decode(Checkpoint checkpoint) {
        try {
            byte[] bytes = checkpoint.getPayload() != null ? checkpoint.getPayload() : readBlob(checkpoint);
            return codec.deserialize(bytes, checkpoint.isCompressed());
        } catch (RuntimeException e) {
            throw new BrokenChainException("unreadable payload of " + checkpoint.getCheckpointId() + ": "
                    + e.getMessage());
        }
    }

    private List<Checkpoint> listAll(String invocationId) {
        List<Checkpoint> all = new ArrayList<>(listDurable(invocationId));
        try {
            all.addAll(microStore.list(invocationId));
        } catch (RuntimeException e) {
            log.warn("[Checkpoint] Micro store unavailable for {}: {}", invocationId, e.getMessage());
        }
        all.sort(Comparator.comparingLong(Checkpoint::getSequence));
        return all;
    }

    private List<Checkpoint> listDurable(String invocationId) {
        return durableStore.list(invocationId);
    }

    private long highestSequence(String invocationId) {
        List<Checkpoint> all = listAll(invocationId);
        return all.isEmpty() ? 0 : all.get(all.size() - 1).getSequence();
    }

    private static Map<String, Checkpoint> index(List<Checkpoint> checkpoints) {
        Map<String, Checkpoint> byId = new HashMap<>();
        checkpoints.forEach(checkpoint -> byId.put(checkpoint.getCheckpointId(), checkpoint));
        return byId;
    }

    private static String headKey(String invocationId, boolean durableOnly) {
        return invocationId + (durableOnly ? "|durable" : "|any");
    }

    private String writeBlob(String invocationId, String checkpointId, byte[] payload) {
        String path = invocationId + "/" + checkpointId + ".bin";
        await(storagePort.putObject(BLOB_DIRECTORY, path, payload), "write blob " + path);
        return STORAGE_SCHEME + BLOB_DIRECTORY + "/" + path;
    }

    private byte[] readBlob(Checkpoint checkpoint) {
        String ref = checkpoint.getExternalRef();
        String prefix = STORAGE_SCHEME + BLOB_DIRECTORY + "/";
        if (ref == null || !ref.startsWith(prefix)) {
            throw new IllegalStateException("Unsupported payload reference: " + ref);
        }
        byte[] bytes = await(storagePort.getObject(BLOB_DIRECTORY, ref.substring(prefix.length())), "read " + ref);
        if (bytes == null) {
            throw new IllegalStateException("Payload blob missing: " + ref);
        }
        return bytes;
    }

    private static <T> T await(CompletableFuture<T> future, String what) {
        try {
            return future.get(STORAGE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted: " + what, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Failed to " + what, e);
        }
    }

    private static final class BrokenChainException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        BrokenChainException(String message) {
            super(message);
        }
    }
}
