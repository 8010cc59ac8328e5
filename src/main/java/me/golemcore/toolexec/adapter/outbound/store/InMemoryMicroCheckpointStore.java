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

import me.golemcore.toolexec.domain.model.Checkpoint;
import me.golemcore.toolexec.port.outbound.CheckpointStorePort;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fast store for micro checkpoints. Contents do not survive a restart.
 */
@Component("microCheckpointStore")
public class InMemoryMicroCheckpointStore implements CheckpointStorePort {

    private final Map<String, List<Checkpoint>> byInvocation = new ConcurrentHashMap<>();

    @Override
    public void append(Checkpoint checkpoint) {
        byInvocation.compute(checkpoint.getInvocationId(), (id, existing) -> {
            List<Checkpoint> list = existing != null ? existing : new ArrayList<>();
            list.add(checkpoint);
            return list;
        });
    }

    @Override
    public Optional<Checkpoint> get(String invocationId, String checkpointId) {
        return list(invocationId).stream()
                .filter(checkpoint -> checkpoint.getCheckpointId().equals(checkpointId))
                .findFirst();
    }

    @Override
    public List<Checkpoint> list(String invocationId) {
        List<Checkpoint> copy = new ArrayList<>();
        byInvocation.computeIfPresent(invocationId, (id, existing) -> {
            copy.addAll(existing);
            return existing;
        });
        copy.sort(Comparator.comparingLong(Checkpoint::getSequence));
        return copy;
    }

    @Override
    public int purgeOlderThan(Instant cutoff) {
        int[] purged = new int[1];
        for (String invocationId : List.copyOf(byInvocation.keySet())) {
            byInvocation.computeIfPresent(invocationId, (id, existing) -> {
                int before = existing.size();
                existing.removeIf(checkpoint -> checkpoint.getCreatedAt().isBefore(cutoff));
                purged[0] += before - existing.size();
                return existing.isEmpty() ? null : existing;
            });
        }
        return purged[0];
    }

    @Override
    public void deleteInvocation(String invocationId) {
        byInvocation.remove(invocationId);
    }
}
