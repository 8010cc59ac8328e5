package me.golemcore.toolexec.port.outbound;

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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Append-only checkpoint storage. There are two instances: a fast micro store
 * and a durable store for macro and named checkpoints.
 */
public interface CheckpointStorePort {

    void append(Checkpoint checkpoint);

    Optional<Checkpoint> get(String invocationId, String checkpointId);

    /**
     * All checkpoints of an invocation ordered by sequence.
     */
    List<Checkpoint> list(String invocationId);

    /**
     * Retires checkpoints created before {@code cutoff}. The micro store deletes
     * them; durable stores archive macro checkpoints and never touch named ones.
     *
     * @return number of retired checkpoints
     */
    int purgeOlderThan(Instant cutoff);

    /**
     * Drops every checkpoint of an invocation whose state is no longer needed.
     * Only called on the micro store.
     */
    void deleteInvocation(String invocationId);
}
