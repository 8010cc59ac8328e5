package me.golemcore.toolexec.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Immutable snapshot of an invocation's execution state.
 *
 * <p>
 * Exactly one of {@code payload} and {@code externalRef} is set. A
 * {@link CheckpointEncoding#DELTA} checkpoint must be reconstructed by walking
 * {@code parentCheckpointId} back to a FULL one.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Checkpoint {

    String checkpointId;
    String invocationId;
    CheckpointType type;
    long sequence;
    String parentCheckpointId;
    String label;
    CheckpointEncoding encoding;
    boolean compressed;
    byte[] payload;
    String externalRef;
    long sizeBytes;
    Instant createdAt;

    @JsonIgnore
    public boolean isDelta() {
        return encoding == CheckpointEncoding.DELTA;
    }
}
