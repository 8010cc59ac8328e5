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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-invocation checkpoint settings.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointConfig {

    private boolean enabled;

    /** Micro-checkpoint cadence in seconds of wall-clock execution time. */
    @Builder.Default
    private int intervalSeconds = 30;

    /** Checkpoint to restore state from when the invocation starts. */
    private String resumeFrom;
}
