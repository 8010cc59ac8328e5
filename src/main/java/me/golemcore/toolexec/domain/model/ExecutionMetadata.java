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
 * Execution facts returned alongside a result or error.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionMetadata {

    private Long durationMs;
    private int attempt;
    private String sandboxId;
    private int checkpointCount;
    private String latestCheckpointId;
    private String resumedFrom;
    private boolean degraded;
    private boolean deprecatedTool;

    /** Set for async submissions. */
    private String pollUrl;
    private Long pollIntervalMs;
}
