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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One attempt to run a tool for a caller.
 *
 * <p>
 * Status changes go through {@link #transitionTo(InvocationStatus, Clock)},
 * which refuses every edge out of a terminal status. Only the orchestrator
 * that currently owns the invocation mutates it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Invocation {

    private String invocationId;
    private String toolId;
    private String toolVersion;
    private CallerIdentity caller;

    @Builder.Default
    private Map<String, Object> parameters = new LinkedHashMap<>();

    private ResourceLimits resourceLimits;
    private CheckpointConfig checkpointConfig;
    private ExecutionOptions executionOptions;

    @Builder.Default
    private InvocationStatus status = InvocationStatus.PENDING;

    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant updatedAt;

    private Map<String, Object> result;
    private ToolError error;

    private Integer progressPercent;
    private String latestCheckpointId;
    private int checkpointCount;

    private ApprovalState approval;

    @Builder.Default
    private int attempt = 1;
    private String resumedFrom;
    private String resumeCheckpointId;

    private String sandboxId;
    private String ownerId;
    private Instant heartbeatAt;
    private boolean cancelRequested;
    /** A fallback tier served part of the tool's context. */
    private boolean degraded;
    private String cancelReason;

    /**
     * Moves the invocation to {@code next}.
     *
     * @return false when the edge is not allowed (including any edge out of a
     *         terminal status); the invocation is left untouched
     */
    public boolean transitionTo(InvocationStatus next, Clock clock) {
        if (status == null || !status.canTransitionTo(next)) {
            return false;
        }
        Instant now = Instant.now(clock);
        status = next;
        updatedAt = now;
        if (next == InvocationStatus.RUNNING && startedAt == null) {
            startedAt = now;
        }
        if (next.isTerminal()) {
            completedAt = now;
        }
        return true;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public String tenantId() {
        return caller != null ? caller.getTenantId() : null;
    }

    public String agentId() {
        return caller != null ? caller.getAgentId() : null;
    }

    public String idempotencyKey() {
        return executionOptions != null ? executionOptions.getIdempotencyKey() : null;
    }
}
