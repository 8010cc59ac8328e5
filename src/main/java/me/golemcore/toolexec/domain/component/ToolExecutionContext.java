package me.golemcore.toolexec.domain.component;

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

import lombok.Builder;
import me.golemcore.toolexec.bridge.DocumentContextService;
import me.golemcore.toolexec.checkpoint.CheckpointManager;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.Checkpoint;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.RetryPolicy;
import me.golemcore.toolexec.domain.model.SecretLease;
import me.golemcore.toolexec.domain.service.ExternalCallGuard;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Everything a running tool may touch: its validated parameters, the state
 * restored from a checkpoint, the sandbox directory, its leased secrets, and
 * the guarded paths for external calls, documents and checkpoints.
 *
 * <p>
 * The tool reports its resumable state through {@link #reportState}; the
 * orchestrator snapshots the latest reported state into micro checkpoints on
 * its own cadence.
 */
public class ToolExecutionContext {

    private final String invocationId;
    private final String toolId;
    private final String tenantId;
    private final int attempt;
    private final Map<String, Object> parameters;
    private final Map<String, Object> restoredState;
    private final Path workingDirectory;
    private final Map<String, SecretLease> secrets;
    private final Instant deadline;
    private final RetryPolicy retryPolicy;
    private final ExternalCallGuard callGuard;
    private final CheckpointManager checkpointManager;
    private final DocumentContextService documents;
    private final Clock clock;
    private final Consumer<Checkpoint> checkpointListener;

    private final AtomicReference<Map<String, Object>> reportedState = new AtomicReference<>();
    private volatile Integer progressPercent;
    private volatile boolean cancelled;
    private volatile boolean degraded;

    @Builder
    public ToolExecutionContext(String invocationId, String toolId, String tenantId, int attempt,
            Map<String, Object> parameters, Map<String, Object> restoredState, Path workingDirectory,
            Map<String, SecretLease> secrets, Instant deadline, RetryPolicy retryPolicy, ExternalCallGuard callGuard,
            CheckpointManager checkpointManager, DocumentContextService documents, Clock clock,
            Consumer<Checkpoint> checkpointListener) {
        this.invocationId = invocationId;
        this.toolId = toolId;
        this.tenantId = tenantId;
        this.attempt = attempt;
        this.parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
        this.restoredState = restoredState;
        this.workingDirectory = workingDirectory;
        this.secrets = secrets != null ? Map.copyOf(secrets) : Map.of();
        this.deadline = deadline;
        this.retryPolicy = retryPolicy;
        this.callGuard = callGuard;
        this.checkpointManager = checkpointManager;
        this.documents = documents;
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.checkpointListener = checkpointListener != null ? checkpointListener : checkpoint -> {
        };
        if (restoredState != null) {
            reportedState.set(restoredState);
        }
    }

    public String getInvocationId() {
        return invocationId;
    }

    public String getToolId() {
        return toolId;
    }

    public int getAttempt() {
        return attempt;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    /**
     * State of the checkpoint this attempt resumed from, if any.
     */
    public Optional<Map<String, Object>> getRestoredState() {
        return Optional.ofNullable(restoredState);
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    /**
     * Value of a declared credential.
     *
     * @throws ToolExecutionException
     *             when the credential was not declared or its lease expired
     */
    public String getSecret(String credentialName) {
        SecretLease lease = secrets.get(credentialName);
        if (lease == null) {
            throw new ToolExecutionException(ErrorCode.PERMISSION_DENIED,
                    "Credential " + credentialName + " is not declared by " + toolId);
        }
        if (lease.isExpired(Instant.now(clock))) {
            throw new ToolExecutionException(ErrorCode.PERMISSION_DENIED,
                    "Credential " + credentialName + " lease expired");
        }
        return lease.value();
    }

    public void reportState(Map<String, Object> state) {
        reportedState.set(state != null ? new LinkedHashMap<>(state) : null);
    }

    public Map<String, Object> getReportedState() {
        return reportedState.get();
    }

    public void reportProgress(int percent) {
        progressPercent = Math.max(0, Math.min(100, percent));
    }

    public Integer getProgressPercent() {
        return progressPercent;
    }

    public Checkpoint saveMacro(Map<String, Object> state) {
        reportState(state);
        Checkpoint checkpoint = checkpointManager.saveMacro(invocationId, state);
        checkpointListener.accept(checkpoint);
        return checkpoint;
    }

    public Checkpoint saveNamed(String label, Map<String, Object> state) {
        reportState(state);
        Checkpoint checkpoint = checkpointManager.saveNamed(invocationId, label, state);
        checkpointListener.accept(checkpoint);
        return checkpoint;
    }

    /**
     * Run an outbound call to {@code serviceId} through rate limiting, the
     * circuit breaker and the tool's retry policy.
     */
    public <T> T callExternal(String serviceId, Callable<T> call) {
        return callGuard.call(serviceId, new ExternalCallGuard.CallScope(toolId, tenantId, invocationId),
                retryPolicy, deadline, call);
    }

    /**
     * Fetch a document through the bridge. {@code version} may be null for the
     * latest version.
     */
    public Map<String, Object> fetchDocument(String documentId, String version) {
        DocumentContextService.Document document = documents.fetch(documentId, version, remaining());
        if (document.degraded()) {
            degraded = true;
        }
        return document.content();
    }

    public Duration remaining() {
        if (deadline == null) {
            return null;
        }
        Duration left = Duration.between(Instant.now(clock), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean isCancelled() {
        return cancelled || Thread.currentThread().isInterrupted();
    }

    /**
     * Ask the tool to stop. Set by the orchestrator.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isDegraded() {
        return degraded;
    }
}
