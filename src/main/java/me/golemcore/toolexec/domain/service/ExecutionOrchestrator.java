package me.golemcore.toolexec.domain.service;

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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.bridge.DocumentContextService;
import me.golemcore.toolexec.checkpoint.CheckpointManager;
import me.golemcore.toolexec.domain.component.ToolExecutionContext;
import me.golemcore.toolexec.domain.component.ToolHandler;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.AuditEventType;
import me.golemcore.toolexec.domain.model.CancelResult;
import me.golemcore.toolexec.domain.model.Checkpoint;
import me.golemcore.toolexec.domain.model.CheckpointConfig;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.Invocation;
import me.golemcore.toolexec.domain.model.InvocationStatus;
import me.golemcore.toolexec.domain.model.ProtocolKind;
import me.golemcore.toolexec.domain.model.ResourceLimits;
import me.golemcore.toolexec.domain.model.ResumedState;
import me.golemcore.toolexec.domain.model.Sandbox;
import me.golemcore.toolexec.domain.model.SandboxSpec;
import me.golemcore.toolexec.domain.model.SecretLease;
import me.golemcore.toolexec.domain.model.ToolError;
import me.golemcore.toolexec.domain.model.ToolManifest;
import me.golemcore.toolexec.domain.model.ToolResult;
import me.golemcore.toolexec.domain.model.ValidationResult;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.CredentialStorePort;
import me.golemcore.toolexec.port.outbound.InvocationStorePort;
import me.golemcore.toolexec.port.outbound.SandboxProvisionerPort;
import me.golemcore.toolexec.validation.ResultValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Drives one invocation from admission to a terminal status.
 *
 * <p>
 * Handlers run on the worker pool, queued by priority. A supervision tick
 * enforces deadlines and cancel grace periods, takes micro checkpoints of the
 * state a tool reports, and renews the worker lease ({@code heartbeatAt}) on
 * the persisted record. Invocations whose lease was not renewed for
 * {@code orphanAfter} by any process are marked {@code worker_lost} so they
 * can be resumed elsewhere.
 *
 * <p>
 * Every path to a terminal status goes through {@link #finish}, which runs
 * once per execution: sandbox teardown, slot release, checkpoint retention,
 * terminal audit event.
 */
@Service
@Slf4j
public class ExecutionOrchestrator {

    private static final int MAX_LINEAGE_DEPTH = 32;
    private static final Duration CREDENTIAL_FETCH_CEILING = Duration.ofSeconds(5);

    private final InvocationStorePort invocationStore;
    private final ResourceAllocator resourceAllocator;
    private final SandboxProvisionerPort sandboxProvisioner;
    private final CredentialStorePort credentialStore;
    private final CheckpointManager checkpointManager;
    private final ResultValidator resultValidator;
    private final ExternalCallGuard callGuard;
    private final DocumentContextService documentContext;
    private final AuditService auditService;
    private final ApprovalCoordinator approvalCoordinator;
    private final Map<ProtocolKind, ToolHandler> handlers = new EnumMap<>(ProtocolKind.class);
    private final ToolExecProperties.ExecutionProperties settings;
    private final Executor workerPool;
    private final Clock clock;

    private final String ownerId = "worker-" + UUID.randomUUID();
    private final Map<String, RunningExecution> running = new ConcurrentHashMap<>();
    private final AtomicLong submissionSequence = new AtomicLong();
    private volatile Instant lastOrphanScanAt;
    private ScheduledExecutorService supervisor;

    @SuppressWarnings("PMD.ExcessiveParameterList")
    public ExecutionOrchestrator(InvocationStorePort invocationStore, ResourceAllocator resourceAllocator,
            SandboxProvisionerPort sandboxProvisioner, CredentialStorePort credentialStore,
            CheckpointManager checkpointManager, ResultValidator resultValidator, ExternalCallGuard callGuard,
            DocumentContextService documentContext, AuditService auditService,
            ApprovalCoordinator approvalCoordinator, List<ToolHandler> toolHandlers, ToolExecProperties properties,
            @Qualifier("toolWorkerPool") Executor workerPool, Clock clock) {
        this.invocationStore = invocationStore;
        this.resourceAllocator = resourceAllocator;
        this.sandboxProvisioner = sandboxProvisioner;
        this.credentialStore = credentialStore;
        this.checkpointManager = checkpointManager;
        this.resultValidator = resultValidator;
        this.callGuard = callGuard;
        this.documentContext = documentContext;
        this.auditService = auditService;
        this.approvalCoordinator = approvalCoordinator;
        for (ToolHandler handler : toolHandlers) {
            handlers.put(handler.getProtocol(), handler);
        }
        this.settings = properties.getExecution();
        this.workerPool = workerPool;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        long tickMs = settings.getSupervisionTick().toMillis();
        supervisor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "invocation-supervisor");
            thread.setDaemon(true);
            return thread;
        });
        supervisor.scheduleWithFixedDelay(this::superviseSafely, tickMs, tickMs, TimeUnit.MILLISECONDS);
        log.info("[Orchestrator] Started as {} with handlers {}", ownerId, handlers.keySet());
    }

    @PreDestroy
    public void stop() {
        if (supervisor != null) {
            supervisor.shutdownNow();
        }
    }

    /**
     * Run an admitted invocation. The future completes with the invocation in
     * its terminal status, or in {@code pending_approval} when a human has to
     * decide first.
     */
    public CompletableFuture<Invocation> execute(Invocation invocation, ToolManifest manifest) {
        if (approvalRequired(invocation, manifest)) {
            return CompletableFuture.completedFuture(snapshot(approvalCoordinator.request(invocation)));
        }
        if (invocation.getApproval() != null && invocation.getApproval().isGranted()) {
            // a cancel may have landed between the decision and this dispatch
            return approvalCoordinator.withInvocationLock(invocation.getInvocationId(), () -> {
                Optional<Invocation> stored = invocationStore.get(invocation.getInvocationId());
                if (stored.isPresent() && stored.get().isTerminal()) {
                    log.info("[Orchestrator] {} ended as {} before dispatch", invocation.getInvocationId(),
                            stored.get().getStatus().wireValue());
                    return CompletableFuture.completedFuture(snapshot(stored.get()));
                }
                return start(invocation, manifest, null);
            });
        }
        return start(invocation, manifest, null);
    }

    /**
     * Start a new attempt from a checkpoint of {@code original} (or of an
     * earlier attempt it was resumed from). The original record is never
     * modified, except that a RUNNING record with an expired worker lease is
     * first marked {@code worker_lost}.
     *
     * @param checkpointId
     *            checkpoint to restore; {@code null} for the latest one
     */
    public Submission resume(Invocation original, ToolManifest manifest, String checkpointId) {
        if (!manifest.isResumable()) {
            throw new ToolExecutionException(ErrorCode.VALIDATION_FAILED,
                    "Tool " + manifest.coordinates() + " is not resumable");
        }
        Invocation source = reclaimIfOrphaned(original);
        if (!source.isTerminal()) {
            throw new ToolExecutionException(ErrorCode.VALIDATION_FAILED,
                    "Invocation " + source.getInvocationId() + " is still " + source.getStatus().wireValue());
        }
        if (source.getStatus() == InvocationStatus.SUCCESS
                || source.getStatus() == InvocationStatus.PERMISSION_DENIED) {
            throw new ToolExecutionException(ErrorCode.VALIDATION_FAILED,
                    "Only failed, timed out or cancelled invocations can be resumed");
        }

        ResumedState restored = checkpointManager.resume(lineage(source), checkpointId);
        Instant now = Instant.now(clock);
        CheckpointConfig checkpointConfig = source.getCheckpointConfig() != null
                ? source.getCheckpointConfig()
                : CheckpointConfig.builder().enabled(true).build();
        Invocation attempt = source.toBuilder()
                .invocationId(UUID.randomUUID().toString())
                .status(InvocationStatus.PENDING)
                .attempt(source.getAttempt() + 1)
                .resumedFrom(source.getInvocationId())
                .resumeCheckpointId(restored.checkpoint().getCheckpointId())
                .checkpointConfig(checkpointConfig)
                .createdAt(now)
                .updatedAt(now)
                .startedAt(null)
                .completedAt(null)
                .result(null)
                .error(null)
                .progressPercent(null)
                .latestCheckpointId(null)
                .checkpointCount(0)
                .sandboxId(null)
                .ownerId(null)
                .heartbeatAt(null)
                .cancelRequested(false)
                .cancelReason(null)
                .degraded(false)
                .build();
        invocationStore.save(attempt);
        log.info("[Orchestrator] Resuming {} as {} (attempt {}) from checkpoint {}", source.getInvocationId(),
                attempt.getInvocationId(), attempt.getAttempt(), restored.checkpoint().getCheckpointId());
        return new Submission(attempt.getInvocationId(), start(attempt, manifest, restored.state()));
    }

    /**
     * Ask an invocation to stop. Running tools get the configured grace period
     * before they are interrupted; queued and approval-waiting invocations are
     * cancelled at once. Terminal invocations are left untouched.
     */
    public CancelResult requestCancel(String invocationId, String reason) {
        RunningExecution local = running.get(invocationId);
        if (local != null) {
            return cancelLocal(local, reason);
        }
        return approvalCoordinator.withInvocationLock(invocationId, () -> cancelStored(invocationId, reason));
    }

    private CancelResult cancelStored(String invocationId, String reason) {
        RunningExecution local = running.get(invocationId);
        if (local != null) {
            return cancelLocal(local, reason);
        }
        Optional<Invocation> stored = invocationStore.get(invocationId);
        if (stored.isEmpty()) {
            return CancelResult.rejected("Invocation " + invocationId + " not found");
        }
        Invocation invocation = stored.get();
        if (invocation.isTerminal()) {
            return CancelResult.rejected(CancelResult.ALREADY_COMPLETED);
        }
        invocation.setCancelRequested(true);
        invocation.setCancelReason(reason);
        if (invocation.getStatus() == InvocationStatus.RUNNING) {
            // owned by another worker; it picks the flag up with its next heartbeat
            invocation.setUpdatedAt(Instant.now(clock));
            invocationStore.save(invocation);
            auditService.emit(AuditEventType.CANCEL_REQUESTED, invocation, reasonPayload(reason));
            return CancelResult.accepted("Cancellation requested");
        }

        boolean awaitingApproval = invocation.getStatus() == InvocationStatus.PENDING_APPROVAL;
        invocation.setError(ToolError.of(ErrorCode.CANCELLED, cancelMessage(reason)));
        invocation.transitionTo(InvocationStatus.CANCELLED, clock);
        invocationStore.save(invocation);
        if (awaitingApproval) {
            approvalCoordinator.withdraw(invocationId);
        }
        auditService.emit(AuditEventType.CANCEL_REQUESTED, invocation, reasonPayload(reason));
        auditService.emit(AuditEventType.COMPLETED, invocation);
        return CancelResult.accepted("Cancelled");
    }

    public boolean isRunningLocally(String invocationId) {
        return running.containsKey(invocationId);
    }

    /**
     * Live view of a locally running invocation, including progress and
     * checkpoint counters that are only persisted with the next heartbeat.
     */
    public Optional<Invocation> liveView(String invocationId) {
        RunningExecution execution = running.get(invocationId);
        if (execution == null) {
            return Optional.empty();
        }
        synchronized (execution) {
            ToolExecutionContext context = execution.context;
            if (context != null && context.getProgressPercent() != null) {
                execution.invocation.setProgressPercent(context.getProgressPercent());
            }
            return Optional.of(snapshot(execution.invocation));
        }
    }

    /**
     * Invocation ids of {@code invocation} and the attempts it was resumed
     * from, newest first.
     */
    public List<String> lineage(Invocation invocation) {
        List<String> lineage = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Invocation current = invocation;
        while (current != null && seen.add(current.getInvocationId()) && lineage.size() < MAX_LINEAGE_DEPTH) {
            lineage.add(current.getInvocationId());
            String parent = current.getResumedFrom();
            current = parent != null ? invocationStore.get(parent).orElse(null) : null;
        }
        return lineage;
    }

    // --- admission ---

    private boolean approvalRequired(Invocation invocation, ToolManifest manifest) {
        if (invocation.getApproval() != null && invocation.getApproval().isGranted()) {
            return false;
        }
        // callers may ask for approval, never waive the manifest's requirement
        Boolean requested = invocation.getExecutionOptions() != null
                ? invocation.getExecutionOptions().getRequireApproval()
                : null;
        return manifest.isRequiresApproval() || Boolean.TRUE.equals(requested);
    }

    private CompletableFuture<Invocation> start(Invocation invocation, ToolManifest manifest,
            Map<String, Object> restoredState) {
        ResourceLimits limits;
        try {
            limits = resourceAllocator.resolve(invocation.getResourceLimits(), manifest,
                    invocation.getCaller() != null ? invocation.getCaller().getAgentLimits() : null);
            invocation.setResourceLimits(limits);
        } catch (ToolExecutionException e) {
            return CompletableFuture.completedFuture(reject(invocation, e.toError()));
        }

        ToolHandler handler = manifest.getBinding() != null ? handlers.get(manifest.getBinding().protocol()) : null;
        if (handler == null) {
            return CompletableFuture.completedFuture(reject(invocation, ToolError.of(ErrorCode.TOOL_UNAVAILABLE,
                    "No handler for the protocol of " + manifest.coordinates())));
        }

        try {
            resourceAllocator.acquireSlot(invocation.agentId());
        } catch (ToolExecutionException e) {
            return CompletableFuture.completedFuture(reject(invocation, e.toError()));
        }

        RunningExecution execution = new RunningExecution(invocation, manifest, handler, restoredState);
        running.put(invocation.getInvocationId(), execution);
        int priority = invocation.getExecutionOptions() != null ? invocation.getExecutionOptions().getPriority() : 5;
        try {
            workerPool.execute(new PrioritizedTask(priority, submissionSequence.incrementAndGet(),
                    () -> run(execution)));
        } catch (RejectedExecutionException e) {
            log.error("[Orchestrator] Worker pool rejected {}", invocation.getInvocationId(), e);
            finish(execution, InvocationStatus.ERROR, null,
                    ToolError.of(ErrorCode.INTERNAL_ERROR, "Worker pool is not accepting work"));
        }
        return execution.future;
    }

    private Invocation reject(Invocation invocation, ToolError error) {
        invocation.setError(error);
        invocation.transitionTo(InvocationStatus.ERROR, clock);
        invocationStore.save(invocation);
        auditService.emit(AuditEventType.COMPLETED, invocation);
        log.info("[Orchestrator] {} rejected: {} {}", invocation.getInvocationId(), error.getCode().wireValue(),
                error.getMessage());
        return snapshot(invocation);
    }

    // --- worker ---

    void run(RunningExecution execution) {
        Invocation invocation = execution.invocation;
        synchronized (execution) {
            if (execution.finished.get()) {
                return;
            }
            execution.thread = Thread.currentThread();
        }
        try {
            ToolExecutionContext context = prepare(execution);
            ToolResult result;
            try {
                result = execution.handler.execute(execution.manifest, context);
            } catch (ToolExecutionException e) {
                onHandlerFailure(execution, e.toError());
                return;
            } catch (InterruptedException e) {
                // not re-asserted: the final checkpoint and record still need storage, and the
                // pooled thread is reset below
                onHandlerFailure(execution, ToolError.of(ErrorCode.CANCELLED, "Tool was interrupted"));
                return;
            } catch (Exception e) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("exception", e.getClass().getName());
                log.warn("[Orchestrator] Tool {} failed in {}: {}", invocation.getToolId(),
                        invocation.getInvocationId(), e.getMessage());
                onHandlerFailure(execution, ToolError.of(ErrorCode.EXECUTION_FAILED,
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), details));
                return;
            }
            complete(execution, result);
        } catch (ToolExecutionException e) {
            finish(execution, InvocationStatus.ERROR, null, e.toError());
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Internal failure while running {}", invocation.getInvocationId(), e);
            finish(execution, InvocationStatus.ERROR, null,
                    ToolError.of(ErrorCode.INTERNAL_ERROR, "Internal error while executing the tool"));
        } finally {
            synchronized (execution) {
                execution.thread = null;
            }
            // the worker thread is pooled
            Thread.interrupted();
        }
    }

    private ToolExecutionContext prepare(RunningExecution execution) {
        Invocation invocation = execution.invocation;
        ToolManifest manifest = execution.manifest;
        Instant startedAt = Instant.now(clock);
        Integer timeoutSeconds = invocation.getResourceLimits().getTimeoutSeconds();
        Duration timeout = Duration.ofSeconds(timeoutSeconds != null ? timeoutSeconds : 30);

        Sandbox sandbox = sandboxProvisioner.provision(SandboxSpec.builder()
                .invocationId(invocation.getInvocationId())
                .toolId(invocation.getToolId())
                .tenantId(invocation.tenantId())
                .parentSandboxId(invocation.getCaller() != null ? invocation.getCaller().getParentSandboxId() : null)
                .limits(invocation.getResourceLimits())
                .build());
        execution.sandbox = sandbox;
        invocation.setSandboxId(sandbox.getSandboxId());

        Instant deadline = startedAt.plus(timeout);
        Map<String, SecretLease> secrets = leaseCredentials(manifest, timeout, deadline);

        ToolExecutionContext context = ToolExecutionContext.builder()
                .invocationId(invocation.getInvocationId())
                .toolId(invocation.getToolId())
                .tenantId(invocation.tenantId())
                .attempt(invocation.getAttempt())
                .parameters(invocation.getParameters())
                .restoredState(execution.restoredState)
                .workingDirectory(sandbox.getWorkingDirectory())
                .secrets(secrets)
                .deadline(deadline)
                .retryPolicy(manifest.getRetryPolicy())
                .callGuard(callGuard)
                .checkpointManager(checkpointManager)
                .documents(documentContext)
                .clock(clock)
                .checkpointListener(checkpoint -> onCheckpoint(execution, checkpoint, true))
                .build();

        synchronized (execution) {
            if (execution.finished.get()) {
                teardown(execution);
                throw new ToolExecutionException(ErrorCode.CANCELLED, "Cancelled before start");
            }
            execution.context = context;
            execution.deadline = deadline;
            execution.lastMicroAt = startedAt;
            execution.lastHeartbeatAt = startedAt;
            invocation.transitionTo(InvocationStatus.RUNNING, clock);
            invocation.setOwnerId(ownerId);
            invocation.setHeartbeatAt(startedAt);
            invocationStore.save(invocation);
            if (execution.cancelRequestedAt != null) {
                context.cancel();
            }
        }
        auditService.emit(invocation.getResumedFrom() != null ? AuditEventType.RESUMED : AuditEventType.STARTED,
                invocation, startPayload(invocation));
        log.info("[Orchestrator] {} running {} (attempt {}, deadline {})", invocation.getInvocationId(),
                manifest.coordinates(), invocation.getAttempt(), deadline);
        return context;
    }

    private Map<String, SecretLease> leaseCredentials(ToolManifest manifest, Duration ttl, Instant deadline) {
        Map<String, SecretLease> secrets = new LinkedHashMap<>();
        for (String name : manifest.getRequiredCredentials()) {
            Duration remaining = Duration.between(Instant.now(clock), deadline);
            Duration wait = remaining.compareTo(CREDENTIAL_FETCH_CEILING) < 0 ? remaining : CREDENTIAL_FETCH_CEILING;
            if (wait.isNegative() || wait.isZero()) {
                throw new ToolExecutionException(ErrorCode.TIMEOUT, "No time left to fetch credential " + name);
            }
            try {
                SecretLease lease = credentialStore.getEphemeral(manifest.getToolId(), name, ttl)
                        .get(wait.toMillis(), TimeUnit.MILLISECONDS);
                secrets.put(name, lease);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ToolExecutionException(ErrorCode.CANCELLED, "Interrupted while fetching credentials", e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof ToolExecutionException toolException) {
                    throw toolException;
                }
                throw new ToolExecutionException(ErrorCode.EXECUTION_FAILED,
                        "Credential " + name + " is unavailable", e.getCause());
            } catch (TimeoutException e) {
                throw new ToolExecutionException(ErrorCode.EXECUTION_FAILED,
                        "Credential store did not answer for " + name + " within " + wait.toMillis() + " ms", e);
            }
        }
        return secrets;
    }

    private void complete(RunningExecution execution, ToolResult result) {
        if (execution.forced.get() != null) {
            return;
        }
        if (execution.cancelRequestedAt != null) {
            flushFinalCheckpoint(execution);
            finish(execution, InvocationStatus.CANCELLED, null,
                    ToolError.of(ErrorCode.CANCELLED, cancelMessage(execution.invocation.getCancelReason())));
            return;
        }
        if (result == null) {
            finish(execution, InvocationStatus.ERROR, null,
                    ToolError.of(ErrorCode.EXECUTION_FAILED, "Tool returned no result"));
            return;
        }
        if (!result.isSuccess()) {
            ErrorCode code = result.getErrorCode() != null ? result.getErrorCode() : ErrorCode.EXECUTION_FAILED;
            finish(execution, InvocationStatus.ERROR, null, ToolError.of(code,
                    result.getError() != null ? result.getError() : "Tool reported a failure", result.getDetails()));
            return;
        }

        Map<String, Object> output = result.getOutput() != null ? result.getOutput() : new LinkedHashMap<>();
        ValidationResult validation = resultValidator.validateOutput(output, execution.manifest.getOutputSchema());
        if (!validation.valid()) {
            log.warn("[Orchestrator] Output of {} failed validation: {}", execution.manifest.coordinates(),
                    validation.summary());
            finish(execution, InvocationStatus.ERROR, null, validation.toError("Tool output is invalid"));
            return;
        }
        finish(execution, InvocationStatus.SUCCESS, asMap(validation.value()), null);
    }

    private void onHandlerFailure(RunningExecution execution, ToolError error) {
        if (execution.forced.get() != null) {
            return;
        }
        if (execution.cancelRequestedAt != null) {
            flushFinalCheckpoint(execution);
            finish(execution, InvocationStatus.CANCELLED, null,
                    ToolError.of(ErrorCode.CANCELLED, cancelMessage(execution.invocation.getCancelReason())));
            return;
        }
        if (error.getCode() == ErrorCode.TIMEOUT) {
            flushFinalCheckpoint(execution);
            finish(execution, InvocationStatus.TIMEOUT, null, error);
            return;
        }
        finish(execution, InvocationStatus.ERROR, null, error);
    }

    // --- supervision ---

    /**
     * One supervision pass over local executions and, once per heartbeat
     * interval, over the persisted RUNNING records of every worker.
     */
    void supervise() {
        Instant now = Instant.now(clock);
        for (RunningExecution execution : running.values()) {
            try {
                superviseOne(execution, now);
            } catch (RuntimeException e) {
                log.warn("[Orchestrator] Supervision of {} failed: {}", execution.invocation.getInvocationId(),
                        e.getMessage());
            }
        }
        if (lastOrphanScanAt == null
                || Duration.between(lastOrphanScanAt, now).compareTo(settings.getHeartbeatInterval()) >= 0) {
            lastOrphanScanAt = now;
            reapOrphans(now);
        }
    }

    private void superviseSafely() {
        try {
            supervise();
        } catch (RuntimeException e) {
            log.warn("[Orchestrator] Supervision tick failed: {}", e.getMessage());
        }
    }

    private void superviseOne(RunningExecution execution, Instant now) {
        if (execution.context == null || execution.finished.get()) {
            return;
        }
        if (!now.isBefore(execution.deadline)) {
            Integer timeout = execution.invocation.getResourceLimits().getTimeoutSeconds();
            force(execution, InvocationStatus.TIMEOUT,
                    ToolError.of(ErrorCode.TIMEOUT, "Tool exceeded its timeout of " + timeout + "s"));
            return;
        }
        Instant cancelRequestedAt = execution.cancelRequestedAt;
        if (cancelRequestedAt != null && !now.isBefore(cancelRequestedAt.plus(settings.getCancelGracePeriod()))) {
            force(execution, InvocationStatus.CANCELLED, ToolError.of(ErrorCode.CANCELLED,
                    cancelMessage(execution.invocation.getCancelReason()) + " (grace period expired)"));
            return;
        }
        takeMicroCheckpoint(execution, now);
        renewLease(execution, now);
    }

    private void takeMicroCheckpoint(RunningExecution execution, Instant now) {
        Duration interval = microInterval(execution);
        if (interval == null || Duration.between(execution.lastMicroAt, now).compareTo(interval) < 0) {
            return;
        }
        execution.lastMicroAt = now;
        Map<String, Object> state = execution.context.getReportedState();
        if (state == null) {
            return;
        }
        checkpointManager.saveMicro(execution.invocation.getInvocationId(), state)
                .ifPresent(checkpoint -> onCheckpoint(execution, checkpoint, false));
    }

    private Duration microInterval(RunningExecution execution) {
        CheckpointConfig config = execution.invocation.getCheckpointConfig();
        boolean enabled = config != null ? config.isEnabled() : execution.manifest.isResumable();
        if (!enabled && !execution.manifest.isResumable()) {
            return null;
        }
        int seconds = config != null && config.getIntervalSeconds() > 0 ? config.getIntervalSeconds() : 30;
        return Duration.ofSeconds(seconds);
    }

    private void renewLease(RunningExecution execution, Instant now) {
        if (Duration.between(execution.lastHeartbeatAt, now).compareTo(settings.getHeartbeatInterval()) < 0) {
            return;
        }
        execution.lastHeartbeatAt = now;
        Invocation invocation = execution.invocation;
        Optional<Invocation> stored = invocationStore.get(invocation.getInvocationId());
        if (stored.isPresent() && (stored.get().isTerminal() || !ownerId.equals(stored.get().getOwnerId()))) {
            abandon(execution, stored.get());
            return;
        }
        if (stored.isPresent() && stored.get().isCancelRequested() && execution.cancelRequestedAt == null) {
            cancelLocal(execution, stored.get().getCancelReason());
        }

        Integer previousProgress;
        Integer progress;
        synchronized (execution) {
            if (execution.finished.get()) {
                return;
            }
            previousProgress = invocation.getProgressPercent();
            progress = execution.context.getProgressPercent();
            invocation.setProgressPercent(progress);
            invocation.setHeartbeatAt(now);
            invocation.setUpdatedAt(now);
            invocationStore.save(invocation);
        }
        if (progress != null && !progress.equals(previousProgress)) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("progress_percent", progress);
            auditService.emit(AuditEventType.PROGRESS, invocation, payload);
        }
    }

    private void reapOrphans(Instant now) {
        for (Invocation invocation : invocationStore.findByStatus(InvocationStatus.RUNNING)) {
            if (running.containsKey(invocation.getInvocationId()) || !isLeaseExpired(invocation, now)) {
                continue;
            }
            markWorkerLost(invocation);
        }
    }

    private boolean isLeaseExpired(Invocation invocation, Instant now) {
        Instant lease = invocation.getHeartbeatAt() != null ? invocation.getHeartbeatAt()
                : invocation.getUpdatedAt();
        return lease == null || Duration.between(lease, now).compareTo(settings.getOrphanAfter()) > 0;
    }

    private Invocation reclaimIfOrphaned(Invocation invocation) {
        if (invocation.getStatus() == InvocationStatus.RUNNING
                && !running.containsKey(invocation.getInvocationId())
                && isLeaseExpired(invocation, Instant.now(clock))) {
            markWorkerLost(invocation);
        }
        return invocation;
    }

    private void markWorkerLost(Invocation invocation) {
        invocation.setError(ToolError.of(ErrorCode.WORKER_LOST,
                "Worker " + invocation.getOwnerId() + " stopped renewing its lease at " + invocation.getHeartbeatAt()));
        if (!invocation.transitionTo(InvocationStatus.ERROR, clock)) {
            return;
        }
        invocationStore.save(invocation);
        auditService.emit(AuditEventType.COMPLETED, invocation);
        log.warn("[Orchestrator] {} lost its worker {}; marked worker_lost", invocation.getInvocationId(),
                invocation.getOwnerId());
    }

    // --- cancellation and forced termination ---

    private CancelResult cancelLocal(RunningExecution execution, String reason) {
        Invocation invocation = execution.invocation;
        boolean notStarted;
        synchronized (execution) {
            if (execution.finished.get()) {
                return CancelResult.rejected(CancelResult.ALREADY_COMPLETED);
            }
            if (execution.cancelRequestedAt != null) {
                return CancelResult.accepted("Cancellation already in progress");
            }
            execution.cancelRequestedAt = Instant.now(clock);
            invocation.setCancelRequested(true);
            invocation.setCancelReason(reason);
            notStarted = execution.context == null && execution.thread == null;
            if (execution.context != null) {
                execution.context.cancel();
            }
        }
        auditService.emit(AuditEventType.CANCEL_REQUESTED, invocation, reasonPayload(reason));
        if (notStarted) {
            finish(execution, InvocationStatus.CANCELLED, null,
                    ToolError.of(ErrorCode.CANCELLED, cancelMessage(reason)));
            return CancelResult.accepted("Cancelled before start");
        }
        log.info("[Orchestrator] Cancel requested for {}; grace period {}", invocation.getInvocationId(),
                settings.getCancelGracePeriod());
        return CancelResult.accepted("Cancellation requested");
    }

    private void force(RunningExecution execution, InvocationStatus status, ToolError error) {
        if (!execution.forced.compareAndSet(null, status)) {
            return;
        }
        flushFinalCheckpoint(execution);
        interruptWorker(execution);
        log.warn("[Orchestrator] Forcing {} to {}", execution.invocation.getInvocationId(), status.wireValue());
        finish(execution, status, null, error);
    }

    /**
     * Interrupts the worker while it still runs this execution. {@code run}
     * clears {@code thread} under the same monitor before the pooled thread
     * moves on, so the interrupt cannot reach another task.
     */
    private void interruptWorker(RunningExecution execution) {
        synchronized (execution) {
            if (execution.context != null) {
                execution.context.cancel();
            }
            if (execution.thread != null) {
                execution.thread.interrupt();
            }
        }
    }

    private void flushFinalCheckpoint(RunningExecution execution) {
        ToolExecutionContext context = execution.context;
        if (context == null || context.getReportedState() == null || !execution.manifest.isResumable()) {
            return;
        }
        checkpointManager.saveMicro(execution.invocation.getInvocationId(), context.getReportedState())
                .ifPresent(checkpoint -> onCheckpoint(execution, checkpoint, false));
    }

    private void onCheckpoint(RunningExecution execution, Checkpoint checkpoint, boolean durable) {
        Invocation invocation = execution.invocation;
        synchronized (execution) {
            invocation.setLatestCheckpointId(checkpoint.getCheckpointId());
            invocation.setCheckpointCount(invocation.getCheckpointCount() + 1);
        }
        if (durable) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("checkpoint_id", checkpoint.getCheckpointId());
            payload.put("type", checkpoint.getType().name().toLowerCase(Locale.ROOT));
            payload.put("sequence", checkpoint.getSequence());
            auditService.emit(AuditEventType.CHECKPOINT, invocation, payload);
        } else {
            log.debug("[Orchestrator] Micro checkpoint {} for {}", checkpoint.getCheckpointId(),
                    invocation.getInvocationId());
        }
    }

    // --- terminal bookkeeping ---

    private void finish(RunningExecution execution, InvocationStatus status, Map<String, Object> result,
            ToolError error) {
        if (!execution.finished.compareAndSet(false, true)) {
            return;
        }
        Invocation invocation = execution.invocation;
        // storage calls below fail on an interrupted thread
        boolean interrupted = Thread.interrupted();
        try {
            synchronized (execution) {
                invocation.setResult(result);
                invocation.setError(error);
                ToolExecutionContext context = execution.context;
                if (context != null) {
                    if (context.getProgressPercent() != null) {
                        invocation.setProgressPercent(context.getProgressPercent());
                    }
                    invocation.setDegraded(context.isDegraded());
                }
                if (!invocation.transitionTo(status, clock)) {
                    log.warn("[Orchestrator] {} cannot move from {} to {}", invocation.getInvocationId(),
                            invocation.getStatus(), status);
                }
            }
            teardown(execution);
            boolean retain = execution.manifest.isResumable()
                    && (status == InvocationStatus.ERROR || status == InvocationStatus.TIMEOUT
                            || status == InvocationStatus.CANCELLED);
            checkpointManager.release(invocation.getInvocationId(), retain);
            saveIfOwned(invocation);
            auditService.emit(AuditEventType.COMPLETED, invocation, completionPayload(invocation));
            log.info("[Orchestrator] {} finished: {}{}", invocation.getInvocationId(), status.wireValue(),
                    error != null ? " (" + error.getCode().wireValue() + ")" : "");
        } catch (RuntimeException e) {
            log.error("[Orchestrator] Terminal bookkeeping failed for {}", invocation.getInvocationId(), e);
        } finally {
            resourceAllocator.releaseSlot(invocation.agentId());
            running.remove(invocation.getInvocationId());
            execution.future.complete(snapshot(invocation));
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void abandon(RunningExecution execution, Invocation stored) {
        if (!execution.finished.compareAndSet(false, true)) {
            return;
        }
        log.warn("[Orchestrator] {} is owned by {} (status {}); stopping the local run",
                stored.getInvocationId(), stored.getOwnerId(), stored.getStatus());
        interruptWorker(execution);
        try {
            teardown(execution);
        } finally {
            resourceAllocator.releaseSlot(execution.invocation.agentId());
            running.remove(stored.getInvocationId());
            execution.future.complete(snapshot(stored));
        }
    }

    private void saveIfOwned(Invocation invocation) {
        Optional<Invocation> stored = invocationStore.get(invocation.getInvocationId());
        if (stored.isPresent() && stored.get().isTerminal()
                && stored.get().getStatus() != invocation.getStatus()) {
            log.warn("[Orchestrator] {} was already finalized as {} elsewhere; keeping it",
                    invocation.getInvocationId(), stored.get().getStatus());
            return;
        }
        invocationStore.save(invocation);
    }

    private void teardown(RunningExecution execution) {
        Sandbox sandbox = execution.sandbox;
        if (sandbox == null) {
            return;
        }
        try {
            sandboxProvisioner.teardown(sandbox);
        } catch (RuntimeException e) {
            log.warn("[Orchestrator] Sandbox teardown failed for {}: {}", sandbox.getSandboxId(), e.getMessage());
        }
    }

    // --- helpers ---

    Collection<String> runningInvocationIds() {
        return running.keySet();
    }

    String getOwnerId() {
        return ownerId;
    }

    private static Invocation snapshot(Invocation invocation) {
        return invocation.toBuilder().build();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        if (value instanceof Map<?, ?> map) {
            return new LinkedHashMap<>((Map<String, Object>) map);
        }
        Map<String, Object> wrapped = new LinkedHashMap<>();
        wrapped.put("value", value);
        return wrapped;
    }

    private static String cancelMessage(String reason) {
        return reason != null && !reason.isBlank() ? "Cancelled: " + reason : "Cancelled by caller";
    }

    private static Map<String, Object> reasonPayload(String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (reason != null) {
            payload.put("reason", reason);
        }
        return payload;
    }

    private static Map<String, Object> startPayload(Invocation invocation) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("attempt", invocation.getAttempt());
        payload.put("sandbox_id", invocation.getSandboxId());
        if (invocation.getResumedFrom() != null) {
            payload.put("resumed_from", invocation.getResumedFrom());
            payload.put("checkpoint_id", invocation.getResumeCheckpointId());
        }
        return payload;
    }

    private static Map<String, Object> completionPayload(Invocation invocation) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (invocation.getStartedAt() != null && invocation.getCompletedAt() != null) {
            payload.put("duration_ms", Duration.between(invocation.getStartedAt(), invocation.getCompletedAt())
                    .toMillis());
        }
        payload.put("checkpoint_count", invocation.getCheckpointCount());
        payload.put("degraded", invocation.isDegraded());
        return payload;
    }

    /**
     * A started attempt: its id is known before it completes.
     */
    public record Submission(String invocationId, CompletableFuture<Invocation> completion) {
    }

    /**
     * Mutable supervision state of one local execution. Fields written by both
     * the worker and the supervisor are guarded by the instance monitor.
     */
    static final class RunningExecution {
        final Invocation invocation;
        final ToolManifest manifest;
        final ToolHandler handler;
        final Map<String, Object> restoredState;
        final CompletableFuture<Invocation> future = new CompletableFuture<>();
        final AtomicBoolean finished = new AtomicBoolean();
        final AtomicReference<InvocationStatus> forced = new AtomicReference<>();

        volatile Thread thread;
        volatile ToolExecutionContext context;
        volatile Sandbox sandbox;
        volatile Instant deadline;
        volatile Instant cancelRequestedAt;
        volatile Instant lastMicroAt;
        volatile Instant lastHeartbeatAt;

        RunningExecution(Invocation invocation, ToolManifest manifest, ToolHandler handler,
                Map<String, Object> restoredState) {
            this.invocation = invocation;
            this.manifest = manifest;
            this.handler = handler;
            this.restoredState = restoredState;
        }
    }

    /**
     * Worker-pool task ordered by priority (higher first), then submission
     * order.
     */
    record PrioritizedTask(int priority, long sequence, Runnable body)
            implements Runnable, Comparable<PrioritizedTask> {

        @Override
        public void run() {
            body.run();
        }

        @Override
        public int compareTo(PrioritizedTask other) {
            int byPriority = Integer.compare(other.priority, priority);
            return byPriority != 0 ? byPriority : Long.compare(sequence, other.sequence);
        }
    }
}
