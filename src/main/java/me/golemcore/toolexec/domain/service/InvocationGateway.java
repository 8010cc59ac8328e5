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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.checkpoint.CheckpointManager;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.ApprovalDecision;
import me.golemcore.toolexec.domain.model.AuditEventType;
import me.golemcore.toolexec.domain.model.CallerIdentity;
import me.golemcore.toolexec.domain.model.CancelResult;
import me.golemcore.toolexec.domain.model.CapabilityCredential;
import me.golemcore.toolexec.domain.model.Checkpoint;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.ExecutionMetadata;
import me.golemcore.toolexec.domain.model.ExecutionOptions;
import me.golemcore.toolexec.domain.model.Invocation;
import me.golemcore.toolexec.domain.model.InvocationRequest;
import me.golemcore.toolexec.domain.model.InvocationResponse;
import me.golemcore.toolexec.domain.model.InvocationStatus;
import me.golemcore.toolexec.domain.model.InvocationStatusView;
import me.golemcore.toolexec.domain.model.PermissionDecision;
import me.golemcore.toolexec.domain.model.ToolError;
import me.golemcore.toolexec.domain.model.ToolFilter;
import me.golemcore.toolexec.domain.model.ToolLifecycleState;
import me.golemcore.toolexec.domain.model.ToolManifest;
import me.golemcore.toolexec.domain.model.ToolPage;
import me.golemcore.toolexec.domain.model.ValidationResult;
import me.golemcore.toolexec.domain.model.VersionRange;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.InvocationStorePort;
import me.golemcore.toolexec.port.outbound.ToolRegistryPort;
import me.golemcore.toolexec.security.CapabilityTokenVerifier;
import me.golemcore.toolexec.security.PermissionChecker;
import me.golemcore.toolexec.validation.ResultValidator;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the control plane: invoke, list, status, cancel, resume and
 * the approval callback.
 *
 * <p>
 * Requests that fail before a tool is resolved (unknown tool or version,
 * malformed request) are answered with an error and leave nothing behind.
 * From the moment the manifest is known every request is persisted as an
 * invocation, including the ones denied by the permission checker or by
 * input validation, so {@code status} can explain them later.
 */
@Service
@Slf4j
public class InvocationGateway {

    static final String POLL_URL_TEMPLATE = "/api/invocations/%s";

    private final ToolRegistryPort registry;
    private final PermissionChecker permissionChecker;
    private final CapabilityTokenVerifier tokenVerifier;
    private final ResultValidator resultValidator;
    private final InvocationStorePort invocationStore;
    private final ExecutionOrchestrator orchestrator;
    private final ApprovalCoordinator approvalCoordinator;
    private final CheckpointManager checkpointManager;
    private final AuditService auditService;
    private final ToolExecProperties properties;
    private final Clock clock;

    @SuppressWarnings("PMD.ExcessiveParameterList")
    public InvocationGateway(ToolRegistryPort registry, PermissionChecker permissionChecker,
            CapabilityTokenVerifier tokenVerifier, ResultValidator resultValidator,
            InvocationStorePort invocationStore, ExecutionOrchestrator orchestrator,
            ApprovalCoordinator approvalCoordinator, CheckpointManager checkpointManager, AuditService auditService,
            ToolExecProperties properties, Clock clock) {
        this.registry = registry;
        this.permissionChecker = permissionChecker;
        this.tokenVerifier = tokenVerifier;
        this.resultValidator = resultValidator;
        this.invocationStore = invocationStore;
        this.orchestrator = orchestrator;
        this.approvalCoordinator = approvalCoordinator;
        this.checkpointManager = checkpointManager;
        this.auditService = auditService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Admit and run a tool invocation. In async mode the returned future is
     * already complete and carries polling metadata; otherwise it completes
     * when the invocation reaches a terminal status (or waits for approval).
     */
    public CompletableFuture<InvocationResponse> invoke(InvocationRequest request) {
        String invocationId = request.getInvocationId() != null ? request.getInvocationId()
                : UUID.randomUUID().toString();
        try {
            if (request.getToolId() == null || request.getToolId().isBlank() || request.getCaller() == null) {
                return completed(errorResponse(invocationId,
                        ToolError.of(ErrorCode.VALIDATION_FAILED, "tool_id and caller identity are required")));
            }

            Optional<Invocation> existing = findExisting(request);
            if (existing.isPresent()) {
                log.info("[Gateway] Returning existing invocation {} for repeated request",
                        existing.get().getInvocationId());
                return completed(toResponse(existing.get(), null, false));
            }

            ToolManifest manifest = resolveManifest(request.getToolId(), request.getToolVersion());
            Invocation invocation = Invocation.builder()
                    .invocationId(invocationId)
                    .toolId(manifest.getToolId())
                    .toolVersion(manifest.getVersion())
                    .caller(request.getCaller())
                    .parameters(request.getParameters() != null ? request.getParameters() : new LinkedHashMap<>())
                    .resourceLimits(request.getResourceLimits())
                    .checkpointConfig(request.getCheckpointConfig())
                    .executionOptions(request.getExecutionOptions() != null ? request.getExecutionOptions()
                            : ExecutionOptions.builder().build())
                    .createdAt(Instant.now(clock))
                    .updatedAt(Instant.now(clock))
                    .build();

            PermissionDecision decision = permissionChecker.check(request.getCaller(), manifest,
                    request.getContext(), properties.getSecurity().getOracle().getTimeout());
            if (!decision.isAllowed()) {
                invocation.setError(decision.toError());
                invocation.transitionTo(InvocationStatus.PERMISSION_DENIED, clock);
                invocationStore.save(invocation);
                auditService.emit(AuditEventType.PERMISSION_DENIED, invocation, reasonPayload(decision.getReason()));
                auditService.emit(AuditEventType.COMPLETED, invocation);
                return completed(toResponse(invocation, manifest, false));
            }

            ValidationResult validation = resultValidator.validateInput(invocation.getParameters(),
                    manifest.getInputSchema());
            if (!validation.valid()) {
                invocation.setError(validation.toError("Invalid parameters"));
                invocation.transitionTo(InvocationStatus.ERROR, clock);
                invocationStore.save(invocation);
                auditService.emit(AuditEventType.INVOKED, invocation);
                auditService.emit(AuditEventType.COMPLETED, invocation);
                return completed(toResponse(invocation, manifest, false));
            }
            invocation.setParameters(asMap(validation.value()));

            invocationStore.save(invocation);
            auditService.emit(AuditEventType.INVOKED, invocation, invokedPayload(invocation));
            log.info("[Gateway] {} invokes {} as {}", invocation.agentId(), manifest.coordinates(), invocationId);

            CompletableFuture<Invocation> execution = orchestrator.execute(invocation, manifest);
            return respond(invocationId, manifest, execution, invocation.getExecutionOptions().isAsyncMode());
        } catch (ToolExecutionException e) {
            return completed(errorResponse(invocationId, e.toError()));
        } catch (RuntimeException e) {
            log.error("[Gateway] Failed to admit {}", invocationId, e);
            return completed(errorResponse(invocationId,
                    ToolError.of(ErrorCode.INTERNAL_ERROR, "Internal error while admitting the invocation")));
        }
    }

    /**
     * Tools visible to the caller. Never fails: a backing failure yields an
     * empty page.
     */
    public ToolPage list(CallerIdentity caller, ToolFilter filter) {
        ToolFilter effective = filter != null ? filter : ToolFilter.builder().build();
        int offset = Math.max(0, effective.getOffset());
        int limit = effective.getLimit() > 0 ? effective.getLimit() : 50;
        try {
            CapabilityCredential capability = effective.isGrantedOnly() ? verifyQuietly(caller) : null;
            if (effective.isGrantedOnly() && capability == null) {
                return ToolPage.empty(offset, limit);
            }
            List<ToolManifest> matches = registry.listLatest().stream()
                    .filter(manifest -> manifest.getLifecycleState().isInvocable())
                    .filter(manifest -> effective.isIncludeDeprecated()
                            || manifest.getLifecycleState() != ToolLifecycleState.DEPRECATED)
                    .filter(manifest -> effective.getProtocol() == null || manifest.getBinding() != null
                            && manifest.getBinding().protocol() == effective.getProtocol())
                    .filter(manifest -> matchesQuery(manifest, effective.getQuery()))
                    .filter(manifest -> capability == null
                            || capability.grants(manifest.getToolId(), manifest.getVersion()))
                    .toList();
            List<ToolPage.ToolSummary> page = matches.stream()
                    .skip(offset)
                    .limit(limit)
                    .map(InvocationGateway::toSummary)
                    .toList();
            Integer nextOffset = offset + page.size() < matches.size() ? offset + page.size() : null;
            return new ToolPage(page, new ToolPage.Pagination(offset, limit, matches.size(), nextOffset));
        } catch (RuntimeException e) {
            log.warn("[Gateway] Tool listing failed, returning an empty page: {}", e.getMessage());
            return ToolPage.empty(offset, limit);
        }
    }

    public InvocationStatusView status(String invocationId, CallerIdentity caller) {
        Invocation invocation = orchestrator.liveView(invocationId)
                .or(() -> invocationStore.get(invocationId))
                .filter(found -> visibleTo(found, caller))
                .orElseThrow(() -> notFound(invocationId));
        return InvocationStatusView.builder()
                .invocationId(invocation.getInvocationId())
                .status(invocation.getStatus())
                .progressPercent(invocation.getProgressPercent())
                .latestCheckpoint(latestCheckpoint(invocation.getInvocationId()))
                .error(invocation.getError())
                .updatedAt(invocation.getUpdatedAt())
                .build();
    }

    /**
     * Idempotent: unknown and already finished invocations are reported with
     * {@code cancelled=false} and nothing is changed.
     */
    public CancelResult cancel(String invocationId, CallerIdentity caller, String reason) {
        Optional<Invocation> invocation = invocationStore.get(invocationId);
        if (invocation.isPresent() && !visibleTo(invocation.get(), caller)
                || invocation.isEmpty() && !orchestrator.isRunningLocally(invocationId)) {
            return CancelResult.rejected("Invocation " + invocationId + " not found");
        }
        if (invocation.isPresent() && invocation.get().isTerminal()) {
            return CancelResult.rejected(CancelResult.ALREADY_COMPLETED);
        }
        CancelResult result = orchestrator.requestCancel(invocationId, reason);
        log.info("[Gateway] Cancel {} by {}: {}", invocationId, caller != null ? caller.getAgentId() : null,
                result.message());
        return result;
    }

    /**
     * Start a new attempt of a failed, timed out, cancelled or orphaned
     * invocation from one of its checkpoints. The caller is authorized again.
     */
    public CompletableFuture<InvocationResponse> resume(String invocationId, CallerIdentity caller,
            String checkpointId) {
        try {
            Invocation original = invocationStore.get(invocationId)
                    .filter(found -> visibleTo(found, caller))
                    .orElseThrow(() -> notFound(invocationId));
            ToolManifest manifest = registry.getVersion(original.getToolId(), original.getToolVersion())
                    .orElseThrow(() -> new ToolExecutionException(ErrorCode.VERSION_NOT_FOUND,
                            "Tool " + original.getToolId() + "@" + original.getToolVersion() + " is gone"));

            CallerIdentity effectiveCaller = caller != null ? caller : original.getCaller();
            PermissionDecision decision = permissionChecker.check(effectiveCaller, manifest, Map.of(),
                    properties.getSecurity().getOracle().getTimeout());
            if (!decision.isAllowed()) {
                return completed(InvocationResponse.builder()
                        .invocationId(invocationId)
                        .status(InvocationStatus.PERMISSION_DENIED)
                        .error(decision.toError())
                        .build());
            }
            if (caller != null && caller.getCapabilityToken() != null) {
                original.setCaller(original.getCaller() != null
                        ? original.getCaller().toBuilder().capabilityToken(caller.getCapabilityToken()).build()
                        : caller);
            }

            ExecutionOrchestrator.Submission submission = orchestrator.resume(original, manifest, checkpointId);
            boolean async = original.getExecutionOptions() != null && original.getExecutionOptions().isAsyncMode();
            return respond(submission.invocationId(), manifest, submission.completion(), async);
        } catch (ToolExecutionException e) {
            return completed(errorResponse(invocationId, e.toError()));
        } catch (RuntimeException e) {
            log.error("[Gateway] Failed to resume {}", invocationId, e);
            return completed(errorResponse(invocationId,
                    ToolError.of(ErrorCode.INTERNAL_ERROR, "Internal error while resuming the invocation")));
        }
    }

    /**
     * Approval callback. An approved invocation is handed to the orchestrator
     * and the current state returned without waiting for the tool.
     */
    public InvocationResponse onApprovalDecision(ApprovalDecision decision) {
        Optional<Invocation> approved = approvalCoordinator.decide(decision);
        if (approved.isEmpty()) {
            return invocationStore.get(decision.invocationId())
                    .map(invocation -> toResponse(invocation, null, false))
                    .orElseThrow(() -> notFound(decision.invocationId()));
        }
        Invocation invocation = approved.get();
        Optional<ToolManifest> manifest = registry.getVersion(invocation.getToolId(), invocation.getToolVersion());
        if (manifest.isEmpty() || !manifest.get().getLifecycleState().isInvocable()) {
            invocation.setError(ToolError.of(ErrorCode.TOOL_UNAVAILABLE,
                    "Tool " + invocation.getToolId() + "@" + invocation.getToolVersion() + " is no longer invocable"));
            invocation.transitionTo(InvocationStatus.ERROR, clock);
            invocationStore.save(invocation);
            auditService.emit(AuditEventType.COMPLETED, invocation);
            return toResponse(invocation, null, false);
        }
        CompletableFuture<Invocation> execution = orchestrator.execute(invocation, manifest.get());
        Invocation current = execution.isDone() ? execution.join()
                : invocationStore.get(invocation.getInvocationId()).orElse(invocation);
        return toResponse(current, manifest.get(), true);
    }

    // --- helpers ---

    private Optional<Invocation> findExisting(InvocationRequest request) {
        ExecutionOptions options = request.getExecutionOptions();
        if (options != null && options.getIdempotencyKey() != null && !options.getIdempotencyKey().isBlank()) {
            Optional<Invocation> byKey = invocationStore.findByIdempotencyKey(request.getCaller().getTenantId(),
                    options.getIdempotencyKey());
            if (byKey.isPresent()) {
                return byKey;
            }
        }
        if (request.getInvocationId() != null) {
            Optional<Invocation> byId = invocationStore.get(request.getInvocationId());
            if (byId.isPresent() && !visibleTo(byId.get(), request.getCaller())) {
                log.warn("[Gateway] Invocation id {} requested by tenant {} belongs to another tenant",
                        request.getInvocationId(), request.getCaller().getTenantId());
                throw new ToolExecutionException(ErrorCode.INVOCATION_CONFLICT,
                        "Invocation id " + request.getInvocationId() + " is already in use");
            }
            return byId;
        }
        return Optional.empty();
    }

    private ToolManifest resolveManifest(String toolId, String requestedVersion) {
        Optional<ToolManifest> manifest = Optional.empty();
        if (requestedVersion != null && VersionRange.isExact(requestedVersion)) {
            manifest = registry.getVersion(toolId, requestedVersion);
        } else {
            try {
                manifest = registry.resolveRange(toolId, requestedVersion)
                        .flatMap(version -> registry.getVersion(toolId, version));
            } catch (IllegalArgumentException e) {
                throw new ToolExecutionException(ErrorCode.VALIDATION_FAILED,
                        "Invalid version range '" + requestedVersion + "': " + e.getMessage(), e);
            }
        }
        if (manifest.isEmpty()) {
            boolean known = registry.listLatest().stream().anyMatch(candidate -> toolId.equals(candidate.getToolId()));
            if (!known) {
                throw new ToolExecutionException(ErrorCode.TOOL_NOT_FOUND, "Tool " + toolId + " not found");
            }
            throw new ToolExecutionException(ErrorCode.VERSION_NOT_FOUND,
                    "No version of " + toolId + " matches " + (requestedVersion != null ? requestedVersion : "*"));
        }
        ToolManifest resolved = manifest.get();
        if (!resolved.getLifecycleState().isInvocable()) {
            throw new ToolExecutionException(ErrorCode.TOOL_UNAVAILABLE, "Tool " + resolved.coordinates() + " is "
                    + resolved.getLifecycleState().name().toLowerCase(Locale.ROOT));
        }
        return resolved;
    }

    private CompletableFuture<InvocationResponse> respond(String invocationId, ToolManifest manifest,
            CompletableFuture<Invocation> execution, boolean async) {
        if (!async || execution.isDone()) {
            return execution.thenApply(invocation -> toResponse(invocation, manifest, async));
        }
        Invocation current = orchestrator.liveView(invocationId)
                .or(() -> invocationStore.get(invocationId))
                .orElseThrow(() -> notFound(invocationId));
        return completed(toResponse(current, manifest, true));
    }

    InvocationResponse toResponse(Invocation invocation, ToolManifest manifest, boolean withPolling) {
        ExecutionMetadata.ExecutionMetadataBuilder metadata = ExecutionMetadata.builder()
                .attempt(invocation.getAttempt())
                .sandboxId(invocation.getSandboxId())
                .checkpointCount(invocation.getCheckpointCount())
                .latestCheckpointId(invocation.getLatestCheckpointId())
                .resumedFrom(invocation.getResumedFrom())
                .degraded(invocation.isDegraded())
                .deprecatedTool(manifest != null && manifest.getLifecycleState() == ToolLifecycleState.DEPRECATED);
        if (invocation.getStartedAt() != null && invocation.getCompletedAt() != null) {
            metadata.durationMs(Duration.between(invocation.getStartedAt(), invocation.getCompletedAt()).toMillis());
        }
        if (withPolling && !invocation.isTerminal()) {
            metadata.pollUrl(String.format(POLL_URL_TEMPLATE, invocation.getInvocationId()))
                    .pollIntervalMs(properties.getExecution().getPollInterval().toMillis());
        }
        return InvocationResponse.builder()
                .invocationId(invocation.getInvocationId())
                .status(invocation.getStatus())
                .result(invocation.getResult())
                .error(invocation.getError())
                .executionMetadata(metadata.build())
                .build();
    }

    private InvocationStatusView.CheckpointSummary latestCheckpoint(String invocationId) {
        try {
            return checkpointManager.latest(invocationId)
                    .map(InvocationGateway::toSummary)
                    .orElse(null);
        } catch (RuntimeException e) {
            log.debug("[Gateway] Checkpoint lookup failed for {}: {}", invocationId, e.getMessage());
            return null;
        }
    }

    private CapabilityCredential verifyQuietly(CallerIdentity caller) {
        if (caller == null || caller.getCapabilityToken() == null) {
            return null;
        }
        try {
            return tokenVerifier.verify(caller.getCapabilityToken());
        } catch (ToolExecutionException e) {
            log.debug("[Gateway] Ignoring invalid credential for listing: {}", e.getMessage());
            return null;
        }
    }

    /**
     * Tenants only see their own invocations; a caller without a tenant only
     * sees invocations created without one.
     */
    private static boolean visibleTo(Invocation invocation, CallerIdentity caller) {
        String callerTenant = caller != null ? caller.getTenantId() : null;
        return Objects.equals(callerTenant, invocation.tenantId());
    }

    private static boolean matchesQuery(ToolManifest manifest, String query) {
        if (query == null || query.isBlank()) {
            return true;
        }
        String needle = query.toLowerCase(Locale.ROOT);
        return manifest.getToolId().toLowerCase(Locale.ROOT).contains(needle)
                || manifest.getDescription() != null
                        && manifest.getDescription().toLowerCase(Locale.ROOT).contains(needle);
    }

    private static ToolPage.ToolSummary toSummary(ToolManifest manifest) {
        return new ToolPage.ToolSummary(manifest.getToolId(), manifest.getVersion(), manifest.getDescription(),
                manifest.getBinding() != null ? manifest.getBinding().protocol() : null,
                manifest.getLifecycleState(), manifest.isRequiresApproval());
    }

    private static InvocationStatusView.CheckpointSummary toSummary(Checkpoint checkpoint) {
        return new InvocationStatusView.CheckpointSummary(checkpoint.getCheckpointId(), checkpoint.getType(),
                checkpoint.getSequence(), checkpoint.getLabel(), checkpoint.getCreatedAt());
    }

    private static ToolExecutionException notFound(String invocationId) {
        return new ToolExecutionException(ErrorCode.INVOCATION_NOT_FOUND, "Invocation " + invocationId + " not found");
    }

    private static InvocationResponse errorResponse(String invocationId, ToolError error) {
        return InvocationResponse.builder()
                .invocationId(invocationId)
                .status(InvocationStatus.ERROR)
                .error(error)
                .build();
    }

    private static CompletableFuture<InvocationResponse> completed(InvocationResponse response) {
        return CompletableFuture.completedFuture(response);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> map ? new LinkedHashMap<>((Map<String, Object>) map)
                : new LinkedHashMap<>();
    }

    private static Map<String, Object> reasonPayload(String reason) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reason", reason);
        return payload;
    }

    private static Map<String, Object> invokedPayload(Invocation invocation) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("parameters", invocation.getParameters());
        payload.put("priority", invocation.getExecutionOptions().getPriority());
        payload.put("async", invocation.getExecutionOptions().isAsyncMode());
        return payload;
    }
}
