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
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.ApprovalDecision;
import me.golemcore.toolexec.domain.model.ApprovalRequest;
import me.golemcore.toolexec.domain.model.ApprovalState;
import me.golemcore.toolexec.domain.model.AuditEventType;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.Invocation;
import me.golemcore.toolexec.domain.model.InvocationStatus;
import me.golemcore.toolexec.domain.model.ToolError;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.ApprovalPort;
import me.golemcore.toolexec.port.outbound.InvocationStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Human-approval waits with tiered escalation.
 *
 * <p>
 * The wait lives on the persisted invocation record, so a decision delivered
 * to any process finds it. A periodic sweep moves overdue requests up to the
 * next tier; once the last tier times out the invocation is cancelled with
 * {@code approval_timeout}.
 *
 * <p>
 * Decisions, escalations and cancellations of a stored invocation run under a
 * striped per-invocation lock and re-read the record inside it, so a
 * redelivered decision is applied once and a terminal record is never
 * reopened.
 */
@Service
@Slf4j
public class ApprovalCoordinator {

    private static final int LOCK_STRIPES = 64;

    private final InvocationStorePort invocationStore;
    private final ApprovalPort approvalPort;
    private final AuditService auditService;
    private final ToolExecProperties.ApprovalProperties config;
    private final Clock clock;
    private final Object[] lockStripes = new Object[LOCK_STRIPES];

    private ScheduledExecutorService scheduler;

    public ApprovalCoordinator(InvocationStorePort invocationStore, ApprovalPort approvalPort,
            AuditService auditService, ToolExecProperties properties, Clock clock) {
        this.invocationStore = invocationStore;
        this.approvalPort = approvalPort;
        this.auditService = auditService;
        this.config = properties.getApproval();
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            lockStripes[i] = new Object();
        }
    }

    @PostConstruct
    public void start() {
        long intervalMs = config.getSweepInterval().toMillis();
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "approval-escalation");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::sweepSafely, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    public void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
    }

    /**
     * Park a pending invocation until a human decides. The caller gets the
     * invocation back in {@code pending_approval}.
     */
    public Invocation request(Invocation invocation) {
        List<ToolExecProperties.TierProperties> tiers = config.getTiers();
        if (tiers.isEmpty()) {
            throw new ToolExecutionException(ErrorCode.INTERNAL_ERROR, "No approval tiers configured");
        }
        Instant now = Instant.now(clock);
        ToolExecProperties.TierProperties first = tiers.get(0);
        invocation.setApproval(ApprovalState.builder()
                .requestedAt(now)
                .tier(first.getName())
                .escalationLevel(0)
                .deadline(now.plus(first.getTimeout()))
                .build());
        if (!invocation.transitionTo(InvocationStatus.PENDING_APPROVAL, clock)) {
            throw new ToolExecutionException(ErrorCode.INTERNAL_ERROR,
                    "Cannot request approval from status " + invocation.getStatus());
        }
        invocationStore.save(invocation);
        approvalPort.requestApproval(toRequest(invocation));
        auditService.emit(AuditEventType.APPROVAL_REQUESTED, invocation, tierPayload(invocation.getApproval()));
        log.info("[Approval] {} awaits approval from tier '{}'", invocation.getInvocationId(), first.getName());
        return invocation;
    }

    /**
     * Apply a decision.
     *
     * @return the invocation, back in {@code pending} and ready to run, when
     *         approved; empty when denied or when the invocation no longer waits
     */
    public Optional<Invocation> decide(ApprovalDecision decision) {
        return withInvocationLock(decision.invocationId(), () -> applyDecision(decision));
    }

    /**
     * Run {@code action} while no decision, escalation or cancellation of the
     * same invocation is in progress.
     */
    public <T> T withInvocationLock(String invocationId, Supplier<T> action) {
        synchronized (lockStripes[Math.floorMod(invocationId.hashCode(), LOCK_STRIPES)]) {
            return action.get();
        }
    }

    private Optional<Invocation> applyDecision(ApprovalDecision decision) {
        Invocation invocation = invocationStore.get(decision.invocationId())
                .orElseThrow(() -> new ToolExecutionException(ErrorCode.INVOCATION_NOT_FOUND,
                        "Invocation " + decision.invocationId() + " not found"));
        if (invocation.getStatus() != InvocationStatus.PENDING_APPROVAL) {
            log.info("[Approval] Ignoring decision for {} in status {}", invocation.getInvocationId(),
                    invocation.getStatus());
            return Optional.empty();
        }

        ApprovalState approval = invocation.getApproval() != null ? invocation.getApproval()
                : ApprovalState.builder().build();
        invocation.setApproval(approval.toBuilder()
                .granted(decision.approved())
                .approver(decision.approver())
                .decidedAt(Instant.now(clock))
                .build());

        Map<String, Object> payload = tierPayload(invocation.getApproval());
        payload.put("approved", decision.approved());
        payload.put("approver", decision.approver());
        if (decision.comment() != null) {
            payload.put("comment", decision.comment());
        }

        if (decision.approved()) {
            invocation.transitionTo(InvocationStatus.PENDING, clock);
            invocationStore.save(invocation);
            withdrawQuietly(invocation.getInvocationId());
            auditService.emit(AuditEventType.APPROVAL_DECIDED, invocation, payload);
            log.info("[Approval] {} approved by {}", invocation.getInvocationId(), decision.approver());
            return Optional.of(invocation);
        }

        invocation.setError(ToolError.of(ErrorCode.APPROVAL_DENIED,
                "Approval denied" + (decision.approver() != null ? " by " + decision.approver() : "")));
        invocation.transitionTo(InvocationStatus.CANCELLED, clock);
        invocationStore.save(invocation);
        withdrawQuietly(invocation.getInvocationId());
        auditService.emit(AuditEventType.APPROVAL_DECIDED, invocation, payload);
        auditService.emit(AuditEventType.COMPLETED, invocation);
        log.info("[Approval] {} denied by {}", invocation.getInvocationId(), decision.approver());
        return Optional.empty();
    }

    /**
     * Escalate or expire every overdue approval wait.
     *
     * @return number of invocations touched
     */
    public int sweep() {
        Instant now = Instant.now(clock);
        int touched = 0;
        for (Invocation candidate : invocationStore.findByStatus(InvocationStatus.PENDING_APPROVAL)) {
            if (withInvocationLock(candidate.getInvocationId(), () -> sweepOne(candidate.getInvocationId(), now))) {
                touched++;
            }
        }
        return touched;
    }

    private boolean sweepOne(String invocationId, Instant now) {
        Invocation invocation = invocationStore.get(invocationId).orElse(null);
        if (invocation == null || invocation.getStatus() != InvocationStatus.PENDING_APPROVAL) {
            return false;
        }
        ApprovalState approval = invocation.getApproval();
        if (approval == null || approval.getDeadline() == null || now.isBefore(approval.getDeadline())) {
            return false;
        }
        int nextLevel = approval.getEscalationLevel() + 1;
        if (nextLevel < config.getTiers().size()) {
            escalate(invocation, nextLevel, now);
        } else {
            expire(invocation);
        }
        return true;
    }

    private void escalate(Invocation invocation, int level, Instant now) {
        ToolExecProperties.TierProperties tier = config.getTiers().get(level);
        invocation.setApproval(invocation.getApproval().toBuilder()
                .escalationLevel(level)
                .tier(tier.getName())
                .deadline(now.plus(tier.getTimeout()))
                .build());
        invocation.setUpdatedAt(now);
        invocationStore.save(invocation);
        approvalPort.requestApproval(toRequest(invocation));
        auditService.emit(AuditEventType.APPROVAL_ESCALATED, invocation, tierPayload(invocation.getApproval()));
        log.info("[Approval] {} escalated to tier '{}'", invocation.getInvocationId(), tier.getName());
    }

    private void expire(Invocation invocation) {
        invocation.setError(ToolError.of(ErrorCode.APPROVAL_TIMEOUT,
                "No approval decision before the last escalation tier timed out"));
        invocation.transitionTo(InvocationStatus.CANCELLED, clock);
        invocationStore.save(invocation);
        withdrawQuietly(invocation.getInvocationId());
        auditService.emit(AuditEventType.COMPLETED, invocation);
        log.info("[Approval] {} cancelled: approval timed out", invocation.getInvocationId());
    }

    /**
     * Withdraw the outstanding request of an invocation that stopped waiting.
     */
    public void withdraw(String invocationId) {
        withdrawQuietly(invocationId);
    }

    private void sweepSafely() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.warn("[Approval] Escalation sweep failed: {}", e.getMessage());
        }
    }

    private void withdrawQuietly(String invocationId) {
        try {
            approvalPort.withdraw(invocationId);
        } catch (RuntimeException e) {
            log.debug("[Approval] Withdraw failed for {}: {}", invocationId, e.getMessage());
        }
    }

    private static ApprovalRequest toRequest(Invocation invocation) {
        ApprovalState approval = invocation.getApproval();
        return new ApprovalRequest(invocation.getInvocationId(), invocation.getToolId(),
                invocation.getToolVersion(), invocation.agentId(), invocation.tenantId(), approval.getTier(),
                approval.getEscalationLevel(), approval.getDeadline(), invocation.getParameters());
    }

    private static Map<String, Object> tierPayload(ApprovalState approval) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("tier", approval.getTier());
        payload.put("escalation_level", approval.getEscalationLevel());
        if (approval.getDeadline() != null) {
            payload.put("deadline", approval.getDeadline().toString());
        }
        return payload;
    }
}
