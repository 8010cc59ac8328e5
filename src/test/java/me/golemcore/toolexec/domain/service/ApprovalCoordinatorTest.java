package me.golemcore.toolexec.domain.service;

import me.golemcore.toolexec.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.toolexec.adapter.outbound.store.LocalInvocationStore;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.ApprovalDecision;
import me.golemcore.toolexec.domain.model.ApprovalRequest;
import me.golemcore.toolexec.domain.model.AuditEvent;
import me.golemcore.toolexec.domain.model.AuditEventType;
import me.golemcore.toolexec.domain.model.CallerIdentity;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.Invocation;
import me.golemcore.toolexec.domain.model.InvocationStatus;
import me.golemcore.toolexec.infrastructure.config.AutoConfiguration;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.ApprovalPort;
import me.golemcore.toolexec.port.outbound.AuditPort;
import me.golemcore.toolexec.security.ContentPolicy;
import me.golemcore.toolexec.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class ApprovalCoordinatorTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private LocalInvocationStore store;
    private ApprovalPort approvalPort;
    private AuditPort auditPort;
    private ApprovalCoordinator coordinator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        ToolExecProperties properties = new ToolExecProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        store = new LocalInvocationStore(storage, AutoConfiguration.objectMapper(), properties, clock);
        approvalPort = mock(ApprovalPort.class);
        auditPort = mock(AuditPort.class);
        coordinator = new ApprovalCoordinator(store, approvalPort,
                new AuditService(auditPort, new ContentPolicy(), clock), properties, clock);
    }

    @Test
    void shouldParkInvocationAtFirstTier() {
        Invocation invocation = coordinator.request(pending("inv-1"));

        assertEquals(InvocationStatus.PENDING_APPROVAL, invocation.getStatus());
        Invocation stored = store.get("inv-1").orElseThrow();
        assertEquals("primary", stored.getApproval().getTier());
        assertEquals(Instant.parse("2026-03-01T10:15:00Z"), stored.getApproval().getDeadline());

        ArgumentCaptor<ApprovalRequest> request = ArgumentCaptor.forClass(ApprovalRequest.class);
        verify(approvalPort).requestApproval(request.capture());
        assertEquals("primary", request.getValue().tier());
        assertEquals("agent-1", request.getValue().agentId());
        assertEquals(List.of(AuditEventType.APPROVAL_REQUESTED), auditTypes());
    }

    @Test
    void shouldEscalateThroughTiersThenCancelWithApprovalTimeout() {
        coordinator.request(pending("inv-1"));

        clock.advance(Duration.ofMinutes(14));
        assertEquals(0, coordinator.sweep());

        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, coordinator.sweep());
        Invocation afterFirst = store.get("inv-1").orElseThrow();
        assertEquals("manager", afterFirst.getApproval().getTier());
        assertEquals(1, afterFirst.getApproval().getEscalationLevel());
        assertEquals(InvocationStatus.PENDING_APPROVAL, afterFirst.getStatus());

        clock.advance(Duration.ofMinutes(30));
        coordinator.sweep();
        assertEquals("admin", store.get("inv-1").orElseThrow().getApproval().getTier());

        clock.advance(Duration.ofHours(1));
        coordinator.sweep();
        Invocation expired = store.get("inv-1").orElseThrow();
        assertEquals(InvocationStatus.CANCELLED, expired.getStatus());
        assertEquals(ErrorCode.APPROVAL_TIMEOUT, expired.getError().getCode());
        assertEquals(Instant.parse("2026-03-01T11:45:00Z"), expired.getCompletedAt());

        verify(approvalPort, times(3)).requestApproval(any());
        verify(approvalPort).withdraw("inv-1");
        assertEquals(List.of(AuditEventType.APPROVAL_REQUESTED, AuditEventType.APPROVAL_ESCALATED,
                AuditEventType.APPROVAL_ESCALATED, AuditEventType.COMPLETED), auditTypes());
    }

    @Test
    void shouldReturnInvocationToPendingWhenApproved() {
        coordinator.request(pending("inv-1"));

        Optional<Invocation> approved = coordinator.decide(new ApprovalDecision("inv-1", true, "lead", "ok"));

        assertTrue(approved.isPresent());
        assertEquals(InvocationStatus.PENDING, approved.get().getStatus());
        assertTrue(approved.get().getApproval().isGranted());
        assertEquals("lead", store.get("inv-1").orElseThrow().getApproval().getApprover());
        verify(approvalPort).withdraw("inv-1");
    }

    @Test
    void shouldCancelWithApprovalDeniedWhenRejected() {
        coordinator.request(pending("inv-1"));

        Optional<Invocation> result = coordinator.decide(new ApprovalDecision("inv-1", false, "lead", null));

        assertTrue(result.isEmpty());
        Invocation stored = store.get("inv-1").orElseThrow();
        assertEquals(InvocationStatus.CANCELLED, stored.getStatus());
        assertEquals(ErrorCode.APPROVAL_DENIED, stored.getError().getCode());
        assertTrue(stored.getError().getMessage().contains("lead"));
    }

    @Test
    void shouldIgnoreLateDecision() {
        coordinator.request(pending("inv-1"));
        coordinator.decide(new ApprovalDecision("inv-1", false, "lead", null));

        Optional<Invocation> late = coordinator.decide(new ApprovalDecision("inv-1", true, "admin", null));

        assertTrue(late.isEmpty());
        assertEquals(InvocationStatus.CANCELLED, store.get("inv-1").orElseThrow().getStatus());
    }

    @Test
    void shouldApplyOnlyOneOfTwoConcurrentApprovals() throws Exception {
        RendezvousInvocationStore racing = racingCoordinator();
        coordinator.request(pending("inv-1"));
        racing.arm();

        List<Optional<Invocation>> results = decideConcurrently(
                new ApprovalDecision("inv-1", true, "lead", null),
                new ApprovalDecision("inv-1", true, "admin", null));

        assertEquals(1, results.stream().filter(Optional::isPresent).count());
        assertEquals(InvocationStatus.PENDING, store.get("inv-1").orElseThrow().getStatus());
        assertEquals(1, auditTypes().stream().filter(AuditEventType.APPROVAL_DECIDED::equals).count());
    }

    @Test
    void shouldNotReopenInvocationDeniedConcurrentlyWithApproval() throws Exception {
        RendezvousInvocationStore racing = racingCoordinator();
        coordinator.request(pending("inv-1"));
        racing.arm();

        List<Optional<Invocation>> results = decideConcurrently(
                new ApprovalDecision("inv-1", false, "lead", null),
                new ApprovalDecision("inv-1", true, "admin", null));

        Invocation stored = store.get("inv-1").orElseThrow();
        if (results.get(1).isPresent()) {
            assertEquals(InvocationStatus.PENDING, stored.getStatus());
        } else {
            assertEquals(InvocationStatus.CANCELLED, stored.getStatus());
            assertEquals(ErrorCode.APPROVAL_DENIED, stored.getError().getCode());
        }
        assertEquals(1, auditTypes().stream().filter(AuditEventType.APPROVAL_DECIDED::equals).count());
    }

    @Test
    void shouldIgnoreApprovalAfterTimeoutExpiry() {
        coordinator.request(pending("inv-1"));
        clock.advance(Duration.ofMinutes(15));
        coordinator.sweep();
        clock.advance(Duration.ofMinutes(30));
        coordinator.sweep();
        clock.advance(Duration.ofHours(1));
        coordinator.sweep();

        Optional<Invocation> late = coordinator.decide(new ApprovalDecision("inv-1", true, "lead", null));

        assertTrue(late.isEmpty());
        Invocation stored = store.get("inv-1").orElseThrow();
        assertEquals(InvocationStatus.CANCELLED, stored.getStatus());
        assertEquals(ErrorCode.APPROVAL_TIMEOUT, stored.getError().getCode());
    }

    @Test
    void shouldRejectDecisionForUnknownInvocation() {
        ToolExecutionException ex = assertThrows(ToolExecutionException.class,
                () -> coordinator.decide(new ApprovalDecision("missing", true, "lead", null)));

        assertEquals(ErrorCode.INVOCATION_NOT_FOUND, ex.getCode());
    }

    @Test
    void shouldSurviveWithdrawFailure() {
        doThrow(new IllegalStateException("bus down")).when(approvalPort).withdraw("inv-1");
        coordinator.request(pending("inv-1"));

        coordinator.decide(new ApprovalDecision("inv-1", true, "lead", null));

        assertEquals(InvocationStatus.PENDING, store.get("inv-1").orElseThrow().getStatus());
    }

    @Test
    void shouldSeeWaitFromAnotherProcessAfterReload() {
        coordinator.request(pending("inv-1"));
        LocalInvocationStore reloaded = reloadStore();

        assertEquals(InvocationStatus.PENDING_APPROVAL, reloaded.get("inv-1").orElseThrow().getStatus());
        assertEquals(1, reloaded.findByStatus(InvocationStatus.PENDING_APPROVAL).size());
    }

    private RendezvousInvocationStore racingCoordinator() {
        ToolExecProperties properties = new ToolExecProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        RendezvousInvocationStore racing = new RendezvousInvocationStore(storage, properties, clock);
        store = racing;
        coordinator = new ApprovalCoordinator(racing, approvalPort,
                new AuditService(auditPort, new ContentPolicy(), clock), properties, clock);
        return racing;
    }

    private List<Optional<Invocation>> decideConcurrently(ApprovalDecision first, ApprovalDecision second)
            throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Optional<Invocation>> a = pool.submit(() -> coordinator.decide(first));
            Future<Optional<Invocation>> b = pool.submit(() -> coordinator.decide(second));
            return List.of(a.get(5, TimeUnit.SECONDS), b.get(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * Once armed, the first two reads wait for each other for a short while so
     * that two unserialized decisions would both see the waiting record.
     */
    private static final class RendezvousInvocationStore extends LocalInvocationStore {
        private volatile CountDownLatch rendezvous;

        RendezvousInvocationStore(LocalStorageAdapter storage, ToolExecProperties properties, MutableClock clock) {
            super(storage, AutoConfiguration.objectMapper(), properties, clock);
        }

        void arm() {
            rendezvous = new CountDownLatch(2);
        }

        @Override
        public Optional<Invocation> get(String invocationId) {
            CountDownLatch latch = rendezvous;
            if (latch != null && latch.getCount() > 0) {
                latch.countDown();
                try {
                    latch.await(300, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return super.get(invocationId);
        }
    }

    private LocalInvocationStore reloadStore() {
        ToolExecProperties properties = new ToolExecProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        LocalInvocationStore reloaded = new LocalInvocationStore(storage, AutoConfiguration.objectMapper(), properties, clock);
        reloaded.load();
        return reloaded;
    }

    private List<AuditEventType> auditTypes() {
        ArgumentCaptor<AuditEvent> events = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditPort, atLeastOnce()).publish(events.capture());
        return events.getAllValues().stream().map(AuditEvent::getType).toList();
    }

    private Invocation pending(String invocationId) {
        return Invocation.builder()
                .invocationId(invocationId)
                .toolId("deploy")
                .toolVersion("1.0.0")
                .caller(CallerIdentity.builder().agentId("agent-1").tenantId("acme").build())
                .parameters(Map.of("env", "prod"))
                .createdAt(clock.instant())
                .build();
    }
}
