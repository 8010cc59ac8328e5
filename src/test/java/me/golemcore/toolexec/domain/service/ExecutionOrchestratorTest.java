package me.golemcore.toolexec.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolexec.adapter.outbound.credentials.PropertiesCredentialStoreAdapter;
import me.golemcore.toolexec.adapter.outbound.sandbox.WorkspaceSandboxProvisioner;
import me.golemcore.toolexec.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.toolexec.adapter.outbound.store.InMemoryCircuitStateStore;
import me.golemcore.toolexec.adapter.outbound.store.InMemoryMicroCheckpointStore;
import me.golemcore.toolexec.adapter.outbound.store.LocalInvocationStore;
import me.golemcore.toolexec.adapter.outbound.store.StorageCheckpointStore;
import me.golemcore.toolexec.bridge.DocumentContextService;
import me.golemcore.toolexec.checkpoint.CheckpointCodec;
import me.golemcore.toolexec.checkpoint.CheckpointManager;
import me.golemcore.toolexec.circuit.CircuitBreakerService;
import me.golemcore.toolexec.domain.component.NativeTool;
import me.golemcore.toolexec.domain.component.ToolExecutionContext;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.ApprovalDecision;
import me.golemcore.toolexec.domain.model.AuditEvent;
import me.golemcore.toolexec.domain.model.AuditEventType;
import me.golemcore.toolexec.domain.model.CallerIdentity;
import me.golemcore.toolexec.domain.model.CancelResult;
import me.golemcore.toolexec.domain.model.CheckpointConfig;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.ExecutionOptions;
import me.golemcore.toolexec.domain.model.Invocation;
import me.golemcore.toolexec.domain.model.InvocationStatus;
import me.golemcore.toolexec.domain.model.ProtocolBinding;
import me.golemcore.toolexec.domain.model.ResourceLimits;
import me.golemcore.toolexec.domain.model.ToolManifest;
import me.golemcore.toolexec.domain.model.ToolResult;
import me.golemcore.toolexec.infrastructure.config.AutoConfiguration;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.infrastructure.event.SpringEventBus;
import me.golemcore.toolexec.port.outbound.ApprovalPort;
import me.golemcore.toolexec.port.outbound.AuditPort;
import me.golemcore.toolexec.ratelimit.TokenBucketRateLimiter;
import me.golemcore.toolexec.security.ContentPolicy;
import me.golemcore.toolexec.security.InjectionGuard;
import me.golemcore.toolexec.security.InputSanitizer;
import me.golemcore.toolexec.testsupport.MutableClock;
import me.golemcore.toolexec.tools.EchoTool;
import me.golemcore.toolexec.tools.NativeToolHandler;
import me.golemcore.toolexec.tools.StepCounterTool;
import me.golemcore.toolexec.validation.ResultValidator;
import me.golemcore.toolexec.validation.SchemaValidator;
import me.golemcore.toolexec.validation.TypeCoercer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ExecutionOrchestratorTest {

    private static final long WAIT_SECONDS = 5;
    private static final String STATE_KEY = "completed_steps";

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private ToolExecProperties properties;
    private ObjectMapper objectMapper;
    private LocalStorageAdapter storage;
    private LocalInvocationStore invocationStore;
    private InMemoryMicroCheckpointStore microStore;
    private ApprovalPort approvalPort;
    private AuditPort auditPort;
    private final List<Node> nodes = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        properties = new ToolExecProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        objectMapper = AutoConfiguration.objectMapper();
        storage = new LocalStorageAdapter(properties);
        storage.init();
        invocationStore = new LocalInvocationStore(storage, objectMapper, properties, clock);
        microStore = new InMemoryMicroCheckpointStore();
        approvalPort = mock(ApprovalPort.class);
        auditPort = mock(AuditPort.class);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        for (Node node : nodes) {
            node.orchestrator.stop();
            node.pool.shutdownNow();
        }
        for (Node node : nodes) {
            node.pool.awaitTermination(WAIT_SECONDS, TimeUnit.SECONDS);
        }
        // storage writes run on the common pool and must land before the temp dir goes
        ForkJoinPool.commonPool().awaitQuiescence(WAIT_SECONDS, TimeUnit.SECONDS);
    }

    // ===== Happy path =====

    @Test
    void shouldRunEchoToSuccess() throws Exception {
        Node node = node(new EchoTool());
        Invocation invocation = invocation("echo", Map.of("message", "hello"), null);

        Invocation done = node.orchestrator.execute(invocation, echoManifest()).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals(InvocationStatus.SUCCESS, done.getStatus());
        assertEquals(Map.of("echoed", "hello"), done.getResult());
        assertNotNull(done.getStartedAt());
        assertNotNull(done.getCompletedAt());
        assertNotNull(done.getSandboxId());
        assertEquals(InvocationStatus.SUCCESS, invocationStore.get(done.getInvocationId()).orElseThrow().getStatus());
        assertEquals(0, node.allocator.activeSlots("agent-1"));
        assertFalse(node.orchestrator.isRunningLocally(done.getInvocationId()));

        List<AuditEventType> types = auditTypes(done.getInvocationId());
        assertEquals(List.of(AuditEventType.STARTED, AuditEventType.COMPLETED), types);
    }

    @Test
    void shouldFailWhenOutputDoesNotMatchSchema() throws Exception {
        Node node = node(new EchoTool());
        ToolManifest manifest = echoManifest();
        manifest.setOutputSchema(Map.of("type", "object", "required", List.of("echoed"),
                "properties", Map.of("echoed", Map.of("type", "integer"))));

        Invocation done = node.orchestrator.execute(invocation("echo", Map.of("message", "hello"), null), manifest)
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals(InvocationStatus.ERROR, done.getStatus());
        assertEquals(ErrorCode.VALIDATION_FAILED, done.getError().getCode());
    }

    @Test
    void shouldMapToolCrashToExecutionFailed() throws Exception {
        NativeTool crashing = new NativeTool() {
            @Override
            public String getName() {
                return "echo";
            }

            @Override
            public ToolResult execute(ToolExecutionContext context) {
                throw new IllegalStateException("disk on fire");
            }
        };
        Node node = node(crashing);

        Invocation done = node.orchestrator.execute(invocation("echo", Map.of(), null), echoManifest())
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals(InvocationStatus.ERROR, done.getStatus());
        assertEquals(ErrorCode.EXECUTION_FAILED, done.getError().getCode());
        assertEquals("disk on fire", done.getError().getMessage());
        assertEquals(IllegalStateException.class.getName(), done.getError().getDetails().get("exception"));
    }

    @Test
    void shouldRejectLimitsAboveToolLimitsBeforeRunning() throws Exception {
        Node node = node(new EchoTool());
        Invocation invocation = invocation("echo", Map.of("message", "x"), null);
        invocation.setResourceLimits(ResourceLimits.builder().memoryMb(999_999).build());

        Invocation done = node.orchestrator.execute(invocation, echoManifest()).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals(InvocationStatus.ERROR, done.getStatus());
        assertEquals(ErrorCode.RESOURCE_LIMIT_EXCEEDED, done.getError().getCode());
        assertNull(done.getSandboxId());
    }

    @Test
    void shouldParkInvocationWhenApprovalRequired() throws Exception {
        Node node = node(new EchoTool());
        ToolManifest manifest = echoManifest();
        manifest.setRequiresApproval(true);

        Invocation parked = node.orchestrator.execute(invocation("echo", Map.of("message", "x"), null), manifest)
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals(InvocationStatus.PENDING_APPROVAL, parked.getStatus());
        assertEquals("primary", parked.getApproval().getTier());
    }

    @Test
    void shouldKeepManifestApprovalWhenCallerAsksToSkipIt() throws Exception {
        Node node = node(new EchoTool());
        ToolManifest manifest = echoManifest();
        manifest.setRequiresApproval(true);
        Invocation invocation = invocation("echo", Map.of("message", "x"), null);
        invocation.setExecutionOptions(ExecutionOptions.builder().requireApproval(false).build());

        Invocation parked = node.orchestrator.execute(invocation, manifest).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals(InvocationStatus.PENDING_APPROVAL, parked.getStatus());
        assertNull(parked.getResult());
        verify(approvalPort).requestApproval(any());
    }

    @Test
    void shouldAskForApprovalWhenCallerRequestsIt() throws Exception {
        Node node = node(new EchoTool());
        Invocation invocation = invocation("echo", Map.of("message", "x"), null);
        invocation.setExecutionOptions(ExecutionOptions.builder().requireApproval(true).build());

        Invocation parked = node.orchestrator.execute(invocation, echoManifest()).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals(InvocationStatus.PENDING_APPROVAL, parked.getStatus());
    }

    @Test
    void shouldNotDispatchApprovedInvocationCancelledBeforeDispatch() throws Exception {
        Node node = node(new EchoTool());
        ToolManifest manifest = echoManifest();
        manifest.setRequiresApproval(true);
        Invocation parked = node.orchestrator.execute(invocation("echo", Map.of("message", "x"), null), manifest)
                .get(WAIT_SECONDS, TimeUnit.SECONDS);
        Optional<Invocation> approved = node.approvals.decide(
                new ApprovalDecision(parked.getInvocationId(), true, "lead", null));
        assertTrue(approved.isPresent());

        CancelResult cancel = node.orchestrator.requestCancel(parked.getInvocationId(), "too late");
        Invocation done = node.orchestrator.execute(approved.get(), manifest).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(cancel.cancelled());
        assertEquals(InvocationStatus.CANCELLED, done.getStatus());
        assertNull(done.getResult());
        Invocation stored = invocationStore.get(parked.getInvocationId()).orElseThrow();
        assertEquals(InvocationStatus.CANCELLED, stored.getStatus());
        assertNull(stored.getStartedAt());
        assertFalse(auditTypes(parked.getInvocationId()).contains(AuditEventType.STARTED));
    }

    // ===== Cancellation =====

    @Test
    void shouldRejectCancelOfCompletedInvocationWithoutChangingIt() throws Exception {
        Node node = node(new EchoTool());
        Invocation done = node.orchestrator.execute(invocation("echo", Map.of("message", "x"), null),
                echoManifest()).get(WAIT_SECONDS, TimeUnit.SECONDS);

        CancelResult first = node.orchestrator.requestCancel(done.getInvocationId(), "no longer needed");
        CancelResult second = node.orchestrator.requestCancel(done.getInvocationId(), "still not needed");

        assertFalse(first.cancelled());
        assertEquals(CancelResult.ALREADY_COMPLETED, first.message());
        assertEquals(first, second);
        Invocation stored = invocationStore.get(done.getInvocationId()).orElseThrow();
        assertEquals(InvocationStatus.SUCCESS, stored.getStatus());
        assertEquals(Map.of("echoed", "x"), stored.getResult());
    }

    @Test
    void shouldRejectCancelOfUnknownInvocation() {
        Node node = node(new EchoTool());

        CancelResult result = node.orchestrator.requestCancel("missing", null);

        assertFalse(result.cancelled());
    }

    @Test
    void shouldCancelCooperativeToolAndKeepFinalCheckpoint() throws Exception {
        GatedStepTool tool = new GatedStepTool();
        Node node = node(tool);
        Invocation invocation = invocation("step-counter", Map.of("steps", 5), checkpoints());
        CompletableFuture<Invocation> future = node.orchestrator.execute(invocation, stepManifest());
        tool.permits.release();
        assertTrue(tool.reported.tryAcquire(WAIT_SECONDS, TimeUnit.SECONDS));

        CancelResult result = node.orchestrator.requestCancel(invocation.getInvocationId(), "user abort");
        tool.permits.release();
        Invocation done = future.get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(result.cancelled());
        assertEquals(InvocationStatus.CANCELLED, done.getStatus());
        assertEquals(ErrorCode.CANCELLED, done.getError().getCode());
        assertTrue(done.getError().getMessage().contains("user abort"));
        assertEquals(Map.of(STATE_KEY, 1),
                node.checkpointManager.resume(invocation.getInvocationId(), null).state());
        assertEquals(CancelResult.ALREADY_COMPLETED,
                node.orchestrator.requestCancel(invocation.getInvocationId(), null).message());
    }

    @Test
    void shouldForceCancelAfterGracePeriod() throws Exception {
        GatedStepTool tool = new GatedStepTool();
        Node node = node(tool);
        Invocation invocation = invocation("step-counter", Map.of("steps", 5), checkpoints());
        CompletableFuture<Invocation> future = node.orchestrator.execute(invocation, stepManifest());
        tool.permits.release();
        assertTrue(tool.reported.tryAcquire(WAIT_SECONDS, TimeUnit.SECONDS));

        node.orchestrator.requestCancel(invocation.getInvocationId(), null);
        clock.advance(Duration.ofSeconds(4));
        node.orchestrator.supervise();
        assertFalse(future.isDone());

        clock.advance(Duration.ofSeconds(1));
        node.orchestrator.supervise();
        Invocation done = future.get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals(InvocationStatus.CANCELLED, done.getStatus());
        assertTrue(done.getError().getMessage().contains("grace period"));
        assertEquals(0, node.allocator.activeSlots("agent-1"));
    }

    @Test
    void shouldPersistTerminalRecordWhenToolLeavesInterruptFlagSet() throws Exception {
        NativeTool interrupting = new NativeTool() {
            @Override
            public String getName() {
                return "echo";
            }

            @Override
            public ToolResult execute(ToolExecutionContext context) {
                Thread.currentThread().interrupt();
                return ToolResult.success(Map.of("echoed", "late"));
            }
        };
        Node node = node(interrupting);
        Invocation invocation = invocation("echo", Map.of("message", "late"), null);

        Invocation done = node.orchestrator.execute(invocation, echoManifest()).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals(InvocationStatus.SUCCESS, done.getStatus());
        Invocation stored = invocationStore.get(invocation.getInvocationId()).orElseThrow();
        assertEquals(InvocationStatus.SUCCESS, stored.getStatus());
        assertEquals(Map.of("echoed", "late"), stored.getResult());
        assertTrue(auditTypes(invocation.getInvocationId()).contains(AuditEventType.COMPLETED));
    }

    @Test
    void shouldCancelApprovalWaitAtOnce() throws Exception {
        Node node = node(new EchoTool());
        ToolManifest manifest = echoManifest();
        manifest.setRequiresApproval(true);
        Invocation parked = node.orchestrator.execute(invocation("echo", Map.of(), null), manifest)
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        CancelResult result = node.orchestrator.requestCancel(parked.getInvocationId(), "changed my mind");

        assertTrue(result.cancelled());
        assertEquals(InvocationStatus.CANCELLED, invocationStore.get(parked.getInvocationId()).orElseThrow()
                .getStatus());
        verify(approvalPort).withdraw(parked.getInvocationId());
    }

    // ===== Supervision =====

    @Test
    void shouldTimeOutAtDeadline() throws Exception {
        GatedStepTool tool = new GatedStepTool();
        Node node = node(tool);
        Invocation invocation = invocation("step-counter", Map.of("steps", 5), checkpoints());
        CompletableFuture<Invocation> future = node.orchestrator.execute(invocation, stepManifest());
        tool.permits.release();
        assertTrue(tool.reported.tryAcquire(WAIT_SECONDS, TimeUnit.SECONDS));

        clock.advance(Duration.ofSeconds(600));
        node.orchestrator.supervise();
        Invocation done = future.get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertEquals(InvocationStatus.TIMEOUT, done.getStatus());
        assertEquals(ErrorCode.TIMEOUT, done.getError().getCode());
        assertEquals(Map.of(STATE_KEY, 1),
                node.checkpointManager.resume(invocation.getInvocationId(), null).state());
    }

    @Test
    void shouldTakeMicroCheckpointsAndRenewLease() throws Exception {
        GatedStepTool tool = new GatedStepTool();
        Node node = node(tool);
        Invocation invocation = invocation("step-counter", Map.of("steps", 5), checkpoints());
        node.orchestrator.execute(invocation, stepManifest());
        tool.permits.release();
        assertTrue(tool.reported.tryAcquire(WAIT_SECONDS, TimeUnit.SECONDS));

        clock.advance(Duration.ofSeconds(10));
        node.orchestrator.supervise();

        Invocation stored = invocationStore.get(invocation.getInvocationId()).orElseThrow();
        assertEquals(InvocationStatus.RUNNING, stored.getStatus());
        assertEquals(clock.instant(), stored.getHeartbeatAt());
        assertEquals(1, stored.getCheckpointCount());
        assertNotNull(stored.getLatestCheckpointId());
        assertEquals(Integer.valueOf(20), stored.getProgressPercent());
    }

    @Test
    void shouldResumeOnAnotherWorkerFromSecondMicroCheckpointAfterCrash() throws Exception {
        GatedStepTool gated = new GatedStepTool();
        Node crashed = node(gated);
        Node survivor = node(new StepCounterTool());
        Invocation invocation = invocation("step-counter", Map.of("steps", 4, "step_delay_ms", 0), checkpoints());
        crashed.orchestrator.execute(invocation, stepManifest());

        gated.permits.release();
        assertTrue(gated.reported.tryAcquire(WAIT_SECONDS, TimeUnit.SECONDS));
        clock.advance(Duration.ofSeconds(10));
        crashed.orchestrator.supervise();

        gated.permits.release();
        assertTrue(gated.reported.tryAcquire(WAIT_SECONDS, TimeUnit.SECONDS));
        clock.advance(Duration.ofSeconds(10));
        crashed.orchestrator.supervise();

        Invocation beforeCrash = invocationStore.get(invocation.getInvocationId()).orElseThrow();
        assertEquals(2, beforeCrash.getCheckpointCount());
        String secondMicro = beforeCrash.getLatestCheckpointId();

        // the first worker stops renewing its lease
        clock.advance(Duration.ofSeconds(61));
        survivor.orchestrator.supervise();

        Invocation orphan = invocationStore.get(invocation.getInvocationId()).orElseThrow();
        assertEquals(InvocationStatus.ERROR, orphan.getStatus());
        assertEquals(ErrorCode.WORKER_LOST, orphan.getError().getCode());

        ExecutionOrchestrator.Submission submission = survivor.orchestrator.resume(orphan, stepManifest(), null);
        Invocation resumed = submission.completion().get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertNotEquals(invocation.getInvocationId(), resumed.getInvocationId());
        assertEquals(InvocationStatus.SUCCESS, resumed.getStatus());
        assertEquals(2, resumed.getAttempt());
        assertEquals(invocation.getInvocationId(), resumed.getResumedFrom());
        assertEquals(secondMicro, resumed.getResumeCheckpointId());
        assertEquals(2, resumed.getResult().get("resumed_from_step"));
        assertEquals(4, resumed.getResult().get(STATE_KEY));
        assertEquals(List.of(resumed.getInvocationId(), invocation.getInvocationId()),
                survivor.orchestrator.lineage(resumed));
        assertEquals(InvocationStatus.ERROR, invocationStore.get(invocation.getInvocationId()).orElseThrow()
                .getStatus());
    }

    @Test
    void shouldNotReapInvocationWithFreshLease() throws Exception {
        GatedStepTool gated = new GatedStepTool();
        Node owner = node(gated);
        Node other = node(new StepCounterTool());
        Invocation invocation = invocation("step-counter", Map.of("steps", 4), checkpoints());
        owner.orchestrator.execute(invocation, stepManifest());
        gated.permits.release();
        assertTrue(gated.reported.tryAcquire(WAIT_SECONDS, TimeUnit.SECONDS));

        clock.advance(Duration.ofSeconds(30));
        other.orchestrator.supervise();

        assertEquals(InvocationStatus.RUNNING, invocationStore.get(invocation.getInvocationId()).orElseThrow()
                .getStatus());
    }

    @Test
    void shouldRefuseToResumeSucceededOrNonResumableInvocations() throws Exception {
        Node node = node(new EchoTool());
        Invocation done = node.orchestrator.execute(invocation("echo", Map.of("message", "x"), null),
                echoManifest()).get(WAIT_SECONDS, TimeUnit.SECONDS);
        ToolManifest resumableEcho = echoManifest();
        resumableEcho.setResumable(true);

        ToolExecutionException notResumable = assertThrows(ToolExecutionException.class,
                () -> node.orchestrator.resume(done, echoManifest(), null));
        ToolExecutionException succeeded = assertThrows(ToolExecutionException.class,
                () -> node.orchestrator.resume(done, resumableEcho, null));

        assertEquals(ErrorCode.VALIDATION_FAILED, notResumable.getCode());
        assertEquals(ErrorCode.VALIDATION_FAILED, succeeded.getCode());
    }

    @Test
    void shouldOrderWorkerTasksByPriorityThenSubmission() {
        ExecutionOrchestrator.PrioritizedTask low = new ExecutionOrchestrator.PrioritizedTask(1, 1, () -> {
        });
        ExecutionOrchestrator.PrioritizedTask high = new ExecutionOrchestrator.PrioritizedTask(9, 2, () -> {
        });
        ExecutionOrchestrator.PrioritizedTask highLater = new ExecutionOrchestrator.PrioritizedTask(9, 3, () -> {
        });

        assertTrue(high.compareTo(low) < 0);
        assertTrue(high.compareTo(highLater) < 0);
    }

    // ===== Fixtures =====

    private Node node(NativeTool tool) {
        Node node = new Node(tool);
        nodes.add(node);
        return node;
    }

    private List<AuditEventType> auditTypes(String invocationId) {
        ArgumentCaptor<AuditEvent> events = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditPort, atLeastOnce()).publish(events.capture());
        return events.getAllValues().stream()
                .filter(event -> invocationId.equals(event.getInvocationId()))
                .map(AuditEvent::getType)
                .toList();
    }

    private Invocation invocation(String toolId, Map<String, Object> parameters, CheckpointConfig checkpoints) {
        return Invocation.builder()
                .invocationId(UUID.randomUUID().toString())
                .toolId(toolId)
                .toolVersion("1.0.0")
                .caller(CallerIdentity.builder().agentId("agent-1").tenantId("acme").build())
                .parameters(parameters)
                .checkpointConfig(checkpoints)
                .executionOptions(ExecutionOptions.builder().build())
                .createdAt(clock.instant())
                .build();
    }

    private static CheckpointConfig checkpoints() {
        return CheckpointConfig.builder().enabled(true).intervalSeconds(10).build();
    }

    private static ToolManifest echoManifest() {
        return ToolManifest.builder()
                .toolId("echo")
                .version("1.0.0")
                .binding(new ProtocolBinding.NativeBinding("echo"))
                .outputSchema(Map.of("type", "object",
                        "properties", Map.of("echoed", Map.of("type", "string"))))
                .build();
    }

    private static ToolManifest stepManifest() {
        return ToolManifest.builder()
                .toolId("step-counter")
                .version("1.0.0")
                .binding(new ProtocolBinding.NativeBinding("step-counter"))
                .resumable(true)
                .resourceLimits(ResourceLimits.builder().timeoutSeconds(600).build())
                .build();
    }

    /**
     * One worker process: its own orchestrator, pool and checkpoint manager
     * over the shared invocation and checkpoint stores.
     */
    private final class Node {
        final ExecutorService pool = Executors.newCachedThreadPool();
        final ResourceAllocator allocator = new ResourceAllocator(properties);
        final CheckpointManager checkpointManager;
        final ApprovalCoordinator approvals;
        final ExecutionOrchestrator orchestrator;

        Node(NativeTool tool) {
            checkpointManager = new CheckpointManager(microStore, new StorageCheckpointStore(storage, objectMapper),
                    new CheckpointCodec(objectMapper), storage, properties, clock);
            CircuitBreakerService circuitBreaker = new CircuitBreakerService(new InMemoryCircuitStateStore(),
                    mock(SpringEventBus.class), clock, properties);
            ExternalCallGuard guard = new ExternalCallGuard(new TokenBucketRateLimiter(properties), circuitBreaker,
                    clock);
            ContentPolicy contentPolicy = new ContentPolicy();
            AuditService auditService = new AuditService(auditPort, contentPolicy, clock);
            ResultValidator validator = new ResultValidator(new TypeCoercer(), new SchemaValidator(),
                    new InputSanitizer(), new InjectionGuard(properties), contentPolicy);
            approvals = new ApprovalCoordinator(invocationStore, approvalPort, auditService,
                    properties, clock);
            orchestrator = new ExecutionOrchestrator(invocationStore, allocator,
                    new WorkspaceSandboxProvisioner(properties), new PropertiesCredentialStoreAdapter(properties, clock),
                    checkpointManager, validator, guard, mock(DocumentContextService.class), auditService, approvals,
                    List.of(new NativeToolHandler(List.of(tool))), properties, pool, clock);
        }
    }

    /**
     * Step tool driven by the test: each step waits for a permit, reports its
     * state, then signals {@link #reported}.
     */
    static final class GatedStepTool implements NativeTool {
        final Semaphore permits = new Semaphore(0);
        final Semaphore reported = new Semaphore(0);

        @Override
        public String getName() {
            return "step-counter";
        }

        @Override
        public ToolResult execute(ToolExecutionContext context) throws InterruptedException {
            int steps = ((Number) context.getParameters().get("steps")).intValue();
            int start = context.getRestoredState()
                    .map(state -> ((Number) state.get(STATE_KEY)).intValue())
                    .orElse(0);
            for (int step = start + 1; step <= steps; step++) {
                permits.acquire();
                if (context.isCancelled()) {
                    return ToolResult.failure(ErrorCode.CANCELLED, "Stopped at step " + (step - 1));
                }
                context.reportState(Map.of(STATE_KEY, step));
                context.reportProgress(step * 100 / steps);
                reported.release();
            }
            return ToolResult.success(Map.of(STATE_KEY, steps));
        }
    }
}
