package me.golemcore.toolexec.domain.service;

import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.ResourceLimits;
import me.golemcore.toolexec.domain.model.ToolManifest;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResourceAllocatorTest {

    private static final ResourceLimits AGENT = limits(2000, 4096, 600);

    private ToolExecProperties properties;
    private ResourceAllocator allocator;

    @BeforeEach
    void setUp() {
        properties = new ToolExecProperties();
        properties.getExecution().setMaxConcurrentPerAgent(2);
        allocator = new ResourceAllocator(properties);
    }

    @Test
    void shouldUseToolLimitsWhenNothingRequested() {
        ResourceLimits effective = allocator.resolve(null, manifest(limits(1000, 2048, 120)), AGENT);

        assertEquals(limits(1000, 2048, 120), effective);
    }

    @Test
    void shouldFallBackPerDimension() {
        ResourceLimits requested = ResourceLimits.builder().memoryMb(512).build();

        ResourceLimits effective = allocator.resolve(requested, manifest(limits(1000, 2048, 120)), AGENT);

        assertEquals(limits(1000, 512, 120), effective);
    }

    @Test
    void shouldFillUndeclaredToolDimensionsFromDefaults() {
        ToolManifest manifest = manifest(ResourceLimits.builder().cpuMillicores(250).build());
        manifest.setDefaultTimeoutSeconds(45);

        ResourceLimits effective = allocator.resolve(null, manifest, AGENT);

        assertEquals(250, effective.getCpuMillicores());
        assertEquals(1024, effective.getMemoryMb());
        assertEquals(45, effective.getTimeoutSeconds());
    }

    @Test
    void shouldAcceptRequestEqualToToolLimits() {
        ResourceLimits effective = allocator.resolve(limits(1000, 2048, 120), manifest(limits(1000, 2048, 120)),
                AGENT);

        assertEquals(limits(1000, 2048, 120), effective);
    }

    @Test
    void shouldRejectRequestAboveToolLimits() {
        ToolExecutionException ex = assertThrows(ToolExecutionException.class,
                () -> allocator.resolve(limits(1500, 1024, 60), manifest(limits(1000, 2048, 120)), AGENT));

        assertEquals(ErrorCode.RESOURCE_LIMIT_EXCEEDED, ex.getCode());
        @SuppressWarnings("unchecked")
        List<String> violations = (List<String>) ex.getDetails().get("violations");
        assertEquals(1, violations.size());
        assertTrue(violations.get(0).startsWith("cpu_millicores"));
    }

    @Test
    void shouldRejectZeroOrNegativeRequestedLimits() {
        ToolExecutionException zeroTimeout = assertThrows(ToolExecutionException.class,
                () -> allocator.resolve(ResourceLimits.builder().timeoutSeconds(0).build(),
                        manifest(limits(1000, 2048, 120)), AGENT));
        ToolExecutionException negativeMemory = assertThrows(ToolExecutionException.class,
                () -> allocator.resolve(ResourceLimits.builder().memoryMb(-1).build(),
                        manifest(limits(1000, 2048, 120)), AGENT));

        assertEquals(ErrorCode.VALIDATION_FAILED, zeroTimeout.getCode());
        assertEquals(ErrorCode.VALIDATION_FAILED, negativeMemory.getCode());
        @SuppressWarnings("unchecked")
        List<String> violations = (List<String>) negativeMemory.getDetails().get("violations");
        assertEquals(List.of("memory_mb -1 <= 0"), violations);
    }

    @Test
    void shouldRejectNonPositiveManifestTimeout() {
        ToolExecutionException ex = assertThrows(ToolExecutionException.class,
                () -> allocator.resolve(null, manifest(limits(1000, 2048, 0)), AGENT));

        assertEquals(ErrorCode.VALIDATION_FAILED, ex.getCode());
        assertTrue(ex.getMessage().startsWith("Tool limits"));
    }

    @Test
    void shouldRejectToolLimitsAboveAgentLimits() {
        ToolExecutionException ex = assertThrows(ToolExecutionException.class,
                () -> allocator.resolve(null, manifest(limits(1000, 8192, 120)), AGENT));

        assertEquals(ErrorCode.RESOURCE_LIMIT_EXCEEDED, ex.getCode());
        assertTrue(ex.getMessage().contains("agent"));
    }

    @Test
    void shouldUseAgentDefaultsWhenAgentLimitsMissing() {
        ResourceLimits effective = allocator.resolve(null, manifest(limits(4000, 8192, 3600)), null);

        assertEquals(limits(4000, 8192, 3600), effective);
        assertThrows(ToolExecutionException.class,
                () -> allocator.resolve(null, manifest(limits(4001, 8192, 3600)), null));
    }

    @Test
    void shouldLimitConcurrentSlotsPerAgent() {
        allocator.acquireSlot("agent-1");
        allocator.acquireSlot("agent-1");

        ToolExecutionException ex = assertThrows(ToolExecutionException.class,
                () -> allocator.acquireSlot("agent-1"));
        assertEquals(ErrorCode.CONCURRENCY_LIMIT_EXCEEDED, ex.getCode());
        assertTrue(ex.isRetryable());

        allocator.acquireSlot("agent-2");
        assertEquals(2, allocator.activeSlots("agent-1"));
        assertEquals(1, allocator.activeSlots("agent-2"));
    }

    @Test
    void shouldFreeSlotOnRelease() {
        allocator.acquireSlot("agent-1");
        allocator.acquireSlot("agent-1");
        allocator.releaseSlot("agent-1");

        allocator.acquireSlot("agent-1");
        assertEquals(2, allocator.activeSlots("agent-1"));

        allocator.releaseSlot("agent-1");
        allocator.releaseSlot("agent-1");
        allocator.releaseSlot("agent-1");
        assertEquals(0, allocator.activeSlots("agent-1"));
    }

    private static ToolManifest manifest(ResourceLimits limits) {
        return ToolManifest.builder()
                .toolId("crunch")
                .version("1.0.0")
                .resourceLimits(limits)
                .build();
    }

    private static ResourceLimits limits(int cpu, int memory, int timeout) {
        return ResourceLimits.builder().cpuMillicores(cpu).memoryMb(memory).timeoutSeconds(timeout).build();
    }
}
