package me.golemcore.toolexec.domain.service;

import me.golemcore.toolexec.adapter.outbound.store.InMemoryCircuitStateStore;
import me.golemcore.toolexec.circuit.CircuitBreakerService;
import me.golemcore.toolexec.domain.exception.AdmissionDeniedException;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.CircuitStateType;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.RetryPolicy;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.infrastructure.event.SpringEventBus;
import me.golemcore.toolexec.ratelimit.TokenBucketRateLimiter;
import me.golemcore.toolexec.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class ExternalCallGuardTest {

    private static final String SERVICE = "X";
    private static final ExternalCallGuard.CallScope SCOPE = new ExternalCallGuard.CallScope("search", "acme",
            "inv-1");

    private MutableClock clock;
    private ToolExecProperties properties;
    private CircuitBreakerService circuitBreaker;
    private List<Duration> sleeps;
    private ExternalCallGuard guard;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        properties = new ToolExecProperties();
        properties.getRateLimit().setCapacity(100);
        properties.getRateLimit().setRefillPerSecond(100);
        circuitBreaker = new CircuitBreakerService(new InMemoryCircuitStateStore(), mock(SpringEventBus.class),
                clock, properties);
        sleeps = new ArrayList<>();
        guard = new ExternalCallGuard(new TokenBucketRateLimiter(properties), circuitBreaker, clock, duration -> {
            sleeps.add(duration);
            clock.advance(duration);
        });
    }

    @Test
    void shouldReturnResultAndRecordSuccess() {
        String result = guard.call(SERVICE, SCOPE, RetryPolicy.none(), null, () -> "ok");

        assertEquals("ok", result);
        assertEquals(CircuitStateType.CLOSED, circuitBreaker.getState(SERVICE).getState());
    }

    @Test
    void shouldRejectWithoutInvokingCallWhenCircuitOpens() {
        for (int i = 0; i < 5; i++) {
            assertThrows(ToolExecutionException.class, () -> guard.call(SERVICE, SCOPE, RetryPolicy.none(), null,
                    () -> {
                        throw new IOException("connection reset");
                    }));
        }
        assertEquals(CircuitStateType.OPEN, circuitBreaker.getState(SERVICE).getState());

        AtomicInteger invoked = new AtomicInteger();
        AdmissionDeniedException denied = assertThrows(AdmissionDeniedException.class,
                () -> guard.call(SERVICE, SCOPE, RetryPolicy.none(), null, invoked::incrementAndGet));

        assertEquals(ErrorCode.CIRCUIT_OPEN, denied.getCode());
        assertEquals(SERVICE, denied.getServiceId());
        assertEquals(0, invoked.get());
    }

    @Test
    void shouldReleaseHalfOpenSlotWhenCallIsInterrupted() {
        properties.getCircuitBreaker().setHalfOpenMaxCalls(1);
        circuitBreaker = new CircuitBreakerService(new InMemoryCircuitStateStore(), mock(SpringEventBus.class),
                clock, properties);
        guard = new ExternalCallGuard(new TokenBucketRateLimiter(properties), circuitBreaker, clock, sleeps::add);
        tripBreaker();
        clock.advance(Duration.ofSeconds(61));

        try {
            ToolExecutionException interrupted = assertThrows(ToolExecutionException.class,
                    () -> guard.call(SERVICE, SCOPE, RetryPolicy.none(), null, () -> {
                        throw new InterruptedException("stop");
                    }));
            assertEquals(ErrorCode.CANCELLED, interrupted.getCode());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }

        assertEquals(CircuitStateType.HALF_OPEN, circuitBreaker.getState(SERVICE).getState());
        assertEquals("ok", guard.call(SERVICE, SCOPE, RetryPolicy.none(), null, () -> "ok"));
    }

    @Test
    void shouldReleaseHalfOpenSlotWhenCallThrowsError() {
        properties.getCircuitBreaker().setHalfOpenMaxCalls(1);
        circuitBreaker = new CircuitBreakerService(new InMemoryCircuitStateStore(), mock(SpringEventBus.class),
                clock, properties);
        guard = new ExternalCallGuard(new TokenBucketRateLimiter(properties), circuitBreaker, clock, sleeps::add);
        tripBreaker();
        clock.advance(Duration.ofSeconds(61));

        assertThrows(StackOverflowError.class, () -> guard.call(SERVICE, SCOPE, RetryPolicy.none(), null, () -> {
            throw new StackOverflowError();
        }));

        assertEquals(0, circuitBreaker.getState(SERVICE).getHalfOpenAdmitted());
        assertEquals("ok", guard.call(SERVICE, SCOPE, RetryPolicy.none(), null, () -> "ok"));
    }

    @Test
    void shouldWrapCallFailureAsExecutionFailed() {
        ToolExecutionException ex = assertThrows(ToolExecutionException.class,
                () -> guard.call(SERVICE, SCOPE, RetryPolicy.none(), null, () -> {
                    throw new IOException("boom");
                }));

        assertEquals(ErrorCode.EXECUTION_FAILED, ex.getCode());
        assertTrue(ex.getMessage().contains("boom"));
    }

    @Test
    void shouldRetryAllowlistedFailuresWithBackoff() {
        RetryPolicy policy = RetryPolicy.builder()
                .maxAttempts(3)
                .initialBackoffMs(100)
                .backoffMultiplier(2.0)
                .jitterRatio(0.0)
                .build();
        AtomicInteger calls = new AtomicInteger();

        String result = guard.call(SERVICE, SCOPE, policy, null, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("flaky");
            }
            return "done";
        });

        assertEquals("done", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(Duration.ofMillis(100), Duration.ofMillis(200)), sleeps);
    }

    @Test
    void shouldNotRetryCodesOutsideAllowlist() {
        RetryPolicy policy = RetryPolicy.builder()
                .maxAttempts(5)
                .retryableCodes(Set.of(ErrorCode.RATE_LIMITED))
                .build();
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ToolExecutionException.class, () -> guard.call(SERVICE, SCOPE, policy, null, () -> {
            calls.incrementAndGet();
            throw new IOException("down");
        }));

        assertEquals(1, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void shouldStopRetryingWhenBackoffPassesDeadline() {
        RetryPolicy policy = RetryPolicy.builder()
                .maxAttempts(5)
                .initialBackoffMs(1_000)
                .jitterRatio(0.0)
                .build();
        Instant deadline = clock.instant().plusMillis(500);
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ToolExecutionException.class, () -> guard.call(SERVICE, SCOPE, policy, deadline, () -> {
            calls.incrementAndGet();
            throw new IOException("slow");
        }));

        assertEquals(1, calls.get());
    }

    @Test
    void shouldDenyWhenRateLimitExhausted() {
        properties.getRateLimit().setCapacity(1);
        properties.getRateLimit().setRefillPerSecond(0.001);
        ExternalCallGuard limited = new ExternalCallGuard(new TokenBucketRateLimiter(properties), circuitBreaker,
                clock, sleeps::add);

        assertEquals("first", limited.call(SERVICE, SCOPE, RetryPolicy.none(), null, () -> "first"));
        AdmissionDeniedException denied = assertThrows(AdmissionDeniedException.class,
                () -> limited.call(SERVICE, SCOPE, RetryPolicy.none(), null, () -> "second"));

        assertEquals(ErrorCode.RATE_LIMITED, denied.getCode());
        assertTrue(denied.isRetryable());
        assertTrue(denied.getRetryAfter().toMillis() > 0);
    }

    private void tripBreaker() {
        for (int i = 0; i < 5; i++) {
            assertThrows(ToolExecutionException.class, () -> guard.call(SERVICE, SCOPE, RetryPolicy.none(), null,
                    () -> {
                        throw new IOException("connection reset");
                    }));
        }
        assertEquals(CircuitStateType.OPEN, circuitBreaker.getState(SERVICE).getState());
    }

    @Test
    void shouldCapBackoffAtMaximum() {
        RetryPolicy policy = RetryPolicy.builder()
                .initialBackoffMs(1_000)
                .backoffMultiplier(10.0)
                .jitterRatio(0.0)
                .maxBackoffMs(3_000)
                .build();

        Duration backoff = ExternalCallGuard.backoff(policy, 4,
                new ToolExecutionException(ErrorCode.EXECUTION_FAILED, "x"));

        assertEquals(Duration.ofMillis(3_000), backoff);
    }
}
