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
import me.golemcore.toolexec.circuit.CircuitBreakerService;
import me.golemcore.toolexec.domain.exception.AdmissionDeniedException;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.RateLimitResult;
import me.golemcore.toolexec.domain.model.RetryPolicy;
import me.golemcore.toolexec.ratelimit.RateLimiter;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Wraps every outbound call a tool makes to an external service.
 *
 * <p>
 * Each attempt passes rate limiter admission, then circuit breaker admission,
 * before the call runs; the outcome is recorded on the breaker. A denial is
 * raised to the tool as a retryable {@link AdmissionDeniedException}, never as
 * an abort of the invocation. Retries follow the manifest's
 * {@link RetryPolicy}: exponential backoff with jitter, only for allowlisted
 * codes, and never past the invocation's deadline.
 */
@Service
@Slf4j
public class ExternalCallGuard {

    private final RateLimiter rateLimiter;
    private final CircuitBreakerService circuitBreaker;
    private final Clock clock;
    private final Sleeper sleeper;

    @Autowired
    public ExternalCallGuard(RateLimiter rateLimiter, CircuitBreakerService circuitBreaker, Clock clock) {
        this(rateLimiter, circuitBreaker, clock, duration -> Thread.sleep(duration.toMillis()));
    }

    ExternalCallGuard(RateLimiter rateLimiter, CircuitBreakerService circuitBreaker, Clock clock, Sleeper sleeper) {
        this.rateLimiter = rateLimiter;
        this.circuitBreaker = circuitBreaker;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    /**
     * Who is calling, for rate limit keys and logs.
     */
    public record CallScope(String toolId, String tenantId, String invocationId) {
    }

    public <T> T call(String serviceId, CallScope scope, RetryPolicy policy, Instant deadline, Callable<T> call) {
        RetryPolicy retry = policy != null ? policy : RetryPolicy.none();
        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        for (int attempt = 1;; attempt++) {
            try {
                return attempt(serviceId, scope, call);
            } catch (ToolExecutionException e) {
                if (attempt >= maxAttempts || !retry.isRetryable(e.getCode())) {
                    throw e;
                }
                Duration backoff = backoff(retry, attempt, e);
                if (deadline != null && Instant.now(clock).plus(backoff).isAfter(deadline)) {
                    log.debug("[Guard] No budget left to retry {} for {}", serviceId, scope.invocationId());
                    throw e;
                }
                log.debug("[Guard] Retrying {} for {} in {} ms (attempt {}/{}): {}", serviceId,
                        scope.invocationId(), backoff.toMillis(), attempt + 1, maxAttempts, e.getCode());
                pause(backoff);
            }
        }
    }

    private <T> T attempt(String serviceId, CallScope scope, Callable<T> call) {
        RateLimitResult admission = rateLimiter.tryAcquire(serviceId, scope.toolId(), scope.tenantId(), 1);
        if (!admission.isAllowed()) {
            throw AdmissionDeniedException.rateLimited(serviceId, admission.getWaitTime());
        }
        if (!circuitBreaker.allowRequest(serviceId)) {
            throw AdmissionDeniedException.circuitOpen(serviceId);
        }
        try {
            T result = call.call();
            circuitBreaker.recordSuccess(serviceId);
            return result;
        } catch (InterruptedException e) {
            circuitBreaker.releaseCall(serviceId);
            Thread.currentThread().interrupt();
            throw new ToolExecutionException(ErrorCode.CANCELLED, "Interrupted while calling " + serviceId, e);
        } catch (ToolExecutionException e) {
            circuitBreaker.recordFailure(serviceId);
            throw e;
        } catch (Exception e) {
            circuitBreaker.recordFailure(serviceId);
            throw new ToolExecutionException(ErrorCode.EXECUTION_FAILED,
                    "Call to " + serviceId + " failed: " + e.getMessage(), e);
        } catch (Error e) {
            circuitBreaker.releaseCall(serviceId);
            throw e;
        }
    }

    static Duration backoff(RetryPolicy policy, int attempt, ToolExecutionException failure) {
        double base = policy.getInitialBackoffMs() * Math.pow(policy.getBackoffMultiplier(), attempt - 1.0);
        double capped = Math.min(base, policy.getMaxBackoffMs());
        double jitter = policy.getJitterRatio() > 0
                ? ThreadLocalRandom.current().nextDouble(-policy.getJitterRatio(), policy.getJitterRatio())
                : 0.0;
        long millis = Math.max(0L, Math.round(capped * (1.0 + jitter)));
        if (failure instanceof AdmissionDeniedException denied && denied.getRetryAfter() != null
                && denied.getRetryAfter().toMillis() > millis) {
            millis = Math.min(denied.getRetryAfter().toMillis(), policy.getMaxBackoffMs());
        }
        return Duration.ofMillis(millis);
    }

    private void pause(Duration backoff) {
        try {
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolExecutionException(ErrorCode.CANCELLED, "Interrupted during retry backoff", e);
        }
    }
}
