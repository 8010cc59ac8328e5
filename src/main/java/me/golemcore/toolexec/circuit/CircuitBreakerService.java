package me.golemcore.toolexec.circuit;

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
import me.golemcore.toolexec.domain.model.CircuitBreakerSettings;
import me.golemcore.toolexec.domain.model.CircuitState;
import me.golemcore.toolexec.domain.model.CircuitStateType;
import me.golemcore.toolexec.domain.model.CircuitTransitionEvent;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.infrastructure.event.SpringEventBus;
import me.golemcore.toolexec.port.outbound.CircuitStateStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Per-service circuit breakers shared by every worker.
 *
 * <p>
 * Each operation loads the current snapshot, computes the next one with
 * {@link CircuitStateMachine} and writes it back with a compare-and-swap
 * against {@link CircuitStateStorePort}, retrying on conflict. When the store
 * fails, {@link #allowRequest(String)} denies.
 */
@Service
@Slf4j
public class CircuitBreakerService {

    private static final int MAX_CAS_ATTEMPTS = 64;

    private final CircuitStateStorePort store;
    private final SpringEventBus eventBus;
    private final Clock clock;
    private final CircuitBreakerSettings defaults;
    private final Map<String, CircuitBreakerSettings> serviceSettings = new ConcurrentHashMap<>();

    public CircuitBreakerService(CircuitStateStorePort store, SpringEventBus eventBus, Clock clock,
            ToolExecProperties properties) {
        this.store = store;
        this.eventBus = eventBus;
        this.clock = clock;
        this.defaults = properties.getCircuitBreaker().toSettings();
    }

    /**
     * Use {@code settings} for {@code serviceId} instead of the configured
     * defaults. Manifests register their overrides here before calling out.
     */
    public void configure(String serviceId, CircuitBreakerSettings settings) {
        if (settings != null) {
            serviceSettings.put(serviceId, settings);
        }
    }

    public CircuitBreakerSettings settingsFor(String serviceId) {
        return serviceSettings.getOrDefault(serviceId, defaults);
    }

    /**
     * Admission check. May move an open breaker to half-open.
     */
    public boolean allowRequest(String serviceId) {
        CircuitBreakerSettings settings = settingsFor(serviceId);
        try {
            CircuitStateMachine.Step step = apply(serviceId,
                    state -> CircuitStateMachine.admit(state, settings, Instant.now(clock)));
            if (!step.allowed()) {
                log.debug("[Circuit] Rejected call to {}: {}", serviceId, step.reason());
            }
            return step.allowed();
        } catch (RuntimeException e) {
            log.warn("[Circuit] State store failure for {}, denying: {}", serviceId, e.getMessage());
            return false;
        }
    }

    public void recordSuccess(String serviceId) {
        CircuitBreakerSettings settings = settingsFor(serviceId);
        applyQuietly(serviceId, state -> CircuitStateMachine.onSuccess(state, settings, Instant.now(clock)));
    }

    public void recordFailure(String serviceId) {
        CircuitBreakerSettings settings = settingsFor(serviceId);
        applyQuietly(serviceId, state -> CircuitStateMachine.onFailure(state, settings, Instant.now(clock)));
    }

    /**
     * Releases an admission whose call produced no outcome.
     */
    public void releaseCall(String serviceId) {
        applyQuietly(serviceId, state -> CircuitStateMachine.onAbandoned(state, Instant.now(clock)));
    }

    public CircuitState getState(String serviceId) {
        return store.load(serviceId).orElseGet(() -> CircuitState.closed(serviceId));
    }

    /**
     * Administrative override, e.g. to close a breaker after a manual fix.
     */
    public CircuitState forceState(String serviceId, CircuitStateType target, String reason) {
        String why = reason != null ? reason : "forced";
        log.info("[Circuit] Forcing {} to {} ({})", serviceId, target, why);
        return apply(serviceId, state -> CircuitStateMachine.force(state, target, Instant.now(clock), why)).next();
    }

    private void applyQuietly(String serviceId, Function<CircuitState, CircuitStateMachine.Step> function) {
        try {
            apply(serviceId, function);
        } catch (RuntimeException e) {
            log.warn("[Circuit] Failed to record outcome for {}: {}", serviceId, e.getMessage());
        }
    }

    private CircuitStateMachine.Step apply(String serviceId,
            Function<CircuitState, CircuitStateMachine.Step> function) {
        for (int attempt = 0; attempt < MAX_CAS_ATTEMPTS; attempt++) {
            CircuitState current = getState(serviceId);
            CircuitStateMachine.Step step = function.apply(current);
            if (!step.changed(current)) {
                return step;
            }
            CircuitState next = step.next().toBuilder().version(current.getVersion() + 1).build();
            if (store.compareAndSet(serviceId, current.getVersion(), next)) {
                CircuitStateMachine.Step applied = new CircuitStateMachine.Step(next, step.allowed(), step.from(),
                        step.to(), step.reason());
                if (applied.transitioned()) {
                    onTransition(serviceId, applied);
                }
                return applied;
            }
        }
        throw new IllegalStateException("Circuit state contention for " + serviceId);
    }

    private void onTransition(String serviceId, CircuitStateMachine.Step step) {
        log.info("[Circuit] {}: {} -> {} ({})", serviceId, step.from(), step.to(), step.reason());
        try {
            eventBus.publish(new CircuitTransitionEvent(serviceId, step.from(), step.to(), step.reason(),
                    Instant.now(clock)));
        } catch (RuntimeException e) {
            log.warn("[Circuit] Transition listener failed for {}: {}", serviceId, e.getMessage());
        }
    }
}
