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

import me.golemcore.toolexec.domain.model.CircuitBreakerSettings;
import me.golemcore.toolexec.domain.model.CircuitState;
import me.golemcore.toolexec.domain.model.CircuitStateType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Transition function of the circuit breaker. Pure: every method takes a
 * snapshot and returns the next snapshot without touching any store, so the
 * caller can apply it with a compare-and-swap and simply recompute on
 * conflict.
 *
 * <p>
 * Edges:
 * <ul>
 * <li>CLOSED to OPEN when failures in the rolling window reach
 * {@code failureThreshold}</li>
 * <li>OPEN to HALF_OPEN on the first admission check after
 * {@code timeoutDuration}; that check is admitted</li>
 * <li>HALF_OPEN to OPEN on any trial failure</li>
 * <li>HALF_OPEN to CLOSED after {@code successThreshold} trial successes</li>
 * </ul>
 */
public final class CircuitStateMachine {

    private CircuitStateMachine() {
    }

    /**
     * Outcome of applying one operation. {@code next} equals the input snapshot
     * when nothing changed.
     */
    public record Step(CircuitState next, boolean allowed, CircuitStateType from, CircuitStateType to,
            String reason) {

        boolean changed(CircuitState previous) {
            return next != previous;
        }

        boolean transitioned() {
            return from != to;
        }
    }

    public static Step admit(CircuitState state, CircuitBreakerSettings settings, Instant now) {
        CircuitStateType current = state.getState();
        switch (current) {
        case CLOSED:
            return new Step(state, true, current, current, null);
        case OPEN:
            if (state.getOpenedAt() == null
                    || !now.isBefore(state.getOpenedAt().plus(settings.getTimeoutDuration()))) {
                CircuitState halfOpen = state.toBuilder()
                        .state(CircuitStateType.HALF_OPEN)
                        .clearOutcomes()
                        .halfOpenAdmitted(1)
                        .halfOpenSuccesses(0)
                        .updatedAt(now)
                        .build();
                return new Step(halfOpen, true, current, CircuitStateType.HALF_OPEN, "open timeout elapsed");
            }
            return new Step(state, false, current, current, "circuit open");
        case HALF_OPEN:
            if (state.getHalfOpenAdmitted() < settings.getHalfOpenMaxCalls()) {
                CircuitState next = state.toBuilder()
                        .halfOpenAdmitted(state.getHalfOpenAdmitted() + 1)
                        .updatedAt(now)
                        .build();
                return new Step(next, true, current, current, null);
            }
            return new Step(state, false, current, current, "half-open trial limit reached");
        default:
            throw new IllegalStateException("Unknown circuit state: " + current);
        }
    }

    public static Step onSuccess(CircuitState state, CircuitBreakerSettings settings, Instant now) {
        CircuitStateType current = state.getState();
        switch (current) {
        case CLOSED:
            return new Step(record(state, settings, now, true), true, current, current, null);
        case HALF_OPEN:
            int successes = state.getHalfOpenSuccesses() + 1;
            if (successes >= effectiveSuccessThreshold(settings)) {
                CircuitState closed = state.toBuilder()
                        .state(CircuitStateType.CLOSED)
                        .clearOutcomes()
                        .openedAt(null)
                        .halfOpenAdmitted(0)
                        .halfOpenSuccesses(0)
                        .updatedAt(now)
                        .build();
                return new Step(closed, true, current, CircuitStateType.CLOSED,
                        successes + " trial successes");
            }
            return new Step(state.toBuilder().halfOpenSuccesses(successes).updatedAt(now).build(),
                    true, current, current, null);
        default:
            // Late result of a call admitted before the breaker opened.
            return new Step(state, true, current, current, null);
        }
    }

    public static Step onFailure(CircuitState state, CircuitBreakerSettings settings, Instant now) {
        CircuitStateType current = state.getState();
        switch (current) {
        case CLOSED:
            CircuitState recorded = record(state, settings, now, false);
            if (recorded.failureCount() >= settings.getFailureThreshold()) {
                return new Step(open(recorded, now), true, current, CircuitStateType.OPEN,
                        recorded.failureCount() + " failures in window");
            }
            return new Step(recorded, true, current, current, null);
        case HALF_OPEN:
            return new Step(open(state, now), true, current, CircuitStateType.OPEN, "trial call failed");
        default:
            return new Step(state, true, current, current, null);
        }
    }

    /**
     * An admitted call ended without an outcome (interrupted, or failed inside
     * the caller). A half-open trial slot is handed back; otherwise nothing
     * changes.
     */
    public static Step onAbandoned(CircuitState state, Instant now) {
        CircuitStateType current = state.getState();
        if (current != CircuitStateType.HALF_OPEN || state.getHalfOpenAdmitted() == 0) {
            return new Step(state, true, current, current, null);
        }
        CircuitState next = state.toBuilder()
                .halfOpenAdmitted(state.getHalfOpenAdmitted() - 1)
                .updatedAt(now)
                .build();
        return new Step(next, true, current, current, null);
    }

    /**
     * Administrative override to any state, bypassing the edge rules.
     */
    public static Step force(CircuitState state, CircuitStateType target, Instant now, String reason) {
        CircuitState.CircuitStateBuilder builder = state.toBuilder()
                .state(target)
                .clearOutcomes()
                .halfOpenAdmitted(0)
                .halfOpenSuccesses(0)
                .updatedAt(now);
        builder.openedAt(target == CircuitStateType.OPEN ? now : null);
        return new Step(builder.build(), target != CircuitStateType.OPEN, state.getState(), target, reason);
    }

    /**
     * A success threshold above the trial budget could never be reached.
     */
    static int effectiveSuccessThreshold(CircuitBreakerSettings settings) {
        return Math.max(1, Math.min(settings.getSuccessThreshold(), settings.getHalfOpenMaxCalls()));
    }

    private static CircuitState open(CircuitState state, Instant now) {
        return state.toBuilder()
                .state(CircuitStateType.OPEN)
                .clearOutcomes()
                .openedAt(now)
                .halfOpenAdmitted(0)
                .halfOpenSuccesses(0)
                .updatedAt(now)
                .build();
    }

    private static CircuitState record(CircuitState state, CircuitBreakerSettings settings, Instant now,
            boolean success) {
        List<CircuitState.Outcome> outcomes = new ArrayList<>(state.getOutcomes());
        outcomes.add(new CircuitState.Outcome(now, success));
        if (settings.getWindowType() == CircuitBreakerSettings.WindowType.COUNT) {
            int overflow = outcomes.size() - Math.max(1, settings.getWindowSize());
            if (overflow > 0) {
                outcomes = new ArrayList<>(outcomes.subList(overflow, outcomes.size()));
            }
        } else {
            Duration window = settings.getWindowDuration();
            Instant cutoff = now.minus(window);
            outcomes.removeIf(outcome -> outcome.at().isBefore(cutoff));
        }
        return state.toBuilder()
                .clearOutcomes()
                .outcomes(outcomes)
                .updatedAt(now)
                .build();
    }
}
