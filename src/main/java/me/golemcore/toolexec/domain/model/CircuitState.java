package me.golemcore.toolexec.domain.model;

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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of one breaker. Every mutation produces a new snapshot
 * with {@code version + 1}; stores accept it only when the stored version
 * still equals the version the change was computed from.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CircuitState {

    String serviceId;
    @Builder.Default
    CircuitStateType state = CircuitStateType.CLOSED;

    /** Outcomes inside the rolling window, oldest first. */
    @Singular
    List<Outcome> outcomes;

    Instant openedAt;
    int halfOpenAdmitted;
    int halfOpenSuccesses;
    long version;
    Instant updatedAt;

    public static CircuitState closed(String serviceId) {
        return CircuitState.builder().serviceId(serviceId).build();
    }

    public long failureCount() {
        return outcomes.stream().filter(o -> !o.success()).count();
    }

    /**
     * One recorded call outcome.
     */
    public record Outcome(Instant at, boolean success) {
    }
}
