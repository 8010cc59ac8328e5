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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * Thresholds for one circuit breaker. Manifests may override the configured
 * defaults for the external services they call.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerSettings {

    public enum WindowType {
        TIME, COUNT
    }

    @Builder.Default
    private int failureThreshold = 5;
    @Builder.Default
    private int successThreshold = 2;
    @Builder.Default
    private Duration timeoutDuration = Duration.ofSeconds(60);
    @Builder.Default
    private int halfOpenMaxCalls = 3;
    @Builder.Default
    private WindowType windowType = WindowType.TIME;
    @Builder.Default
    private Duration windowDuration = Duration.ofSeconds(60);
    @Builder.Default
    private int windowSize = 20;
}
