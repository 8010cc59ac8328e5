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

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Retry settings applied by the external-call wrapper a tool uses for its
 * outbound calls. The control plane never retries a whole invocation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RetryPolicy {

    @Builder.Default
    private int maxAttempts = 1;
    @Builder.Default
    private long initialBackoffMs = 200;
    @Builder.Default
    private double backoffMultiplier = 2.0;
    @Builder.Default
    private double jitterRatio = 0.2;
    @Builder.Default
    private long maxBackoffMs = 5_000;
    @Builder.Default
    private Set<ErrorCode> retryableCodes = new LinkedHashSet<>(
            Set.of(ErrorCode.RATE_LIMITED, ErrorCode.EXECUTION_FAILED));

    public static RetryPolicy none() {
        return RetryPolicy.builder().maxAttempts(1).build();
    }

    public boolean isRetryable(ErrorCode code) {
        return retryableCodes != null && retryableCodes.contains(code);
    }
}
