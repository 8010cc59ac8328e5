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
import lombok.Data;

import java.time.Duration;

/**
 * Result of a rate limit check.
 *
 * <p>
 * Contains:
 * <ul>
 * <li>{@code allowed} - whether the request was admitted</li>
 * <li>{@code remainingTokens} - whole tokens left in the bucket</li>
 * <li>{@code waitTime} - if denied, how long until enough tokens refill</li>
 * <li>{@code reason} - explanation for denial</li>
 * </ul>
 */
@Data
@Builder
public class RateLimitResult {

    private boolean allowed;
    private String key;
    private long remainingTokens;
    private Duration waitTime;
    private String reason;

    public static RateLimitResult allowed(String key, long remaining) {
        return RateLimitResult.builder()
                .allowed(true)
                .key(key)
                .remainingTokens(remaining)
                .build();
    }

    public static RateLimitResult denied(String key, long waitMs, String reason) {
        return RateLimitResult.builder()
                .allowed(false)
                .key(key)
                .waitTime(Duration.ofMillis(waitMs))
                .reason(reason)
                .build();
    }
}
