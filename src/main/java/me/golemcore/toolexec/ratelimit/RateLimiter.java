package me.golemcore.toolexec.ratelimit;

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

import me.golemcore.toolexec.domain.model.BucketState;
import me.golemcore.toolexec.domain.model.RateLimitResult;

/**
 * Admission control for outbound calls to external services.
 */
public interface RateLimiter {

    /**
     * Check and consume {@code cost} tokens for the bucket chosen by the
     * configured granularity: the service, or the (tool, tenant) pair.
     */
    RateLimitResult tryAcquire(String serviceId, String toolId, String tenantId, long cost);

    /**
     * Check and consume tokens for an explicit bucket key.
     */
    RateLimitResult tryAcquire(String key, long cost);

    /**
     * Get current bucket state, or {@code null} if the bucket was never used.
     */
    BucketState getBucketState(String key);
}
