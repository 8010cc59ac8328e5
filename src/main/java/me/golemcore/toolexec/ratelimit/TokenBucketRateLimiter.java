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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.model.BucketState;
import me.golemcore.toolexec.domain.model.RateLimitResult;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Token bucket rate limiter keyed by external service or by (tool, tenant).
 *
 * <p>
 * Bucket keys are {@code service:<id>} or {@code tool:<toolId>:<tenant>},
 * selected by {@code toolexec.rate-limit.granularity}. Capacity and refill
 * rate come from {@code toolexec.rate-limit.*}, with per-key overrides under
 * {@code toolexec.rate-limit.overrides.<key>}. A bucket is rebuilt when its
 * configuration changes.
 *
 * <p>
 * Can be disabled via {@code toolexec.rate-limit.enabled=false}.
 *
 * @see TokenBucket
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TokenBucketRateLimiter implements RateLimiter {

    private final ToolExecProperties properties;

    private final Map<String, ConfiguredBucket> buckets = new ConcurrentHashMap<>();

    @Override
    public RateLimitResult tryAcquire(String serviceId, String toolId, String tenantId, long cost) {
        return tryAcquire(keyFor(serviceId, toolId, tenantId), cost);
    }

    @Override
    public RateLimitResult tryAcquire(String key, long cost) {
        ToolExecProperties.RateLimitProperties config = properties.getRateLimit();
        if (!config.isEnabled()) {
            return RateLimitResult.allowed(key, Long.MAX_VALUE);
        }

        RateLimitResult result = resolveBucket(key).tryConsume(key, cost);
        if (!result.isAllowed()) {
            log.debug("[RateLimit] Denied {} (wait {} ms)", key, result.getWaitTime().toMillis());
        }
        return result;
    }

    @Override
    public BucketState getBucketState(String key) {
        ConfiguredBucket configuredBucket = buckets.get(key);
        if (configuredBucket == null) {
            return null;
        }
        return configuredBucket.bucket().getState(key);
    }

    String keyFor(String serviceId, String toolId, String tenantId) {
        if (properties.getRateLimit().getGranularity() == ToolExecProperties.RateLimitProperties.Granularity.TOOL_TENANT) {
            return "tool:" + toolId + ":" + tenantId;
        }
        return "service:" + serviceId;
    }

    private TokenBucket resolveBucket(String key) {
        ToolExecProperties.RateLimitProperties config = properties.getRateLimit();
        ToolExecProperties.BucketProperties override = config.getOverrides().get(key);
        long capacity = override != null && override.getCapacity() > 0 ? override.getCapacity() : config.getCapacity();
        double refill = override != null && override.getRefillPerSecond() > 0
                ? override.getRefillPerSecond()
                : config.getRefillPerSecond();

        ConfiguredBucket configured = buckets.compute(key, (bucketKey, existing) -> {
            if (existing == null || existing.capacity() != capacity
                    || Double.compare(existing.refillPerSecond(), refill) != 0) {
                return new ConfiguredBucket(new TokenBucket(capacity, refill), capacity, refill);
            }
            return existing;
        });
        return configured.bucket();
    }

    private record ConfiguredBucket(TokenBucket bucket, long capacity, double refillPerSecond) {
    }
}
