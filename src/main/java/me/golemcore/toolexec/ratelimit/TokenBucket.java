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

import java.util.function.LongSupplier;

/**
 * Thread-safe token bucket.
 *
 * <p>
 * The bucket:
 * <ul>
 * <li>Starts full with {@code capacity} tokens</li>
 * <li>Refills continuously at {@code refillPerSecond}, never above
 * capacity</li>
 * <li>Denies a request when fewer than {@code cost} tokens are available,
 * returning the wait until enough have refilled</li>
 * </ul>
 *
 * <p>
 * Refill is calculated lazily inside the single synchronized mutation path, so
 * concurrent callers never observe a partially applied check-and-decrement.
 */
public class TokenBucket {

    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final long capacity;
    private final double refillPerSecond;
    private final LongSupplier nanoTime;
    private double tokens;
    private long lastRefillNanos;

    public TokenBucket(long capacity, double refillPerSecond) {
        this(capacity, refillPerSecond, System::nanoTime);
    }

    TokenBucket(long capacity, double refillPerSecond, LongSupplier nanoTime) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (refillPerSecond <= 0) {
            throw new IllegalArgumentException("refillPerSecond must be positive");
        }
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.nanoTime = nanoTime;
        this.tokens = capacity;
        this.lastRefillNanos = nanoTime.getAsLong();
    }

    /**
     * Try to consume {@code cost} tokens. Never blocks.
     */
    public synchronized RateLimitResult tryConsume(String key, long cost) {
        if (cost > capacity) {
            return RateLimitResult.denied(key, Long.MAX_VALUE, "Cost " + cost + " exceeds bucket capacity");
        }
        refill();

        if (tokens >= cost) {
            tokens -= cost;
            return RateLimitResult.allowed(key, (long) Math.floor(tokens));
        }

        double missing = cost - tokens;
        long waitMs = (long) Math.ceil(missing / refillPerSecond * 1000.0);
        return RateLimitResult.denied(key, waitMs, "Rate limit exceeded");
    }

    /**
     * Get current state of the bucket.
     */
    public synchronized BucketState getState(String key) {
        refill();
        return BucketState.builder()
                .key(key)
                .tokens(tokens)
                .capacity(capacity)
                .refillPerSecond(refillPerSecond)
                .build();
    }

    long getCapacity() {
        return capacity;
    }

    double getRefillPerSecond() {
        return refillPerSecond;
    }

    private void refill() {
        long now = nanoTime.getAsLong();
        long elapsedNanos = now - lastRefillNanos;
        if (elapsedNanos <= 0) {
            return;
        }
        tokens = Math.min(capacity, tokens + elapsedNanos / NANOS_PER_SECOND * refillPerSecond);
        lastRefillNanos = now;
    }
}
