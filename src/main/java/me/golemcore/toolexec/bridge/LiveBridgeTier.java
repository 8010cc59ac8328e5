package me.golemcore.toolexec.bridge;

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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import me.golemcore.toolexec.port.outbound.BridgePeerPort;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * First tier: the live peer. Successful reads refresh the caches.
 */
@Component
@Order(1)
@RequiredArgsConstructor
public class LiveBridgeTier implements FallbackTier {

    private final BridgePeerPort peer;
    private final BridgeCache cache;

    @Override
    public String name() {
        return "live";
    }

    @Override
    public Optional<BridgeResult> serve(BridgeRequest request, Duration timeout) {
        if (!peer.isAvailable()) {
            throw new IllegalStateException("bridge peer not connected");
        }
        JsonNode value;
        try {
            value = peer.call(request.method(), request.params()).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        } catch (TimeoutException e) {
            throw new IllegalStateException("timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new IllegalStateException(cause.getMessage(), cause);
        }
        cache.store(request, value);
        return Optional.of(new BridgeResult(value, BridgeResult.Tier.LIVE));
    }
}
