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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.exception.BridgeUnavailableException;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Protocol-agnostic client to the bridge peer.
 *
 * <p>
 * Cacheable reads are first answered from a fresh cache entry. Otherwise the
 * {@link FallbackTier}s are tried in order (live bridge, stale shared cache,
 * direct durable read) and the first that produces a value wins. When every
 * tier fails a retryable {@link BridgeUnavailableException} is thrown.
 */
@Service
@Slf4j
public class BridgeClient {

    private final List<FallbackTier> tiers;
    private final BridgeCache cache;
    private final Duration callTimeout;

    public BridgeClient(List<FallbackTier> tiers, BridgeCache cache, ToolExecProperties properties) {
        this.tiers = List.copyOf(tiers);
        this.cache = cache;
        this.callTimeout = properties.getBridge().getCallTimeout();
    }

    public BridgeResult call(BridgeRequest request) {
        return call(request, null);
    }

    /**
     * @param budget
     *            remaining time of the calling invocation; the live call timeout
     *            is capped by it
     */
    public BridgeResult call(BridgeRequest request, Duration budget) {
        Optional<BridgeResult> cached = cache.lookupFresh(request);
        if (cached.isPresent()) {
            return cached.get();
        }

        Duration timeout = budget != null && budget.compareTo(callTimeout) < 0 ? budget : callTimeout;
        List<String> failures = new ArrayList<>();
        for (FallbackTier tier : tiers) {
            try {
                Optional<BridgeResult> result = tier.serve(request, timeout);
                if (result.isPresent()) {
                    if (result.get().isDegraded()) {
                        log.warn("[Bridge] {} served by {} after: {}", request.method(), tier.name(), failures);
                    }
                    return result.get();
                }
                failures.add(tier.name() + ": no result");
            } catch (RuntimeException e) {
                log.debug("[Bridge] Tier {} failed for {}: {}", tier.name(), request.method(), e.getMessage());
                failures.add(tier.name() + ": " + e.getMessage());
            }
        }
        log.warn("[Bridge] All tiers failed for {}: {}", request.method(), failures);
        throw new BridgeUnavailableException(request.method(), failures);
    }
}
