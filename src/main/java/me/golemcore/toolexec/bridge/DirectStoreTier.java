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

import lombok.RequiredArgsConstructor;
import me.golemcore.toolexec.port.outbound.BridgeDirectReadPort;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Third tier: degraded read straight from the peer's durable store.
 */
@Component
@Order(3)
@RequiredArgsConstructor
public class DirectStoreTier implements FallbackTier {

    private final BridgeDirectReadPort directRead;

    @Override
    public String name() {
        return "direct-store";
    }

    @Override
    public Optional<BridgeResult> serve(BridgeRequest request, Duration timeout) {
        if (!request.read() || !directRead.supports(request.method())) {
            return Optional.empty();
        }
        return directRead.read(request.method(), request.params())
                .map(value -> new BridgeResult(value, BridgeResult.Tier.DIRECT_STORE));
    }
}
