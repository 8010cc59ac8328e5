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

import java.time.Duration;
import java.util.Optional;

/**
 * One strategy in the bridge fallback chain. Tiers are tried in
 * {@link org.springframework.core.annotation.Order} order and the first
 * non-empty result wins.
 */
public interface FallbackTier {

    String name();

    /**
     * @return empty when this tier has nothing to offer for the request
     * @throws RuntimeException
     *             when the tier failed; the next tier is tried
     */
    Optional<BridgeResult> serve(BridgeRequest request, Duration timeout);
}
