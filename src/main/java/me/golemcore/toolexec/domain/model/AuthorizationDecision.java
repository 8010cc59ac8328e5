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

import java.time.Duration;

/**
 * Answer of the authorization oracle. A {@code null} ttl means the decision
 * must not be cached.
 */
public record AuthorizationDecision(boolean allowed, String reason, Duration ttl) {

    public static AuthorizationDecision allow(Duration ttl) {
        return new AuthorizationDecision(true, "allowed", ttl);
    }

    public static AuthorizationDecision deny(String reason, Duration ttl) {
        return new AuthorizationDecision(false, reason, ttl);
    }
}
