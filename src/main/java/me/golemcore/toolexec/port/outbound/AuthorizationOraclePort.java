package me.golemcore.toolexec.port.outbound;

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

import me.golemcore.toolexec.domain.model.AuthorizationDecision;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * External policy decision point.
 */
public interface AuthorizationOraclePort {

    /**
     * Ask whether {@code subject} may perform {@code action} on
     * {@code resource}. The caller bounds the wait; implementations should not
     * block the calling thread.
     */
    CompletableFuture<AuthorizationDecision> authorize(String subject, String resource, String action,
            Map<String, Object> context);
}
