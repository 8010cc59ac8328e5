package me.golemcore.toolexec.adapter.inbound.web.controller;

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

import me.golemcore.toolexec.domain.model.CallerIdentity;

/**
 * Builds the caller identity from request headers.
 */
final class CallerHeaders {

    static final String AGENT_ID = "X-Agent-Id";
    static final String TENANT_ID = "X-Tenant-Id";
    static final String SESSION_ID = "X-Session-Id";
    static final String PARENT_SANDBOX_ID = "X-Parent-Sandbox-Id";

    private static final String BEARER_PREFIX = "Bearer ";

    private CallerHeaders() {
    }

    static CallerIdentity toIdentity(String authorization, String agentId, String tenantId, String sessionId,
            String parentSandboxId) {
        return CallerIdentity.builder()
                .agentId(agentId)
                .tenantId(tenantId)
                .sessionId(sessionId)
                .parentSandboxId(parentSandboxId)
                .capabilityToken(bearerToken(authorization))
                .build();
    }

    static String bearerToken(String authorization) {
        if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
