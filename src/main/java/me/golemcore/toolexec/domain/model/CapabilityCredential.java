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

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Verified contents of a capability token.
 */
@Value
@Builder
public class CapabilityCredential {

    String subject;
    String tenantId;
    String tokenId;
    @Singular
    List<ToolGrant> grants;
    @Singular
    Set<String> permissions;
    Instant issuedAt;
    Instant expiresAt;

    public boolean grants(String toolId, String version) {
        return grants.stream().anyMatch(grant -> grant.covers(toolId, version));
    }
}
