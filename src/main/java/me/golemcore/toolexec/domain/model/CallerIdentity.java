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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Who is invoking: the agent, its tenant and session, the capability
 * credential it presented, and the isolation boundary and limits it runs
 * under.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CallerIdentity {

    private String agentId;
    private String tenantId;
    private String sessionId;

    @ToString.Exclude
    @JsonIgnore
    private String capabilityToken;

    private String parentSandboxId;
    private ResourceLimits agentLimits;

    public boolean sameTenant(CallerIdentity other) {
        return other != null && tenantId != null && tenantId.equals(other.getTenantId());
    }
}
