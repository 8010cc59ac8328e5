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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Versioned declaration of a tool: schemas, permissions, resilience settings
 * and the protocol binding used to reach it.
 *
 * <p>
 * A manifest is immutable once published under a version; publishing a change
 * means publishing a new version. The control plane only reads manifests.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(value = "protocol", allowGetters = true)
public class ToolManifest {

    private String toolId;
    private String version;
    private String description;
    private ProtocolBinding binding;

    @Builder.Default
    private Map<String, Object> inputSchema = new LinkedHashMap<>();
    @Builder.Default
    private Map<String, Object> outputSchema = new LinkedHashMap<>();

    @Builder.Default
    private List<String> requiredPermissions = new ArrayList<>();
    @Builder.Default
    private List<String> requiredCredentials = new ArrayList<>();
    @Builder.Default
    private List<String> externalServices = new ArrayList<>();

    private Integer defaultTimeoutSeconds;
    @Builder.Default
    private RetryPolicy retryPolicy = RetryPolicy.none();
    private CircuitBreakerSettings circuitBreaker;
    private ResourceLimits resourceLimits;

    private boolean requiresApproval;
    private boolean resumable;

    @Builder.Default
    private ToolLifecycleState lifecycleState = ToolLifecycleState.ACTIVE;

    public ProtocolKind getProtocol() {
        return binding != null ? binding.protocol() : ProtocolKind.NATIVE;
    }

    public String coordinates() {
        return toolId + "@" + version;
    }
}
