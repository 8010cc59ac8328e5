package me.golemcore.toolexec.domain.service;

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
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.ResourceLimits;
import me.golemcore.toolexec.domain.model.ToolManifest;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resource sub-allocation and per-agent concurrency slots.
 *
 * <p>
 * The effective limits of an invocation are the caller's request, falling back
 * dimension by dimension to the manifest's limits and then to the configured
 * tool defaults. They must fit inside the manifest limits, which in turn must
 * fit inside the agent's limits. Violations are configuration errors and are
 * rejected before anything is provisioned.
 */
@Service
@Slf4j
public class ResourceAllocator {

    private final ToolExecProperties.ExecutionProperties settings;
    private final Map<String, Integer> activeByAgent = new ConcurrentHashMap<>();

    public ResourceAllocator(ToolExecProperties properties) {
        this.settings = properties.getExecution();
    }

    /**
     * Compute the effective limits of one invocation.
     *
     * @throws ToolExecutionException
     *             {@code validation_failed} when any level sets a zero or
     *             negative limit, {@code resource_limit_exceeded} when a level
     *             does not fit inside its parent
     */
    public ResourceLimits resolve(ResourceLimits requested, ToolManifest manifest, ResourceLimits agentLimits) {
        ResourceLimits agent = agentLimits != null ? agentLimits : settings.getAgentDefaults().toLimits();
        ResourceLimits tool = toolLimits(manifest);
        requirePositive("Agent", agent);
        requirePositive("Tool", tool);
        if (requested != null) {
            requirePositive("Requested", requested);
        }

        List<String> toolViolations = tool.violationsAgainst(agent);
        if (!toolViolations.isEmpty()) {
            throw violation("Tool limits exceed agent limits", toolViolations);
        }
        ResourceLimits effective = merge(requested, tool);
        List<String> requestViolations = effective.violationsAgainst(tool);
        if (!requestViolations.isEmpty()) {
            throw violation("Requested limits exceed tool limits", requestViolations);
        }
        return effective;
    }

    /**
     * Take one concurrency slot for {@code agentId}.
     *
     * @throws ToolExecutionException
     *             {@code concurrency_limit_exceeded} when the agent is at its
     *             limit
     */
    public void acquireSlot(String agentId) {
        String key = agentId != null ? agentId : "";
        int limit = settings.getMaxConcurrentPerAgent();
        boolean[] granted = new boolean[1];
        activeByAgent.compute(key, (id, active) -> {
            int current = active != null ? active : 0;
            if (current >= limit) {
                return current;
            }
            granted[0] = true;
            return current + 1;
        });
        if (!granted[0]) {
            log.info("[Orchestrator] Agent {} is at its limit of {} concurrent tools", agentId, limit);
            throw new ToolExecutionException(ErrorCode.CONCURRENCY_LIMIT_EXCEEDED,
                    "Agent " + agentId + " already runs " + limit + " tools");
        }
    }

    public void releaseSlot(String agentId) {
        activeByAgent.computeIfPresent(agentId != null ? agentId : "",
                (id, active) -> active <= 1 ? null : active - 1);
    }

    public int activeSlots(String agentId) {
        return activeByAgent.getOrDefault(agentId != null ? agentId : "", 0);
    }

    private ResourceLimits toolLimits(ToolManifest manifest) {
        ResourceLimits defaults = settings.getToolDefaults().toLimits();
        ResourceLimits declared = manifest.getResourceLimits() != null ? manifest.getResourceLimits()
                : ResourceLimits.builder().build();
        Integer timeout = declared.getTimeoutSeconds() != null ? declared.getTimeoutSeconds()
                : manifest.getDefaultTimeoutSeconds();
        return ResourceLimits.builder()
                .cpuMillicores(firstNonNull(declared.getCpuMillicores(), defaults.getCpuMillicores()))
                .memoryMb(firstNonNull(declared.getMemoryMb(), defaults.getMemoryMb()))
                .timeoutSeconds(firstNonNull(timeout, defaults.getTimeoutSeconds()))
                .build();
    }

    private static ResourceLimits merge(ResourceLimits requested, ResourceLimits tool) {
        if (requested == null) {
            return tool.toBuilder().build();
        }
        return ResourceLimits.builder()
                .cpuMillicores(firstNonNull(requested.getCpuMillicores(), tool.getCpuMillicores()))
                .memoryMb(firstNonNull(requested.getMemoryMb(), tool.getMemoryMb()))
                .timeoutSeconds(firstNonNull(requested.getTimeoutSeconds(), tool.getTimeoutSeconds()))
                .build();
    }

    private static Integer firstNonNull(Integer first, Integer second) {
        return first != null ? first : second;
    }

    private static void requirePositive(String level, ResourceLimits limits) {
        List<String> invalid = limits.nonPositiveDimensions();
        if (!invalid.isEmpty()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("violations", invalid);
            throw new ToolExecutionException(ErrorCode.VALIDATION_FAILED,
                    level + " limits must be positive: " + invalid, details, null);
        }
    }

    private static ToolExecutionException violation(String message, List<String> violations) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("violations", violations);
        return new ToolExecutionException(ErrorCode.RESOURCE_LIMIT_EXCEEDED, message + ": " + violations, details,
                null);
    }
}
