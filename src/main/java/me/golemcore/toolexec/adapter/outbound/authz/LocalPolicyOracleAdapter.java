package me.golemcore.toolexec.adapter.outbound.authz;

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
import me.golemcore.toolexec.domain.model.AuthorizationDecision;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.AuthorizationOraclePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * In-process policy: allow unless the subject is listed in
 * {@code denied-subjects} or the tool is listed for it in
 * {@code denied-tools} ({@code subject -> [toolId, ...]}, {@code *} for all
 * subjects).
 */
@Component
@ConditionalOnProperty(name = "toolexec.security.oracle.mode", havingValue = "local", matchIfMissing = true)
@Slf4j
public class LocalPolicyOracleAdapter implements AuthorizationOraclePort {

    private static final String RESOURCE_PREFIX = "tool:";
    private static final String ANY_SUBJECT = "*";

    private final ToolExecProperties.OracleProperties settings;

    public LocalPolicyOracleAdapter(ToolExecProperties properties) {
        this.settings = properties.getSecurity().getOracle();
    }

    @Override
    public CompletableFuture<AuthorizationDecision> authorize(String subject, String resource, String action,
            Map<String, Object> context) {
        if (settings.getDeniedSubjects().contains(subject)) {
            return CompletableFuture.completedFuture(
                    AuthorizationDecision.deny("Subject " + subject + " is blocked", settings.getDefaultTtl()));
        }
        String toolId = toolIdOf(resource);
        if (isDenied(subject, toolId) || isDenied(ANY_SUBJECT, toolId)) {
            log.debug("[Permission] Local policy denies {} on {}", subject, resource);
            return CompletableFuture.completedFuture(
                    AuthorizationDecision.deny("Tool " + toolId + " is denied for " + subject,
                            settings.getDefaultTtl()));
        }
        return CompletableFuture.completedFuture(AuthorizationDecision.allow(settings.getDefaultTtl()));
    }

    private boolean isDenied(String subject, String toolId) {
        List<String> tools = settings.getDeniedTools().get(subject);
        return tools != null && tools.contains(toolId);
    }

    private static String toolIdOf(String resource) {
        String coordinates = resource.startsWith(RESOURCE_PREFIX) ? resource.substring(RESOURCE_PREFIX.length())
                : resource;
        int at = coordinates.indexOf('@');
        return at >= 0 ? coordinates.substring(0, at) : coordinates;
    }
}
