package me.golemcore.toolexec.security;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.AuthorizationDecision;
import me.golemcore.toolexec.domain.model.CallerIdentity;
import me.golemcore.toolexec.domain.model.CapabilityCredential;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.PermissionDecision;
import me.golemcore.toolexec.domain.model.PolicyChangedEvent;
import me.golemcore.toolexec.domain.model.ToolManifest;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.AuthorizationOraclePort;
import me.golemcore.toolexec.port.outbound.ToolRegistryPort;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a caller may invoke a tool version.
 *
 * <p>
 * Order of checks:
 * <ol>
 * <li>capability token signature and expiry ({@code invalid_credential})</li>
 * <li>grant list covers the tool version and the token's permissions cover the
 * manifest's required permissions ({@code tool_not_granted})</li>
 * <li>decision cache</li>
 * <li>authorization oracle, bounded by a short timeout; any error or timeout
 * denies with {@code authorization_unavailable} and is not cached</li>
 * </ol>
 * Oracle answers are cached for the TTL the oracle returns, capped by
 * {@code toolexec.security.decision-cache-max-ttl}.
 */
@Service
@Slf4j
public class PermissionChecker {

    static final String ACTION_INVOKE = "invoke";
    static final String CREDENTIAL_PERMISSION_PREFIX = "credential:";

    private final CapabilityTokenVerifier tokenVerifier;
    private final AuthorizationOraclePort oracle;
    private final PermissionDecisionCache cache;
    private final ToolRegistryPort registry;
    private final Clock clock;
    private final ToolExecProperties properties;
    private final ObjectMapper canonicalMapper;

    public PermissionChecker(CapabilityTokenVerifier tokenVerifier, AuthorizationOraclePort oracle,
            PermissionDecisionCache cache, ToolRegistryPort registry, Clock clock, ToolExecProperties properties,
            ObjectMapper objectMapper) {
        this.tokenVerifier = tokenVerifier;
        this.oracle = oracle;
        this.cache = cache;
        this.registry = registry;
        this.clock = clock;
        this.properties = properties;
        this.canonicalMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    /**
     * Check by coordinates. Required permissions are read from the registry when
     * the version is published there.
     */
    public PermissionDecision check(String credential, String toolId, String version, Map<String, Object> context) {
        Optional<ToolManifest> manifest = registry.getVersion(toolId, version);
        ToolManifest target = manifest.orElseGet(() -> ToolManifest.builder().toolId(toolId).version(version).build());
        return check(credential, target, context, null);
    }

    /**
     * Check for a caller: the token's subject and tenant must also match the
     * identity the caller presented.
     */
    public PermissionDecision check(CallerIdentity caller, ToolManifest manifest, Map<String, Object> context,
            Duration budget) {
        return check(caller.getCapabilityToken(), caller, manifest, context, budget);
    }

    public PermissionDecision check(String credential, ToolManifest manifest, Map<String, Object> context,
            Duration budget) {
        return check(credential, null, manifest, context, budget);
    }

    private PermissionDecision check(String credential, CallerIdentity caller, ToolManifest manifest,
            Map<String, Object> context, Duration budget) {
        CapabilityCredential capability;
        try {
            capability = tokenVerifier.verify(credential);
        } catch (ToolExecutionException e) {
            return PermissionDecision.deny(null, ErrorCode.INVALID_CREDENTIAL, e.getMessage());
        }
        String subject = capability.getSubject();

        if (caller != null) {
            if (caller.getAgentId() != null && !caller.getAgentId().equals(subject)) {
                return PermissionDecision.deny(subject, ErrorCode.INVALID_CREDENTIAL,
                        "Capability credential was issued to a different agent");
            }
            if (caller.getTenantId() != null && capability.getTenantId() != null
                    && !caller.getTenantId().equals(capability.getTenantId())) {
                return PermissionDecision.deny(subject, ErrorCode.INVALID_CREDENTIAL,
                        "Capability credential was issued for a different tenant");
            }
        }

        String toolId = manifest.getToolId();
        String version = manifest.getVersion();
        if (!capability.grants(toolId, version)) {
            log.info("[Permission] {} has no grant for {}", subject, manifest.coordinates());
            return PermissionDecision.deny(subject, ErrorCode.TOOL_NOT_GRANTED,
                    "Credential does not grant " + manifest.coordinates());
        }
        List<String> missing = new ArrayList<>();
        for (String permission : manifest.getRequiredPermissions()) {
            if (!capability.getPermissions().contains(permission)) {
                missing.add(permission);
            }
        }
        for (String credentialName : manifest.getRequiredCredentials()) {
            String permission = CREDENTIAL_PERMISSION_PREFIX + credentialName;
            if (!capability.getPermissions().contains(permission)) {
                missing.add(permission);
            }
        }
        if (!missing.isEmpty()) {
            log.info("[Permission] {} lacks permissions {} for {}", subject, missing, manifest.coordinates());
            return PermissionDecision.deny(subject, ErrorCode.TOOL_NOT_GRANTED,
                    "Credential does not grant required permissions " + missing);
        }

        Map<String, Object> oracleContext = context != null ? context : Map.of();
        PermissionDecisionCache.Key key = new PermissionDecisionCache.Key(subject, toolId, version,
                contextHash(oracleContext));
        Optional<PermissionDecision> cached = cache.get(key);
        if (cached.isPresent()) {
            return cached.get();
        }

        PermissionDecision decision = askOracle(subject, capability, manifest, oracleContext, budget);
        if (decision.getExpiresAt() != null) {
            cache.put(key, decision);
        }
        return decision;
    }

    @EventListener
    public void onPolicyChanged(PolicyChangedEvent event) {
        if (event.affectsAll()) {
            log.info("[Permission] Policy changed for all subjects, clearing decision cache");
            cache.clear();
            return;
        }
        int purged = cache.purgeSubjects(event.subjects());
        log.info("[Permission] Policy changed for {}, purged {} cached decisions", event.subjects(), purged);
    }

    private PermissionDecision askOracle(String subject, CapabilityCredential capability, ToolManifest manifest,
            Map<String, Object> context, Duration budget) {
        Duration timeout = properties.getSecurity().getOracle().getTimeout();
        if (budget != null && budget.compareTo(timeout) < 0) {
            timeout = budget;
        }
        if (timeout.isZero() || timeout.isNegative()) {
            return PermissionDecision.deny(subject, ErrorCode.AUTHORIZATION_UNAVAILABLE,
                    "No time left to consult the authorization oracle");
        }

        Map<String, Object> request = new LinkedHashMap<>(context);
        if (capability.getTenantId() != null) {
            request.putIfAbsent("tenant_id", capability.getTenantId());
        }
        String resource = "tool:" + manifest.coordinates();

        AuthorizationDecision answer;
        try {
            answer = oracle.authorize(subject, resource, ACTION_INVOKE, request)
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return unavailable(subject, "interrupted");
        } catch (TimeoutException e) {
            return unavailable(subject, "timed out after " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return unavailable(subject, cause.getMessage());
        } catch (RuntimeException e) {
            return unavailable(subject, e.getMessage());
        }
        if (answer == null) {
            return unavailable(subject, "empty answer");
        }

        Instant expiresAt = expiry(answer.ttl());
        if (answer.allowed()) {
            return PermissionDecision.allow(subject, answer.reason(), expiresAt);
        }
        log.info("[Permission] Oracle denied {} on {}: {}", subject, resource, answer.reason());
        return PermissionDecision.deny(subject, ErrorCode.PERMISSION_DENIED,
                answer.reason() != null ? answer.reason() : "Denied by policy")
                .toBuilder().expiresAt(expiresAt).build();
    }

    private PermissionDecision unavailable(String subject, String reason) {
        log.warn("[Permission] Authorization oracle unavailable for {}: {}", subject, reason);
        return PermissionDecision.deny(subject, ErrorCode.AUTHORIZATION_UNAVAILABLE,
                "Authorization oracle unavailable");
    }

    private Instant expiry(Duration oracleTtl) {
        if (oracleTtl == null || oracleTtl.isZero() || oracleTtl.isNegative()) {
            return null;
        }
        Duration maxTtl = properties.getSecurity().getDecisionCacheMaxTtl();
        Duration ttl = oracleTtl.compareTo(maxTtl) > 0 ? maxTtl : oracleTtl;
        return Instant.now(clock).plus(ttl);
    }

    String contextHash(Map<String, Object> context) {
        try {
            byte[] canonical = canonicalMapper.writeValueAsString(context).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Cannot hash permission context", e);
        }
    }
}
