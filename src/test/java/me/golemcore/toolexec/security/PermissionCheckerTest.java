package me.golemcore.toolexec.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolexec.domain.model.AuthorizationDecision;
import me.golemcore.toolexec.domain.model.CallerIdentity;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.PermissionDecision;
import me.golemcore.toolexec.domain.model.PolicyChangedEvent;
import me.golemcore.toolexec.domain.model.ToolGrant;
import me.golemcore.toolexec.domain.model.ToolManifest;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.AuthorizationOraclePort;
import me.golemcore.toolexec.port.outbound.ToolRegistryPort;
import me.golemcore.toolexec.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PermissionCheckerTest {

    private static final String AGENT = "agent-7";
    private static final String TENANT = "acme";
    private static final String SECRET = "permission-checker-test-secret-0123456789";

    private MutableClock clock;
    private ToolExecProperties properties;
    private CapabilityTokenVerifier verifier;
    private AuthorizationOraclePort oracle;
    private ToolRegistryPort registry;
    private PermissionDecisionCache cache;
    private PermissionChecker checker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        properties = new ToolExecProperties();
        properties.getSecurity().setCapabilitySecret(SECRET);
        properties.getSecurity().getOracle().setTimeout(Duration.ofMillis(100));
        verifier = new CapabilityTokenVerifier(properties, clock);
        verifier.init();
        oracle = mock(AuthorizationOraclePort.class);
        registry = mock(ToolRegistryPort.class);
        cache = new PermissionDecisionCache(clock, properties);
        checker = new PermissionChecker(verifier, oracle, cache, registry, clock, properties, new ObjectMapper());
    }

    // ===== Credential checks =====

    @Test
    void shouldDenyToolNotGrantedWhenRequiredCredentialIsMissing() {
        ToolManifest manifest = manifest("credentialed-echo").toBuilder()
                .requiredCredentials(List.of("demo_api_key"))
                .build();
        String token = token(List.of(new ToolGrant("credentialed-echo", "*")), Set.of());

        PermissionDecision decision = checker.check(token, manifest, Map.of(), null);

        assertFalse(decision.isAllowed());
        assertEquals(ErrorCode.TOOL_NOT_GRANTED, decision.getErrorCode());
        assertFalse(decision.toError().isRetryable());
        verify(oracle, never()).authorize(anyString(), anyString(), anyString(), anyMap());
    }

    @Test
    void shouldAllowCredentialedToolWhenCredentialPermissionIsGranted() {
        allowFor(Duration.ofSeconds(30));
        ToolManifest manifest = manifest("credentialed-echo").toBuilder()
                .requiredCredentials(List.of("demo_api_key"))
                .build();
        String token = token(List.of(new ToolGrant("credentialed-echo", "*")), Set.of("credential:demo_api_key"));

        assertTrue(checker.check(token, manifest, Map.of(), null).isAllowed());
    }

    @Test
    void shouldDenyWhenGrantDoesNotCoverVersion() {
        String token = token(List.of(new ToolGrant("echo", "^2.0.0")), Set.of());

        PermissionDecision decision = checker.check(token, manifest("echo"), Map.of(), null);

        assertEquals(ErrorCode.TOOL_NOT_GRANTED, decision.getErrorCode());
    }

    @Test
    void shouldDenyWhenRequiredPermissionIsMissing() {
        ToolManifest manifest = manifest("echo").toBuilder().requiredPermissions(List.of("files:write")).build();
        String token = token(List.of(new ToolGrant("echo", "1.x")), Set.of("files:read"));

        PermissionDecision decision = checker.check(token, manifest, Map.of(), null);

        assertEquals(ErrorCode.TOOL_NOT_GRANTED, decision.getErrorCode());
        assertTrue(decision.getReason().contains("files:write"));
    }

    @Test
    void shouldRejectTamperedToken() {
        String token = token(List.of(new ToolGrant("echo", "*")), Set.of());

        PermissionDecision decision = checker.check(token + "x", manifest("echo"), Map.of(), null);

        assertEquals(ErrorCode.INVALID_CREDENTIAL, decision.getErrorCode());
    }

    @Test
    void shouldRejectExpiredToken() {
        String token = token(List.of(new ToolGrant("echo", "*")), Set.of());
        clock.advance(Duration.ofMinutes(11));

        PermissionDecision decision = checker.check(token, manifest("echo"), Map.of(), null);

        assertEquals(ErrorCode.INVALID_CREDENTIAL, decision.getErrorCode());
    }

    @Test
    void shouldRejectTokenIssuedToAnotherAgent() {
        String token = token(List.of(new ToolGrant("echo", "*")), Set.of());
        CallerIdentity caller = CallerIdentity.builder()
                .agentId("agent-9")
                .tenantId(TENANT)
                .capabilityToken(token)
                .build();

        PermissionDecision decision = checker.check(caller, manifest("echo"), Map.of(), null);

        assertEquals(ErrorCode.INVALID_CREDENTIAL, decision.getErrorCode());
    }

    // ===== Oracle =====

    @Test
    void shouldFailClosedWhenOracleTimesOut() {
        when(oracle.authorize(anyString(), anyString(), anyString(), anyMap()))
                .thenReturn(new CompletableFuture<>());

        PermissionDecision decision = checker.check(grantedToken(), manifest("echo"), Map.of(), null);

        assertFalse(decision.isAllowed());
        assertEquals(ErrorCode.AUTHORIZATION_UNAVAILABLE, decision.getErrorCode());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldFailClosedWhenOracleErrors() {
        when(oracle.authorize(anyString(), anyString(), anyString(), anyMap()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("policy engine down")));

        PermissionDecision first = checker.check(grantedToken(), manifest("echo"), Map.of(), null);
        PermissionDecision second = checker.check(grantedToken(), manifest("echo"), Map.of(), null);

        assertEquals(ErrorCode.AUTHORIZATION_UNAVAILABLE, first.getErrorCode());
        assertEquals(ErrorCode.AUTHORIZATION_UNAVAILABLE, second.getErrorCode());
        verify(oracle, times(2)).authorize(anyString(), anyString(), anyString(), anyMap());
    }

    @Test
    void shouldFailClosedWhenNoBudgetLeft() {
        PermissionDecision decision = checker.check(grantedToken(), manifest("echo"), Map.of(), Duration.ZERO);

        assertEquals(ErrorCode.AUTHORIZATION_UNAVAILABLE, decision.getErrorCode());
        verify(oracle, never()).authorize(anyString(), anyString(), anyString(), anyMap());
    }

    @Test
    void shouldMapOracleDenialToPermissionDenied() {
        when(oracle.authorize(anyString(), anyString(), anyString(), anyMap()))
                .thenReturn(CompletableFuture.completedFuture(
                        AuthorizationDecision.deny("outside business hours", Duration.ofSeconds(30))));

        PermissionDecision decision = checker.check(grantedToken(), manifest("echo"), Map.of(), null);

        assertEquals(ErrorCode.PERMISSION_DENIED, decision.getErrorCode());
        assertEquals("outside business hours", decision.getReason());
    }

    @Test
    void shouldPassSubjectResourceAndTenantToOracle() {
        allowFor(Duration.ofSeconds(30));

        checker.check(grantedToken(), manifest("echo"), Map.of("purpose", "demo"), null);

        verify(oracle).authorize(eq(AGENT), eq("tool:echo@1.0.0"), eq("invoke"),
                eq(Map.of("purpose", "demo", "tenant_id", TENANT)));
    }

    // ===== Decision cache =====

    @Test
    void shouldCacheAllowDecisionForOracleTtl() {
        allowFor(Duration.ofSeconds(30));

        PermissionDecision first = checker.check(grantedToken(), manifest("echo"), Map.of(), null);
        PermissionDecision second = checker.check(grantedToken(), manifest("echo"), Map.of(), null);

        assertTrue(first.isAllowed());
        assertFalse(first.isCached());
        assertTrue(second.isAllowed());
        assertTrue(second.isCached());
        verify(oracle, times(1)).authorize(anyString(), anyString(), anyString(), anyMap());

        clock.advance(Duration.ofSeconds(31));
        checker.check(grantedToken(), manifest("echo"), Map.of(), null);
        verify(oracle, times(2)).authorize(anyString(), anyString(), anyString(), anyMap());
    }

    @Test
    void shouldKeyCacheByContext() {
        allowFor(Duration.ofSeconds(30));

        checker.check(grantedToken(), manifest("echo"), Map.of("project", "a"), null);
        checker.check(grantedToken(), manifest("echo"), Map.of("project", "b"), null);

        verify(oracle, times(2)).authorize(anyString(), anyString(), anyString(), anyMap());
    }

    @Test
    void shouldCapCachedTtlAtConfiguredMaximum() {
        allowFor(Duration.ofHours(1));

        PermissionDecision decision = checker.check(grantedToken(), manifest("echo"), Map.of(), null);

        assertEquals(clock.instant().plus(Duration.ofMinutes(5)), decision.getExpiresAt());
    }

    @Test
    void shouldNotCacheDecisionWithoutTtl() {
        allowFor(null);

        checker.check(grantedToken(), manifest("echo"), Map.of(), null);

        assertEquals(0, cache.size());
    }

    @Test
    void shouldPurgeCachedDecisionsOnPolicyChange() {
        allowFor(Duration.ofSeconds(30));
        checker.check(grantedToken(), manifest("echo"), Map.of(), null);
        assertEquals(1, cache.size());

        checker.onPolicyChanged(new PolicyChangedEvent(Set.of("someone-else")));
        assertEquals(1, cache.size());

        checker.onPolicyChanged(new PolicyChangedEvent(Set.of(AGENT)));
        assertEquals(0, cache.size());
    }

    @Test
    void shouldProduceStableContextHashRegardlessOfKeyOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("a", 1);
        first.put("b", 2);
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("b", 2);
        second.put("a", 1);

        assertEquals(checker.contextHash(first), checker.contextHash(second));
    }

    @Test
    void shouldLookUpManifestByCoordinates() {
        allowFor(Duration.ofSeconds(30));
        when(registry.getVersion("echo", "1.0.0")).thenReturn(Optional.of(manifest("echo")));

        PermissionDecision decision = checker.check(grantedToken(), "echo", "1.0.0", Map.of());

        assertTrue(decision.isAllowed());
        verify(registry).getVersion("echo", "1.0.0");
    }

    private void allowFor(Duration ttl) {
        when(oracle.authorize(anyString(), anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.completedFuture(AuthorizationDecision.allow(ttl)));
    }

    private String grantedToken() {
        return token(List.of(new ToolGrant("echo", "*")), Set.of());
    }

    private String token(List<ToolGrant> grants, Set<String> permissions) {
        return verifier.issue(AGENT, TENANT, grants, permissions, Duration.ofMinutes(10));
    }

    private static ToolManifest manifest(String toolId) {
        return ToolManifest.builder().toolId(toolId).version("1.0.0").build();
    }
}
