package me.golemcore.toolexec.adapter.outbound.openapi;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolexec.adapter.outbound.store.InMemoryCircuitStateStore;
import me.golemcore.toolexec.circuit.CircuitBreakerService;
import me.golemcore.toolexec.domain.component.ToolExecutionContext;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.CircuitStateType;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.ProtocolBinding;
import me.golemcore.toolexec.domain.model.RetryPolicy;
import me.golemcore.toolexec.domain.model.SecretLease;
import me.golemcore.toolexec.domain.model.ToolManifest;
import me.golemcore.toolexec.domain.model.ToolResult;
import me.golemcore.toolexec.domain.service.ExternalCallGuard;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.infrastructure.event.SpringEventBus;
import me.golemcore.toolexec.ratelimit.TokenBucketRateLimiter;
import me.golemcore.toolexec.testsupport.MutableClock;
import me.golemcore.toolexec.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;

class OpenApiToolHandlerTest {

    private static final String BASE_URL = "https://api.example.test/v1";

    private MutableClock clock;
    private OkHttpMockEngine engine;
    private CircuitBreakerService circuitBreaker;
    private ExternalCallGuard guard;
    private OpenApiToolHandler handler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        engine = new OkHttpMockEngine();
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        ToolExecProperties properties = new ToolExecProperties();
        circuitBreaker = new CircuitBreakerService(new InMemoryCircuitStateStore(), mock(SpringEventBus.class),
                clock, properties);
        guard = new ExternalCallGuard(new TokenBucketRateLimiter(properties), circuitBreaker, clock);
        handler = new OpenApiToolHandler(client, new ObjectMapper());
    }

    @Test
    void shouldFillPathAndQueryForGet() {
        engine.enqueueJson(200, "{\"name\":\"golem\",\"stars\":42}");

        ToolResult result = handler.execute(manifest("GET", "/repos/{owner}/{repo}", Map.of()),
                context(Map.of("owner", "acme corp", "repo", "golem", "page", 2)));

        assertTrue(result.isSuccess());
        assertEquals("golem", result.getOutput().get("name"));
        assertEquals(42, result.getOutput().get("stars"));
        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("GET", request.method());
        assertEquals("/v1/repos/acme%20corp/golem?page=2", request.target());
    }

    @Test
    void shouldSendJsonBodyForPost() {
        engine.enqueueJson(201, "{\"id\":\"issue-7\"}");

        ToolResult result = handler.execute(manifest("post", "/issues", Map.of()),
                context(Map.of("title", "Broken build")));

        assertTrue(result.isSuccess());
        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("{\"title\":\"Broken build\"}", request.body());
        assertTrue(request.contentType().startsWith("application/json"));
    }

    @Test
    void shouldResolveCredentialReferencesInHeaders() {
        engine.enqueueJson(200, "{}");

        handler.execute(manifest("GET", "/me", Map.of("Authorization", "Bearer ${credential:github_token}")),
                context(Map.of()));

        assertEquals("Bearer s3cr3t", engine.takeRequest().header("Authorization"));
    }

    @Test
    void shouldWrapNonObjectBodies() {
        engine.enqueueJson(200, "[1,2,3]");
        engine.enqueueText(200, "plain words");

        ToolResult array = handler.execute(manifest("GET", "/list", Map.of()), context(Map.of()));
        ToolResult text = handler.execute(manifest("GET", "/text", Map.of()), context(Map.of()));

        assertEquals(List.of(1, 2, 3), array.getOutput().get("body"));
        assertEquals("plain words", text.getOutput().get("body"));
    }

    @Test
    void shouldReturnFailureForClientErrorsWithoutTrippingBreaker() {
        engine.enqueueJson(404, "{\"message\":\"Not Found\"}");

        ToolResult result = handler.execute(manifest("GET", "/missing", Map.of()), context(Map.of()));

        assertFalse(result.isSuccess());
        assertEquals(ErrorCode.EXECUTION_FAILED, result.getErrorCode());
        assertEquals(404, result.getDetails().get("http_status"));
        assertEquals(CircuitStateType.CLOSED, circuitBreaker.getState("github").getState());
        assertEquals(0, circuitBreaker.getState("github").failureCount());
    }

    @Test
    void shouldCountServerErrorsAsBreakerFailures() {
        engine.enqueueJson(503, "{}");

        ToolExecutionException ex = assertThrows(ToolExecutionException.class,
                () -> handler.execute(manifest("GET", "/flaky", Map.of()), context(Map.of())));

        assertEquals(ErrorCode.EXECUTION_FAILED, ex.getCode());
        assertEquals(1, circuitBreaker.getState("github").failureCount());
    }

    @Test
    void shouldCountTransportErrorsAsBreakerFailures() {
        engine.enqueueFailure(new IOException("connection refused"));

        assertThrows(ToolExecutionException.class,
                () -> handler.execute(manifest("GET", "/down", Map.of()), context(Map.of())));

        assertEquals(1, circuitBreaker.getState("github").failureCount());
    }

    @Test
    void shouldRejectMissingPathParameter() {
        ToolExecutionException ex = assertThrows(ToolExecutionException.class,
                () -> handler.execute(manifest("GET", "/repos/{owner}", Map.of()), context(Map.of())));

        assertEquals(ErrorCode.VALIDATION_FAILED, ex.getCode());
        assertEquals(0, engine.getRequestCount());
    }

    private ToolManifest manifest(String method, String path, Map<String, String> headers) {
        return ToolManifest.builder()
                .toolId("github_api")
                .version("1.0.0")
                .binding(new ProtocolBinding.OpenApiBinding(BASE_URL, method, path, headers))
                .externalServices(List.of("github"))
                .build();
    }

    private ToolExecutionContext context(Map<String, Object> parameters) {
        return ToolExecutionContext.builder()
                .invocationId("inv-1")
                .toolId("github_api")
                .tenantId("acme")
                .attempt(1)
                .parameters(parameters)
                .secrets(Map.of("github_token",
                        new SecretLease("github_token", "s3cr3t", clock.instant().plusSeconds(300))))
                .retryPolicy(RetryPolicy.none())
                .callGuard(guard)
                .clock(clock)
                .build();
    }
}
