package me.golemcore.toolexec.adapter.outbound.authz;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolexec.domain.model.AuthorizationDecision;
import me.golemcore.toolexec.infrastructure.config.AutoConfiguration;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpAuthorizationOracleAdapterTest {

    private OkHttpMockEngine engine;
    private ObjectMapper objectMapper;
    private HttpAuthorizationOracleAdapter adapter;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        objectMapper = AutoConfiguration.objectMapper();
        ToolExecProperties properties = new ToolExecProperties();
        properties.getSecurity().getOracle().setMode("http");
        properties.getSecurity().getOracle().setUrl("https://pdp.example.test/v1/decide");
        properties.getSecurity().getOracle().setDefaultTtl(Duration.ofSeconds(45));
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(engine).build();
        adapter = new HttpAuthorizationOracleAdapter(client, objectMapper, properties);
    }

    @Test
    void shouldPostDecisionRequestAndReadAnswer() throws Exception {
        engine.enqueueJson(200, "{\"allowed\":true,\"reason\":\"role:builder\",\"ttl_seconds\":120}");

        AuthorizationDecision decision = adapter.authorize("agent-1", "tool:echo@1.0.0", "invoke",
                Map.of("tenant_id", "acme")).get(5, TimeUnit.SECONDS);

        assertTrue(decision.allowed());
        assertEquals("role:builder", decision.reason());
        assertEquals(Duration.ofSeconds(120), decision.ttl());

        OkHttpMockEngine.CapturedRequest request = engine.takeRequest();
        assertEquals("POST", request.method());
        assertEquals("/v1/decide", request.target());
        JsonNode body = objectMapper.readTree(request.body());
        assertEquals("agent-1", body.get("subject").asText());
        assertEquals("tool:echo@1.0.0", body.get("resource").asText());
        assertEquals("invoke", body.get("action").asText());
        assertEquals("acme", body.get("context").get("tenant_id").asText());
    }

    @Test
    void shouldUseDefaultTtlAndReasonForBareDenial() throws Exception {
        engine.enqueueJson(200, "{\"allowed\":false}");

        AuthorizationDecision decision = adapter.authorize("agent-1", "tool:echo@1.0.0", "invoke", null)
                .get(5, TimeUnit.SECONDS);

        assertFalse(decision.allowed());
        assertEquals("Denied by policy", decision.reason());
        assertEquals(Duration.ofSeconds(45), decision.ttl());
    }

    @Test
    void shouldFailOnServerError() {
        engine.enqueueJson(503, "{}");

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> adapter.authorize("agent-1", "tool:echo@1.0.0", "invoke", Map.of()).get(5, TimeUnit.SECONDS));

        assertTrue(ex.getCause() instanceof IllegalStateException);
    }

    @Test
    void shouldFailOnMalformedAnswer() {
        engine.enqueueJson(200, "{\"decision\":\"yes\"}");

        assertThrows(ExecutionException.class,
                () -> adapter.authorize("agent-1", "tool:echo@1.0.0", "invoke", Map.of()).get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldFailOnTransportError() {
        engine.enqueueFailure(new IOException("connection refused"));

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> adapter.authorize("agent-1", "tool:echo@1.0.0", "invoke", Map.of()).get(5, TimeUnit.SECONDS));

        assertTrue(ex.getCause() instanceof UncheckedIOException);
    }
}
