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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.model.AuthorizationDecision;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.AuthorizationOraclePort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Policy decision point reached over HTTP.
 *
 * <p>
 * POSTs {@code {subject, resource, action, context}} to
 * {@code toolexec.security.oracle.url} and expects
 * {@code {allowed, reason, ttl_seconds}} back. Transport errors and non-2xx
 * responses fail the future; the permission checker turns that into a denial.
 */
@Component
@ConditionalOnProperty(name = "toolexec.security.oracle.mode", havingValue = "http")
@Slf4j
public class HttpAuthorizationOracleAdapter implements AuthorizationOraclePort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ToolExecProperties.OracleProperties settings;

    public HttpAuthorizationOracleAdapter(OkHttpClient baseHttpClient, ObjectMapper objectMapper,
            ToolExecProperties properties) {
        this.settings = properties.getSecurity().getOracle();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(settings.getTimeout())
                .readTimeout(settings.getTimeout())
                .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public CompletableFuture<AuthorizationDecision> authorize(String subject, String resource, String action,
            Map<String, Object> context) {
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("subject", subject);
            payload.put("resource", resource);
            payload.put("action", action);
            payload.put("context", context != null ? context : Map.of());
            try {
                Request request = new Request.Builder()
                        .url(settings.getUrl())
                        .post(RequestBody.create(objectMapper.writeValueAsString(payload), JSON))
                        .build();
                try (Response response = httpClient.newCall(request).execute()) {
                    ResponseBody body = response.body();
                    if (!response.isSuccessful() || body == null) {
                        throw new IllegalStateException("Authorization oracle returned HTTP " + response.code());
                    }
                    return parse(objectMapper.readTree(body.string()));
                }
            } catch (IOException e) {
                log.warn("[Permission] Authorization oracle call failed: {}", e.getMessage());
                throw new UncheckedIOException(e);
            }
        });
    }

    private AuthorizationDecision parse(JsonNode node) {
        JsonNode allowed = node.get("allowed");
        if (allowed == null || !allowed.isBoolean()) {
            throw new IllegalStateException("Authorization oracle answer has no 'allowed' flag");
        }
        Duration ttl = node.has("ttl_seconds")
                ? Duration.ofSeconds(node.get("ttl_seconds").asLong())
                : settings.getDefaultTtl();
        String reason = node.has("reason") ? node.get("reason").asText() : null;
        return allowed.asBoolean() ? new AuthorizationDecision(true, reason, ttl)
                : AuthorizationDecision.deny(reason != null ? reason : "Denied by policy", ttl);
    }
}
