package me.golemcore.toolexec.adapter.outbound.openapi;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.component.ToolExecutionContext;
import me.golemcore.toolexec.domain.component.ToolHandler;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.ProtocolBinding;
import me.golemcore.toolexec.domain.model.ProtocolKind;
import me.golemcore.toolexec.domain.model.ToolManifest;
import me.golemcore.toolexec.domain.model.ToolResult;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs tools bound to a single HTTP operation.
 *
 * <p>
 * {@code {name}} placeholders in the path are filled from parameters; the
 * remaining parameters go into the query string for GET and DELETE and into a
 * JSON body otherwise. Header values may reference a declared credential as
 * {@code ${credential:NAME}}. The request runs through the external-call
 * guard under the first declared external service (or the host name), so
 * 5xx responses and transport errors count as breaker failures.
 */
@Component
@Slf4j
public class OpenApiToolHandler implements ToolHandler {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Pattern PATH_PARAM = Pattern.compile("\\{([^}/]+)}");
    private static final Pattern CREDENTIAL_REF = Pattern.compile("\\$\\{credential:([^}]+)}");
    private static final Set<String> QUERY_METHODS = Set.of("GET", "DELETE", "HEAD");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OpenApiToolHandler(OkHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public ProtocolKind getProtocol() {
        return ProtocolKind.OPENAPI;
    }

    @Override
    public ToolResult execute(ToolManifest manifest, ToolExecutionContext context) {
        if (!(manifest.getBinding() instanceof ProtocolBinding.OpenApiBinding binding)) {
            throw new ToolExecutionException(ErrorCode.TOOL_UNAVAILABLE,
                    manifest.coordinates() + " has no OpenAPI binding");
        }
        Request request = buildRequest(binding, context);
        String serviceId = !manifest.getExternalServices().isEmpty() ? manifest.getExternalServices().get(0)
                : request.url().host();

        HttpOutcome outcome = context.callExternal(serviceId, () -> send(request));
        if (outcome.code() >= 400) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("http_status", outcome.code());
            return ToolResult.builder()
                    .success(false)
                    .errorCode(ErrorCode.EXECUTION_FAILED)
                    .error("HTTP " + outcome.code() + " from " + serviceId)
                    .details(details)
                    .build();
        }
        return ToolResult.success(toOutput(outcome.body()));
    }

    Request buildRequest(ProtocolBinding.OpenApiBinding binding, ToolExecutionContext context) {
        Map<String, Object> remaining = new LinkedHashMap<>(context.getParameters());
        Matcher matcher = PATH_PARAM.matcher(binding.path() != null ? binding.path() : "");
        StringBuilder path = new StringBuilder();
        while (matcher.find()) {
            Object value = remaining.remove(matcher.group(1));
            if (value == null) {
                throw new ToolExecutionException(ErrorCode.VALIDATION_FAILED,
                        "Missing path parameter " + matcher.group(1));
            }
            matcher.appendReplacement(path, Matcher.quoteReplacement(
                    HttpUrl.parse("http://x/").newBuilder().addPathSegment(String.valueOf(value)).build()
                            .encodedPathSegments().get(0)));
        }
        matcher.appendTail(path);

        HttpUrl base = HttpUrl.parse(stripTrailingSlash(binding.baseUrl()) + path);
        if (base == null) {
            throw new ToolExecutionException(ErrorCode.TOOL_UNAVAILABLE, "Invalid URL " + binding.baseUrl() + path);
        }
        String method = binding.method() != null ? binding.method().toUpperCase(Locale.ROOT) : "GET";
        HttpUrl.Builder url = base.newBuilder();
        RequestBody body = null;
        if (QUERY_METHODS.contains(method)) {
            remaining.forEach((name, value) -> url.addQueryParameter(name, String.valueOf(value)));
        } else {
            try {
                body = RequestBody.create(objectMapper.writeValueAsString(remaining), JSON);
            } catch (IOException e) {
                throw new ToolExecutionException(ErrorCode.VALIDATION_FAILED, "Parameters are not serializable", e);
            }
        }

        Request.Builder builder = new Request.Builder().url(url.build()).method(method, body);
        if (binding.headers() != null) {
            binding.headers().forEach((name, value) -> builder.header(name, resolveCredentials(value, context)));
        }
        return builder.build();
    }

    private HttpOutcome send(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            if (response.code() >= 500) {
                throw new IOException("HTTP " + response.code());
            }
            return new HttpOutcome(response.code(), text);
        }
    }

    private Map<String, Object> toOutput(String body) {
        if (body == null || body.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node.isObject()) {
                return objectMapper.convertValue(node, MAP_TYPE);
            }
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put("body", objectMapper.convertValue(node, Object.class));
            return wrapped;
        } catch (IOException e) {
            log.debug("Response is not JSON, returning as text: {}", e.getMessage());
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put("body", body);
            return wrapped;
        }
    }

    private static String resolveCredentials(String value, ToolExecutionContext context) {
        Matcher matcher = CREDENTIAL_REF.matcher(value);
        StringBuilder resolved = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(resolved, Matcher.quoteReplacement(context.getSecret(matcher.group(1))));
        }
        matcher.appendTail(resolved);
        return resolved.toString();
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private record HttpOutcome(int code, String body) {
    }
}
