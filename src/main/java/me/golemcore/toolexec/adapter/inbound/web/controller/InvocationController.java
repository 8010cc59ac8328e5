package me.golemcore.toolexec.adapter.inbound.web.controller;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.adapter.inbound.web.ErrorStatusMapper;
import me.golemcore.toolexec.adapter.inbound.web.dto.ApprovalDecisionRequest;
import me.golemcore.toolexec.adapter.inbound.web.dto.CancelRequest;
import me.golemcore.toolexec.adapter.inbound.web.dto.InvokeRequest;
import me.golemcore.toolexec.adapter.inbound.web.dto.ResumeRequest;
import me.golemcore.toolexec.domain.model.ApprovalDecision;
import me.golemcore.toolexec.domain.model.CallerIdentity;
import me.golemcore.toolexec.domain.model.CancelResult;
import me.golemcore.toolexec.domain.model.InvocationRequest;
import me.golemcore.toolexec.domain.model.InvocationResponse;
import me.golemcore.toolexec.domain.model.InvocationStatusView;
import me.golemcore.toolexec.domain.service.InvocationGateway;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.LinkedHashMap;

/**
 * REST surface of the invocation gateway.
 *
 * <p>
 * The caller is identified by {@code X-Agent-Id} and {@code X-Tenant-Id}; the
 * capability token travels as a bearer token. Synchronous invocations hold
 * the HTTP request until the tool finishes; async ones answer 202 with a poll
 * URL.
 */
@RestController
@RequestMapping("/api/invocations")
@RequiredArgsConstructor
@Slf4j
public class InvocationController {

    private final InvocationGateway gateway;

    @PostMapping
    public Mono<ResponseEntity<InvocationResponse>> invoke(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = CallerHeaders.AGENT_ID, required = false) String agentId,
            @RequestHeader(value = CallerHeaders.TENANT_ID, required = false) String tenantId,
            @RequestHeader(value = CallerHeaders.SESSION_ID, required = false) String sessionId,
            @RequestHeader(value = CallerHeaders.PARENT_SANDBOX_ID, required = false) String parentSandboxId,
            @RequestBody InvokeRequest body) {
        CallerIdentity caller = CallerHeaders.toIdentity(authorization, agentId, tenantId, sessionId,
                parentSandboxId);
        InvocationRequest request = InvocationRequest.builder()
                .invocationId(body.getInvocationId())
                .toolId(body.getToolId())
                .toolVersion(body.getToolVersion())
                .caller(caller)
                .parameters(body.getParameters() != null ? body.getParameters() : new LinkedHashMap<>())
                .resourceLimits(body.getResourceLimits())
                .checkpointConfig(body.getCheckpointConfig())
                .executionOptions(body.getExecutionOptions())
                .context(body.getContext() != null ? body.getContext() : new LinkedHashMap<>())
                .build();
        return Mono.defer(() -> Mono.fromFuture(gateway.invoke(request)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(InvocationController::toEntity);
    }

    @GetMapping("/{invocationId}")
    public Mono<ResponseEntity<InvocationStatusView>> status(
            @PathVariable String invocationId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = CallerHeaders.AGENT_ID, required = false) String agentId,
            @RequestHeader(value = CallerHeaders.TENANT_ID, required = false) String tenantId) {
        CallerIdentity caller = CallerHeaders.toIdentity(authorization, agentId, tenantId, null, null);
        return Mono.fromCallable(() -> gateway.status(invocationId, caller))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{invocationId}/cancel")
    public Mono<ResponseEntity<CancelResult>> cancel(
            @PathVariable String invocationId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = CallerHeaders.AGENT_ID, required = false) String agentId,
            @RequestHeader(value = CallerHeaders.TENANT_ID, required = false) String tenantId,
            @RequestBody(required = false) CancelRequest body) {
        CallerIdentity caller = CallerHeaders.toIdentity(authorization, agentId, tenantId, null, null);
        String reason = body != null ? body.getReason() : null;
        return Mono.fromCallable(() -> gateway.cancel(invocationId, caller, reason))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/{invocationId}/resume")
    public Mono<ResponseEntity<InvocationResponse>> resume(
            @PathVariable String invocationId,
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestHeader(value = CallerHeaders.AGENT_ID, required = false) String agentId,
            @RequestHeader(value = CallerHeaders.TENANT_ID, required = false) String tenantId,
            @RequestBody(required = false) ResumeRequest body) {
        CallerIdentity caller = CallerHeaders.toIdentity(authorization, agentId, tenantId, null, null);
        String checkpointId = body != null ? body.getCheckpointId() : null;
        return Mono.defer(() -> Mono.fromFuture(gateway.resume(invocationId, caller, checkpointId)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(InvocationController::toEntity);
    }

    @PostMapping("/{invocationId}/approval")
    public Mono<ResponseEntity<InvocationResponse>> approval(
            @PathVariable String invocationId,
            @RequestBody ApprovalDecisionRequest body) {
        log.info("[API] Approval decision for {}: approved={} by {}", invocationId, body.isApproved(),
                body.getApprover());
        ApprovalDecision decision = new ApprovalDecision(invocationId, body.isApproved(), body.getApprover(),
                body.getComment());
        return Mono.fromCallable(() -> gateway.onApprovalDecision(decision))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    private static ResponseEntity<InvocationResponse> toEntity(InvocationResponse response) {
        return ResponseEntity.status(ErrorStatusMapper.forResponse(response)).body(response);
    }
}
