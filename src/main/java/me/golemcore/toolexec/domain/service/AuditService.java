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
import me.golemcore.toolexec.domain.model.AuditEvent;
import me.golemcore.toolexec.domain.model.AuditEventType;
import me.golemcore.toolexec.domain.model.Invocation;
import me.golemcore.toolexec.port.outbound.AuditPort;
import me.golemcore.toolexec.security.ContentPolicy;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Emits audit events for invocations. Events of one invocation carry an
 * increasing sequence and are partitioned by tenant; payloads are redacted
 * before they leave the process. Audit is fire-and-forget: a failing sink is
 * logged and never fails the invocation.
 */
@Service
@Slf4j
public class AuditService {

    private final AuditPort auditPort;
    private final ContentPolicy contentPolicy;
    private final Clock clock;
    private final Map<String, AtomicLong> sequences = new ConcurrentHashMap<>();

    public AuditService(AuditPort auditPort, ContentPolicy contentPolicy, Clock clock) {
        this.auditPort = auditPort;
        this.contentPolicy = contentPolicy;
        this.clock = clock;
    }

    public void emit(AuditEventType type, Invocation invocation) {
        emit(type, invocation, Map.of());
    }

    public void emit(AuditEventType type, Invocation invocation, Map<String, Object> payload) {
        long sequence = sequences.computeIfAbsent(invocation.getInvocationId(), id -> new AtomicLong())
                .incrementAndGet();
        AuditEvent event = AuditEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .invocationId(invocation.getInvocationId())
                .toolId(invocation.getToolId())
                .toolVersion(invocation.getToolVersion())
                .agentId(invocation.agentId())
                .partitionKey(invocation.tenantId())
                .sequence(sequence)
                .status(invocation.getStatus())
                .errorCode(invocation.getError() != null && invocation.getError().getCode() != null
                        ? invocation.getError().getCode().wireValue()
                        : null)
                .timestamp(Instant.now(clock))
                .payload(new LinkedHashMap<>(contentPolicy.sanitizeMap(payload)))
                .build();
        try {
            auditPort.publish(event);
        } catch (RuntimeException e) {
            log.warn("[Audit] Failed to publish {} for {}: {}", type, invocation.getInvocationId(), e.getMessage());
        }
        if (type == AuditEventType.COMPLETED) {
            sequences.remove(invocation.getInvocationId());
        }
    }
}
