package me.golemcore.toolexec.adapter.outbound.audit;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.model.AuditEvent;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.port.outbound.AuditPort;
import me.golemcore.toolexec.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Audit sink writing one JSONL file per partition key (tenant). Appends are
 * serialized so events of one partition keep their emission order.
 */
@Component
@Slf4j
public class StorageAuditAdapter implements AuditPort {

    private static final String DEFAULT_PARTITION = "_default";
    private static final long TIMEOUT_SECONDS = 5;

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ToolExecProperties.AuditProperties settings;

    public StorageAuditAdapter(StoragePort storagePort, ObjectMapper objectMapper, ToolExecProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.settings = properties.getAudit();
    }

    @Override
    public synchronized void publish(AuditEvent event) {
        if (!settings.isEnabled()) {
            return;
        }
        String partition = event.getPartitionKey() != null ? event.getPartitionKey() : DEFAULT_PARTITION;
        try {
            String line = objectMapper.writeValueAsString(event) + "\n";
            storagePort.appendText(settings.getDirectory(), partition + ".jsonl", line)
                    .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (JsonProcessingException e) {
            log.warn("[Audit] Failed to serialize event {}: {}", event.getEventId(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Audit] Interrupted while writing event {}", event.getEventId());
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Audit] Failed to write event {}: {}", event.getEventId(), e.getMessage());
        }
    }
}
