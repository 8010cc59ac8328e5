package me.golemcore.toolexec.adapter.outbound.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolexec.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.toolexec.domain.model.AuditEvent;
import me.golemcore.toolexec.domain.model.AuditEventType;
import me.golemcore.toolexec.infrastructure.config.AutoConfiguration;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StorageAuditAdapterTest {

    @TempDir
    Path tempDir;

    private ToolExecProperties properties;
    private ObjectMapper objectMapper;
    private StorageAuditAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new ToolExecProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        objectMapper = AutoConfiguration.objectMapper();
        adapter = new StorageAuditAdapter(storage, objectMapper, properties);
    }

    @Test
    void shouldAppendEventsPerTenantInOrder() throws Exception {
        adapter.publish(event("acme", 1, AuditEventType.INVOKED));
        adapter.publish(event("globex", 1, AuditEventType.INVOKED));
        adapter.publish(event("acme", 2, AuditEventType.STARTED));
        adapter.publish(event("acme", 3, AuditEventType.COMPLETED));

        List<String> lines = Files.readAllLines(tempDir.resolve("audit").resolve("acme.jsonl"));
        assertEquals(3, lines.size());
        for (int i = 0; i < lines.size(); i++) {
            JsonNode node = objectMapper.readTree(lines.get(i));
            assertEquals(i + 1, node.get("sequence").asInt());
        }
        assertEquals(1, Files.readAllLines(tempDir.resolve("audit").resolve("globex.jsonl")).size());
    }

    @Test
    void shouldUseDefaultPartitionWithoutTenant() {
        adapter.publish(event(null, 1, AuditEventType.INVOKED));

        assertTrue(Files.exists(tempDir.resolve("audit").resolve("_default.jsonl")));
    }

    @Test
    void shouldWriteNothingWhenDisabled() {
        properties.getAudit().setEnabled(false);

        adapter.publish(event("acme", 1, AuditEventType.INVOKED));

        assertFalse(Files.exists(tempDir.resolve("audit").resolve("acme.jsonl")));
    }

    private static AuditEvent event(String tenant, long sequence, AuditEventType type) {
        return AuditEvent.builder()
                .eventId("evt-" + tenant + "-" + sequence)
                .type(type)
                .invocationId("inv-1")
                .toolId("echo")
                .toolVersion("1.0.0")
                .agentId("agent-1")
                .partitionKey(tenant)
                .sequence(sequence)
                .timestamp(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
    }
}
