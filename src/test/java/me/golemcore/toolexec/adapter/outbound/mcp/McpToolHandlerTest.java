package me.golemcore.toolexec.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.toolexec.domain.component.ToolExecutionContext;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.ProtocolBinding;
import me.golemcore.toolexec.domain.model.ToolManifest;
import me.golemcore.toolexec.domain.model.ToolResult;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class McpToolHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final McpToolHandler handler = new McpToolHandler(objectMapper);

    @Test
    void shouldJoinTextContent() throws Exception {
        JsonNode result = objectMapper.readTree("""
                {"content":[{"type":"text","text":"line one"},{"type":"image","data":"x"},
                {"type":"text","text":"line two"}]}
                """);

        ToolResult toolResult = handler.parseToolCallResult("reader", result);

        assertTrue(toolResult.isSuccess());
        assertEquals("line one\nline two", toolResult.getOutput().get("content"));
    }

    @Test
    void shouldPreferStructuredContent() throws Exception {
        JsonNode result = objectMapper.readTree("""
                {"content":[{"type":"text","text":"ignored"}],"structuredContent":{"total":3}}
                """);

        ToolResult toolResult = handler.parseToolCallResult("sum", result);

        assertEquals(Map.of("total", 3), toolResult.getOutput());
    }

    @Test
    void shouldMapIsErrorToFailure() throws Exception {
        JsonNode result = objectMapper.readTree("""
                {"isError":true,"content":[{"type":"text","text":"disk full"}]}
                """);

        ToolResult toolResult = handler.parseToolCallResult("writer", result);

        assertFalse(toolResult.isSuccess());
        assertEquals(ErrorCode.EXECUTION_FAILED, toolResult.getErrorCode());
        assertEquals("disk full", toolResult.getError());
    }

    @Test
    void shouldFailWhenResultMissing() {
        ToolResult toolResult = handler.parseToolCallResult("writer", null);

        assertFalse(toolResult.isSuccess());
    }

    @Test
    void shouldRejectManifestWithoutMcpBinding() {
        ToolManifest manifest = ToolManifest.builder()
                .toolId("echo")
                .version("1.0.0")
                .binding(new ProtocolBinding.NativeBinding("echo"))
                .build();
        ToolExecutionContext context = ToolExecutionContext.builder().invocationId("inv-1").build();

        ToolExecutionException ex = assertThrows(ToolExecutionException.class,
                () -> handler.execute(manifest, context));
        assertEquals(ErrorCode.TOOL_UNAVAILABLE, ex.getCode());
    }
}
