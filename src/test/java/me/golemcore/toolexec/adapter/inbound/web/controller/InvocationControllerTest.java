package me.golemcore.toolexec.adapter.inbound.web.controller;

import me.golemcore.toolexec.adapter.inbound.web.dto.ApprovalDecisionRequest;
import me.golemcore.toolexec.adapter.inbound.web.dto.CancelRequest;
import me.golemcore.toolexec.adapter.inbound.web.dto.InvokeRequest;
import me.golemcore.toolexec.adapter.inbound.web.dto.ResumeRequest;
import me.golemcore.toolexec.domain.exception.ToolExecutionException;
import me.golemcore.toolexec.domain.model.ApprovalDecision;
import me.golemcore.toolexec.domain.model.CallerIdentity;
import me.golemcore.toolexec.domain.model.CancelResult;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.ExecutionMetadata;
import me.golemcore.toolexec.domain.model.InvocationRequest;
import me.golemcore.toolexec.domain.model.InvocationResponse;
import me.golemcore.toolexec.domain.model.InvocationStatus;
import me.golemcore.toolexec.domain.model.InvocationStatusView;
import me.golemcore.toolexec.domain.model.ToolError;
import me.golemcore.toolexec.domain.service.InvocationGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InvocationControllerTest {

    private InvocationGateway gateway;
    private InvocationController controller;

    @BeforeEach
    void setUp() {
        gateway = mock(InvocationGateway.class);
        controller = new InvocationController(gateway);
    }

    @Test
    void invokeShouldPassCallerHeadersToGateway() {
        when(gateway.invoke(any())).thenReturn(CompletableFuture.completedFuture(InvocationResponse.builder()
                .invocationId("inv-1")
                .status(InvocationStatus.SUCCESS)
                .result(Map.of("echoed", "hi"))
                .executionMetadata(ExecutionMetadata.builder().attempt(1).build())
                .build()));
        InvokeRequest body = InvokeRequest.builder()
                .toolId("echo")
                .toolVersion("^1.0.0")
                .parameters(Map.of("message", "hi"))
                .build();

        StepVerifier.create(controller.invoke("Bearer tok-1", "agent-1", "acme", "sess-1", null, body))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    assertEquals("inv-1", resp.getBody().getInvocationId());
                })
                .verifyComplete();

        ArgumentCaptor<InvocationRequest> captor = ArgumentCaptor.forClass(InvocationRequest.class);
        verify(gateway).invoke(captor.capture());
        CallerIdentity caller = captor.getValue().getCaller();
        assertEquals("tok-1", caller.getCapabilityToken());
        assertEquals("agent-1", caller.getAgentId());
        assertEquals("acme", caller.getTenantId());
        assertEquals("sess-1", caller.getSessionId());
        assertEquals("^1.0.0", captor.getValue().getToolVersion());
    }

    @Test
    void invokeShouldAnswerAcceptedForRunningAsyncInvocation() {
        when(gateway.invoke(any())).thenReturn(CompletableFuture.completedFuture(InvocationResponse.builder()
                .invocationId("inv-2")
                .status(InvocationStatus.RUNNING)
                .executionMetadata(ExecutionMetadata.builder().pollUrl("/api/invocations/inv-2")
                        .pollIntervalMs(1000L).build())
                .build()));

        StepVerifier.create(controller.invoke(null, "agent-1", "acme", null, null,
                InvokeRequest.builder().toolId("step-counter").build()))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.ACCEPTED, resp.getStatusCode());
                    assertEquals("/api/invocations/inv-2", resp.getBody().getExecutionMetadata().getPollUrl());
                })
                .verifyComplete();
    }

    @Test
    void invokeShouldAnswerForbiddenWhenPermissionDenied() {
        when(gateway.invoke(any())).thenReturn(CompletableFuture.completedFuture(InvocationResponse.builder()
                .invocationId("inv-3")
                .status(InvocationStatus.PERMISSION_DENIED)
                .error(ToolError.of(ErrorCode.TOOL_NOT_GRANTED, "Credential does not grant echo@1.0.0"))
                .build()));

        StepVerifier.create(controller.invoke("Bearer x", "agent-1", "acme", null, null,
                InvokeRequest.builder().toolId("echo").build()))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.FORBIDDEN, resp.getStatusCode());
                    assertFalse(resp.getBody().getError().isRetryable());
                })
                .verifyComplete();
    }

    @Test
    void invokeShouldAnswerNotFoundForUnknownTool() {
        when(gateway.invoke(any())).thenReturn(CompletableFuture.completedFuture(InvocationResponse.builder()
                .invocationId("inv-4")
                .status(InvocationStatus.ERROR)
                .error(ToolError.of(ErrorCode.TOOL_NOT_FOUND, "Tool nope not found"))
                .build()));

        StepVerifier.create(controller.invoke(null, "agent-1", null, null, null,
                InvokeRequest.builder().toolId("nope").build()))
                .assertNext(resp -> assertEquals(HttpStatus.NOT_FOUND, resp.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void invokeShouldKeepOkForAdmittedFailure() {
        when(gateway.invoke(any())).thenReturn(CompletableFuture.completedFuture(InvocationResponse.builder()
                .invocationId("inv-5")
                .status(InvocationStatus.ERROR)
                .error(ToolError.of(ErrorCode.EXECUTION_FAILED, "boom"))
                .executionMetadata(ExecutionMetadata.builder().attempt(1).build())
                .build()));

        StepVerifier.create(controller.invoke(null, "agent-1", null, null, null,
                InvokeRequest.builder().toolId("echo").build()))
                .assertNext(resp -> assertEquals(HttpStatus.OK, resp.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void statusShouldPropagateNotFound() {
        when(gateway.status(eq("missing"), any())).thenThrow(
                new ToolExecutionException(ErrorCode.INVOCATION_NOT_FOUND, "Invocation missing not found"));

        StepVerifier.create(controller.status("missing", null, "agent-1", "acme"))
                .expectErrorMatches(error -> error instanceof ToolExecutionException toolError
                        && toolError.getCode() == ErrorCode.INVOCATION_NOT_FOUND)
                .verify();
    }

    @Test
    void statusShouldReturnView() {
        when(gateway.status(eq("inv-6"), any())).thenReturn(InvocationStatusView.builder()
                .invocationId("inv-6")
                .status(InvocationStatus.RUNNING)
                .progressPercent(40)
                .build());

        StepVerifier.create(controller.status("inv-6", null, "agent-1", "acme"))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    assertEquals(Integer.valueOf(40), resp.getBody().getProgressPercent());
                })
                .verifyComplete();
    }

    @Test
    void cancelShouldForwardReasonAndTolerateMissingBody() {
        when(gateway.cancel(eq("inv-7"), any(), eq("no longer needed")))
                .thenReturn(CancelResult.accepted("Cancellation requested"));
        when(gateway.cancel(eq("inv-8"), any(), eq(null)))
                .thenReturn(CancelResult.rejected(CancelResult.ALREADY_COMPLETED));

        StepVerifier.create(controller.cancel("inv-7", null, "agent-1", "acme",
                new CancelRequest("no longer needed")))
                .assertNext(resp -> assertTrue(resp.getBody().cancelled()))
                .verifyComplete();
        StepVerifier.create(controller.cancel("inv-8", null, "agent-1", "acme", null))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    assertFalse(resp.getBody().cancelled());
                    assertEquals(CancelResult.ALREADY_COMPLETED, resp.getBody().message());
                })
                .verifyComplete();
    }

    @Test
    void resumeShouldPassCheckpointId() {
        when(gateway.resume(eq("inv-9"), any(), eq("cp-2"))).thenReturn(CompletableFuture.completedFuture(
                InvocationResponse.builder()
                        .invocationId("inv-10")
                        .status(InvocationStatus.SUCCESS)
                        .executionMetadata(ExecutionMetadata.builder().attempt(2).resumedFrom("inv-9").build())
                        .build()));
        ResumeRequest body = new ResumeRequest();
        body.setCheckpointId("cp-2");

        StepVerifier.create(controller.resume("inv-9", "Bearer tok", "agent-1", "acme", body))
                .assertNext(resp -> {
                    assertEquals(HttpStatus.OK, resp.getStatusCode());
                    assertEquals("inv-10", resp.getBody().getInvocationId());
                    assertEquals(2, resp.getBody().getExecutionMetadata().getAttempt());
                })
                .verifyComplete();
    }

    @Test
    void approvalShouldBuildDecision() {
        when(gateway.onApprovalDecision(any())).thenReturn(InvocationResponse.builder()
                .invocationId("inv-11")
                .status(InvocationStatus.PENDING)
                .build());
        ApprovalDecisionRequest body = ApprovalDecisionRequest.builder()
                .approved(true)
                .approver("alice")
                .comment("ok")
                .build();

        StepVerifier.create(controller.approval("inv-11", body))
                .assertNext(resp -> assertNull(resp.getBody().getError()))
                .verifyComplete();

        verify(gateway).onApprovalDecision(new ApprovalDecision("inv-11", true, "alice", "ok"));
    }

    @Test
    void bearerTokenShouldIgnoreOtherSchemes() {
        assertEquals("abc", CallerHeaders.bearerToken("bearer abc"));
        assertNull(CallerHeaders.bearerToken("Basic abc"));
        assertNull(CallerHeaders.bearerToken("Bearer   "));
        assertNull(CallerHeaders.bearerToken(null));
    }
}
