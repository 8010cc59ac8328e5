package me.golemcore.toolexec.adapter.inbound.web;

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

import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.InvocationResponse;
import me.golemcore.toolexec.domain.model.InvocationStatus;
import org.springframework.http.HttpStatus;

/**
 * HTTP status for error codes and invocation responses.
 *
 * <p>
 * An invocation that was admitted and then failed is still a successful API
 * call (200) whose body carries the error; only rejections before admission
 * map to 4xx/5xx statuses.
 */
public final class ErrorStatusMapper {

    private ErrorStatusMapper() {
    }

    public static HttpStatus forCode(ErrorCode code) {
        if (code == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (code) {
        case TOOL_NOT_FOUND, VERSION_NOT_FOUND, INVOCATION_NOT_FOUND, CHECKPOINT_NOT_FOUND -> HttpStatus.NOT_FOUND;
        case INVOCATION_CONFLICT -> HttpStatus.CONFLICT;
        case INVALID_CREDENTIAL -> HttpStatus.UNAUTHORIZED;
        case TOOL_NOT_GRANTED, PERMISSION_DENIED -> HttpStatus.FORBIDDEN;
        case VALIDATION_FAILED, INJECTION_DETECTED, RESOURCE_LIMIT_EXCEEDED -> HttpStatus.BAD_REQUEST;
        case CIRCUIT_OPEN, RATE_LIMITED, CONCURRENCY_LIMIT_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
        case TOOL_UNAVAILABLE, AUTHORIZATION_UNAVAILABLE, BRIDGE_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    public static HttpStatus forResponse(InvocationResponse response) {
        if (response.getStatus() == InvocationStatus.PERMISSION_DENIED) {
            return HttpStatus.FORBIDDEN;
        }
        boolean admitted = response.getExecutionMetadata() != null;
        if (!admitted && response.getError() != null) {
            return forCode(response.getError().getCode());
        }
        if (response.getStatus() != null && !response.getStatus().isTerminal()) {
            return HttpStatus.ACCEPTED;
        }
        return HttpStatus.OK;
    }
}
