package me.golemcore.toolexec.domain.model;

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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Stable, machine-readable error codes carried by every failed invocation.
 * Callers branch on the code and the {@code retryable} flag, never on message
 * text.
 */
public enum ErrorCode {

    TOOL_NOT_FOUND(false),
    VERSION_NOT_FOUND(false),
    INVOCATION_NOT_FOUND(false),
    INVOCATION_CONFLICT(false),
    CHECKPOINT_NOT_FOUND(false),
    TOOL_UNAVAILABLE(false),

    INVALID_CREDENTIAL(false),
    TOOL_NOT_GRANTED(false),
    PERMISSION_DENIED(false),
    AUTHORIZATION_UNAVAILABLE(false),

    CIRCUIT_OPEN(true),
    RATE_LIMITED(true),
    CONCURRENCY_LIMIT_EXCEEDED(true),

    VALIDATION_FAILED(false),
    INJECTION_DETECTED(false),
    RESOURCE_LIMIT_EXCEEDED(false),

    SANDBOX_PROVISIONING_FAILED(false),
    EXECUTION_FAILED(false),
    TIMEOUT(false),
    CANCELLED(false),
    WORKER_LOST(false),

    APPROVAL_DENIED(false),
    APPROVAL_TIMEOUT(false),

    BRIDGE_UNAVAILABLE(true),
    CHECKPOINT_FAILED(false),

    INTERNAL_ERROR(false);

    private final boolean retryable;

    ErrorCode(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ErrorCode fromWire(String value) {
        return ErrorCode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
