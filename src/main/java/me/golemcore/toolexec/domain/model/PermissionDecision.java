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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a permission check. Cached decisions carry their expiry.
 */
@Value
@Builder(toBuilder = true)
public class PermissionDecision {

    boolean allowed;
    String reason;
    ErrorCode errorCode;
    String subject;
    Instant expiresAt;
    boolean cached;

    public static PermissionDecision allow(String subject, String reason, Instant expiresAt) {
        return PermissionDecision.builder()
                .allowed(true)
                .subject(subject)
                .reason(reason)
                .expiresAt(expiresAt)
                .build();
    }

    public static PermissionDecision deny(String subject, ErrorCode code, String reason) {
        return PermissionDecision.builder()
                .allowed(false)
                .subject(subject)
                .errorCode(code)
                .reason(reason)
                .build();
    }

    public boolean isExpired(Instant now) {
        return expiresAt == null || !now.isBefore(expiresAt);
    }

    public ToolError toError() {
        return ToolError.of(errorCode != null ? errorCode : ErrorCode.PERMISSION_DENIED, reason);
    }
}
