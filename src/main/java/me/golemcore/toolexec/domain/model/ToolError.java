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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured error attached to a failed invocation response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolError {

    private ErrorCode code;
    private String message;
    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();
    private boolean retryable;

    public static ToolError of(ErrorCode code, String message) {
        return ToolError.builder()
                .code(code)
                .message(message)
                .retryable(code.isRetryable())
                .build();
    }

    public static ToolError of(ErrorCode code, String message, Map<String, Object> details) {
        return ToolError.builder()
                .code(code)
                .message(message)
                .details(details != null ? new LinkedHashMap<>(details) : new LinkedHashMap<>())
                .retryable(code.isRetryable())
                .build();
    }
}
