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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Result of validating a value against a schema. {@code value} is the coerced
 * value; it is only meant to be used when {@code valid} is true.
 */
public record ValidationResult(boolean valid, Object value, List<ValidationError> errors, ErrorCode code) {

    public static ValidationResult ok(Object value) {
        return new ValidationResult(true, value, List.of(), null);
    }

    public static ValidationResult failed(Object value, List<ValidationError> errors) {
        return rejected(value, errors, ErrorCode.VALIDATION_FAILED);
    }

    public static ValidationResult rejected(Object value, List<ValidationError> errors, ErrorCode code) {
        return new ValidationResult(false, value, List.copyOf(errors), code);
    }

    public String summary() {
        return errors.stream().map(ValidationError::toString).collect(Collectors.joining("; "));
    }

    public ToolError toError(String context) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("errors", errors.stream()
                .map(error -> Map.of("path", error.path(), "message", error.message()))
                .toList());
        return ToolError.of(code != null ? code : ErrorCode.VALIDATION_FAILED, context + ": " + summary(), details);
    }
}
