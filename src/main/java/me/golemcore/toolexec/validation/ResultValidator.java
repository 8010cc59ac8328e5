package me.golemcore.toolexec.validation;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.domain.model.ErrorCode;
import me.golemcore.toolexec.domain.model.ValidationError;
import me.golemcore.toolexec.domain.model.ValidationResult;
import me.golemcore.toolexec.security.ContentPolicy;
import me.golemcore.toolexec.security.InjectionGuard;
import me.golemcore.toolexec.security.InputSanitizer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Entry points for validating tool input and output.
 *
 * <p>
 * Input goes through Unicode sanitization, type coercion, schema validation
 * and the injection guard, in that order. Output goes through coercion and
 * schema validation, and is optionally redacted for audit and log sinks.
 * Nothing is partially applied: a failed result must not be used.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResultValidator {

    private final TypeCoercer typeCoercer;
    private final SchemaValidator schemaValidator;
    private final InputSanitizer inputSanitizer;
    private final InjectionGuard injectionGuard;
    private final ContentPolicy contentPolicy;

    @SuppressWarnings("unchecked")
    public ValidationResult validateInput(Map<String, Object> params, Map<String, Object> schema) {
        Map<String, Object> cleaned = inputSanitizer.sanitizeParameters(params);
        Object coerced = typeCoercer.coerce(cleaned, schema);

        List<ValidationError> errors = schemaValidator.validate(coerced, schema);
        if (!errors.isEmpty()) {
            return ValidationResult.failed(coerced, errors);
        }

        List<InjectionGuard.Threat> threats = injectionGuard.scan((Map<String, Object>) coerced);
        if (!threats.isEmpty()) {
            log.warn("[Validation] Rejected input with {} threat(s) at {}", threats.size(),
                    threats.stream().map(InjectionGuard.Threat::path).distinct().toList());
            List<ValidationError> threatErrors = threats.stream()
                    .map(threat -> new ValidationError(threat.path(), threat.kind() + " pattern detected"))
                    .toList();
            return ValidationResult.rejected(coerced, threatErrors, ErrorCode.INJECTION_DETECTED);
        }
        return ValidationResult.ok(coerced);
    }

    public ValidationResult validateOutput(Object result, Map<String, Object> schema) {
        return validateOutput(result, schema, false);
    }

    /**
     * @param sanitize
     *            redact sensitive data from the returned value; use only for
     *            output headed to audit or logs
     */
    public ValidationResult validateOutput(Object result, Map<String, Object> schema, boolean sanitize) {
        Object coerced = typeCoercer.coerce(result, schema);
        List<ValidationError> errors = schemaValidator.validate(coerced, schema);
        if (!errors.isEmpty()) {
            return ValidationResult.failed(coerced, errors);
        }
        return ValidationResult.ok(sanitize ? contentPolicy.sanitize(coerced) : coerced);
    }

    public Object sanitize(Object value) {
        return contentPolicy.sanitize(value);
    }
}
