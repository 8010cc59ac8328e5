package me.golemcore.toolexec.domain.exception;

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

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outbound call refused by the rate limiter or the circuit breaker. Always
 * retryable; {@code retryAfter} is a hint, possibly {@code null}.
 */
public class AdmissionDeniedException extends ToolExecutionException {

    private static final long serialVersionUID = 1L;

    private final String serviceId;
    private final transient Duration retryAfter;

    public AdmissionDeniedException(ErrorCode code, String serviceId, String message, Duration retryAfter) {
        super(code, message, details(serviceId, retryAfter), null);
        this.serviceId = serviceId;
        this.retryAfter = retryAfter;
    }

    public static AdmissionDeniedException circuitOpen(String serviceId) {
        return new AdmissionDeniedException(ErrorCode.CIRCUIT_OPEN, serviceId,
                "Circuit open for service " + serviceId, null);
    }

    public static AdmissionDeniedException rateLimited(String serviceId, Duration retryAfter) {
        return new AdmissionDeniedException(ErrorCode.RATE_LIMITED, serviceId,
                "Rate limited for " + serviceId, retryAfter);
    }

    public String getServiceId() {
        return serviceId;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }

    private static Map<String, Object> details(String serviceId, Duration retryAfter) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("service_id", serviceId);
        if (retryAfter != null) {
            details.put("retry_after_ms", retryAfter.toMillis());
        }
        return details;
    }
}
