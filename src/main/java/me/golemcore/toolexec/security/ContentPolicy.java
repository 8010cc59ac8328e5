package me.golemcore.toolexec.security;

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

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts sensitive data from values destined for audit records and logs.
 *
 * <p>
 * Two passes run over every structure:
 * <ul>
 * <li>values of sensitive field names ({@code password}, {@code secret},
 * {@code token}, {@code api_key}, ...) are replaced unconditionally</li>
 * <li>every string leaf is pattern-redacted for bare JWTs, bearer tokens,
 * email addresses, SSN-like, credit-card-like and phone-like numbers</li>
 * </ul>
 */
@Component
public class ContentPolicy {

    public static final String REDACTED = "[REDACTED]";
    public static final String REDACTED_EMAIL = "[REDACTED_EMAIL]";
    public static final String REDACTED_CARD = "[REDACTED_CARD]";
    public static final String REDACTED_SSN = "[REDACTED_SSN]";
    public static final String REDACTED_PHONE = "[REDACTED_PHONE]";
    public static final String REDACTED_JWT = "[REDACTED_JWT]";

    private static final Set<String> SENSITIVE_FIELDS = Set.of(
            "password", "passwd", "pwd", "secret", "clientsecret", "token", "accesstoken", "refreshtoken",
            "apikey", "privatekey", "accesskey", "authorization", "credential", "credentials",
            "capabilitytoken", "sessiontoken");

    private static final List<Redaction> REDACTIONS = List.of(
            new Redaction(Pattern.compile("\\beyJ[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]*"), REDACTED_JWT),
            new Redaction(Pattern.compile("Bearer\\s+[A-Za-z0-9\\-._~+/]+=*", Pattern.CASE_INSENSITIVE),
                    "Bearer " + REDACTED),
            new Redaction(Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"), REDACTED_EMAIL),
            new Redaction(Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"), REDACTED_SSN),
            new Redaction(Pattern.compile("\\b(?:\\d[ -]?){12,18}\\d\\b"), REDACTED_CARD),
            new Redaction(Pattern.compile("(?<![\\w+])\\+?(?:\\d{1,3}[ .-]?)?\\(?\\d{3}\\)?[ .-]?\\d{3}[ .-]?\\d{4}\\b"),
                    REDACTED_PHONE),
            new Redaction(Pattern.compile("((?:password|api[_-]?key|secret)\\s*[:=]\\s*['\"]?)[^'\"\\s,}]+",
                    Pattern.CASE_INSENSITIVE), "$1" + REDACTED));

    /**
     * Returns a redacted deep copy of {@code value}. Maps, lists and strings are
     * walked; other leaves are returned unchanged.
     */
    public Object sanitize(Object value) {
        if (value instanceof String s) {
            return redactSensitive(s);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((key, child) -> {
                String name = String.valueOf(key);
                result.put(name, isSensitiveField(name) && child != null ? REDACTED : sanitize(child));
            });
            return result;
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(sanitize(item));
            }
            return result;
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    public Map<String, Object> sanitizeMap(Map<String, Object> value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        return (Map<String, Object>) sanitize(value);
    }

    /**
     * Pattern-based redaction of a single string.
     */
    public String redactSensitive(String content) {
        if (content == null) {
            return "";
        }
        String result = content;
        for (Redaction redaction : REDACTIONS) {
            result = redaction.pattern().matcher(result).replaceAll(redaction.replacement());
        }
        return result;
    }

    public boolean isSensitiveField(String name) {
        if (name == null) {
            return false;
        }
        String normalized = name.toLowerCase(Locale.ROOT).replace("_", "").replace("-", "");
        return SENSITIVE_FIELDS.contains(normalized)
                || normalized.endsWith("password")
                || normalized.endsWith("secret")
                || normalized.endsWith("apikey");
    }

    /**
     * Truncate content to maximum length.
     */
    public String truncate(String content, int maxLength) {
        if (content == null) {
            return "";
        }
        if (content.length() <= maxLength) {
            return content;
        }
        return content.substring(0, maxLength - 3) + "...";
    }

    private record Redaction(Pattern pattern, String replacement) {
    }
}
