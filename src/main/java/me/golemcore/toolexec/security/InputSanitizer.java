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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalizes Unicode and removes invisible and control characters from tool
 * parameters before they reach a tool process.
 *
 * <p>
 * Protects against:
 * <ul>
 * <li>Homograph attacks - normalizes Unicode to canonical NFC form</li>
 * <li>Invisible character injection - removes zero-width and control
 * characters</li>
 * <li>Text direction override attacks - removes BiDi control characters</li>
 * </ul>
 *
 * <p>
 * Newline and tab are preserved.
 */
@Component
@Slf4j
public class InputSanitizer {

    /**
     * Normalize to NFC and remove invisible characters.
     */
    public String normalizeUnicode(String input) {
        if (input == null) {
            return "";
        }

        String normalized = Normalizer.normalize(input, Normalizer.Form.NFC);

        // Zero-width, soft hyphen and BiDi controls
        normalized = normalized.replaceAll(
                "[\\u200B-\\u200F\\uFEFF\\u2060\\u00AD\\u061C\\u180E\\u202A-\\u202E\\u2066-\\u2069]", "");

        // Control characters except newline/tab
        normalized = normalized.replaceAll("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]", "");

        return normalized;
    }

    public String sanitize(String input) {
        if (input == null) {
            return "";
        }

        int originalLength = input.length();
        String sanitized = normalizeUnicode(input);
        if (sanitized.length() != originalLength) {
            log.debug("[Security] Input sanitized: {} -> {} chars", originalLength, sanitized.length());
        }
        return sanitized;
    }

    /**
     * Applies {@link #sanitize(String)} to every string key and string leaf of a
     * parameter tree. Non-string leaves are returned unchanged.
     */
    public Map<String, Object> sanitizeParameters(Map<String, Object> parameters) {
        if (parameters == null) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        parameters.forEach((key, value) -> result.put(sanitize(key), sanitizeValue(value)));
        return result;
    }

    @SuppressWarnings("unchecked")
    private Object sanitizeValue(Object value) {
        if (value instanceof String s) {
            return sanitize(s);
        }
        if (value instanceof Map<?, ?> map) {
            return sanitizeParameters((Map<String, Object>) map);
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(sanitizeValue(item));
            }
            return result;
        }
        return value;
    }
}
