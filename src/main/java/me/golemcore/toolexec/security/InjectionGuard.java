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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Detects shell, SQL and path-traversal payloads in tool parameters.
 *
 * <p>
 * This is a second line of defense: tools still run inside a sandbox, and the
 * guard only rejects inputs that match known attack signatures. Detection can
 * be disabled with {@code toolexec.security.injection-guard-enabled=false}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class InjectionGuard {

    private final ToolExecProperties properties;

    private static final List<Pattern> COMMAND_INJECTION_PATTERNS = List.of(
            Pattern.compile(";\\s*(rm|del|format|dd|mkfs|curl|wget|nc)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\|\\s*(sh|bash|zsh|cmd|powershell)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("`[^`]+`"),
            Pattern.compile("\\$\\([^)]+\\)"),
            Pattern.compile("\\$\\{[^}]+\\}"),
            Pattern.compile("&&\\s*(rm|del|format|curl|wget)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\|\\|\\s*(rm|del|format)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile(">\\s*/dev/(sd|nvme|tcp)", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> SQL_INJECTION_PATTERNS = List.of(
            Pattern.compile("'\\s*(OR|AND)\\s+'", Pattern.CASE_INSENSITIVE),
            Pattern.compile("'\\s*=\\s*'"),
            Pattern.compile("\\bUNION\\s+(ALL\\s+)?SELECT\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("'\\s*;?\\s*--"),
            Pattern.compile(";\\s*(DROP|DELETE|TRUNCATE|ALTER)\\s", Pattern.CASE_INSENSITIVE),
            Pattern.compile("'\\s*OR\\s+1\\s*=\\s*1", Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> PATH_TRAVERSAL_PATTERNS = List.of(
            Pattern.compile("\\.\\./"),
            Pattern.compile("\\.\\.\\\\"),
            Pattern.compile("%2e%2e%2f", Pattern.CASE_INSENSITIVE),
            Pattern.compile("%2e%2e/", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.\\.%2f", Pattern.CASE_INSENSITIVE),
            Pattern.compile("%2e%2e%5c", Pattern.CASE_INSENSITIVE),
            Pattern.compile("/etc/passwd", Pattern.CASE_INSENSITIVE),
            Pattern.compile("C:\\\\Windows", Pattern.CASE_INSENSITIVE));

    /**
     * A detected threat and where it was found.
     */
    public record Threat(String path, String kind) {
    }

    public boolean detectCommandInjection(String input) {
        return matches(input, COMMAND_INJECTION_PATTERNS, "Command injection");
    }

    public boolean detectSqlInjection(String input) {
        return matches(input, SQL_INJECTION_PATTERNS, "SQL injection");
    }

    public boolean detectPathTraversal(String input) {
        return matches(input, PATH_TRAVERSAL_PATTERNS, "Path traversal");
    }

    /**
     * Check a single string for every threat kind.
     */
    public List<String> detectAllThreats(String input) {
        List<String> threats = new ArrayList<>();
        if (!properties.getSecurity().isInjectionGuardEnabled()) {
            return threats;
        }

        if (detectCommandInjection(input)) {
            threats.add("command_injection");
        }
        if (detectSqlInjection(input)) {
            threats.add("sql_injection");
        }
        if (detectPathTraversal(input)) {
            threats.add("path_traversal");
        }
        return threats;
    }

    /**
     * Walks a parameter tree and reports every string leaf that carries a
     * threat.
     */
    public List<Threat> scan(Map<String, Object> parameters) {
        List<Threat> threats = new ArrayList<>();
        if (parameters != null && properties.getSecurity().isInjectionGuardEnabled()) {
            scanValue("$", parameters, threats);
        }
        return threats;
    }

    private void scanValue(String path, Object value, List<Threat> threats) {
        if (value instanceof String s) {
            for (String kind : detectAllThreats(s)) {
                threats.add(new Threat(path, kind));
            }
        } else if (value instanceof Map<?, ?> map) {
            map.forEach((key, child) -> scanValue(path + "." + key, child, threats));
        } else if (value instanceof List<?> list) {
            for (int i = 0; i < list.size(); i++) {
                scanValue(path + "[" + i + "]", list.get(i), threats);
            }
        }
    }

    private boolean matches(String input, List<Pattern> patterns, String label) {
        if (input == null || input.isBlank()) {
            return false;
        }

        for (Pattern pattern : patterns) {
            if (pattern.matcher(input).find()) {
                log.warn("[Security] {} detected: pattern={}", label, pattern.pattern());
                return true;
            }
        }
        return false;
    }
}
