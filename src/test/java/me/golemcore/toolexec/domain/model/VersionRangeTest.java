package me.golemcore.toolexec.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VersionRangeTest {

    @ParameterizedTest
    @CsvSource({
            "*, 0.0.1, true",
            "^1.2.0, 1.2.0, true",
            "^1.2.0, 1.9.3, true",
            "^1.2.0, 2.0.0, false",
            "^1.2.0, 1.1.9, false",
            "^0.3.1, 0.3.9, true",
            "^0.3.1, 0.4.0, false",
            "~1.2.0, 1.2.7, true",
            "~1.2.0, 1.3.0, false",
            "1.x, 1.99.0, true",
            "1.x, 2.0.0, false",
            "1.2.x, 1.2.5, true",
            "1.2.x, 1.3.0, false",
            ">=1.0.0 <2.0.0, 1.5.0, true",
            ">=1.0.0 <2.0.0, 2.0.0, false",
            "1.0.0, 1.0.0, true",
            "=1.0.0, 1.0.1, false"
    })
    void shouldMatchNpmStyleRanges(String range, String version, boolean expected) {
        assertEquals(expected, VersionRange.parse(range).matches(version));
    }

    @Test
    void shouldTellExactVersionsFromRanges() {
        assertTrue(VersionRange.isExact("1.0.0"));
        assertFalse(VersionRange.isExact("^1.0.0"));
        assertFalse(VersionRange.isExact("1.x"));
        assertFalse(VersionRange.isExact(null));
    }

    @Test
    void shouldRejectBlankRange() {
        assertThrows(IllegalArgumentException.class, () -> VersionRange.parse(" "));
    }

    @Test
    void shouldOrderPreReleaseBeforeRelease() {
        assertTrue(SemanticVersion.parse("2.0.0-rc.1").compareTo(SemanticVersion.parse("2.0.0")) < 0);
        assertTrue(SemanticVersion.parse("2.0.0-alpha").compareTo(SemanticVersion.parse("2.0.0-beta")) < 0);
        assertEquals(0, SemanticVersion.parse("v1.2.3+build.7").compareTo(SemanticVersion.parse("1.2.3")));
    }

    @Test
    void shouldFillMissingComponentsWithZero() {
        assertEquals("3.0.0", SemanticVersion.parse("3").toString());
        assertThrows(IllegalArgumentException.class, () -> SemanticVersion.parse("one.two"));
    }
}
