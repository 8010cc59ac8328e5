package me.golemcore.toolexec.adapter.outbound.cache;

import com.fasterxml.jackson.databind.node.TextNode;
import me.golemcore.toolexec.infrastructure.config.ToolExecProperties;
import me.golemcore.toolexec.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemorySharedCacheTest {

    private MutableClock clock;
    private InMemorySharedCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        ToolExecProperties properties = new ToolExecProperties();
        properties.getBridge().setSharedCacheStaleRetention(Duration.ofMinutes(30));
        cache = new InMemorySharedCache(clock, properties);
    }

    @Test
    void shouldKeepExpiredEntryForStaleReadsWithinRetention() {
        cache.put("doc:1", TextNode.valueOf("v1"), Duration.ofMinutes(5));
        clock.advance(Duration.ofMinutes(20));

        assertEquals(0, cache.cleanup());
        assertTrue(cache.get("doc:1").orElseThrow().isStale(clock.instant()));
    }

    @Test
    void shouldDropEntriesExpiredLongerThanRetention() {
        cache.put("doc:1", TextNode.valueOf("v1"), Duration.ofMinutes(5));
        cache.put("doc:2", TextNode.valueOf("v2"), Duration.ofHours(2));
        clock.advance(Duration.ofMinutes(35));

        assertEquals(1, cache.cleanup());
        assertFalse(cache.get("doc:1").isPresent());
        assertTrue(cache.get("doc:2").isPresent());
        assertEquals(1, cache.size());
    }

    @Test
    void shouldEvictKeyWithItsVersionedVariants() {
        cache.put("doc:1", TextNode.valueOf("v1"), Duration.ofMinutes(5));
        cache.put("doc:1@3", TextNode.valueOf("v3"), Duration.ofMinutes(5));
        cache.put("doc:10", TextNode.valueOf("other"), Duration.ofMinutes(5));

        cache.evict("doc:1");

        assertFalse(cache.get("doc:1").isPresent());
        assertFalse(cache.get("doc:1@3").isPresent());
        assertTrue(cache.get("doc:10").isPresent());
    }
}
