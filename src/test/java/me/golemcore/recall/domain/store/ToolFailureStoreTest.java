package me.golemcore.recall.domain.store;

import me.golemcore.recall.domain.model.ToolFailure;
import me.golemcore.recall.domain.model.ToolFailureCategory;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.testsupport.MutableClock;
import me.golemcore.recall.testsupport.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolFailureStoreTest {

    private static final String AGENT = "agent-1";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private RecallProperties properties;
    private MutableClock clock;
    private ToolFailureStore store;

    @BeforeEach
    void setUp() {
        properties = new RecallProperties();
        clock = new MutableClock(NOW);
        store = new ToolFailureStore(TestStores.storage(tempDir), TestStores.objectMapper(), properties, clock);
    }

    @Test
    void shouldCollapseRecurringErrorsIntoOneRecord() {
        store.recordToolFailure(AGENT, "web_fetch", "Error 429: Too Many Requests");
        clock.advance(Duration.ofMinutes(5));
        store.recordToolFailure(AGENT, "web_fetch", "Error 429: Too Many Requests");
        clock.advance(Duration.ofMinutes(5));
        Optional<ToolFailure> third = store.recordToolFailure(AGENT, "web_fetch", "Error 429: Too Many Requests");

        List<ToolFailure> failures = store.getFailures(AGENT);
        assertEquals(1, failures.size());
        ToolFailure failure = failures.get(0);
        assertEquals(3, failure.getCount());
        assertEquals(ToolFailureCategory.RATE_LIMIT, failure.getCategory());
        assertEquals(NOW, failure.getFirstSeen());
        assertEquals(NOW.plus(Duration.ofMinutes(10)), failure.getLastSeen());
        assertEquals(3, third.orElseThrow().getCount());
    }

    @Test
    void shouldMatchOnSharedPatternPrefix() {
        String prefix = "Request failed with status 403 Forbidden while calling the remote api";
        store.recordToolFailure(AGENT, "http", prefix + " (attempt one)");
        store.recordToolFailure(AGENT, "http", prefix + " (attempt two)");

        assertEquals(1, store.getFailures(AGENT).size());
        assertEquals(2, store.getFailures(AGENT).get(0).getCount());
    }

    @Test
    void shouldKeepSeparateRecordsPerToolAndCategory() {
        store.recordToolFailure(AGENT, "exec", "Command timed out after 30s");
        store.recordToolFailure(AGENT, "web_fetch", "Command timed out after 30s");
        store.recordToolFailure(AGENT, "exec", "ENOENT: no such file or directory");

        assertEquals(3, store.getFailures(AGENT).size());
    }

    @Test
    void shouldIgnoreUnclassifiableErrors() {
        Optional<ToolFailure> recorded = store.recordToolFailure(AGENT, "exec", "oops");

        assertFalse(recorded.isPresent());
        assertTrue(store.getFailures(AGENT).isEmpty());
    }

    @Test
    void shouldEvictLeastFrequentRecordsAtCapacity() {
        properties.getToolFailures().setMaxEntries(5);
        properties.getToolFailures().setEvictBatch(2);
        store.recordToolFailure(AGENT, "tool-0", "request timed out");
        store.recordToolFailure(AGENT, "tool-0", "request timed out");
        for (int i = 1; i < 5; i++) {
            clock.advance(Duration.ofMinutes(1));
            store.recordToolFailure(AGENT, "tool-" + i, "request timed out");
        }

        clock.advance(Duration.ofMinutes(1));
        store.recordToolFailure(AGENT, "tool-5", "request timed out");

        List<String> tools = store.getFailures(AGENT).stream().map(ToolFailure::getToolName).toList();
        assertEquals(List.of("tool-0", "tool-3", "tool-4", "tool-5"), tools);
    }

    @Test
    void shouldRenderInjectionGroupedByTool() {
        assertNull(store.readToolFailuresForInjection(AGENT));

        for (int i = 0; i < 3; i++) {
            store.recordToolFailure(AGENT, "web_fetch", "Error 429: Too Many Requests");
        }
        store.recordToolFailure(AGENT, "exec", "ENOENT: no such file or directory, open 'config.yml'");
        store.recordToolFailure(AGENT, "web_fetch", "401 Unauthorized: invalid api key");

        String block = store.readToolFailuresForInjection(AGENT);

        assertTrue(block.startsWith("## ⚠️ Known Tool Issues (learned from past failures)"));
        assertTrue(block.contains("### web_fetch\n- **rate_limit** (3× since 2026-03-01): web_fetch hits rate limits"));
        assertTrue(block.contains("- **auth**: web_fetch auth failure"));
        assertTrue(block.contains("### exec\n- **not_found**: exec target not found"));
        assertTrue(block.indexOf("### web_fetch") < block.indexOf("### exec"));
        assertEquals(1, block.split("### web_fetch", -1).length - 1);
    }

    @Test
    void shouldLimitInjectedRecords() {
        properties.getToolFailures().setInjectionLimit(2);
        store.recordToolFailure(AGENT, "a", "request timed out");
        store.recordToolFailure(AGENT, "b", "request timed out");
        store.recordToolFailure(AGENT, "c", "request timed out");
        store.recordToolFailure(AGENT, "c", "request timed out");

        String block = store.readToolFailuresForInjection(AGENT);

        assertTrue(block.contains("### c"));
        assertEquals(2, block.split("- \\*\\*timeout\\*\\*", -1).length - 1);
    }
}
