package me.golemcore.recall.domain.service;

import me.golemcore.recall.adapter.outbound.subagent.InMemorySubagentRunRegistry;
import me.golemcore.recall.domain.model.SubagentRun;
import me.golemcore.recall.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SubagentStatusServiceTest {

    private static final String AGENT = "main";

    private MutableClock clock;
    private InMemorySubagentRunRegistry registry;
    private SubagentStatusService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        registry = new InMemorySubagentRunRegistry(clock);
        service = new SubagentStatusService(registry, clock);
    }

    @Test
    void shouldReturnNullWithoutRuns() {
        assertNull(service.buildStatusContext(AGENT));
    }

    @Test
    void shouldRenderRunningAndRecentRuns() {
        registry.register(AGENT, "r1", "Index the docs", "indexer");
        registry.register(AGENT, "r2", "Fetch pricing", null);
        clock.advance(Duration.ofSeconds(90));
        registry.finish(AGENT, "r2", SubagentRun.SubagentOutcome.OK);
        clock.advance(Duration.ofMinutes(30));

        assertEquals("## 🔄 Sub-Agent Status\n\n"
                + "### Running Now\n"
                + "- **Index the docs** (indexer), running for 31m\n\n"
                + "### Recently Completed\n"
                + "- ✅ Fetch pricing (took 1m), 30m ago", service.buildStatusContext(AGENT));
    }

    @Test
    void shouldHideRunsFinishedMoreThanADayAgo() {
        registry.register(AGENT, "r1", "Old crawl", null);
        registry.finish(AGENT, "r1", SubagentRun.SubagentOutcome.ERROR);
        clock.advance(Duration.ofHours(25));

        assertNull(service.buildStatusContext(AGENT));
    }

    @Test
    void shouldMarkTimedOutRuns() {
        registry.register(AGENT, "r1", "Slow job", "batch");
        clock.advance(Duration.ofMinutes(5));
        registry.finish(AGENT, "r1", SubagentRun.SubagentOutcome.TIMEOUT);

        assertTrue(service.buildStatusContext(AGENT).contains("- ⏰ timeout Slow job [batch] (took 5m), 0s ago"));
    }

    @Test
    void shouldFormatDurationsAndTruncate() {
        assertEquals("45s", SubagentStatusService.formatDuration(Duration.ofSeconds(45)));
        assertEquals("2h", SubagentStatusService.formatDuration(Duration.ofHours(2)));
        assertEquals("2h 5m", SubagentStatusService.formatDuration(Duration.ofMinutes(125)));
        assertEquals("0s", SubagentStatusService.formatDuration(Duration.ofSeconds(-5)));
        assertEquals("ab...", SubagentStatusService.truncate("abcdef", 5));
        assertEquals("", SubagentStatusService.truncate(null, 5));
    }
}
