package me.golemcore.recall.domain.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.recall.domain.exception.ValidationException;
import me.golemcore.recall.domain.model.CorrectionCategory;
import me.golemcore.recall.domain.model.CorrectionDocument;
import me.golemcore.recall.domain.model.CorrectionEntry;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.testsupport.MutableClock;
import me.golemcore.recall.testsupport.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CorrectionStoreTest {

    private static final String AGENT = "agent-1";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private RecallProperties properties;
    private MutableClock clock;
    private CorrectionStore store;

    @BeforeEach
    void setUp() {
        objectMapper = TestStores.objectMapper();
        properties = new RecallProperties();
        clock = new MutableClock(NOW);
        store = new CorrectionStore(TestStores.storage(tempDir), objectMapper, properties, clock);
    }

    @Test
    void shouldAddCorrectionAtHeadWithAssignedFields() {
        store.addCorrection(AGENT, draft("Use tabs for indentation", CorrectionCategory.PREFERENCE, 0.7));
        clock.advance(Duration.ofMinutes(1));
        CorrectionEntry second = store.addCorrection(AGENT,
                draft("The capital of Australia is Canberra", CorrectionCategory.FACTUAL, 0.8));

        List<CorrectionEntry> corrections = store.getCorrections(AGENT);
        assertEquals(2, corrections.size());
        assertEquals(second.getId(), corrections.get(0).getId());
        assertNotNull(second.getId());
        assertEquals(NOW.plus(Duration.ofMinutes(1)), second.getTimestamp());
        assertEquals(0, second.getAccessCount());
        assertEquals("", second.getAgentSaid());
    }

    @Test
    void shouldRejectCorrectionWithoutRule() {
        assertThrows(ValidationException.class,
                () -> store.addCorrection(AGENT, CorrectionEntry.builder().rule(" ").build()));
    }

    @Test
    void shouldKeepFrequentlyServedCorrectionWhenCapIsExceeded() throws Exception {
        CorrectionDocument document = new CorrectionDocument();
        for (int i = 0; i < 500; i++) {
            document.getCorrections().add(CorrectionEntry.builder()
                    .id("c-" + i)
                    .timestamp(NOW.minus(Duration.ofHours(i)))
                    .rule("rule number " + i)
                    .confidence(0.5)
                    .accessCount(i == 499 ? 50 : 0)
                    .build());
        }
        Files.createDirectories(tempDir.resolve("corrections"));
        Files.writeString(tempDir.resolve("corrections").resolve(AGENT + ".json"),
                objectMapper.writeValueAsString(document));

        store.addCorrection(AGENT, draft("brand new rule", CorrectionCategory.BEHAVIORAL, 0.6));

        List<CorrectionEntry> corrections = store.getCorrections(AGENT);
        assertEquals(500, corrections.size());
        assertEquals("c-499", corrections.get(0).getId());
        assertTrue(corrections.stream().anyMatch(entry -> "brand new rule".equals(entry.getRule())));
        assertTrue(corrections.stream().noneMatch(entry -> "c-498".equals(entry.getId())));
    }

    @Test
    void shouldPruneToRequestedSize() {
        for (int i = 0; i < 4; i++) {
            clock.advance(Duration.ofMinutes(1));
            store.addCorrection(AGENT, draft("rule " + i, CorrectionCategory.BEHAVIORAL, 0.6));
        }

        int removed = store.pruneCorrections(AGENT, 2);

        assertEquals(2, removed);
        List<CorrectionEntry> remaining = store.getCorrections(AGENT);
        assertEquals(List.of("rule 3", "rule 2"), remaining.stream().map(CorrectionEntry::getRule).toList());
    }

    @Test
    void shouldRequireTwoKeywordOverlapsForSearch() {
        store.addCorrection(AGENT, CorrectionEntry.builder()
                .rule("Deploy with the staging pipeline before production")
                .context("user asked about release")
                .category(CorrectionCategory.PROCEDURAL)
                .confidence(0.8)
                .build());

        assertTrue(store.searchCorrections(AGENT, "production outage").isEmpty());

        List<CorrectionEntry> matches = store.searchCorrections(AGENT, "how do I deploy to production?");

        assertEquals(1, matches.size());
        assertEquals(1, matches.get(0).getAccessCount());
        assertEquals(NOW, matches.get(0).getLastAccessed());
        assertEquals(1, store.getCorrections(AGENT).get(0).getAccessCount());
    }

    @Test
    void shouldRankBetterMatchesFirst() {
        store.addCorrection(AGENT, draft("Always run unit tests", CorrectionCategory.PROCEDURAL, 0.6));
        store.addCorrection(AGENT, draft("Always run unit tests with coverage report", CorrectionCategory.PROCEDURAL,
                0.6));

        List<CorrectionEntry> matches = store.searchCorrections(AGENT, "run unit tests with coverage");

        assertEquals(2, matches.size());
        assertEquals("Always run unit tests with coverage report", matches.get(0).getRule());
    }

    @Test
    void shouldRenderInjectionBlocks() {
        assertNull(store.readCorrectionsForInjection(AGENT));

        store.addCorrection(AGENT, CorrectionEntry.builder()
                .rule("Answer in English")
                .context("previous reply was in German")
                .category(CorrectionCategory.PREFERENCE)
                .confidence(0.75)
                .build());

        String block = store.readCorrectionsForInjection(AGENT);
        assertTrue(block.startsWith("## Learned Corrections"));
        assertTrue(block.contains("- [preference] Answer in English (confidence: 0.75) - context: previous reply"));

        assertNull(store.readRelevantCorrectionsForInjection(AGENT, "unrelated words here"));
        String relevant = store.readRelevantCorrectionsForInjection(AGENT, "please answer in english");
        assertTrue(relevant.startsWith("## Relevant Corrections"));
    }

    @Test
    void shouldRespectInjectionBudget() {
        properties.getCorrections().setInjectionChars(200);
        for (int i = 0; i < 10; i++) {
            store.addCorrection(AGENT, draft("Rule number " + i + " " + "x".repeat(40),
                    CorrectionCategory.BEHAVIORAL, 0.6));
        }

        String block = store.readCorrectionsForInjection(AGENT);

        assertTrue(block.length() <= 200);
        assertTrue(block.contains("Rule number 9"));
    }

    @Test
    void shouldReturnNullWhenNoCorrectionFitsTheBudget() {
        properties.getCorrections().setInjectionChars(120);
        store.addCorrection(AGENT, draft("Always describe the rollback plan before touching the "
                + "production database schema", CorrectionCategory.PROCEDURAL, 0.9));

        assertNull(store.readCorrectionsForInjection(AGENT));
        assertNull(store.readRelevantCorrectionsForInjection(AGENT, "rollback plan for the production schema"));
    }

    private static CorrectionEntry draft(String rule, CorrectionCategory category, double confidence) {
        return CorrectionEntry.builder()
                .rule(rule)
                .category(category)
                .confidence(confidence)
                .build();
    }
}
