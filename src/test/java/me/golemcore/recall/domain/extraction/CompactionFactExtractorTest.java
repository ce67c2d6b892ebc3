package me.golemcore.recall.domain.extraction;

import me.golemcore.recall.domain.exception.PersistenceException;
import me.golemcore.recall.domain.model.AssistantMessage;
import me.golemcore.recall.domain.model.ConversationMessage;
import me.golemcore.recall.domain.model.ExtractedFact;
import me.golemcore.recall.domain.model.ExtractionOutcome;
import me.golemcore.recall.domain.model.FactCategory;
import me.golemcore.recall.domain.model.MessageRole;
import me.golemcore.recall.domain.model.ToolResultMessage;
import me.golemcore.recall.domain.model.UserMessage;
import me.golemcore.recall.domain.service.MemoryArtifactWriter;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.testsupport.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CompactionFactExtractorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00.123Z");

    @TempDir
    Path workspaceDir;

    private CompactionFactExtractor extractor;

    @BeforeEach
    void setUp() {
        MemoryArtifactWriter writer = new MemoryArtifactWriter(TestStores.storage(workspaceDir),
                new RecallProperties());
        extractor = new CompactionFactExtractor(writer, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldExtractDecisionsFromConversation() {
        List<ExtractedFact> facts = extractor.extractFacts(List.of(
                UserMessage.of("Let's use PostgreSQL for the analytics database"),
                AssistantMessage.of("Sure.")));

        assertTrue(facts.contains(new ExtractedFact(FactCategory.DECISION,
                "use PostgreSQL for the analytics database", MessageRole.USER, 0.0)));
    }

    @Test
    void shouldRestrictCategoriesBySourceRole() {
        List<ExtractedFact> facts = extractor.extractFacts(List.of(
                UserMessage.of("Error: the build failed on the CI runner"),
                ToolResultMessage.success("c1", "exec", "we will retry the upload tomorrow morning"),
                ToolResultMessage.success("c2", "exec", "Error: connection refused by upstream gateway")));

        assertFalse(facts.stream().anyMatch(fact -> fact.category() == FactCategory.ERROR_PATTERN
                && fact.source() == MessageRole.USER));
        assertFalse(facts.stream().anyMatch(fact -> fact.category() == FactCategory.DECISION
                && fact.source() == MessageRole.TOOL));
        assertTrue(facts.stream().anyMatch(fact -> fact.category() == FactCategory.ERROR_PATTERN
                && fact.content().equals("connection refused by upstream gateway")));
    }

    @Test
    void shouldCaptureUrlsOnce() {
        List<ExtractedFact> facts = extractor.extractFacts(List.of(
                AssistantMessage.of("Docs are at https://docs.example.com/guide and again https://docs.example.com/guide"),
                UserMessage.of("ok")));

        List<ExtractedFact> urls = facts.stream().filter(fact -> fact.category() == FactCategory.URL).toList();
        assertEquals(1, urls.size());
        assertEquals("https://docs.example.com/guide", urls.get(0).content());
    }

    @Test
    void shouldDeduplicateAcrossTheBatch() {
        List<ExtractedFact> facts = extractor.extractFacts(List.of(
                UserMessage.of("Let's use PostgreSQL for the analytics database"),
                UserMessage.of("Let's use PostgreSQL for the analytics database")));

        assertEquals(1, facts.stream().filter(fact -> fact.category() == FactCategory.DECISION).count());
    }

    @Test
    void shouldPersistFactsToTimestampedFile() throws IOException {
        List<ConversationMessage> messages = List.of(
                UserMessage.of("Let's use PostgreSQL for the analytics database"),
                AssistantMessage.of("Done."));

        ExtractionOutcome outcome = extractor.extractAndPersist(messages, "agent:main/1");

        assertTrue(outcome.logged());
        assertEquals("memory/compaction-facts/2026-03-01T12-00-00-123-agent_main_1.md", outcome.filePath());
        String content = Files.readString(workspaceDir.resolve(outcome.filePath()));
        assertTrue(content.startsWith("# Compaction Facts: 2026-03-01\n\nExtracted at: 2026-03-01T12:00:00.123Z\n"
                + "Session: agent:main/1\nMessages processed: 2\n"));
        assertTrue(content.contains("## Decisions\n\n- use PostgreSQL for the analytics database\n"));
    }

    @Test
    void shouldSkipWriteWhenNothingExtracted() {
        ExtractionOutcome outcome = extractor.extractAndPersist(List.of(UserMessage.of("hi")), "s1");

        assertFalse(outcome.logged());
        assertNull(outcome.filePath());
        assertFalse(Files.exists(workspaceDir.resolve("memory/compaction-facts")));
    }

    @Test
    void shouldNotThrowWhenWriteFails() {
        MemoryArtifactWriter writer = mock(MemoryArtifactWriter.class);
        when(writer.write(anyString(), anyString(), anyString()))
                .thenThrow(new PersistenceException("disk full"));
        CompactionFactExtractor failing = new CompactionFactExtractor(writer, Clock.fixed(NOW, ZoneOffset.UTC));

        ExtractionOutcome outcome = failing.extractAndPersist(
                List.of(UserMessage.of("Let's use PostgreSQL for the analytics database")), "s1");

        assertFalse(outcome.logged());
    }

    @Test
    void shouldOmitSessionSuffixWhenMissing() {
        assertEquals("2026-03-01T12-00-00-123.md", CompactionFactExtractor.fileName(NOW, null));
    }
}
