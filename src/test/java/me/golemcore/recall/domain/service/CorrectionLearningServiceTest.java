package me.golemcore.recall.domain.service;

import me.golemcore.recall.domain.exception.PersistenceException;
import me.golemcore.recall.domain.model.CorrectionCategory;
import me.golemcore.recall.domain.model.CorrectionEntry;
import me.golemcore.recall.domain.store.CorrectionStore;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.testsupport.MutableClock;
import me.golemcore.recall.testsupport.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CorrectionLearningServiceTest {

    private static final String AGENT = "agent-1";

    @TempDir
    Path tempDir;

    private CorrectionStore store;
    private CorrectionLearningService service;

    @BeforeEach
    void setUp() {
        store = new CorrectionStore(TestStores.storage(tempDir), TestStores.objectMapper(), new RecallProperties(),
                new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
        service = new CorrectionLearningService(store);
    }

    @Test
    void shouldStoreDetectedCorrection() {
        Optional<CorrectionEntry> learned = service.learnFromExchange(AGENT,
                "  No, that's wrong, it's actually the staging server  ", "Deploying to production", "deploy it");

        assertTrue(learned.isPresent());
        CorrectionEntry entry = learned.get();
        assertEquals("No, that's wrong, it's actually the staging server", entry.getRule());
        assertEquals(CorrectionCategory.FACTUAL, entry.getCategory());
        assertEquals(1.0, entry.getConfidence());
        assertEquals("Deploying to production", entry.getAgentSaid());
        assertEquals("deploy it", entry.getContext());
        assertEquals(1, store.getCorrections(AGENT).size());
    }

    @Test
    void shouldIgnoreNormalMessages() {
        assertTrue(service.learnFromExchange(AGENT, "Thanks, looks good", "Here you go", null).isEmpty());
        assertTrue(store.getCorrections(AGENT).isEmpty());
    }

    @Test
    void shouldStoreEmptyExcerptsWhenHistoryMissing() {
        CorrectionEntry entry = service.learnFromExchange(AGENT, "Stop adding emojis to commit messages", null, null)
                .orElseThrow();

        assertEquals("", entry.getAgentSaid());
        assertEquals("", entry.getContext());
        assertEquals(CorrectionCategory.BEHAVIORAL, entry.getCategory());
    }

    @Test
    void shouldSwallowStoreFailures() {
        CorrectionStore failing = mock(CorrectionStore.class);
        when(failing.addCorrection(anyString(), any(CorrectionEntry.class)))
                .thenThrow(new PersistenceException("Read failed"));

        Optional<CorrectionEntry> learned = new CorrectionLearningService(failing)
                .learnFromExchange(AGENT, "That's wrong, use the other bucket", null, null);

        assertTrue(learned.isEmpty());
    }
}
