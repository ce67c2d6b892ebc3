package me.golemcore.recall.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.recall.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.recall.adapter.outbound.subagent.InMemorySubagentRunRegistry;
import me.golemcore.recall.domain.exception.PersistenceException;
import me.golemcore.recall.domain.model.SubagentRun;
import me.golemcore.recall.domain.model.Task;
import me.golemcore.recall.domain.model.TaskDraft;
import me.golemcore.recall.domain.model.TaskPriority;
import me.golemcore.recall.domain.model.Trigger;
import me.golemcore.recall.domain.model.TriggerEvaluation;
import me.golemcore.recall.domain.model.TriggerPriority;
import me.golemcore.recall.domain.model.TriggerStateDocument;
import me.golemcore.recall.domain.model.TriggerType;
import me.golemcore.recall.domain.store.TaskLedgerStore;
import me.golemcore.recall.domain.store.ToolFailureStore;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.testsupport.MutableClock;
import me.golemcore.recall.testsupport.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProactiveTriggerServiceTest {

    private static final String AGENT = "main";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path stateDir;

    @TempDir
    Path workspaceDir;

    private RecallProperties properties;
    private MutableClock clock;
    private ObjectMapper objectMapper;
    private LocalStorageAdapter stateStorage;
    private LocalStorageAdapter workspaceStorage;
    private TaskLedgerStore taskLedgerStore;
    private ToolFailureStore toolFailureStore;
    private InMemorySubagentRunRegistry registry;
    private ProactiveTriggerService service;

    @BeforeEach
    void setUp() {
        properties = new RecallProperties();
        clock = new MutableClock(NOW);
        objectMapper = TestStores.objectMapper();
        stateStorage = TestStores.storage(stateDir);
        workspaceStorage = TestStores.storage(workspaceDir);
        taskLedgerStore = new TaskLedgerStore(stateStorage, objectMapper, properties, clock);
        toolFailureStore = new ToolFailureStore(stateStorage, objectMapper, properties, clock);
        registry = new InMemorySubagentRunRegistry(clock);
        service = new ProactiveTriggerService(taskLedgerStore, toolFailureStore, registry, stateStorage,
                workspaceStorage, objectMapper, properties, clock);
    }

    @Test
    void shouldReturnEmptyEvaluationWhenNothingIsWrong() {
        TriggerEvaluation evaluation = service.evaluate(AGENT);

        assertTrue(evaluation.triggers().isEmpty());
        assertNull(evaluation.injectionText());
        assertTrue(Files.exists(stateDir.resolve("proactive-triggers.json")));
    }

    @Test
    void shouldFlagStaleTasksAndRespectCooldown() {
        taskLedgerStore.createTask(AGENT, TaskDraft.builder().title("Write report").priority(TaskPriority.HIGH)
                .build());
        clock.advance(Duration.ofDays(4));

        List<Trigger> triggers = service.evaluate(AGENT).triggers();
        assertEquals(1, triggers.size());
        assertEquals(TriggerType.STALE_TASK, triggers.get(0).type());
        assertEquals(TriggerPriority.HIGH, triggers.get(0).priority());
        assertEquals("Task \"Write report\" hasn't been updated in 4 days (status: active). "
                + "Should this be completed, updated, or cancelled?", triggers.get(0).message());

        assertTrue(service.evaluate(AGENT).triggers().isEmpty());

        clock.advance(Duration.ofHours(4));
        assertEquals(1, service.evaluate(AGENT).triggers().size());
    }

    @Test
    void shouldWarnAboutDueAndOverdueTasks() {
        taskLedgerStore.createTask(AGENT, TaskDraft.builder().title("Renew cert")
                .dueAt(NOW.plus(Duration.ofHours(5))).build());
        taskLedgerStore.createTask(AGENT, TaskDraft.builder().title("File taxes")
                .dueAt(NOW.minus(Duration.ofHours(2))).build());
        taskLedgerStore.createTask(AGENT, TaskDraft.builder().title("Plan offsite")
                .dueAt(NOW.plus(Duration.ofDays(10))).build());

        List<String> messages = service.evaluate(AGENT).triggers().stream().map(Trigger::message).toList();

        assertEquals(List.of(
                "Task \"Renew cert\" is due in 5 hours (2026-03-01T15:00:00Z).",
                "Task \"File taxes\" is overdue (was due 2026-03-01T08:00:00Z)."), messages);
    }

    @Test
    void shouldNotRepeatDeadlineAlertAsHoursTickDown() {
        taskLedgerStore.createTask(AGENT, TaskDraft.builder().title("Renew the production TLS certificate")
                .dueAt(NOW.plus(Duration.ofHours(20))).build());

        List<Trigger> first = service.evaluate(AGENT).triggers();
        assertEquals(1, first.size());
        assertEquals(TriggerType.DEADLINE, first.get(0).type());

        for (int hour = 1; hour < 4; hour++) {
            clock.advance(Duration.ofHours(1));
            assertTrue(service.evaluate(AGENT).triggers().isEmpty(), "re-fired after " + hour + "h");
        }

        clock.advance(Duration.ofHours(1));
        List<Trigger> afterCooldown = service.evaluate(AGENT).triggers();
        assertEquals(1, afterCooldown.size());
        assertEquals("Task \"Renew the production TLS certificate\" is due in 16 hours (2026-03-02T06:00:00Z).",
                afterCooldown.get(0).message());
    }

    @Test
    void shouldAlertAgainOnceDueTaskBecomesOverdue() {
        taskLedgerStore.createTask(AGENT, TaskDraft.builder().title("Send invoice")
                .dueAt(NOW.plus(Duration.ofHours(2))).build());
        assertEquals(1, service.evaluate(AGENT).triggers().size());

        clock.advance(Duration.ofHours(3));
        List<Trigger> triggers = service.evaluate(AGENT).triggers();

        assertEquals(1, triggers.size());
        assertEquals("Task \"Send invoice\" is overdue (was due 2026-03-01T12:00:00Z).", triggers.get(0).message());
    }

    @Test
    void shouldKeyStaleTaskCooldownOnTaskNotDayCount() {
        Task task = taskLedgerStore.createTask(AGENT, TaskDraft.builder().title("Write report").build());
        clock.advance(Duration.ofDays(4).minusMinutes(1));
        Trigger first = service.evaluate(AGENT).triggers().get(0);
        assertEquals("Task \"Write report\" hasn't been updated in 3 days (status: active). "
                + "Should this be completed, updated, or cancelled?", first.message());

        clock.advance(Duration.ofMinutes(2));

        assertTrue(service.evaluate(AGENT).triggers().isEmpty());
        assertTrue(readState().getFiredTriggers().containsKey(AGENT + "/stale_task:" + task.getId()));
    }

    @Test
    void shouldKeyStuckSubagentCooldownOnRunNotMinutes() {
        registry.register(AGENT, "r1", "Crawl", null);
        clock.advance(Duration.ofMinutes(31));
        assertEquals(1, service.evaluate(AGENT).triggers().size());

        clock.advance(Duration.ofMinutes(1));

        assertTrue(service.evaluate(AGENT).triggers().isEmpty());
    }

    @Test
    void shouldNotRepeatFailureAlertWhenCountGrows() {
        for (int i = 0; i < 3; i++) {
            toolFailureStore.recordToolFailure(AGENT, "web_fetch", "HTTP 429 Too Many Requests");
        }
        assertEquals(1, service.evaluate(AGENT).triggers().size());

        toolFailureStore.recordToolFailure(AGENT, "web_fetch", "HTTP 429 Too Many Requests");
        clock.advance(Duration.ofMinutes(10));

        assertTrue(service.evaluate(AGENT).triggers().isEmpty());
    }

    @Test
    void shouldForgetFiredKeysAfterTwiceTheCooldown() {
        registry.register(AGENT, "r1", "Crawl", null);
        clock.advance(Duration.ofMinutes(31));
        service.evaluate(AGENT);
        String key = AGENT + "/stuck_subagent:r1";
        assertEquals(NOW.plus(Duration.ofMinutes(31)), readState().getFiredTriggers().get(key));

        registry.finish(AGENT, "r1", SubagentRun.SubagentOutcome.OK);
        clock.advance(Duration.ofHours(4));
        service.evaluate(AGENT);
        assertTrue(readState().getFiredTriggers().containsKey(key));

        clock.advance(Duration.ofHours(4).plusMinutes(1));
        service.evaluate(AGENT);

        Map<String, Instant> fired = readState().getFiredTriggers();
        assertFalse(fired.containsKey(key));
        assertTrue(fired.isEmpty());
        assertEquals(clock.instant(), readState().getLastRun());
    }

    @Test
    void shouldReportRepeatedToolFailures() {
        for (int i = 0; i < 3; i++) {
            toolFailureStore.recordToolFailure(AGENT, "web_fetch", "HTTP 429 Too Many Requests");
        }

        Trigger trigger = service.evaluate(AGENT).triggers().get(0);

        assertEquals(TriggerType.REPEATED_FAILURE, trigger.type());
        assertEquals(TriggerPriority.MEDIUM, trigger.priority());
        assertEquals("Tool \"web_fetch\" has failed 3 times with rate_limit errors. Consider a permanent fix: "
                + "web_fetch hits rate limits; add delays between calls or reduce batch size.", trigger.message());
    }

    @Test
    void shouldRenderStuckSubagentAlert() {
        registry.register(AGENT, "r1", "Crawl the docs site", null);
        clock.advance(Duration.ofMinutes(31));

        TriggerEvaluation evaluation = service.evaluate(AGENT);

        assertEquals("## ⚡ Proactive Alerts\n"
                + "These conditions were detected automatically. Act on them if appropriate.\n\n"
                + "🔴 **stuck_subagent**: Sub-agent \"Crawl the docs site\" has been running for 31 minutes. "
                + "It may be stuck.", evaluation.injectionText());
    }

    @Test
    void shouldScopeCooldownPerAgent() {
        registry.register("alpha", "r1", "Crawl", null);
        registry.register("beta", "r2", "Crawl", null);
        clock.advance(Duration.ofMinutes(45));

        assertEquals(1, service.evaluate("alpha").triggers().size());
        assertEquals(1, service.evaluate("beta").triggers().size());
        assertTrue(service.evaluate("alpha").triggers().isEmpty());
    }

    @Test
    void shouldDetectExternalFileChangesAfterFirstSighting() throws IOException {
        Path agentsFile = workspaceDir.resolve("AGENTS.md");
        Files.writeString(agentsFile, "rules v1");

        assertTrue(service.evaluate(AGENT).triggers().isEmpty());

        Files.writeString(agentsFile, "rules v2 with more text");
        List<Trigger> triggers = service.evaluate(AGENT).triggers();

        assertEquals(1, triggers.size());
        assertEquals(TriggerType.FILE_CHANGE, triggers.get(0).type());
        assertEquals(TriggerPriority.LOW, triggers.get(0).priority());
        assertEquals("AGENTS.md was modified externally. You may want to re-read it for updated instructions.",
                triggers.get(0).message());
    }

    @Test
    void shouldSortByPriorityAndCapPerCheck() throws IOException {
        properties.getTriggers().setMaxPerCheck(2);
        Files.writeString(workspaceDir.resolve("USER.md"), "v1");
        service.evaluate(AGENT);
        Files.writeString(workspaceDir.resolve("USER.md"), "v2 changed");
        for (int i = 0; i < 3; i++) {
            toolFailureStore.recordToolFailure(AGENT, "exec", "Connection timed out after 30s");
        }
        registry.register(AGENT, "r1", "Long job", null);
        clock.advance(Duration.ofMinutes(40));

        List<Trigger> triggers = service.evaluate(AGENT).triggers();

        assertEquals(2, triggers.size());
        assertEquals(TriggerPriority.HIGH, triggers.get(0).priority());
        assertEquals(TriggerPriority.MEDIUM, triggers.get(1).priority());
    }

    @Test
    void shouldParkAlertsForOneConsumption() {
        registry.register(AGENT, "r1", "Crawl", null);
        clock.advance(Duration.ofHours(1));

        service.evaluateAndPark(AGENT);

        assertTrue(service.consumePendingAlerts(AGENT).startsWith("## ⚡ Proactive Alerts"));
        assertNull(service.consumePendingAlerts(AGENT));
    }

    @Test
    void shouldNeverThrowOnStoreFailure() {
        TaskLedgerStore failing = mock(TaskLedgerStore.class);
        when(failing.listTasks(anyString(), any(), any())).thenThrow(new PersistenceException("Corrupt document"));
        ProactiveTriggerService broken = new ProactiveTriggerService(failing, toolFailureStore, registry,
                stateStorage, workspaceStorage, objectMapper, properties, clock);

        TriggerEvaluation evaluation = broken.evaluate(AGENT);

        assertTrue(evaluation.triggers().isEmpty());
        assertNull(evaluation.injectionText());
    }

    private TriggerStateDocument readState() {
        try {
            return objectMapper.readValue(stateDir.resolve("proactive-triggers.json").toFile(),
                    TriggerStateDocument.class);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
