package me.golemcore.recall.domain.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.recall.domain.exception.CapacityExceededException;
import me.golemcore.recall.domain.exception.NotFoundException;
import me.golemcore.recall.domain.exception.ValidationException;
import me.golemcore.recall.domain.model.Task;
import me.golemcore.recall.domain.model.TaskDraft;
import me.golemcore.recall.domain.model.TaskLedgerDocument;
import me.golemcore.recall.domain.model.TaskPriority;
import me.golemcore.recall.domain.model.TaskStatus;
import me.golemcore.recall.domain.model.TaskUpdate;
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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskLedgerStoreTest {

    private static final String AGENT = "agent-1";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private RecallProperties properties;
    private MutableClock clock;
    private TaskLedgerStore store;

    @BeforeEach
    void setUp() {
        objectMapper = TestStores.objectMapper();
        properties = new RecallProperties();
        clock = new MutableClock(NOW);
        store = new TaskLedgerStore(TestStores.storage(tempDir), objectMapper, properties, clock);
    }

    @Test
    void shouldCreateTaskWithDefaults() {
        Task task = store.createTask(AGENT, TaskDraft.builder()
                .title("  Write release notes  ")
                .tags(List.of("docs"))
                .build());

        assertEquals(8, task.getId().length());
        assertEquals("Write release notes", task.getTitle());
        assertEquals(TaskStatus.ACTIVE, task.getStatus());
        assertEquals(TaskPriority.NORMAL, task.getPriority());
        assertEquals("", task.getContext());
        assertEquals(NOW, task.getCreatedAt());
        assertEquals(NOW, task.getUpdatedAt());
        assertEquals(task.getId(), store.getTask(AGENT, task.getId()).getId());
    }

    @Test
    void shouldTruncateTitleAndContext() {
        Task task = store.createTask(AGENT, TaskDraft.builder()
                .title("t".repeat(300))
                .context("c".repeat(2500))
                .build());

        assertEquals(200, task.getTitle().length());
        assertEquals(2000, task.getContext().length());
    }

    @Test
    void shouldRejectBlankTitle() {
        assertThrows(ValidationException.class, () -> store.createTask(AGENT, TaskDraft.builder().title(" ").build()));
    }

    @Test
    void shouldRejectTwentySixthActiveTask() {
        for (int i = 0; i < 25; i++) {
            store.createTask(AGENT, TaskDraft.builder().title("Task " + i).build());
        }

        CapacityExceededException error = assertThrows(CapacityExceededException.class,
                () -> store.createTask(AGENT, TaskDraft.builder().title("One too many").build()));

        assertTrue(error.getMessage().startsWith("Maximum 25 active tasks reached"));
        assertEquals(25, store.listTasks(AGENT, null, null).size());
    }

    @Test
    void shouldRejectReopeningWhenActiveSlotsAreFull() {
        Task finished = store.createTask(AGENT, TaskDraft.builder().title("Old work").build());
        store.updateTask(AGENT, finished.getId(), TaskUpdate.builder().status(TaskStatus.DONE).build());
        for (int i = 0; i < 25; i++) {
            store.createTask(AGENT, TaskDraft.builder().title("Task " + i).build());
        }

        TaskUpdate reopen = TaskUpdate.builder().status(TaskStatus.WAITING).build();
        assertThrows(CapacityExceededException.class, () -> store.updateTask(AGENT, finished.getId(), reopen));

        assertEquals(TaskStatus.DONE, store.getTask(AGENT, finished.getId()).getStatus());
        long nonTerminal = store.listTasks(AGENT, null, null).stream()
                .filter(task -> !task.getStatus().isTerminal())
                .count();
        assertEquals(25, nonTerminal);
    }

    @Test
    void shouldAllowStatusChangesBetweenActiveStatesAtCapacity() {
        Task first = store.createTask(AGENT, TaskDraft.builder().title("Task 0").build());
        for (int i = 1; i < 25; i++) {
            store.createTask(AGENT, TaskDraft.builder().title("Task " + i).build());
        }

        Task blocked = store.updateTask(AGENT, first.getId(),
                TaskUpdate.builder().status(TaskStatus.BLOCKED).build());

        assertEquals(TaskStatus.BLOCKED, blocked.getStatus());
    }

    @Test
    void shouldPruneOldestTerminalTasksAtTotalCapacity() throws Exception {
        TaskLedgerDocument document = new TaskLedgerDocument();
        for (int i = 0; i < 100; i++) {
            document.getTasks().add(Task.builder()
                    .id("t-" + i)
                    .title("Task " + i)
                    .status(i < 95 ? TaskStatus.DONE : TaskStatus.ACTIVE)
                    .createdAt(NOW.minus(Duration.ofDays(200)))
                    .updatedAt(NOW.minus(Duration.ofDays(100 - i)))
                    .build());
        }
        Files.createDirectories(tempDir.resolve("task-ledger"));
        Files.writeString(tempDir.resolve("task-ledger").resolve(AGENT + ".json"),
                objectMapper.writeValueAsString(document));

        store.createTask(AGENT, TaskDraft.builder().title("Fresh").build());

        List<Task> tasks = store.listTasks(AGENT, null, null);
        assertEquals(91, tasks.size());
        assertTrue(tasks.stream().noneMatch(task -> "t-0".equals(task.getId()) || "t-9".equals(task.getId())));
        assertTrue(tasks.stream().anyMatch(task -> "t-10".equals(task.getId())));
    }

    @Test
    void shouldStampAndClearCompletedAt() {
        Task task = store.createTask(AGENT, TaskDraft.builder().title("Ship it").build());
        clock.advance(Duration.ofHours(1));

        Task done = store.updateTask(AGENT, task.getId(), TaskUpdate.builder().status(TaskStatus.DONE).build());
        assertEquals(NOW.plus(Duration.ofHours(1)), done.getCompletedAt());

        Task reopened = store.updateTask(AGENT, task.getId(), TaskUpdate.builder().status(TaskStatus.ACTIVE).build());
        assertNull(reopened.getCompletedAt());
    }

    @Test
    void shouldApplyOnlyNonNullFields() {
        Task task = store.createTask(AGENT, TaskDraft.builder()
                .title("Migrate database")
                .nextAction("Write migration script")
                .build());

        Task updated = store.updateTask(AGENT, task.getId(), TaskUpdate.builder()
                .blocker("Waiting on DBA approval")
                .priority(TaskPriority.HIGH)
                .build());

        assertEquals("Migrate database", updated.getTitle());
        assertEquals("Write migration script", updated.getNextAction());
        assertEquals("Waiting on DBA approval", updated.getBlocker());
        assertEquals(TaskPriority.HIGH, updated.getPriority());
    }

    @Test
    void shouldFailOnUnknownTask() {
        TaskUpdate update = TaskUpdate.builder().status(TaskStatus.DONE).build();

        assertThrows(NotFoundException.class, () -> store.updateTask(AGENT, "missing", update));
        assertThrows(NotFoundException.class, () -> store.getTask(AGENT, "missing"));
        assertThrows(NotFoundException.class, () -> store.deleteTask(AGENT, "missing"));
        assertThrows(ValidationException.class, () -> store.getTask(AGENT, ""));
    }

    @Test
    void shouldFilterByStatusAndTag() {
        Task first = store.createTask(AGENT, TaskDraft.builder().title("A").tags(List.of("infra")).build());
        store.createTask(AGENT, TaskDraft.builder().title("B").tags(List.of("docs")).build());
        store.updateTask(AGENT, first.getId(), TaskUpdate.builder().status(TaskStatus.BLOCKED).build());

        assertEquals(List.of("A"), titles(store.listTasks(AGENT, TaskStatus.BLOCKED, null)));
        assertEquals(List.of("B"), titles(store.listTasks(AGENT, null, "docs")));
        assertTrue(store.listTasks(AGENT, TaskStatus.ACTIVE, "infra").isEmpty());
    }

    @Test
    void shouldDeleteTask() {
        Task task = store.createTask(AGENT, TaskDraft.builder().title("Temporary").build());

        store.deleteTask(AGENT, task.getId());

        assertTrue(store.listTasks(AGENT, null, null).isEmpty());
    }

    @Test
    void shouldRenderActiveTasksByPriorityThenRecency() {
        assertNull(store.readTasksForInjection(AGENT));

        store.createTask(AGENT, TaskDraft.builder().title("Normal old").build());
        clock.advance(Duration.ofMinutes(1));
        store.createTask(AGENT, TaskDraft.builder().title("Normal new").nextAction("Do it").build());
        clock.advance(Duration.ofMinutes(1));
        store.createTask(AGENT, TaskDraft.builder().title("Urgent").priority(TaskPriority.CRITICAL).build());
        clock.advance(Duration.ofMinutes(1));
        Task finished = store.createTask(AGENT, TaskDraft.builder().title("Finished").build());
        store.updateTask(AGENT, finished.getId(), TaskUpdate.builder().status(TaskStatus.DONE).build());

        String block = store.readTasksForInjection(AGENT);

        assertTrue(block.startsWith("## 📋 Active Tasks (Task Ledger)"));
        assertTrue(block.contains("### 🔵 Urgent [CRITICAL]"));
        assertTrue(block.contains("**Next action:** Do it"));
        assertTrue(block.indexOf("Urgent") < block.indexOf("Normal new"));
        assertTrue(block.indexOf("Normal new") < block.indexOf("Normal old"));
        assertTrue(block.contains("### Recently Completed\n- ✅ Finished (2026-03-01)"));
        assertFalse(block.contains("### ✅ Finished"));
    }

    @Test
    void shouldReturnNullWhenOnlyTerminalTasksExist() {
        Task task = store.createTask(AGENT, TaskDraft.builder().title("Done already").build());
        store.updateTask(AGENT, task.getId(), TaskUpdate.builder().status(TaskStatus.CANCELLED).build());

        assertNull(store.readTasksForInjection(AGENT));
        assertNotNull(store.getTask(AGENT, task.getId()).getCompletedAt());
    }

    private static List<String> titles(List<Task> tasks) {
        return tasks.stream().map(Task::getTitle).toList();
    }
}
