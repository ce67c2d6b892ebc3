/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.recall.domain.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
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
import me.golemcore.recall.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Persistent task ledger per agent ({@code task-ledger/<agentId>.json}).
 *
 * <p>
 * Active tasks are injected into every turn so the agent keeps track of what
 * it is working on across sessions and compactions. The ledger holds at most
 * {@code recall.tasks.max-tasks} tasks, of which at most
 * {@code recall.tasks.max-active} may be non-terminal. When the total cap is
 * reached the oldest-updated terminal tasks are pruned to make room.
 */
@Component
@Slf4j
public class TaskLedgerStore {

    static final String DIRECTORY = "task-ledger";

    private static final int TASK_ID_LENGTH = 8;

    private static final Comparator<Task> INJECTION_ORDER = Comparator
            .comparing(Task::getPriority)
            .thenComparing(Task::getUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final JsonDocumentStore<TaskLedgerDocument> documents;
    private final RecallProperties.TasksProperties config;
    private final Clock clock;

    public TaskLedgerStore(StoragePort storagePort, ObjectMapper objectMapper, RecallProperties properties,
            Clock clock) {
        this.documents = new JsonDocumentStore<>(storagePort, objectMapper, DIRECTORY, TaskLedgerDocument.class,
                TaskLedgerDocument::new, properties.getStorage().isBackupOnWrite());
        this.config = properties.getTasks();
        this.clock = clock;
    }

    public Task createTask(String agentId, TaskDraft draft) {
        if (draft == null || draft.getTitle() == null || draft.getTitle().isBlank()) {
            throw new ValidationException("Task title is required");
        }
        Instant now = clock.instant();

        Task created = documents.update(agentId, document -> {
            List<Task> tasks = document.getTasks();
            requireActiveSlot(tasks);
            if (tasks.size() >= config.getMaxTasks()) {
                pruneTerminal(tasks);
            }

            Task task = Task.builder()
                    .id(UUID.randomUUID().toString().substring(0, TASK_ID_LENGTH))
                    .title(truncate(draft.getTitle().trim(), config.getMaxTitleChars()))
                    .priority(draft.getPriority() != null ? draft.getPriority() : TaskPriority.NORMAL)
                    .context(truncate(nullToEmpty(draft.getContext()), config.getMaxContextChars()))
                    .nextAction(draft.getNextAction())
                    .parentId(draft.getParentId())
                    .tags(draft.getTags() != null ? new ArrayList<>(draft.getTags()) : new ArrayList<>())
                    .dueAt(draft.getDueAt())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            tasks.add(task);
            return task;
        });
        log.debug("[TaskLedger] Created task {} for {}: {}", created.getId(), agentId, created.getTitle());
        return created;
    }

    /**
     * Applies the non-null fields of the update. Moving to a terminal status
     * stamps {@code completedAt}; reopening a task clears it and needs a free
     * active slot, like creating one.
     */
    public Task updateTask(String agentId, String taskId, TaskUpdate update) {
        if (update == null) {
            throw new ValidationException("Task update is required");
        }
        Instant now = clock.instant();

        Task updated = documents.update(agentId, document -> {
            Task task = find(document, taskId);
            if (update.getTitle() != null) {
                if (update.getTitle().isBlank()) {
                    throw new ValidationException("Task title must not be blank");
                }
                task.setTitle(truncate(update.getTitle().trim(), config.getMaxTitleChars()));
            }
            if (update.getStatus() != null) {
                if (task.getStatus().isTerminal() && !update.getStatus().isTerminal()) {
                    requireActiveSlot(document.getTasks());
                }
                task.setStatus(update.getStatus());
                task.setCompletedAt(update.getStatus().isTerminal() ? now : null);
            }
            if (update.getPriority() != null) {
                task.setPriority(update.getPriority());
            }
            if (update.getContext() != null) {
                task.setContext(truncate(update.getContext(), config.getMaxContextChars()));
            }
            if (update.getNextAction() != null) {
                task.setNextAction(update.getNextAction());
            }
            if (update.getBlocker() != null) {
                task.setBlocker(update.getBlocker());
            }
            if (update.getWaitingFor() != null) {
                task.setWaitingFor(update.getWaitingFor());
            }
            if (update.getTags() != null) {
                task.setTags(new ArrayList<>(update.getTags()));
            }
            if (update.getDueAt() != null) {
                task.setDueAt(update.getDueAt());
            }
            task.setUpdatedAt(now);
            return task;
        });
        log.debug("[TaskLedger] Updated task {} for {} (status={})", taskId, agentId,
                updated.getStatus().getCode());
        return updated;
    }

    private void requireActiveSlot(List<Task> tasks) {
        long active = tasks.stream().filter(task -> !task.getStatus().isTerminal()).count();
        if (active >= config.getMaxActive()) {
            throw new CapacityExceededException("Maximum " + config.getMaxActive()
                    + " active tasks reached. Complete or cancel existing tasks first.");
        }
    }

    public Task getTask(String agentId, String taskId) {
        return find(documents.read(agentId), taskId);
    }

    /**
     * Lists tasks in ledger order. Either filter may be null.
     */
    public List<Task> listTasks(String agentId, TaskStatus status, String tag) {
        return documents.read(agentId).getTasks().stream()
                .filter(task -> status == null || task.getStatus() == status)
                .filter(task -> tag == null || task.getTags() != null && task.getTags().contains(tag))
                .collect(Collectors.toList());
    }

    public void deleteTask(String agentId, String taskId) {
        documents.update(agentId, document -> {
            Task task = find(document, taskId);
            document.getTasks().remove(task);
            return task;
        });
        log.debug("[TaskLedger] Deleted task {} for {}", taskId, agentId);
    }

    /**
     * Renders non-terminal tasks by priority and recency, followed by recent
     * completions. Returns null when nothing is in progress.
     */
    public String readTasksForInjection(String agentId) {
        List<Task> tasks = documents.read(agentId).getTasks();
        List<Task> active = tasks.stream()
                .filter(task -> !task.getStatus().isTerminal())
                .sorted(INJECTION_ORDER)
                .collect(Collectors.toList());
        if (active.isEmpty()) {
            return null;
        }

        int budget = config.getInjectionChars();
        StringBuilder sb = new StringBuilder();
        sb.append("## 📋 Active Tasks (Task Ledger)\n");
        sb.append("These are your current tasks. Update them as you make progress. Complete them when done.\n\n");
        for (Task task : active) {
            String section = formatTask(task);
            if (sb.length() + section.length() > budget) {
                sb.append("_(more tasks omitted)_\n\n");
                break;
            }
            sb.append(section);
        }

        Instant since = clock.instant().minus(config.getRecentCompletionWindow());
        List<Task> recentDone = tasks.stream()
                .filter(task -> task.getStatus() == TaskStatus.DONE)
                .filter(task -> task.getCompletedAt() != null && task.getCompletedAt().isAfter(since))
                .sorted(Comparator.comparing(Task::getCompletedAt).reversed())
                .limit(config.getRecentCompletionLimit())
                .collect(Collectors.toList());
        if (!recentDone.isEmpty()) {
            StringBuilder done = new StringBuilder("### Recently Completed\n");
            for (Task task : recentDone) {
                done.append("- ✅ ").append(task.getTitle())
                        .append(" (").append(formatDate(task.getCompletedAt())).append(")\n");
            }
            if (sb.length() + done.length() <= budget) {
                sb.append(done);
            }
        }
        return sb.toString().stripTrailing();
    }

    private String formatTask(Task task) {
        StringBuilder sb = new StringBuilder();
        sb.append("### ").append(task.getStatus().getIcon()).append(' ').append(task.getTitle());
        if (task.getPriority() != TaskPriority.NORMAL) {
            sb.append(" [").append(task.getPriority().getCode().toUpperCase(Locale.ROOT)).append(']');
        }
        sb.append('\n');
        sb.append("ID: `").append(task.getId()).append("` | Status: ").append(task.getStatus().getCode())
                .append(" | Updated: ").append(formatDate(task.getUpdatedAt())).append('\n');
        if (task.getDueAt() != null) {
            sb.append("Due: ").append(task.getDueAt()).append('\n');
        }
        if (hasText(task.getContext())) {
            sb.append("Context: ").append(task.getContext()).append('\n');
        }
        if (hasText(task.getNextAction())) {
            sb.append("**Next action:** ").append(task.getNextAction()).append('\n');
        }
        if (hasText(task.getBlocker())) {
            sb.append("**Blocked by:** ").append(task.getBlocker()).append('\n');
        }
        if (hasText(task.getWaitingFor())) {
            sb.append("**Waiting for:** ").append(task.getWaitingFor()).append('\n');
        }
        if (task.getTags() != null && !task.getTags().isEmpty()) {
            sb.append("Tags: ").append(String.join(", ", task.getTags())).append('\n');
        }
        return sb.append('\n').toString();
    }

    private void pruneTerminal(List<Task> tasks) {
        Set<String> victims = new HashSet<>();
        tasks.stream()
                .filter(task -> task.getStatus().isTerminal())
                .sorted(Comparator.comparing(Task::getUpdatedAt, Comparator.nullsFirst(Comparator.naturalOrder())))
                .limit(config.getPruneBatch())
                .forEach(task -> victims.add(task.getId()));
        if (!victims.isEmpty()) {
            tasks.removeIf(task -> victims.contains(task.getId()));
            log.debug("[TaskLedger] Pruned {} terminal tasks at capacity", victims.size());
        }
    }

    private static Task find(TaskLedgerDocument document, String taskId) {
        if (taskId == null || taskId.isBlank()) {
            throw new ValidationException("Task id is required");
        }
        return document.getTasks().stream()
                .filter(task -> taskId.equals(task.getId()))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
    }

    private static String truncate(String value, int max) {
        return value.length() > max ? value.substring(0, max) : value;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private static String formatDate(Instant instant) {
        return instant != null ? instant.toString().substring(0, 10) : "unknown";
    }
}
