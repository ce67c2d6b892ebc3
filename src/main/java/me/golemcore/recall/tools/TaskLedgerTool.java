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

package me.golemcore.recall.tools;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.component.ToolComponent;
import me.golemcore.recall.domain.context.OwnerContextHolder;
import me.golemcore.recall.domain.exception.ValidationException;
import me.golemcore.recall.domain.model.OwnerContext;
import me.golemcore.recall.domain.model.Task;
import me.golemcore.recall.domain.model.TaskDraft;
import me.golemcore.recall.domain.model.TaskPriority;
import me.golemcore.recall.domain.model.TaskStatus;
import me.golemcore.recall.domain.model.TaskUpdate;
import me.golemcore.recall.domain.model.ToolDefinition;
import me.golemcore.recall.domain.model.ToolResult;
import me.golemcore.recall.domain.store.TaskLedgerStore;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Agent-facing interface to the persistent task ledger.
 *
 * <p>
 * Operations:
 * <ul>
 * <li>create - Create a task (title required)
 * <li>update - Modify fields of a task
 * <li>complete - Mark a task done
 * <li>list - List tasks, optionally filtered by status or tag
 * <li>get - Show one task in detail
 * <li>delete - Remove a task
 * </ul>
 *
 * <p>
 * Active tasks are injected into the agent context on every turn, so the agent
 * always sees what it is working on.
 *
 * @see me.golemcore.recall.domain.store.TaskLedgerStore
 */
@Component
@Slf4j
public class TaskLedgerTool implements ToolComponent {

    // JSON Schema constants
    private static final String SCHEMA_TYPE = "type";
    private static final String SCHEMA_OBJECT = "object";
    private static final String SCHEMA_STRING = "string";
    private static final String SCHEMA_PROPERTIES = "properties";
    private static final String SCHEMA_DESCRIPTION = "description";
    private static final String SCHEMA_ENUM = "enum";
    private static final String SCHEMA_REQUIRED = "required";

    // Parameter names
    private static final String PARAM_OPERATION = "operation";
    private static final String PARAM_ID = "id";
    private static final String PARAM_TITLE = "title";
    private static final String PARAM_CONTEXT = "context";
    private static final String PARAM_NEXT_ACTION = "next_action";
    private static final String PARAM_STATUS = "status";
    private static final String PARAM_PRIORITY = "priority";
    private static final String PARAM_BLOCKER = "blocker";
    private static final String PARAM_WAITING_FOR = "waiting_for";
    private static final String PARAM_TAGS = "tags";
    private static final String PARAM_DUE_AT = "due_at";
    private static final String PARAM_PARENT_ID = "parent_id";
    private static final String PARAM_FILTER = "filter";

    private static final String ERR_MISSING_ID = "Missing required parameter: id";
    private static final int TIMESTAMP_CHARS = 16;

    private final TaskLedgerStore taskLedgerStore;

    public TaskLedgerTool(TaskLedgerStore taskLedgerStore) {
        this.taskLedgerStore = taskLedgerStore;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("task_ledger")
                .description("""
                        Persistent task/goal tracker that survives across sessions. \
                        Use it to track what you're working on, what's blocked and what's next. \
                        Active tasks are auto-injected into your context every session.
                        Operations: create, update, complete, list, get, delete.
                        """)
                .inputSchema(Map.of(
                        SCHEMA_TYPE, SCHEMA_OBJECT,
                        SCHEMA_PROPERTIES, buildProperties(),
                        SCHEMA_REQUIRED, List.of(PARAM_OPERATION)))
                .build();
    }

    private static Map<String, Object> buildProperties() {
        Map<String, Object> props = new HashMap<>();
        props.put(PARAM_OPERATION, Map.of(
                SCHEMA_TYPE, SCHEMA_STRING,
                SCHEMA_ENUM, List.of("create", "update", "complete", "list", "get", "delete"),
                SCHEMA_DESCRIPTION, "Operation to perform"));
        props.put(PARAM_ID, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION,
                "Task ID (required for update/complete/get/delete)"));
        props.put(PARAM_TITLE, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION,
                "Task title (required for create)"));
        props.put(PARAM_CONTEXT, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION,
                "Task context/description. Max 2000 chars."));
        props.put(PARAM_NEXT_ACTION, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION,
                "The next concrete action to take on this task"));
        props.put(PARAM_STATUS, Map.of(
                SCHEMA_TYPE, SCHEMA_STRING,
                SCHEMA_ENUM, Arrays.stream(TaskStatus.values()).map(TaskStatus::getCode).toList(),
                SCHEMA_DESCRIPTION, "Task status"));
        props.put(PARAM_PRIORITY, Map.of(
                SCHEMA_TYPE, SCHEMA_STRING,
                SCHEMA_ENUM, Arrays.stream(TaskPriority.values()).map(TaskPriority::getCode).toList(),
                SCHEMA_DESCRIPTION, "Task priority"));
        props.put(PARAM_BLOCKER, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION,
                "What is blocking this task"));
        props.put(PARAM_WAITING_FOR, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION,
                "What we are waiting for"));
        props.put(PARAM_TAGS, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION, "Comma-separated tags"));
        props.put(PARAM_DUE_AT, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION,
                "Due date as ISO-8601 instant, e.g. 2026-03-01T12:00:00Z"));
        props.put(PARAM_PARENT_ID, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION,
                "Parent task ID (for create)"));
        props.put(PARAM_FILTER, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION,
                "Filter for list: status name (active/blocked/waiting/done/cancelled) or tag name"));
        return props;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        log.debug("[TaskLedger] Execute: {}", parameters);

        OwnerContext owner = OwnerContextHolder.get();
        if (owner == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("No owner context available"));
        }

        try {
            String operation = stringParam(parameters, PARAM_OPERATION);
            if (operation == null) {
                return CompletableFuture.completedFuture(
                        ToolResult.failure("Missing required parameter: operation"));
            }

            ToolResult result = switch (operation) {
            case "create" -> createTask(owner.agentId(), parameters);
            case "update" -> updateTask(owner.agentId(), parameters);
            case "complete" -> completeTask(owner.agentId(), parameters);
            case "list" -> listTasks(owner.agentId(), parameters);
            case "get" -> getTask(owner.agentId(), parameters);
            case "delete" -> deleteTask(owner.agentId(), parameters);
            default -> ToolResult.failure("Unknown operation: " + operation);
            };
            return CompletableFuture.completedFuture(result);
        } catch (RuntimeException e) {
            log.warn("[TaskLedger] Error: {}", e.getMessage());
            return CompletableFuture.completedFuture(ToolResult.failure(e));
        }
    }

    private ToolResult createTask(String agentId, Map<String, Object> parameters) {
        String title = stringParam(parameters, PARAM_TITLE);
        if (title == null) {
            return ToolResult.failure("Missing required parameter: title");
        }
        TaskPriority priority = TaskPriority.fromCode(stringParam(parameters, PARAM_PRIORITY));

        Task task = taskLedgerStore.createTask(agentId, TaskDraft.builder()
                .title(title)
                .context(stringParam(parameters, PARAM_CONTEXT))
                .nextAction(stringParam(parameters, PARAM_NEXT_ACTION))
                .priority(priority != null ? priority : TaskPriority.NORMAL)
                .parentId(stringParam(parameters, PARAM_PARENT_ID))
                .tags(parseTags(stringParam(parameters, PARAM_TAGS)))
                .dueAt(parseInstant(stringParam(parameters, PARAM_DUE_AT)))
                .build());
        return ToolResult.success("Task created:\n" + formatTask(task), Map.of("task_id", task.getId()));
    }

    private ToolResult updateTask(String agentId, Map<String, Object> parameters) {
        String id = stringParam(parameters, PARAM_ID);
        if (id == null) {
            return ToolResult.failure(ERR_MISSING_ID);
        }

        // Unknown status or priority values are ignored, like absent ones.
        TaskUpdate update = TaskUpdate.builder()
                .title(stringParam(parameters, PARAM_TITLE))
                .context(stringParam(parameters, PARAM_CONTEXT))
                .nextAction(stringParam(parameters, PARAM_NEXT_ACTION))
                .status(TaskStatus.fromCode(stringParam(parameters, PARAM_STATUS)))
                .priority(TaskPriority.fromCode(stringParam(parameters, PARAM_PRIORITY)))
                .blocker(stringParam(parameters, PARAM_BLOCKER))
                .waitingFor(stringParam(parameters, PARAM_WAITING_FOR))
                .tags(parseTags(stringParam(parameters, PARAM_TAGS)))
                .dueAt(parseInstant(stringParam(parameters, PARAM_DUE_AT)))
                .build();
        Task task = taskLedgerStore.updateTask(agentId, id, update);
        return ToolResult.success("Task updated:\n" + formatTask(task), Map.of("task_id", task.getId()));
    }

    private ToolResult completeTask(String agentId, Map<String, Object> parameters) {
        String id = stringParam(parameters, PARAM_ID);
        if (id == null) {
            return ToolResult.failure(ERR_MISSING_ID);
        }
        Task task = taskLedgerStore.updateTask(agentId, id, TaskUpdate.builder().status(TaskStatus.DONE).build());
        return ToolResult.success("Task completed:\n" + formatTask(task), Map.of("task_id", task.getId()));
    }

    private ToolResult listTasks(String agentId, Map<String, Object> parameters) {
        String filter = stringParam(parameters, PARAM_FILTER);
        TaskStatus status = TaskStatus.fromCode(filter);
        String tag = filter != null && status == null ? filter : null;

        List<Task> tasks = taskLedgerStore.listTasks(agentId, status, tag);
        if (tasks.isEmpty()) {
            return ToolResult.success(filter != null ? "No tasks matching \"" + filter + "\"." : "No tasks found.",
                    Map.of("count", 0));
        }

        String output = tasks.stream()
                .map(task -> {
                    StringBuilder line = new StringBuilder();
                    line.append(task.getStatus().getIcon()).append(" [").append(task.getId()).append("] ")
                            .append(task.getTitle());
                    if (task.getPriority() != TaskPriority.NORMAL) {
                        line.append(" (").append(task.getPriority().getCode()).append(')');
                    }
                    if (task.getNextAction() != null) {
                        line.append("\n   → ").append(task.getNextAction());
                    }
                    return line.toString();
                })
                .collect(Collectors.joining("\n"));
        return ToolResult.success(tasks.size() + " task(s):\n" + output, Map.of("count", tasks.size()));
    }

    private ToolResult getTask(String agentId, Map<String, Object> parameters) {
        String id = stringParam(parameters, PARAM_ID);
        if (id == null) {
            return ToolResult.failure(ERR_MISSING_ID);
        }
        Task task = taskLedgerStore.getTask(agentId, id);
        return ToolResult.success(formatTask(task), Map.of("task_id", task.getId()));
    }

    private ToolResult deleteTask(String agentId, Map<String, Object> parameters) {
        String id = stringParam(parameters, PARAM_ID);
        if (id == null) {
            return ToolResult.failure(ERR_MISSING_ID);
        }
        taskLedgerStore.deleteTask(agentId, id);
        return ToolResult.success("Task \"" + id + "\" deleted.");
    }

    static String formatTask(Task task) {
        StringBuilder sb = new StringBuilder();
        sb.append("ID: ").append(task.getId()).append('\n');
        sb.append("Title: ").append(task.getTitle()).append('\n');
        sb.append("Status: ").append(task.getStatus().getCode()).append('\n');
        sb.append("Priority: ").append(task.getPriority().getCode()).append('\n');
        appendIfPresent(sb, "Context", task.getContext());
        appendIfPresent(sb, "Next action", task.getNextAction());
        appendIfPresent(sb, "Blocked by", task.getBlocker());
        appendIfPresent(sb, "Waiting for", task.getWaitingFor());
        appendIfPresent(sb, "Parent", task.getParentId());
        if (task.getTags() != null && !task.getTags().isEmpty()) {
            sb.append("Tags: ").append(String.join(", ", task.getTags())).append('\n');
        }
        if (task.getDueAt() != null) {
            sb.append("Due: ").append(shortTimestamp(task.getDueAt())).append('\n');
        }
        sb.append("Created: ").append(shortTimestamp(task.getCreatedAt())).append('\n');
        sb.append("Updated: ").append(shortTimestamp(task.getUpdatedAt()));
        if (task.getCompletedAt() != null) {
            sb.append("\nCompleted: ").append(shortTimestamp(task.getCompletedAt()));
        }
        return sb.toString();
    }

    private static void appendIfPresent(StringBuilder sb, String label, String value) {
        if (value != null && !value.isBlank()) {
            sb.append(label).append(": ").append(value).append('\n');
        }
    }

    private static String shortTimestamp(Instant instant) {
        if (instant == null) {
            return "-";
        }
        String text = instant.toString();
        return text.length() > TIMESTAMP_CHARS ? text.substring(0, TIMESTAMP_CHARS) : text;
    }

    private static List<String> parseTags(String raw) {
        if (raw == null) {
            return null;
        }
        List<String> tags = Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(tag -> !tag.isEmpty())
                .toList();
        return tags.isEmpty() ? null : tags;
    }

    private static Instant parseInstant(String raw) {
        if (raw == null) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid due_at, expected ISO-8601 instant: " + raw);
        }
    }

    private static String stringParam(Map<String, Object> parameters, String name) {
        Object value = parameters.get(name);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
