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

package me.golemcore.recall.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.FileSnapshot;
import me.golemcore.recall.domain.model.SubagentRun;
import me.golemcore.recall.domain.model.Task;
import me.golemcore.recall.domain.model.TaskPriority;
import me.golemcore.recall.domain.model.ToolFailure;
import me.golemcore.recall.domain.model.Trigger;
import me.golemcore.recall.domain.model.TriggerEvaluation;
import me.golemcore.recall.domain.model.TriggerPriority;
import me.golemcore.recall.domain.model.TriggerStateDocument;
import me.golemcore.recall.domain.model.TriggerType;
import me.golemcore.recall.domain.store.JsonDocumentStore;
import me.golemcore.recall.domain.store.TaskLedgerStore;
import me.golemcore.recall.domain.store.ToolFailureStore;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.StoragePort;
import me.golemcore.recall.port.outbound.SubagentRunRegistryPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Detects conditions the agent should act on without being asked: stale or
 * due tasks, repeatedly failing tools, watched workspace files changed from
 * outside, and sub-agents that look stuck.
 *
 * <p>
 * The evaluator keeps one global state document
 * ({@code proactive-triggers.json}) with the last observed size and mtime of
 * each watched file and the time each trigger key last fired. A key is built
 * from the trigger's subject, not its wording, and does not fire again within
 * the cooldown; keys are scoped per agent. There is no
 * rollback: a failed write leaves the previous state, which the next
 * successful run corrects.
 */
@Service
@Slf4j
public class ProactiveTriggerService {

    static final String STATE_KEY = "proactive-triggers";

    private static final long MTIME_TOLERANCE_MS = 1000;
    private static final int SUBAGENT_TASK_CHARS = 80;

    private static final Comparator<Trigger> PRIORITY_ORDER = Comparator.comparing(Trigger::priority);

    private final TaskLedgerStore taskLedgerStore;
    private final ToolFailureStore toolFailureStore;
    private final SubagentRunRegistryPort runRegistry;
    private final StoragePort workspaceStorage;
    private final JsonDocumentStore<TriggerStateDocument> stateStore;
    private final RecallProperties.TriggersProperties config;
    private final Clock clock;
    private final Map<String, String> pendingAlerts = new ConcurrentHashMap<>();

    public ProactiveTriggerService(TaskLedgerStore taskLedgerStore, ToolFailureStore toolFailureStore,
            SubagentRunRegistryPort runRegistry, StoragePort storagePort,
            @Qualifier("workspaceStoragePort") StoragePort workspaceStorage, ObjectMapper objectMapper,
            RecallProperties properties, Clock clock) {
        this.taskLedgerStore = taskLedgerStore;
        this.toolFailureStore = toolFailureStore;
        this.runRegistry = runRegistry;
        this.workspaceStorage = workspaceStorage;
        this.stateStore = new JsonDocumentStore<>(storagePort, objectMapper, "", TriggerStateDocument.class,
                TriggerStateDocument::new, properties.getStorage().isBackupOnWrite());
        this.config = properties.getTriggers();
        this.clock = clock;
    }

    /**
     * Runs every check for the agent and returns the triggers that are not in
     * cooldown, highest priority first, with the rendered alert block. Never
     * throws; a failure yields an empty evaluation.
     */
    public TriggerEvaluation evaluate(String agentId) {
        try {
            Instant now = clock.instant();
            List<Trigger> candidates = new ArrayList<>();
            List<Task> tasks = taskLedgerStore.listTasks(agentId, null, null);
            candidates.addAll(checkDeadlines(tasks, now));
            candidates.addAll(checkStaleTasks(tasks, now));
            candidates.addAll(checkRepeatedFailures(toolFailureStore.getFailures(agentId), now));
            candidates.addAll(checkStuckSubagents(runRegistry.listRuns(agentId), now));

            List<Trigger> fired = stateStore.update(STATE_KEY, state -> {
                candidates.addAll(checkFileChanges(state, now));
                List<Trigger> fresh = new ArrayList<>();
                for (Trigger trigger : candidates) {
                    if (!firedRecently(state, firedKey(agentId, trigger), now)) {
                        fresh.add(trigger);
                    }
                }
                fresh.sort(PRIORITY_ORDER);
                List<Trigger> kept = new ArrayList<>(fresh.subList(0, Math.min(config.getMaxPerCheck(),
                        fresh.size())));
                for (Trigger trigger : kept) {
                    state.getFiredTriggers().put(firedKey(agentId, trigger), now);
                }
                Instant expiry = now.minus(config.getCooldown().multipliedBy(2));
                state.getFiredTriggers().values().removeIf(firedAt -> firedAt.isBefore(expiry));
                state.setLastRun(now);
                return kept;
            });

            if (fired.isEmpty()) {
                return TriggerEvaluation.empty();
            }
            log.info("[Triggers] {} alert(s) for {}", fired.size(), agentId);
            return new TriggerEvaluation(fired, render(fired));
        } catch (RuntimeException e) {
            log.warn("[Triggers] Evaluation failed for {}: {}", agentId, e.getMessage());
            return TriggerEvaluation.empty();
        }
    }

    /**
     * Evaluates and parks the alert block for the agent's next turn, replacing
     * any block still waiting there.
     */
    public TriggerEvaluation evaluateAndPark(String agentId) {
        TriggerEvaluation evaluation = evaluate(agentId);
        if (evaluation.injectionText() != null) {
            pendingAlerts.put(agentId, evaluation.injectionText());
        }
        return evaluation;
    }

    /**
     * Hands over the parked alert block, at most once.
     */
    public String consumePendingAlerts(String agentId) {
        return pendingAlerts.remove(agentId);
    }

    List<Trigger> checkDeadlines(List<Task> tasks, Instant now) {
        List<Trigger> triggers = new ArrayList<>();
        Instant horizon = now.plus(config.getDeadlineHorizon());
        for (Task task : tasks) {
            if (task.getStatus().isTerminal() || task.getDueAt() == null || task.getDueAt().isAfter(horizon)) {
                continue;
            }
            boolean overdue = task.getDueAt().isBefore(now);
            String message;
            if (overdue) {
                message = "Task \"" + task.getTitle() + "\" is overdue (was due " + task.getDueAt() + ").";
            } else {
                long hours = Duration.between(now, task.getDueAt()).toHours();
                message = "Task \"" + task.getTitle() + "\" is due in " + hours + " hours (" + task.getDueAt() + ").";
            }
            // due and overdue are separate alerts; a new due date is a new subject
            String subject = task.getId() + "@" + task.getDueAt() + (overdue ? ":overdue" : ":due");
            triggers.add(new Trigger(TriggerType.DEADLINE, TriggerPriority.HIGH, subject, message, now));
        }
        return triggers;
    }

    List<Trigger> checkStaleTasks(List<Task> tasks, Instant now) {
        List<Trigger> triggers = new ArrayList<>();
        for (Task task : tasks) {
            if (task.getStatus().isTerminal() || task.getUpdatedAt() == null) {
                continue;
            }
            Duration idle = Duration.between(task.getUpdatedAt(), now);
            if (idle.compareTo(config.getStaleTask()) <= 0) {
                continue;
            }
            TriggerPriority priority = task.getPriority() == TaskPriority.HIGH
                    || task.getPriority() == TaskPriority.CRITICAL ? TriggerPriority.HIGH : TriggerPriority.MEDIUM;
            String message = "Task \"" + task.getTitle() + "\" hasn't been updated in " + idle.toDays()
                    + " days (status: " + task.getStatus().getCode()
                    + "). Should this be completed, updated, or cancelled?";
            triggers.add(new Trigger(TriggerType.STALE_TASK, priority, task.getId(), message, now));
        }
        return triggers;
    }

    List<Trigger> checkRepeatedFailures(List<ToolFailure> failures, Instant now) {
        List<Trigger> triggers = new ArrayList<>();
        for (ToolFailure failure : failures) {
            if (failure.getCount() < config.getRepeatedFailureThreshold()) {
                continue;
            }
            TriggerPriority priority = failure.getCount() >= config.getHighPriorityFailureCount()
                    ? TriggerPriority.HIGH
                    : TriggerPriority.MEDIUM;
            String message = "Tool \"" + failure.getToolName() + "\" has failed " + failure.getCount()
                    + " times with " + failure.getCategory().getCode() + " errors. Consider a permanent fix: "
                    + failure.getLesson();
            String subject = failure.getToolName() + ":" + failure.getCategory().getCode() + ":"
                    + failure.getPattern();
            triggers.add(new Trigger(TriggerType.REPEATED_FAILURE, priority, subject, message, now));
        }
        return triggers;
    }

    List<Trigger> checkStuckSubagents(List<SubagentRun> runs, Instant now) {
        List<Trigger> triggers = new ArrayList<>();
        for (SubagentRun run : runs) {
            if (!run.isRunning() || run.getStartedAt() == null) {
                continue;
            }
            Duration running = Duration.between(run.getStartedAt(), now);
            if (running.compareTo(config.getStuckSubagent()) <= 0) {
                continue;
            }
            String task = run.getTask() != null ? run.getTask() : run.getRunId();
            if (task.length() > SUBAGENT_TASK_CHARS) {
                task = task.substring(0, SUBAGENT_TASK_CHARS);
            }
            String message = "Sub-agent \"" + task + "\" has been running for " + running.toMinutes()
                    + " minutes. It may be stuck.";
            triggers.add(new Trigger(TriggerType.STUCK_SUBAGENT, TriggerPriority.HIGH, run.getRunId(), message,
                    now));
        }
        return triggers;
    }

    /**
     * Compares watched files with their last observation and records the new
     * one. The first sighting of a file only records it; a vanished file is
     * dropped from tracking.
     */
    private List<Trigger> checkFileChanges(TriggerStateDocument state, Instant now) {
        List<Trigger> triggers = new ArrayList<>();
        Map<String, FileSnapshot> observed = state.getFileChecksums();
        for (String file : config.getWatchedFiles()) {
            FileSnapshot current = stat(file);
            if (current == null) {
                observed.remove(file);
                continue;
            }
            FileSnapshot previous = observed.get(file);
            if (previous != null && (previous.size() != current.size()
                    || Math.abs(previous.mtimeMs() - current.mtimeMs()) > MTIME_TOLERANCE_MS)) {
                triggers.add(new Trigger(TriggerType.FILE_CHANGE, TriggerPriority.LOW, file, file
                        + " was modified externally. You may want to re-read it for updated instructions.", now));
            }
            observed.put(file, current);
        }
        return triggers;
    }

    private FileSnapshot stat(String file) {
        try {
            return workspaceStorage.stat("", file).join();
        } catch (CompletionException e) {
            log.debug("[Triggers] Cannot stat {}: {}", file, e.getMessage());
            return null;
        }
    }

    private boolean firedRecently(TriggerStateDocument state, String key, Instant now) {
        Instant lastFired = state.getFiredTriggers().get(key);
        return lastFired != null && Duration.between(lastFired, now).compareTo(config.getCooldown()) < 0;
    }

    private static String firedKey(String agentId, Trigger trigger) {
        return agentId + "/" + trigger.dedupKey();
    }

    private static String render(List<Trigger> triggers) {
        StringBuilder sb = new StringBuilder();
        sb.append("## ⚡ Proactive Alerts\n");
        sb.append("These conditions were detected automatically. Act on them if appropriate.\n\n");
        for (Trigger trigger : triggers) {
            sb.append(trigger.priority().getIcon()).append(" **").append(trigger.type().getCode()).append("**: ")
                    .append(trigger.message()).append('\n');
        }
        return sb.toString().stripTrailing();
    }
}
