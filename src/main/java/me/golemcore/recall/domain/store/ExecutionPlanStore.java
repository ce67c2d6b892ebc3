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
import me.golemcore.recall.domain.exception.NotFoundException;
import me.golemcore.recall.domain.exception.ValidationException;
import me.golemcore.recall.domain.model.ExecutionPlan;
import me.golemcore.recall.domain.model.PlanStep;
import me.golemcore.recall.domain.model.PlanStepStatus;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One declared multi-step plan per session
 * ({@code execution-plans/<sessionKey>.json}). Creating a plan replaces the
 * previous one.
 */
@Component
@Slf4j
public class ExecutionPlanStore {

    static final String DIRECTORY = "execution-plans";

    private final JsonDocumentStore<ExecutionPlan> documents;
    private final Clock clock;

    public ExecutionPlanStore(StoragePort storagePort, ObjectMapper objectMapper, RecallProperties properties,
            Clock clock) {
        this.documents = new JsonDocumentStore<>(storagePort, objectMapper, DIRECTORY, ExecutionPlan.class,
                ExecutionPlan::new, properties.getStorage().isBackupOnWrite());
        this.clock = clock;
    }

    public ExecutionPlan create(String sessionKey, String goal, List<String> stepDescriptions) {
        if (goal == null || goal.isBlank() || stepDescriptions == null || stepDescriptions.isEmpty()) {
            throw new ValidationException("Goal and steps are required for create");
        }
        Instant now = clock.instant();

        ExecutionPlan plan = documents.update(sessionKey, document -> {
            List<PlanStep> steps = new ArrayList<>();
            for (int i = 0; i < stepDescriptions.size(); i++) {
                steps.add(PlanStep.builder()
                        .id(i + 1)
                        .description(stepDescriptions.get(i))
                        .build());
            }
            document.setGoal(goal);
            document.setSteps(steps);
            document.setCreatedAt(now);
            document.setUpdatedAt(now);
            return document;
        });
        log.debug("[Plans] Created plan for {} with {} steps", sessionKey, plan.getSteps().size());
        return plan;
    }

    /**
     * Sets a step's status. Marking a step done moves the first pending step to
     * in progress.
     */
    public ExecutionPlan updateStep(String sessionKey, int stepId, PlanStepStatus status) {
        if (status == null) {
            throw new ValidationException("Step status is required");
        }
        if (get(sessionKey).isEmpty()) {
            throw new NotFoundException("No active plan. Create one first.");
        }

        return documents.update(sessionKey, plan -> {
            if (plan.isEmpty()) {
                throw new NotFoundException("No active plan. Create one first.");
            }
            PlanStep step = plan.getSteps().stream()
                    .filter(candidate -> candidate.getId() == stepId)
                    .findFirst()
                    .orElseThrow(() -> new NotFoundException("Step " + stepId + " not found"));
            step.setStatus(status);
            plan.setUpdatedAt(clock.instant());

            if (status == PlanStepStatus.DONE) {
                plan.getSteps().stream()
                        .filter(candidate -> candidate.getStatus() == PlanStepStatus.PENDING)
                        .findFirst()
                        .ifPresent(next -> next.setStatus(PlanStepStatus.IN_PROGRESS));
            }
            return plan;
        });
    }

    public Optional<ExecutionPlan> get(String sessionKey) {
        ExecutionPlan plan = documents.read(sessionKey);
        return plan.isEmpty() ? Optional.empty() : Optional.of(plan);
    }

    public void clear(String sessionKey) {
        documents.delete(sessionKey);
        log.debug("[Plans] Cleared plan for {}", sessionKey);
    }

    /**
     * Renders the plan with its completion percentage, or null when the session
     * has no plan.
     */
    public String readPlanForInjection(String sessionKey) {
        Optional<ExecutionPlan> found = get(sessionKey);
        if (found.isEmpty()) {
            return null;
        }
        ExecutionPlan plan = found.get();
        StringBuilder sb = new StringBuilder();
        sb.append("## 📋 Execution Plan (").append(progressPercent(plan)).append("% complete)\n");
        sb.append("**Goal:** ").append(plan.getGoal()).append("\n\n");
        for (PlanStep step : plan.getSteps()) {
            sb.append(step.getStatus().getIcon()).append(' ').append(step.getId()).append(". ")
                    .append(step.getDescription()).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    public static long progressPercent(ExecutionPlan plan) {
        int total = plan.getSteps().size();
        return total > 0 ? Math.round(plan.getDoneCount() * 100.0 / total) : 0;
    }
}
