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
import me.golemcore.recall.domain.model.ExecutionPlan;
import me.golemcore.recall.domain.model.OwnerContext;
import me.golemcore.recall.domain.model.PlanStep;
import me.golemcore.recall.domain.model.PlanStepStatus;
import me.golemcore.recall.domain.model.ToolDefinition;
import me.golemcore.recall.domain.model.ToolResult;
import me.golemcore.recall.domain.store.ExecutionPlanStore;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Lets the agent declare a multi-step plan for the current session and tick
 * off its steps. The plan survives compaction and is rendered into context
 * with its progress.
 *
 * @see me.golemcore.recall.domain.store.ExecutionPlanStore
 */
@Component
@Slf4j
public class ExecutionPlanTool implements ToolComponent {

    // JSON Schema constants
    private static final String SCHEMA_TYPE = "type";
    private static final String SCHEMA_OBJECT = "object";
    private static final String SCHEMA_STRING = "string";
    private static final String SCHEMA_INTEGER = "integer";
    private static final String SCHEMA_ARRAY = "array";
    private static final String SCHEMA_PROPERTIES = "properties";
    private static final String SCHEMA_DESCRIPTION = "description";
    private static final String SCHEMA_ENUM = "enum";
    private static final String SCHEMA_ITEMS = "items";
    private static final String SCHEMA_REQUIRED = "required";

    // Parameter names
    private static final String PARAM_OPERATION = "operation";
    private static final String PARAM_GOAL = "goal";
    private static final String PARAM_STEPS = "steps";
    private static final String PARAM_STEP_ID = "step_id";
    private static final String PARAM_STATUS = "status";

    private final ExecutionPlanStore executionPlanStore;

    public ExecutionPlanTool(ExecutionPlanStore executionPlanStore) {
        this.executionPlanStore = executionPlanStore;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("execution_plan")
                .description("""
                        Declare and track multi-step execution plans. Plans survive compaction so you never \
                        lose your place. Use 'create' to declare a plan with ordered steps, 'update' to mark \
                        steps as done, 'get' to check the current plan and 'clear' when the plan is complete.
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
                SCHEMA_ENUM, List.of("create", "update", "get", "clear"),
                SCHEMA_DESCRIPTION, "Operation to perform"));
        props.put(PARAM_GOAL, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION, "Goal description (for create)"));
        props.put(PARAM_STEPS, Map.of(
                SCHEMA_TYPE, SCHEMA_ARRAY,
                SCHEMA_ITEMS, Map.of(SCHEMA_TYPE, SCHEMA_STRING),
                SCHEMA_DESCRIPTION, "Ordered step descriptions (for create)"));
        props.put(PARAM_STEP_ID, Map.of(SCHEMA_TYPE, SCHEMA_INTEGER, SCHEMA_DESCRIPTION,
                "Step number to update, starting at 1"));
        props.put(PARAM_STATUS, Map.of(
                SCHEMA_TYPE, SCHEMA_STRING,
                SCHEMA_ENUM, Arrays.stream(PlanStepStatus.values()).map(PlanStepStatus::getCode).toList(),
                SCHEMA_DESCRIPTION, "New step status (for update, defaults to done)"));
        return props;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        log.debug("[Plans] Execute: {}", parameters);

        OwnerContext owner = OwnerContextHolder.get();
        if (owner == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("No owner context available"));
        }

        try {
            Object operation = parameters.get(PARAM_OPERATION);
            if (operation == null) {
                return CompletableFuture.completedFuture(
                        ToolResult.failure("Missing required parameter: operation"));
            }

            String sessionKey = owner.sessionKey();
            ToolResult result = switch (operation.toString()) {
            case "create" -> createPlan(sessionKey, parameters);
            case "update" -> updateStep(sessionKey, parameters);
            case "get" -> getPlan(sessionKey);
            case "clear" -> clearPlan(sessionKey);
            default -> ToolResult.failure("Unknown operation: " + operation);
            };
            return CompletableFuture.completedFuture(result);
        } catch (RuntimeException e) {
            log.warn("[Plans] Error: {}", e.getMessage());
            return CompletableFuture.completedFuture(ToolResult.failure(e));
        }
    }

    private ToolResult createPlan(String sessionKey, Map<String, Object> parameters) {
        Object goal = parameters.get(PARAM_GOAL);
        List<String> steps = parseSteps(parameters.get(PARAM_STEPS));
        ExecutionPlan plan = executionPlanStore.create(sessionKey, goal != null ? goal.toString() : null, steps);
        return ToolResult.success("Plan created: " + plan.getGoal() + " (" + plan.getSteps().size() + " steps)",
                Map.of("status", "created", "total_steps", plan.getSteps().size()));
    }

    private ToolResult updateStep(String sessionKey, Map<String, Object> parameters) {
        Object rawStepId = parameters.get(PARAM_STEP_ID);
        if (rawStepId == null) {
            return ToolResult.failure("Missing required parameter: step_id");
        }
        int stepId;
        if (rawStepId instanceof Number number) {
            stepId = number.intValue();
        } else {
            try {
                stepId = Integer.parseInt(rawStepId.toString().trim());
            } catch (NumberFormatException e) {
                return ToolResult.failure("Invalid step_id: " + rawStepId);
            }
        }

        Object rawStatus = parameters.get(PARAM_STATUS);
        PlanStepStatus status = rawStatus == null ? PlanStepStatus.DONE : PlanStepStatus.fromCode(rawStatus.toString());
        if (status == null) {
            return ToolResult.failure("Invalid status: " + rawStatus);
        }

        ExecutionPlan plan = executionPlanStore.updateStep(sessionKey, stepId, status);
        String progress = plan.getDoneCount() + "/" + plan.getSteps().size();
        return ToolResult.success("Step " + stepId + " -> " + status.getCode() + " (" + progress + " done)",
                Map.of("status", "updated", "step_id", stepId, "progress", progress));
    }

    private ToolResult getPlan(String sessionKey) {
        Optional<ExecutionPlan> existing = executionPlanStore.get(sessionKey);
        if (existing.isEmpty()) {
            return ToolResult.success("No active plan.", Map.of("status", "no_plan"));
        }
        ExecutionPlan plan = existing.get();
        StringBuilder sb = new StringBuilder();
        sb.append("Goal: ").append(plan.getGoal())
                .append(" (").append(ExecutionPlanStore.progressPercent(plan)).append("% complete)\n");
        for (PlanStep step : plan.getSteps()) {
            sb.append(step.getStatus().getIcon()).append(' ').append(step.getId()).append(". ")
                    .append(step.getDescription()).append('\n');
        }
        String progress = plan.getDoneCount() + "/" + plan.getSteps().size();
        return ToolResult.success(sb.toString().trim(), Map.of("goal", plan.getGoal(), "progress", progress));
    }

    private ToolResult clearPlan(String sessionKey) {
        executionPlanStore.clear(sessionKey);
        return ToolResult.success("Plan cleared.", Map.of("status", "cleared"));
    }

    private static List<String> parseSteps(Object raw) {
        if (!(raw instanceof List<?> list)) {
            return List.of();
        }
        return list.stream()
                .filter(item -> item != null && !item.toString().isBlank())
                .map(Object::toString)
                .toList();
    }
}
