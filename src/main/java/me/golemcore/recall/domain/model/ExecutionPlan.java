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

package me.golemcore.recall.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Multi-step plan declared by the agent for one session. Survives compaction
 * so the agent keeps its place in the workflow.
 */
@Data
public class ExecutionPlan implements VersionedDocument {

    private int version = CURRENT_VERSION;
    private String goal;
    private List<PlanStep> steps = new ArrayList<>();
    private Instant createdAt;
    private Instant updatedAt;

    @JsonIgnore
    public boolean isEmpty() {
        return goal == null && steps.isEmpty();
    }

    @JsonIgnore
    public long getDoneCount() {
        return steps.stream()
                .filter(step -> step.getStatus() == PlanStepStatus.DONE)
                .count();
    }
}
