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

package me.golemcore.recall.adapter.outbound.subagent;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.SubagentRun;
import me.golemcore.recall.port.outbound.SubagentRunRegistryPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Process-local run registry, used when the agent runtime reports sub-agent
 * starts and finishes into this service directly.
 */
@Component
@Slf4j
public class InMemorySubagentRunRegistry implements SubagentRunRegistryPort {

    private final Map<String, List<SubagentRun>> runsByAgent = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySubagentRunRegistry(Clock clock) {
        this.clock = clock;
    }

    public SubagentRun register(String agentId, String runId, String task, String label) {
        SubagentRun run = SubagentRun.builder()
                .runId(runId)
                .task(task)
                .label(label)
                .startedAt(clock.instant())
                .build();
        runsByAgent.computeIfAbsent(agentId, key -> new CopyOnWriteArrayList<>()).add(run);
        log.debug("[Subagents] Registered run {} for {}", runId, agentId);
        return run;
    }

    /**
     * Marks a run finished. Unknown run ids are ignored.
     *
     * @return true when the run was found
     */
    public boolean finish(String agentId, String runId, SubagentRun.SubagentOutcome outcome) {
        List<SubagentRun> runs = runsByAgent.get(agentId);
        if (runs == null) {
            return false;
        }
        for (SubagentRun run : runs) {
            if (runId.equals(run.getRunId()) && run.isRunning()) {
                run.setEndedAt(clock.instant());
                run.setOutcome(outcome);
                return true;
            }
        }
        return false;
    }

    @Override
    public List<SubagentRun> listRuns(String agentId) {
        List<SubagentRun> runs = runsByAgent.get(agentId);
        return runs != null ? new ArrayList<>(runs) : List.of();
    }
}
