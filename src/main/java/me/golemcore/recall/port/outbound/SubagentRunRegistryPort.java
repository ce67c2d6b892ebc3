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

package me.golemcore.recall.port.outbound;

import me.golemcore.recall.domain.model.SubagentRun;

import java.util.List;

/**
 * Port to the registry of sub-agent runs spawned by an agent. The agent
 * runtime owns the registry; this engine only reads it.
 */
public interface SubagentRunRegistryPort {

    /**
     * Runs spawned by the agent, running and finished, in any order.
     */
    List<SubagentRun> listRuns(String agentId);
}
