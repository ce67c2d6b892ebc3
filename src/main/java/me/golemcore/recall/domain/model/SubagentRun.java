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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A sub-agent run as reported by the run registry. {@code endedAt} is null
 * while the run is still going.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubagentRun {

    private String runId;
    private String task;
    private String label;
    private Instant startedAt;
    private Instant endedAt;
    private SubagentOutcome outcome;

    public boolean isRunning() {
        return endedAt == null;
    }

    public enum SubagentOutcome {
        OK, ERROR, TIMEOUT
    }
}
