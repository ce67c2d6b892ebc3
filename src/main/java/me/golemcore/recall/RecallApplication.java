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

package me.golemcore.recall;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for GolemCore Recall.
 *
 * <p>
 * GolemCore Recall is the working-memory and retrieval engine of an agent
 * runtime. It keeps what an agent would otherwise lose to context compaction
 * and session boundaries.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Pattern Classifiers</b> - correction detection, tool error
 * categories, recall depth and context tags</li>
 * <li><b>Extraction Pipelines</b> - compaction facts, episode summaries and
 * mined procedures written as daily markdown logs</li>
 * <li><b>Bounded Stores</b> - corrections, tool failures, task ledger, scratch
 * pad, session state and execution plans</li>
 * <li><b>Proactive Triggers</b> - deadline, stale task, repeated failure,
 * stuck sub-agent and file change alerts with cooldown</li>
 * <li><b>Hybrid Retrieval</b> - vector and keyword score fusion with recency
 * decay</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Tools              → task_ledger, session_state, execution_plan
 * Domain Layer       → Classifiers, Extraction, Stores, Services
 * Infrastructure     → Local storage, Sub-agent run registry
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code recall.*}
 * prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
public class RecallApplication {

    public static void main(String[] args) {
        SpringApplication.run(RecallApplication.class, args);
    }

}
