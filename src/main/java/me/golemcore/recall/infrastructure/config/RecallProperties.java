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

package me.golemcore.recall.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration of the working-memory engine, bound from
 * application.properties under the {@code recall.*} prefix.
 *
 * <p>
 * Nested property classes group the settings per subsystem:
 * <ul>
 * <li>{@link StorageProperties} - state root and workspace root</li>
 * <li>{@link CorrectionsProperties}, {@link ToolFailuresProperties},
 * {@link TasksProperties}, {@link ScratchProperties},
 * {@link SessionStateProperties} - store capacities and injection budgets</li>
 * <li>{@link TriggersProperties} - proactive heartbeat</li>
 * <li>{@link HybridProperties} - search score fusion weights</li>
 * <li>{@link BackgroundProperties} - background task queue</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "recall")
@Data
public class RecallProperties {

    private StorageProperties storage = new StorageProperties();
    private CorrectionsProperties corrections = new CorrectionsProperties();
    private ToolFailuresProperties toolFailures = new ToolFailuresProperties();
    private TasksProperties tasks = new TasksProperties();
    private ScratchProperties scratch = new ScratchProperties();
    private SessionStateProperties sessionState = new SessionStateProperties();
    private TriggersProperties triggers = new TriggersProperties();
    private HybridProperties hybrid = new HybridProperties();
    private BackgroundProperties background = new BackgroundProperties();

    @Data
    public static class StorageProperties {
        private String statePath = "${user.home}/.golemcore/recall/state";
        private String workspacePath = "${user.home}/.golemcore/recall/workspace";
        private String memoryDirectory = "memory";
        private boolean backupOnWrite = false;
    }

    @Data
    public static class CorrectionsProperties {
        private int maxEntries = 500;
        private int minKeywordOverlap = 2;
        private int searchLimit = 5;
        private int injectionChars = 3000;
    }

    @Data
    public static class ToolFailuresProperties {
        private int maxEntries = 100;
        private int evictBatch = 10;
        private int injectionLimit = 15;
    }

    @Data
    public static class TasksProperties {
        private int maxTasks = 100;
        private int maxActive = 25;
        private int pruneBatch = 10;
        private int maxTitleChars = 200;
        private int maxContextChars = 2000;
        private int injectionChars = 6000;
        private Duration recentCompletionWindow = Duration.ofDays(7);
        private int recentCompletionLimit = 5;
    }

    @Data
    public static class ScratchProperties {
        private List<String> captureTools = new ArrayList<>(List.of(
                "web_search", "web_fetch", "memory_search", "memory_get", "sessions_list",
                "sessions_history", "session_status", "nodes", "exec"));
        private int maxEntries = 20;
        private int maxEntryChars = 2000;
        private int minOutputChars = 20;
        private int injectionChars = 15000;
        private boolean mirrorMarkdown = true;
    }

    @Data
    public static class SessionStateProperties {
        private int maxKeys = 20;
        private int maxValueChars = 500;
        private int maxBytes = 10240;
    }

    @Data
    public static class TriggersProperties {
        private boolean enabled = false;
        private Duration interval = Duration.ofMinutes(5);
        private List<String> owners = new ArrayList<>();
        private Duration cooldown = Duration.ofHours(4);
        private int maxPerCheck = 5;
        private Duration staleTask = Duration.ofHours(72);
        private Duration stuckSubagent = Duration.ofMinutes(30);
        private Duration deadlineHorizon = Duration.ofHours(24);
        private int repeatedFailureThreshold = 3;
        private int highPriorityFailureCount = 10;
        private List<String> watchedFiles = new ArrayList<>(List.of(
                "AGENTS.md", "SOUL.md", "TOOLS.md", "USER.md", "HEARTBEAT.md"));
    }

    @Data
    public static class HybridProperties {
        private double vectorWeight = 0.7;
        private double textWeight = 0.3;
        private double recencyWeight = 0.15;
    }

    @Data
    public static class BackgroundProperties {
        private int queueCapacity = 256;
    }
}
