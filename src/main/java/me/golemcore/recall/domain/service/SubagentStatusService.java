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

import me.golemcore.recall.domain.model.SubagentRun;
import me.golemcore.recall.port.outbound.SubagentRunRegistryPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Summarizes the agent's sub-agent runs so the main agent knows what is
 * running in parallel and what recently finished.
 */
@Service
public class SubagentStatusService {

    private static final Duration RECENT_WINDOW = Duration.ofHours(24);
    private static final int MAX_RECENT = 5;
    private static final int RUNNING_TASK_CHARS = 120;
    private static final int DONE_TASK_CHARS = 100;

    private final SubagentRunRegistryPort runRegistry;
    private final Clock clock;

    public SubagentStatusService(SubagentRunRegistryPort runRegistry, Clock clock) {
        this.runRegistry = runRegistry;
        this.clock = clock;
    }

    /**
     * Running runs plus up to five runs finished in the last 24 hours, or null
     * when there is nothing to show.
     */
    public String buildStatusContext(String agentId) {
        List<SubagentRun> runs = runRegistry.listRuns(agentId);
        if (runs.isEmpty()) {
            return null;
        }
        Instant now = clock.instant();
        List<SubagentRun> running = new ArrayList<>();
        List<SubagentRun> recent = new ArrayList<>();
        for (SubagentRun run : runs) {
            if (run.isRunning()) {
                running.add(run);
            } else if (Duration.between(run.getEndedAt(), now).compareTo(RECENT_WINDOW) < 0) {
                recent.add(run);
            }
        }
        if (running.isEmpty() && recent.isEmpty()) {
            return null;
        }

        StringBuilder sb = new StringBuilder("## 🔄 Sub-Agent Status\n\n");
        if (!running.isEmpty()) {
            sb.append("### Running Now\n");
            for (SubagentRun run : running) {
                String duration = run.getStartedAt() != null
                        ? formatDuration(Duration.between(run.getStartedAt(), now))
                        : "just started";
                sb.append("- **").append(truncate(run.getTask(), RUNNING_TASK_CHARS)).append("**");
                if (run.getLabel() != null) {
                    sb.append(" (").append(run.getLabel()).append(')');
                }
                sb.append(", running for ").append(duration).append('\n');
            }
            sb.append('\n');
        }

        if (!recent.isEmpty()) {
            recent.sort(Comparator.comparing(SubagentRun::getEndedAt).reversed());
            sb.append("### Recently Completed\n");
            for (SubagentRun run : recent.subList(0, Math.min(MAX_RECENT, recent.size()))) {
                sb.append("- ").append(outcomeIcon(run.getOutcome())).append(' ')
                        .append(truncate(run.getTask(), DONE_TASK_CHARS));
                if (run.getLabel() != null) {
                    sb.append(" [").append(run.getLabel()).append(']');
                }
                if (run.getStartedAt() != null) {
                    sb.append(" (took ").append(formatDuration(Duration.between(run.getStartedAt(),
                            run.getEndedAt()))).append(')');
                }
                sb.append(", ").append(formatDuration(Duration.between(run.getEndedAt(), now))).append(" ago\n");
            }
        }
        return sb.toString().stripTrailing();
    }

    static String formatDuration(Duration duration) {
        long seconds = Math.max(0, duration.getSeconds());
        if (seconds < 60) {
            return seconds + "s";
        }
        long minutes = seconds / 60;
        if (minutes < 60) {
            return minutes + "m";
        }
        long hours = minutes / 60;
        long remainder = minutes % 60;
        return remainder > 0 ? hours + "h " + remainder + "m" : hours + "h";
    }

    static String truncate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max - 3) + "...";
    }

    private static String outcomeIcon(SubagentRun.SubagentOutcome outcome) {
        if (outcome == null) {
            return "❓";
        }
        return switch (outcome) {
        case OK -> "✅";
        case ERROR -> "❌";
        case TIMEOUT -> "⏰ timeout";
        };
    }
}
