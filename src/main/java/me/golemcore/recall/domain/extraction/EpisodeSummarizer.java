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

package me.golemcore.recall.domain.extraction;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.AssistantMessage;
import me.golemcore.recall.domain.model.ConversationMessage;
import me.golemcore.recall.domain.model.Episode;
import me.golemcore.recall.domain.model.ExtractionOutcome;
import me.golemcore.recall.domain.model.MessageRole;
import me.golemcore.recall.domain.model.ToolUse;
import me.golemcore.recall.domain.service.MemoryArtifactWriter;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns a finished run into an episode: what was asked, which tools ran, which
 * files were touched and what came out of it. Episodes are appended to a daily
 * file under {@code memory/episodes/}.
 *
 * <p>
 * Runs without a single tool call are plain chat and are not logged.
 */
@Component
@Slf4j
public class EpisodeSummarizer {

    static final String ARTIFACT_KIND = "episodes";

    private static final int MAX_REQUEST_CHARS = 500;
    private static final int MAX_FILES = 20;
    private static final int MAX_OUTCOMES = 10;
    private static final int MAX_OUTCOME_CHARS = 200;
    private static final int OUTCOME_DEDUP_PREFIX = 60;
    private static final int MIN_OUTCOME_CHARS = 8;
    private static final int OUTCOME_TAIL_MESSAGES = 3;

    private static final List<String> FILE_INPUT_KEYS = List.of("file_path", "path", "filePath");

    private static final List<Pattern> FILE_PATTERNS = List.of(
            Pattern.compile("(?:file_path|path|file)\\s*[:=]\\s*[\"']?([^\\s\"',\\]}{]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:Read|Write|Edit)\\s+(?:file\\s+)?[\"']?([^\\s\"',\\]}{]+\\.\\w+)",
                    Pattern.CASE_INSENSITIVE));

    private static final List<Pattern> OUTCOME_PATTERNS = List.of(
            Pattern.compile("\\b(?:I(?:'ve| have)?|successfully|done|completed|created|updated|fixed|built|installed"
                    + "|configured|deployed|pushed|committed|sent|wrote|saved)\\s+(.{10,200})",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:✅|✓|\\b(?:done|ready|complete):?)\\s+(.{5,200})", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\b(?:error|failed|couldn'?t|unable to|blocked by)\\s+(.{10,200})",
                    Pattern.CASE_INSENSITIVE));

    private final MemoryArtifactWriter artifactWriter;
    private final Clock clock;

    public EpisodeSummarizer(MemoryArtifactWriter artifactWriter, Clock clock) {
        this.artifactWriter = artifactWriter;
        this.clock = clock;
    }

    /**
     * Builds the episode for a run, or null when no tool was called.
     */
    public Episode summarize(List<ConversationMessage> messages, boolean success, String error, Long durationMs,
            String sessionKey, String agentId) {
        List<String> tools = toolsUsed(messages);
        if (tools.isEmpty()) {
            return null;
        }
        return Episode.builder()
                .timestamp(clock.instant())
                .sessionKey(sessionKey)
                .agentId(agentId)
                .request(Transcripts.lastUserRequest(messages, MAX_REQUEST_CHARS, "(no request found)"))
                .toolsUsed(tools)
                .filesAccessed(filesAccessed(messages))
                .outcomes(outcomes(messages))
                .success(success)
                .error(error)
                .durationMs(durationMs)
                .build();
    }

    /**
     * Summarizes the run and appends it to today's episode file. Never throws.
     */
    public ExtractionOutcome logEpisode(List<ConversationMessage> messages, boolean success, String error,
            Long durationMs, String sessionKey, String agentId) {
        try {
            Episode episode = summarize(messages, success, error, durationMs, sessionKey, agentId);
            if (episode == null) {
                return ExtractionOutcome.notLogged();
            }

            LocalDate date = LocalDate.ofInstant(episode.getTimestamp(), ZoneOffset.UTC);
            String header = "# Episodes: " + date + "\n\nAutomatic work log. Each entry records what was requested, "
                    + "what tools were used, and what the outcome was.\n";
            String path = artifactWriter.appendDaily(ARTIFACT_KIND, date, header, format(episode));
            log.info("[Episodes] Logged episode: {} tools, {} outcomes into {}", episode.getToolsUsed().size(),
                    episode.getOutcomes().size(), path);
            return ExtractionOutcome.logged(path, 1);
        } catch (RuntimeException e) {
            log.warn("[Episodes] Episode logging failed: {}", e.getMessage());
            return ExtractionOutcome.notLogged();
        }
    }

    List<String> toolsUsed(List<ConversationMessage> messages) {
        Set<String> tools = new LinkedHashSet<>();
        for (ConversationMessage message : messages) {
            if (message instanceof AssistantMessage assistant) {
                for (ToolUse toolUse : assistant.toolUses()) {
                    if (toolUse.name() != null) {
                        tools.add(toolUse.name());
                    }
                }
            }
        }
        return new ArrayList<>(tools);
    }

    List<String> filesAccessed(List<ConversationMessage> messages) {
        Set<String> files = new LinkedHashSet<>();
        for (ConversationMessage message : messages) {
            if (message instanceof AssistantMessage assistant) {
                for (ToolUse toolUse : assistant.toolUses()) {
                    for (String key : FILE_INPUT_KEYS) {
                        if (toolUse.input().get(key) instanceof String path) {
                            files.add(path);
                        }
                    }
                }
            }
            if (message.role() == MessageRole.TOOL) {
                continue;
            }
            for (Pattern pattern : FILE_PATTERNS) {
                Matcher matcher = pattern.matcher(message.text());
                while (matcher.find()) {
                    String path = matcher.group(1);
                    if (path.length() > 3 && path.length() < 200) {
                        files.add(path);
                    }
                }
            }
        }
        return files.stream().limit(MAX_FILES).collect(Collectors.toList());
    }

    List<String> outcomes(List<ConversationMessage> messages) {
        List<String> tail = new ArrayList<>();
        for (int i = messages.size() - 1; i >= 0 && tail.size() < OUTCOME_TAIL_MESSAGES; i--) {
            ConversationMessage message = messages.get(i);
            if (message.role() == MessageRole.ASSISTANT && !message.text().isEmpty()) {
                tail.add(message.text());
            }
        }
        String combined = String.join("\n", tail);

        List<String> outcomes = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Pattern pattern : OUTCOME_PATTERNS) {
            Matcher matcher = pattern.matcher(combined);
            while (matcher.find() && outcomes.size() < MAX_OUTCOMES) {
                String outcome = Transcripts.truncate(matcher.group(1).trim(), MAX_OUTCOME_CHARS);
                String key = Transcripts.truncate(outcome.toLowerCase(Locale.ROOT), OUTCOME_DEDUP_PREFIX);
                if (outcome.length() > MIN_OUTCOME_CHARS && seen.add(key)) {
                    outcomes.add(outcome);
                }
            }
        }
        return outcomes;
    }

    private String format(Episode episode) {
        Instant timestamp = episode.getTimestamp();
        String iso = timestamp.toString();
        StringBuilder sb = new StringBuilder();
        sb.append("# Episode: ").append(iso, 0, 10).append(' ').append(iso, 11, 16).append("\n\n");
        if (episode.getSessionKey() != null) {
            sb.append("Session: ").append(episode.getSessionKey()).append('\n');
        }
        sb.append("Status: ").append(episode.isSuccess() ? "✅ Success" : "❌ Failed").append('\n');
        if (episode.getDurationMs() != null && episode.getDurationMs() > 0) {
            sb.append("Duration: ").append(Math.round(episode.getDurationMs() / 1000.0)).append("s\n");
        }
        sb.append("\n## Request\n").append(episode.getRequest()).append("\n\n");
        appendList(sb, "## Tools Used", episode.getToolsUsed());
        appendList(sb, "## Files Accessed", episode.getFilesAccessed());
        appendList(sb, "## Outcomes", episode.getOutcomes());
        if (episode.getError() != null && !episode.getError().isBlank()) {
            sb.append("## Error\n").append(episode.getError()).append("\n\n");
        }
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String heading, List<String> items) {
        if (items.isEmpty()) {
            return;
        }
        sb.append(heading).append('\n');
        for (String item : items) {
            sb.append("- ").append(item).append('\n');
        }
        sb.append('\n');
    }
}
