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
import me.golemcore.recall.domain.model.ExtractionOutcome;
import me.golemcore.recall.domain.model.Procedure;
import me.golemcore.recall.domain.model.ProcedureStep;
import me.golemcore.recall.domain.model.ToolResultMessage;
import me.golemcore.recall.domain.model.ToolUse;
import me.golemcore.recall.domain.service.MemoryArtifactWriter;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mines reusable procedures from successful multi-step runs: the ordered tool
 * calls that got the job done, named after the request and tagged for search.
 * Appended to a daily file under {@code memory/procedures/}.
 */
@Component
@Slf4j
public class ProcedureMiner {

    static final String ARTIFACT_KIND = "procedures";

    private static final int MIN_STEPS = 3;
    private static final int MAX_REQUEST_CHARS = 500;
    private static final int MAX_NAME_CHARS = 100;
    private static final int MAX_PARAM_CHARS = 200;
    private static final int ACTION_CHARS = 100;
    private static final int QUERY_ACTION_CHARS = 80;

    private static final Pattern SENTENCE_BREAK = Pattern.compile("[.\\n!?]");

    private static final Pattern ACTION_WORDS = Pattern.compile(
            "\\b(install|create|build|deploy|fix|update|delete|send|email|search|research|write|read|configure"
                    + "|setup|push|commit|test|debug|monitor|check|analyze|scrape|crawl|filter)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern NOUN_WORDS = Pattern.compile(
            "\\b(file|script|cron|api|database|server|website|email|git|github|pipeline|report|template|config"
                    + "|memory|brain)\\b",
            Pattern.CASE_INSENSITIVE);

    private final MemoryArtifactWriter artifactWriter;
    private final Clock clock;

    public ProcedureMiner(MemoryArtifactWriter artifactWriter, Clock clock) {
        this.artifactWriter = artifactWriter;
        this.clock = clock;
    }

    /**
     * Pairs tool calls with their results by call id, in emission order.
     */
    public List<ProcedureStep> extractSteps(List<ConversationMessage> messages) {
        Map<String, ToolUse> pending = new HashMap<>();
        List<ProcedureStep> steps = new ArrayList<>();

        for (ConversationMessage message : messages) {
            if (message instanceof AssistantMessage assistant) {
                for (ToolUse toolUse : assistant.toolUses()) {
                    if (toolUse.id() != null) {
                        pending.put(toolUse.id(), toolUse);
                    }
                }
            } else if (message instanceof ToolResultMessage result) {
                ToolUse toolUse = result.toolCallId() != null ? pending.remove(result.toolCallId()) : null;
                String toolName;
                Map<String, String> keyParams = new LinkedHashMap<>();
                if (toolUse != null) {
                    toolName = toolUse.name();
                    toolUse.input().forEach((key, value) -> {
                        if (value instanceof String text && text.length() < MAX_PARAM_CHARS) {
                            keyParams.put(key, text);
                        } else if (value instanceof Number || value instanceof Boolean) {
                            keyParams.put(key, String.valueOf(value));
                        }
                    });
                } else {
                    toolName = result.toolName() != null ? result.toolName() : "unknown";
                }

                steps.add(ProcedureStep.builder()
                        .order(steps.size() + 1)
                        .tool(toolName)
                        .action(describeAction(toolName, keyParams))
                        .keyParams(keyParams)
                        .success(!result.error())
                        .build());
            }
        }
        return steps;
    }

    /**
     * Builds a procedure for a successful run with enough steps, or null.
     */
    public Procedure mine(List<ConversationMessage> messages, boolean success) {
        if (!success) {
            return null;
        }
        List<ProcedureStep> steps = extractSteps(messages);
        if (steps.size() < MIN_STEPS) {
            return null;
        }
        String request = Transcripts.lastUserRequest(messages, MAX_REQUEST_CHARS, "(unknown request)");
        Set<String> toolNames = new LinkedHashSet<>();
        steps.forEach(step -> toolNames.add(step.getTool()));

        return Procedure.builder()
                .name(deriveName(request))
                .request(request)
                .steps(steps)
                .tags(deriveTags(request, toolNames))
                .timestamp(clock.instant())
                .success(true)
                .build();
    }

    /**
     * Mines the run and appends the procedure to today's file. Never throws.
     */
    public ExtractionOutcome logProcedure(List<ConversationMessage> messages, boolean success) {
        try {
            Procedure procedure = mine(messages, success);
            if (procedure == null) {
                return ExtractionOutcome.notLogged();
            }
            LocalDate date = LocalDate.ofInstant(procedure.getTimestamp(), ZoneOffset.UTC);
            String header = "# Procedures: " + date + "\n\nLearned task procedures. Each entry records the "
                    + "step-by-step approach that worked.\n";
            String path = artifactWriter.appendDaily(ARTIFACT_KIND, date, header, format(procedure));
            log.info("[Procedures] Logged \"{}\": {} steps, tags: {}", procedure.getName(),
                    procedure.getSteps().size(), procedure.getTags());
            return ExtractionOutcome.logged(path, procedure.getSteps().size());
        } catch (RuntimeException e) {
            log.warn("[Procedures] Procedure logging failed: {}", e.getMessage());
            return ExtractionOutcome.notLogged();
        }
    }

    static String describeAction(String toolName, Map<String, String> keyParams) {
        if (keyParams.containsKey("command")) {
            return toolName + ": " + Transcripts.truncate(keyParams.get("command"), ACTION_CHARS);
        }
        String path = keyParams.containsKey("file_path") ? keyParams.get("file_path") : keyParams.get("path");
        if (path != null) {
            return toolName + ": " + Transcripts.truncate(path, ACTION_CHARS);
        }
        if (keyParams.containsKey("query")) {
            return toolName + ": \"" + Transcripts.truncate(keyParams.get("query"), QUERY_ACTION_CHARS) + "\"";
        }
        if (keyParams.containsKey("url")) {
            return toolName + ": " + Transcripts.truncate(keyParams.get("url"), ACTION_CHARS);
        }
        return toolName;
    }

    static String deriveName(String request) {
        String first = SENTENCE_BREAK.split(request, 2)[0].trim();
        return Transcripts.truncate(first, MAX_NAME_CHARS);
    }

    static List<String> deriveTags(String request, Set<String> toolNames) {
        Set<String> tags = new LinkedHashSet<>();
        toolNames.forEach(tool -> tags.add(tool.toLowerCase(Locale.ROOT)));
        for (Pattern pattern : List.of(ACTION_WORDS, NOUN_WORDS)) {
            Matcher matcher = pattern.matcher(request);
            while (matcher.find()) {
                tags.add(matcher.group(1).toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(tags);
    }

    private static String format(Procedure procedure) {
        StringBuilder sb = new StringBuilder();
        sb.append("# Procedure: ").append(procedure.getName()).append("\n\n");
        sb.append("**Status:** ").append(procedure.isSuccess() ? "✅ Successful" : "❌ Failed").append('\n');
        sb.append("**Date:** ").append(procedure.getTimestamp().toString(), 0, 10).append('\n');
        sb.append("**Tags:** ").append(String.join(", ", procedure.getTags())).append("\n\n");
        sb.append("## Request\n").append(procedure.getRequest()).append("\n\n");
        sb.append("## Steps\n\n");
        for (ProcedureStep step : procedure.getSteps()) {
            sb.append(step.getOrder()).append(". ").append(step.isSuccess() ? "✅" : "❌")
                    .append(" **").append(step.getAction()).append("**\n");
        }
        return sb.toString();
    }
}
