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

package me.golemcore.recall.domain.classifier;

import me.golemcore.recall.domain.model.RecallDepth;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Picks how deep auto-recall should dig for a prompt. Rules form a precedence
 * chain and the first match wins:
 * <ol>
 * <li>greetings and prompts of at most two words: {@link RecallDepth#NONE}</li>
 * <li>explicit memory language: {@link RecallDepth#DEEP}</li>
 * <li>questions about people, status or plans: {@link RecallDepth#DEEP}</li>
 * <li>short imperative instructions under ten words:
 * {@link RecallDepth#SHALLOW}</li>
 * <li>anything else: {@link RecallDepth#NORMAL}</li>
 * </ol>
 */
public final class RecallDepthClassifier {

    private static final int MAX_SKIP_WORDS = 2;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern GREETINGS = Pattern.compile(
            "^(hi|hello|hey|sup|yo|gm|good\\s*(morning|afternoon|evening|night)|thanks|thank you|ok|okay|yes|no"
                    + "|sure|cool|nice|👍|❤️|😊)\\s*[!.?]*$",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern MEMORY_TRIGGERS = Pattern.compile(
            "\\b(remember|recall|last\\s+time|previously|earlier|before|history|what\\s+happened|when\\s+did"
                    + "|did\\s+(i|we|you)|how\\s+did|what\\s+was)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern CONTEXT_TRIGGERS = Pattern.compile(
            "\\b(who\\s+is|tell\\s+me\\s+about|update\\s+on|status\\s+of|progress"
                    + "|what('s| is)\\s+the\\s+(plan|status|update))\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TASK_TRIGGERS = Pattern.compile(
            "^(do|run|check|fix|update|create|delete|send|write|read|open|close|start|stop|restart|install|build)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final List<DepthRule> RULES = List.of(
            new DepthRule(MEMORY_TRIGGERS, Integer.MAX_VALUE, RecallDepth.DEEP),
            new DepthRule(CONTEXT_TRIGGERS, Integer.MAX_VALUE, RecallDepth.DEEP),
            new DepthRule(TASK_TRIGGERS, 10, RecallDepth.SHALLOW));

    private RecallDepthClassifier() {
    }

    public static RecallDepth classify(String prompt) {
        String trimmed = prompt == null ? "" : prompt.trim().toLowerCase(Locale.ROOT);
        int wordCount = trimmed.isEmpty() ? 0 : WHITESPACE.split(trimmed).length;

        if (GREETINGS.matcher(trimmed).find() || wordCount <= MAX_SKIP_WORDS) {
            return RecallDepth.NONE;
        }

        for (DepthRule rule : RULES) {
            if (wordCount < rule.maxWordsExclusive() && rule.pattern().matcher(trimmed).find()) {
                return rule.depth();
            }
        }
        return RecallDepth.NORMAL;
    }

    private record DepthRule(Pattern pattern, int maxWordsExclusive, RecallDepth depth) {
    }
}
