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

import me.golemcore.recall.domain.model.ContextClassification;
import me.golemcore.recall.domain.model.ContextTag;
import me.golemcore.recall.domain.model.InjectionBlock;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static me.golemcore.recall.domain.model.ContextTag.CHAT;
import static me.golemcore.recall.domain.model.ContextTag.COMMUNICATION;
import static me.golemcore.recall.domain.model.ContextTag.CORRECTIONS;
import static me.golemcore.recall.domain.model.ContextTag.EPISODES;
import static me.golemcore.recall.domain.model.ContextTag.FILES;
import static me.golemcore.recall.domain.model.ContextTag.MEMORY;
import static me.golemcore.recall.domain.model.ContextTag.PROCEDURES;
import static me.golemcore.recall.domain.model.ContextTag.RESEARCH;
import static me.golemcore.recall.domain.model.ContextTag.SCHEDULING;
import static me.golemcore.recall.domain.model.ContextTag.SUBAGENTS;
import static me.golemcore.recall.domain.model.ContextTag.SYSTEM;
import static me.golemcore.recall.domain.model.ContextTag.TASKS;
import static me.golemcore.recall.domain.model.ContextTag.TECHNICAL;
import static me.golemcore.recall.domain.model.ContextTag.TOOLS;
import static me.golemcore.recall.domain.model.ContextTag.TOOL_FAILURES;

/**
 * Maps an incoming message to the context tags that decide which injections
 * the orchestrator includes.
 *
 * <p>
 * Every rule in the table is evaluated and the tags of all matching rules are
 * merged. Missing context hurts more than extra context, so a message that
 * matches nothing and is not small talk gets a broad fallback set.
 */
public final class ContextClassifier {

    private static final int SHORT_MESSAGE_LENGTH = 10;

    private static final Set<ContextTag> FALLBACK_TAGS = EnumSet.of(MEMORY, TASKS, CORRECTIONS, TOOL_FAILURES);

    private static final List<TagRule> RULES = List.of(
            // tool specific
            rule("\\b(?:camera|snapshot|alert|motion|ptz)\\b", TOOLS, TECHNICAL),
            rule("\\b(?:tts|voice|speak|audio)\\b", TOOLS, TECHNICAL),
            rule("\\b(?:browser|headless|playwright)\\b", TOOLS, TECHNICAL),
            rule("\\b(?:drive|mount|share)\\b", TOOLS, FILES),
            rule("\\b(?:excel|xlsx|csv|spreadsheet|pandas)\\b", TOOLS, FILES),
            rule("\\b(?:pdf|docx?|word|powerpoint|pptx)\\b", TOOLS, FILES),
            rule("\\b(?:conda|venv|pip install|python.*env)\\b", TOOLS, TECHNICAL),
            rule("\\b(?:service|daemon|process.*manager)\\b", TOOLS, SYSTEM),

            // task and work
            rule("\\b(?:task|todo|backlog|priority|deadline|goal)\\b", TASKS),
            rule("\\b(?:what.*(?:working|doing)|status|progress|update)\\b", TASKS, SUBAGENTS, EPISODES),
            rule("\\b(?:remember|recall|last.*time|yesterday|earlier|before)\\b", MEMORY, EPISODES),
            rule("\\b(?:how.*(?:did|do)|procedure|steps|workflow)\\b", PROCEDURES, EPISODES),

            // research
            rule("\\b(?:search|research|find|look.*up|google|browse)\\b", RESEARCH, TOOL_FAILURES),
            rule("\\b(?:lead|prospect|brand|competitor|market)\\b", RESEARCH, MEMORY),
            rule("\\b(?:web_search|web_fetch|scrape|crawl)\\b", RESEARCH, TOOLS, TOOL_FAILURES),

            // communication
            rule("\\b(?:email|gmail|draft|send|outreach|message)\\b", COMMUNICATION, TOOLS),
            rule("\\b(?:whatsapp|telegram|discord|signal|slack)\\b", COMMUNICATION),

            // files
            rule("\\b(?:file|folder|directory|read|write|edit|create|delete|rename)\\b", FILES),
            rule("\\b(?:git|commit|push|pull|branch|merge)\\b", FILES, TECHNICAL),

            // scheduling
            rule("\\b(?:cron|schedule|reminder|alarm|timer|heartbeat)\\b", SCHEDULING, SYSTEM),
            rule("\\b(?:calendar|event|meeting|appointment)\\b", SCHEDULING, TOOLS),

            // system
            rule("\\b(?:gateway|config|restart|update|install|npm)\\b", SYSTEM, TOOLS),
            rule("\\b(?:model|llm|provider|ollama)\\b", SYSTEM),
            rule("\\b(?:sub.*agent|spawn|worker|parallel)\\b", SUBAGENTS),

            // technical
            rule("\\b(?:code|script|function|debug|error|fix|build|compile)\\b", TECHNICAL, TOOL_FAILURES),
            rule("\\b(?:api|endpoint|request|response|json|http)\\b", TECHNICAL, TOOLS),

            // corrections and learning
            rule("\\b(?:wrong|incorrect|no,?\\s*(?:that|it)|actually|don'?t)\\b", CORRECTIONS),
            rule("\\b(?:always|never|remember|from now on|going forward)\\b", CORRECTIONS, MEMORY));

    private static final List<Pattern> CHAT_PATTERNS = List.of(
            Pattern.compile("^(?:hi|hey|hello|yo|sup|morning|evening|night|gm|gn)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(?:ok|okay|sure|yeah|yep|nope|no|yes|thanks|thank you|cool|nice|great|good|perfect"
                    + "|awesome)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(?:how are you|what'?s up|how'?s it going)\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^(?:lol|haha|😂|👍|❤️|🙌)"));

    private ContextClassifier() {
    }

    public static ContextClassification classify(String message) {
        String trimmed = message == null ? "" : message.trim();

        if (trimmed.length() < SHORT_MESSAGE_LENGTH && isChat(trimmed)) {
            return new ContextClassification(EnumSet.of(CHAT), 0.9, true);
        }

        Set<ContextTag> tags = EnumSet.noneOf(ContextTag.class);
        for (TagRule rule : RULES) {
            if (rule.pattern().matcher(trimmed).find()) {
                tags.addAll(rule.tags());
            }
        }

        if (tags.isEmpty()) {
            if (isChat(trimmed)) {
                return new ContextClassification(EnumSet.of(CHAT), 0.8, true);
            }
            return new ContextClassification(FALLBACK_TAGS, 0.2, false);
        }

        tags.add(CORRECTIONS);
        if (tags.contains(RESEARCH) || tags.contains(TECHNICAL)) {
            tags.add(MEMORY);
            tags.add(PROCEDURES);
        }
        return new ContextClassification(tags, 0.1, false);
    }

    /**
     * Injection blocks the orchestrator may drop for this classification. Only
     * pure small talk sheds anything; corrections are always kept.
     */
    public static Set<InjectionBlock> resolveExclusions(ContextClassification classification) {
        if (!classification.minimalContext()) {
            return EnumSet.noneOf(InjectionBlock.class);
        }
        return EnumSet.of(InjectionBlock.TASK_LEDGER, InjectionBlock.TOOL_FAILURES,
                InjectionBlock.SUBAGENT_STATUS, InjectionBlock.PROACTIVE_ALERTS);
    }

    private static boolean isChat(String text) {
        return CHAT_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(text).find());
    }

    private static TagRule rule(String regex, ContextTag... tags) {
        return new TagRule(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), EnumSet.copyOf(List.of(tags)));
    }

    private record TagRule(Pattern pattern, Set<ContextTag> tags) {
    }
}
