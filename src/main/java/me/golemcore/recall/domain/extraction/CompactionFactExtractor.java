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
import me.golemcore.recall.domain.model.ConversationMessage;
import me.golemcore.recall.domain.model.ExtractedFact;
import me.golemcore.recall.domain.model.ExtractionOutcome;
import me.golemcore.recall.domain.model.FactCategory;
import me.golemcore.recall.domain.model.MessageRole;
import me.golemcore.recall.domain.service.MemoryArtifactWriter;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls decisions, tasks, corrections and other durable facts out of messages
 * that compaction is about to destroy, and writes them to
 * {@code memory/compaction-facts/} for indexing.
 *
 * <p>
 * Pure regex heuristics, no model calls: this runs inline with compaction and
 * has to be fast. Each batch gets its own file, never appended.
 */
@Component
@Slf4j
public class CompactionFactExtractor {

    static final String ARTIFACT_KIND = "compaction-facts";

    private static final int MIN_TEXT_LENGTH = 15;
    private static final int MIN_FACT_LENGTH = 8;
    private static final int MAX_FACT_LENGTH = 500;
    private static final int PATTERN_DEDUP_PREFIX = 80;
    private static final int BATCH_DEDUP_PREFIX = 100;
    private static final int SESSION_SUFFIX_CHARS = 30;

    // Millisecond precision keeps back-to-back compactions in separate files.
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter
            .ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS", Locale.ROOT)
            .withZone(ZoneOffset.UTC);

    private static final List<FactCategory> RENDER_ORDER = List.of(
            FactCategory.DECISION, FactCategory.CORRECTION, FactCategory.PREFERENCE, FactCategory.TASK,
            FactCategory.FACT, FactCategory.ERROR_PATTERN, FactCategory.URL);

    private static final List<Pattern> DECISION_PATTERNS = List.of(
            ci("(?:let'?s|we(?:'ll| will| should)|I(?:'ll| will)|going to|decided to|decision:?)\\s+(.{10,200})"),
            ci("(?:the plan is|approach:?|strategy:?)\\s+(.{10,200})"),
            ci("(?:agreed|confirmed|approved|settled on)\\s+(.{10,200})"));

    private static final List<Pattern> TASK_PATTERNS = List.of(
            ci("(?:TODO|TASK|ACTION):?\\s+(.{10,200})"),
            ci("(?:need to|must|should|have to|going to)\\s+(.{10,200})"),
            ci("(?:done|completed|finished|shipped|deployed|fixed|resolved):?\\s+(.{10,200})"),
            ci("(?:created|set up|configured|installed|built|implemented)\\s+(.{10,200})"));

    private static final List<Pattern> FACT_PATTERNS = List.of(
            ci("(?:the (?:password|key|token|secret|api.?key|credential) (?:is|for))\\s+(.{5,200})"),
            ci("(?:IP|address|port|host|endpoint|URL|path):?\\s*(\\S{5,200})"),
            ci("(?:version|v)\\s*(\\d+\\.\\d+(?:\\.\\d+)?(?:[-+].+)?)"),
            ci("(?:account|email|username|login):?\\s*(\\S{5,200})"),
            Pattern.compile("(\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}(?::\\d+)?)"));

    private static final List<Pattern> CORRECTION_PATTERNS = List.of(
            ci("(?:no,? (?:that'?s|it'?s)|actually|wrong|incorrect|not right|don'?t)\\s+(.{10,200})"),
            ci("(?:I (?:meant|mean)|what I (?:said|want)|correct(?:ion)?:?)\\s+(.{10,200})"),
            ci("(?:stop|never|always|remember to|don'?t forget)\\s+(.{10,200})"));

    private static final List<Pattern> PREFERENCE_PATTERNS = List.of(
            ci("(?:I (?:prefer|like|want|need)|(?:please|always) (?:use|do|keep))\\s+(.{10,200})"),
            ci("(?:from now on|going forward|in (?:the )?future)\\s+(.{10,200})"));

    private static final List<Pattern> ERROR_PATTERNS = List.of(
            ci("(?:error|failed|failure|exception|crashed|broke|broken):?\\s+(.{10,300})"),
            ci("(?:429|rate.?limit|quota|exceeded|timeout|timed? out)\\s*(.{0,200})"),
            ci("(?:fixed by|solution was|workaround:?|resolved by)\\s+(.{10,200})"));

    private static final Pattern URL_PATTERN = Pattern.compile("https?://[^\\s<>\"{}|\\\\^`\\[\\]]{10,500}");

    private final MemoryArtifactWriter artifactWriter;
    private final Clock clock;

    public CompactionFactExtractor(MemoryArtifactWriter artifactWriter, Clock clock) {
        this.artifactWriter = artifactWriter;
        this.clock = clock;
    }

    /**
     * Extracts facts from the transcript, deduplicated across the batch by
     * category and lowercased content prefix. Decisions, corrections and
     * preferences only come from user and assistant text; error patterns only
     * from assistant and tool text.
     */
    public List<ExtractedFact> extractFacts(List<ConversationMessage> messages) {
        List<ExtractedFact> all = new ArrayList<>();
        int total = Math.max(1, messages.size());

        for (int i = 0; i < messages.size(); i++) {
            ConversationMessage message = messages.get(i);
            String text = message.text();
            if (text == null || text.length() < MIN_TEXT_LENGTH) {
                continue;
            }
            MessageRole role = message.role();
            double position = (double) i / total;

            if (role == MessageRole.USER || role == MessageRole.ASSISTANT) {
                all.addAll(match(text, DECISION_PATTERNS, FactCategory.DECISION, role, position));
                all.addAll(match(text, CORRECTION_PATTERNS, FactCategory.CORRECTION, role, position));
                all.addAll(match(text, PREFERENCE_PATTERNS, FactCategory.PREFERENCE, role, position));
            }
            all.addAll(match(text, TASK_PATTERNS, FactCategory.TASK, role, position));
            all.addAll(match(text, FACT_PATTERNS, FactCategory.FACT, role, position));
            all.addAll(matchUrls(text, role, position));
            if (role == MessageRole.TOOL || role == MessageRole.ASSISTANT) {
                all.addAll(match(text, ERROR_PATTERNS, FactCategory.ERROR_PATTERN, role, position));
            }
        }

        Map<String, ExtractedFact> deduped = new LinkedHashMap<>();
        for (ExtractedFact fact : all) {
            String key = fact.category().getCode() + ":" + prefix(fact.content(), BATCH_DEDUP_PREFIX);
            deduped.putIfAbsent(key, fact);
        }
        return new ArrayList<>(deduped.values());
    }

    /**
     * Extracts facts and writes them to a new markdown file. Never throws.
     */
    public ExtractionOutcome extractAndPersist(List<ConversationMessage> messages, String sessionKey) {
        try {
            List<ExtractedFact> facts = extractFacts(messages);
            if (facts.isEmpty()) {
                log.debug("[CompactionFacts] No facts extracted, skipping write");
                return ExtractionOutcome.notLogged();
            }

            Instant now = clock.instant();
            String fileName = fileName(now, sessionKey);
            String path = artifactWriter.write(ARTIFACT_KIND, fileName,
                    render(facts, now, sessionKey, messages.size()));
            log.info("[CompactionFacts] Extracted {} facts from {} messages into {}", facts.size(),
                    messages.size(), fileName);
            return ExtractionOutcome.logged(path, facts.size());
        } catch (RuntimeException e) {
            log.warn("[CompactionFacts] Extraction failed: {}", e.getMessage());
            return ExtractionOutcome.notLogged();
        }
    }

    private String render(List<ExtractedFact> facts, Instant extractedAt, String sessionKey, int messageCount) {
        Map<FactCategory, List<ExtractedFact>> groups = new EnumMap<>(FactCategory.class);
        for (ExtractedFact fact : facts) {
            groups.computeIfAbsent(fact.category(), key -> new ArrayList<>()).add(fact);
        }

        StringBuilder sb = new StringBuilder();
        sb.append("# Compaction Facts: ").append(extractedAt.toString(), 0, 10).append("\n\n");
        sb.append("Extracted at: ").append(extractedAt).append('\n');
        if (sessionKey != null && !sessionKey.isBlank()) {
            sb.append("Session: ").append(sessionKey).append('\n');
        }
        sb.append("Messages processed: ").append(messageCount).append('\n');
        sb.append("Facts extracted: ").append(facts.size()).append("\n\n");

        for (FactCategory category : RENDER_ORDER) {
            List<ExtractedFact> group = groups.get(category);
            if (group == null) {
                continue;
            }
            sb.append(category.getHeading()).append("\n\n");
            for (ExtractedFact fact : group) {
                sb.append("- ").append(fact.content()).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    static String fileName(Instant timestamp, String sessionKey) {
        StringBuilder name = new StringBuilder(FILE_STAMP.format(timestamp));
        if (sessionKey != null && !sessionKey.isBlank()) {
            String safe = sessionKey.replaceAll("[^a-zA-Z0-9-]", "_");
            name.append('-').append(safe, 0, Math.min(SESSION_SUFFIX_CHARS, safe.length()));
        }
        return name.append(".md").toString();
    }

    private static List<ExtractedFact> match(String text, List<Pattern> patterns, FactCategory category,
            MessageRole source, double position) {
        List<ExtractedFact> facts = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String raw = matcher.groupCount() >= 1 && matcher.group(1) != null ? matcher.group(1) : matcher.group();
                String content = raw.trim();
                if (content.length() < MIN_FACT_LENGTH || content.length() > MAX_FACT_LENGTH) {
                    continue;
                }
                if (seen.add(prefix(content, PATTERN_DEDUP_PREFIX))) {
                    facts.add(new ExtractedFact(category, content, source, position));
                }
            }
        }
        return facts;
    }

    private static List<ExtractedFact> matchUrls(String text, MessageRole source, double position) {
        List<ExtractedFact> facts = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Matcher matcher = URL_PATTERN.matcher(text);
        while (matcher.find()) {
            String url = matcher.group();
            if (seen.add(url.toLowerCase(Locale.ROOT))) {
                facts.add(new ExtractedFact(FactCategory.URL, url, source, position));
            }
        }
        return facts;
    }

    private static String prefix(String content, int length) {
        String lower = content.toLowerCase(Locale.ROOT);
        return lower.length() > length ? lower.substring(0, length) : lower;
    }

    private static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }
}
