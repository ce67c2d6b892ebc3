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

package me.golemcore.recall.domain.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.exception.ValidationException;
import me.golemcore.recall.domain.model.CorrectionDocument;
import me.golemcore.recall.domain.model.CorrectionEntry;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Learned corrections per agent, stored in {@code corrections/<agentId>.json}
 * with the most recent entry first.
 *
 * <p>
 * When the list grows past the cap it is re-sorted by access count, then by
 * recency, and truncated, so corrections that keep getting served outlive
 * stale ones.
 *
 * <p>
 * Search contract: a correction matches a query when at least
 * {@code recall.corrections.min-keyword-overlap} distinct query keywords
 * (default 2) appear in its rule, correction text or context. Matches are
 * scored {@code overlap + confidence}; every served match has its access count
 * incremented.
 */
@Component
@Slf4j
public class CorrectionStore {

    static final String DIRECTORY = "corrections";

    private static final int MIN_TOKEN_LENGTH = 3;
    private static final int CONTEXT_EXCERPT_CHARS = 120;

    private static final Comparator<CorrectionEntry> RETENTION_ORDER = Comparator
            .comparingInt(CorrectionEntry::getAccessCount).reversed()
            .thenComparing(CorrectionEntry::getTimestamp, Comparator.nullsLast(Comparator.reverseOrder()));

    private final JsonDocumentStore<CorrectionDocument> documents;
    private final RecallProperties.CorrectionsProperties config;
    private final Clock clock;

    public CorrectionStore(StoragePort storagePort, ObjectMapper objectMapper, RecallProperties properties,
            Clock clock) {
        this.documents = new JsonDocumentStore<>(storagePort, objectMapper, DIRECTORY, CorrectionDocument.class,
                CorrectionDocument::new, properties.getStorage().isBackupOnWrite());
        this.config = properties.getCorrections();
        this.clock = clock;
    }

    /**
     * Stores a correction at the head of the list and prunes past the cap.
     * {@code id}, {@code timestamp} and {@code accessCount} are assigned here.
     */
    public CorrectionEntry addCorrection(String agentId, CorrectionEntry draft) {
        if (draft == null || draft.getRule() == null || draft.getRule().isBlank()) {
            throw new ValidationException("Correction rule is required");
        }

        CorrectionEntry entry = CorrectionEntry.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(clock.instant())
                .context(nullToEmpty(draft.getContext()))
                .agentSaid(nullToEmpty(draft.getAgentSaid()))
                .correctionText(nullToEmpty(draft.getCorrectionText()))
                .rule(draft.getRule())
                .category(draft.getCategory())
                .confidence(draft.getConfidence())
                .accessCount(0)
                .build();

        int pruned = documents.update(agentId, document -> {
            document.getCorrections().add(0, entry);
            return prune(document.getCorrections(), config.getMaxEntries());
        });
        log.debug("[Corrections] Added correction {} for {} (pruned {})", entry.getId(), agentId, pruned);
        return entry;
    }

    public List<CorrectionEntry> getCorrections(String agentId) {
        return documents.read(agentId).getCorrections();
    }

    /**
     * Trims the store to {@code maxEntries}, returning how many entries were
     * removed.
     */
    public int pruneCorrections(String agentId, int maxEntries) {
        return documents.update(agentId, document -> prune(document.getCorrections(), maxEntries));
    }

    /**
     * Returns up to {@code recall.corrections.search-limit} corrections relevant
     * to the query, best first, and records the access on each of them.
     */
    public List<CorrectionEntry> searchCorrections(String agentId, String query) {
        Set<String> keywords = tokenize(query);
        if (keywords.size() < config.getMinKeywordOverlap()) {
            return List.of();
        }
        if (rank(getCorrections(agentId), keywords).isEmpty()) {
            return List.of();
        }

        Instant now = clock.instant();
        return documents.update(agentId, document -> {
            List<CorrectionEntry> matches = rank(document.getCorrections(), keywords);
            for (CorrectionEntry match : matches) {
                match.setAccessCount(match.getAccessCount() + 1);
                match.setLastAccessed(now);
            }
            return matches;
        });
    }

    /**
     * Builds the always-on corrections block, most recent first, within the
     * configured character budget. Returns null when there is nothing to show.
     */
    public String readCorrectionsForInjection(String agentId) {
        List<CorrectionEntry> entries = getCorrections(agentId);
        if (entries.isEmpty()) {
            return null;
        }
        return render("## Learned Corrections",
                "Rules learned from past user corrections. Follow them.", entries);
    }

    /**
     * Builds a block of corrections that match the current user message, or null
     * when none do.
     */
    public String readRelevantCorrectionsForInjection(String agentId, String query) {
        List<CorrectionEntry> matches = searchCorrections(agentId, query);
        if (matches.isEmpty()) {
            return null;
        }
        return render("## Relevant Corrections",
                "Past corrections that look related to this message.", matches);
    }

    private String render(String heading, String intro, List<CorrectionEntry> entries) {
        StringBuilder sb = new StringBuilder();
        sb.append(heading).append('\n').append(intro).append("\n\n");
        int budget = config.getInjectionChars();
        int written = 0;
        for (CorrectionEntry entry : entries) {
            String line = formatLine(entry);
            if (sb.length() + line.length() > budget) {
                break;
            }
            sb.append(line);
            written++;
        }
        // a heading with no entry under it is not worth injecting
        return written == 0 ? null : sb.toString().stripTrailing();
    }

    private String formatLine(CorrectionEntry entry) {
        String category = entry.getCategory() != null ? entry.getCategory().getCode() : "general";
        StringBuilder line = new StringBuilder();
        line.append("- [").append(category).append("] ").append(entry.getRule())
                .append(String.format(Locale.ROOT, " (confidence: %.2f)", entry.getConfidence()));
        String context = entry.getContext();
        if (context != null && !context.isBlank()) {
            String excerpt = context.length() > CONTEXT_EXCERPT_CHARS
                    ? context.substring(0, CONTEXT_EXCERPT_CHARS)
                    : context;
            line.append(" - context: ").append(excerpt.replace('\n', ' '));
        }
        return line.append('\n').toString();
    }

    private List<CorrectionEntry> rank(List<CorrectionEntry> entries, Set<String> keywords) {
        List<ScoredCorrection> scored = new ArrayList<>();
        for (CorrectionEntry entry : entries) {
            double score = score(entry, keywords);
            if (score > 0) {
                scored.add(new ScoredCorrection(entry, score));
            }
        }
        scored.sort(Comparator.comparingDouble(ScoredCorrection::score).reversed());
        return scored.stream()
                .limit(config.getSearchLimit())
                .map(ScoredCorrection::entry)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private double score(CorrectionEntry entry, Set<String> keywords) {
        Set<String> entryTokens = tokenize(String.join(" ",
                nullToEmpty(entry.getRule()), nullToEmpty(entry.getCorrectionText()),
                nullToEmpty(entry.getContext())));
        long overlap = keywords.stream().filter(entryTokens::contains).count();
        if (overlap < config.getMinKeywordOverlap()) {
            return 0.0;
        }
        return overlap + entry.getConfidence();
    }

    private static int prune(List<CorrectionEntry> corrections, int maxEntries) {
        if (corrections.size() <= maxEntries) {
            return 0;
        }
        int removed = corrections.size() - maxEntries;
        corrections.sort(RETENTION_ORDER);
        corrections.subList(maxEntries, corrections.size()).clear();
        return removed;
    }

    static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^a-z0-9_]+")) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    private record ScoredCorrection(CorrectionEntry entry, double score) {
    }
}
