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

package me.golemcore.recall.retrieval;

import me.golemcore.recall.domain.model.HybridResult;
import me.golemcore.recall.domain.model.KeywordHit;
import me.golemcore.recall.domain.model.VectorHit;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fuses vector-similarity and keyword hits for the same chunks into one ranked
 * list.
 *
 * <p>
 * Hits are unioned by chunk id. Where both sides found a chunk, the keyword
 * snippet wins when it is non-empty and the newer {@code updatedAt} is kept.
 * The three weights are normalized to sum to 1 and each chunk scores
 * {@code wv * vector + wt * text + wr * decay(updatedAt)}.
 */
@Component
public class HybridResultMerger {

    private final RecallProperties.HybridProperties config;
    private final Clock clock;

    public HybridResultMerger(RecallProperties properties, Clock clock) {
        this.config = properties.getHybrid();
        this.clock = clock;
    }

    /**
     * Merges with the configured weights at the current time.
     */
    public List<HybridResult> merge(List<VectorHit> vector, List<KeywordHit> keyword) {
        return merge(vector, keyword, config.getVectorWeight(), config.getTextWeight(), config.getRecencyWeight(),
                clock.instant());
    }

    public static List<HybridResult> merge(List<VectorHit> vector, List<KeywordHit> keyword, double vectorWeight,
            double textWeight, double recencyWeight, Instant now) {
        Map<String, Candidate> byId = new LinkedHashMap<>();
        for (VectorHit hit : vector) {
            byId.put(hit.id(), new Candidate(hit.id(), hit.path(), hit.startLine(), hit.endLine(), hit.source(),
                    hit.snippet(), hit.vectorScore(), 0.0, hit.updatedAt()));
        }
        for (KeywordHit hit : keyword) {
            Candidate existing = byId.get(hit.id());
            if (existing == null) {
                byId.put(hit.id(), new Candidate(hit.id(), hit.path(), hit.startLine(), hit.endLine(), hit.source(),
                        hit.snippet(), 0.0, hit.textScore(), hit.updatedAt()));
                continue;
            }
            existing.textScore = hit.textScore();
            if (hit.snippet() != null && !hit.snippet().isEmpty()) {
                existing.snippet = hit.snippet();
            }
            if (hit.updatedAt() != null
                    && (existing.updatedAt == null || hit.updatedAt().isAfter(existing.updatedAt))) {
                existing.updatedAt = hit.updatedAt();
            }
        }

        double total = vectorWeight + textWeight + recencyWeight;
        double normVector = total > 0 ? vectorWeight / total : 0.0;
        double normText = total > 0 ? textWeight / total : 0.0;
        double normRecency = total > 0 ? recencyWeight / total : 0.0;

        List<HybridResult> merged = new ArrayList<>(byId.size());
        for (Candidate candidate : byId.values()) {
            double relevance = normVector * candidate.vectorScore + normText * candidate.textScore;
            double recencyBoost = normRecency * RecencyDecay.decay(candidate.updatedAt, now);
            merged.add(new HybridResult(candidate.id, candidate.path, candidate.startLine, candidate.endLine,
                    relevance + recencyBoost, candidate.snippet, candidate.source, candidate.updatedAt));
        }
        merged.sort(Comparator.comparingDouble(HybridResult::score).reversed());
        return merged;
    }

    private static final class Candidate {
        private final String id;
        private final String path;
        private final int startLine;
        private final int endLine;
        private final String source;
        private String snippet;
        private final double vectorScore;
        private double textScore;
        private Instant updatedAt;

        private Candidate(String id, String path, int startLine, int endLine, String source, String snippet,
                double vectorScore, double textScore, Instant updatedAt) {
            this.id = id;
            this.path = path;
            this.startLine = startLine;
            this.endLine = endLine;
            this.source = source;
            this.snippet = snippet;
            this.vectorScore = vectorScore;
            this.textScore = textScore;
            this.updatedAt = updatedAt;
        }
    }
}
