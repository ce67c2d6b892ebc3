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

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for the full-text side of hybrid search.
 */
public final class KeywordScoring {

    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9_]+");
    private static final double NON_FINITE_RANK = 999.0;

    private KeywordScoring() {
    }

    /**
     * Builds an FTS match expression that requires every alphanumeric token of
     * the raw query: {@code "a" AND "b"}. Returns null when the query has no
     * tokens.
     */
    public static String buildFtsQuery(String raw) {
        if (raw == null) {
            return null;
        }
        List<String> quoted = new ArrayList<>();
        Matcher matcher = TOKEN.matcher(raw);
        while (matcher.find()) {
            quoted.add("\"" + matcher.group() + "\"");
        }
        return quoted.isEmpty() ? null : String.join(" AND ", quoted);
    }

    /**
     * Maps a BM25 rank (lower is better) to a score in {@code (0, 1]}.
     * Non-finite ranks sink to the bottom instead of failing the merge.
     */
    public static double bm25RankToScore(double rank) {
        double normalized = Double.isFinite(rank) ? Math.max(0.0, rank) : NON_FINITE_RANK;
        return 1.0 / (1.0 + normalized);
    }
}
