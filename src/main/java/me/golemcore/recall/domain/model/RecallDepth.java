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

package me.golemcore.recall.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much long-term memory to pull in for a prompt, with the retrieval
 * parameters bound to each level.
 */
public enum RecallDepth {
    NONE("none", 0, 0.0, 0),
    SHALLOW("shallow", 3, 0.4, 2000),
    NORMAL("normal", 5, 0.3, 4000),
    DEEP("deep", 10, 0.2, 8000);

    private final String code;
    private final int maxResults;
    private final double minScore;
    private final int maxChars;

    RecallDepth(String code, int maxResults, double minScore, int maxChars) {
        this.code = code;
        this.maxResults = maxResults;
        this.minScore = minScore;
        this.maxChars = maxChars;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getMaxResults() {
        return maxResults;
    }

    public double getMinScore() {
        return minScore;
    }

    public int getMaxChars() {
        return maxChars;
    }
}
