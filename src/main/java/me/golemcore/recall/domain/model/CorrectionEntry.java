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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A learned correction. {@code accessCount} grows every time the entry is
 * served from a search, which protects it from capacity pruning.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorrectionEntry {

    private String id;
    private Instant timestamp;
    private String context;
    private String agentSaid;
    private String correctionText;
    private String rule;
    private CorrectionCategory category;
    private double confidence;
    private int accessCount;
    private Instant lastAccessed;
}
