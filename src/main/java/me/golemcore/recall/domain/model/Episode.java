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
import java.util.ArrayList;
import java.util.List;

/**
 * Structured summary of one finished agent run: what was asked, which tools
 * ran, which files were touched and what came out of it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Episode {

    private Instant timestamp;
    private String sessionKey;
    private String agentId;
    private String request;

    @Builder.Default
    private List<String> toolsUsed = new ArrayList<>();

    @Builder.Default
    private List<String> filesAccessed = new ArrayList<>();

    @Builder.Default
    private List<String> outcomes = new ArrayList<>();

    private boolean success;
    private String error;
    private Long durationMs;
}
