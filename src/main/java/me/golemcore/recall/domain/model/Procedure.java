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
 * Reusable ordered sequence of tool calls that accomplished a request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Procedure {

    private String name;
    private String request;

    @Builder.Default
    private List<ProcedureStep> steps = new ArrayList<>();

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private Instant timestamp;
    private boolean success;
}
