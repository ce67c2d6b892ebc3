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
 * Entry of the persistent task ledger. {@code parentId} is advisory and never
 * resolved.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Task {

    private String id;
    private String title;

    @Builder.Default
    private TaskStatus status = TaskStatus.ACTIVE;

    @Builder.Default
    private TaskPriority priority = TaskPriority.NORMAL;

    private String context;
    private String nextAction;
    private String blocker;
    private String waitingFor;
    private String parentId;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    private Instant dueAt;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;
}
