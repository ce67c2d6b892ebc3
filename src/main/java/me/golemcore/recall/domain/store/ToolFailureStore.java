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
import me.golemcore.recall.domain.classifier.ToolErrorClassifier;
import me.golemcore.recall.domain.model.ClassifiedToolError;
import me.golemcore.recall.domain.model.ToolFailure;
import me.golemcore.recall.domain.model.ToolFailureDocument;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Remembers how tools failed so the agent can avoid repeating the same
 * mistake. Stored per agent in {@code tool-failures/<agentId>.json}.
 *
 * <p>
 * A new failure folds into an existing record with the same tool and category
 * when the normalized patterns are identical or share their first
 * {@value #PATTERN_PREFIX_CHARS} characters. At capacity the records with the
 * lowest count, oldest first, are evicted in one batch.
 */
@Component
@Slf4j
public class ToolFailureStore {

    static final String DIRECTORY = "tool-failures";

    private static final int PATTERN_PREFIX_CHARS = 50;

    private static final Comparator<ToolFailure> EVICTION_ORDER = Comparator
            .comparingInt(ToolFailure::getCount)
            .thenComparing(ToolFailure::getLastSeen, Comparator.nullsFirst(Comparator.naturalOrder()));

    private static final Comparator<ToolFailure> INJECTION_ORDER = Comparator
            .comparingInt(ToolFailure::getCount).reversed()
            .thenComparing(ToolFailure::getLastSeen, Comparator.nullsLast(Comparator.reverseOrder()));

    private final JsonDocumentStore<ToolFailureDocument> documents;
    private final RecallProperties.ToolFailuresProperties config;
    private final Clock clock;

    public ToolFailureStore(StoragePort storagePort, ObjectMapper objectMapper, RecallProperties properties,
            Clock clock) {
        this.documents = new JsonDocumentStore<>(storagePort, objectMapper, DIRECTORY, ToolFailureDocument.class,
                ToolFailureDocument::new, properties.getStorage().isBackupOnWrite());
        this.config = properties.getToolFailures();
        this.clock = clock;
    }

    /**
     * Classifies the error and records it. Errors the classifier ignores
     * (too short to be meaningful) are not stored.
     *
     * @return the created or updated record
     */
    public Optional<ToolFailure> recordToolFailure(String agentId, String toolName, String errorText) {
        Optional<ClassifiedToolError> classified = ToolErrorClassifier.classify(errorText, toolName);
        if (classified.isEmpty()) {
            return Optional.empty();
        }
        ClassifiedToolError error = classified.get();
        Instant now = clock.instant();

        ToolFailure recorded = documents.update(agentId, document -> {
            List<ToolFailure> failures = document.getFailures();
            Optional<ToolFailure> existing = failures.stream()
                    .filter(failure -> matches(failure, toolName, error))
                    .findFirst();

            if (existing.isPresent()) {
                ToolFailure failure = existing.get();
                failure.setCount(failure.getCount() + 1);
                failure.setLastSeen(now);
                if (error.lesson().length() > nullSafeLength(failure.getLesson())) {
                    failure.setLesson(error.lesson());
                }
                return failure;
            }

            if (failures.size() >= config.getMaxEntries()) {
                evict(failures);
            }
            ToolFailure failure = ToolFailure.builder()
                    .toolName(toolName)
                    .pattern(error.pattern())
                    .category(error.category())
                    .count(1)
                    .lesson(error.lesson())
                    .firstSeen(now)
                    .lastSeen(now)
                    .build();
            failures.add(failure);
            return failure;
        });

        log.debug("[ToolFailures] Recorded {} [{}] count={}", toolName, recorded.getCategory().getCode(),
                recorded.getCount());
        return Optional.of(recorded);
    }

    public List<ToolFailure> getFailures(String agentId) {
        return documents.read(agentId).getFailures();
    }

    /**
     * Renders the most frequent failures grouped by tool, or null when nothing
     * has been recorded.
     */
    public String readToolFailuresForInjection(String agentId) {
        List<ToolFailure> failures = new ArrayList<>(getFailures(agentId));
        if (failures.isEmpty()) {
            return null;
        }
        failures.sort(INJECTION_ORDER);
        List<ToolFailure> top = failures.subList(0, Math.min(config.getInjectionLimit(), failures.size()));

        Map<String, List<ToolFailure>> byTool = new LinkedHashMap<>();
        for (ToolFailure failure : top) {
            byTool.computeIfAbsent(failure.getToolName(), key -> new ArrayList<>()).add(failure);
        }

        StringBuilder sb = new StringBuilder();
        sb.append("## ⚠️ Known Tool Issues (learned from past failures)\n");
        sb.append("These are tool failure patterns observed in past sessions. Avoid repeating them.\n\n");
        for (Map.Entry<String, List<ToolFailure>> group : byTool.entrySet()) {
            sb.append("### ").append(group.getKey()).append('\n');
            for (ToolFailure failure : group.getValue()) {
                sb.append("- **").append(failure.getCategory().getCode()).append("**");
                if (failure.getCount() > 1) {
                    sb.append(" (").append(failure.getCount()).append("× since ")
                            .append(formatDate(failure.getFirstSeen())).append(')');
                }
                sb.append(": ").append(failure.getLesson()).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString().stripTrailing();
    }

    private void evict(List<ToolFailure> failures) {
        List<ToolFailure> ordered = new ArrayList<>(failures);
        ordered.sort(EVICTION_ORDER);
        Set<ToolFailure> victims = Collections.newSetFromMap(new IdentityHashMap<>());
        victims.addAll(ordered.subList(0, Math.min(config.getEvictBatch(), ordered.size())));
        failures.removeIf(victims::contains);
        log.debug("[ToolFailures] Evicted {} records at capacity", victims.size());
    }

    private static boolean matches(ToolFailure failure, String toolName, ClassifiedToolError error) {
        if (!toolName.equals(failure.getToolName()) || failure.getCategory() != error.category()) {
            return false;
        }
        String pattern = failure.getPattern() != null ? failure.getPattern() : "";
        return pattern.equals(error.pattern()) || prefix(pattern).equals(prefix(error.pattern()));
    }

    private static String prefix(String pattern) {
        return pattern.length() > PATTERN_PREFIX_CHARS ? pattern.substring(0, PATTERN_PREFIX_CHARS) : pattern;
    }

    private static int nullSafeLength(String value) {
        return value != null ? value.length() : 0;
    }

    private static String formatDate(Instant instant) {
        return instant != null ? instant.toString().substring(0, 10) : "unknown";
    }
}
