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

package me.golemcore.recall.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.classifier.CorrectionDetector;
import me.golemcore.recall.domain.model.CorrectionEntry;
import me.golemcore.recall.domain.model.CorrectionSignal;
import me.golemcore.recall.domain.store.CorrectionStore;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Watches user turns for corrections of the previous answer and stores them as
 * learned rules.
 */
@Service
@Slf4j
public class CorrectionLearningService {

    private static final int MAX_RULE_CHARS = 300;
    private static final int MAX_EXCERPT_CHARS = 500;

    private final CorrectionStore correctionStore;

    public CorrectionLearningService(CorrectionStore correctionStore) {
        this.correctionStore = correctionStore;
    }

    /**
     * Detects and stores a correction. Best-effort: failures are logged and
     * reported as an empty result.
     *
     * @param userMessage
     *            the user's latest message
     * @param previousAgentMessage
     *            the assistant reply being corrected, may be null
     * @param previousUserMessage
     *            the user message that reply answered, may be null
     * @return the stored correction, if one was detected
     */
    public Optional<CorrectionEntry> learnFromExchange(String agentId, String userMessage,
            String previousAgentMessage, String previousUserMessage) {
        try {
            CorrectionSignal signal = CorrectionDetector.detect(userMessage, previousAgentMessage,
                    previousUserMessage);
            if (!signal.detected()) {
                return Optional.empty();
            }

            String text = userMessage.trim();
            CorrectionEntry stored = correctionStore.addCorrection(agentId, CorrectionEntry.builder()
                    .rule(truncate(text, MAX_RULE_CHARS))
                    .correctionText(truncate(text, MAX_EXCERPT_CHARS))
                    .agentSaid(truncate(previousAgentMessage, MAX_EXCERPT_CHARS))
                    .context(truncate(previousUserMessage, MAX_EXCERPT_CHARS))
                    .category(signal.category())
                    .confidence(signal.confidence())
                    .build());
            log.info("[Corrections] Learned {} correction for {} (confidence {})", signal.category().getCode(),
                    agentId, signal.confidence());
            return Optional.of(stored);
        } catch (RuntimeException e) {
            log.warn("[Corrections] Failed to learn from exchange for {}: {}", agentId, e.getMessage());
            return Optional.empty();
        }
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() > max ? value.substring(0, max) : value;
    }
}
