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

package me.golemcore.recall.domain.extraction;

import me.golemcore.recall.domain.model.ConversationMessage;
import me.golemcore.recall.domain.model.MessageRole;

import java.util.List;

/**
 * Small lookups shared by the extraction pipelines.
 */
final class Transcripts {

    private Transcripts() {
    }

    /**
     * Text of the last user message, which is the one that triggered the run.
     */
    static String lastUserRequest(List<ConversationMessage> messages, int maxChars, String fallback) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            ConversationMessage message = messages.get(i);
            if (message.role() == MessageRole.USER) {
                return truncate(message.text(), maxChars);
            }
        }
        return fallback;
    }

    static String truncate(String value, int maxChars) {
        return value.length() > maxChars ? value.substring(0, maxChars) : value;
    }
}
