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

import java.time.Instant;
import java.util.List;

/**
 * Assistant reply, optionally carrying tool invocations.
 */
public record AssistantMessage(String text, List<ToolUse> toolUses, Instant timestamp)
        implements ConversationMessage {

    public AssistantMessage {
        text = text != null ? text : "";
        toolUses = toolUses != null ? List.copyOf(toolUses) : List.of();
    }

    public static AssistantMessage of(String text) {
        return new AssistantMessage(text, List.of(), null);
    }

    public static AssistantMessage withTools(String text, ToolUse... toolUses) {
        return new AssistantMessage(text, List.of(toolUses), null);
    }

    @Override
    public MessageRole role() {
        return MessageRole.ASSISTANT;
    }
}
