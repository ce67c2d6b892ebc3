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

/**
 * Output of a tool call. {@code meta} is a short human description of the call
 * (query, path) when the agent loop supplies one.
 */
public record ToolResultMessage(String toolCallId, String toolName, String text, boolean error, String meta,
        Instant timestamp) implements ConversationMessage {

    public ToolResultMessage {
        text = text != null ? text : "";
    }

    public static ToolResultMessage success(String toolCallId, String toolName, String text) {
        return new ToolResultMessage(toolCallId, toolName, text, false, null, null);
    }

    public static ToolResultMessage failure(String toolCallId, String toolName, String text) {
        return new ToolResultMessage(toolCallId, toolName, text, true, null, null);
    }

    @Override
    public MessageRole role() {
        return MessageRole.TOOL;
    }
}
