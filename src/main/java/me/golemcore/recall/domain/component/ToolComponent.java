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
package me.golemcore.recall.domain.component;

import me.golemcore.recall.domain.model.ToolDefinition;
import me.golemcore.recall.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool the agent can call to inspect or maintain its working memory. Tools
 * expose a JSON Schema definition and never throw: every store error comes
 * back as a failed {@link ToolResult}.
 */
public interface ToolComponent {

    ToolDefinition getDefinition();

    /**
     * Executes the tool for the owner bound to the calling thread.
     *
     * @param parameters
     *            the arguments the agent supplied
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    default String getToolName() {
        return getDefinition().getName();
    }
}
