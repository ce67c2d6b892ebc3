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
import me.golemcore.recall.domain.component.ToolComponent;
import me.golemcore.recall.domain.context.OwnerContextHolder;
import me.golemcore.recall.domain.model.OwnerContext;
import me.golemcore.recall.domain.model.ToolDefinition;
import me.golemcore.recall.domain.model.ToolResult;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point for the agent loop's calls into the working-memory tools.
 *
 * <p>
 * Binds the caller's {@link OwnerContext} to the executing thread for the
 * duration of the call, so each tool resolves its store keys without extra
 * parameters, and always clears it afterwards.
 */
@Service
@Slf4j
public class ToolCallService {

    private static final long TOOL_TIMEOUT_SECONDS = 30;

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();

    public ToolCallService(List<ToolComponent> toolComponents) {
        for (ToolComponent tool : toolComponents) {
            tools.put(tool.getToolName(), tool);
        }
        log.info("[Tools] Registered working-memory tools: {}", tools.keySet());
    }

    public List<ToolDefinition> getDefinitions() {
        return tools.values().stream().map(ToolComponent::getDefinition).toList();
    }

    public ToolResult execute(OwnerContext owner, String toolName, Map<String, Object> arguments) {
        ToolComponent tool = tools.get(toolName);
        if (tool == null) {
            return ToolResult.failure("Unknown tool: " + toolName + ". Available tools: "
                    + String.join(", ", tools.keySet()));
        }

        OwnerContextHolder.set(owner);
        try {
            return tool.execute(arguments != null ? arguments : Map.of())
                    .get(TOOL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolResult.ErrorKind.EXECUTION, "Tool execution interrupted: " + toolName);
        } catch (TimeoutException e) {
            log.warn("[Tools] {} timed out after {}s", toolName, TOOL_TIMEOUT_SECONDS);
            return ToolResult.failure(ToolResult.ErrorKind.EXECUTION,
                    "Tool execution timed out after " + TOOL_TIMEOUT_SECONDS + "s: " + toolName);
        } catch (ExecutionException e) {
            log.warn("[Tools] {} failed", toolName, e.getCause());
            return ToolResult.failure(ToolResult.ErrorKind.EXECUTION, "Tool execution failed: " + toolName);
        } finally {
            OwnerContextHolder.clear();
        }
    }
}
