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

package me.golemcore.recall.tools;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.component.ToolComponent;
import me.golemcore.recall.domain.context.OwnerContextHolder;
import me.golemcore.recall.domain.model.OwnerContext;
import me.golemcore.recall.domain.model.ToolDefinition;
import me.golemcore.recall.domain.model.ToolResult;
import me.golemcore.recall.domain.store.SessionStateStore;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Small key-value scratch space scoped to the current session. Values are
 * injected into context every turn, so the agent keeps track of session facts
 * through compaction.
 *
 * @see me.golemcore.recall.domain.store.SessionStateStore
 */
@Component
@Slf4j
public class SessionStateTool implements ToolComponent {

    private static final String SCHEMA_TYPE = "type";
    private static final String SCHEMA_OBJECT = "object";
    private static final String SCHEMA_STRING = "string";
    private static final String SCHEMA_PROPERTIES = "properties";
    private static final String SCHEMA_DESCRIPTION = "description";
    private static final String SCHEMA_ENUM = "enum";
    private static final String SCHEMA_REQUIRED = "required";

    private static final String PARAM_OPERATION = "operation";
    private static final String PARAM_KEY = "key";
    private static final String PARAM_VALUE = "value";

    private static final String ERR_MISSING_KEY = "Missing required parameter: key";

    private final SessionStateStore sessionStateStore;

    public SessionStateTool(SessionStateStore sessionStateStore) {
        this.sessionStateStore = sessionStateStore;
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("session_state")
                .description("""
                        Key-value state for the current session (max 20 keys, 500 chars per value). \
                        Survives compaction and is shown in your context every turn.
                        Operations: get, set, delete, list.
                        """)
                .inputSchema(Map.of(
                        SCHEMA_TYPE, SCHEMA_OBJECT,
                        SCHEMA_PROPERTIES, buildProperties(),
                        SCHEMA_REQUIRED, List.of(PARAM_OPERATION)))
                .build();
    }

    private static Map<String, Object> buildProperties() {
        Map<String, Object> props = new HashMap<>();
        props.put(PARAM_OPERATION, Map.of(
                SCHEMA_TYPE, SCHEMA_STRING,
                SCHEMA_ENUM, List.of("get", "set", "delete", "list"),
                SCHEMA_DESCRIPTION, "Operation to perform"));
        props.put(PARAM_KEY, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION,
                "Key name (required for get/set/delete)"));
        props.put(PARAM_VALUE, Map.of(SCHEMA_TYPE, SCHEMA_STRING, SCHEMA_DESCRIPTION,
                "Value to store (required for set). Max 500 chars."));
        return props;
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        log.debug("[SessionState] Execute: {}", parameters);

        OwnerContext owner = OwnerContextHolder.get();
        if (owner == null) {
            return CompletableFuture.completedFuture(ToolResult.failure("No owner context available"));
        }

        try {
            Object operation = parameters.get(PARAM_OPERATION);
            if (operation == null) {
                return CompletableFuture.completedFuture(
                        ToolResult.failure("Missing required parameter: operation"));
            }

            String sessionKey = owner.sessionKey();
            ToolResult result = switch (operation.toString()) {
            case "get" -> get(sessionKey, parameters);
            case "set" -> set(sessionKey, parameters);
            case "delete" -> delete(sessionKey, parameters);
            case "list" -> list(sessionKey);
            default -> ToolResult.failure("Unknown operation: " + operation + ". Use get, set, delete, or list.");
            };
            return CompletableFuture.completedFuture(result);
        } catch (RuntimeException e) {
            log.warn("[SessionState] Error: {}", e.getMessage());
            return CompletableFuture.completedFuture(ToolResult.failure(e));
        }
    }

    private ToolResult get(String sessionKey, Map<String, Object> parameters) {
        String key = (String) parameters.get(PARAM_KEY);
        if (key == null || key.isBlank()) {
            return ToolResult.failure(ERR_MISSING_KEY);
        }
        Optional<String> value = sessionStateStore.get(sessionKey, key);
        return value.map(ToolResult::success)
                .orElseGet(() -> ToolResult.success("Key \"" + key + "\" not found."));
    }

    private ToolResult set(String sessionKey, Map<String, Object> parameters) {
        String key = (String) parameters.get(PARAM_KEY);
        if (key == null || key.isBlank()) {
            return ToolResult.failure(ERR_MISSING_KEY);
        }
        Object value = parameters.get(PARAM_VALUE);
        if (value == null) {
            return ToolResult.failure("Missing required parameter: value");
        }
        sessionStateStore.set(sessionKey, key, value.toString());
        return ToolResult.success("Set \"" + key + "\" successfully.");
    }

    private ToolResult delete(String sessionKey, Map<String, Object> parameters) {
        String key = (String) parameters.get(PARAM_KEY);
        if (key == null || key.isBlank()) {
            return ToolResult.failure(ERR_MISSING_KEY);
        }
        sessionStateStore.delete(sessionKey, key);
        return ToolResult.success("Deleted \"" + key + "\".");
    }

    private ToolResult list(String sessionKey) {
        Map<String, String> entries = sessionStateStore.list(sessionKey);
        if (entries.isEmpty()) {
            return ToolResult.success("No session state set.", entries);
        }
        String output = entries.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining("\n"));
        return ToolResult.success(output, entries);
    }
}
