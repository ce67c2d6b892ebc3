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

import lombok.Builder;
import lombok.Data;
import me.golemcore.recall.domain.exception.CapacityExceededException;
import me.golemcore.recall.domain.exception.NotFoundException;
import me.golemcore.recall.domain.exception.PersistenceException;
import me.golemcore.recall.domain.exception.ValidationException;

/**
 * What a working-memory tool hands back to the agent. Store errors never
 * escape a tool: they arrive here as {@code "Error: ..."} text tagged with the
 * {@link ErrorKind} of the exception that caused them.
 */
@Data
@Builder
public class ToolResult {

    private static final String ERROR_PREFIX = "Error: ";

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String output;
    private Object data;
    private String error;
    private ErrorKind errorKind;

    public enum ErrorKind {
        VALIDATION, NOT_FOUND, CAPACITY_EXCEEDED, PERSISTENCE, EXECUTION
    }

    public static ToolResult success(String output) {
        return success(output, null);
    }

    public static ToolResult success(String output, Object data) {
        return ToolResult.builder()
                .success(true)
                .output(output)
                .data(data)
                .build();
    }

    /**
     * Rejected call: missing or malformed parameters, unknown operation.
     */
    public static ToolResult failure(String error) {
        return failure(ErrorKind.VALIDATION, error);
    }

    public static ToolResult failure(ErrorKind kind, String error) {
        return ToolResult.builder()
                .success(false)
                .error(error)
                .errorKind(kind)
                .build();
    }

    /**
     * Converts a store exception into a failed result, keeping its kind.
     */
    public static ToolResult failure(RuntimeException e) {
        return failure(kindOf(e), ERROR_PREFIX + e.getMessage());
    }

    private static ErrorKind kindOf(RuntimeException e) {
        if (e instanceof NotFoundException) {
            return ErrorKind.NOT_FOUND;
        }
        if (e instanceof CapacityExceededException) {
            return ErrorKind.CAPACITY_EXCEEDED;
        }
        if (e instanceof PersistenceException) {
            return ErrorKind.PERSISTENCE;
        }
        if (e instanceof ValidationException || e instanceof IllegalArgumentException) {
            return ErrorKind.VALIDATION;
        }
        return ErrorKind.EXECUTION;
    }
}
