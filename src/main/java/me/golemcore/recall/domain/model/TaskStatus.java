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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Task lifecycle. {@link #DONE} and {@link #CANCELLED} are terminal.
 */
public enum TaskStatus {
    ACTIVE("active", "🔵"),
    BLOCKED("blocked", "🔴"),
    WAITING("waiting", "⏳"),
    DONE("done", "✅"),
    CANCELLED("cancelled", "❌");

    private final String code;
    private final String icon;

    TaskStatus(String code, String icon) {
        this.code = code;
        this.icon = icon;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getIcon() {
        return icon;
    }

    public boolean isTerminal() {
        return this == DONE || this == CANCELLED;
    }

    /**
     * Parses a status code, returning null for unknown input.
     */
    public static TaskStatus fromCode(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TaskStatus status : values()) {
            if (status.code.equals(normalized)) {
                return status;
            }
        }
        return null;
    }
}
