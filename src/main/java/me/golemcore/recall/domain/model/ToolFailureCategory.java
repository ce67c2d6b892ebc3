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

/**
 * Failure class assigned by the tool-error classifier.
 */
public enum ToolFailureCategory {
    RATE_LIMIT("rate_limit"),
    AUTH("auth"),
    TIMEOUT("timeout"),
    INVALID_PARAMS("invalid_params"),
    NOT_FOUND("not_found"),
    ENCODING("encoding"),
    OTHER("other");

    private final String code;

    ToolFailureCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
