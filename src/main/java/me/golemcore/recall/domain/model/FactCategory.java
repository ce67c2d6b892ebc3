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
 * Kind of fact pulled out of a transcript before compaction.
 */
public enum FactCategory {
    DECISION("decision", "## Decisions"),
    TASK("task", "## Tasks & Actions"),
    FACT("fact", "## Key Facts"),
    CORRECTION("correction", "## Corrections & Rules"),
    PREFERENCE("preference", "## Preferences"),
    URL("url", "## URLs Referenced"),
    ERROR_PATTERN("error_pattern", "## Error Patterns");

    private final String code;
    private final String heading;

    FactCategory(String code, String heading) {
        this.code = code;
        this.heading = heading;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getHeading() {
        return heading;
    }
}
