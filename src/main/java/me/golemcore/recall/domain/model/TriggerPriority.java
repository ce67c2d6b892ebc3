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
 * Alert priority, declared from most to least urgent.
 */
public enum TriggerPriority {
    HIGH("high", "🔴"), MEDIUM("medium", "🟡"), LOW("low", "🟢");

    private final String code;
    private final String icon;

    TriggerPriority(String code, String icon) {
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
}
