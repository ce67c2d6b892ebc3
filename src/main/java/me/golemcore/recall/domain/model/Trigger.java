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
 * A condition detected by the proactive evaluator that the agent may want to
 * act on.
 *
 * <p>
 * {@code subject} names what the trigger is about (a task, a run, a file) and
 * stays the same while the condition persists, unlike the message, which may
 * carry elapsed hours or minutes. Cooldown bookkeeping keys on the subject.
 */
public record Trigger(TriggerType type, TriggerPriority priority, String subject, String message,
        Instant detectedAt) {

    private static final int KEY_SUBJECT_CHARS = 80;

    /**
     * Trigger whose message is itself stable and doubles as the subject.
     */
    public Trigger(TriggerType type, TriggerPriority priority, String message, Instant detectedAt) {
        this(type, priority, message, message, detectedAt);
    }

    /**
     * Dedup key used for cooldown bookkeeping.
     */
    public String dedupKey() {
        String head = subject.length() > KEY_SUBJECT_CHARS ? subject.substring(0, KEY_SUBJECT_CHARS) : subject;
        return type.getCode() + ":" + head;
    }
}
