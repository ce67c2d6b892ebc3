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

import java.util.Set;

/**
 * Tags for a message plus how likely it is to be small talk.
 *
 * @param tags
 *            union of the tags of every rule that fired
 * @param chatProbability
 *            confidence in [0, 1] that the message is plain chat
 * @param minimalContext
 *            whether heavy injections can be skipped
 */
public record ContextClassification(Set<ContextTag> tags, double chatProbability, boolean minimalContext) {

    public ContextClassification {
        tags = Set.copyOf(tags);
    }

    public boolean has(ContextTag tag) {
        return tags.contains(tag);
    }
}
