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

import java.util.List;

/**
 * Working-memory context assembled for one turn.
 *
 * @param text
 *            the blocks joined by blank lines, or null when nothing applies
 * @param blocks
 *            blocks that contributed, in order
 * @param classification
 *            topic classification of the user message
 * @param recallDepth
 *            how much long-term recall the message warrants
 */
public record ContextInjection(String text, List<InjectionBlock> blocks, ContextClassification classification,
        RecallDepth recallDepth) {

    public ContextInjection {
        blocks = List.copyOf(blocks);
    }

    public boolean isEmpty() {
        return text == null;
    }
}
