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

/**
 * Result of a best-effort extraction pipeline. A pipeline that failed or had
 * nothing to persist reports {@code logged == false} instead of throwing.
 *
 * @param logged
 *            whether an artifact was written
 * @param filePath
 *            workspace-relative path of the artifact, or null
 * @param itemCount
 *            number of facts, outcomes or steps captured
 */
public record ExtractionOutcome(boolean logged, String filePath, int itemCount) {

    public static ExtractionOutcome notLogged() {
        return new ExtractionOutcome(false, null, 0);
    }

    public static ExtractionOutcome logged(String filePath, int itemCount) {
        return new ExtractionOutcome(true, filePath, itemCount);
    }
}
