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

package me.golemcore.recall.domain.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.model.ScratchEntry;
import me.golemcore.recall.domain.model.ScratchPadDocument;
import me.golemcore.recall.domain.service.MemoryArtifactWriter;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Per-session scratch pad of data-producing tool outputs
 * ({@code scratch/<sessionKey>.json}).
 *
 * <p>
 * Compaction destroys intermediate tool results; the pad keeps the last
 * {@code recall.scratch.max-entries} of them and re-injects them after a
 * compaction has happened. Before the first compaction the results are still
 * in the transcript, so injection returns nothing. A result already on the pad
 * is not captured twice. Each capture also rewrites
 * a markdown mirror under {@code memory/scratch/} for the external indexer.
 */
@Component
@Slf4j
public class ScratchPadStore {

    static final String DIRECTORY = "scratch";

    private static final String ARTIFACT_KIND = "scratch";

    private final JsonDocumentStore<ScratchPadDocument> documents;
    private final MemoryArtifactWriter artifactWriter;
    private final RecallProperties.ScratchProperties config;
    private final Set<String> captureTools;
    private final Clock clock;

    public ScratchPadStore(StoragePort storagePort, ObjectMapper objectMapper, MemoryArtifactWriter artifactWriter,
            RecallProperties properties, Clock clock) {
        this.documents = new JsonDocumentStore<>(storagePort, objectMapper, DIRECTORY, ScratchPadDocument.class,
                ScratchPadDocument::new, properties.getStorage().isBackupOnWrite());
        this.artifactWriter = artifactWriter;
        this.config = properties.getScratch();
        this.captureTools = Set.copyOf(config.getCaptureTools());
        this.clock = clock;
    }

    /**
     * Captures a tool result if the tool is on the allow-list and the result is
     * a non-trivial success. Never throws.
     *
     * @return true when an entry was stored
     */
    public boolean capture(String sessionKey, String toolName, String meta, String resultText, boolean isError) {
        if (!captureTools.contains(toolName) || isError) {
            return false;
        }
        if (resultText == null || resultText.length() < config.getMinOutputChars()) {
            return false;
        }

        try {
            ScratchEntry entry = ScratchEntry.builder()
                    .tool(toolName)
                    .context(meta != null && !meta.isBlank() ? meta : toolName)
                    .output(truncate(resultText, config.getMaxEntryChars()))
                    .timestamp(clock.instant())
                    .build();

            List<ScratchEntry> snapshot = documents.update(sessionKey, document -> {
                document.setSessionKey(sessionKey);
                List<ScratchEntry> entries = document.getEntries();
                if (entries.stream().anyMatch(existing -> sameContent(existing, entry))) {
                    return null;
                }
                entries.add(entry);
                int overflow = entries.size() - config.getMaxEntries();
                if (overflow > 0) {
                    entries.subList(0, overflow).clear();
                }
                return new ArrayList<>(entries);
            });
            if (snapshot == null) {
                return false;
            }
            mirror(sessionKey, snapshot);
            log.debug("[Scratch] Captured {} output for {} ({} entries)", toolName, sessionKey, snapshot.size());
            return true;
        } catch (RuntimeException e) {
            log.warn("[Scratch] Capture failed for {}: {}", sessionKey, e.getMessage());
            return false;
        }
    }

    /**
     * Counts a compaction for the session, which enables injection.
     *
     * @return the new compaction count
     */
    public int recordCompaction(String sessionKey) {
        return documents.update(sessionKey, document -> {
            document.setSessionKey(sessionKey);
            document.setCompactionCount(document.getCompactionCount() + 1);
            return document.getCompactionCount();
        });
    }

    public int getCompactionCount(String sessionKey) {
        return documents.read(sessionKey).getCompactionCount();
    }

    public List<ScratchEntry> getEntries(String sessionKey) {
        return documents.read(sessionKey).getEntries();
    }

    /**
     * Renders the pad newest-first within the character budget, or null before
     * the first compaction or when the pad is empty.
     */
    public String readScratchForInjection(String sessionKey) {
        ScratchPadDocument pad = documents.read(sessionKey);
        if (pad.getCompactionCount() == 0 || pad.getEntries().isEmpty()) {
            return null;
        }

        int budget = config.getInjectionChars();
        StringBuilder sb = new StringBuilder();
        sb.append("## 📋 Working Memory (preserved across compaction)\n");
        sb.append("These are tool outputs from earlier in this session that survived compaction.\n\n");

        List<ScratchEntry> newestFirst = new ArrayList<>(pad.getEntries());
        Collections.reverse(newestFirst);
        int used = 0;
        for (ScratchEntry entry : newestFirst) {
            if (used >= budget) {
                break;
            }
            String output = truncate(entry.getOutput(), budget - used);
            sb.append("### ").append(entry.getTool()).append(": ").append(entry.getContext()).append('\n');
            sb.append("```\n").append(output).append("\n```\n\n");
            used += output.length() + entry.getContext().length();
        }
        return sb.toString().stripTrailing();
    }

    /**
     * Drops the pad and its markdown mirror at session end.
     */
    public void clear(String sessionKey) {
        documents.delete(sessionKey);
        if (config.isMirrorMarkdown()) {
            artifactWriter.delete(ARTIFACT_KIND, mirrorFileName(sessionKey));
        }
        log.debug("[Scratch] Cleared pad for {}", sessionKey);
    }

    private void mirror(String sessionKey, List<ScratchEntry> entries) {
        if (!config.isMirrorMarkdown() || entries.isEmpty()) {
            return;
        }
        StringBuilder sb = new StringBuilder();
        sb.append("# Working Memory: Active Session\n\n");
        sb.append("Tool outputs captured during this session. Auto-indexed for recall.\n\n");
        for (ScratchEntry entry : entries) {
            sb.append("## ").append(entry.getTool()).append(": ").append(entry.getContext()).append('\n');
            sb.append("```\n").append(entry.getOutput()).append("\n```\n\n");
        }
        artifactWriter.write(ARTIFACT_KIND, mirrorFileName(sessionKey), sb.toString());
    }

    private static boolean sameContent(ScratchEntry left, ScratchEntry right) {
        return left.getTool().equals(right.getTool()) && left.getContext().equals(right.getContext())
                && left.getOutput().equals(right.getOutput());
    }

    private static String mirrorFileName(String sessionKey) {
        return JsonDocumentStore.sanitizeKey(sessionKey) + ".md";
    }

    private static String truncate(String value, int max) {
        return value.length() > max ? value.substring(0, Math.max(0, max)) : value;
    }
}
