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

package me.golemcore.recall.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.recall.domain.extraction.CompactionFactExtractor;
import me.golemcore.recall.domain.extraction.EpisodeSummarizer;
import me.golemcore.recall.domain.extraction.ProcedureMiner;
import me.golemcore.recall.domain.model.ConversationMessage;
import me.golemcore.recall.domain.model.ExtractionOutcome;
import me.golemcore.recall.domain.model.OwnerContext;
import me.golemcore.recall.domain.model.ToolResultMessage;
import me.golemcore.recall.domain.store.ScratchPadStore;
import me.golemcore.recall.domain.store.ToolFailureStore;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry points the agent loop calls at lifecycle events. Everything except
 * compaction is queued on the {@link BackgroundTaskSupervisor} so the turn
 * never waits on memory bookkeeping.
 *
 * <p>
 * Compaction runs inline because the messages are gone once it finishes; it
 * still never throws.
 */
@Service
@Slf4j
public class WorkingMemoryLifecycleService {

    private final CompactionFactExtractor factExtractor;
    private final EpisodeSummarizer episodeSummarizer;
    private final ProcedureMiner procedureMiner;
    private final ScratchPadStore scratchPadStore;
    private final ToolFailureStore toolFailureStore;
    private final CorrectionLearningService correctionLearningService;
    private final BackgroundTaskSupervisor supervisor;

    public WorkingMemoryLifecycleService(CompactionFactExtractor factExtractor, EpisodeSummarizer episodeSummarizer,
            ProcedureMiner procedureMiner, ScratchPadStore scratchPadStore, ToolFailureStore toolFailureStore,
            CorrectionLearningService correctionLearningService, BackgroundTaskSupervisor supervisor) {
        this.factExtractor = factExtractor;
        this.episodeSummarizer = episodeSummarizer;
        this.procedureMiner = procedureMiner;
        this.scratchPadStore = scratchPadStore;
        this.toolFailureStore = toolFailureStore;
        this.correctionLearningService = correctionLearningService;
        this.supervisor = supervisor;
    }

    /**
     * Called right before compaction discards {@code messages}: extracts facts,
     * saves successful tool outputs to the scratch pad and counts the
     * compaction so the pad becomes injectable.
     */
    public ExtractionOutcome onCompactionStart(OwnerContext owner, List<ConversationMessage> messages) {
        ExtractionOutcome outcome = factExtractor.extractAndPersist(messages, owner.sessionKey());
        for (ConversationMessage message : messages) {
            if (message instanceof ToolResultMessage result && !result.error() && result.toolName() != null) {
                scratchPadStore.capture(owner.sessionKey(), result.toolName(), result.meta(), result.text(), false);
            }
        }
        try {
            scratchPadStore.recordCompaction(owner.sessionKey());
        } catch (RuntimeException e) {
            log.warn("[Scratch] Failed to record compaction for {}: {}", owner.sessionKey(), e.getMessage());
        }
        return outcome;
    }

    /**
     * Called after every tool call. Errors feed the failure store, successes
     * the scratch pad.
     */
    public boolean onToolEnd(OwnerContext owner, String toolName, String meta, String resultText, boolean isError) {
        if (isError) {
            return supervisor.submit("tool-failure",
                    () -> toolFailureStore.recordToolFailure(owner.agentId(), toolName, resultText));
        }
        return supervisor.submit("scratch-capture",
                () -> scratchPadStore.capture(owner.sessionKey(), toolName, meta, resultText, false));
    }

    /**
     * Called when a user message arrives, with the exchange it responds to.
     */
    public boolean onUserTurn(OwnerContext owner, String userMessage, String previousAgentMessage,
            String previousUserMessage) {
        return supervisor.submit("correction-learning", () -> correctionLearningService
                .learnFromExchange(owner.agentId(), userMessage, previousAgentMessage, previousUserMessage));
    }

    /**
     * Called when a run finishes; logs the episode and mines a procedure.
     */
    public boolean onRunEnd(OwnerContext owner, List<ConversationMessage> messages, boolean success, String error,
            Long durationMs) {
        List<ConversationMessage> snapshot = List.copyOf(messages);
        boolean episodeQueued = supervisor.submit("episode", () -> episodeSummarizer.logEpisode(snapshot, success,
                error, durationMs, owner.sessionKey(), owner.agentId()));
        boolean procedureQueued = supervisor.submit("procedure",
                () -> procedureMiner.logProcedure(snapshot, success));
        return episodeQueued && procedureQueued;
    }

    /**
     * Called when the session ends normally; the scratch pad is discarded.
     */
    public void onSessionEnd(OwnerContext owner) {
        try {
            scratchPadStore.clear(owner.sessionKey());
        } catch (RuntimeException e) {
            log.warn("[Scratch] Failed to clear pad for {}: {}", owner.sessionKey(), e.getMessage());
        }
    }
}
