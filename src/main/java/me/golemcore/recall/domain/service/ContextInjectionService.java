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
import me.golemcore.recall.domain.classifier.ContextClassifier;
import me.golemcore.recall.domain.classifier.RecallDepthClassifier;
import me.golemcore.recall.domain.model.ContextClassification;
import me.golemcore.recall.domain.model.ContextInjection;
import me.golemcore.recall.domain.model.InjectionBlock;
import me.golemcore.recall.domain.model.OwnerContext;
import me.golemcore.recall.domain.model.RecallDepth;
import me.golemcore.recall.domain.store.CorrectionStore;
import me.golemcore.recall.domain.store.ExecutionPlanStore;
import me.golemcore.recall.domain.store.ScratchPadStore;
import me.golemcore.recall.domain.store.SessionStateStore;
import me.golemcore.recall.domain.store.TaskLedgerStore;
import me.golemcore.recall.domain.store.ToolFailureStore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Assembles the working-memory blocks injected ahead of a turn.
 *
 * <p>
 * The user message is classified first; small talk drops the task, failure,
 * sub-agent and alert blocks. Corrections are always considered: the ones
 * matching the message when there are any, otherwise the learned list. A
 * builder that fails is skipped with a warning so one broken store never
 * blanks the whole context.
 */
@Service
@Slf4j
public class ContextInjectionService {

    private static final String BLOCK_SEPARATOR = "\n\n";

    private final CorrectionStore correctionStore;
    private final TaskLedgerStore taskLedgerStore;
    private final ToolFailureStore toolFailureStore;
    private final SessionStateStore sessionStateStore;
    private final ExecutionPlanStore executionPlanStore;
    private final ScratchPadStore scratchPadStore;
    private final SubagentStatusService subagentStatusService;
    private final ProactiveTriggerService proactiveTriggerService;

    public ContextInjectionService(CorrectionStore correctionStore, TaskLedgerStore taskLedgerStore,
            ToolFailureStore toolFailureStore, SessionStateStore sessionStateStore,
            ExecutionPlanStore executionPlanStore, ScratchPadStore scratchPadStore,
            SubagentStatusService subagentStatusService, ProactiveTriggerService proactiveTriggerService) {
        this.correctionStore = correctionStore;
        this.taskLedgerStore = taskLedgerStore;
        this.toolFailureStore = toolFailureStore;
        this.sessionStateStore = sessionStateStore;
        this.executionPlanStore = executionPlanStore;
        this.scratchPadStore = scratchPadStore;
        this.subagentStatusService = subagentStatusService;
        this.proactiveTriggerService = proactiveTriggerService;
    }

    public ContextInjection buildInjection(OwnerContext owner, String userMessage) {
        ContextClassification classification = ContextClassifier.classify(userMessage);
        RecallDepth depth = RecallDepthClassifier.classify(userMessage);
        Set<InjectionBlock> excluded = ContextClassifier.resolveExclusions(classification);
        String agentId = owner.agentId();
        String sessionKey = owner.sessionKey();

        List<String> parts = new ArrayList<>();
        List<InjectionBlock> included = new ArrayList<>();

        add(parts, included, excluded, InjectionBlock.CORRECTIONS, () -> {
            String relevant = classification.minimalContext() ? null
                    : correctionStore.readRelevantCorrectionsForInjection(agentId, userMessage);
            return relevant != null ? relevant : correctionStore.readCorrectionsForInjection(agentId);
        });
        add(parts, included, excluded, InjectionBlock.SESSION_STATE,
                () -> sessionStateStore.readStateForInjection(sessionKey));
        add(parts, included, excluded, InjectionBlock.EXECUTION_PLAN,
                () -> executionPlanStore.readPlanForInjection(sessionKey));
        add(parts, included, excluded, InjectionBlock.TASK_LEDGER,
                () -> taskLedgerStore.readTasksForInjection(agentId));
        add(parts, included, excluded, InjectionBlock.TOOL_FAILURES,
                () -> toolFailureStore.readToolFailuresForInjection(agentId));
        add(parts, included, excluded, InjectionBlock.SCRATCH_PAD,
                () -> scratchPadStore.readScratchForInjection(sessionKey));
        add(parts, included, excluded, InjectionBlock.SUBAGENT_STATUS,
                () -> subagentStatusService.buildStatusContext(agentId));
        add(parts, included, excluded, InjectionBlock.PROACTIVE_ALERTS,
                () -> proactiveTriggerService.consumePendingAlerts(agentId));

        String text = parts.isEmpty() ? null : String.join(BLOCK_SEPARATOR, parts);
        log.debug("[Injection] {} blocks for {}/{} (tags={}, depth={})", included.size(), agentId, sessionKey,
                classification.tags(), depth.getCode());
        return new ContextInjection(text, included, classification, depth);
    }

    private void add(List<String> parts, List<InjectionBlock> included, Set<InjectionBlock> excluded,
            InjectionBlock block, Supplier<String> builder) {
        if (excluded.contains(block)) {
            return;
        }
        try {
            String text = builder.get();
            if (text != null && !text.isBlank()) {
                parts.add(text);
                included.add(block);
            }
        } catch (RuntimeException e) {
            log.warn("[Injection] Skipping {} block: {}", block, e.getMessage());
        }
    }
}
