package me.golemcore.recall.domain.service;

import me.golemcore.recall.domain.exception.PersistenceException;
import me.golemcore.recall.domain.model.ContextInjection;
import me.golemcore.recall.domain.model.ContextTag;
import me.golemcore.recall.domain.model.InjectionBlock;
import me.golemcore.recall.domain.model.OwnerContext;
import me.golemcore.recall.domain.model.RecallDepth;
import me.golemcore.recall.domain.store.CorrectionStore;
import me.golemcore.recall.domain.store.ExecutionPlanStore;
import me.golemcore.recall.domain.store.ScratchPadStore;
import me.golemcore.recall.domain.store.SessionStateStore;
import me.golemcore.recall.domain.store.TaskLedgerStore;
import me.golemcore.recall.domain.store.ToolFailureStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ContextInjectionServiceTest {

    private static final OwnerContext OWNER = new OwnerContext("main", "session-1");
    private static final String TECH_MESSAGE = "Please fix the build error in the parser";

    private CorrectionStore correctionStore;
    private TaskLedgerStore taskLedgerStore;
    private ToolFailureStore toolFailureStore;
    private SessionStateStore sessionStateStore;
    private ExecutionPlanStore executionPlanStore;
    private ScratchPadStore scratchPadStore;
    private SubagentStatusService subagentStatusService;
    private ProactiveTriggerService proactiveTriggerService;
    private ContextInjectionService service;

    @BeforeEach
    void setUp() {
        correctionStore = mock(CorrectionStore.class);
        taskLedgerStore = mock(TaskLedgerStore.class);
        toolFailureStore = mock(ToolFailureStore.class);
        sessionStateStore = mock(SessionStateStore.class);
        executionPlanStore = mock(ExecutionPlanStore.class);
        scratchPadStore = mock(ScratchPadStore.class);
        subagentStatusService = mock(SubagentStatusService.class);
        proactiveTriggerService = mock(ProactiveTriggerService.class);
        service = new ContextInjectionService(correctionStore, taskLedgerStore, toolFailureStore,
                sessionStateStore, executionPlanStore, scratchPadStore, subagentStatusService,
                proactiveTriggerService);
    }

    @Test
    void shouldAssembleBlocksInFixedOrder() {
        when(correctionStore.readRelevantCorrectionsForInjection("main", TECH_MESSAGE)).thenReturn("corrections");
        when(sessionStateStore.readStateForInjection("session-1")).thenReturn("state");
        when(executionPlanStore.readPlanForInjection("session-1")).thenReturn("plan");
        when(taskLedgerStore.readTasksForInjection("main")).thenReturn("tasks");
        when(toolFailureStore.readToolFailuresForInjection("main")).thenReturn("failures");
        when(scratchPadStore.readScratchForInjection("session-1")).thenReturn("scratch");
        when(subagentStatusService.buildStatusContext("main")).thenReturn("subagents");
        when(proactiveTriggerService.consumePendingAlerts("main")).thenReturn("alerts");

        ContextInjection injection = service.buildInjection(OWNER, TECH_MESSAGE);

        assertEquals("corrections\n\nstate\n\nplan\n\ntasks\n\nfailures\n\nscratch\n\nsubagents\n\nalerts",
                injection.text());
        assertEquals(List.of(InjectionBlock.CORRECTIONS, InjectionBlock.SESSION_STATE,
                InjectionBlock.EXECUTION_PLAN, InjectionBlock.TASK_LEDGER, InjectionBlock.TOOL_FAILURES,
                InjectionBlock.SCRATCH_PAD, InjectionBlock.SUBAGENT_STATUS, InjectionBlock.PROACTIVE_ALERTS),
                injection.blocks());
        assertTrue(injection.classification().has(ContextTag.TECHNICAL));
        assertEquals(RecallDepth.NORMAL, injection.recallDepth());
        verify(correctionStore, never()).readCorrectionsForInjection(anyString());
    }

    @Test
    void shouldFallBackToAllCorrectionsWhenNoneMatch() {
        when(correctionStore.readCorrectionsForInjection("main")).thenReturn("all corrections");

        ContextInjection injection = service.buildInjection(OWNER, TECH_MESSAGE);

        assertEquals("all corrections", injection.text());
        assertEquals(List.of(InjectionBlock.CORRECTIONS), injection.blocks());
    }

    @Test
    void shouldDropOperationalBlocksForSmallTalk() {
        when(correctionStore.readCorrectionsForInjection("main")).thenReturn("corrections");
        when(taskLedgerStore.readTasksForInjection("main")).thenReturn("tasks");

        ContextInjection injection = service.buildInjection(OWNER, "hi");

        assertEquals("corrections", injection.text());
        assertEquals(RecallDepth.NONE, injection.recallDepth());
        verify(correctionStore, never()).readRelevantCorrectionsForInjection(anyString(), anyString());
        verify(taskLedgerStore, never()).readTasksForInjection(anyString());
        verify(toolFailureStore, never()).readToolFailuresForInjection(anyString());
        verify(subagentStatusService, never()).buildStatusContext(anyString());
        verify(proactiveTriggerService, never()).consumePendingAlerts(anyString());
    }

    @Test
    void shouldSkipFailingBuilders() {
        when(taskLedgerStore.readTasksForInjection("main")).thenThrow(new PersistenceException("Corrupt document"));
        when(scratchPadStore.readScratchForInjection("session-1")).thenReturn("scratch");

        ContextInjection injection = service.buildInjection(OWNER, TECH_MESSAGE);

        assertEquals("scratch", injection.text());
        assertEquals(List.of(InjectionBlock.SCRATCH_PAD), injection.blocks());
    }

    @Test
    void shouldReturnEmptyInjectionWhenNothingToSay() {
        ContextInjection injection = service.buildInjection(OWNER, TECH_MESSAGE);

        assertTrue(injection.isEmpty());
        assertNull(injection.text());
        assertTrue(injection.blocks().isEmpty());
    }
}
