package me.golemcore.recall.auto;

import me.golemcore.recall.domain.model.Trigger;
import me.golemcore.recall.domain.model.TriggerEvaluation;
import me.golemcore.recall.domain.model.TriggerPriority;
import me.golemcore.recall.domain.model.TriggerType;
import me.golemcore.recall.domain.service.ProactiveTriggerService;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ProactiveTriggerSchedulerTest {

    private ProactiveTriggerService triggerService;
    private RecallProperties properties;
    private ProactiveTriggerScheduler scheduler;

    @BeforeEach
    void setUp() {
        triggerService = mock(ProactiveTriggerService.class);
        properties = new RecallProperties();
        properties.getTriggers().setOwners(List.of("main", "helper"));
        scheduler = new ProactiveTriggerScheduler(triggerService, properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    void tickEvaluatesEveryOwner() {
        Trigger trigger = new Trigger(TriggerType.STALE_TASK, TriggerPriority.MEDIUM, "stale",
                Instant.parse("2026-03-01T10:00:00Z"));
        when(triggerService.evaluateAndPark("main")).thenReturn(new TriggerEvaluation(List.of(trigger), "alerts"));
        when(triggerService.evaluateAndPark("helper")).thenReturn(TriggerEvaluation.empty());

        assertEquals(1, scheduler.tick());
        verify(triggerService).evaluateAndPark("main");
        verify(triggerService).evaluateAndPark("helper");
    }

    @Test
    void tickSkipsWhilePreviousTickRuns() {
        AtomicInteger nested = new AtomicInteger();
        when(triggerService.evaluateAndPark(anyString())).thenAnswer(invocation -> {
            nested.set(scheduler.tick());
            return TriggerEvaluation.empty();
        });

        assertEquals(0, scheduler.tick());
        assertEquals(-1, nested.get());
    }

    @Test
    void tickSurvivesEvaluationFailure() {
        when(triggerService.evaluateAndPark("main")).thenThrow(new IllegalStateException("boom"));

        assertEquals(0, scheduler.tick());
        doReturn(TriggerEvaluation.empty()).when(triggerService).evaluateAndPark("main");
        when(triggerService.evaluateAndPark("helper")).thenReturn(TriggerEvaluation.empty());
        assertEquals(0, scheduler.tick());
        verify(triggerService, times(1)).evaluateAndPark("helper");
    }

    @Test
    void initDoesNothingWhenDisabled() {
        properties.getTriggers().setEnabled(false);

        scheduler.init();

        verifyNoInteractions(triggerService);
    }

    @Test
    void initDoesNothingWithoutOwners() {
        properties.getTriggers().setEnabled(true);
        properties.getTriggers().setOwners(List.of());

        scheduler.init();

        verifyNoInteractions(triggerService);
    }
}
