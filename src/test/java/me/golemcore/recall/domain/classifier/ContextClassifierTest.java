package me.golemcore.recall.domain.classifier;

import me.golemcore.recall.domain.model.ContextClassification;
import me.golemcore.recall.domain.model.ContextTag;
import me.golemcore.recall.domain.model.InjectionBlock;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextClassifierTest {

    @Test
    void shouldTreatShortGreetingAsMinimalChat() {
        ContextClassification classification = ContextClassifier.classify("hi");

        assertEquals(Set.of(ContextTag.CHAT), classification.tags());
        assertEquals(0.9, classification.chatProbability());
        assertTrue(classification.minimalContext());
        assertEquals(EnumSet.of(InjectionBlock.TASK_LEDGER, InjectionBlock.TOOL_FAILURES,
                InjectionBlock.SUBAGENT_STATUS, InjectionBlock.PROACTIVE_ALERTS),
                ContextClassifier.resolveExclusions(classification));
    }

    @Test
    void shouldTreatLongerSmallTalkAsChatWhenNoRuleMatches() {
        ContextClassification classification = ContextClassifier.classify("thanks a lot for all of that");

        assertEquals(Set.of(ContextTag.CHAT), classification.tags());
        assertEquals(0.8, classification.chatProbability());
        assertTrue(classification.minimalContext());
    }

    @Test
    void shouldAddMemoryAndProceduresForTechnicalMessages() {
        ContextClassification classification = ContextClassifier.classify("Please fix the build error in the parser");

        assertEquals(Set.of(ContextTag.TECHNICAL, ContextTag.TOOL_FAILURES, ContextTag.CORRECTIONS,
                ContextTag.MEMORY, ContextTag.PROCEDURES), classification.tags());
        assertEquals(0.1, classification.chatProbability());
        assertFalse(classification.minimalContext());
        assertTrue(ContextClassifier.resolveExclusions(classification).isEmpty());
    }

    @Test
    void shouldAlwaysIncludeCorrectionsWhenAnyRuleMatches() {
        ContextClassification classification = ContextClassifier.classify("Send the email to the team");

        assertEquals(Set.of(ContextTag.COMMUNICATION, ContextTag.TOOLS, ContextTag.CORRECTIONS),
                classification.tags());
    }

    @Test
    void shouldFallBackToBroadTagsForUnknownMessages() {
        ContextClassification classification = ContextClassifier.classify("Sounds like a plan to me");

        assertEquals(Set.of(ContextTag.MEMORY, ContextTag.TASKS, ContextTag.CORRECTIONS, ContextTag.TOOL_FAILURES),
                classification.tags());
        assertEquals(0.2, classification.chatProbability());
        assertFalse(classification.minimalContext());
        assertTrue(classification.has(ContextTag.TASKS));
    }
}
