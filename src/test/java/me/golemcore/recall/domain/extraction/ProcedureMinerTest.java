package me.golemcore.recall.domain.extraction;

import me.golemcore.recall.domain.model.AssistantMessage;
import me.golemcore.recall.domain.model.ConversationMessage;
import me.golemcore.recall.domain.model.ExtractionOutcome;
import me.golemcore.recall.domain.model.Procedure;
import me.golemcore.recall.domain.model.ProcedureStep;
import me.golemcore.recall.domain.model.ToolResultMessage;
import me.golemcore.recall.domain.model.ToolUse;
import me.golemcore.recall.domain.model.UserMessage;
import me.golemcore.recall.domain.service.MemoryArtifactWriter;
import me.golemcore.recall.infrastructure.config.RecallProperties;
import me.golemcore.recall.testsupport.TestStores;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcedureMinerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @TempDir
    Path workspaceDir;

    private ProcedureMiner miner;

    @BeforeEach
    void setUp() {
        MemoryArtifactWriter writer = new MemoryArtifactWriter(TestStores.storage(workspaceDir),
                new RecallProperties());
        miner = new ProcedureMiner(writer, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldPairToolCallsWithResults() {
        List<ProcedureStep> steps = miner.extractSteps(deployRun());

        assertEquals(3, steps.size());
        assertEquals("exec: npm run build", steps.get(0).getAction());
        assertEquals(2, steps.get(1).getOrder());
        assertEquals("web_fetch: https://staging.example.com", steps.get(2).getAction());
        assertEquals("30", steps.get(2).getKeyParams().get("timeout"));
        assertFalse(steps.get(2).isSuccess());
    }

    @Test
    void shouldFallBackToResultToolNameForOrphanResults() {
        List<ProcedureStep> steps = miner.extractSteps(List.of(
                ToolResultMessage.success("missing", "browser", "page"),
                ToolResultMessage.success(null, null, "???")));

        assertEquals("browser", steps.get(0).getTool());
        assertEquals("unknown", steps.get(1).getTool());
    }

    @Test
    void shouldMineProcedureFromSuccessfulRun() {
        Procedure procedure = miner.mine(deployRun(), true);

        assertEquals("Deploy the website to the staging server", procedure.getName());
        assertEquals(List.of("exec", "web_fetch", "deploy", "website", "server"), procedure.getTags());
        assertEquals(3, procedure.getSteps().size());
        assertEquals(NOW, procedure.getTimestamp());
    }

    @Test
    void shouldSkipFailedOrShortRuns() {
        assertNull(miner.mine(deployRun(), false));
        assertNull(miner.mine(deployRun().subList(0, 3), true));
    }

    @Test
    void shouldDescribeActionsByKeyParameter() {
        assertEquals("search: \"kotlin coroutines\"",
                ProcedureMiner.describeAction("search", Map.of("query", "kotlin coroutines")));
        assertEquals("read: notes/todo.md", ProcedureMiner.describeAction("read", Map.of("path", "notes/todo.md")));
        assertEquals("noop", ProcedureMiner.describeAction("noop", Map.of()));
        assertEquals(List.of("exec", "build", "script"),
                ProcedureMiner.deriveTags("Build the release script", Set.of("exec")));
    }

    @Test
    void shouldAppendProcedureToDailyFile() throws IOException {
        ExtractionOutcome outcome = miner.logProcedure(deployRun(), true);

        assertTrue(outcome.logged());
        assertEquals(3, outcome.itemCount());
        assertEquals("memory/procedures/2026-03-01.md", outcome.filePath());
        String content = Files.readString(workspaceDir.resolve(outcome.filePath()));
        assertTrue(content.contains("# Procedure: Deploy the website to the staging server\n\n**Status:** ✅ Successful"));
        assertTrue(content.contains("**Tags:** exec, web_fetch, deploy, website, server"));
        assertTrue(content.contains("1. ✅ **exec: npm run build**"));
        assertTrue(content.contains("3. ❌ **web_fetch: https://staging.example.com**"));
    }

    private static List<ConversationMessage> deployRun() {
        return List.of(
                UserMessage.of("Deploy the website to the staging server. Then notify the team"),
                AssistantMessage.withTools("",
                        new ToolUse("1", "exec", Map.of("command", "npm run build")),
                        new ToolUse("2", "exec", Map.of("command", "rsync dist/ staging:/var/www"))),
                ToolResultMessage.success("1", "exec", "built"),
                ToolResultMessage.success("2", "exec", "synced"),
                AssistantMessage.withTools("",
                        new ToolUse("3", "web_fetch", Map.of("url", "https://staging.example.com", "timeout", 30))),
                ToolResultMessage.failure("3", "web_fetch", "timeout"));
    }
}
