package com.dcruver.organizer.reporting;

import com.dcruver.organizer.VaultFixture;
import com.dcruver.organizer.config.VaultLayout;
import com.dcruver.organizer.domain.planning.ExecutionResult;
import com.dcruver.organizer.domain.planning.ExecutionStatus;
import com.dcruver.organizer.domain.planning.MovePlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JSON reports and rewrite previews.
 */
class ExecutionReportWriterTest {

    @TempDir
    Path tempDir;

    private VaultFixture vault;

    @BeforeEach
    void setUp() throws Exception {
        vault = new VaultFixture(tempDir);
        vault.note("Inbox/a.md", "permanent", "Intro\nSee [[Inbox/b|Beta]]\nOutro\n");
        vault.note("Inbox/b.md", "literature", "B\n");
    }

    @Test
    void testPreviewShowsRewrittenLinesWithoutWriting() throws Exception {
        Map<String, String> before = vault.tree();
        MovePlan plan = vault.planner.plan();

        String preview = vault.reportWriter.previewRewrites(plan);

        assertTrue(preview.contains("--- a/Inbox/a.md"), preview);
        assertTrue(preview.contains("+++ b/Permanent Notes/a.md"), preview);
        assertTrue(preview.contains("-See [[Inbox/b|Beta]]"), preview);
        assertTrue(preview.contains("+See [[Literature Notes/b|Beta]]"), preview);
        assertEquals(before, vault.tree());
    }

    @Test
    void testWriteReport() throws Exception {
        MovePlan plan = vault.planner.plan();
        ExecutionResult result = ExecutionResult.builder()
            .status(ExecutionStatus.REFUSED)
            .startedAt(Instant.now())
            .elapsed(Duration.ofMillis(12))
            .failureReason("testing")
            .build();

        Path report = vault.reportWriter.writeReport(plan, result);

        assertNotNull(report);
        assertTrue(report.startsWith(vault.reports));
        String json = Files.readString(report);
        assertTrue(json.contains("\"failureReason\" : \"testing\""), json);
        assertTrue(json.contains("\"plannedMoves\" : 2"), json);
    }

    @Test
    void testNoReportsPathSkipsReport() throws Exception {
        vault.properties.setReportsPath(null);
        ExecutionReportWriter writer = new ExecutionReportWriter(
            new VaultLayout(vault.properties), vault.fileOperations, vault.linkRewriter);

        Path report = writer.writeReport(vault.planner.plan(), ExecutionResult.builder()
            .status(ExecutionStatus.SUCCESS)
            .build());

        assertNull(report);
        assertFalse(Files.exists(vault.reports));
    }
}
