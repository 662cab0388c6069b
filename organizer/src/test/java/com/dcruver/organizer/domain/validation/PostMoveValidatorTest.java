package com.dcruver.organizer.domain.validation;

import com.dcruver.organizer.VaultFixture;
import com.dcruver.organizer.domain.planning.ExecutionOptions;
import com.dcruver.organizer.domain.planning.ExecutionResult;
import com.dcruver.organizer.domain.planning.MovePlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for checking the vault after moves.
 */
class PostMoveValidatorTest {

    @TempDir
    Path tempDir;

    private VaultFixture vault;

    @BeforeEach
    void setUp() throws Exception {
        vault = new VaultFixture(tempDir);
    }

    private ExecutionOptions noValidationOptions() {
        return ExecutionOptions.builder().createBackup(false).build();
    }

    @Test
    void testNameLinksSurviveMove() throws Exception {
        vault.note("Inbox/a.md", "permanent", "Alpha\n");
        vault.note("Literature Notes/ref.md", "literature", "Refers to [[a]] and [[a#Intro|alpha]]\n");

        MovePlan plan = vault.planner.plan();
        ExecutionResult result = vault.executor.execute(plan, noValidationOptions());
        ValidationReport report = vault.validator.validate(plan, result);

        assertTrue(report.isValidationPassed(), report.describeFailure());
        assertEquals(2, report.getLinksChecked());
        assertEquals(2, report.getValidLinks());
        assertTrue(report.getBrokenLinks().isEmpty());
        assertEquals(2, report.getFilesChecked());
        assertEquals(2, report.getReadableFiles());
    }

    @Test
    void testRewrittenPathLinksStillResolve() throws Exception {
        vault.note("Inbox/a.md", "permanent", "![img](../attachments/p.png) [b](b.md)\n");
        vault.note("Inbox/b.md", "fleeting", "Back to [[Inbox/a|A]]\n");
        vault.write("attachments/p.png", "PNG");

        MovePlan plan = vault.planner.plan();
        ExecutionResult result = vault.executor.execute(plan, noValidationOptions());
        ValidationReport report = vault.validator.validate(plan, result);

        assertTrue(report.isValidationPassed(), report.describeFailure());
        assertEquals(3, report.getValidLinks());
    }

    @Test
    void testBrokenLinkIsDetected() throws Exception {
        vault.note("Inbox/a.md", "permanent", "Alpha\n");
        vault.note("Literature Notes/ref.md", "literature", "See [[a]]\n");

        MovePlan plan = vault.planner.plan();
        ExecutionResult result = vault.executor.execute(plan, noValidationOptions());
        Files.delete(vault.vault.resolve("Permanent Notes/a.md"));

        ValidationReport report = vault.validator.validate(plan, result);

        assertFalse(report.isValidationPassed());
        assertEquals(1, report.getBrokenLinks().size());
        BrokenLink broken = report.getBrokenLinks().get(0);
        assertEquals("Literature Notes/ref.md", broken.getSourcePath());
        assertEquals("[[a]]", broken.getLinkText());
        assertEquals("Permanent Notes/a.md", broken.getExpectedTarget());
        assertTrue(report.getErrors().stream().anyMatch(e -> e.contains("missing at target")));
        assertTrue(report.getErrors().stream().anyMatch(e -> e.contains("Note count changed")));
    }

    @Test
    void testPreviouslyUnresolvedLinkIsOnlyAWarning() throws Exception {
        vault.note("Inbox/a.md", "permanent", "Points at [[nowhere]]\n");

        MovePlan plan = vault.planner.plan();
        ExecutionResult result = vault.executor.execute(plan, noValidationOptions());
        ValidationReport report = vault.validator.validate(plan, result);

        assertTrue(report.isValidationPassed());
        assertEquals(1, report.getWarnings().size());
        assertTrue(report.getWarnings().get(0).contains("already unresolved"));
        assertFalse(report.getRecommendations().isEmpty());
    }
}
