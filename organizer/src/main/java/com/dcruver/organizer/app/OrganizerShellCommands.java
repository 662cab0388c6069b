package com.dcruver.organizer.app;

import com.dcruver.organizer.domain.planning.ExecutionOptions;
import com.dcruver.organizer.domain.planning.ExecutionResult;
import com.dcruver.organizer.domain.planning.ItemOutcome;
import com.dcruver.organizer.domain.planning.MoveConflict;
import com.dcruver.organizer.domain.planning.MoveItem;
import com.dcruver.organizer.domain.planning.MovePlan;
import com.dcruver.organizer.domain.planning.PlanSummary;
import com.dcruver.organizer.domain.planning.PlanningDiagnostic;
import com.dcruver.organizer.domain.validation.BrokenLink;
import com.dcruver.organizer.domain.validation.ValidationReport;
import com.dcruver.organizer.io.PruneResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Path;
import java.util.List;

/**
 * Spring Shell commands for the vault organizer.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class OrganizerShellCommands {

    private final VaultOrganizer organizer;

    @ShellMethod(key = {"plan", "plan moves"}, value = "Show where notes would move, without touching the vault")
    public String plan(@ShellOption(defaultValue = "false", help = "Show link rewrites as a unified diff") boolean diff) {
        log.info("Planning moves...");

        try {
            MovePlan plan = organizer.planMoves();
            StringBuilder sb = new StringBuilder();
            appendSummary(sb, plan.getSummary());

            if (!plan.getMoves().isEmpty()) {
                sb.append("\nPlanned moves:\n");
                for (MoveItem move : plan.getMoves()) {
                    sb.append(String.format("  %s -> %s [%s]\n",
                        move.getSourcePath(), move.getTargetPath(), move.getNoteType().getValue()));
                }
            }

            if (!plan.getConflicts().isEmpty()) {
                sb.append("\nConflicts (execution is blocked until resolved):\n");
                for (MoveConflict conflict : plan.getConflicts()) {
                    sb.append(String.format("  %s -> %s: %s\n",
                        conflict.getSourcePath(), conflict.getTargetPath(), conflict.getReason()));
                }
            }

            appendDiagnostics(sb, "Unknown type", plan.getUnknownTypes());
            appendDiagnostics(sb, "Malformed", plan.getMalformedFiles());

            if (!plan.getWarnings().isEmpty()) {
                sb.append("\nWarnings:\n");
                plan.getWarnings().forEach(w -> sb.append("  ").append(w).append("\n"));
            }

            if (diff && !plan.getRewrites().isEmpty()) {
                sb.append("\nLink rewrites:\n");
                sb.append(organizer.previewRewrites(plan));
            }

            if (plan.isEmpty()) {
                sb.append("\nNothing to move - every typed note is where it belongs.\n");
            } else if (!plan.hasConflicts()) {
                sb.append("\nRun 'execute' to apply this plan.\n");
            }

            return sb.toString();

        } catch (Exception e) {
            log.error("Planning failed", e);
            return "Planning failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = {"execute", "organize"}, value = "Back up the vault, move notes, validate, and roll back on failure")
    public String execute(
        @ShellOption(defaultValue = "true", help = "Snapshot the vault before moving") boolean backup,
        @ShellOption(defaultValue = "true", help = "Validate links after moving") boolean validate,
        @ShellOption(value = "--auto-rollback", defaultValue = "true", help = "Roll back when validation fails") boolean autoRollback,
        @ShellOption(value = "--report", defaultValue = "false", help = "Write a JSON execution report") boolean report
    ) {
        log.info("Executing organizer (backup: {}, validate: {}, auto-rollback: {})", backup, validate, autoRollback);

        try {
            ExecutionOptions options = ExecutionOptions.builder()
                .createBackup(backup)
                .rollbackOnError(backup)
                .validateAfter(validate)
                .autoRollback(autoRollback)
                .writeReport(report)
                .progressListener((index, total, fileName) ->
                    log.info("[{}/{}] {}", index, total, fileName))
                .build();

            ExecutionResult result = organizer.executeWithValidation(options);
            return formatResult(result);

        } catch (Exception e) {
            log.error("Execution failed", e);
            return "Execution failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "rollback", value = "Restore the vault from a snapshot")
    public String rollback(@ShellOption(help = "Snapshot id or absolute path") String snapshotId) {
        try {
            Path restored = organizer.rollback(snapshotId);
            return "✓ Vault restored from " + restored;
        } catch (Exception e) {
            log.error("Rollback failed", e);
            return "Rollback failed: " + e.getMessage();
        }
    }

    @ShellMethod(key = "backups list", value = "List snapshots, newest first")
    public String backupsList() {
        try {
            List<Path> backups = organizer.listBackups();
            if (backups.isEmpty()) {
                return "No backups found.";
            }

            StringBuilder sb = new StringBuilder("Backups:\n\n");
            for (Path backup : backups) {
                sb.append("  ").append(backup.getFileName()).append("\n");
            }
            sb.append(String.format("\nTotal: %d backups\n", backups.size()));
            sb.append("Use 'rollback <id>' to restore one\n");
            return sb.toString();

        } catch (Exception e) {
            log.error("Failed to list backups", e);
            return "Failed to list backups: " + e.getMessage();
        }
    }

    @ShellMethod(key = "backups prune", value = "Delete all but the newest N snapshots")
    public String backupsPrune(
        @ShellOption(help = "Number of snapshots to keep") int keep,
        @ShellOption(value = "--dry-run", defaultValue = "false", help = "Only show what would be deleted") boolean dryRun
    ) {
        try {
            PruneResult result = organizer.pruneBackups(keep, dryRun);

            StringBuilder sb = new StringBuilder();
            sb.append(String.format("Found %d backups, keeping %d\n", result.getFound(), result.getKept().size()));
            for (Path pruned : result.getPruned()) {
                sb.append(String.format("  %s %s\n", dryRun ? "would delete" : "deleted", pruned.getFileName()));
            }
            if (result.getPruned().isEmpty()) {
                sb.append("Nothing to prune.\n");
            }
            return sb.toString();

        } catch (Exception e) {
            log.error("Failed to prune backups", e);
            return "Failed to prune backups: " + e.getMessage();
        }
    }

    private void appendSummary(StringBuilder sb, PlanSummary summary) {
        sb.append("Plan Summary:\n");
        sb.append(String.format("- Notes scanned: %d (of %d in vault)\n",
            summary.getTotalFilesScanned(), summary.getNotesInVault()));
        sb.append(String.format("- With metadata: %d\n", summary.getFilesWithMetadata()));
        sb.append(String.format("- Correctly placed: %d\n", summary.getCorrectlyPlaced()));
        sb.append(String.format("- Planned moves: %d\n", summary.getPlannedMoves()));
        sb.append(String.format("- Conflicts: %d\n", summary.getConflicts()));
        sb.append(String.format("- Unknown type: %d\n", summary.getUnknownTypes()));
        sb.append(String.format("- Malformed: %d\n", summary.getMalformedFiles()));
        sb.append(String.format("- Links: %d (%d unresolved, %d ambiguous names)\n",
            summary.getTotalLinks(), summary.getUnresolvedLinks(), summary.getAmbiguousLinkNames()));
        sb.append(String.format("- Link rewrites: %d\n", summary.getLinkRewrites()));
    }

    private void appendDiagnostics(StringBuilder sb, String title, List<PlanningDiagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return;
        }
        sb.append("\n").append(title).append(":\n");
        for (PlanningDiagnostic diagnostic : diagnostics) {
            sb.append(String.format("  %s: %s\n", diagnostic.getSourcePath(), diagnostic.getMessage()));
        }
    }

    private String formatResult(ExecutionResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Status: %s (exit code %d)\n",
            result.getStatus(), result.getStatus().getExitCode()));
        sb.append(String.format("- Moves executed: %d of %d processed\n",
            result.getMovesExecuted(), result.getFilesProcessed()));
        sb.append(String.format("- Link rewrites applied: %d\n", result.getLinkRewritesApplied()));
        if (result.getBackup() != null) {
            sb.append(String.format("- Backup: %s\n", result.getBackup().getId()));
        }
        sb.append(String.format("- Elapsed: %d ms\n", result.getElapsed().toMillis()));

        if (result.getFailureReason() != null) {
            sb.append("\nReason: ").append(result.getFailureReason()).append("\n");
        }

        for (ItemOutcome failed : result.getFailedMoves()) {
            sb.append(String.format("  ✗ %s: %s\n", failed.getSourcePath(), failed.getError()));
        }

        ValidationReport validation = result.getValidation();
        if (validation != null) {
            sb.append(String.format("\nValidation: %s (%d/%d links valid)\n",
                validation.isValidationPassed() ? "passed" : "FAILED",
                validation.getValidLinks(), validation.getLinksChecked()));
            for (BrokenLink broken : validation.getBrokenLinks()) {
                sb.append(String.format("  broken: %s in %s (line %d)\n",
                    broken.getLinkText(), broken.getSourcePath(), broken.getLine()));
            }
            validation.getErrors().forEach(e -> sb.append("  error: ").append(e).append("\n"));
            validation.getRecommendations().forEach(r -> sb.append("  - ").append(r).append("\n"));
        }
        return sb.toString();
    }
}
