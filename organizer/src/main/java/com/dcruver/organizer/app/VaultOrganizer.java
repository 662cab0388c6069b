package com.dcruver.organizer.app;

import com.dcruver.organizer.domain.planning.ExecutionOptions;
import com.dcruver.organizer.domain.planning.ExecutionResult;
import com.dcruver.organizer.domain.planning.ExecutionStatus;
import com.dcruver.organizer.domain.planning.MoveExecutor;
import com.dcruver.organizer.domain.planning.MovePlan;
import com.dcruver.organizer.domain.planning.MovePlanner;
import com.dcruver.organizer.domain.validation.PostMoveValidator;
import com.dcruver.organizer.domain.validation.ValidationReport;
import com.dcruver.organizer.io.BackupException;
import com.dcruver.organizer.io.BackupManager;
import com.dcruver.organizer.io.PruneResult;
import com.dcruver.organizer.reporting.ExecutionReportWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Entry point for organizing a vault: plan, execute, validate, and roll back when
 * validation finds damage.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VaultOrganizer {

    private final MovePlanner planner;
    private final MoveExecutor executor;
    private final PostMoveValidator validator;
    private final BackupManager backupManager;
    private final ExecutionReportWriter reportWriter;

    /**
     * Compute a plan without touching the vault.
     */
    public MovePlan planMoves() throws IOException {
        return planner.plan();
    }

    /**
     * Plan, execute and validate in one pass.
     *
     * @throws IOException if the vault cannot be scanned
     * @throws BackupException if the backup or a rollback fails
     */
    public ExecutionResult executeWithValidation(ExecutionOptions options) throws IOException, BackupException {
        MovePlan plan = planner.plan();
        ExecutionResult result = executor.execute(plan, options);

        if (options.isValidateAfter()
            && result.getStatus() != ExecutionStatus.REFUSED
            && !result.isRolledBack()) {

            ValidationReport validation = validator.validate(plan, result);
            result.setValidation(validation);

            if (!validation.isValidationPassed()) {
                log.error("Post-move validation failed: {}", validation.describeFailure());
                if (options.isAutoRollback() && result.getBackup() != null) {
                    backupManager.rollback(result.getBackup());
                    result.setStatus(ExecutionStatus.ROLLED_BACK_VALIDATION_FAILED);
                    result.setFailureReason("Validation failed: " + validation.describeFailure());
                    log.warn("Vault restored from snapshot {}", result.getBackup().getId());
                } else {
                    result.setStatus(ExecutionStatus.PARTIAL_FAILURE);
                    result.setFailureReason("Validation failed, vault left as moved: " + validation.describeFailure());
                    log.warn("Validation failed but no rollback was performed");
                }
            }
        }

        result.setElapsed(Duration.between(result.getStartedAt(), Instant.now()));

        if (options.isWriteReport()) {
            try {
                reportWriter.writeReport(plan, result);
            } catch (IOException e) {
                log.error("Failed to write execution report", e);
            }
        }

        log.info("Organizer finished with status {} in {} ms", result.getStatus(), result.getElapsed().toMillis());
        return result;
    }

    /**
     * Restore the vault from a snapshot id or path.
     */
    public Path rollback(String snapshotId) throws BackupException {
        Path snapshot = backupManager.resolveSnapshot(snapshotId);
        backupManager.rollback(snapshot);
        return snapshot;
    }

    public List<Path> listBackups() throws BackupException {
        return backupManager.listBackups();
    }

    public PruneResult pruneBackups(int keep, boolean dryRun) throws BackupException {
        return backupManager.pruneBackups(keep, dryRun);
    }

    public String previewRewrites(MovePlan plan) throws IOException {
        return reportWriter.previewRewrites(plan);
    }
}
