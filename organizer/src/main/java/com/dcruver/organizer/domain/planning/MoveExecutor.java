package com.dcruver.organizer.domain.planning;

import com.dcruver.organizer.config.VaultLayout;
import com.dcruver.organizer.domain.links.LinkRewrite;
import com.dcruver.organizer.domain.links.LinkRewriter;
import com.dcruver.organizer.io.BackupException;
import com.dcruver.organizer.io.BackupManager;
import com.dcruver.organizer.io.BackupSnapshot;
import com.dcruver.organizer.io.VaultFileOperations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies a move plan to the vault.
 * <p>
 * A plan with conflicts is refused before anything is touched. Otherwise the vault is
 * backed up, the plan is checked against a fresh scan, and moves run in source-path
 * order. On the first failure the vault is rolled back to the snapshot when
 * rollback is enabled and a snapshot exists.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MoveExecutor {

    private final MovePlanner planner;
    private final BackupManager backupManager;
    private final VaultFileOperations fileOperations;
    private final LinkRewriter linkRewriter;
    private final VaultLayout layout;

    /**
     * Execute the plan.
     *
     * @throws BackupException if the backup cannot be created or a rollback fails
     */
    public ExecutionResult execute(MovePlan plan, ExecutionOptions options) throws BackupException {
        Instant started = Instant.now();
        log.info("Executing plan with {} moves (backup: {}, rollback on error: {})",
            plan.getMoves().size(), options.isCreateBackup(), options.isRollbackOnError());

        if (plan.hasConflicts()) {
            log.warn("Refusing to execute: plan has {} conflicts", plan.getConflicts().size());
            return refused(started, null, "Plan has " + plan.getConflicts().size() + " unresolved conflicts");
        }

        BackupSnapshot snapshot = null;
        if (options.isCreateBackup()) {
            snapshot = backupManager.createBackup();
        }

        if (options.isValidateFirst()) {
            String staleReason = checkStillCurrent(plan);
            if (staleReason != null) {
                log.warn("Refusing to execute: {}", staleReason);
                return refused(started, snapshot, staleReason);
            }
        }

        List<MoveItem> ordered = new ArrayList<>(plan.getMoves());
        ordered.sort(Comparator.comparing(MoveItem::getSourcePath));
        Map<String, List<LinkRewrite>> rewritesByMove = plan.rewritesByMove();

        List<ItemOutcome> outcomes = new ArrayList<>();
        Map<String, String> moved = new HashMap<>();
        int executed = 0;
        int succeeded = 0;
        int rewritesApplied = 0;
        int total = ordered.size();

        for (int i = 0; i < total; i++) {
            MoveItem item = ordered.get(i);
            boolean itemMoved = false;
            List<String> rewrittenNotes = new ArrayList<>();
            try {
                fileOperations.move(layout.resolve(item.getSourcePath()), layout.resolve(item.getTargetPath()));
                moved.put(item.getSourcePath(), item.getTargetPath());
                itemMoved = true;
                executed++;

                int applied = applyRewrites(rewritesByMove.getOrDefault(item.getSourcePath(), List.of()),
                    moved, rewrittenNotes);
                rewritesApplied += applied;
                succeeded++;

                outcomes.add(ItemOutcome.builder()
                    .sourcePath(item.getSourcePath())
                    .targetPath(item.getTargetPath())
                    .moved(true)
                    .success(true)
                    .linkRewritesApplied(applied)
                    .rewrittenNotes(rewrittenNotes)
                    .build());
                log.info("Moved {} -> {}", item.getSourcePath(), item.getTargetPath());

            } catch (IOException | RuntimeException e) {
                String failure = itemMoved
                    ? "Link rewrite after moving " + item.getSourcePath() + " failed: " + e.getMessage()
                    : "Move of " + item.getSourcePath() + " failed: " + e.getMessage();
                log.error(failure, e);
                outcomes.add(ItemOutcome.builder()
                    .sourcePath(item.getSourcePath())
                    .targetPath(item.getTargetPath())
                    .moved(itemMoved)
                    .success(false)
                    .rewrittenNotes(rewrittenNotes)
                    .error(e.getClass().getSimpleName() + ": " + e.getMessage())
                    .build());

                if (options.isRollbackOnError() && snapshot != null) {
                    log.warn("Rolling back to snapshot {}", snapshot.getId());
                    backupManager.rollback(snapshot);
                    options.getProgressListener().onMove(i + 1, total, fileName(item));
                    return ExecutionResult.builder()
                        .status(ExecutionStatus.ROLLED_BACK)
                        .startedAt(started)
                        .elapsed(Duration.between(started, Instant.now()))
                        .movesExecuted(executed)
                        .filesProcessed(i + 1)
                        .linkRewritesApplied(rewritesApplied)
                        .outcomes(outcomes)
                        .backup(snapshot)
                        .failureReason(failure)
                        .build();
                }
            }
            options.getProgressListener().onMove(i + 1, total, fileName(item));
        }

        int failed = total - succeeded;
        ExecutionStatus status = failed == 0 ? ExecutionStatus.SUCCESS : ExecutionStatus.PARTIAL_FAILURE;
        log.info("Execution finished: {} moved, {} failed, {} link rewrites", executed, failed, rewritesApplied);

        return ExecutionResult.builder()
            .status(status)
            .startedAt(started)
            .elapsed(Duration.between(started, Instant.now()))
            .movesExecuted(executed)
            .filesProcessed(total)
            .linkRewritesApplied(rewritesApplied)
            .outcomes(outcomes)
            .backup(snapshot)
            .failureReason(failed == 0 ? null : failed + " of " + total + " moves failed")
            .build();
    }

    /**
     * Re-plan and compare.
     *
     * @return why the plan is stale, or null if it still matches the vault
     */
    private String checkStillCurrent(MovePlan plan) {
        MovePlan current;
        try {
            current = planner.plan();
        } catch (IOException e) {
            log.error("Cannot re-scan vault before executing", e);
            return "Cannot re-scan vault: " + e.getMessage();
        }

        if (!current.getMoves().equals(plan.getMoves())) {
            return "Plan is stale: planned moves no longer match the vault";
        }
        if (!current.getConflicts().equals(plan.getConflicts())) {
            return "Plan is stale: conflicts changed since planning";
        }
        if (!current.getRewrites().equals(plan.getRewrites())) {
            return "Plan is stale: link rewrites changed since planning";
        }
        return null;
    }

    /**
     * Rewrite references in whichever notes these rewrites touch, at their current location.
     * Each note whose rewrites were written is added to rewrittenNotes by its pre-move path.
     */
    private int applyRewrites(List<LinkRewrite> rewrites, Map<String, String> moved,
                              List<String> rewrittenNotes) throws IOException {
        if (rewrites.isEmpty()) {
            return 0;
        }

        Map<String, List<LinkRewrite>> byNote = new LinkedHashMap<>();
        for (LinkRewrite rewrite : rewrites) {
            byNote.computeIfAbsent(rewrite.getSourcePath(), k -> new ArrayList<>()).add(rewrite);
        }

        int applied = 0;
        for (Map.Entry<String, List<LinkRewrite>> entry : byNote.entrySet()) {
            String current = moved.getOrDefault(entry.getKey(), entry.getKey());
            Path note = layout.resolve(current);
            String content = fileOperations.read(note);
            String updated = linkRewriter.apply(content, entry.getValue());
            if (!updated.equals(content)) {
                fileOperations.write(note, updated);
            }
            rewrittenNotes.add(entry.getKey());
            applied += entry.getValue().size();
            log.debug("Rewrote {} links in {}", entry.getValue().size(), current);
        }
        return applied;
    }

    private ExecutionResult refused(Instant started, BackupSnapshot snapshot, String reason) {
        return ExecutionResult.builder()
            .status(ExecutionStatus.REFUSED)
            .startedAt(started)
            .elapsed(Duration.between(started, Instant.now()))
            .backup(snapshot)
            .failureReason(reason)
            .build();
    }

    private static String fileName(MoveItem item) {
        return VaultLayout.fileNameOf(item.getSourcePath());
    }
}
