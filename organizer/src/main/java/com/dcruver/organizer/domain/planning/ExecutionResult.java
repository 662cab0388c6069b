package com.dcruver.organizer.domain.planning;

import com.dcruver.organizer.domain.validation.ValidationReport;
import com.dcruver.organizer.io.BackupSnapshot;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of executing a move plan.
 */
@Data
@Builder
public class ExecutionResult {
    private ExecutionStatus status;
    private Instant startedAt;
    private Duration elapsed;
    private int movesExecuted;
    private int filesProcessed;
    private int linkRewritesApplied;
    @Builder.Default
    private List<ItemOutcome> outcomes = new ArrayList<>();
    private BackupSnapshot backup;
    private String failureReason;
    private ValidationReport validation;

    public boolean isSuccess() {
        return status == ExecutionStatus.SUCCESS;
    }

    public boolean isRolledBack() {
        return status == ExecutionStatus.ROLLED_BACK || status == ExecutionStatus.ROLLED_BACK_VALIDATION_FAILED;
    }

    /**
     * Items whose file was moved, including those whose link rewrites then failed.
     */
    @JsonIgnore
    public List<ItemOutcome> getExecutedMoves() {
        return outcomes.stream().filter(ItemOutcome::isMoved).toList();
    }

    @JsonIgnore
    public List<ItemOutcome> getFailedMoves() {
        return outcomes.stream().filter(o -> !o.isSuccess()).toList();
    }
}
