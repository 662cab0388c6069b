package com.dcruver.organizer.domain.planning;

import lombok.Builder;
import lombok.Value;

/**
 * Switches for one execution. Every safety step is on by default.
 */
@Value
@Builder(toBuilder = true)
public class ExecutionOptions {
    @Builder.Default
    boolean createBackup = true;

    @Builder.Default
    boolean validateFirst = true;       // Refuse a plan that no longer matches the vault

    @Builder.Default
    boolean rollbackOnError = true;

    @Builder.Default
    boolean validateAfter = true;

    @Builder.Default
    boolean autoRollback = true;        // Roll back when post-move validation fails

    @Builder.Default
    boolean writeReport = false;

    @Builder.Default
    MoveProgressListener progressListener = MoveProgressListener.NONE;

    public static ExecutionOptions defaults() {
        return ExecutionOptions.builder().build();
    }
}
