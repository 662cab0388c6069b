package com.dcruver.organizer.domain.planning;

/**
 * Outcome of an execution, with the exit code the CLI reports for it.
 */
public enum ExecutionStatus {
    SUCCESS(0),
    PARTIAL_FAILURE(2),
    ROLLED_BACK(1),
    ROLLED_BACK_VALIDATION_FAILED(1),
    REFUSED(3);

    private final int exitCode;

    ExecutionStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
