package com.dcruver.organizer.reporting;

import com.dcruver.organizer.domain.planning.ExecutionResult;
import com.dcruver.organizer.domain.planning.MovePlan;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What gets persisted after an execution.
 */
@Value
@Builder
public class ExecutionReport {
    Instant generatedAt;
    String vault;
    MovePlan plan;
    ExecutionResult result;
}
