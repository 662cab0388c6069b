package com.dcruver.organizer.domain.planning;

import lombok.Value;

/**
 * A note the planner could not classify.
 */
@Value
public class PlanningDiagnostic {

    public enum Kind {
        UNKNOWN_TYPE,
        MALFORMED
    }

    String sourcePath;
    Kind kind;
    String message;
}
