package com.dcruver.organizer.domain.planning;

import lombok.Value;

/**
 * A move that cannot happen. Any conflict blocks the whole plan.
 */
@Value
public class MoveConflict {
    public static final String TARGET_OCCUPIED = "target already occupied";
    public static final String TARGET_CLAIMED_BY_MULTIPLE = "target claimed by multiple notes";

    String sourcePath;
    String targetPath;
    String reason;
}
