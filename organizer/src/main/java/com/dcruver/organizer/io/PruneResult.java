package com.dcruver.organizer.io;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Outcome of a retention pass over the backup root.
 */
@Value
@Builder
public class PruneResult {
    int found;
    int keep;
    boolean dryRun;
    List<Path> kept;
    List<Path> pruned;
}
