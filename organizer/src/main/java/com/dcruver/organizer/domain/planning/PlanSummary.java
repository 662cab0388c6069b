package com.dcruver.organizer.domain.planning;

import lombok.Builder;
import lombok.Data;

/**
 * Counts for one planning pass.
 */
@Data
@Builder
public class PlanSummary {
    private final int totalFilesScanned;     // Notes inside the scan directories
    private final int filesWithMetadata;
    private final int correctlyPlaced;
    private final int plannedMoves;
    private final int conflicts;
    private final int unknownTypes;
    private final int malformedFiles;
    private final int notesInVault;
    private final int totalLinks;
    private final int unresolvedLinks;
    private final int ambiguousLinkNames;
    private final int linkRewrites;
}
