package com.dcruver.organizer.domain.planning;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What happened to one planned move. A note can be moved while its link rewrites
 * failed; {@code moved} and {@code success} tell the two apart.
 */
@Value
@Builder
public class ItemOutcome {
    String sourcePath;
    String targetPath;
    boolean moved;
    boolean success;
    int linkRewritesApplied;

    // Pre-move paths of notes whose rewrites from this move were written
    @Builder.Default
    List<String> rewrittenNotes = List.of();

    String error;
}
