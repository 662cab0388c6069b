package com.dcruver.organizer.domain.planning;

import com.dcruver.organizer.domain.links.LinkReference;
import com.dcruver.organizer.domain.links.LinkRewrite;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result of one planning pass. Never mutated after creation.
 */
@Value
@Builder
public class MovePlan {
    Instant createdAt;
    List<MoveItem> moves;
    List<MoveConflict> conflicts;
    List<PlanningDiagnostic> unknownTypes;
    List<PlanningDiagnostic> malformedFiles;
    List<String> correctlyPlaced;
    List<LinkRewrite> rewrites;
    List<String> warnings;
    @JsonIgnore
    List<LinkReference> linkReferences;
    PlanSummary summary;

    public boolean hasConflicts() {
        return !conflicts.isEmpty();
    }

    public boolean isEmpty() {
        return moves.isEmpty();
    }

    public Map<String, String> moveMap() {
        Map<String, String> map = new LinkedHashMap<>();
        for (MoveItem move : moves) {
            map.put(move.getSourcePath(), move.getTargetPath());
        }
        return map;
    }

    /**
     * Rewrites grouped by the move that carries them: the target's move when the
     * target moves, otherwise the referencing note's own move.
     */
    public Map<String, List<LinkRewrite>> rewritesByMove() {
        Set<String> moving = moves.stream().map(MoveItem::getSourcePath).collect(Collectors.toSet());
        Map<String, List<LinkRewrite>> grouped = new LinkedHashMap<>();
        for (LinkRewrite rewrite : rewrites) {
            String carrier = moving.contains(rewrite.getTargetPath())
                ? rewrite.getTargetPath()
                : rewrite.getSourcePath();
            grouped.computeIfAbsent(carrier, k -> new ArrayList<>()).add(rewrite);
        }
        return grouped;
    }
}
