package com.dcruver.organizer.domain.planning;

import com.dcruver.organizer.config.VaultLayout;
import com.dcruver.organizer.domain.Note;
import com.dcruver.organizer.domain.NoteType;
import com.dcruver.organizer.domain.VaultContents;
import com.dcruver.organizer.domain.VaultScanner;
import com.dcruver.organizer.domain.links.LinkIndex;
import com.dcruver.organizer.domain.links.LinkRewrite;
import com.dcruver.organizer.domain.links.LinkRewriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Decides where every note belongs.
 * <p>
 * Each note in the scan directories lands in exactly one bucket, checked in order:
 * malformed, unknown type, correctly placed, conflict, planned move.
 * Read-only: scanning and planning never touch the vault.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class MovePlanner {

    private final VaultScanner scanner;
    private final VaultLayout layout;
    private final LinkRewriter linkRewriter;

    /**
     * Scan the vault and build a fresh plan.
     *
     * @throws IOException if the vault cannot be walked
     */
    public MovePlan plan() throws IOException {
        VaultContents contents = scanner.scan();
        LinkIndex index = LinkIndex.build(contents, layout);
        Set<String> files = contents.fileSet();

        List<PlanningDiagnostic> malformed = new ArrayList<>();
        List<PlanningDiagnostic> unknownTypes = new ArrayList<>();
        List<String> correctlyPlaced = new ArrayList<>();
        List<MoveConflict> conflicts = new ArrayList<>();
        Map<String, List<MoveItem>> candidatesByTarget = new TreeMap<>();
        int scanned = 0;
        int withMetadata = 0;

        for (Note note : contents.getNotes()) {
            if (!layout.isInScanScope(note.getPath())) {
                continue;
            }
            scanned++;

            if (note.isMalformed()) {
                malformed.add(new PlanningDiagnostic(note.getPath(), PlanningDiagnostic.Kind.MALFORMED, note.getProblem()));
                continue;
            }
            if (note.isMetadataPresent()) {
                withMetadata++;
            }

            Optional<NoteType> type = note.getNoteType();
            if (type.isEmpty()) {
                String declared = note.getDeclaredType();
                unknownTypes.add(new PlanningDiagnostic(note.getPath(), PlanningDiagnostic.Kind.UNKNOWN_TYPE,
                    declared == null || declared.isBlank() ? "No type declared" : "Unrecognized type: " + declared));
                continue;
            }

            String canonical = layout.directoryFor(type.get());
            if (VaultLayout.isWithin(note.getDirectory(), canonical)) {
                correctlyPlaced.add(note.getPath());
                continue;
            }

            String target = VaultLayout.join(canonical, note.getFileName());
            if (files.contains(target) || Files.exists(layout.resolve(target))) {
                conflicts.add(new MoveConflict(note.getPath(), target, MoveConflict.TARGET_OCCUPIED));
                continue;
            }

            candidatesByTarget.computeIfAbsent(target, k -> new ArrayList<>())
                .add(new MoveItem(note.getPath(), target, type.get()));
        }

        List<MoveItem> moves = new ArrayList<>();
        candidatesByTarget.forEach((target, candidates) -> {
            if (candidates.size() == 1) {
                moves.add(candidates.get(0));
            } else {
                log.warn("{} notes would move to {}", candidates.size(), target);
                candidates.forEach(c -> conflicts.add(
                    new MoveConflict(c.getSourcePath(), target, MoveConflict.TARGET_CLAIMED_BY_MULTIPLE)));
            }
        });
        moves.sort(Comparator.comparing(MoveItem::getSourcePath));
        conflicts.sort(Comparator.comparing(MoveConflict::getSourcePath));

        Map<String, String> moveMap = new TreeMap<>();
        moves.forEach(m -> moveMap.put(m.getSourcePath(), m.getTargetPath()));
        List<LinkRewrite> rewrites = linkRewriter.computeRewrites(moveMap, index);

        List<String> warnings = new ArrayList<>();
        index.getAmbiguousStems().forEach((stem, paths) -> warnings.add(String.format(
            "Ambiguous link name '%s' matches %d notes, resolving to %s", stem, paths.size(), paths.get(0))));

        PlanSummary summary = PlanSummary.builder()
            .totalFilesScanned(scanned)
            .filesWithMetadata(withMetadata)
            .correctlyPlaced(correctlyPlaced.size())
            .plannedMoves(moves.size())
            .conflicts(conflicts.size())
            .unknownTypes(unknownTypes.size())
            .malformedFiles(malformed.size())
            .notesInVault(contents.getNotes().size())
            .totalLinks(index.getReferences().size())
            .unresolvedLinks(index.getUnresolved().size())
            .ambiguousLinkNames(index.getAmbiguousStems().size())
            .linkRewrites(rewrites.size())
            .build();

        log.info("Plan: {} moves, {} conflicts, {} correctly placed, {} unknown type, {} malformed, {} link rewrites",
            moves.size(), conflicts.size(), correctlyPlaced.size(), unknownTypes.size(), malformed.size(), rewrites.size());

        return MovePlan.builder()
            .createdAt(Instant.now())
            .moves(List.copyOf(moves))
            .conflicts(List.copyOf(conflicts))
            .unknownTypes(List.copyOf(unknownTypes))
            .malformedFiles(List.copyOf(malformed))
            .correctlyPlaced(List.copyOf(correctlyPlaced))
            .rewrites(List.copyOf(rewrites))
            .warnings(List.copyOf(warnings))
            .linkReferences(List.copyOf(index.getReferences()))
            .summary(summary)
            .build();
    }
}
