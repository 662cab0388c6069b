package com.dcruver.organizer.domain.validation;

import com.dcruver.organizer.config.VaultLayout;
import com.dcruver.organizer.domain.Note;
import com.dcruver.organizer.domain.VaultContents;
import com.dcruver.organizer.domain.VaultScanner;
import com.dcruver.organizer.domain.links.LinkIndex;
import com.dcruver.organizer.domain.links.LinkReference;
import com.dcruver.organizer.domain.links.LinkRewrite;
import com.dcruver.organizer.domain.planning.ExecutionResult;
import com.dcruver.organizer.domain.planning.ItemOutcome;
import com.dcruver.organizer.domain.planning.MovePlan;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the vault after moves: every note readable, every move landed, and every
 * reference that resolved before still resolves to the same note.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PostMoveValidator {

    private final VaultScanner scanner;
    private final VaultLayout layout;

    public ValidationReport validate(MovePlan plan, ExecutionResult result) {
        ValidationReport report = ValidationReport.builder()
            .validatedAt(Instant.now())
            .build();

        VaultContents after;
        try {
            after = scanner.scan();
        } catch (IOException e) {
            log.error("Validation scan failed", e);
            report.getErrors().add("Cannot scan vault: " + e.getMessage());
            return report;
        }

        checkNotes(plan, after, report);

        Map<String, String> moved = new HashMap<>();
        Map<String, Set<String>> rewrittenByCarrier = new HashMap<>();
        for (ItemOutcome outcome : result.getExecutedMoves()) {
            moved.put(outcome.getSourcePath(), outcome.getTargetPath());
            rewrittenByCarrier.put(outcome.getSourcePath(), new HashSet<>(outcome.getRewrittenNotes()));
        }
        checkMoves(moved, after.fileSet(), report);
        checkLinks(plan, moved, rewrittenByCarrier, LinkIndex.build(after, layout), report);

        addRecommendations(plan, report);

        log.info("Validation {}: {} files, {}/{} links valid, {} broken, {} errors, {} warnings",
            report.isValidationPassed() ? "passed" : "FAILED",
            report.getFilesChecked(), report.getValidLinks(), report.getLinksChecked(),
            report.getBrokenLinks().size(), report.getErrors().size(), report.getWarnings().size());
        return report;
    }

    private void checkNotes(MovePlan plan, VaultContents after, ValidationReport report) {
        int readable = 0;
        for (Note note : after.getNotes()) {
            if (note.isReadable()) {
                readable++;
            } else {
                report.getErrors().add("Unreadable note: " + note.getPath());
            }
        }
        report.setFilesChecked(after.getNotes().size());
        report.setReadableFiles(readable);

        int before = plan.getSummary().getNotesInVault();
        if (after.getNotes().size() != before) {
            report.getErrors().add("Note count changed from " + before + " to " + after.getNotes().size());
        }
    }

    private void checkMoves(Map<String, String> moved, Set<String> files, ValidationReport report) {
        moved.forEach((source, target) -> {
            if (!files.contains(target)) {
                report.getErrors().add("Moved note missing at target: " + target);
            }
            if (files.contains(source)) {
                report.getErrors().add("Moved note still present at source: " + source);
            }
        });
    }

    private void checkLinks(MovePlan plan, Map<String, String> moved, Map<String, Set<String>> rewrittenByCarrier,
                            LinkIndex afterIndex, ValidationReport report) {
        // A rewrite only happened if its carrier moved and its note was written
        Map<String, String> rewrittenText = new HashMap<>();
        plan.rewritesByMove().forEach((carrier, rewrites) -> {
            Set<String> written = rewrittenByCarrier.getOrDefault(carrier, Set.of());
            for (LinkRewrite rewrite : rewrites) {
                if (written.contains(rewrite.getSourcePath())) {
                    rewrittenText.put(key(rewrite.getSourcePath(), rewrite.getOldText()), rewrite.getNewText());
                }
            }
        });

        Map<String, LinkReference> afterRefs = new HashMap<>();
        for (LinkReference ref : afterIndex.getReferences()) {
            afterRefs.putIfAbsent(key(ref.getSourcePath(), ref.getRawText()), ref);
        }

        int checked = 0;
        int valid = 0;
        int unresolvedBefore = 0;

        for (LinkReference before : plan.getLinkReferences()) {
            checked++;
            String source = before.getSourcePath();
            String newSource = moved.getOrDefault(source, source);
            String newText = rewrittenText.getOrDefault(key(source, before.getRawText()), before.getRawText());
            LinkReference now = afterRefs.get(key(newSource, newText));

            if (!before.isResolved()) {
                unresolvedBefore++;
                if (now != null && now.isResolved()) {
                    valid++;
                }
                continue;
            }

            String expected = moved.getOrDefault(before.getResolvedPath(), before.getResolvedPath());
            if (now == null || !now.isResolved()) {
                report.getBrokenLinks().add(new BrokenLink(newSource, newText, expected, before.getLine()));
                continue;
            }

            valid++;
            if (!now.getResolvedPath().equals(expected)) {
                report.getWarnings().add(String.format("%s in %s now resolves to %s instead of %s",
                    newText, newSource, now.getResolvedPath(), expected));
            }
        }

        if (unresolvedBefore > 0) {
            report.getWarnings().add(unresolvedBefore + " links were already unresolved before the move");
        }
        report.setLinksChecked(checked);
        report.setValidLinks(valid);
    }

    private void addRecommendations(MovePlan plan, ValidationReport report) {
        List<String> recommendations = report.getRecommendations();
        if (!report.getBrokenLinks().isEmpty()) {
            recommendations.add("Fix or restore the " + report.getBrokenLinks().size() + " broken links");
        }
        if (!report.getErrors().isEmpty()) {
            recommendations.add("Roll back to the pre-move snapshot and inspect the errors");
        }
        if (plan.getSummary().getUnresolvedLinks() > 0) {
            recommendations.add("Review " + plan.getSummary().getUnresolvedLinks() + " unresolved links");
        }
        if (plan.getSummary().getAmbiguousLinkNames() > 0) {
            recommendations.add("Rename notes that share a file name to make links unambiguous");
        }
        if (plan.getSummary().getUnknownTypes() > 0) {
            recommendations.add("Declare a type for " + plan.getSummary().getUnknownTypes() + " untyped notes");
        }
    }

    private static String key(String sourcePath, String text) {
        return sourcePath + '\u0000' + text;
    }
}
