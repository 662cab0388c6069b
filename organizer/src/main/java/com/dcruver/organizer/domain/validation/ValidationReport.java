package com.dcruver.organizer.domain.validation;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Findings of one post-move validation pass.
 */
@Data
@Builder
public class ValidationReport {
    private Instant validatedAt;
    private int filesChecked;
    private int readableFiles;
    private int linksChecked;
    private int validLinks;
    @Builder.Default
    private List<BrokenLink> brokenLinks = new ArrayList<>();
    @Builder.Default
    private List<String> errors = new ArrayList<>();
    @Builder.Default
    private List<String> warnings = new ArrayList<>();
    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    public boolean isValidationPassed() {
        return errors.isEmpty() && brokenLinks.isEmpty();
    }

    /**
     * One line naming the first problem, for failure messages.
     */
    public String describeFailure() {
        if (!errors.isEmpty()) {
            return errors.size() + " errors, first: " + errors.get(0);
        }
        if (!brokenLinks.isEmpty()) {
            BrokenLink first = brokenLinks.get(0);
            return brokenLinks.size() + " broken links, first: " + first.getLinkText() + " in " + first.getSourcePath();
        }
        return "no problems";
    }
}
