package com.dcruver.organizer.domain.links;

import lombok.Builder;
import lombok.Value;

/**
 * One reference as it appears in a note body, split into the parts needed to
 * resolve it and to write it back with a different target.
 */
@Value
@Builder
public class ParsedLink {
    String raw;
    LinkStyle style;
    boolean embed;

    String target;          // Name or path, decoded, without alias/anchor
    String rawTarget;       // Target exactly as written

    // Wiki: everything after the target ("#anchor|alias"). Markdown: "#anchor".
    String suffix;

    // Markdown only
    String label;
    String title;
    boolean angleBracketed;
    boolean percentEncoded;

    int offset;             // Start of raw within the body
    int line;

    /**
     * The same reference pointing at a different target.
     */
    public String rebuild(String newTarget) {
        String bang = embed ? "!" : "";
        if (style != LinkStyle.MARKDOWN_PATH) {
            return bang + "[[" + newTarget + suffix + "]]";
        }

        String destination;
        if (angleBracketed) {
            destination = "<" + newTarget + suffix + ">";
        } else if (percentEncoded || newTarget.contains(" ")) {
            destination = newTarget.replace(" ", "%20") + suffix;
        } else {
            destination = newTarget + suffix;
        }
        return bang + "[" + label + "](" + destination + title + ")";
    }
}
