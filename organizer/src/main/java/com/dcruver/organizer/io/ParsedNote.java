package com.dcruver.organizer.io;

import lombok.Value;

/**
 * Result of splitting note text into frontmatter and body.
 * The body is always an exact suffix of the original text.
 */
@Value
public class ParsedNote {
    Frontmatter frontmatter;
    String body;
    boolean metadataPresent;

    public static ParsedNote withMetadata(Frontmatter frontmatter, String body) {
        return new ParsedNote(frontmatter, body, true);
    }

    public static ParsedNote withoutMetadata(String body) {
        return new ParsedNote(Frontmatter.empty(), body, false);
    }
}
