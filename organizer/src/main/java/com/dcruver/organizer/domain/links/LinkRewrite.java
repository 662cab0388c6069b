package com.dcruver.organizer.domain.links;

import lombok.Value;

/**
 * Replace oldText with newText in the body of the note at sourcePath.
 * Both paths are the pre-move locations.
 */
@Value
public class LinkRewrite {
    String sourcePath;
    String targetPath;
    String oldText;
    String newText;
}
