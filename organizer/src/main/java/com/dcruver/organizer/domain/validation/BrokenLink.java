package com.dcruver.organizer.domain.validation;

import lombok.Value;

/**
 * A reference that resolved before the moves and no longer does.
 */
@Value
public class BrokenLink {
    String sourcePath;
    String linkText;
    String expectedTarget;
    int line;
}
