package com.dcruver.organizer.domain.planning;

import com.dcruver.organizer.domain.NoteType;
import lombok.Value;

/**
 * Move one note into the canonical directory for its type.
 */
@Value
public class MoveItem {
    String sourcePath;
    String targetPath;
    NoteType noteType;
}
