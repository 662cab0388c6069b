package com.dcruver.organizer.domain;

import com.dcruver.organizer.config.VaultLayout;
import com.dcruver.organizer.io.Frontmatter;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * A note discovered by one scan of the vault.
 * Identified by its vault-relative path; never cached across scans.
 */
@Value
@Builder
public class Note {
    String path;
    String rawContent;

    Frontmatter frontmatter;     // Empty when no block is present, null when unparseable
    String body;
    boolean metadataPresent;

    String problem;              // Read or parse failure, null when the note is usable

    public String getFileName() {
        return VaultLayout.fileNameOf(path);
    }

    public String getStem() {
        return VaultLayout.stemOf(getFileName());
    }

    public String getDirectory() {
        return VaultLayout.parentOf(path);
    }

    public boolean isReadable() {
        return rawContent != null;
    }

    public boolean isMalformed() {
        return problem != null;
    }

    public String getDeclaredType() {
        return frontmatter != null ? frontmatter.getType() : null;
    }

    public Optional<NoteType> getNoteType() {
        return NoteType.fromDeclared(getDeclaredType());
    }
}
