package com.dcruver.organizer.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Recognized note types and the directory each one lives in.
 */
public enum NoteType {
    /**
     * Atomic, one idea; heavy linking
     */
    PERMANENT("permanent", "Permanent Notes"),

    /**
     * Faithful summaries with citations
     */
    LITERATURE("literature", "Literature Notes"),

    /**
     * Quick captures awaiting processing
     */
    FLEETING("fleeting", "Fleeting Notes");

    private final String value;
    private final String defaultDirectory;

    NoteType(String value, String defaultDirectory) {
        this.value = value;
        this.defaultDirectory = defaultDirectory;
    }

    public String getValue() {
        return value;
    }

    public String getDefaultDirectory() {
        return defaultDirectory;
    }

    /**
     * Match a declared frontmatter value, ignoring case and surrounding whitespace.
     */
    public static Optional<NoteType> fromDeclared(String declared) {
        if (declared == null || declared.isBlank()) {
            return Optional.empty();
        }
        String normalized = declared.trim().toLowerCase(Locale.ROOT);
        for (NoteType type : values()) {
            if (type.value.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
