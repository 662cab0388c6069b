package com.dcruver.organizer.io;

/**
 * Reads and writes the key-value metadata block at the top of a note.
 */
public interface MetadataCodec {

    /**
     * Split note text into its metadata and body.
     *
     * @throws MetadataParseException if a metadata block is present but cannot be parsed
     */
    ParsedNote parse(String text) throws MetadataParseException;

    /**
     * Render metadata and body back into note text.
     */
    String render(Frontmatter frontmatter, String body);
}
