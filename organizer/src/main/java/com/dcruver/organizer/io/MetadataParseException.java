package com.dcruver.organizer.io;

/**
 * A note's metadata block exists but is not a readable key-value mapping.
 */
public class MetadataParseException extends Exception {

    public MetadataParseException(String message) {
        super(message);
    }

    public MetadataParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
