package com.dcruver.organizer.io;

/**
 * Backup or rollback could not be performed. Always fatal to the surrounding operation.
 */
public class BackupException extends Exception {

    public BackupException(String message) {
        super(message);
    }

    public BackupException(String message, Throwable cause) {
        super(message, cause);
    }
}
