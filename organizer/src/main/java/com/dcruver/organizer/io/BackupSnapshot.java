package com.dcruver.organizer.io;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A full, write-once copy of the vault.
 */
@Value
@Builder
public class BackupSnapshot {
    String id;         // <vault-name>-<yyyyMMddHHmmss>[-NN]
    Path path;
    Instant createdAt;
    long fileCount;
}
