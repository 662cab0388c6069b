package com.dcruver.organizer.io;

import com.dcruver.organizer.config.VaultLayout;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.CopyOption;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Creates timestamped snapshots of the whole vault and restores them wholesale.
 * Knows nothing about notes; this is plain tree copying.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BackupManager {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private static final Pattern SNAPSHOT_NAME = Pattern.compile("^(.+)-(\\d{14})(?:-(\\d{2,}))?$");
    private static final String EMERGENCY_PREFIX = "emergency-before-rollback-";

    private final VaultLayout layout;

    /**
     * Copy the vault (hidden entries included, exclude patterns skipped) into a new
     * snapshot directory under the backup root.
     */
    public BackupSnapshot createBackup() throws BackupException {
        Path vaultRoot = layout.getVaultRoot();
        Path backupRoot = layout.getBackupRoot();

        if (!Files.exists(vaultRoot)) {
            throw fail("Vault root does not exist: " + vaultRoot, null);
        }
        if (!Files.isDirectory(vaultRoot)) {
            throw fail("Vault root is not a directory: " + vaultRoot, null);
        }
        checkBackupRootOutsideVault();

        try {
            Files.createDirectories(backupRoot);
        } catch (IOException e) {
            throw fail("Cannot create backup root: " + backupRoot, e);
        }
        if (!Files.isDirectory(backupRoot) || !Files.isWritable(backupRoot)) {
            throw fail("Backup root is not writable: " + backupRoot, null);
        }

        Instant createdAt = Instant.now();
        Path snapshotPath;
        try {
            snapshotPath = createUniqueDirectory(backupRoot, layout.getVaultName() + "-" + TIMESTAMP_FORMAT.format(createdAt));
        } catch (IOException e) {
            throw fail("Cannot create snapshot directory in " + backupRoot, e);
        }

        log.info("Creating backup: {}", snapshotPath);

        try {
            long sourceCount = countFiles(vaultRoot, true);
            log.info("Backing up {} files from vault", sourceCount);

            copyTree(vaultRoot, snapshotPath, true);

            long backupCount = countFiles(snapshotPath, false);
            if (backupCount != sourceCount) {
                log.warn("File count mismatch: original={}, backup={}", sourceCount, backupCount);
            } else {
                log.info("Backup created successfully: {} files copied", backupCount);
            }

            return BackupSnapshot.builder()
                .id(snapshotPath.getFileName().toString())
                .path(snapshotPath)
                .createdAt(createdAt)
                .fileCount(backupCount)
                .build();

        } catch (IOException e) {
            deletePartial(snapshotPath);
            throw fail("Failed to create backup: " + e.getMessage(), e);
        }
    }

    public void rollback(BackupSnapshot snapshot) throws BackupException {
        rollback(snapshot.getPath());
    }

    /**
     * Replace the vault's contents with a snapshot. Entries matching the exclude
     * patterns were never snapshotted and are left in place. Safe to repeat.
     */
    public void rollback(Path snapshotPath) throws BackupException {
        if (!Files.exists(snapshotPath)) {
            throw fail("Backup path does not exist: " + snapshotPath, null);
        }
        if (!Files.isDirectory(snapshotPath)) {
            throw fail("Backup path is not a directory: " + snapshotPath, null);
        }
        checkBackupRootOutsideVault();

        Path vaultRoot = layout.getVaultRoot();
        long snapshotCount;
        try {
            snapshotCount = countFiles(snapshotPath, false);
        } catch (IOException e) {
            throw fail("Cannot read backup: " + snapshotPath, e);
        }
        if (snapshotCount == 0) {
            throw fail("Backup appears empty (no files found): " + snapshotPath, null);
        }

        log.info("Rolling back vault to backup: {} ({} files)", snapshotPath, snapshotCount);

        Path emergency = createEmergencyCopy();

        try {
            Files.createDirectories(vaultRoot);
            clearVault(vaultRoot);
            copyTree(snapshotPath, vaultRoot, false, StandardCopyOption.REPLACE_EXISTING);

            long restoredCount = countFiles(vaultRoot, true);
            if (restoredCount != snapshotCount) {
                log.warn("File count mismatch after rollback: backup={}, restored={}", snapshotCount, restoredCount);
            } else {
                log.info("Rollback completed successfully: {} files restored", restoredCount);
            }
        } catch (IOException e) {
            String message = "Failed to rollback vault: " + e.getMessage();
            if (emergency != null) {
                message += " (emergency backup available at " + emergency + ")";
            }
            throw fail(message, e);
        }

        if (emergency != null) {
            deletePartial(emergency);
        }
    }

    /**
     * Resolve a snapshot id (directory name under the backup root) or an absolute path.
     * Either way the result must be a snapshot directly under the backup root.
     */
    public Path resolveSnapshot(String snapshotId) throws BackupException {
        Path backupRoot = layout.getBackupRoot();
        Path candidate = Paths.get(snapshotId);
        Path resolved = (candidate.isAbsolute() ? candidate : backupRoot.resolve(candidate))
            .toAbsolutePath().normalize();

        if (!backupRoot.equals(resolved.getParent())) {
            throw fail("Snapshot is not in backup root " + backupRoot + ": " + snapshotId, null);
        }
        if (!SNAPSHOT_NAME.matcher(resolved.getFileName().toString()).matches()) {
            throw fail("Not a snapshot name: " + snapshotId, null);
        }
        return resolved;
    }

    /**
     * Snapshot directories under the backup root, newest first.
     */
    public List<Path> listBackups() throws BackupException {
        Path backupRoot = layout.getBackupRoot();
        if (!Files.isDirectory(backupRoot)) {
            return List.of();
        }

        try (Stream<Path> entries = Files.list(backupRoot)) {
            return entries
                .filter(Files::isDirectory)
                .filter(p -> !p.getFileName().toString().startsWith(EMERGENCY_PREFIX))
                .filter(p -> SNAPSHOT_NAME.matcher(p.getFileName().toString()).matches())
                .sorted(Comparator.comparing(BackupManager::sortKey).reversed())
                .toList();
        } catch (IOException e) {
            throw fail("Cannot list backups in " + backupRoot, e);
        }
    }

    /**
     * Delete all but the {@code keep} newest snapshots.
     */
    public PruneResult pruneBackups(int keep, boolean dryRun) throws BackupException {
        if (keep < 0) {
            throw new IllegalArgumentException("keep must be >= 0");
        }

        List<Path> backups = listBackups();
        List<Path> kept = backups.subList(0, Math.min(keep, backups.size()));
        List<Path> pruned = backups.subList(Math.min(keep, backups.size()), backups.size());

        if (!dryRun) {
            for (Path backup : pruned) {
                try {
                    deleteTree(backup);
                    log.info("Pruned backup: {}", backup);
                } catch (IOException e) {
                    throw fail("Failed to prune backup " + backup, e);
                }
            }
        }

        log.info("Backup retention: found={}, keep={}, pruned={}{}",
            backups.size(), keep, pruned.size(), dryRun ? " (dry run)" : "");

        return PruneResult.builder()
            .found(backups.size())
            .keep(keep)
            .dryRun(dryRun)
            .kept(List.copyOf(kept))
            .pruned(List.copyOf(pruned))
            .build();
    }

    private void checkBackupRootOutsideVault() throws BackupException {
        Path vaultRoot = layout.getVaultRoot();
        Path backupRoot = layout.getBackupRoot();
        if (backupRoot.startsWith(vaultRoot)) {
            throw fail("Backup target is inside source vault (" + backupRoot
                + "); refusing recursive backup", null);
        }
    }

    private Path createEmergencyCopy() {
        Path vaultRoot = layout.getVaultRoot();
        if (!Files.isDirectory(vaultRoot)) {
            return null;
        }

        Path emergency = null;
        try {
            Files.createDirectories(layout.getBackupRoot());
            emergency = createUniqueDirectory(layout.getBackupRoot(), EMERGENCY_PREFIX + TIMESTAMP_FORMAT.format(Instant.now()));
            copyTree(vaultRoot, emergency, true);
            log.info("Emergency backup created: {}", emergency);
            return emergency;
        } catch (IOException e) {
            // Rollback proceeds without the safety copy
            log.warn("Failed to create emergency backup: {}", e.getMessage());
            if (emergency != null) {
                deletePartial(emergency);
            }
            return null;
        }
    }

    private Path createUniqueDirectory(Path parent, String baseName) throws IOException {
        Path candidate = parent.resolve(baseName);
        int counter = 0;
        while (true) {
            try {
                return Files.createDirectory(candidate);
            } catch (FileAlreadyExistsException e) {
                counter++;
                candidate = parent.resolve(String.format("%s-%02d", baseName, counter));
            }
        }
    }

    /**
     * Delete everything in the vault except excluded entries (and the directories holding them).
     */
    private void clearVault(Path vaultRoot) throws IOException {
        Files.walkFileTree(vaultRoot, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(vaultRoot) && layout.isExcluded(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (!layout.isExcluded(file)) {
                    Files.delete(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                if (!dir.equals(vaultRoot)) {
                    try {
                        Files.delete(dir);
                    } catch (DirectoryNotEmptyException e) {
                        log.debug("Keeping {}: holds excluded entries", dir);
                    }
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void copyTree(Path source, Path target, boolean applyExcludes, CopyOption... extraOptions) throws IOException {
        List<CopyOption> options = new ArrayList<>(List.of(StandardCopyOption.COPY_ATTRIBUTES, LinkOption.NOFOLLOW_LINKS));
        options.addAll(List.of(extraOptions));
        CopyOption[] copyOptions = options.toArray(new CopyOption[0]);

        Files.walkFileTree(source, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                if (applyExcludes && !dir.equals(source) && layout.isExcluded(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                Files.createDirectories(target.resolve(source.relativize(dir).toString()));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (applyExcludes && layout.isExcluded(file)) {
                    return FileVisitResult.CONTINUE;
                }
                Files.copy(file, target.resolve(source.relativize(file).toString()), copyOptions);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private long countFiles(Path root, boolean applyExcludes) throws IOException {
        long[] count = {0};
        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (applyExcludes && !dir.equals(root) && layout.isExcluded(dir)) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (!(applyExcludes && layout.isExcluded(file))) {
                    count[0]++;
                }
                return FileVisitResult.CONTINUE;
            }
        });
        return count[0];
    }

    private static void deleteTree(Path root) throws IOException {
        Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) {
                    throw exc;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    private void deletePartial(Path path) {
        try {
            deleteTree(path);
            log.info("Cleaned up {}", path);
        } catch (IOException e) {
            log.warn("Failed to clean up {}: {}", path, e.getMessage());
        }
    }

    private static String sortKey(Path snapshot) {
        Matcher matcher = SNAPSHOT_NAME.matcher(snapshot.getFileName().toString());
        if (!matcher.matches()) {
            return "";
        }
        String counter = matcher.group(3) != null ? matcher.group(3) : "";
        return matcher.group(2) + "-" + String.format("%6s", counter).replace(' ', '0');
    }

    private BackupException fail(String message, Throwable cause) {
        log.error(message);
        return new BackupException(message, cause);
    }
}
