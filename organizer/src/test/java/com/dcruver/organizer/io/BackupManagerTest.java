package com.dcruver.organizer.io;

import com.dcruver.organizer.VaultFixture;
import com.dcruver.organizer.config.OrganizerProperties;
import com.dcruver.organizer.config.VaultLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for snapshots, rollback and retention.
 */
class BackupManagerTest {

    @TempDir
    Path tempDir;

    private VaultFixture vault;
    private BackupManager backupManager;

    @BeforeEach
    void setUp() throws Exception {
        vault = new VaultFixture(tempDir);
        backupManager = vault.backupManager;

        vault.note("Inbox/a.md", "permanent", "Alpha\n");
        vault.write(".obsidian/app.json", "{\"theme\":\"dark\"}");
        vault.write(".hidden-note.md", "hidden\n");
        vault.write("attachments/diagram.png", "PNG-bytes");
    }

    @Test
    void testBackupCopiesHiddenFiles() throws Exception {
        BackupSnapshot snapshot = backupManager.createBackup();

        assertTrue(snapshot.getId().startsWith("vault-"));
        assertEquals(4, snapshot.getFileCount());
        assertTrue(Files.exists(snapshot.getPath().resolve(".obsidian/app.json")));
        assertTrue(Files.exists(snapshot.getPath().resolve(".hidden-note.md")));
        assertEquals("PNG-bytes", Files.readString(snapshot.getPath().resolve("attachments/diagram.png")));
    }

    @Test
    void testTwoBackupsGetDistinctNames() throws Exception {
        BackupSnapshot first = backupManager.createBackup();
        BackupSnapshot second = backupManager.createBackup();

        assertNotEquals(first.getId(), second.getId());
        assertNotEquals(first.getPath(), second.getPath());
    }

    @Test
    void testBackupRootInsideVaultIsRefused() throws Exception {
        OrganizerProperties properties = new OrganizerProperties();
        properties.setVaultPath(vault.vault.toString());
        properties.setBackupPath(vault.vault.resolve("snapshots").toString());
        BackupManager nested = new BackupManager(new VaultLayout(properties));

        BackupException e = assertThrows(BackupException.class, nested::createBackup);
        assertTrue(e.getMessage().contains("inside source vault"));
        assertFalse(Files.exists(vault.vault.resolve("snapshots")));
    }

    @Test
    void testMissingVaultIsRefused() {
        OrganizerProperties properties = new OrganizerProperties();
        properties.setVaultPath(tempDir.resolve("no-such-vault").toString());
        properties.setBackupPath(tempDir.resolve("elsewhere").toString());
        BackupManager missing = new BackupManager(new VaultLayout(properties));

        assertThrows(BackupException.class, missing::createBackup);
    }

    @Test
    void testExcludedEntriesAreNotBackedUp() throws Exception {
        vault.write(".git/HEAD", "ref: refs/heads/main\n");
        vault.write("node_modules/pkg/index.js", "module.exports = {}\n");

        BackupSnapshot snapshot = backupManager.createBackup();

        assertFalse(Files.exists(snapshot.getPath().resolve(".git")));
        assertFalse(Files.exists(snapshot.getPath().resolve("node_modules")));
        assertEquals(4, snapshot.getFileCount());
    }

    @Test
    void testRollbackRestoresExactTree() throws Exception {
        Map<String, String> before = vault.tree();
        BackupSnapshot snapshot = backupManager.createBackup();

        // Mutate: edit, delete, add, move
        vault.write("Inbox/a.md", "changed");
        Files.delete(vault.vault.resolve(".hidden-note.md"));
        vault.write("Permanent Notes/new.md", "new\n");
        Files.move(vault.vault.resolve("attachments/diagram.png"), vault.vault.resolve("diagram.png"));

        backupManager.rollback(snapshot);

        assertEquals(before, vault.tree());
    }

    @Test
    void testRollbackIsIdempotent() throws Exception {
        Map<String, String> before = vault.tree();
        BackupSnapshot snapshot = backupManager.createBackup();
        vault.write("Inbox/extra.md", "extra");

        backupManager.rollback(snapshot);
        backupManager.rollback(snapshot);

        assertEquals(before, vault.tree());
    }

    @Test
    void testRollbackKeepsExcludedEntries() throws Exception {
        BackupSnapshot snapshot = backupManager.createBackup();
        vault.write(".git/HEAD", "ref: refs/heads/main\n");

        backupManager.rollback(snapshot);

        assertEquals("ref: refs/heads/main\n", vault.read(".git/HEAD"));
    }

    @Test
    void testRollbackDiscardsEmergencyCopyOnSuccess() throws Exception {
        BackupSnapshot snapshot = backupManager.createBackup();

        backupManager.rollback(snapshot);

        try (var entries = Files.list(vault.backups)) {
            assertTrue(entries.noneMatch(p -> p.getFileName().toString().startsWith("emergency-")));
        }
    }

    @Test
    void testRollbackFromMissingSnapshotFails() throws Exception {
        Map<String, String> before = vault.tree();

        assertThrows(BackupException.class, () -> backupManager.rollback(vault.backups.resolve("vault-20000101000000")));
        assertEquals(before, vault.tree());
    }

    @Test
    void testListNewestFirstAndPrune() throws Exception {
        Files.createDirectories(vault.backups.resolve("vault-20250101000000"));
        Files.createDirectories(vault.backups.resolve("vault-20250301000000"));
        Files.createDirectories(vault.backups.resolve("vault-20250201000000"));
        Files.createDirectories(vault.backups.resolve("emergency-before-rollback-20250401000000"));
        Files.createDirectories(vault.backups.resolve("unrelated"));

        List<Path> backups = backupManager.listBackups();
        assertEquals(List.of("vault-20250301000000", "vault-20250201000000", "vault-20250101000000"),
            backups.stream().map(p -> p.getFileName().toString()).toList());

        PruneResult dryRun = backupManager.pruneBackups(1, true);
        assertEquals(3, dryRun.getFound());
        assertEquals(2, dryRun.getPruned().size());
        assertTrue(Files.exists(vault.backups.resolve("vault-20250101000000")));

        PruneResult pruned = backupManager.pruneBackups(1, false);
        assertEquals(List.of(vault.backups.resolve("vault-20250301000000")), pruned.getKept());
        assertFalse(Files.exists(vault.backups.resolve("vault-20250201000000")));
        assertFalse(Files.exists(vault.backups.resolve("vault-20250101000000")));
        assertTrue(Files.exists(vault.backups.resolve("unrelated")));
    }

    @Test
    void testRollbackFromEmptySnapshotIsRefused() throws Exception {
        Path empty = Files.createDirectories(vault.backups.resolve("vault-20250101000000"));
        Files.createDirectories(empty.resolve("Inbox"));
        Map<String, String> before = vault.tree();

        BackupException e = assertThrows(BackupException.class, () -> backupManager.rollback(empty));

        assertTrue(e.getMessage().contains("empty"), e.getMessage());
        assertEquals(before, vault.tree());
    }

    @Test
    void testResolveSnapshotById() throws Exception {
        Path expected = vault.backups.resolve("vault-20250101000000").toAbsolutePath().normalize();

        assertEquals(expected, backupManager.resolveSnapshot("vault-20250101000000"));
        assertEquals(expected, backupManager.resolveSnapshot(expected.toString()));
    }

    @Test
    void testResolveSnapshotRejectsPathsOutsideBackupRoot() {
        assertThrows(BackupException.class, () -> backupManager.resolveSnapshot("../vault"));
        assertThrows(BackupException.class, () -> backupManager.resolveSnapshot("../vault/Inbox"));
        assertThrows(BackupException.class, () -> backupManager.resolveSnapshot("vault-20250101000000/Inbox"));
        assertThrows(BackupException.class,
            () -> backupManager.resolveSnapshot(tempDir.resolve("vault-20250101000000").toString()));
        assertThrows(BackupException.class, () -> backupManager.resolveSnapshot("unrelated"));
    }
}
