package com.dcruver.organizer.config;

import com.dcruver.organizer.domain.NoteType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves vault locations from {@link OrganizerProperties}.
 * All note paths handed around the organizer are vault-relative strings with '/' separators.
 */
@Component
@Slf4j
public class VaultLayout {

    private final Path vaultRoot;
    private final Path backupRoot;
    private final Path reportsRoot;
    private final String noteExtension;
    private final List<String> scanDirectories;
    private final Map<NoteType, String> typeDirectories = new EnumMap<>(NoteType.class);
    private final List<PathMatcher> excludeMatchers;

    public VaultLayout(OrganizerProperties properties) {
        this.vaultRoot = Paths.get(expandHome(properties.getVaultPath())).toAbsolutePath().normalize();

        String backupPath = properties.getBackupPath();
        this.backupRoot = backupPath == null || backupPath.isBlank()
            ? Paths.get(System.getProperty("user.home"), "backups", vaultName(vaultRoot)).toAbsolutePath().normalize()
            : Paths.get(expandHome(backupPath)).toAbsolutePath().normalize();

        String reportsPath = properties.getReportsPath();
        this.reportsRoot = reportsPath == null || reportsPath.isBlank()
            ? null
            : Paths.get(expandHome(reportsPath)).toAbsolutePath().normalize();

        this.noteExtension = properties.getNoteExtension().toLowerCase(Locale.ROOT);

        for (NoteType type : NoteType.values()) {
            String override = properties.getTypeDirectories().get(type.getValue());
            typeDirectories.put(type, override != null && !override.isBlank()
                ? normalizeRelative(override)
                : type.getDefaultDirectory());
        }

        List<String> configured = properties.getScanDirectories();
        if (configured == null) {
            Set<String> defaults = new LinkedHashSet<>();
            defaults.add(normalizeRelative(properties.getInboxDirectory()));
            defaults.addAll(typeDirectories.values());
            configured = new ArrayList<>(defaults);
        }
        this.scanDirectories = configured.stream()
            .map(VaultLayout::normalizeRelative)
            .filter(dir -> !dir.isEmpty())
            .toList();

        this.excludeMatchers = properties.getExcludePatterns().stream()
            .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
            .toList();

        log.debug("Vault layout: root={}, backups={}, types={}", vaultRoot, backupRoot, typeDirectories);
    }

    public Path getVaultRoot() {
        return vaultRoot;
    }

    public Path getBackupRoot() {
        return backupRoot;
    }

    /**
     * Directory for JSON execution reports, or null when reporting is disabled.
     */
    public Path getReportsRoot() {
        return reportsRoot;
    }

    public List<String> getScanDirectories() {
        return scanDirectories;
    }

    public String getNoteExtension() {
        return noteExtension;
    }

    public String getVaultName() {
        return vaultName(vaultRoot);
    }

    /**
     * Canonical vault-relative directory for a note type.
     */
    public String directoryFor(NoteType type) {
        return typeDirectories.get(type);
    }

    /**
     * Resolve a vault-relative path, refusing anything that escapes the vault.
     */
    public Path resolve(String relativePath) {
        String normalized = normalizeRelative(relativePath);
        if (normalized.isEmpty()) {
            return vaultRoot;
        }
        Path resolved = vaultRoot.resolve(normalized).normalize();
        if (!resolved.startsWith(vaultRoot)) {
            throw new IllegalArgumentException("Path escapes vault root: " + relativePath);
        }
        return resolved;
    }

    public String relativize(Path absolutePath) {
        return vaultRoot.relativize(absolutePath.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    public boolean isNoteFile(String fileName) {
        return fileName.toLowerCase(Locale.ROOT).endsWith(noteExtension);
    }

    /**
     * Whether a file or directory name matches one of the exclude patterns.
     */
    public boolean isExcluded(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return false;
        }
        for (PathMatcher matcher : excludeMatchers) {
            if (matcher.matches(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether a note at this path is a candidate for moving.
     */
    public boolean isInScanScope(String relativePath) {
        if (scanDirectories.isEmpty()) {
            return true;
        }
        for (String dir : scanDirectories) {
            if (isWithin(relativePath, dir)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True when relativePath is dir itself or anything below it.
     */
    public static boolean isWithin(String relativePath, String dir) {
        return relativePath.equals(dir) || relativePath.startsWith(dir + "/");
    }

    public static String parentOf(String relativePath) {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? "" : relativePath.substring(0, slash);
    }

    public static String fileNameOf(String relativePath) {
        int slash = relativePath.lastIndexOf('/');
        return slash < 0 ? relativePath : relativePath.substring(slash + 1);
    }

    public static String join(String dir, String fileName) {
        return dir.isEmpty() ? fileName : dir + "/" + fileName;
    }

    /**
     * File name without its last extension.
     */
    public static String stemOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }

    public static String normalizeRelative(String path) {
        if (path == null) {
            return "";
        }
        String normalized = path.replace('\\', '/').trim();
        while (normalized.startsWith("/")) {
            normalized = normalized.substring(1);
        }
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private static String vaultName(Path root) {
        Path name = root.getFileName();
        return name != null ? name.toString() : "vault";
    }

    private static String expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return System.getProperty("user.home") + path.substring(1);
        }
        return path.replace("${user.home}", System.getProperty("user.home"));
    }
}
