package com.dcruver.organizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vault and backup locations plus the type-to-directory layout.
 */
@Component
@ConfigurationProperties(prefix = "organizer")
@Data
public class OrganizerProperties {

    /**
     * Root of the note vault.
     */
    private String vaultPath = ".";

    /**
     * Where snapshots are written. Defaults to ~/backups/&lt;vault-name&gt; so it never
     * lands inside the vault.
     */
    private String backupPath;

    /**
     * Where JSON execution reports are written. Reports are skipped when unset.
     */
    private String reportsPath;

    /**
     * Staging directory that notes are sorted out of. Part of the default scan scope.
     */
    private String inboxDirectory = "Inbox";

    private String noteExtension = ".md";

    /**
     * Directories whose notes are classified for moves. Unset means the inbox plus every
     * type directory; empty means the whole vault. Link indexing always covers the whole vault.
     */
    private List<String> scanDirectories;

    /**
     * Overrides for the canonical directory of a note type, keyed by type value
     * (permanent, literature, fleeting).
     */
    private Map<String, String> typeDirectories = new LinkedHashMap<>();

    /**
     * Glob patterns matched against directory and file names; matches are neither
     * scanned nor backed up.
     */
    private List<String> excludePatterns = new ArrayList<>(List.of(
        ".git", "backups", ".venv", "venv", "*_env", "node_modules", "__pycache__"
    ));
}
