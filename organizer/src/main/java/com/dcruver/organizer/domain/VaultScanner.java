package com.dcruver.organizer.domain;

import com.dcruver.organizer.config.VaultLayout;
import com.dcruver.organizer.io.MetadataCodec;
import com.dcruver.organizer.io.MetadataParseException;
import com.dcruver.organizer.io.ParsedNote;
import com.dcruver.organizer.io.VaultFileOperations;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;

/**
 * Walks the vault and reads every note.
 * Hidden directories and excluded names are skipped. Read and parse failures are
 * recorded on the note instead of aborting the scan.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VaultScanner {

    private final VaultLayout layout;
    private final MetadataCodec metadataCodec;
    private final VaultFileOperations fileOperations;

    /**
     * Scan the vault.
     *
     * @throws IOException if the vault root is missing or cannot be walked
     */
    public VaultContents scan() throws IOException {
        Path vaultRoot = layout.getVaultRoot();
        if (!Files.isDirectory(vaultRoot)) {
            throw new IOException("Vault root is not a readable directory: " + vaultRoot);
        }

        log.info("Scanning vault at: {}", vaultRoot);

        List<String> files = new ArrayList<>();
        Files.walkFileTree(vaultRoot, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (dir.equals(vaultRoot)) {
                    return FileVisitResult.CONTINUE;
                }
                String name = dir.getFileName().toString();
                if (name.startsWith(".") || layout.isExcluded(dir) || dir.startsWith(layout.getBackupRoot())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && !layout.isExcluded(file)) {
                    files.add(layout.relativize(file));
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.warn("Cannot visit {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });

        files.sort(null);

        List<Note> notes = new ArrayList<>();
        for (String file : files) {
            if (layout.isNoteFile(VaultLayout.fileNameOf(file))) {
                notes.add(readNote(file));
            }
        }

        log.info("Found {} notes among {} files", notes.size(), files.size());
        return new VaultContents(List.copyOf(notes), List.copyOf(files));
    }

    private Note readNote(String relativePath) {
        String content;
        try {
            content = fileOperations.read(layout.resolve(relativePath));
        } catch (IOException e) {
            log.error("Failed to read note: {}", relativePath, e);
            return Note.builder()
                .path(relativePath)
                .problem("Unreadable: " + e.getMessage())
                .build();
        }

        try {
            ParsedNote parsed = metadataCodec.parse(content);
            return Note.builder()
                .path(relativePath)
                .rawContent(content)
                .frontmatter(parsed.getFrontmatter())
                .body(parsed.getBody())
                .metadataPresent(parsed.isMetadataPresent())
                .build();
        } catch (MetadataParseException e) {
            log.warn("Malformed frontmatter in {}: {}", relativePath, e.getMessage());
            return Note.builder()
                .path(relativePath)
                .rawContent(content)
                .body(content)
                .metadataPresent(true)
                .problem(e.getMessage())
                .build();
        }
    }
}
