package com.dcruver.organizer.domain.links;

import com.dcruver.organizer.config.VaultLayout;
import com.dcruver.organizer.domain.Note;
import com.dcruver.organizer.domain.VaultContents;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Every reference in the vault, resolved against one scan.
 * <p>
 * Names resolve by stem (case-insensitive) against note files. When two notes share a
 * stem, the first in sorted walk order wins and the stem is reported as ambiguous.
 */
public final class LinkIndex {

    private final String noteExtension;
    private final Set<String> files;
    private final Map<String, String> notesByStem = new HashMap<>();
    private final Map<String, String> filesByName = new HashMap<>();
    private final Map<String, List<String>> ambiguousStems = new TreeMap<>();
    private final List<LinkReference> references = new ArrayList<>();

    private LinkIndex(VaultContents contents, String noteExtension) {
        this.noteExtension = noteExtension;
        this.files = contents.fileSet();

        Map<String, List<String>> stemPaths = new LinkedHashMap<>();
        for (Note note : contents.getNotes()) {
            stemPaths.computeIfAbsent(lower(note.getStem()), k -> new ArrayList<>()).add(note.getPath());
        }
        stemPaths.forEach((stem, paths) -> {
            notesByStem.put(stem, paths.get(0));
            if (paths.size() > 1) {
                ambiguousStems.put(stem, List.copyOf(paths));
            }
        });

        for (String file : contents.getFiles()) {
            filesByName.putIfAbsent(lower(VaultLayout.fileNameOf(file)), file);
        }

        for (Note note : contents.getNotes()) {
            if (note.getBody() == null) {
                continue;
            }
            for (ParsedLink link : LinkParser.parse(note.getBody())) {
                references.add(new LinkReference(note.getPath(), link, resolve(note.getPath(), link)));
            }
        }
    }

    public static LinkIndex build(VaultContents contents, VaultLayout layout) {
        return new LinkIndex(contents, layout.getNoteExtension());
    }

    /**
     * Resolve one reference written in the note at sourcePath.
     *
     * @return the vault-relative path of the target, or null
     */
    public String resolve(String sourcePath, ParsedLink link) {
        String target = link.getTarget();
        switch (link.getStyle()) {
            case WIKI_NAME: {
                String byStem = lower(target).endsWith(noteExtension)
                    ? notesByStem.get(lower(VaultLayout.stemOf(target)))
                    : notesByStem.get(lower(target));
                return byStem != null ? byStem : filesByName.get(lower(target));
            }
            case WIKI_PATH: {
                String path = VaultLayout.normalizeRelative(target);
                return existing(path);
            }
            case MARKDOWN_PATH: {
                String path = normalizeDotSegments(VaultLayout.join(VaultLayout.parentOf(sourcePath), target));
                return path == null ? null : existing(path);
            }
            default:
                return null;
        }
    }

    private String existing(String path) {
        if (files.contains(path)) {
            return path;
        }
        String withExtension = path + noteExtension;
        return files.contains(withExtension) ? withExtension : null;
    }

    public List<LinkReference> getReferences() {
        return Collections.unmodifiableList(references);
    }

    public List<LinkReference> getUnresolved() {
        return references.stream().filter(r -> !r.isResolved()).toList();
    }

    public Map<String, List<String>> getAmbiguousStems() {
        return Collections.unmodifiableMap(ambiguousStems);
    }

    /**
     * Collapse "." and ".." segments.
     *
     * @return the normalized path, or null if it climbs above the vault root
     */
    static String normalizeDotSegments(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                if (segments.isEmpty()) {
                    return null;
                }
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return String.join("/", segments);
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
