package com.dcruver.organizer.domain;

import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Everything one walk of the vault found: parsed notes plus every file path,
 * both in sorted walk order.
 */
@Value
public class VaultContents {
    List<Note> notes;
    List<String> files;

    public Map<String, Note> notesByPath() {
        return notes.stream().collect(Collectors.toMap(Note::getPath, Function.identity()));
    }

    public Set<String> fileSet() {
        return Set.copyOf(files);
    }

    public long unreadableCount() {
        return notes.stream().filter(n -> !n.isReadable()).count();
    }
}
