package com.dcruver.organizer.io;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Typed frontmatter block of a note.
 * Recognized keys are lifted into fields; everything else is kept in
 * {@link #extraFields} in its original order so nothing is lost on round-trip.
 */
@Value
@Builder(toBuilder = true)
public class Frontmatter {

    public static final String KEY_CREATED = "created";
    public static final String KEY_TYPE = "type";
    public static final String KEY_STATUS = "status";
    public static final String KEY_TAGS = "tags";

    private static final Set<String> KNOWN_KEYS = Set.of(KEY_CREATED, KEY_TYPE, KEY_STATUS, KEY_TAGS);

    String type;
    String created;
    String status;
    List<String> tags;

    @Builder.Default
    Map<String, Object> extraFields = new LinkedHashMap<>();

    public static Frontmatter empty() {
        return Frontmatter.builder().build();
    }

    public static Frontmatter fromMap(Map<String, Object> fields) {
        Map<String, Object> extras = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : fields.entrySet()) {
            if (!KNOWN_KEYS.contains(entry.getKey())) {
                extras.put(entry.getKey(), entry.getValue());
            }
        }

        return Frontmatter.builder()
            .type(asString(fields.get(KEY_TYPE)))
            .created(asString(fields.get(KEY_CREATED)))
            .status(asString(fields.get(KEY_STATUS)))
            .tags(asTags(fields.get(KEY_TAGS)))
            .extraFields(extras)
            .build();
    }

    /**
     * Ordered mapping for rendering: created, type, status, tags, then extras.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (created != null) {
            map.put(KEY_CREATED, created);
        }
        if (type != null) {
            map.put(KEY_TYPE, type);
        }
        if (status != null) {
            map.put(KEY_STATUS, status);
        }
        if (tags != null) {
            map.put(KEY_TAGS, tags);
        }
        map.putAll(extraFields);
        return map;
    }

    public boolean isEmpty() {
        return created == null && type == null && status == null && tags == null && extraFields.isEmpty();
    }

    private static String asString(Object value) {
        return value == null ? null : String.valueOf(value);
    }

    private static List<String> asTags(Object value) {
        if (value == null) {
            return null;
        }
        List<String> tags = new ArrayList<>();
        if (value instanceof Collection<?> collection) {
            for (Object item : collection) {
                if (item != null) {
                    tags.add(String.valueOf(item));
                }
            }
        } else {
            for (String tag : String.valueOf(value).split("[,\\s]+")) {
                if (!tag.isBlank()) {
                    tags.add(tag);
                }
            }
        }
        return tags;
    }
}
