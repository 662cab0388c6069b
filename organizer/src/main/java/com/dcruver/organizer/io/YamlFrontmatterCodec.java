package com.dcruver.organizer.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * YAML frontmatter delimited by "---" lines.
 */
@Component
public class YamlFrontmatterCodec implements MetadataCodec {

    private static final String DELIMITER = "---";

    private final ObjectMapper yamlMapper = new ObjectMapper(YAMLFactory.builder()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
        .build());

    @Override
    public ParsedNote parse(String text) throws MetadataParseException {
        String content = text != null ? text : "";
        int length = content.length();

        // Frontmatter must open on the first non-blank line
        int lineStart = 0;
        String firstLine = null;
        while (lineStart < length) {
            int lineEnd = lineEnd(content, lineStart);
            String line = content.substring(lineStart, lineEnd);
            if (!line.isBlank()) {
                firstLine = line;
                break;
            }
            lineStart = nextLine(content, lineEnd);
        }

        if (firstLine == null || !firstLine.strip().equals(DELIMITER)) {
            return ParsedNote.withoutMetadata(content);
        }

        int yamlStart = nextLine(content, lineEnd(content, lineStart));
        int cursor = yamlStart;
        while (cursor < length) {
            int lineEnd = lineEnd(content, cursor);
            if (content.substring(cursor, lineEnd).strip().equals(DELIMITER)) {
                String yaml = content.substring(yamlStart, cursor);
                String body = content.substring(nextLine(content, lineEnd));
                return ParsedNote.withMetadata(Frontmatter.fromMap(readFields(yaml)), body);
            }
            cursor = nextLine(content, lineEnd);
        }

        throw new MetadataParseException("Frontmatter block is not closed");
    }

    @Override
    public String render(Frontmatter frontmatter, String body) {
        String safeBody = body != null ? body : "";
        if (frontmatter == null || frontmatter.isEmpty()) {
            return safeBody;
        }

        try {
            String yaml = yamlMapper.writeValueAsString(frontmatter.toMap());
            return DELIMITER + "\n" + yaml + DELIMITER + "\n" + safeBody;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render frontmatter", e);
        }
    }

    private Map<String, Object> readFields(String yaml) throws MetadataParseException {
        if (yaml.isBlank()) {
            return new LinkedHashMap<>();
        }

        Object parsed;
        try {
            parsed = yamlMapper.readValue(yaml, Object.class);
        } catch (JsonProcessingException e) {
            throw new MetadataParseException("Invalid YAML in frontmatter: " + e.getOriginalMessage(), e);
        }

        if (parsed == null) {
            return new LinkedHashMap<>();
        }
        if (!(parsed instanceof Map<?, ?> raw)) {
            throw new MetadataParseException("Frontmatter is not a key-value mapping");
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        raw.forEach((key, value) -> fields.put(String.valueOf(key), value));
        return fields;
    }

    private static int lineEnd(String content, int from) {
        int newline = content.indexOf('\n', from);
        return newline < 0 ? content.length() : newline;
    }

    private static int nextLine(String content, int lineEnd) {
        return lineEnd < content.length() ? lineEnd + 1 : content.length();
    }
}
