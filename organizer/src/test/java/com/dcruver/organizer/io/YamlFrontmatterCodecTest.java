package com.dcruver.organizer.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for splitting notes into frontmatter and body.
 */
class YamlFrontmatterCodecTest {

    private YamlFrontmatterCodec codec;

    @BeforeEach
    void setUp() {
        codec = new YamlFrontmatterCodec();
    }

    @Test
    void testParsesKnownAndExtraFields() throws Exception {
        String text = """
            ---
            title: Zettel
            type: permanent
            created: 2025-01-15
            tags: [ideas, reading]
            ---
            # Heading

            Body text.
            """;

        ParsedNote parsed = codec.parse(text);

        assertTrue(parsed.isMetadataPresent());
        Frontmatter fm = parsed.getFrontmatter();
        assertEquals("permanent", fm.getType());
        assertEquals("2025-01-15", fm.getCreated());
        assertEquals(List.of("ideas", "reading"), fm.getTags());
        assertEquals("Zettel", fm.getExtraFields().get("title"));
        assertEquals("# Heading\n\nBody text.\n", parsed.getBody());
        assertTrue(text.endsWith(parsed.getBody()), "Body should be an exact suffix of the text");
    }

    @Test
    void testNoteWithoutFrontmatter() throws Exception {
        String text = "Just a body\nwith --- inside\n";

        ParsedNote parsed = codec.parse(text);

        assertFalse(parsed.isMetadataPresent());
        assertTrue(parsed.getFrontmatter().isEmpty());
        assertEquals(text, parsed.getBody());
    }

    @Test
    void testCommaSeparatedTags() throws Exception {
        ParsedNote parsed = codec.parse("---\ntags: one, two three\n---\nbody");

        assertEquals(List.of("one", "two", "three"), parsed.getFrontmatter().getTags());
    }

    @Test
    void testUnclosedBlockIsMalformed() {
        MetadataParseException e = assertThrows(MetadataParseException.class,
            () -> codec.parse("---\ntype: permanent\nno closing line\n"));
        assertTrue(e.getMessage().contains("not closed"));
    }

    @Test
    void testInvalidYamlIsMalformed() {
        assertThrows(MetadataParseException.class,
            () -> codec.parse("---\ntype: permanent\ntags: [a, b\n---\nbody\n"));
    }

    @Test
    void testScalarFrontmatterIsMalformed() {
        assertThrows(MetadataParseException.class, () -> codec.parse("---\njust a string\n---\nbody\n"));
    }

    @Test
    void testRenderOrdersKnownKeysFirstAndKeepsExtras() throws Exception {
        ParsedNote parsed = codec.parse("---\ntitle: Zettel\ntype: literature\ncreated: 2025-01-15\n---\nBody\n");

        String rendered = codec.render(parsed.getFrontmatter(), parsed.getBody());

        assertTrue(rendered.startsWith("---\ncreated: "), rendered);
        assertTrue(rendered.indexOf("type: literature") < rendered.indexOf("title: Zettel"), rendered);
        assertTrue(rendered.endsWith("---\nBody\n"), rendered);

        ParsedNote reparsed = codec.parse(rendered);
        assertEquals(parsed.getFrontmatter(), reparsed.getFrontmatter());
        assertEquals("Body\n", reparsed.getBody());
    }

    @Test
    void testRenderWithoutMetadataReturnsBody() {
        assertEquals("plain\n", codec.render(Frontmatter.empty(), "plain\n"));
    }
}
