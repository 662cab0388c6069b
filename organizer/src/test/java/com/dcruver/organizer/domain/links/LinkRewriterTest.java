package com.dcruver.organizer.domain.links;

import com.dcruver.organizer.VaultFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for computing and applying link rewrites.
 */
class LinkRewriterTest {

    @TempDir
    Path tempDir;

    private VaultFixture vault;

    @BeforeEach
    void setUp() throws Exception {
        vault = new VaultFixture(tempDir);
    }

    private List<LinkRewrite> rewrites(Map<String, String> moves) throws Exception {
        return vault.linkRewriter.computeRewrites(moves, LinkIndex.build(vault.scanner.scan(), vault.layout));
    }

    @Test
    void testWikiNamesAreNeverRewritten() throws Exception {
        vault.note("Inbox/a.md", "permanent", "A\n");
        vault.note("Inbox/b.md", "fleeting", "See [[a]] and [[a|alias]]\n");

        assertTrue(rewrites(Map.of("Inbox/a.md", "Permanent Notes/a.md")).isEmpty());
    }

    @Test
    void testWikiPathFollowsMovedTarget() throws Exception {
        vault.note("Inbox/a.md", "permanent", "A\n");
        vault.note("Literature Notes/b.md", "literature", "See [[Inbox/a#Intro|A]] and [[Inbox/a.md]]\n");

        List<LinkRewrite> rewrites = rewrites(Map.of("Inbox/a.md", "Permanent Notes/a.md"));

        assertEquals(2, rewrites.size());
        assertEquals("[[Permanent Notes/a#Intro|A]]", rewrites.get(0).getNewText());
        assertEquals("[[Permanent Notes/a.md]]", rewrites.get(1).getNewText());
        assertEquals("Literature Notes/b.md", rewrites.get(0).getSourcePath());
        assertEquals("Inbox/a.md", rewrites.get(0).getTargetPath());
    }

    @Test
    void testRelativeLinkFromMovedNoteChangingDepth() throws Exception {
        vault.note("Inbox/Projects/a.md", "permanent", "![img](../../attachments/p.png) [c](../c.md)\n");
        vault.note("Inbox/c.md", "fleeting", "C\n");
        vault.write("attachments/p.png", "PNG");

        List<LinkRewrite> rewrites = rewrites(Map.of("Inbox/Projects/a.md", "Permanent Notes/a.md"));

        assertEquals(2, rewrites.size());
        Map<String, String> byOld = Map.of(
            rewrites.get(0).getOldText(), rewrites.get(0).getNewText(),
            rewrites.get(1).getOldText(), rewrites.get(1).getNewText());
        assertEquals("![img](../attachments/p.png)", byOld.get("![img](../../attachments/p.png)"));
        assertEquals("[c](../Inbox/c.md)", byOld.get("[c](../c.md)"));
    }

    @Test
    void testSameDepthMoveNeedsNoRewrite() throws Exception {
        vault.note("Inbox/a.md", "permanent", "[img](../attachments/p.png)\n");
        vault.write("attachments/p.png", "PNG");

        assertTrue(rewrites(Map.of("Inbox/a.md", "Permanent Notes/a.md")).isEmpty());
    }

    @Test
    void testBothEndpointsMoving() throws Exception {
        vault.note("Inbox/a.md", "permanent", "[b](<b note.md>)\n");
        vault.note("Inbox/b note.md", "literature", "B\n");

        List<LinkRewrite> rewrites = rewrites(Map.of(
            "Inbox/a.md", "Permanent Notes/a.md",
            "Inbox/b note.md", "Literature Notes/b note.md"));

        assertEquals(1, rewrites.size());
        assertEquals("[b](<../Literature Notes/b note.md>)", rewrites.get(0).getNewText());
    }

    @Test
    void testApplyTouchesBodyOnly() {
        String content = "---\ntype: permanent\nsee: \"[x](../Inbox/a.md)\"\n---\nLink [x](../Inbox/a.md) twice [x](../Inbox/a.md)\n";
        LinkRewrite rewrite = new LinkRewrite("Literature Notes/b.md", "Inbox/a.md",
            "[x](../Inbox/a.md)", "[x](../Permanent Notes/a.md)");

        String updated = vault.linkRewriter.apply(content, List.of(rewrite));

        assertTrue(updated.startsWith("---\ntype: permanent\nsee: \"[x](../Inbox/a.md)\"\n---\n"), updated);
        assertTrue(updated.endsWith("Link [x](../Permanent Notes/a.md) twice [x](../Permanent Notes/a.md)\n"), updated);
    }

    @Test
    void testApplyDoesNotRewriteAReplacementAgain() {
        String content = "---\ntype: permanent\n---\n[t](../../Permanent%20Notes/t.md) and [t](t.md)\n";
        List<LinkRewrite> rewrites = List.of(
            new LinkRewrite("Inbox/sub/s.md", "Permanent Notes/t.md", "[t](../../Permanent%20Notes/t.md)", "[t](t.md)"),
            new LinkRewrite("Inbox/sub/s.md", "Inbox/sub/t.md", "[t](t.md)", "[t](../Inbox/sub/t.md)"));

        String updated = vault.linkRewriter.apply(content, rewrites);

        assertEquals("---\ntype: permanent\n---\n[t](t.md) and [t](../Inbox/sub/t.md)\n", updated);
    }

    @Test
    void testApplyFailsWhenTextIsGone() {
        LinkRewrite rewrite = new LinkRewrite("b.md", "a.md", "[[Inbox/a]]", "[[Permanent Notes/a]]");

        assertThrows(IllegalStateException.class, () -> vault.linkRewriter.apply("no links here\n", List.of(rewrite)));
    }

    @Test
    void testRelativePath() {
        assertEquals("../Inbox/c.md", LinkRewriter.relativePath("Permanent Notes", "Inbox/c.md"));
        assertEquals("c.md", LinkRewriter.relativePath("Inbox", "Inbox/c.md"));
        assertEquals("Inbox/c.md", LinkRewriter.relativePath("", "Inbox/c.md"));
        assertEquals("../../x.png", LinkRewriter.relativePath("a/b", "x.png"));
        assertEquals("sub/c.md", LinkRewriter.relativePath("Inbox", "Inbox/sub/c.md"));
    }
}
