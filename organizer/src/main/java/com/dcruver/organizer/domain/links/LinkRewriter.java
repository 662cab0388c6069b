package com.dcruver.organizer.domain.links;

import com.dcruver.organizer.config.VaultLayout;
import com.dcruver.organizer.io.MetadataCodec;
import com.dcruver.organizer.io.MetadataParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Keeps path-style references pointing at the right file when notes move.
 * Name references resolve wherever the note lives and are left alone.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LinkRewriter {

    private final VaultLayout layout;
    private final MetadataCodec metadataCodec;

    /**
     * Rewrites needed for a set of moves.
     *
     * @param moves source path to target path
     * @return one rewrite per distinct (note, old text), sorted by note then text
     */
    public List<LinkRewrite> computeRewrites(Map<String, String> moves, LinkIndex index) {
        Map<String, LinkRewrite> rewrites = new LinkedHashMap<>();

        for (LinkReference ref : index.getReferences()) {
            if (!ref.isResolved() || !ref.getStyle().isPathLiteral()) {
                continue;
            }

            String source = ref.getSourcePath();
            String target = ref.getResolvedPath();
            String newSource = moves.getOrDefault(source, source);
            String newTarget = moves.getOrDefault(target, target);
            if (newSource.equals(source) && newTarget.equals(target)) {
                continue;
            }

            String newText = ref.getLink().rebuild(targetText(ref.getLink(), newSource, newTarget));
            if (newText.equals(ref.getRawText())) {
                continue;
            }

            rewrites.putIfAbsent(source + '\u0000' + ref.getRawText(),
                new LinkRewrite(source, target, ref.getRawText(), newText));
        }

        List<LinkRewrite> sorted = new ArrayList<>(rewrites.values());
        sorted.sort(Comparator.comparing(LinkRewrite::getSourcePath).thenComparing(LinkRewrite::getOldText));
        log.debug("Computed {} link rewrites for {} moves", sorted.size(), moves.size());
        return sorted;
    }

    /**
     * Apply rewrites to note text. Only the body changes; the metadata block is kept byte for byte.
     *
     * @throws IllegalStateException if a rewrite's old text is no longer in the body
     */
    public String apply(String content, List<LinkRewrite> rewrites) {
        if (rewrites.isEmpty()) {
            return content;
        }

        String body;
        try {
            body = metadataCodec.parse(content).getBody();
        } catch (MetadataParseException e) {
            body = content;
        }
        String header = content.substring(0, content.length() - body.length());

        Map<String, String> replacements = new HashMap<>();
        for (LinkRewrite rewrite : rewrites) {
            replacements.put(rewrite.getOldText(), rewrite.getNewText());
        }

        // Single pass over link positions so a replacement is never rewritten again
        StringBuilder rewritten = new StringBuilder(body.length());
        Set<String> matched = new HashSet<>();
        int cursor = 0;
        for (ParsedLink link : LinkParser.parse(body)) {
            String replacement = replacements.get(link.getRaw());
            if (replacement == null || link.getOffset() < cursor) {
                continue;
            }
            rewritten.append(body, cursor, link.getOffset()).append(replacement);
            cursor = link.getOffset() + link.getRaw().length();
            matched.add(link.getRaw());
        }
        rewritten.append(body, cursor, body.length());

        for (LinkRewrite rewrite : rewrites) {
            if (!matched.contains(rewrite.getOldText())) {
                throw new IllegalStateException("Link text not found in " + rewrite.getSourcePath()
                    + ": " + rewrite.getOldText());
            }
        }
        return header + rewritten;
    }

    private String targetText(ParsedLink link, String newSource, String newTarget) {
        if (link.getStyle() == LinkStyle.WIKI_PATH) {
            boolean explicitExtension = link.getTarget().toLowerCase(Locale.ROOT).endsWith(layout.getNoteExtension());
            if (!explicitExtension && layout.isNoteFile(newTarget)) {
                return newTarget.substring(0, newTarget.length() - layout.getNoteExtension().length());
            }
            return newTarget;
        }

        String relative = relativePath(VaultLayout.parentOf(newSource), newTarget);
        if (link.getTarget().startsWith("./") && !relative.startsWith("../")) {
            return "./" + relative;
        }
        return relative;
    }

    /**
     * Path of 'to' as seen from directory 'fromDir', both vault-relative.
     */
    static String relativePath(String fromDir, String to) {
        String[] from = fromDir.isEmpty() ? new String[0] : fromDir.split("/");
        String[] dest = to.split("/");

        int common = 0;
        while (common < from.length && common < dest.length - 1 && from[common].equals(dest[common])) {
            common++;
        }

        StringBuilder relative = new StringBuilder();
        for (int i = common; i < from.length; i++) {
            relative.append("../");
        }
        for (int i = common; i < dest.length; i++) {
            relative.append(dest[i]);
            if (i < dest.length - 1) {
                relative.append('/');
            }
        }
        return relative.toString();
    }
}
