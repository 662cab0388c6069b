package com.dcruver.organizer.domain.links;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts cross-document references from a note body.
 */
public final class LinkParser {

    private static final Pattern WIKI_LINK = Pattern.compile("(!?)\\[\\[([^\\[\\]\\n]+?)\\]\\]");
    private static final Pattern MARKDOWN_LINK = Pattern.compile(
        "(!?)\\[([^\\]\\n]*)\\]\\((<[^>\\n]+>|[^)\\s]+)(\\s+\"[^\"\\n]*\")?\\)");
    private static final Pattern URI_SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:");

    private LinkParser() {
    }

    public static List<ParsedLink> parse(String body) {
        if (body == null || body.isEmpty()) {
            return List.of();
        }

        List<ParsedLink> found = new ArrayList<>();

        Matcher wiki = WIKI_LINK.matcher(body);
        while (wiki.find()) {
            ParsedLink link = parseWiki(wiki, lineOf(body, wiki.start()));
            if (link != null) {
                found.add(link);
            }
        }

        Matcher markdown = MARKDOWN_LINK.matcher(body);
        while (markdown.find()) {
            ParsedLink link = parseMarkdown(markdown, lineOf(body, markdown.start()));
            if (link != null) {
                found.add(link);
            }
        }

        found.sort(Comparator.comparingInt(ParsedLink::getOffset));
        return found;
    }

    private static ParsedLink parseWiki(Matcher matcher, int line) {
        String inner = matcher.group(2);

        int cut = inner.length();
        int pipe = inner.indexOf('|');
        int hash = inner.indexOf('#');
        if (pipe >= 0) {
            cut = pipe;
        }
        if (hash >= 0 && hash < cut) {
            cut = hash;
        }
        // Escaped pipe inside tables: [[name\|alias]]
        if (cut > 0 && cut < inner.length() && inner.charAt(cut - 1) == '\\') {
            cut--;
        }

        String rawTarget = inner.substring(0, cut);
        String target = rawTarget.trim();
        if (target.isEmpty()) {
            return null;   // [[#heading]] points into the same note
        }

        return ParsedLink.builder()
            .raw(matcher.group())
            .style(target.contains("/") ? LinkStyle.WIKI_PATH : LinkStyle.WIKI_NAME)
            .embed(!matcher.group(1).isEmpty())
            .target(target)
            .rawTarget(rawTarget)
            .suffix(inner.substring(cut))
            .label("")
            .title("")
            .offset(matcher.start())
            .line(line)
            .build();
    }

    private static ParsedLink parseMarkdown(Matcher matcher, int line) {
        String destination = matcher.group(3);
        boolean angle = destination.startsWith("<");
        if (angle) {
            destination = destination.substring(1, destination.length() - 1);
        }

        int hash = destination.indexOf('#');
        String path = hash >= 0 ? destination.substring(0, hash) : destination;
        String anchor = hash >= 0 ? destination.substring(hash) : "";

        if (path.isEmpty() || path.startsWith("/") || URI_SCHEME.matcher(path).find()) {
            return null;
        }

        boolean encoded = path.contains("%20");
        return ParsedLink.builder()
            .raw(matcher.group())
            .style(LinkStyle.MARKDOWN_PATH)
            .embed(!matcher.group(1).isEmpty())
            .target(encoded ? path.replace("%20", " ") : path)
            .rawTarget(path)
            .suffix(anchor)
            .label(matcher.group(2))
            .title(matcher.group(4) != null ? matcher.group(4) : "")
            .angleBracketed(angle)
            .percentEncoded(encoded)
            .offset(matcher.start())
            .line(line)
            .build();
    }

    private static int lineOf(String body, int offset) {
        int line = 1;
        for (int i = 0; i < offset; i++) {
            if (body.charAt(i) == '\n') {
                line++;
            }
        }
        return line;
    }
}
