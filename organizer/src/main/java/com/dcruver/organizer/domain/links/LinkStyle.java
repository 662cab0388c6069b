package com.dcruver.organizer.domain.links;

/**
 * How a reference names its target.
 */
public enum LinkStyle {
    /**
     * [[name]]: resolved by file name, survives any move unchanged
     */
    WIKI_NAME,

    /**
     * [[Folder/name]]: vault-relative path
     */
    WIKI_PATH,

    /**
     * [label](../Folder/name.md): path relative to the referencing note
     */
    MARKDOWN_PATH;

    public boolean isPathLiteral() {
        return this != WIKI_NAME;
    }
}
