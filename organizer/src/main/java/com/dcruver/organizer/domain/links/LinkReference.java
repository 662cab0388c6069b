package com.dcruver.organizer.domain.links;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

/**
 * A reference found in one note, together with what it resolved to.
 */
@Value
public class LinkReference {
    String sourcePath;
    @JsonIgnore
    ParsedLink link;
    String resolvedPath;    // null when the reference does not resolve

    public String getRawText() {
        return link.getRaw();
    }

    public String getTarget() {
        return link.getTarget();
    }

    public LinkStyle getStyle() {
        return link.getStyle();
    }

    public int getLine() {
        return link.getLine();
    }

    public boolean isResolved() {
        return resolvedPath != null;
    }
}
