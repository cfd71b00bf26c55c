package com.ofx.tagtree.loader;

import com.ofx.tagtree.loader.ast.SourceLocation;

/** A closing tag did not match the innermost open aggregate. */
public final class TagMismatchException extends OfxParseException {
    private final String openTag;

    public TagMismatchException(String closeTag, String openTag, SourceLocation location) {
        super(
                openTag == null
                        ? "</" + closeTag + "> has no open aggregate to close"
                        : "</" + closeTag + "> does not close <" + openTag + ">",
                closeTag,
                location);
        this.openTag = openTag;
    }

    /** The aggregate that was open when the closing tag arrived, or {@code null} if none was. */
    public String getOpenTag() {
        return openTag;
    }
}
