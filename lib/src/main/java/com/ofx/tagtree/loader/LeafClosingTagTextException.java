package com.ofx.tagtree.loader;

import com.ofx.tagtree.loader.ast.SourceLocation;

/** A closing tag was followed by text, which only opening tags of data elements may carry. */
public final class LeafClosingTagTextException extends OfxParseException {
    private final String trailingText;

    public LeafClosingTagTextException(String closeTag, String trailingText, SourceLocation location) {
        super("</" + closeTag + "> is a closing tag but carries trailing text '" + trailingText + "'",
                closeTag,
                location);
        this.trailingText = trailingText;
    }

    public String getTrailingText() {
        return trailingText;
    }
}
