package com.ofx.tagtree.loader;

import com.ofx.tagtree.loader.ast.SourceLocation;

/**
 * The body contains characters the tag grammar cannot lex: a {@code <} that does not start a valid
 * tag, a lower-case tag name, or a character outside {@code [A-Z1-9./]} inside a tag name.
 */
public final class InvalidMarkupException extends OfxParseException {
    private final String fragment;

    public InvalidMarkupException(String fragment, String tag, SourceLocation location) {
        super("'" + fragment + "' is not a valid OFX tag", tag, location);
        this.fragment = fragment;
    }

    /** Input from the start of the rejected token up to and including the offending character. */
    public String getFragment() {
        return fragment;
    }
}
