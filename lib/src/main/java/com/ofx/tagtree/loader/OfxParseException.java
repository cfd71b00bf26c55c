package com.ofx.tagtree.loader;

import com.ofx.tagtree.loader.ast.SourceLocation;

/**
 * Checked exception signalling that an OFX document was rejected. Subclasses identify the kind of
 * structural or validation problem; all of them abort the whole parse or conversion.
 */
public class OfxParseException extends Exception {
    private final String tag;
    private final SourceLocation location;

    public OfxParseException(String message) {
        this(message, null, null);
    }

    public OfxParseException(String message, Throwable cause) {
        super(message, cause);
        this.tag = null;
        this.location = null;
    }

    public OfxParseException(String message, String tag, SourceLocation location) {
        super(location == null ? message : message + " (" + location + ")");
        this.tag = tag;
        this.location = location;
    }

    /** Tag name the problem was detected on, or {@code null} when none applies. */
    public String getTag() {
        return tag;
    }

    public SourceLocation getLocation() {
        return location;
    }
}
