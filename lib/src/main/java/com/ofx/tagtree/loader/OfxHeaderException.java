package com.ofx.tagtree.loader;

/** The header block in front of the OFX body is missing, malformed, or declares an unsupported version. */
public final class OfxHeaderException extends OfxParseException {
    public OfxHeaderException(String message) {
        super(message);
    }
}
