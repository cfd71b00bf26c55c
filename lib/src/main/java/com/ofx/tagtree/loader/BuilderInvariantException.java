package com.ofx.tagtree.loader;

/**
 * Internal failure of the tree builder that does not depend on the shape of the input. This is a
 * bug, so it is unchecked and never reported as an {@link OfxParseException}.
 */
public final class BuilderInvariantException extends IllegalStateException {
    public BuilderInvariantException(String message) {
        super(message);
    }
}
