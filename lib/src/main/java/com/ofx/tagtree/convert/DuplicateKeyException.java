package com.ofx.tagtree.convert;

import com.ofx.tagtree.loader.OfxParseException;
import com.ofx.tagtree.loader.ast.SourceLocation;

/** Two elements of one aggregate flatten to the same key. */
public final class DuplicateKeyException extends OfxParseException {
    private final String key;

    public DuplicateKeyException(String key, String aggregateTag, SourceLocation location) {
        super("<" + aggregateTag + "> contains element '" + key + "' more than once after flattening",
                aggregateTag,
                location);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
