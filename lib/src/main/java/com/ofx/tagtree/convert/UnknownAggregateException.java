package com.ofx.tagtree.convert;

import com.ofx.tagtree.loader.OfxParseException;
import com.ofx.tagtree.loader.ast.SourceLocation;

/** No aggregate type is registered for a tag. */
public final class UnknownAggregateException extends OfxParseException {
    public UnknownAggregateException(String tag, SourceLocation location) {
        super("No aggregate type is registered for <" + tag + ">", tag, location);
    }
}
