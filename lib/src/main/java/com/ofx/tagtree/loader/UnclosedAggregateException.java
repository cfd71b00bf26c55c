package com.ofx.tagtree.loader;

import com.ofx.tagtree.loader.ast.SourceLocation;

/** The input ended while an aggregate was still open. */
public final class UnclosedAggregateException extends OfxParseException {
    public UnclosedAggregateException(String tag, SourceLocation openedAt) {
        super("<" + tag + "> is never closed", tag, openedAt);
    }
}
