package com.ofx.tagtree.convert;

import com.ofx.tagtree.loader.OfxParseException;
import com.ofx.tagtree.loader.ast.SourceLocation;

/** An aggregate contains both a {@code CURRENCY} and an {@code ORIGCURRENCY} aggregate. */
public final class AmbiguousCurrencyException extends OfxParseException {
    public AmbiguousCurrencyException(String aggregateTag, SourceLocation location) {
        super("<" + aggregateTag + "> may not contain both <CURRENCY> and <ORIGCURRENCY>", aggregateTag, location);
    }
}
