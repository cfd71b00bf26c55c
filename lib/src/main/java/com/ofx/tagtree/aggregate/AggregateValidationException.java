package com.ofx.tagtree.aggregate;

import com.ofx.tagtree.loader.OfxParseException;

/** An aggregate type rejected the flattened attributes it was asked to construct from. */
public final class AggregateValidationException extends OfxParseException {
    private final String element;

    public AggregateValidationException(String aggregateTag, String element, String message) {
        super("<" + aggregateTag + ">" + (element == null ? "" : " element '" + element + "'") + ": " + message,
                aggregateTag,
                null);
        this.element = element;
    }

    /** Lower-case element key that failed, or {@code null} for aggregate-level problems. */
    public String getElement() {
        return element;
    }
}
