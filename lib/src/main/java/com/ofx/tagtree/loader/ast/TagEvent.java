package com.ofx.tagtree.loader.ast;

import java.util.Objects;

/**
 * One classified tag from the scanner's event stream.
 *
 * <p>{@code LEAF} events always carry non-empty trimmed text. {@code OPEN} events carry no text and
 * set {@code inlineClose} when the source used the {@code <TAG></TAG>} empty-aggregate shorthand.
 * {@code CLOSE} events name the aggregate being closed, without the leading slash.
 */
public record TagEvent(Kind kind, String tag, String text, boolean inlineClose, SourceLocation location) {

    public enum Kind {
        LEAF,
        OPEN,
        CLOSE
    }

    public TagEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(tag, "tag");
        Objects.requireNonNull(location, "location");
    }

    public static TagEvent leaf(String tag, String text, boolean inlineClose, SourceLocation location) {
        return new TagEvent(Kind.LEAF, tag, Objects.requireNonNull(text, "text"), inlineClose, location);
    }

    public static TagEvent open(String tag, boolean inlineClose, SourceLocation location) {
        return new TagEvent(Kind.OPEN, tag, null, inlineClose, location);
    }

    public static TagEvent close(String tag, SourceLocation location) {
        return new TagEvent(Kind.CLOSE, tag, null, false, location);
    }
}
