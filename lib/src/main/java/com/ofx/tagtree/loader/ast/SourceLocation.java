package com.ofx.tagtree.loader.ast;

import java.util.Objects;

/**
 * Position of a tag within an OFX file. Lines and columns are 1-based and count from the top of the
 * file, header included.
 *
 * <p>The body is lexed on its own, so the lexer reports positions relative to the first body
 * character. {@link #translate(int, int)} maps those onto the file using the body's origin.
 */
public final class SourceLocation {
    private final String sourceName;
    private final int line;
    private final int column;

    public SourceLocation(String sourceName, int line, int column) {
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("Positions are 1-based: " + line + ":" + column);
        }
        this.sourceName = sourceName;
        this.line = line;
        this.column = column;
    }

    /** Origin of input that is not preceded by a header. */
    public static SourceLocation startOf(String sourceName) {
        return new SourceLocation(sourceName, 1, 1);
    }

    /**
     * Treats this location as the start of the body and returns the file position of a body-relative
     * {@code bodyLine:bodyColumn}. Only the first body line is shifted horizontally.
     */
    public SourceLocation translate(int bodyLine, int bodyColumn) {
        if (bodyLine == 1) {
            return new SourceLocation(sourceName, line, column + bodyColumn - 1);
        }
        return new SourceLocation(sourceName, line + bodyLine - 1, bodyColumn);
    }

    public String getSourceName() {
        return sourceName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof SourceLocation)) {
            return false;
        }
        SourceLocation other = (SourceLocation) obj;
        return line == other.line && column == other.column && Objects.equals(sourceName, other.sourceName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceName, line, column);
    }

    @Override
    public String toString() {
        return sourceName + ":" + line + ":" + column;
    }
}
