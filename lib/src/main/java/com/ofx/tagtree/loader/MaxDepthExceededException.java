package com.ofx.tagtree.loader;

import com.ofx.tagtree.loader.ast.SourceLocation;

/** Nesting went past {@link OfxParserOptions#getMaxDepth()}. */
public final class MaxDepthExceededException extends OfxParseException {
    private final int maxDepth;

    public MaxDepthExceededException(String tag, int maxDepth, SourceLocation location) {
        super("<" + tag + "> exceeds the maximum nesting depth of " + maxDepth, tag, location);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
