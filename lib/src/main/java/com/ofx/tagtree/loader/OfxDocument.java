package com.ofx.tagtree.loader;

import com.ofx.tagtree.loader.ast.TagNode;
import java.util.Objects;

/** A loaded OFX document: its header and the root of its parsed body. */
public final class OfxDocument {
    private final OfxHeader header;
    private final TagNode root;

    public OfxDocument(OfxHeader header, TagNode root) {
        this.header = Objects.requireNonNull(header, "header");
        this.root = Objects.requireNonNull(root, "root");
    }

    public OfxHeader getHeader() {
        return header;
    }

    public TagNode getRoot() {
        return root;
    }
}
