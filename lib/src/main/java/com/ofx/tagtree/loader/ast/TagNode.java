package com.ofx.tagtree.loader.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Node of a parsed OFX tree. A node is either a data-bearing leaf ("element") whose text is its
 * value, or an aggregate holding an ordered list of children. Leaves never have children.
 */
public final class TagNode {
    private final String tag;
    private final String text;
    private final SourceLocation location;
    private final List<TagNode> children = new ArrayList<>();

    private TagNode(String tag, String text, SourceLocation location) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.text = text;
        this.location = location;
    }

    public static TagNode aggregate(String tag, SourceLocation location) {
        return new TagNode(tag, null, location);
    }

    public static TagNode aggregate(String tag) {
        return aggregate(tag, null);
    }

    public static TagNode leaf(String tag, String text, SourceLocation location) {
        Objects.requireNonNull(text, "text");
        if (text.trim().isEmpty()) {
            throw new IllegalArgumentException("Leaf <" + tag + "> requires non-blank text");
        }
        return new TagNode(tag, text, location);
    }

    public static TagNode leaf(String tag, String text) {
        return leaf(tag, text, null);
    }

    public String getTag() {
        return tag;
    }

    /** Text of a data-bearing leaf, or {@code null} for aggregates. */
    public String getText() {
        return text;
    }

    public boolean isLeaf() {
        return text != null;
    }

    /** Where the opening tag appeared, or {@code null} for nodes built by hand. */
    public SourceLocation getLocation() {
        return location;
    }

    public List<TagNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public TagNode addChild(TagNode child) {
        Objects.requireNonNull(child, "child");
        if (isLeaf()) {
            throw new IllegalStateException("Leaf <" + tag + "> cannot contain <" + child.tag + ">");
        }
        if (child == this) {
            throw new IllegalArgumentException("<" + tag + "> cannot contain itself");
        }
        children.add(child);
        return this;
    }

    public boolean removeChild(TagNode child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                children.remove(i);
                return true;
            }
        }
        return false;
    }

    /** First direct child with the given tag, or {@code null}. */
    public TagNode findChild(String childTag) {
        for (TagNode child : children) {
            if (child.tag.equals(childTag)) {
                return child;
            }
        }
        return null;
    }

    public List<TagNode> findChildren(String childTag) {
        List<TagNode> matches = new ArrayList<>();
        for (TagNode child : children) {
            if (child.tag.equals(childTag)) {
                matches.add(child);
            }
        }
        return matches;
    }

    /** First strict descendant with the given tag in document order, or {@code null}. */
    public TagNode findDescendant(String descendantTag) {
        for (TagNode child : children) {
            if (child.tag.equals(descendantTag)) {
                return child;
            }
            TagNode nested = child.findDescendant(descendantTag);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    /** This node and all descendants with the given tag, in document order. */
    public List<TagNode> findAll(String matchTag) {
        List<TagNode> matches = new ArrayList<>();
        collect(matchTag, matches);
        return matches;
    }

    private void collect(String matchTag, List<TagNode> out) {
        if (tag.equals(matchTag)) {
            out.add(this);
        }
        for (TagNode child : children) {
            child.collect(matchTag, out);
        }
    }

    @Override
    public String toString() {
        if (isLeaf()) {
            return "<" + tag + ">" + text;
        }
        return "<" + tag + "> (" + children.size() + " children)";
    }
}
