package com.ofx.tagtree.convert;

import com.ofx.tagtree.loader.MaxDepthExceededException;
import com.ofx.tagtree.loader.OfxParseException;
import com.ofx.tagtree.loader.OfxParserOptions;
import com.ofx.tagtree.loader.ast.TagNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Collapses an aggregate subtree into one level of uniquely keyed attributes.
 *
 * <p>Keys are the lower-cased tags of data elements at any depth. Every key must be unique across
 * the whole subtree: between sibling elements, between the contents of sibling aggregates, and
 * between an element and the contents of an aggregate beside it. Repeated structures (lists) can
 * therefore never be flattened and must be removed from the node first. Elements whose tag
 * contains a dot are vendor extensions; they are left out of the mapping and reported through
 * {@link FlatAttributeMap#getExtensions()}.
 */
public final class AttributeFlattener {
    private static final Logger LOGGER = Logger.getLogger(AttributeFlattener.class.getName());

    private final OfxParserOptions options;

    public AttributeFlattener() {
        this(OfxParserOptions.defaults());
    }

    public AttributeFlattener(OfxParserOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public FlatAttributeMap flatten(TagNode node) throws OfxParseException {
        return flatten(node, List.of());
    }

    /**
     * Flattens {@code node} as if the given direct children had been removed. The node itself is not
     * modified.
     */
    FlatAttributeMap flatten(TagNode node, Collection<TagNode> skippedChildren) throws OfxParseException {
        Objects.requireNonNull(node, "node");
        List<ExtensionElement> extensions = new ArrayList<>();
        Map<String, String> attributes = collect(node, skippedChildren, extensions, 1);
        return new FlatAttributeMap(attributes, extensions);
    }

    private Map<String, String> collect(
            TagNode node, Collection<TagNode> skippedChildren, List<ExtensionElement> extensions, int depth)
            throws OfxParseException {
        if (depth > options.getMaxDepth()) {
            throw new MaxDepthExceededException(node.getTag(), options.getMaxDepth(), node.getLocation());
        }
        Map<String, String> leaves = new LinkedHashMap<>();
        Map<String, String> nested = new LinkedHashMap<>();
        for (TagNode child : node.getChildren()) {
            if (containsInstance(skippedChildren, child)) {
                continue;
            }
            if (child.isLeaf()) {
                String text = child.getText().trim();
                if (child.getTag().indexOf('.') >= 0) {
                    extensions.add(new ExtensionElement(child.getTag(), text));
                    LOGGER.log(
                            Level.FINE,
                            "Dropping private element <{0}> from <{1}>",
                            new Object[] {child.getTag(), node.getTag()});
                    continue;
                }
                String key = child.getTag().toLowerCase(Locale.ROOT);
                if (leaves.putIfAbsent(key, text) != null) {
                    throw new DuplicateKeyException(key, node.getTag(), child.getLocation());
                }
            } else {
                for (Map.Entry<String, String> entry : collect(child, List.of(), extensions, depth + 1).entrySet()) {
                    if (nested.putIfAbsent(entry.getKey(), entry.getValue()) != null) {
                        throw new DuplicateKeyException(entry.getKey(), node.getTag(), child.getLocation());
                    }
                }
            }
        }
        for (String key : nested.keySet()) {
            if (leaves.containsKey(key)) {
                throw new DuplicateKeyException(key, node.getTag(), node.getLocation());
            }
        }
        leaves.putAll(nested);
        return leaves;
    }

    static boolean containsInstance(Collection<TagNode> nodes, TagNode node) {
        for (TagNode candidate : nodes) {
            if (candidate == node) {
                return true;
            }
        }
        return false;
    }
}
