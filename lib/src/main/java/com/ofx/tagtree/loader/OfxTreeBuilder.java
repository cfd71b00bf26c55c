package com.ofx.tagtree.loader;

import com.ofx.tagtree.loader.ast.SourceLocation;
import com.ofx.tagtree.loader.ast.TagEvent;
import com.ofx.tagtree.loader.ast.TagNode;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Builds a {@link TagNode} tree from OFXv1 (SGML) or OFXv2 (XML) body text.
 *
 * <p>Data elements are closed as soon as their text is read, so their closing tags are optional.
 * Aggregates must be closed explicitly and in order. The builder keeps no state between calls and
 * may be shared.
 */
public final class OfxTreeBuilder {

    private enum State {
        BEFORE_ROOT,
        IN_ROOT,
        DONE
    }

    private final TagScanner scanner = new TagScanner();
    private final OfxParserOptions options;

    public OfxTreeBuilder() {
        this(OfxParserOptions.defaults());
    }

    public OfxTreeBuilder(OfxParserOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public TagNode build(String input) throws OfxParseException {
        return build("<input>", input);
    }

    public TagNode build(String sourceName, String input) throws OfxParseException {
        return build(scanner.scan(sourceName, input));
    }

    /** Builds body text located at {@code bodyOrigin} within its file. */
    public TagNode build(SourceLocation bodyOrigin, String input) throws OfxParseException {
        return build(scanner.scan(bodyOrigin, input));
    }

    public TagNode build(List<TagEvent> events) throws OfxParseException {
        Deque<TagNode> open = new ArrayDeque<>();
        TagNode root = null;
        State state = State.BEFORE_ROOT;

        for (TagEvent event : events) {
            if (state == State.DONE && event.kind() != TagEvent.Kind.CLOSE) {
                throw new OfxParseException(
                        "<" + event.tag() + "> appears after the document root <"
                                + root.getTag() + "> was closed",
                        event.tag(),
                        event.location());
            }
            switch (event.kind()) {
                case LEAF -> {
                    checkDepth(event, open.size() + 1);
                    TagNode leaf = TagNode.leaf(event.tag(), event.text(), event.location());
                    if (open.isEmpty()) {
                        root = leaf;
                        state = State.DONE;
                    } else {
                        open.peek().addChild(leaf);
                    }
                }
                case OPEN -> {
                    checkDepth(event, open.size() + 1);
                    TagNode aggregate = TagNode.aggregate(event.tag(), event.location());
                    if (open.isEmpty()) {
                        root = aggregate;
                        state = State.IN_ROOT;
                    } else {
                        open.peek().addChild(aggregate);
                    }
                    open.push(aggregate);
                    if (event.inlineClose()) {
                        closeInline(open, aggregate);
                        if (open.isEmpty()) {
                            state = State.DONE;
                        }
                    }
                }
                case CLOSE -> {
                    if (open.isEmpty()) {
                        throw new TagMismatchException(event.tag(), null, event.location());
                    }
                    TagNode current = open.peek();
                    if (!current.getTag().equals(event.tag())) {
                        throw new TagMismatchException(event.tag(), current.getTag(), event.location());
                    }
                    open.pop();
                    if (open.isEmpty()) {
                        state = State.DONE;
                    }
                }
                default -> throw new BuilderInvariantException("Unknown event kind " + event.kind());
            }
        }

        if (!open.isEmpty()) {
            TagNode unclosed = open.peek();
            throw new UnclosedAggregateException(unclosed.getTag(), unclosed.getLocation());
        }
        if (root == null) {
            throw new OfxParseException("Document contains no tags");
        }
        if (state != State.DONE) {
            throw new BuilderInvariantException("Builder finished in state " + state);
        }
        return root;
    }

    private void checkDepth(TagEvent event, int depth) throws MaxDepthExceededException {
        if (depth > options.getMaxDepth()) {
            throw new MaxDepthExceededException(event.tag(), options.getMaxDepth(), event.location());
        }
    }

    // The scanner only marks an inline close when the fragment names the tag it follows.
    private static void closeInline(Deque<TagNode> open, TagNode expected) {
        TagNode popped = open.poll();
        if (popped != expected) {
            throw new BuilderInvariantException(
                    "Inline close of <" + expected.getTag() + "> popped "
                            + (popped == null ? "an empty stack" : "<" + popped.getTag() + ">"));
        }
    }
}
