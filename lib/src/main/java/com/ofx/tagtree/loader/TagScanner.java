package com.ofx.tagtree.loader;

import com.ofx.tagtree.loader.ast.SourceLocation;
import com.ofx.tagtree.loader.ast.TagEvent;
import com.ofx.tagtree.loader.grammar.OfxLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Turns an OFX body into a stream of {@link TagEvent}s.
 *
 * <p>Each opening tag is grouped with the text that follows it and with an immediately adjacent
 * closing tag of the same name. Non-blank text makes the tag a data leaf, whether or not it was
 * explicitly closed; otherwise it opens an aggregate. Closing tags that are not consumed this way
 * become {@link TagEvent.Kind#CLOSE} events.
 */
public final class TagScanner {

    public List<TagEvent> scan(String sourceName, String input) throws OfxParseException {
        return scan(SourceLocation.startOf(Objects.requireNonNull(sourceName, "sourceName")), input);
    }

    /**
     * Scans body text that starts at {@code bodyOrigin} in its file, so that event locations and
     * lexer errors point at file positions rather than body positions.
     */
    public List<TagEvent> scan(SourceLocation bodyOrigin, String input) throws OfxParseException {
        Objects.requireNonNull(bodyOrigin, "bodyOrigin");
        Objects.requireNonNull(input, "input");

        OfxLexer lexer = new OfxLexer(CharStreams.fromString(input, bodyOrigin.getSourceName()));
        lexer.removeErrorListeners();
        lexer.addErrorListener(new ThrowingErrorListener(bodyOrigin));

        CommonTokenStream stream = new CommonTokenStream(lexer);
        try {
            stream.fill();
        } catch (ParseCancellationException ex) {
            if (ex.getCause() instanceof InvalidMarkupException) {
                throw (InvalidMarkupException) ex.getCause();
            }
            throw new OfxParseException(ex.getMessage(), null, bodyOrigin);
        }
        if (DebugFlags.isTokenDebugEnabled()) {
            DebugFlags.logTokens(stream, lexer);
        }

        List<Token> tokens = new ArrayList<>();
        for (Token token : stream.getTokens()) {
            if (token.getType() != Token.EOF) {
                tokens.add(token);
            }
        }
        return classify(bodyOrigin, tokens);
    }

    private static List<TagEvent> classify(SourceLocation bodyOrigin, List<Token> tokens)
            throws OfxParseException {
        List<TagEvent> events = new ArrayList<>();
        // Tag whose closing fragment was the last thing consumed; text right after it is illegal.
        String lastClosed = null;
        int index = 0;
        while (index < tokens.size()) {
            Token token = tokens.get(index);
            SourceLocation location = locate(bodyOrigin, token);
            switch (token.getType()) {
                case OfxLexer.OPEN_TAG -> {
                    String tag = openTagName(token);
                    int next = index + 1;
                    String text = "";
                    if (typeAt(tokens, next) == OfxLexer.TEXT) {
                        text = tokens.get(next).getText().trim();
                        next++;
                    }
                    boolean inlineClose = false;
                    if (typeAt(tokens, next) == OfxLexer.CLOSE_TAG
                            && closeTagName(tokens.get(next)).equals(tag)) {
                        inlineClose = true;
                        next++;
                    }
                    if (text.isEmpty()) {
                        events.add(TagEvent.open(tag, inlineClose, location));
                    } else {
                        events.add(TagEvent.leaf(tag, text, inlineClose, location));
                    }
                    lastClosed = inlineClose ? tag : null;
                    index = next;
                }
                case OfxLexer.CLOSE_TAG -> {
                    String tag = closeTagName(token);
                    int next = index + 1;
                    if (typeAt(tokens, next) == OfxLexer.TEXT) {
                        String trailing = tokens.get(next).getText().trim();
                        if (!trailing.isEmpty()) {
                            throw new LeafClosingTagTextException(tag, trailing, location);
                        }
                        next++;
                    }
                    events.add(TagEvent.close(tag, location));
                    lastClosed = tag;
                    index = next;
                }
                case OfxLexer.TEXT -> {
                    String text = token.getText().trim();
                    if (!text.isEmpty()) {
                        if (lastClosed != null) {
                            throw new LeafClosingTagTextException(lastClosed, text, location);
                        }
                        throw new OfxParseException(
                                "Text '" + text + "' appears outside of any tag", null, location);
                    }
                    index++;
                }
                default -> throw new BuilderInvariantException(
                        "Unexpected token type " + token.getType() + " at " + location);
            }
        }
        return events;
    }

    private static int typeAt(List<Token> tokens, int index) {
        return index < tokens.size() ? tokens.get(index).getType() : Token.EOF;
    }

    private static String openTagName(Token token) {
        String text = token.getText();
        return text.substring(1, text.length() - 1);
    }

    private static String closeTagName(Token token) {
        String text = token.getText();
        return text.substring(2, text.length() - 1);
    }

    private static SourceLocation locate(SourceLocation bodyOrigin, Token token) {
        return bodyOrigin.translate(token.getLine(), token.getCharPositionInLine() + 1);
    }
}
