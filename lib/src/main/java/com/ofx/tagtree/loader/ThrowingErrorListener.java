package com.ofx.tagtree.loader;

import com.ofx.tagtree.loader.ast.SourceLocation;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Aborts lexing on the first error. The {@link InvalidMarkupException} travels as the cause of a
 * {@link ParseCancellationException} because ANTLR callbacks cannot throw checked exceptions.
 */
final class ThrowingErrorListener extends BaseErrorListener {
    private final SourceLocation bodyOrigin;

    ThrowingErrorListener(SourceLocation bodyOrigin) {
        this.bodyOrigin = bodyOrigin;
    }

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        String fragment = recognizer instanceof Lexer ? fragment((Lexer) recognizer) : msg;
        SourceLocation location = bodyOrigin.translate(line, charPositionInLine + 1);
        throw new ParseCancellationException(new InvalidMarkupException(fragment, tagName(fragment), location));
    }

    private static String fragment(Lexer lexer) {
        CharStream input = lexer.getInputStream();
        int end = Math.min(input.index(), input.size() - 1);
        return input.getText(Interval.of(lexer._tokenStartCharIndex, end));
    }

    // "<b" -> "b", "</x" -> "x"; null when nothing resembling a name was read.
    private static String tagName(String fragment) {
        String name = fragment;
        if (name.startsWith("</")) {
            name = name.substring(2);
        } else if (name.startsWith("<")) {
            name = name.substring(1);
        }
        if (name.endsWith(">")) {
            name = name.substring(0, name.length() - 1);
        }
        return name.isEmpty() ? null : name;
    }
}
