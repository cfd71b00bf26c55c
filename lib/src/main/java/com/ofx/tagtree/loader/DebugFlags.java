package com.ofx.tagtree.loader;

import com.ofx.tagtree.loader.grammar.OfxLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

public final class DebugFlags {
    private static final String TOKENS_PROPERTY = "ofx.tagtree.debugTokens";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "OFX_TAGTREE_DEBUG_TOKENS";
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        String value = System.getProperty(TOKENS_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(TOKENS_ENV));
    }

    /** Prints the token dump to stderr and keeps it, replacing this thread's previous dump. */
    public static void logTokens(CommonTokenStream tokens, OfxLexer lexer) {
        List<String> captured = CAPTURED_TOKENS.get();
        captured.clear();
        System.err.println("[OFX TagTree] Token dump for debugging:");
        for (Token token : tokens.getTokens()) {
            String symbolic = token.getType() == Token.EOF
                    ? "EOF"
                    : lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-10s @ %4d:%-3d -> %s",
                            symbolic,
                            token.getLine(),
                            token.getCharPositionInLine(),
                            token.getText().strip());
            System.err.printf(Locale.ROOT, "  %s%n", line);
            captured.add(line);
        }
    }

    /** Returns and forgets the most recent token dump of this thread. */
    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }
}
