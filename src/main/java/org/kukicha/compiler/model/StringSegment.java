package org.kukicha.compiler.model;

import java.util.List;

/**
 * One piece of a string literal as segmented by the lexer. A literal alternates
 * plain {@link Text} and {@link Embedded} expression runs written as {@code {expr}}.
 */
public sealed interface StringSegment permits StringSegment.Text, StringSegment.Embedded {

    /**
     * Literal text with escape sequences already resolved.
     * @param text The unescaped text.
     */
    record Text(String text) implements StringSegment {}

    /**
     * An embedded expression, already lexed into its own token run (terminated by EOF).
     * @param tokens The tokens of the embedded expression.
     * @param source The raw expression source between the braces.
     */
    record Embedded(List<Token> tokens, String source) implements StringSegment {
        public Embedded {
            tokens = List.copyOf(tokens);
        }
    }
}
