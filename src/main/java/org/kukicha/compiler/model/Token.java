package org.kukicha.compiler.model;

/**
 * Represents a single token produced by the lexer.
 *
 * @param type     The type of the token.
 * @param text     The raw source text of the token.
 * @param value    The literal value ({@link Long}, {@link Double}, or a list of {@link StringSegment}s), or null.
 * @param line     The line number where the token appears (1-based).
 * @param column   The column number where the token starts (1-based).
 * @param fileName The name of the file the token comes from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * Returns a human-readable description of the token for error messages.
     * Structural tokens are described by name, everything else by its text.
     * @return The description.
     */
    public String describe() {
        return switch (type) {
            case NEWLINE -> "end of line";
            case INDENT -> "indentation";
            case DEDENT -> "end of block";
            case EOF -> "end of file";
            default -> "'" + text + "'";
        };
    }
}
