package org.kukicha.compiler.diagnostics;

/**
 * A single error or warning reported during compilation.
 *
 * @param type     Whether this is an error or a warning.
 * @param kind     The stage that reported it.
 * @param message  The message.
 * @param fileName The source file.
 * @param line     The 1-based line number.
 * @param column   The 1-based column number.
 * @param snippet  The source line the diagnostic points at, or null if unknown.
 * @param hint     An optional fix-it hint, or null.
 */
public record Diagnostic(
        Type type,
        ErrorKind kind,
        String message,
        String fileName,
        int line,
        int column,
        String snippet,
        String hint
) {

    public enum Type {
        ERROR,
        WARNING
    }

    /**
     * @return true if this diagnostic carries a fix-it hint.
     */
    public boolean hasHint() {
        return hint != null && !hint.isEmpty();
    }

    @Override
    public String toString() {
        String severity = type == Type.ERROR ? "error" : "warning";
        return String.format("%s:%d:%d: %s: %s", fileName, line, column, severity, message);
    }
}
