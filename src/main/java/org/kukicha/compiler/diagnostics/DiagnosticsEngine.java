package org.kukicha.compiler.diagnostics;

import org.kukicha.compiler.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Collects errors and warnings from all compilation stages. Stages report into the
 * engine and keep going, so a single run can surface several independent problems.
 * <p>
 * The number of stored errors is bounded. Once the limit is hit a single closing
 * note is recorded and further errors are dropped.
 */
public class DiagnosticsEngine {

    /** Error limit used when none is configured. */
    public static final int DEFAULT_MAX_ERRORS = 50;

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Map<String, String[]> sourceLines = new HashMap<>();
    private final int maxErrors;
    private int errorCount;
    private boolean limitReached;

    public DiagnosticsEngine() {
        this(DEFAULT_MAX_ERRORS);
    }

    /**
     * @param maxErrors The maximum number of errors to record before truncating.
     */
    public DiagnosticsEngine(int maxErrors) {
        if (maxErrors < 1) {
            throw new IllegalArgumentException("maxErrors must be positive, got " + maxErrors);
        }
        this.maxErrors = maxErrors;
    }

    /**
     * Registers the text of a source file so diagnostics can carry a snippet of the offending line.
     * @param fileName The logical file name used in tokens.
     * @param content The normalized file content.
     */
    public void registerSource(String fileName, String content) {
        sourceLines.put(fileName, content.split("\n", -1));
    }

    public void reportError(ErrorKind kind, String message, String fileName, int line, int column) {
        reportError(kind, message, fileName, line, column, null);
    }

    public void reportError(ErrorKind kind, String message, String fileName, int line, int column, String hint) {
        if (limitReached) {
            return;
        }
        if (errorCount >= maxErrors) {
            limitReached = true;
            diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, kind,
                    "Too many errors, stopping after " + maxErrors, fileName, line, column, null, null));
            return;
        }
        errorCount++;
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, kind, message, fileName, line, column,
                snippetFor(fileName, line), hint));
    }

    public void reportError(ErrorKind kind, String message, Token token) {
        reportError(kind, message, token, null);
    }

    public void reportError(ErrorKind kind, String message, Token token, String hint) {
        reportError(kind, message, token.fileName(), token.line(), token.column(), hint);
    }

    public void reportWarning(ErrorKind kind, String message, Token token) {
        reportWarning(kind, message, token, null);
    }

    public void reportWarning(ErrorKind kind, String message, Token token, String hint) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, kind, message, token.fileName(),
                token.line(), token.column(), snippetFor(token.fileName(), token.line()), hint));
    }

    /**
     * @return true if at least one error was reported.
     */
    public boolean hasErrors() {
        return errorCount > 0;
    }

    public int errorCount() {
        return errorCount;
    }

    /**
     * @return All diagnostics in reporting order.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return Only the errors, in reporting order.
     */
    public List<Diagnostic> getErrors() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .collect(Collectors.toList());
    }

    /**
     * @param kind The stage to filter by.
     * @return The errors reported by that stage.
     */
    public List<Diagnostic> getErrors(ErrorKind kind) {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR && d.kind() == kind)
                .collect(Collectors.toList());
    }

    /**
     * @return A one-line summary, e.g. "2 errors, 1 warning".
     */
    public String summary() {
        long warnings = diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.WARNING).count();
        return plural(errorCount, "error") + ", " + plural(warnings, "warning");
    }

    private String snippetFor(String fileName, int line) {
        String[] lines = sourceLines.get(fileName);
        if (lines == null || line < 1 || line > lines.length) {
            return null;
        }
        return lines[line - 1];
    }

    private static String plural(long count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
