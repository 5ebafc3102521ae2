package org.kukicha.cli.commands;

import org.kukicha.compiler.diagnostics.Diagnostic;

import java.io.PrintWriter;
import java.util.List;

/**
 * Renders diagnostics the way Go tools do:
 * <pre>
 * main.kuki:3:5: error: Undefined variable 'x'
 *     y := x + 1
 *          ^
 *     hint: declare 'x' before using it
 * </pre>
 */
public final class DiagnosticPrinter {

    private DiagnosticPrinter() {
    }

    public static void print(List<Diagnostic> diagnostics, PrintWriter out) {
        for (Diagnostic diagnostic : diagnostics) {
            print(diagnostic, out);
        }
        long errors = diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).count();
        long warnings = diagnostics.size() - errors;
        if (!diagnostics.isEmpty()) {
            out.printf("%d error%s, %d warning%s%n", errors, errors == 1 ? "" : "s", warnings, warnings == 1 ? "" : "s");
        }
        out.flush();
    }

    static void print(Diagnostic diagnostic, PrintWriter out) {
        out.println(diagnostic);
        if (diagnostic.snippet() != null) {
            out.println("    " + diagnostic.snippet());
            out.println("    " + caret(diagnostic.snippet(), diagnostic.column()));
        }
        if (diagnostic.hasHint()) {
            out.println("    hint: " + diagnostic.hint());
        }
    }

    /**
     * A caret under the given 1-based column. Tabs in the snippet are kept so the caret lines up.
     */
    static String caret(String snippet, int column) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < column - 1; i++) {
            sb.append(i < snippet.length() && snippet.charAt(i) == '\t' ? '\t' : ' ');
        }
        return sb.append('^').toString();
    }
}
