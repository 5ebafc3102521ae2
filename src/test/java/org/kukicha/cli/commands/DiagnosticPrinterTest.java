package org.kukicha.cli.commands;

import org.kukicha.compiler.diagnostics.Diagnostic;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DiagnosticPrinterTest {

    @Test
    @Tag("unit")
    void printsLocationSnippetCaretAndHint() {
        Diagnostic error = new Diagnostic(Diagnostic.Type.ERROR, ErrorKind.LEX,
                "Use 4 spaces for indentation, not tabs", "main.kuki", 2, 5,
                "    x := 1", "replace the tab with 4 spaces");
        StringWriter out = new StringWriter();

        DiagnosticPrinter.print(List.of(error), new PrintWriter(out));

        assertThat(out.toString()).isEqualTo(String.join(System.lineSeparator(),
                "main.kuki:2:5: error: Use 4 spaces for indentation, not tabs",
                "        x := 1",
                "        ^",
                "    hint: replace the tab with 4 spaces",
                "1 error, 0 warnings",
                ""));
    }

    @Test
    @Tag("unit")
    void countsWarningsSeparately() {
        Diagnostic warning = new Diagnostic(Diagnostic.Type.WARNING, ErrorKind.SEMANTIC,
                "onerr discard silently swallows errors", "main.kuki", 1, 1, null, null);
        StringWriter out = new StringWriter();

        DiagnosticPrinter.print(List.of(warning, warning), new PrintWriter(out));

        assertThat(out.toString())
                .startsWith("main.kuki:1:1: warning: onerr discard silently swallows errors")
                .contains("0 errors, 2 warnings");
    }

    @Test
    @Tag("unit")
    void printsNothingWithoutDiagnostics() {
        StringWriter out = new StringWriter();

        DiagnosticPrinter.print(List.of(), new PrintWriter(out));

        assertThat(out.toString()).isEmpty();
    }

    @Test
    @Tag("unit")
    void caretKeepsTabsOfTheSnippet() {
        assertThat(DiagnosticPrinter.caret("\tx := y", 7)).isEqualTo("\t     ^");
        assertThat(DiagnosticPrinter.caret("x", 1)).isEqualTo("^");
    }
}
