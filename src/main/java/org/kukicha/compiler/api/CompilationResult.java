package org.kukicha.compiler.api;

import org.kukicha.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * The outcome of a compilation: the generated files, in input order, and every diagnostic
 * reported along the way. No files are generated when the front end reported errors.
 */
public record CompilationResult(List<GeneratedFile> files, List<Diagnostic> diagnostics) {

    public CompilationResult {
        files = List.copyOf(files);
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.WARNING).toList();
    }
}
