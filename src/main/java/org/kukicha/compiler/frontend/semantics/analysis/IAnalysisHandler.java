package org.kukicha.compiler.frontend.semantics.analysis;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.frontend.parser.ast.AstNode;
import org.kukicha.compiler.frontend.semantics.SymbolTable;

/**
 * Interface for specialized handlers of the body pass.
 * Each handler is responsible for analyzing a specific kind of declaration.
 */
public interface IAnalysisHandler {
    /**
     * Analyzes a single declaration.
     * @param node The node to analyze.
     * @param symbolTable The symbol table, positioned at the scope of the node's file.
     * @param diagnostics The engine for reporting errors.
     */
    void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics);
}
