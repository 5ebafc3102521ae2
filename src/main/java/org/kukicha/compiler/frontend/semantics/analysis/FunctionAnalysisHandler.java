package org.kukicha.compiler.frontend.semantics.analysis;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.frontend.parser.ast.AstNode;
import org.kukicha.compiler.frontend.parser.ast.FunctionDecl;
import org.kukicha.compiler.frontend.semantics.BodyAnalyzer;
import org.kukicha.compiler.frontend.semantics.SymbolTable;

/**
 * Walks the body of a function or method. The function's scope is opened below the scope
 * the symbol table is positioned at, which is the scope of the declaring file.
 */
public class FunctionAnalysisHandler implements IAnalysisHandler {

    private final BodyAnalyzer bodies;

    public FunctionAnalysisHandler(BodyAnalyzer bodies) {
        this.bodies = bodies;
    }

    @Override
    public void analyze(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        bodies.analyzeFunction((FunctionDecl) node);
    }
}
