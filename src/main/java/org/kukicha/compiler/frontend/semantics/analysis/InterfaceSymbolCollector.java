package org.kukicha.compiler.frontend.semantics.analysis;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.kukicha.compiler.frontend.parser.ast.AstNode;
import org.kukicha.compiler.frontend.parser.ast.InterfaceDecl;
import org.kukicha.compiler.frontend.parser.ast.MethodSignature;
import org.kukicha.compiler.frontend.semantics.AnalysisContext;
import org.kukicha.compiler.frontend.semantics.Symbol;
import org.kukicha.compiler.frontend.semantics.SymbolTable;
import org.kukicha.compiler.frontend.semantics.types.InterfaceType;

/**
 * Registers interface types and, in the signature pass, their method sets.
 */
public class InterfaceSymbolCollector implements ISymbolCollector {

    private final AnalysisContext context;

    public InterfaceSymbolCollector(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        InterfaceDecl decl = (InterfaceDecl) node;
        InterfaceType type = new InterfaceType(decl.name());
        if (!context.environment().declare(decl.name(), type)) {
            diagnostics.reportError(ErrorKind.SEMANTIC, "Type '" + decl.name() + "' is already declared", decl.token());
            return;
        }
        SymbolTable.Scope previous = symbolTable.getCurrentScope();
        symbolTable.setCurrentScope(symbolTable.getRootScope());
        symbolTable.define(new Symbol(decl.name(), Symbol.Kind.TYPE, type, false, decl.token()));
        symbolTable.setCurrentScope(previous);
    }

    @Override
    public void collectSignatures(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        InterfaceDecl decl = (InterfaceDecl) node;
        if (!(context.environment().lookup(decl.name()).orElse(null) instanceof InterfaceType iface)) {
            return;
        }
        for (MethodSignature method : decl.methods()) {
            if (iface.methods().containsKey(method.name())) {
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        "Duplicate method '" + method.name() + "' in interface '" + decl.name() + "'", method.token());
                continue;
            }
            ParameterRules.check(method.params(), "method '" + decl.name() + "." + method.name() + "'", diagnostics);
            context.environment().addInterfaceMethod(iface, method.name(),
                    context.resolver().signature(method.params(), method.returns()));
        }
    }
}
