package org.kukicha.compiler.frontend.semantics.analysis;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.frontend.parser.ast.AstNode;
import org.kukicha.compiler.frontend.parser.ast.ImportDecl;
import org.kukicha.compiler.frontend.semantics.Symbol;
import org.kukicha.compiler.frontend.semantics.SymbolTable;
import org.kukicha.compiler.frontend.semantics.types.UnknownType;

/**
 * Registers an import under its alias, or the last element of its path, in the file scope.
 */
public class ImportSymbolCollector implements ISymbolCollector {

    @Override
    public void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        if (!(node instanceof ImportDecl imp)) {
            return;
        }
        symbolTable.define(new Symbol(imp.effectiveName(), Symbol.Kind.IMPORT, UnknownType.INSTANCE, false, imp.token()));
    }
}
