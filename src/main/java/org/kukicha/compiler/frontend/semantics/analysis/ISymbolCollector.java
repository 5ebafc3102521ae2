package org.kukicha.compiler.frontend.semantics.analysis;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.frontend.parser.ast.AstNode;
import org.kukicha.compiler.frontend.semantics.SymbolTable;

/**
 * Interface for declaration-level symbol collection.
 * <p>
 * {@link #collect} runs in the type pass, once every file of the unit is parsed, and registers
 * names. {@link #collectSignatures} runs in the signature pass, once every name is known, and
 * attaches the types that may refer to other declarations: struct fields, interface methods and
 * function signatures.
 */
public interface ISymbolCollector {
    /**
     * Registers the names a declaration introduces.
     * @param node The declaration.
     * @param symbolTable The symbol table to register symbols in.
     * @param diagnostics The engine for reporting errors.
     */
    void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics);

    /**
     * Resolves the types of a declaration once all names are known.
     * @param node The declaration.
     * @param symbolTable The symbol table.
     * @param diagnostics The engine for reporting errors.
     */
    default void collectSignatures(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {}
}
