package org.kukicha.compiler.frontend.semantics.analysis;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.kukicha.compiler.frontend.parser.ast.AstNode;
import org.kukicha.compiler.frontend.parser.ast.FieldDecl;
import org.kukicha.compiler.frontend.parser.ast.TypeDecl;
import org.kukicha.compiler.frontend.semantics.AnalysisContext;
import org.kukicha.compiler.frontend.semantics.Symbol;
import org.kukicha.compiler.frontend.semantics.SymbolTable;
import org.kukicha.compiler.frontend.semantics.types.StructType;
import org.kukicha.compiler.frontend.semantics.types.Type;
import org.kukicha.compiler.frontend.semantics.types.TypeEnvironment;
import org.kukicha.compiler.frontend.semantics.types.UnknownType;

/**
 * Registers struct and defined types. Names are registered in the type pass; fields and the
 * targets of defined types are resolved in the signature pass.
 */
public class TypeSymbolCollector implements ISymbolCollector {

    private final AnalysisContext context;

    public TypeSymbolCollector(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        TypeDecl decl = (TypeDecl) node;
        Type placeholder = decl.isAlias() ? UnknownType.INSTANCE : new StructType(decl.name());
        if (!context.environment().declare(decl.name(), placeholder)) {
            diagnostics.reportError(ErrorKind.SEMANTIC, "Type '" + decl.name() + "' is already declared", decl.token());
            return;
        }
        SymbolTable.Scope previous = symbolTable.getCurrentScope();
        symbolTable.setCurrentScope(symbolTable.getRootScope());
        symbolTable.define(new Symbol(decl.name(), Symbol.Kind.TYPE, placeholder, false, decl.token()));
        symbolTable.setCurrentScope(previous);
    }

    @Override
    public void collectSignatures(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        TypeDecl decl = (TypeDecl) node;
        TypeEnvironment environment = context.environment();
        if (decl.isAlias()) {
            environment.redefine(decl.name(), context.resolver().resolve(decl.aliasType()));
            return;
        }
        if (!(environment.lookup(decl.name()).orElse(null) instanceof StructType struct)) {
            return;
        }
        for (FieldDecl field : decl.fields()) {
            if (struct.field(field.name()).isPresent()) {
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        "Duplicate field '" + field.name() + "' in type '" + decl.name() + "'", field.token());
                continue;
            }
            environment.addField(struct, new StructType.Field(field.name(), context.resolver().resolve(field.type()), field.tag()));
        }
    }
}
