package org.kukicha.compiler.frontend.semantics.analysis;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.kukicha.compiler.frontend.parser.ast.AstNode;
import org.kukicha.compiler.frontend.parser.ast.FunctionDecl;
import org.kukicha.compiler.frontend.parser.ast.NamedTypeRef;
import org.kukicha.compiler.frontend.parser.ast.ReferenceTypeRef;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;
import org.kukicha.compiler.frontend.semantics.AnalysisContext;
import org.kukicha.compiler.frontend.semantics.Symbol;
import org.kukicha.compiler.frontend.semantics.SymbolTable;
import org.kukicha.compiler.frontend.semantics.types.FunctionType;
import org.kukicha.compiler.frontend.semantics.types.Type;
import org.kukicha.compiler.frontend.semantics.types.UnknownType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers function signatures in the package scope and method signatures on their
 * receiver types. Runs in the signature pass only, so that signatures can mention every
 * type of the unit.
 */
public class FunctionSymbolCollector implements ISymbolCollector {

    private static final Logger log = LoggerFactory.getLogger(FunctionSymbolCollector.class);

    private final AnalysisContext context;

    public FunctionSymbolCollector(AnalysisContext context) {
        this.context = context;
    }

    @Override
    public void collect(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        // signatures only
    }

    @Override
    public void collectSignatures(AstNode node, SymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        FunctionDecl decl = (FunctionDecl) node;
        String owner = (decl.isMethod() ? "method '" : "function '") + decl.name() + "'";
        ParameterRules.check(decl.params(), owner, diagnostics);
        FunctionType signature = context.resolver().signature(decl.params(), decl.returns());

        if (decl.isMethod()) {
            context.recordSignature(decl, signature, collectMethod(decl, signature, diagnostics));
            return;
        }
        context.recordSignature(decl, signature, null);
        if (!context.registerFunction(decl)) {
            diagnostics.reportError(ErrorKind.SEMANTIC, "Function '" + decl.name() + "' is already declared", decl.token());
            return;
        }
        SymbolTable.Scope previous = symbolTable.getCurrentScope();
        symbolTable.setCurrentScope(symbolTable.getRootScope());
        if (symbolTable.resolveLocal(decl.name()).isPresent()) {
            diagnostics.reportError(ErrorKind.SEMANTIC, "'" + decl.name() + "' is already declared as a type", decl.token());
        } else {
            symbolTable.define(new Symbol(decl.name(), Symbol.Kind.FUNCTION, signature, false, decl.token()));
        }
        symbolTable.setCurrentScope(previous);
    }

    /**
     * @return The resolved receiver type; {@link UnknownType} if it is missing or invalid.
     */
    private Type collectMethod(FunctionDecl decl, FunctionType signature, DiagnosticsEngine diagnostics) {
        TypeRef receiverType = decl.receiver().type();
        if (receiverType == null) {
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    "Receiver '" + decl.receiver().name() + "' of method '" + decl.name() + "' requires an explicit type annotation",
                    decl.receiver().token());
            return UnknownType.INSTANCE;
        }
        String baseName = baseTypeName(receiverType);
        if (baseName == null) {
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    "Methods can only be declared on named types of this package", receiverType.token());
            return UnknownType.INSTANCE;
        }
        Type receiver = context.resolver().resolve(receiverType);
        if (!context.environment().declareMethod(baseName, decl.name(), signature)) {
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    "Method '" + decl.name() + "' is already declared on type '" + baseName + "'", decl.token());
            return receiver;
        }
        log.trace("Registered method {}.{}", baseName, decl.name());
        return receiver;
    }

    private static String baseTypeName(TypeRef ref) {
        TypeRef target = ref instanceof ReferenceTypeRef reference ? reference.target() : ref;
        if (target instanceof NamedTypeRef named && !named.isQualified()) {
            return named.name();
        }
        return null;
    }
}
