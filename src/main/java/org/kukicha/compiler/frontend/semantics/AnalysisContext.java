package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.frontend.parser.ast.FunctionDecl;
import org.kukicha.compiler.frontend.semantics.registry.SignatureRegistry;
import org.kukicha.compiler.frontend.semantics.types.FunctionType;
import org.kukicha.compiler.frontend.semantics.types.Type;
import org.kukicha.compiler.frontend.semantics.types.TypeEnvironment;
import org.kukicha.compiler.frontend.semantics.types.UnknownType;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * State shared by the collectors and handlers of one analysis run.
 */
public class AnalysisContext {

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;
    private final TypeEnvironment environment;
    private final TypeResolver resolver;
    private final InterfaceSatisfactionChecker interfaces;
    private final TypeRules rules;
    private final SignatureRegistry signatures;
    private final AnalysisFacts facts = new AnalysisFacts();
    private final Map<String, FunctionDecl> functions = new HashMap<>();
    private final Map<FunctionDecl, FunctionType> declaredSignatures = new IdentityHashMap<>();
    private final Map<FunctionDecl, Type> receiverTypes = new IdentityHashMap<>();
    private FileContext currentFile;

    public AnalysisContext(DiagnosticsEngine diagnostics, SymbolTable symbolTable, SignatureRegistry signatures) {
        this.diagnostics = diagnostics;
        this.symbolTable = symbolTable;
        this.signatures = signatures;
        this.environment = new TypeEnvironment();
        this.resolver = new TypeResolver(environment, diagnostics);
        this.interfaces = new InterfaceSatisfactionChecker(environment);
        this.rules = new TypeRules(interfaces);
    }

    public DiagnosticsEngine diagnostics() {
        return diagnostics;
    }

    public SymbolTable symbolTable() {
        return symbolTable;
    }

    public TypeEnvironment environment() {
        return environment;
    }

    public TypeResolver resolver() {
        return resolver;
    }

    public InterfaceSatisfactionChecker interfaces() {
        return interfaces;
    }

    public TypeRules rules() {
        return rules;
    }

    public SignatureRegistry signatures() {
        return signatures;
    }

    public AnalysisFacts facts() {
        return facts;
    }

    /**
     * Registers a package-level function declaration.
     * @return false if a function of that name was already registered.
     */
    public boolean registerFunction(FunctionDecl decl) {
        return functions.putIfAbsent(decl.name(), decl) == null;
    }

    public Optional<FunctionDecl> function(String name) {
        return Optional.ofNullable(functions.get(name));
    }

    /**
     * Records the resolved signature of a function or method so later passes do not resolve
     * (and report) its annotations again.
     */
    public void recordSignature(FunctionDecl decl, FunctionType signature, Type receiver) {
        declaredSignatures.put(decl, signature);
        if (receiver != null) {
            receiverTypes.put(decl, receiver);
        }
    }

    public Optional<FunctionType> declaredSignature(FunctionDecl decl) {
        return Optional.ofNullable(declaredSignatures.get(decl));
    }

    public Type receiverType(FunctionDecl decl) {
        return receiverTypes.getOrDefault(decl, UnknownType.INSTANCE);
    }

    public FileContext currentFile() {
        if (currentFile == null) {
            throw new IllegalStateException("No file is being analyzed");
        }
        return currentFile;
    }

    void setCurrentFile(FileContext file) {
        this.currentFile = file;
    }
}
