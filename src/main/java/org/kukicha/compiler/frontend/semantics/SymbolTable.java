package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.diagnostics.ErrorKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A lexically scoped symbol table. The root scope holds package-level names (functions,
 * types); every function body, block and loop opens a nested scope. Imports are file-local
 * and live in a per-file scope directly below the root.
 */
public class SymbolTable {

    /**
     * Represents a single scope in the symbol table.
     */
    public static class Scope {
        private final Scope parent;
        private final List<Scope> children = new ArrayList<>();
        private final Map<String, Symbol> symbols = new LinkedHashMap<>();

        Scope(Scope parent) {
            this.parent = parent;
        }

        void addChild(Scope child) {
            children.add(child);
        }

        public Scope getParent() {
            return parent;
        }

        public List<Scope> getChildren() {
            return Collections.unmodifiableList(children);
        }

        public Map<String, Symbol> getSymbols() {
            return Collections.unmodifiableMap(symbols);
        }
    }

    private final Scope rootScope;
    private Scope currentScope;
    private final DiagnosticsEngine diagnostics;

    /**
     * Constructs a new symbol table.
     * @param diagnostics The diagnostics engine for reporting redeclarations.
     */
    public SymbolTable(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
        this.rootScope = new Scope(null);
        this.currentScope = rootScope;
    }

    /**
     * Resets the current scope to the root scope.
     */
    public void resetScope() {
        this.currentScope = rootScope;
    }

    /**
     * Enters a new scope.
     * @return The new scope.
     */
    public Scope enterScope() {
        Scope newScope = new Scope(currentScope);
        currentScope.addChild(newScope);
        currentScope = newScope;
        return newScope;
    }

    /**
     * Leaves the current scope and moves to the parent scope.
     */
    public void leaveScope() {
        if (currentScope.parent != null) {
            currentScope = currentScope.parent;
        }
    }

    public void setCurrentScope(Scope scope) {
        this.currentScope = scope;
    }

    public Scope getCurrentScope() {
        return currentScope;
    }

    public Scope getRootScope() {
        return rootScope;
    }

    /**
     * Defines a new symbol in the current scope. A second binding of the same name in the
     * same scope is reported and the first binding is kept. Shadowing a name of an
     * enclosing scope is allowed.
     * @param symbol The symbol to define.
     * @return true if the symbol was added.
     */
    public boolean define(Symbol symbol) {
        Symbol existing = currentScope.symbols.putIfAbsent(symbol.name(), symbol);
        if (existing != null) {
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    "'" + symbol.name() + "' is already declared in this scope",
                    symbol.token(),
                    "use '=' to assign a new value to an existing variable");
            return false;
        }
        return true;
    }

    /**
     * Resolves a name, searching from the current scope upwards to the root.
     * @param name The name to resolve.
     * @return The innermost symbol of that name, or empty if none is visible.
     */
    public Optional<Symbol> resolve(String name) {
        for (Scope scope = currentScope; scope != null; scope = scope.parent) {
            Symbol symbol = scope.symbols.get(name);
            if (symbol != null) {
                return Optional.of(symbol);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a name in the current scope only.
     */
    public Optional<Symbol> resolveLocal(String name) {
        return Optional.ofNullable(currentScope.symbols.get(name));
    }
}
