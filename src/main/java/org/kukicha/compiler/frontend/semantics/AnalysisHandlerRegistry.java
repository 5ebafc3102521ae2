package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.frontend.parser.ast.AstNode;
import org.kukicha.compiler.frontend.parser.ast.FunctionDecl;
import org.kukicha.compiler.frontend.parser.ast.ImportDecl;
import org.kukicha.compiler.frontend.parser.ast.InterfaceDecl;
import org.kukicha.compiler.frontend.parser.ast.TypeDecl;
import org.kukicha.compiler.frontend.semantics.analysis.FunctionAnalysisHandler;
import org.kukicha.compiler.frontend.semantics.analysis.FunctionSymbolCollector;
import org.kukicha.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.kukicha.compiler.frontend.semantics.analysis.ISymbolCollector;
import org.kukicha.compiler.frontend.semantics.analysis.ImportSymbolCollector;
import org.kukicha.compiler.frontend.semantics.analysis.InterfaceSymbolCollector;
import org.kukicha.compiler.frontend.semantics.analysis.TypeSymbolCollector;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping declaration classes to symbol collectors (type and signature passes) and
 * analysis handlers (body pass).
 */
public final class AnalysisHandlerRegistry {

    private final Map<Class<? extends AstNode>, IAnalysisHandler> handlers = new HashMap<>();
    private final Map<Class<? extends AstNode>, ISymbolCollector> collectors = new HashMap<>();

    /**
     * Registers a body-pass analysis handler for the given AST node class.
     *
     * @param nodeType The concrete AST node class.
     * @param handler  The handler instance.
     * @param <T>      Concrete AST type parameter.
     */
    public <T extends AstNode> void register(Class<T> nodeType, IAnalysisHandler handler) {
        handlers.put(nodeType, handler);
    }

    /**
     * Registers a symbol collector for the given AST node class.
     *
     * @param nodeType  The concrete AST node class.
     * @param collector The collector instance.
     * @param <T>       Concrete AST type parameter.
     */
    public <T extends AstNode> void registerCollector(Class<T> nodeType, ISymbolCollector collector) {
        collectors.put(nodeType, collector);
    }

    /**
     * Resolves the body-pass handler for the given node class.
     *
     * @param nodeType The AST node class to look up.
     * @return Optional handler if registered.
     */
    public Optional<IAnalysisHandler> resolveHandler(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(handlers.get(nodeType));
    }

    /**
     * Resolves the collector for the given node class.
     *
     * @param nodeType The AST node class to look up.
     * @return Optional collector if registered.
     */
    public Optional<ISymbolCollector> resolveCollector(Class<? extends AstNode> nodeType) {
        return Optional.ofNullable(collectors.get(nodeType));
    }

    /**
     * Creates a registry pre-populated with the default handlers and collectors.
     *
     * @param context The analysis state shared by the collectors and handlers.
     * @return A fully initialized registry.
     */
    public static AnalysisHandlerRegistry initializeWithDefaults(AnalysisContext context) {
        AnalysisHandlerRegistry registry = new AnalysisHandlerRegistry();

        registry.registerCollector(ImportDecl.class, new ImportSymbolCollector());
        registry.registerCollector(TypeDecl.class, new TypeSymbolCollector(context));
        registry.registerCollector(InterfaceDecl.class, new InterfaceSymbolCollector(context));
        registry.registerCollector(FunctionDecl.class, new FunctionSymbolCollector(context));

        registry.register(FunctionDecl.class, new FunctionAnalysisHandler(new BodyAnalyzer(context)));

        return registry;
    }
}
