package org.kukicha.compiler.frontend.parser;

import org.kukicha.compiler.frontend.parser.features.FunctionDeclarationHandler;
import org.kukicha.compiler.frontend.parser.features.ImportDeclarationHandler;
import org.kukicha.compiler.frontend.parser.features.InterfaceDeclarationHandler;
import org.kukicha.compiler.frontend.parser.features.PackageDeclarationHandler;
import org.kukicha.compiler.frontend.parser.features.TypeDeclarationHandler;
import org.kukicha.compiler.model.TokenType;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry for top-level declaration handlers.
 * Maps the keyword that starts a declaration to its handler.
 */
public class DeclarationHandlerRegistry {

    private final Map<TokenType, IDeclarationHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a handler for a declaration keyword.
     * @param keyword The keyword token type (e.g. {@link TokenType#FUNC}).
     * @param handler The handler for this declaration.
     */
    public void register(TokenType keyword, IDeclarationHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Looks up the handler for a keyword.
     * @param keyword The keyword token type.
     * @return The handler, or empty if the keyword does not start a declaration.
     */
    public Optional<IDeclarationHandler> get(TokenType keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Creates a registry with all built-in declaration handlers.
     * @return A new registry instance.
     */
    public static DeclarationHandlerRegistry initialize() {
        DeclarationHandlerRegistry registry = new DeclarationHandlerRegistry();
        registry.register(TokenType.PETIOLE, new PackageDeclarationHandler());
        registry.register(TokenType.IMPORT, new ImportDeclarationHandler());
        registry.register(TokenType.TYPE, new TypeDeclarationHandler());
        registry.register(TokenType.INTERFACE, new InterfaceDeclarationHandler());
        registry.register(TokenType.FUNC, new FunctionDeclarationHandler());
        return registry;
    }
}
