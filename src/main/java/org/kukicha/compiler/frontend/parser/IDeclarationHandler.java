package org.kukicha.compiler.frontend.parser;

import org.kukicha.compiler.frontend.parser.ast.Declaration;

/**
 * Handler interface for top-level declarations. Each handler is registered for the
 * keyword that introduces its declaration and consumes the whole declaration,
 * starting at that keyword.
 */
public interface IDeclarationHandler {

    /**
     * Parses the declaration from the token stream.
     *
     * @param context The parsing context providing access to the token stream.
     * @return The declaration node.
     */
    Declaration parse(ParsingContext context);
}
