package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code petiole name}, also written {@code leaf name}.
 */
public record PackageDecl(Token token, String name) implements Declaration {
}
