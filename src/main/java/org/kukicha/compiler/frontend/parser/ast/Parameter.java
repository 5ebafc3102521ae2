package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * A function parameter.
 *
 * @param token        The parameter name token, or the {@code many} keyword for variadics.
 * @param name         The parameter name.
 * @param type         The declared type, or null if omitted.
 * @param variadic     Whether the parameter was declared with {@code many}.
 * @param defaultValue The default value expression, or null.
 */
public record Parameter(Token token, String name, TypeRef type, boolean variadic, Expression defaultValue) implements AstNode {
}
