package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code on name Type}. The type is null when the receiver was written without one.
 */
public record Receiver(Token token, String name, TypeRef type) implements AstNode {
}
