package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record BooleanLiteral(Token token, boolean value) implements Expression {
}
