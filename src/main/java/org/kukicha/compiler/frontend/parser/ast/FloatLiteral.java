package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record FloatLiteral(Token token, double value) implements Expression {
}
