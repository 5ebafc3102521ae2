package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record IntegerLiteral(Token token, long value) implements Expression {
}
