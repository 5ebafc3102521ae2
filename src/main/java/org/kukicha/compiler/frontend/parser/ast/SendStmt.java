package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code send value to channel}.
 */
public record SendStmt(Token token, Expression value, Expression channel) implements Statement {
}
