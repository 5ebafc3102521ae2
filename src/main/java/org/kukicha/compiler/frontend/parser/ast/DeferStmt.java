package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record DeferStmt(Token token, Expression call) implements Statement {
}
