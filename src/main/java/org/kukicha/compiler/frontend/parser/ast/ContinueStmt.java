package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record ContinueStmt(Token token) implements Statement {
}
