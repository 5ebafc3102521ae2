package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record BreakStmt(Token token) implements Statement {
}
