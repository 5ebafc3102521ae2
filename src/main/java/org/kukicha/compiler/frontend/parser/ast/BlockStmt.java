package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * An indented sequence of statements.
 */
public record BlockStmt(Token token, List<Statement> statements) implements Statement {

    public BlockStmt {
        statements = List.copyOf(statements);
    }
}
