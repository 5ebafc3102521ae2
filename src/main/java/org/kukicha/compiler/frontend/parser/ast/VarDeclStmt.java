package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * {@code a, b := values [onerr ...]}.
 */
public record VarDeclStmt(Token token, List<Identifier> names, List<Expression> values, OnErrClause onErr) implements Statement {

    public VarDeclStmt {
        names = List.copyOf(names);
        values = List.copyOf(values);
    }
}
