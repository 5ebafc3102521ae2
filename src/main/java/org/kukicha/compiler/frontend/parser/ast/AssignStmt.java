package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * {@code targets = values [onerr ...]}. Targets are identifiers, selectors or index expressions.
 */
public record AssignStmt(Token token, List<Expression> targets, List<Expression> values, OnErrClause onErr) implements Statement {

    public AssignStmt {
        targets = List.copyOf(targets);
        values = List.copyOf(values);
    }
}
