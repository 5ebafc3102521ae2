package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

public record ReturnStmt(Token token, List<Expression> values) implements Statement {

    public ReturnStmt {
        values = List.copyOf(values);
    }
}
