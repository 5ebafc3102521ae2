package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

public record WhenCase(Token token, List<Expression> values, BlockStmt body) implements AstNode {

    public WhenCase {
        values = List.copyOf(values);
    }
}
