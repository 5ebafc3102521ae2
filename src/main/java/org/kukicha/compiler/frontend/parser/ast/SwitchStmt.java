package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * {@code switch [subject]} with {@code when} arms and an optional {@code otherwise} arm.
 * Without a subject each {@code when} value is a boolean condition.
 */
public record SwitchStmt(Token token, Expression subject, List<WhenCase> cases, BlockStmt otherwise) implements Statement {

    public SwitchStmt {
        cases = List.copyOf(cases);
    }
}
