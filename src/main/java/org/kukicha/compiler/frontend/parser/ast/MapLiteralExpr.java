package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * {@code map of K to V{k: v, ...}}.
 */
public record MapLiteralExpr(Token token, TypeRef keyType, TypeRef valueType, List<Entry> entries) implements Expression {

    public MapLiteralExpr {
        entries = List.copyOf(entries);
    }

    public record Entry(Expression key, Expression value) {
    }
}
