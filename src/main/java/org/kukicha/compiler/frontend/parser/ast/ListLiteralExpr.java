package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * {@code list of T{a, b}} or {@code [a, b]}. The element type is null for the bracket form.
 */
public record ListLiteralExpr(Token token, TypeRef elementType, List<Expression> elements) implements Expression {

    public ListLiteralExpr {
        elements = List.copyOf(elements);
    }
}
