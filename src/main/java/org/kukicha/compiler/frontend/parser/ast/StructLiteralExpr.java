package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

public record StructLiteralExpr(Token token, TypeRef type, List<FieldValue> fields) implements Expression {

    public StructLiteralExpr {
        fields = List.copyOf(fields);
    }

    public record FieldValue(Token token, String name, Expression value) {
    }
}
