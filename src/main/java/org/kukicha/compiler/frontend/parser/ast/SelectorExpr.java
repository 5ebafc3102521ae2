package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code object.field}. The object is null for the pipe shorthand {@code .field}.
 */
public record SelectorExpr(Token token, Expression object, String field) implements Expression {

    public boolean isShorthand() {
        return object == null;
    }
}
