package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record Identifier(Token token, String name) implements Expression {

    /**
     * @return true for the blank identifier {@code _}.
     */
    public boolean isBlank() {
        return "_".equals(name);
    }
}
