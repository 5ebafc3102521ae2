package org.kukicha.compiler.backend.codegen;

import org.kukicha.compiler.model.Token;

/**
 * Thrown when a construct that passed analysis still cannot be lowered to Go.
 * The generator reports it as a diagnostic and drops the enclosing declaration.
 */
public class CodeGenException extends RuntimeException {

    private final transient Token token;

    public CodeGenException(String message, Token token) {
        super(message);
        this.token = token;
    }

    public Token getToken() {
        return token;
    }
}
