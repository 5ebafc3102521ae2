package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

public record InterfaceDecl(Token token, String name, List<MethodSignature> methods) implements Declaration {

    public InterfaceDecl {
        methods = List.copyOf(methods);
    }
}
