package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * A method requirement inside an interface declaration.
 */
public record MethodSignature(Token token, String name, List<Parameter> params, List<TypeRef> returns) implements AstNode {

    public MethodSignature {
        params = List.copyOf(params);
        returns = List.copyOf(returns);
    }
}
