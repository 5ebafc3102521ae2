package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * {@code func(T, U) R} or {@code func(T) (R, error)}.
 */
public record FunctionTypeRef(Token token, List<TypeRef> params, List<TypeRef> returns) implements TypeRef {

    public FunctionTypeRef {
        params = List.copyOf(params);
        returns = List.copyOf(returns);
    }
}
