package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * A function or, when {@code receiver} is non-null, a method.
 *
 * @param token    The func keyword.
 * @param name     The function name.
 * @param receiver The receiver of a method, or null for plain functions.
 * @param params   The parameters in declaration order.
 * @param returns  The declared result types, possibly empty.
 * @param body     The function body.
 */
public record FunctionDecl(
        Token token,
        String name,
        Receiver receiver,
        List<Parameter> params,
        List<TypeRef> returns,
        BlockStmt body
) implements Declaration {

    public FunctionDecl {
        params = List.copyOf(params);
        returns = List.copyOf(returns);
    }

    public boolean isMethod() {
        return receiver != null;
    }
}
