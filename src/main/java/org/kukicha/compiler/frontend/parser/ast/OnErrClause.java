package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * The {@code onerr} clause trailing a binding, an assignment or an expression statement.
 * <p>
 * Forms:
 * <ul>
 *     <li>{@code onerr <expr>}: {@code handler} is the expression ({@link PanicExpr}, {@link ErrorExpr},
 *     {@link ReturnExpr}, {@link DiscardExpr} or a default value);</li>
 *     <li>{@code onerr} + indented block: {@code handler} is a {@link BlockExpr};</li>
 *     <li>{@code onerr as e} + indented block: as above with {@code alias} set;</li>
 *     <li>{@code onerr return}: {@code shorthandReturn} is set and {@code handler} is null;</li>
 *     <li>{@code onerr explain "hint"}: {@code handler} is null, {@code explain} is set.</li>
 * </ul>
 * Any handler form may be followed by {@code explain "hint"}.
 */
public record OnErrClause(Token token, Expression handler, String explain, String alias, boolean shorthandReturn) implements AstNode {

    public boolean hasExplain() {
        return explain != null;
    }

    /**
     * @return true if this clause propagates the error to the caller of the enclosing function.
     */
    public boolean propagates() {
        return shorthandReturn || (handler == null && explain != null);
    }
}
