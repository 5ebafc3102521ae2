package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.frontend.semantics.types.Type;
import org.kukicha.compiler.model.Token;

/**
 * Represents a named entity visible in some scope.
 *
 * @param name    The name the entity is referenced by.
 * @param kind    What the name denotes.
 * @param type    The static type, {@link org.kukicha.compiler.frontend.semantics.types.UnknownType} if not known.
 * @param mutable true if the name may be the target of an assignment.
 * @param token   The token of the declaration, for diagnostics.
 */
public record Symbol(String name, Kind kind, Type type, boolean mutable, Token token) {

    public enum Kind {
        VARIABLE,
        PARAMETER,
        FUNCTION,
        METHOD,
        TYPE,
        FIELD,
        IMPORT,
        CONSTANT
    }
}
