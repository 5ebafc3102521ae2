package org.kukicha.compiler.frontend.semantics.types;

/**
 * The type of values the analyzer cannot see into: results of external calls, qualified
 * external types and expressions that already failed to type-check. It is compatible with
 * every other type so that one error does not cascade.
 */
public enum UnknownType implements Type {
    INSTANCE;

    @Override
    public String displayName() {
        return "unknown";
    }
}
