package org.kukicha.compiler.frontend.semantics.types;

/**
 * The type of an untyped {@code empty}.
 */
public enum NilType implements Type {
    INSTANCE;

    @Override
    public String displayName() {
        return "empty";
    }
}
