package org.kukicha.compiler.frontend.semantics.types;

/**
 * A pointer to {@code target}.
 */
public record ReferenceType(Type target) implements Type {

    @Override
    public String displayName() {
        return "reference " + target.displayName();
    }
}
