package org.kukicha.compiler.frontend.semantics.types;

public record ListType(Type elementType) implements Type {

    @Override
    public String displayName() {
        return "list of " + elementType.displayName();
    }
}
