package org.kukicha.compiler.frontend.semantics.types;

public record MapType(Type keyType, Type valueType) implements Type {

    @Override
    public String displayName() {
        return "map of " + keyType.displayName() + " to " + valueType.displayName();
    }
}
