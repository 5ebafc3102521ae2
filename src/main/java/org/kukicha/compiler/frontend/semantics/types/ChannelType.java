package org.kukicha.compiler.frontend.semantics.types;

public record ChannelType(Type elementType) implements Type {

    @Override
    public String displayName() {
        return "channel of " + elementType.displayName();
    }
}
