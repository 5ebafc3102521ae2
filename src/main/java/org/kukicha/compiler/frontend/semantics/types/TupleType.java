package org.kukicha.compiler.frontend.semantics.types;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The result of a call that yields zero or several values.
 */
public record TupleType(List<Type> elements) implements Type {

    public static final TupleType EMPTY = new TupleType(List.of());

    public TupleType {
        elements = List.copyOf(elements);
    }

    public int size() {
        return elements.size();
    }

    @Override
    public String displayName() {
        if (elements.isEmpty()) {
            return "no value";
        }
        return "(" + elements.stream().map(Type::displayName).collect(Collectors.joining(", ")) + ")";
    }
}
