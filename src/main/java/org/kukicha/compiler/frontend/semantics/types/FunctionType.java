package org.kukicha.compiler.frontend.semantics.types;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The signature of a function, method or function value.
 *
 * @param params   The parameter types. For a variadic function the last entry is the element type.
 * @param returns  The result types, possibly empty.
 * @param variadic true if the last parameter is declared with {@code many}.
 */
public record FunctionType(List<Type> params, List<Type> returns, boolean variadic) implements Type {

    public FunctionType {
        params = List.copyOf(params);
        returns = List.copyOf(returns);
    }

    /**
     * @return The single result type, a {@link TupleType} for several results, or
     *         {@link TupleType#EMPTY} for none.
     */
    public Type resultType() {
        if (returns.size() == 1) {
            return returns.get(0);
        }
        return new TupleType(returns);
    }

    /**
     * @return true if the last result is {@code error}.
     */
    public boolean returnsError() {
        return !returns.isEmpty() && returns.get(returns.size() - 1).equals(PrimitiveType.ERROR);
    }

    @Override
    public String displayName() {
        String paramList = params.stream().map(Type::displayName).collect(Collectors.joining(", "));
        String result = switch (returns.size()) {
            case 0 -> "";
            case 1 -> " " + returns.get(0).displayName();
            default -> " (" + returns.stream().map(Type::displayName).collect(Collectors.joining(", ")) + ")";
        };
        return "func(" + paramList + ")" + result;
    }
}
