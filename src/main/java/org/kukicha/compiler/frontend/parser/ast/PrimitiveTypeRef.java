package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.Set;

/**
 * A built-in scalar type such as {@code int}, {@code string} or {@code error}.
 */
public record PrimitiveTypeRef(Token token, String name) implements TypeRef {

    /** Names that resolve to primitive types. */
    public static final Set<String> NAMES = Set.of(
            "int", "int8", "int16", "int32", "int64",
            "uint", "uint8", "uint16", "uint32", "uint64",
            "float32", "float64", "string", "bool", "byte", "rune", "error", "any", "any2");

    public static boolean isPrimitive(String name) {
        return NAMES.contains(name);
    }
}
