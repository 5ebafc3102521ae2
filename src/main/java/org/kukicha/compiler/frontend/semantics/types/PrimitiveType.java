package org.kukicha.compiler.frontend.semantics.types;

import java.util.Set;

/**
 * A built-in scalar type, {@code error} or {@code any}.
 * <p>
 * Integer and float literals have an untyped variant that converts implicitly to any
 * numeric type of the matching kind.
 *
 * @param name    The Kukicha (and Go) spelling.
 * @param untyped true for the type of a bare numeric literal.
 */
public record PrimitiveType(String name, boolean untyped) implements Type {

    public static final PrimitiveType INT = new PrimitiveType("int", false);
    public static final PrimitiveType INT64 = new PrimitiveType("int64", false);
    public static final PrimitiveType FLOAT64 = new PrimitiveType("float64", false);
    public static final PrimitiveType STRING = new PrimitiveType("string", false);
    public static final PrimitiveType BOOL = new PrimitiveType("bool", false);
    public static final PrimitiveType BYTE = new PrimitiveType("byte", false);
    public static final PrimitiveType RUNE = new PrimitiveType("rune", false);
    public static final PrimitiveType ERROR = new PrimitiveType("error", false);
    public static final PrimitiveType ANY = new PrimitiveType("any", false);
    public static final PrimitiveType ANY2 = new PrimitiveType("any2", false);
    public static final PrimitiveType UNTYPED_INT = new PrimitiveType("int", true);
    public static final PrimitiveType UNTYPED_FLOAT = new PrimitiveType("float64", true);

    private static final Set<String> INTEGERS = Set.of(
            "int", "int8", "int16", "int32", "int64",
            "uint", "uint8", "uint16", "uint32", "uint64", "byte", "rune");
    private static final Set<String> FLOATS = Set.of("float32", "float64");

    public static PrimitiveType of(String name) {
        return new PrimitiveType(name, false);
    }

    public boolean isInteger() {
        return INTEGERS.contains(name);
    }

    public boolean isFloat() {
        return FLOATS.contains(name);
    }

    public boolean isNumeric() {
        return isInteger() || isFloat();
    }

    public boolean isString() {
        return name.equals("string");
    }

    public boolean isBool() {
        return name.equals("bool");
    }

    /**
     * @return true for {@code any} and the second generic placeholder {@code any2}.
     */
    public boolean isAny() {
        return name.equals("any") || name.equals("any2");
    }

    /**
     * @return This type with the untyped flag cleared.
     */
    public PrimitiveType typed() {
        return untyped ? of(name) : this;
    }

    @Override
    public String displayName() {
        return name;
    }
}
