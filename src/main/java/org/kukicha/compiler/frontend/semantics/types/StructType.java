package org.kukicha.compiler.frontend.semantics.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A named struct type. Fields are attached after all type names of the compilation
 * unit are known, so that fields can refer to types declared later (or to the struct itself).
 * Identity is the type name.
 */
public final class StructType implements Type {

    /**
     * A struct field.
     *
     * @param name The field name.
     * @param type The field type.
     * @param tag  The Go struct tag, or null.
     */
    public record Field(String name, Type type, String tag) {
    }

    private final String name;
    private final Map<String, Field> fields = new LinkedHashMap<>();

    public StructType(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    void addField(Field field) {
        fields.put(field.name(), field);
    }

    /**
     * @return The fields in declaration order.
     */
    public Map<String, Field> fields() {
        return Collections.unmodifiableMap(fields);
    }

    public Optional<Field> field(String fieldName) {
        return Optional.ofNullable(fields.get(fieldName));
    }

    @Override
    public String displayName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StructType other && other.name.equals(name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("struct", name);
    }

    @Override
    public String toString() {
        return "StructType[" + name + "]";
    }
}
