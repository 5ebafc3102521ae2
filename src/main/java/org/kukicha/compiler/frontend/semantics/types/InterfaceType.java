package org.kukicha.compiler.frontend.semantics.types;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named interface type with its method set. Like {@link StructType}, methods are attached
 * once every type name is known and identity is the name.
 */
public final class InterfaceType implements Type {

    private final String name;
    private final Map<String, FunctionType> methods = new LinkedHashMap<>();

    public InterfaceType(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    void addMethod(String methodName, FunctionType signature) {
        methods.put(methodName, signature);
    }

    /**
     * @return The method signatures in declaration order.
     */
    public Map<String, FunctionType> methods() {
        return Collections.unmodifiableMap(methods);
    }

    @Override
    public String displayName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InterfaceType other && other.name.equals(name);
    }

    @Override
    public int hashCode() {
        return Objects.hash("interface", name);
    }

    @Override
    public String toString() {
        return "InterfaceType[" + name + "]";
    }
}
