package org.kukicha.compiler.frontend.semantics.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The named types of a compilation unit together with the methods declared on them.
 * Shared by every file of the unit.
 */
public class TypeEnvironment {

    private final Map<String, Type> named = new LinkedHashMap<>();
    private final Map<String, Map<String, FunctionType>> methods = new HashMap<>();

    /**
     * Declares a named type.
     * @param name The type name.
     * @param type The type. For aliases this is the aliased type.
     * @return false if a type of that name already exists.
     */
    public boolean declare(String name, Type type) {
        return named.putIfAbsent(name, type) == null;
    }

    /**
     * Replaces the type bound to a name declared earlier, used once the target of a
     * defined type is resolved.
     */
    public void redefine(String name, Type type) {
        named.put(name, type);
    }

    public Optional<Type> lookup(String name) {
        return Optional.ofNullable(named.get(name));
    }

    public boolean isDeclared(String name) {
        return named.containsKey(name);
    }

    public void addField(StructType struct, StructType.Field field) {
        struct.addField(field);
    }

    public void addInterfaceMethod(InterfaceType iface, String methodName, FunctionType signature) {
        iface.addMethod(methodName, signature);
    }

    /**
     * Declares a method on the named receiver type.
     * @return false if the receiver type already has a method of that name.
     */
    public boolean declareMethod(String receiverTypeName, String methodName, FunctionType signature) {
        Map<String, FunctionType> set = methods.computeIfAbsent(receiverTypeName, k -> new LinkedHashMap<>());
        return set.putIfAbsent(methodName, signature) == null;
    }

    /**
     * Returns the methods callable on a value of the given type. Methods declared on a type
     * are visible through a reference to it as well, and an interface exposes its own method set.
     * @param type The receiver type.
     * @return The method set, possibly empty.
     */
    public Map<String, FunctionType> methodSet(Type type) {
        if (type instanceof ReferenceType ref) {
            return methodSet(ref.target());
        }
        if (type instanceof InterfaceType iface) {
            return iface.methods();
        }
        if (type instanceof StructType struct) {
            return Collections.unmodifiableMap(methods.getOrDefault(struct.name(), Map.of()));
        }
        return Map.of();
    }

    public Optional<FunctionType> method(Type receiver, String methodName) {
        return Optional.ofNullable(methodSet(receiver).get(methodName));
    }

    public List<StructType> structs() {
        List<StructType> result = new ArrayList<>();
        for (Type type : named.values()) {
            if (type instanceof StructType struct && !result.contains(struct)) {
                result.add(struct);
            }
        }
        return result;
    }

    public List<InterfaceType> interfaces() {
        List<InterfaceType> result = new ArrayList<>();
        for (Type type : named.values()) {
            if (type instanceof InterfaceType iface && !result.contains(iface)) {
                result.add(iface);
            }
        }
        return result;
    }
}
