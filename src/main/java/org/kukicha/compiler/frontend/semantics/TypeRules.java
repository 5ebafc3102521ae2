package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.frontend.parser.ast.BinaryOperator;
import org.kukicha.compiler.frontend.semantics.types.ChannelType;
import org.kukicha.compiler.frontend.semantics.types.FunctionType;
import org.kukicha.compiler.frontend.semantics.types.InterfaceType;
import org.kukicha.compiler.frontend.semantics.types.ListType;
import org.kukicha.compiler.frontend.semantics.types.MapType;
import org.kukicha.compiler.frontend.semantics.types.NilType;
import org.kukicha.compiler.frontend.semantics.types.PrimitiveType;
import org.kukicha.compiler.frontend.semantics.types.ReferenceType;
import org.kukicha.compiler.frontend.semantics.types.TupleType;
import org.kukicha.compiler.frontend.semantics.types.Type;
import org.kukicha.compiler.frontend.semantics.types.UnknownType;

import java.util.List;
import java.util.Optional;

/**
 * Assignability and operator typing.
 * <p>
 * {@link UnknownType} and {@code any} are compatible in both directions, so values of
 * external or generic types never produce errors on their own.
 */
public class TypeRules {

    private final InterfaceSatisfactionChecker interfaces;

    public TypeRules(InterfaceSatisfactionChecker interfaces) {
        this.interfaces = interfaces;
    }

    public boolean isAssignable(Type from, Type to) {
        if (isLenient(from) || isLenient(to)) {
            return true;
        }
        if (from instanceof PrimitiveType source && source.untyped() && to instanceof PrimitiveType target) {
            return source.isInteger() ? target.isNumeric() : target.isFloat();
        }
        if (from instanceof NilType) {
            return acceptsNil(to);
        }
        if (to instanceof InterfaceType iface) {
            return interfaces.satisfies(from, iface);
        }
        if (to.equals(PrimitiveType.ERROR)) {
            return from.equals(PrimitiveType.ERROR) || interfaces.implementsError(from);
        }
        return identical(from, to);
    }

    /**
     * Structural identity where unknown and {@code any} components match anything.
     */
    public boolean identical(Type a, Type b) {
        if (isLenient(a) || isLenient(b)) {
            return true;
        }
        if (a instanceof PrimitiveType pa && b instanceof PrimitiveType pb) {
            return canonical(pa.name()).equals(canonical(pb.name()));
        }
        if (a instanceof ListType la && b instanceof ListType lb) {
            return identical(la.elementType(), lb.elementType());
        }
        if (a instanceof MapType ma && b instanceof MapType mb) {
            return identical(ma.keyType(), mb.keyType()) && identical(ma.valueType(), mb.valueType());
        }
        if (a instanceof ReferenceType ra && b instanceof ReferenceType rb) {
            return identical(ra.target(), rb.target());
        }
        if (a instanceof ChannelType ca && b instanceof ChannelType cb) {
            return identical(ca.elementType(), cb.elementType());
        }
        if (a instanceof FunctionType fa && b instanceof FunctionType fb) {
            return fa.variadic() == fb.variadic()
                    && identicalAll(fa.params(), fb.params())
                    && identicalAll(fa.returns(), fb.returns());
        }
        return a.equals(b);
    }

    /**
     * Types a binary operation.
     * @return The result type, or empty if the operator does not apply to the operand types.
     */
    public Optional<Type> binaryResult(BinaryOperator operator, Type left, Type right) {
        if (operator.isLogical()) {
            return isBoolish(left) && isBoolish(right) ? Optional.of(PrimitiveType.BOOL) : Optional.empty();
        }
        if (operator.isMembership()) {
            if (right instanceof ListType list) {
                return isAssignable(left, list.elementType()) ? Optional.of(PrimitiveType.BOOL) : Optional.empty();
            }
            if (right instanceof MapType map) {
                return isAssignable(left, map.keyType()) ? Optional.of(PrimitiveType.BOOL) : Optional.empty();
            }
            if (isLenient(right) || right.equals(PrimitiveType.STRING)) {
                return Optional.of(PrimitiveType.BOOL);
            }
            return Optional.empty();
        }
        if (operator == BinaryOperator.EQ || operator == BinaryOperator.NE) {
            return isAssignable(left, right) || isAssignable(right, left)
                    ? Optional.of(PrimitiveType.BOOL) : Optional.empty();
        }
        if (isLenient(left) || isLenient(right)) {
            return Optional.of(operator.isComparison() ? PrimitiveType.BOOL : pick(left, right));
        }
        if (!(left instanceof PrimitiveType l) || !(right instanceof PrimitiveType r)) {
            return Optional.empty();
        }
        if (!isAssignable(l, r) && !isAssignable(r, l)) {
            return Optional.empty();
        }
        if (operator.isComparison()) {
            return (l.isNumeric() || l.isString()) ? Optional.of(PrimitiveType.BOOL) : Optional.empty();
        }
        PrimitiveType result = l.untyped() ? r : l;
        if (l.untyped() && r.untyped()) {
            result = l.isFloat() || r.isFloat() ? PrimitiveType.UNTYPED_FLOAT : PrimitiveType.UNTYPED_INT;
        }
        return switch (operator) {
            case ADD -> (result.isNumeric() || result.isString()) ? Optional.of(result) : Optional.empty();
            case SUB, MUL, DIV -> result.isNumeric() ? Optional.of(result) : Optional.empty();
            case MOD, BIT_OR -> result.isInteger() ? Optional.of(result) : Optional.empty();
            default -> Optional.empty();
        };
    }

    private static Type pick(Type left, Type right) {
        return isLenient(left) ? right : left;
    }

    private boolean identicalAll(List<Type> a, List<Type> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!identical(a.get(i), b.get(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isBoolish(Type type) {
        return isLenient(type) || (type instanceof PrimitiveType p && p.isBool());
    }

    public static boolean isLenient(Type type) {
        return type instanceof UnknownType || (type instanceof PrimitiveType p && p.isAny());
    }

    private static boolean acceptsNil(Type type) {
        return type instanceof ReferenceType
                || type instanceof ListType
                || type instanceof MapType
                || type instanceof ChannelType
                || type instanceof FunctionType
                || type instanceof InterfaceType
                || type instanceof NilType
                || type.equals(PrimitiveType.ERROR);
    }

    private static String canonical(String name) {
        return switch (name) {
            case "byte" -> "uint8";
            case "rune" -> "int32";
            default -> name;
        };
    }

    /**
     * @return The number of values a result type carries.
     */
    public static int valueCount(Type type) {
        return type instanceof TupleType tuple ? tuple.size() : 1;
    }
}
