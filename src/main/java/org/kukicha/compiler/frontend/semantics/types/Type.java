package org.kukicha.compiler.frontend.semantics.types;

/**
 * The static type of a Kukicha value.
 * <p>
 * Types are immutable values compared structurally, except {@link StructType} and
 * {@link InterfaceType}, which are nominal and compared by name.
 */
public sealed interface Type
        permits PrimitiveType, StructType, InterfaceType, ListType, MapType, ReferenceType,
        ChannelType, FunctionType, TupleType, NilType, UnknownType {

    /**
     * @return The type as it would be written in Kukicha source, for error messages.
     */
    String displayName();

    default boolean isUnknown() {
        return this instanceof UnknownType;
    }
}
