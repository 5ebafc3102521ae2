package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.kukicha.compiler.frontend.parser.ast.ChannelTypeRef;
import org.kukicha.compiler.frontend.parser.ast.FunctionTypeRef;
import org.kukicha.compiler.frontend.parser.ast.ListTypeRef;
import org.kukicha.compiler.frontend.parser.ast.MapTypeRef;
import org.kukicha.compiler.frontend.parser.ast.NamedTypeRef;
import org.kukicha.compiler.frontend.parser.ast.Parameter;
import org.kukicha.compiler.frontend.parser.ast.PrimitiveTypeRef;
import org.kukicha.compiler.frontend.parser.ast.ReferenceTypeRef;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;
import org.kukicha.compiler.frontend.semantics.types.ChannelType;
import org.kukicha.compiler.frontend.semantics.types.FunctionType;
import org.kukicha.compiler.frontend.semantics.types.ListType;
import org.kukicha.compiler.frontend.semantics.types.MapType;
import org.kukicha.compiler.frontend.semantics.types.PrimitiveType;
import org.kukicha.compiler.frontend.semantics.types.ReferenceType;
import org.kukicha.compiler.frontend.semantics.types.Type;
import org.kukicha.compiler.frontend.semantics.types.TypeEnvironment;
import org.kukicha.compiler.frontend.semantics.types.UnknownType;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns type annotations into {@link Type}s against the named types of the compilation unit.
 */
public class TypeResolver {

    private final TypeEnvironment environment;
    private final DiagnosticsEngine diagnostics;

    public TypeResolver(TypeEnvironment environment, DiagnosticsEngine diagnostics) {
        this.environment = environment;
        this.diagnostics = diagnostics;
    }

    /**
     * Resolves a type annotation. Names that are neither built in nor declared in the unit are
     * reported and resolve to {@link UnknownType}; qualified names ({@code pkg.T}) belong to
     * external packages and always resolve to {@link UnknownType}.
     * @param ref The annotation, or null for a missing one.
     * @return The type.
     */
    public Type resolve(TypeRef ref) {
        if (ref == null) {
            return UnknownType.INSTANCE;
        }
        if (ref instanceof PrimitiveTypeRef primitive) {
            return PrimitiveType.of(primitive.name());
        }
        if (ref instanceof NamedTypeRef named) {
            if (named.isQualified()) {
                return UnknownType.INSTANCE;
            }
            return environment.lookup(named.name()).orElseGet(() -> {
                diagnostics.reportError(ErrorKind.SEMANTIC, "Unknown type '" + named.name() + "'", named.token());
                return UnknownType.INSTANCE;
            });
        }
        if (ref instanceof ListTypeRef list) {
            return new ListType(resolve(list.elementType()));
        }
        if (ref instanceof MapTypeRef map) {
            return new MapType(resolve(map.keyType()), resolve(map.valueType()));
        }
        if (ref instanceof ChannelTypeRef channel) {
            return new ChannelType(resolve(channel.elementType()));
        }
        if (ref instanceof ReferenceTypeRef reference) {
            return new ReferenceType(resolve(reference.target()));
        }
        if (ref instanceof FunctionTypeRef function) {
            return new FunctionType(resolveAll(function.params()), resolveAll(function.returns()), false);
        }
        throw new IllegalStateException("Unhandled type annotation: " + ref.getClass().getSimpleName());
    }

    public List<Type> resolveAll(List<TypeRef> refs) {
        List<Type> types = new ArrayList<>(refs.size());
        for (TypeRef ref : refs) {
            types.add(resolve(ref));
        }
        return types;
    }

    /**
     * Builds the signature of a function from its parameters and result annotations. Missing
     * parameter annotations resolve to {@link UnknownType}; reporting them is up to the caller.
     */
    public FunctionType signature(List<Parameter> params, List<TypeRef> returns) {
        List<Type> paramTypes = new ArrayList<>(params.size());
        boolean variadic = false;
        for (Parameter param : params) {
            paramTypes.add(resolve(param.type()));
            variadic = param.variadic();
        }
        return new FunctionType(paramTypes, resolveAll(returns), variadic);
    }
}
