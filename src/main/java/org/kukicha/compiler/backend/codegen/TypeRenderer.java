package org.kukicha.compiler.backend.codegen;

import org.kukicha.compiler.frontend.parser.ast.ChannelTypeRef;
import org.kukicha.compiler.frontend.parser.ast.FunctionTypeRef;
import org.kukicha.compiler.frontend.parser.ast.ListTypeRef;
import org.kukicha.compiler.frontend.parser.ast.MapTypeRef;
import org.kukicha.compiler.frontend.parser.ast.NamedTypeRef;
import org.kukicha.compiler.frontend.parser.ast.PrimitiveTypeRef;
import org.kukicha.compiler.frontend.parser.ast.ReferenceTypeRef;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;
import org.kukicha.compiler.frontend.semantics.types.ChannelType;
import org.kukicha.compiler.frontend.semantics.types.FunctionType;
import org.kukicha.compiler.frontend.semantics.types.InterfaceType;
import org.kukicha.compiler.frontend.semantics.types.ListType;
import org.kukicha.compiler.frontend.semantics.types.MapType;
import org.kukicha.compiler.frontend.semantics.types.PrimitiveType;
import org.kukicha.compiler.frontend.semantics.types.ReferenceType;
import org.kukicha.compiler.frontend.semantics.types.StructType;
import org.kukicha.compiler.frontend.semantics.types.TupleType;
import org.kukicha.compiler.frontend.semantics.types.Type;
import org.kukicha.compiler.frontend.semantics.types.TypeEnvironment;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders type annotations and analyzed types as Go type expressions, and computes zero values.
 * Inside a generic library function the placeholders {@code any} and {@code any2} render as the
 * function's type parameters.
 */
final class TypeRenderer {

    private final TypeEnvironment environment;
    private Map<String, String> placeholders = Map.of();

    TypeRenderer(TypeEnvironment environment) {
        this.environment = environment;
    }

    void setPlaceholders(Map<String, String> placeholders) {
        this.placeholders = Map.copyOf(placeholders);
    }

    void clearPlaceholders() {
        this.placeholders = Map.of();
    }

    String render(TypeRef ref) {
        if (ref instanceof PrimitiveTypeRef p) {
            return placeholders.getOrDefault(p.name(), p.name().equals("any2") ? "any" : p.name());
        }
        if (ref instanceof NamedTypeRef n) {
            return n.name();
        }
        if (ref instanceof ListTypeRef l) {
            return "[]" + render(l.elementType());
        }
        if (ref instanceof MapTypeRef m) {
            return "map[" + render(m.keyType()) + "]" + render(m.valueType());
        }
        if (ref instanceof ReferenceTypeRef r) {
            return "*" + render(r.target());
        }
        if (ref instanceof ChannelTypeRef c) {
            return "chan " + render(c.elementType());
        }
        if (ref instanceof FunctionTypeRef f) {
            String params = f.params().stream().map(this::render).collect(Collectors.joining(", "));
            return "func(" + params + ")" + results(f.returns());
        }
        throw new CodeGenException("Cannot render type " + ref.getClass().getSimpleName(), ref.token());
    }

    /**
     * Renders a result list: nothing, a single type after a space, or a parenthesized list.
     */
    String results(List<TypeRef> returns) {
        return switch (returns.size()) {
            case 0 -> "";
            case 1 -> " " + render(returns.get(0));
            default -> " (" + returns.stream().map(this::render).collect(Collectors.joining(", ")) + ")";
        };
    }

    /**
     * Renders an analyzed type, or empty when the type is not known well enough to be spelled out.
     */
    Optional<String> renderType(Type type) {
        if (type instanceof PrimitiveType p) {
            return Optional.of(placeholders.getOrDefault(p.name(), p.name().equals("any2") ? "any" : p.name()));
        }
        if (type instanceof StructType s) {
            return Optional.of(s.name());
        }
        if (type instanceof InterfaceType i) {
            return Optional.of(i.name());
        }
        if (type instanceof ListType l) {
            return renderType(l.elementType()).map(e -> "[]" + e);
        }
        if (type instanceof MapType m) {
            return renderType(m.keyType()).flatMap(k -> renderType(m.valueType()).map(v -> "map[" + k + "]" + v));
        }
        if (type instanceof ReferenceType r) {
            return renderType(r.target()).map(t -> "*" + t);
        }
        if (type instanceof ChannelType c) {
            return renderType(c.elementType()).map(e -> "chan " + e);
        }
        if (type instanceof FunctionType f) {
            return renderFunction(f);
        }
        if (type instanceof TupleType t && !t.elements().isEmpty()) {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < t.size(); i++) {
                Optional<String> element = renderType(t.elements().get(i));
                if (element.isEmpty()) {
                    return Optional.empty();
                }
                sb.append(i > 0 ? ", " : "").append(element.get());
            }
            return Optional.of(sb.append(')').toString());
        }
        return Optional.empty();
    }

    private Optional<String> renderFunction(FunctionType f) {
        StringBuilder sb = new StringBuilder("func(");
        for (int i = 0; i < f.params().size(); i++) {
            Optional<String> param = renderType(f.params().get(i));
            if (param.isEmpty()) {
                return Optional.empty();
            }
            boolean variadic = f.variadic() && i == f.params().size() - 1;
            sb.append(i > 0 ? ", " : "").append(variadic ? "..." : "").append(param.get());
        }
        sb.append(')');
        if (!f.returns().isEmpty()) {
            Optional<String> result = renderType(f.resultType());
            if (result.isEmpty()) {
                return Optional.empty();
            }
            sb.append(' ').append(result.get());
        }
        return Optional.of(sb.toString());
    }

    /**
     * The Go zero value of an annotated type.
     */
    String zeroValue(TypeRef ref) {
        if (ref instanceof PrimitiveTypeRef p) {
            if (placeholders.containsKey(p.name())) {
                return "*new(" + placeholders.get(p.name()) + ")";
            }
            return primitiveZero(p.name());
        }
        if (ref instanceof NamedTypeRef n) {
            if (n.isQualified()) {
                return "*new(" + n.name() + ")";
            }
            Optional<Type> declared = environment.lookup(n.name());
            if (declared.isPresent() && declared.get() instanceof StructType) {
                return n.name() + "{}";
            }
            if (declared.isPresent() && isNilable(declared.get())) {
                return "nil";
            }
            return "*new(" + n.name() + ")";
        }
        return "nil";
    }

    private static boolean isNilable(Type type) {
        return type instanceof InterfaceType || type instanceof ListType || type instanceof MapType
                || type instanceof ReferenceType || type instanceof ChannelType || type instanceof FunctionType;
    }

    private static String primitiveZero(String name) {
        return switch (name) {
            case "string" -> "\"\"";
            case "bool" -> "false";
            case "error", "any", "any2" -> "nil";
            default -> "0";
        };
    }
}
