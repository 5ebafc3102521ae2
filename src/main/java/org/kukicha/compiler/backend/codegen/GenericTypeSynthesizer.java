package org.kukicha.compiler.backend.codegen;

import org.kukicha.compiler.frontend.parser.ast.AstNode;
import org.kukicha.compiler.frontend.parser.ast.AstNodes;
import org.kukicha.compiler.frontend.parser.ast.FunctionDecl;
import org.kukicha.compiler.frontend.parser.ast.MapTypeRef;
import org.kukicha.compiler.frontend.parser.ast.Parameter;
import org.kukicha.compiler.frontend.parser.ast.PrimitiveTypeRef;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the {@code any}/{@code any2} placeholders of a library function's signature into Go type
 * parameters: {@code any} becomes {@code T} and {@code any2} becomes {@code K}. A parameter is
 * constrained to {@code comparable} when the function uses it as a map key.
 */
final class GenericTypeSynthesizer {

    /**
     * A synthesized type parameter list.
     *
     * @param placeholders placeholder name to type parameter name
     * @param declaration  the Go list including brackets, or an empty string
     */
    record Generics(Map<String, String> placeholders, String declaration) {
        static final Generics NONE = new Generics(Map.of(), "");

        boolean isGeneric() {
            return !placeholders.isEmpty();
        }
    }

    private static final Map<String, String> NAMES = Map.of("any", "T", "any2", "K");

    Generics synthesize(FunctionDecl decl) {
        if (decl.isMethod()) {
            return Generics.NONE;
        }
        List<TypeRef> signature = new ArrayList<>();
        for (Parameter param : decl.params()) {
            if (param.type() != null && !(param.variadic() && isPlaceholder(param.type(), "any"))) {
                signature.add(param.type());
            }
        }
        signature.addAll(decl.returns());

        Map<String, String> placeholders = new LinkedHashMap<>();
        StringBuilder declaration = new StringBuilder();
        for (String placeholder : List.of("any", "any2")) {
            if (signature.stream().noneMatch(ref -> mentions(ref, placeholder))) {
                continue;
            }
            String name = NAMES.get(placeholder);
            placeholders.put(placeholder, name);
            declaration.append(declaration.length() == 0 ? "[" : ", ")
                    .append(name).append(' ')
                    .append(usedAsMapKey(decl, placeholder) ? "comparable" : "any");
        }
        if (placeholders.isEmpty()) {
            return Generics.NONE;
        }
        return new Generics(placeholders, declaration.append(']').toString());
    }

    private static boolean mentions(AstNode ref, String placeholder) {
        boolean[] found = {false};
        AstNodes.walk(ref, node -> found[0] |= isPlaceholder(node, placeholder));
        return found[0];
    }

    private static boolean usedAsMapKey(FunctionDecl decl, String placeholder) {
        boolean[] found = {false};
        AstNodes.walk(decl, node -> {
            if (node instanceof MapTypeRef map && isPlaceholder(map.keyType(), placeholder)) {
                found[0] = true;
            }
        });
        return found[0];
    }

    private static boolean isPlaceholder(AstNode node, String placeholder) {
        return node instanceof PrimitiveTypeRef p && p.name().equals(placeholder);
    }
}
