package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * A user-defined or imported type, e.g. {@code Todo} or {@code http.Request}.
 */
public record NamedTypeRef(Token token, String name) implements TypeRef {

    public boolean isQualified() {
        return name.indexOf('.') > 0;
    }
}
