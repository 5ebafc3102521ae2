package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record ReferenceTypeRef(Token token, TypeRef target) implements TypeRef {
}
