package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record ListTypeRef(Token token, TypeRef elementType) implements TypeRef {
}
