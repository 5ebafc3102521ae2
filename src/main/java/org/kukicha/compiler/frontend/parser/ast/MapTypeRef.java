package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record MapTypeRef(Token token, TypeRef keyType, TypeRef valueType) implements TypeRef {
}
