package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

public record ChannelTypeRef(Token token, TypeRef elementType) implements TypeRef {
}
