package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * A struct type ({@code type Name} with an indented field block) or a defined type
 * ({@code type Name OtherType}). Exactly one of {@code fields} and {@code aliasType} is meaningful:
 * an alias has a non-null {@code aliasType} and no fields.
 */
public record TypeDecl(Token token, String name, List<FieldDecl> fields, TypeRef aliasType) implements Declaration {

    public TypeDecl {
        fields = List.copyOf(fields);
    }

    public boolean isAlias() {
        return aliasType != null;
    }
}
