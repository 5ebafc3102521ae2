package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * A struct field.
 *
 * @param token The field name token.
 * @param name  The field name.
 * @param type  The field type.
 * @param tag   The raw Go struct tag without backquotes (e.g. {@code json:"id"}), or null.
 */
public record FieldDecl(Token token, String name, TypeRef type, String tag) implements AstNode {
}
