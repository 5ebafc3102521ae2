package org.kukicha.compiler.frontend.parser.features;

import org.kukicha.compiler.frontend.parser.IDeclarationHandler;
import org.kukicha.compiler.frontend.parser.ParsingContext;
import org.kukicha.compiler.frontend.parser.ast.Declaration;
import org.kukicha.compiler.frontend.parser.ast.FieldDecl;
import org.kukicha.compiler.frontend.parser.ast.TypeDecl;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;
import org.kukicha.compiler.model.StringSegment;
import org.kukicha.compiler.model.Token;
import org.kukicha.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses struct and defined type declarations.
 * <pre>
 *   type Todo
 *       id int64 as "id"
 *       title string json:"title,omitempty"
 *
 *   type Handler func(string) error
 * </pre>
 */
public class TypeDeclarationHandler implements IDeclarationHandler {

    @Override
    public Declaration parse(ParsingContext context) {
        Token keyword = context.advance(); // consume type
        Token name = context.consumeName("a type name after 'type'");

        if (context.canStartType()) {
            TypeRef aliasType = context.typeAnnotation();
            context.endOfStatement();
            return new TypeDecl(keyword, name.text(), List.of(), aliasType);
        }

        List<FieldDecl> fields = new ArrayList<>();
        context.consume(TokenType.NEWLINE, "end of line after the type name");
        if (!context.match(TokenType.INDENT)) {
            return new TypeDecl(keyword, name.text(), fields, null);
        }
        while (!context.check(TokenType.DEDENT) && !context.isAtEnd()) {
            context.skipNewlines();
            if (context.check(TokenType.DEDENT)) {
                break;
            }
            fields.add(field(context));
            context.endOfStatement();
        }
        context.match(TokenType.DEDENT);
        return new TypeDecl(keyword, name.text(), fields, null);
    }

    private FieldDecl field(ParsingContext context) {
        Token name = context.consumeName("a field name");
        TypeRef type = context.typeAnnotation();
        String tag = null;
        if (context.match(TokenType.AS)) {
            Token alias = context.consume(TokenType.STRING, "a JSON name in quotes after 'as'");
            tag = "json:\"" + text(alias) + "\"";
        }
        if (context.check(TokenType.IDENTIFIER) && context.peekNext().type() == TokenType.COLON) {
            Token key = context.advance();
            context.advance(); // consume ':'
            Token value = context.consume(TokenType.STRING, "a quoted tag value after '" + key.text() + ":'");
            if (tag != null) {
                context.reportError(key, "Cannot combine a field alias and an explicit struct tag on the same field");
            } else {
                tag = key.text() + ":\"" + text(value) + "\"";
            }
        }
        return new FieldDecl(name, name.text(), type, tag);
    }

    @SuppressWarnings("unchecked")
    private static String text(Token stringToken) {
        StringBuilder sb = new StringBuilder();
        for (StringSegment segment : (List<StringSegment>) stringToken.value()) {
            if (segment instanceof StringSegment.Text text) {
                sb.append(text.text());
            }
        }
        return sb.toString();
    }
}
