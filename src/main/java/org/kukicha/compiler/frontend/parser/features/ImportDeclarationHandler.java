package org.kukicha.compiler.frontend.parser.features;

import org.kukicha.compiler.frontend.parser.IDeclarationHandler;
import org.kukicha.compiler.frontend.parser.ParsingContext;
import org.kukicha.compiler.frontend.parser.ast.Declaration;
import org.kukicha.compiler.frontend.parser.ast.ImportDecl;
import org.kukicha.compiler.model.StringSegment;
import org.kukicha.compiler.model.Token;
import org.kukicha.compiler.model.TokenType;

import java.util.List;

/**
 * Parses {@code import "path" [as alias]}.
 */
public class ImportDeclarationHandler implements IDeclarationHandler {

    @Override
    public Declaration parse(ParsingContext context) {
        Token keyword = context.advance(); // consume import
        Token pathToken = context.consume(TokenType.STRING, "an import path in quotes");
        String path = plainText(pathToken);
        if (path == null || path.isBlank()) {
            throw context.error(pathToken, "Import path must be a non-empty plain string");
        }
        String alias = null;
        if (context.match(TokenType.AS)) {
            alias = context.consumeName("an alias after 'as'").text();
        }
        context.endOfStatement();
        return new ImportDecl(keyword, path, alias);
    }

    @SuppressWarnings("unchecked")
    private static String plainText(Token token) {
        StringBuilder sb = new StringBuilder();
        for (StringSegment segment : (List<StringSegment>) token.value()) {
            if (!(segment instanceof StringSegment.Text text)) {
                return null;
            }
            sb.append(text.text());
        }
        return sb.toString();
    }
}
