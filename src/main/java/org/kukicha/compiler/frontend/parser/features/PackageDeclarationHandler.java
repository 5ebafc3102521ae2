package org.kukicha.compiler.frontend.parser.features;

import org.kukicha.compiler.frontend.parser.IDeclarationHandler;
import org.kukicha.compiler.frontend.parser.ParsingContext;
import org.kukicha.compiler.frontend.parser.ast.Declaration;
import org.kukicha.compiler.frontend.parser.ast.PackageDecl;
import org.kukicha.compiler.model.Token;

/**
 * Parses {@code petiole name} (or its alias {@code leaf name}), which names the Go package.
 */
public class PackageDeclarationHandler implements IDeclarationHandler {

    @Override
    public Declaration parse(ParsingContext context) {
        Token keyword = context.advance(); // consume petiole
        Token name = context.consumeName("a package name after '" + keyword.text() + "'");
        context.endOfStatement();
        return new PackageDecl(keyword, name.text());
    }
}
