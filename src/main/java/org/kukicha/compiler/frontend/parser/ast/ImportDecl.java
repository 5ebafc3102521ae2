package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

/**
 * {@code import "path" [as alias]}.
 *
 * @param token The import keyword.
 * @param path  The import path, e.g. {@code encoding/json}.
 * @param alias The local alias, or null.
 */
public record ImportDecl(Token token, String path, String alias) implements Declaration {

    /**
     * @return The name the import is referenced by in source: the alias, or the last path element.
     */
    public String effectiveName() {
        if (alias != null) {
            return alias;
        }
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
