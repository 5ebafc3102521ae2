package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;
import java.util.Optional;

/**
 * The root of the AST for one source file.
 *
 * @param token        The first token of the file.
 * @param fileName     The logical name of the file.
 * @param declarations The top-level declarations in source order.
 */
public record Program(Token token, String fileName, List<Declaration> declarations) implements AstNode {

    public Program {
        declarations = List.copyOf(declarations);
    }

    /**
     * @return The petiole declaration of this file, if it has one.
     */
    public Optional<PackageDecl> packageDecl() {
        return declarations.stream()
                .filter(PackageDecl.class::isInstance)
                .map(PackageDecl.class::cast)
                .findFirst();
    }

    public List<ImportDecl> imports() {
        return declarations.stream()
                .filter(ImportDecl.class::isInstance)
                .map(ImportDecl.class::cast)
                .toList();
    }

    public List<FunctionDecl> functions() {
        return declarations.stream()
                .filter(FunctionDecl.class::isInstance)
                .map(FunctionDecl.class::cast)
                .toList();
    }
}
