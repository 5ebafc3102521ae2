package org.kukicha.compiler.frontend.parser;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.frontend.parser.ast.BlockStmt;
import org.kukicha.compiler.frontend.parser.ast.Expression;
import org.kukicha.compiler.frontend.parser.ast.Parameter;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;
import org.kukicha.compiler.model.Token;
import org.kukicha.compiler.model.TokenType;

import java.util.List;

/**
 * Provides declaration handlers with access to the token stream and to the shared
 * sub-parsers. This interface decouples handlers from the concrete {@link Parser} implementation.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * @return The token after the current one, or the EOF token.
     */
    Token peekNext();

    /**
     * @param offset The distance from the current token; 0 is the current token.
     * @return The token at that offset, or the EOF token.
     */
    Token peekAt(int offset);

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type. Otherwise reports
     * "Expected {@code what} but found ..." and aborts the current statement or declaration.
     * @param type The expected token type.
     * @param what A description of what was expected, e.g. "')' after arguments".
     * @return The consumed token.
     */
    Token consume(TokenType type, String what);

    /**
     * Consumes a name. Keywords are accepted as well, since member and package names
     * such as {@code close} or {@code list} are legal in Go.
     * @param what A description of the expected name for the error message.
     * @return The name token.
     */
    Token consumeName(String what);

    /**
     * Reports a syntax error and returns an exception that aborts the current statement
     * or declaration when thrown.
     * @param token The offending token.
     * @param message The error message.
     * @return The exception to throw.
     */
    RuntimeException error(Token token, String message);

    /**
     * Reports a syntax error without interrupting parsing.
     * @param token The offending token.
     * @param message The error message.
     */
    void reportError(Token token, String message);

    /**
     * Gets the diagnostics engine for reporting errors and warnings.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();

    void skipNewlines();

    /**
     * Expects the end of a simple statement or declaration line: a NEWLINE, or the
     * end of the enclosing block. Lines ending in an indented block need no terminator.
     */
    void endOfStatement();

    String fileName();

    Expression expression();

    /**
     * Parses an indented block, including the line break in front of it.
     * @return The block.
     */
    BlockStmt block();

    TypeRef typeAnnotation();

    /**
     * @return true if the current token can start a type annotation.
     */
    boolean canStartType();

    /**
     * Parses a parameter list. The opening parenthesis must already be consumed;
     * the closing one is left in place.
     * @return The parameters.
     */
    List<Parameter> parameters();

    /**
     * Parses a single result type or a parenthesized list of them.
     * @return The result types.
     */
    List<TypeRef> returnTypes();
}
