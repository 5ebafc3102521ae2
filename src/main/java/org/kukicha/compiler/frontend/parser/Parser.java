package org.kukicha.compiler.frontend.parser;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.kukicha.compiler.frontend.lexer.Keywords;
import org.kukicha.compiler.frontend.parser.ast.BlockStmt;
import org.kukicha.compiler.frontend.parser.ast.Declaration;
import org.kukicha.compiler.frontend.parser.ast.Expression;
import org.kukicha.compiler.frontend.parser.ast.Parameter;
import org.kukicha.compiler.frontend.parser.ast.Program;
import org.kukicha.compiler.frontend.parser.ast.Statement;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;
import org.kukicha.compiler.model.Token;
import org.kukicha.compiler.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Recursive descent parser that turns the token list of one file into a {@link Program}.
 * <p>
 * Top-level declarations are dispatched through the {@link DeclarationHandlerRegistry};
 * expressions, statements and types are parsed by {@link ExpressionParser},
 * {@link StatementParser} and {@link TypeParser}.
 * <p>
 * A syntax error aborts only the statement or declaration it occurs in. The parser then
 * skips to the next line boundary (and over any block hanging off the broken line) and
 * carries on, so one run reports every independent error in the file.
 */
public class Parser implements ParsingContext {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private final DeclarationHandlerRegistry declarationRegistry;
    private final ExpressionParser expressions;
    private final StatementParser statements;
    private final TypeParser types;
    private int current = 0;

    /**
     * Thrown by {@link #consume} and {@link #error} to unwind to the nearest recovery point.
     * The error itself has already been reported when this is thrown.
     */
    private static final class ParseError extends RuntimeException {
        ParseError(String message) {
            super(message, null, false, false);
        }
    }

    /**
     * Creates a parser with the built-in declaration handlers.
     * @param tokens The tokens of one file, terminated by EOF.
     * @param diagnostics The engine to report syntax errors to.
     * @param fileName The logical file name.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, String fileName) {
        this(tokens, diagnostics, fileName, DeclarationHandlerRegistry.initialize());
    }

    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, String fileName, DeclarationHandlerRegistry declarationRegistry) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.fileName = fileName;
        this.declarationRegistry = declarationRegistry;
        this.expressions = new ExpressionParser(this);
        this.statements = new StatementParser(this);
        this.types = new TypeParser(this);
    }

    /**
     * Parses the whole file.
     * @return The program. Declarations that failed to parse are omitted.
     */
    public Program parse() {
        Token first = peek();
        List<Declaration> declarations = new ArrayList<>();
        skipNewlines();
        while (!isAtEnd()) {
            Token start = peek();
            try {
                Optional<IDeclarationHandler> handler = declarationRegistry.get(start.type());
                if (handler.isEmpty()) {
                    throw error(start, "Expected a declaration (func, type, interface, import or petiole) but found " + start.describe());
                }
                Declaration declaration = handler.get().parse(this);
                if (declaration != null) {
                    declarations.add(declaration);
                }
            } catch (ParseError e) {
                synchronizeDeclaration();
            }
            skipNewlines();
        }
        log.debug("Parsed {} declarations from {}", declarations.size(), fileName);
        return new Program(first, fileName, declarations);
    }

    /**
     * Parses a single expression spanning the whole token list. Used for the
     * embedded expressions of interpolated strings.
     * @return The expression, or empty if it could not be parsed.
     */
    public Optional<Expression> parseStandaloneExpression() {
        try {
            Expression expr = expression();
            if (!isAtEnd()) {
                throw error(peek(), "Expected '}' to close the interpolation but found " + peek().describe());
            }
            return Optional.of(expr);
        } catch (ParseError e) {
            return Optional.empty();
        }
    }

    /**
     * Parses one statement of a block, recovering from syntax errors.
     * @return The statement, or null if it failed to parse.
     */
    Statement statementWithRecovery() {
        try {
            return statements.statement();
        } catch (ParseError e) {
            synchronizeStatement();
            return null;
        }
    }

    private void synchronizeStatement() {
        while (!isAtEnd() && !check(TokenType.NEWLINE) && !check(TokenType.DEDENT)) {
            if (check(TokenType.INDENT)) {
                skipIndentedBlock();
                return;
            }
            advance();
        }
        match(TokenType.NEWLINE);
        if (check(TokenType.INDENT)) {
            skipIndentedBlock();
        }
    }

    private void synchronizeDeclaration() {
        while (!isAtEnd()) {
            synchronizeStatement();
            if (isAtEnd() || declarationRegistry.get(peek().type()).isPresent()) {
                return;
            }
            if (check(TokenType.DEDENT)) {
                advance();
            }
        }
    }

    private void skipIndentedBlock() {
        int depth = 0;
        do {
            if (check(TokenType.INDENT)) {
                depth++;
            } else if (check(TokenType.DEDENT)) {
                depth--;
            }
            advance();
        } while (depth > 0 && !isAtEnd());
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) {
            current++;
        }
        return previous();
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token peekNext() {
        return peekAt(1);
    }

    @Override
    public Token peekAt(int offset) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    @Override
    public Token previous() {
        return current == 0 ? tokens.get(0) : tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, String what) {
        if (check(type)) {
            return advance();
        }
        throw error(peek(), "Expected " + what + " but found " + peek().describe());
    }

    @Override
    public Token consumeName(String what) {
        Token token = peek();
        if (token.type() == TokenType.IDENTIFIER || Keywords.isKeyword(token.text())) {
            return advance();
        }
        throw error(token, "Expected " + what + " but found " + token.describe());
    }

    @Override
    public RuntimeException error(Token token, String message) {
        reportError(token, message);
        return new ParseError(message);
    }

    @Override
    public void reportError(Token token, String message) {
        diagnostics.reportError(ErrorKind.SYNTAX, message, token);
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    @Override
    public void skipNewlines() {
        while (match(TokenType.NEWLINE)) {
            // skip
        }
    }

    @Override
    public void endOfStatement() {
        if (match(TokenType.NEWLINE) || check(TokenType.DEDENT) || isAtEnd()) {
            return;
        }
        if (current > 0 && previous().type() == TokenType.DEDENT) {
            return;
        }
        throw error(peek(), "Expected end of line but found " + peek().describe());
    }

    @Override
    public String fileName() {
        return fileName;
    }

    @Override
    public Expression expression() {
        return expressions.expression();
    }

    @Override
    public BlockStmt block() {
        skipNewlines();
        Token start = consume(TokenType.INDENT, "an indented block");
        List<Statement> body = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            skipNewlines();
            if (check(TokenType.DEDENT) || isAtEnd()) {
                break;
            }
            Statement statement = statementWithRecovery();
            if (statement != null) {
                body.add(statement);
            }
        }
        match(TokenType.DEDENT);
        return new BlockStmt(start, body);
    }

    @Override
    public TypeRef typeAnnotation() {
        return types.typeAnnotation();
    }

    @Override
    public boolean canStartType() {
        return types.canStartType();
    }

    @Override
    public List<Parameter> parameters() {
        return types.parameters();
    }

    @Override
    public List<TypeRef> returnTypes() {
        return types.returnTypes();
    }
}
