package org.kukicha.compiler.frontend.lexer;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.kukicha.compiler.model.StringSegment;
import org.kukicha.compiler.model.Token;
import org.kukicha.compiler.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Converts Kukicha source text into a flat list of tokens.
 * <p>
 * Block structure is derived from leading spaces: every logical line is compared with the
 * indentation stack and {@link TokenType#INDENT} / {@link TokenType#DEDENT} tokens are emitted
 * accordingly. Newlines inside brackets do not end a line. String literals are split into
 * text and embedded expression segments, the latter lexed recursively.
 * <p>
 * Errors are reported to the {@link DiagnosticsEngine} and scanning continues.
 */
public class Lexer {

    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    /** Number of spaces per indentation level. */
    public static final int INDENT_WIDTH = 4;

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private final boolean fragment;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indentStack = new ArrayDeque<>();

    private int start = 0;
    private int current = 0;
    private int line;
    private int column;
    private int startLine;
    private int startColumn;
    private int nesting = 0;
    private boolean atLineStart = true;
    private boolean lineHasTokens = false;

    /**
     * Creates a lexer for a whole source file.
     * @param source The normalized source text.
     * @param diagnostics The engine to report lexical errors to.
     * @param fileName The logical file name stamped on every token.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String fileName) {
        this(source, diagnostics, fileName, 1, 1, false);
    }

    private Lexer(String source, DiagnosticsEngine diagnostics, String fileName, int line, int column, boolean fragment) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.fileName = fileName;
        this.line = line;
        this.column = column;
        this.fragment = fragment;
    }

    /**
     * Scans the complete input.
     * @return The token list, always terminated by {@link TokenType#EOF}. For valid input the
     *         INDENT and DEDENT tokens are balanced.
     */
    public List<Token> scanTokens() {
        indentStack.push(0);
        while (!isAtEnd()) {
            if (atLineStart && nesting == 0 && !fragment) {
                handleIndentation();
                if (isAtEnd()) {
                    break;
                }
            }
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        if (!fragment) {
            if (lineHasTokens) {
                addStructural(TokenType.NEWLINE);
            }
            while (indentStack.peek() > 0) {
                indentStack.pop();
                addStructural(TokenType.DEDENT);
            }
        }
        tokens.add(new Token(TokenType.EOF, "", null, line, column, fileName));
        if (!fragment) {
            log.debug("Lexed {} tokens from {}", tokens.size(), fileName);
        }
        return tokens;
    }

    private void handleIndentation() {
        int width = 0;
        boolean sawTab = false;
        int tabColumn = column;
        while (!isAtEnd() && (peek() == ' ' || peek() == '\t')) {
            if (peek() == '\t' && !sawTab) {
                sawTab = true;
                tabColumn = column;
            }
            width += peek() == '\t' ? INDENT_WIDTH : 1;
            advance();
        }
        if (isAtEnd() || peek() == '\n' || peek() == '\r' || peek() == '#') {
            // Blank and comment-only lines never change the block structure.
            return;
        }
        atLineStart = false;
        if (sawTab) {
            diagnostics.reportError(ErrorKind.LEX, "Use 4 spaces for indentation, not tabs",
                    fileName, line, tabColumn, "Replace each tab with 4 spaces");
        }
        if (width % INDENT_WIDTH != 0) {
            diagnostics.reportError(ErrorKind.LEX,
                    "Indentation must be a multiple of " + INDENT_WIDTH + " spaces, found " + width,
                    fileName, line, 1);
            width = (width / INDENT_WIDTH) * INDENT_WIDTH;
        }

        int top = indentStack.peek();
        if (width > top) {
            if (width - top != INDENT_WIDTH) {
                diagnostics.reportError(ErrorKind.LEX,
                        "Indentation increased by more than one level", fileName, line, 1,
                        "Indent nested blocks by exactly " + INDENT_WIDTH + " spaces");
            }
            indentStack.push(width);
            addStructural(TokenType.INDENT);
        } else if (width < top) {
            while (indentStack.peek() > width) {
                indentStack.pop();
                addStructural(TokenType.DEDENT);
            }
            if (indentStack.peek() != width) {
                diagnostics.reportError(ErrorKind.LEX, "Indentation mismatch", fileName, line, 1,
                        "Dedent to the level of an enclosing block");
                indentStack.push(width);
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\r' -> { }
            case '\n' -> newline();
            case '#' -> {
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            }
            case '"', '\'' -> string(c);
            case '(' -> open(TokenType.LPAREN);
            case ')' -> close(TokenType.RPAREN);
            case '[' -> open(TokenType.LBRACKET);
            case ']' -> close(TokenType.RBRACKET);
            case '{' -> open(TokenType.LBRACE);
            case '}' -> close(TokenType.RBRACE);
            case ',' -> addToken(TokenType.COMMA);
            case '.' -> addToken(TokenType.DOT);
            case '+' -> addToken(TokenType.PLUS);
            case '-' -> addToken(TokenType.MINUS);
            case '*' -> addToken(TokenType.STAR);
            case '/' -> addToken(TokenType.SLASH);
            case '%' -> addToken(TokenType.PERCENT);
            case ':' -> addToken(match('=') ? TokenType.WALRUS : TokenType.COLON);
            case '=' -> {
                if (match('=')) {
                    addToken(TokenType.DOUBLE_EQUALS);
                } else if (match('>')) {
                    addToken(TokenType.FAT_ARROW);
                } else {
                    addToken(TokenType.ASSIGN);
                }
            }
            case '!' -> addToken(match('=') ? TokenType.NOT_EQUALS : TokenType.BANG);
            case '<' -> addToken(match('=') ? TokenType.LTE : TokenType.LT);
            case '>' -> addToken(match('=') ? TokenType.GTE : TokenType.GT);
            case '|' -> {
                if (match('>')) {
                    addToken(TokenType.PIPE);
                } else if (match('|')) {
                    addToken(TokenType.OR);
                } else {
                    addToken(TokenType.BIT_OR);
                }
            }
            case '&' -> {
                if (match('&')) {
                    addToken(TokenType.AND);
                } else {
                    diagnostics.reportError(ErrorKind.LEX, "Unexpected character '&'",
                            fileName, startLine, startColumn, "Did you mean '&&'?");
                }
            }
            default -> {
                if (isDigit(c)) {
                    number(c);
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    diagnostics.reportError(ErrorKind.LEX, "Unexpected character '" + c + "'",
                            fileName, startLine, startColumn);
                }
            }
        }
    }

    private void newline() {
        if (nesting == 0 && !fragment) {
            if (lineHasTokens) {
                tokens.add(new Token(TokenType.NEWLINE, "\n", null, startLine, startColumn, fileName));
            }
            lineHasTokens = false;
            atLineStart = true;
        }
    }

    private void open(TokenType type) {
        nesting++;
        addToken(type);
    }

    private void close(TokenType type) {
        if (nesting > 0) {
            nesting--;
        }
        addToken(type);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) {
            advance();
        }
        String text = source.substring(start, current);
        addToken(Keywords.lookup(text).orElse(TokenType.IDENTIFIER));
    }

    private void number(char first) {
        if (first == '0' && (peek() == 'x' || peek() == 'X' || peek() == 'o' || peek() == 'O'
                || peek() == 'b' || peek() == 'B')) {
            char prefix = Character.toLowerCase(advance());
            int radix = prefix == 'x' ? 16 : prefix == 'o' ? 8 : 2;
            while (Character.digit(peek(), radix) >= 0 || peek() == '_') {
                advance();
            }
            String digits = source.substring(start + 2, current).replace("_", "");
            addInteger(digits, radix);
            return;
        }
        while (isDigit(peek()) || peek() == '_') {
            advance();
        }
        boolean isFloat = false;
        if (peek() == '.' && isDigit(peekNext())) {
            isFloat = true;
            advance();
            while (isDigit(peek()) || peek() == '_') {
                advance();
            }
        }
        if ((peek() == 'e' || peek() == 'E')
                && (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peekAt(2))))) {
            isFloat = true;
            advance();
            if (peek() == '+' || peek() == '-') {
                advance();
            }
            while (isDigit(peek())) {
                advance();
            }
        }
        String text = source.substring(start, current).replace("_", "");
        if (isFloat) {
            addToken(TokenType.FLOAT, Double.parseDouble(text));
        } else {
            addInteger(text, 10);
        }
    }

    private void addInteger(String digits, int radix) {
        try {
            addToken(TokenType.INTEGER, Long.parseLong(digits, radix));
        } catch (NumberFormatException e) {
            diagnostics.reportError(ErrorKind.LEX, "Invalid integer literal '" + source.substring(start, current) + "'",
                    fileName, startLine, startColumn);
            addToken(TokenType.INTEGER, 0L);
        }
    }

    private void string(char quote) {
        List<StringSegment> segments = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        while (true) {
            if (isAtEnd() || peek() == '\n') {
                diagnostics.reportError(ErrorKind.LEX, "Unterminated string", fileName, startLine, startColumn,
                        "Close the string with " + quote + " on the same line");
                break;
            }
            char c = advance();
            if (c == quote) {
                break;
            }
            if (c == '\\') {
                escape(text);
            } else if (c == '{' && isAlpha(peek())) {
                if (text.length() > 0) {
                    segments.add(new StringSegment.Text(text.toString()));
                    text.setLength(0);
                }
                StringSegment.Embedded embedded = embedded();
                if (embedded != null) {
                    segments.add(embedded);
                }
            } else {
                text.append(c);
            }
        }
        if (text.length() > 0 || segments.isEmpty()) {
            segments.add(new StringSegment.Text(text.toString()));
        }
        addToken(TokenType.STRING, List.copyOf(segments));
    }

    private void escape(StringBuilder text) {
        if (isAtEnd() || peek() == '\n') {
            return;
        }
        char e = advance();
        switch (e) {
            case 'n' -> text.append('\n');
            case 't' -> text.append('\t');
            case 'r' -> text.append('\r');
            case '\\', '"', '\'', '{', '}' -> text.append(e);
            default -> {
                diagnostics.reportError(ErrorKind.LEX, "Unknown escape sequence '\\" + e + "'",
                        fileName, line, column - 2);
                text.append('\\').append(e);
            }
        }
    }

    /**
     * Scans an embedded {@code {expr}} span. The opening brace is already consumed.
     * Braces and nested string literals inside the expression are tracked so the
     * closing brace of the span is found correctly.
     */
    private StringSegment.Embedded embedded() {
        int exprLine = line;
        int exprColumn = column;
        int exprStart = current;
        int depth = 1;
        while (!isAtEnd() && peek() != '\n') {
            char c = peek();
            if (c == '"' || c == '\'') {
                advance();
                while (!isAtEnd() && peek() != '\n' && peek() != c) {
                    if (peek() == '\\') {
                        advance();
                    }
                    advance();
                }
                if (!isAtEnd() && peek() == c) {
                    advance();
                }
                continue;
            }
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    break;
                }
            }
            advance();
        }
        if (depth != 0) {
            diagnostics.reportError(ErrorKind.LEX, "Unclosed '{' in string interpolation",
                    fileName, exprLine, exprColumn - 1, "Escape a literal brace as \\{");
            return null;
        }
        String expr = source.substring(exprStart, current);
        advance(); // closing brace
        List<Token> exprTokens = new Lexer(expr, diagnostics, fileName, exprLine, exprColumn, true).scanTokens();
        return new StringSegment.Embedded(exprTokens, expr);
    }

    private void addStructural(TokenType type) {
        tokens.add(new Token(type, "", null, line, 1, fileName));
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, startLine, startColumn, fileName));
        lineHasTokens = true;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) {
            return false;
        }
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekNext() {
        return peekAt(1);
    }

    private char peekAt(int offset) {
        int index = current + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
