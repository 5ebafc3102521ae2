package org.kukicha.compiler.model;

/**
 * Defines the different types of tokens that the lexer can produce.
 */
public enum TokenType {
    // Literals
    IDENTIFIER, INTEGER, FLOAT, STRING, TRUE, FALSE,

    // Declarations
    PETIOLE, IMPORT, TYPE, INTERFACE, FUNC, ON, MANY, AS,

    // Statements
    RETURN, IF, ELSE, FOR, IN, FROM, TO, THROUGH, SWITCH, WHEN, OTHERWISE,
    BREAK, CONTINUE, GO, DEFER, SEND, ONERR, EXPLAIN,

    // Expression keywords
    MAKE, LIST, MAP, CHANNEL, OF, RECEIVE, CLOSE, PANIC, RECOVER, ERROR,
    EMPTY, REFERENCE, DEREFERENCE, DISCARD, AND, OR, NOT, EQUALS,

    // Operators
    WALRUS, ASSIGN, DOUBLE_EQUALS, NOT_EQUALS, LT, GT, LTE, GTE,
    PLUS, MINUS, STAR, SLASH, PERCENT, BANG, PIPE, BIT_OR, FAT_ARROW,

    // Punctuation
    LPAREN, RPAREN, LBRACKET, RBRACKET, LBRACE, RBRACE, COMMA, DOT, COLON,

    // Structure
    NEWLINE, INDENT, DEDENT, EOF
}
