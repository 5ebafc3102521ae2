package org.kukicha.compiler.frontend.lexer;

import org.kukicha.compiler.model.TokenType;

import java.util.Map;
import java.util.Optional;

import static java.util.Map.entry;

/**
 * Fixed lexeme to keyword table. Whether a keyword such as {@code list} introduces a
 * type or acts as a plain name is decided by the parser, not here.
 */
public final class Keywords {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            entry("petiole", TokenType.PETIOLE),
            entry("leaf", TokenType.PETIOLE),
            entry("import", TokenType.IMPORT),
            entry("type", TokenType.TYPE),
            entry("interface", TokenType.INTERFACE),
            entry("func", TokenType.FUNC),
            entry("function", TokenType.FUNC),
            entry("on", TokenType.ON),
            entry("many", TokenType.MANY),
            entry("as", TokenType.AS),
            entry("return", TokenType.RETURN),
            entry("if", TokenType.IF),
            entry("else", TokenType.ELSE),
            entry("for", TokenType.FOR),
            entry("in", TokenType.IN),
            entry("from", TokenType.FROM),
            entry("to", TokenType.TO),
            entry("through", TokenType.THROUGH),
            entry("switch", TokenType.SWITCH),
            entry("when", TokenType.WHEN),
            entry("otherwise", TokenType.OTHERWISE),
            entry("break", TokenType.BREAK),
            entry("continue", TokenType.CONTINUE),
            entry("go", TokenType.GO),
            entry("defer", TokenType.DEFER),
            entry("send", TokenType.SEND),
            entry("onerr", TokenType.ONERR),
            entry("explain", TokenType.EXPLAIN),
            entry("make", TokenType.MAKE),
            entry("list", TokenType.LIST),
            entry("map", TokenType.MAP),
            entry("channel", TokenType.CHANNEL),
            entry("of", TokenType.OF),
            entry("receive", TokenType.RECEIVE),
            entry("close", TokenType.CLOSE),
            entry("panic", TokenType.PANIC),
            entry("recover", TokenType.RECOVER),
            entry("error", TokenType.ERROR),
            entry("empty", TokenType.EMPTY),
            entry("nil", TokenType.EMPTY),
            entry("reference", TokenType.REFERENCE),
            entry("dereference", TokenType.DEREFERENCE),
            entry("discard", TokenType.DISCARD),
            entry("and", TokenType.AND),
            entry("or", TokenType.OR),
            entry("not", TokenType.NOT),
            entry("equals", TokenType.EQUALS),
            entry("true", TokenType.TRUE),
            entry("false", TokenType.FALSE)
    );

    private Keywords() {}

    /**
     * @param lexeme An identifier-shaped lexeme.
     * @return The keyword token type, or empty if the lexeme is an ordinary identifier.
     */
    public static Optional<TokenType> lookup(String lexeme) {
        return Optional.ofNullable(KEYWORDS.get(lexeme));
    }

    public static boolean isKeyword(String lexeme) {
        return KEYWORDS.containsKey(lexeme);
    }
}
