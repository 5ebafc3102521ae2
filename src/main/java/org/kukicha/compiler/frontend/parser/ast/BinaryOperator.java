package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.TokenType;

import java.util.Optional;

/**
 * Binary operators. Each carries the Go spelling and the canonical Kukicha spelling.
 */
public enum BinaryOperator {
    OR("||", "or"),
    AND("&&", "and"),
    BIT_OR("|", "|"),
    EQ("==", "=="),
    NE("!=", "!="),
    LT("<", "<"),
    GT(">", ">"),
    LE("<=", "<="),
    GE(">=", ">="),
    ADD("+", "+"),
    SUB("-", "-"),
    MUL("*", "*"),
    DIV("/", "/"),
    MOD("%", "%"),
    IN("in", "in"),
    NOT_IN("not in", "not in");

    private final String goSymbol;
    private final String surface;

    BinaryOperator(String goSymbol, String surface) {
        this.goSymbol = goSymbol;
        this.surface = surface;
    }

    public String goSymbol() {
        return goSymbol;
    }

    public String surface() {
        return surface;
    }

    public boolean isComparison() {
        return this == EQ || this == NE || this == LT || this == GT || this == LE || this == GE;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    public boolean isMembership() {
        return this == IN || this == NOT_IN;
    }

    /**
     * Maps a single operator token to its operator. Multi-token forms such as {@code not in}
     * are assembled by the parser.
     */
    public static Optional<BinaryOperator> fromToken(TokenType type) {
        return Optional.ofNullable(switch (type) {
            case OR -> OR;
            case AND -> AND;
            case BIT_OR -> BIT_OR;
            case DOUBLE_EQUALS, EQUALS -> EQ;
            case NOT_EQUALS -> NE;
            case LT -> LT;
            case GT -> GT;
            case LTE -> LE;
            case GTE -> GE;
            case PLUS -> ADD;
            case MINUS -> SUB;
            case STAR -> MUL;
            case SLASH -> DIV;
            case PERCENT -> MOD;
            case IN -> IN;
            default -> null;
        });
    }
}
