package org.kukicha.compiler.frontend.parser;

import org.kukicha.compiler.frontend.parser.ast.AddressOfExpr;
import org.kukicha.compiler.frontend.parser.ast.ArrowLambda;
import org.kukicha.compiler.frontend.parser.ast.BinaryExpr;
import org.kukicha.compiler.frontend.parser.ast.BinaryOperator;
import org.kukicha.compiler.frontend.parser.ast.BlockStmt;
import org.kukicha.compiler.frontend.parser.ast.BooleanLiteral;
import org.kukicha.compiler.frontend.parser.ast.CallExpr;
import org.kukicha.compiler.frontend.parser.ast.CloseExpr;
import org.kukicha.compiler.frontend.parser.ast.DerefExpr;
import org.kukicha.compiler.frontend.parser.ast.DiscardExpr;
import org.kukicha.compiler.frontend.parser.ast.EmptyExpr;
import org.kukicha.compiler.frontend.parser.ast.ErrorExpr;
import org.kukicha.compiler.frontend.parser.ast.Expression;
import org.kukicha.compiler.frontend.parser.ast.FloatLiteral;
import org.kukicha.compiler.frontend.parser.ast.FunctionLiteral;
import org.kukicha.compiler.frontend.parser.ast.Identifier;
import org.kukicha.compiler.frontend.parser.ast.IndexExpr;
import org.kukicha.compiler.frontend.parser.ast.IntegerLiteral;
import org.kukicha.compiler.frontend.parser.ast.ListLiteralExpr;
import org.kukicha.compiler.frontend.parser.ast.ListTypeRef;
import org.kukicha.compiler.frontend.parser.ast.MakeExpr;
import org.kukicha.compiler.frontend.parser.ast.MapLiteralExpr;
import org.kukicha.compiler.frontend.parser.ast.MapTypeRef;
import org.kukicha.compiler.frontend.parser.ast.MethodCallExpr;
import org.kukicha.compiler.frontend.parser.ast.NamedTypeRef;
import org.kukicha.compiler.frontend.parser.ast.PanicExpr;
import org.kukicha.compiler.frontend.parser.ast.Parameter;
import org.kukicha.compiler.frontend.parser.ast.PipeExpr;
import org.kukicha.compiler.frontend.parser.ast.PrimitiveTypeRef;
import org.kukicha.compiler.frontend.parser.ast.ReceiveExpr;
import org.kukicha.compiler.frontend.parser.ast.RecoverExpr;
import org.kukicha.compiler.frontend.parser.ast.ReturnExpr;
import org.kukicha.compiler.frontend.parser.ast.SelectorExpr;
import org.kukicha.compiler.frontend.parser.ast.SliceExpr;
import org.kukicha.compiler.frontend.parser.ast.StringLiteral;
import org.kukicha.compiler.frontend.parser.ast.StructLiteralExpr;
import org.kukicha.compiler.frontend.parser.ast.TypeCastExpr;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;
import org.kukicha.compiler.frontend.parser.ast.UnaryExpr;
import org.kukicha.compiler.model.StringSegment;
import org.kukicha.compiler.model.Token;
import org.kukicha.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Precedence climbing expression parser.
 * <p>
 * Levels, lowest first: {@code or}, pipe {@code |>}, {@code and}, bitwise {@code |},
 * comparison and membership, additive, multiplicative, unary, postfix, primary.
 */
class ExpressionParser {

    private final ParsingContext context;

    ExpressionParser(ParsingContext context) {
        this.context = context;
    }

    Expression expression() {
        return or();
    }

    private Expression or() {
        Expression left = pipe();
        while (context.match(TokenType.OR)) {
            Token operator = context.previous();
            left = new BinaryExpr(operator, BinaryOperator.OR, left, pipe());
        }
        return left;
    }

    private Expression pipe() {
        Expression left = and();
        while (context.match(TokenType.PIPE)) {
            Token operator = context.previous();
            left = new PipeExpr(operator, left, and());
        }
        return left;
    }

    private Expression and() {
        Expression left = bitwiseOr();
        while (context.match(TokenType.AND)) {
            Token operator = context.previous();
            left = new BinaryExpr(operator, BinaryOperator.AND, left, bitwiseOr());
        }
        return left;
    }

    private Expression bitwiseOr() {
        Expression left = comparison();
        while (context.match(TokenType.BIT_OR)) {
            Token operator = context.previous();
            left = new BinaryExpr(operator, BinaryOperator.BIT_OR, left, comparison());
        }
        return left;
    }

    private Expression comparison() {
        Expression left = additive();
        while (true) {
            Token operator = context.peek();
            BinaryOperator op;
            if (context.check(TokenType.NOT) && context.peekNext().type() == TokenType.EQUALS) {
                context.advance();
                context.advance();
                op = BinaryOperator.NE;
            } else if (context.check(TokenType.NOT) && context.peekNext().type() == TokenType.IN) {
                context.advance();
                context.advance();
                op = BinaryOperator.NOT_IN;
            } else if (isComparison(operator.type())) {
                context.advance();
                op = BinaryOperator.fromToken(operator.type()).orElseThrow();
            } else {
                return left;
            }
            left = new BinaryExpr(operator, op, left, additive());
        }
    }

    private static boolean isComparison(TokenType type) {
        return switch (type) {
            case DOUBLE_EQUALS, NOT_EQUALS, LT, GT, LTE, GTE, EQUALS, IN -> true;
            default -> false;
        };
    }

    private Expression additive() {
        Expression left = multiplicative();
        while (context.match(TokenType.PLUS, TokenType.MINUS)) {
            Token operator = context.previous();
            BinaryOperator op = operator.type() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUB;
            left = new BinaryExpr(operator, op, left, multiplicative());
        }
        return left;
    }

    private Expression multiplicative() {
        Expression left = unary();
        while (context.match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token operator = context.previous();
            left = new BinaryExpr(operator, BinaryOperator.fromToken(operator.type()).orElseThrow(), left, unary());
        }
        return left;
    }

    private Expression unary() {
        Token token = context.peek();
        if (context.match(TokenType.NOT, TokenType.BANG)) {
            return new UnaryExpr(token, UnaryExpr.Operator.NOT, unary());
        }
        if (context.match(TokenType.MINUS)) {
            return new UnaryExpr(token, UnaryExpr.Operator.NEGATE, unary());
        }
        if (context.check(TokenType.REFERENCE) && context.peekNext().type() == TokenType.OF) {
            context.advance();
            context.advance();
            return new AddressOfExpr(token, unary());
        }
        if (context.match(TokenType.DEREFERENCE)) {
            return new DerefExpr(token, unary());
        }
        return postfix();
    }

    private Expression postfix() {
        Expression expr = primary();
        while (true) {
            Token token = context.peek();
            if (context.match(TokenType.LPAREN)) {
                CallArguments args = callArguments();
                expr = new CallExpr(expr.token(), expr, args.values(), args.spread());
            } else if (context.match(TokenType.DOT)) {
                expr = member(expr, token);
            } else if (context.match(TokenType.LBRACKET)) {
                expr = indexOrSlice(expr, token);
            } else if (context.match(TokenType.AS)) {
                expr = new TypeCastExpr(token, expr, context.typeAnnotation());
            } else {
                return expr;
            }
        }
    }

    private Expression member(Expression object, Token dot) {
        Token name = context.consumeName("a field or method name after '.'");
        if (context.match(TokenType.LPAREN)) {
            CallArguments args = callArguments();
            return new MethodCallExpr(dot, object, name.text(), args.values(), args.spread());
        }
        if (context.check(TokenType.LBRACE) && object instanceof Identifier pkg) {
            TypeRef type = new NamedTypeRef(pkg.token(), pkg.name() + "." + name.text());
            context.advance();
            return new StructLiteralExpr(pkg.token(), type, bracedFields());
        }
        return new SelectorExpr(dot, object, name.text());
    }

    private Expression indexOrSlice(Expression target, Token bracket) {
        Expression start = null;
        if (!context.check(TokenType.COLON)) {
            start = expression();
            if (!context.check(TokenType.COLON)) {
                context.consume(TokenType.RBRACKET, "']' after the index");
                return new IndexExpr(bracket, target, start);
            }
        }
        context.consume(TokenType.COLON, "':' in slice expression");
        Expression end = context.check(TokenType.RBRACKET) ? null : expression();
        context.consume(TokenType.RBRACKET, "']' after the slice");
        return new SliceExpr(bracket, target, start, end);
    }

    private record CallArguments(List<Expression> values, boolean spread) {
    }

    /**
     * Parses call arguments after the opening parenthesis, including the closing one.
     */
    private CallArguments callArguments() {
        List<Expression> args = new ArrayList<>();
        boolean spread = false;
        if (!context.check(TokenType.RPAREN)) {
            do {
                if (spread) {
                    context.reportError(context.peek(), "Only the last argument can be spread with 'many'");
                }
                if (context.match(TokenType.MANY)) {
                    spread = true;
                }
                args.add(expression());
            } while (context.match(TokenType.COMMA) && !context.check(TokenType.RPAREN));
        }
        context.consume(TokenType.RPAREN, "')' after the arguments");
        return new CallArguments(args, spread);
    }

    private Expression primary() {
        Token token = context.peek();
        switch (token.type()) {
            case INTEGER -> {
                context.advance();
                return new IntegerLiteral(token, (Long) token.value());
            }
            case FLOAT -> {
                context.advance();
                return new FloatLiteral(token, (Double) token.value());
            }
            case STRING -> {
                context.advance();
                return stringLiteral(token);
            }
            case TRUE, FALSE -> {
                context.advance();
                return new BooleanLiteral(token, token.type() == TokenType.TRUE);
            }
            case IDENTIFIER -> {
                if (context.peekNext().type() == TokenType.FAT_ARROW) {
                    return arrowLambda();
                }
                context.advance();
                return identifierOrStructLiteral(token);
            }
            case EMPTY -> {
                context.advance();
                return empty(token);
            }
            case DISCARD -> {
                context.advance();
                return new DiscardExpr(token);
            }
            case ERROR -> {
                context.advance();
                TokenType next = context.peek().type();
                if (next == TokenType.STRING || next == TokenType.IDENTIFIER || next == TokenType.LPAREN) {
                    return new ErrorExpr(token, expression());
                }
                return new Identifier(token, token.text());
            }
            case MAKE -> {
                context.advance();
                return make(token);
            }
            case CLOSE -> {
                context.advance();
                return new CloseExpr(token, expression());
            }
            case PANIC -> {
                context.advance();
                return new PanicExpr(token, expression());
            }
            case RECOVER -> {
                context.advance();
                if (context.check(TokenType.LPAREN) && context.peekNext().type() == TokenType.RPAREN) {
                    context.advance();
                    context.advance();
                }
                return new RecoverExpr(token);
            }
            case RECEIVE -> {
                context.advance();
                context.consume(TokenType.FROM, "'from' after 'receive'");
                return new ReceiveExpr(token, expression());
            }
            case LIST -> {
                if (context.peekNext().type() == TokenType.OF) {
                    return typedList();
                }
                context.advance();
                return new Identifier(token, token.text());
            }
            case MAP -> {
                if (context.peekNext().type() == TokenType.OF) {
                    return typedMap();
                }
                context.advance();
                return new Identifier(token, token.text());
            }
            case LBRACKET -> {
                context.advance();
                return new ListLiteralExpr(token, null, elements(TokenType.RBRACKET, "']' after the list elements"));
            }
            case LPAREN -> {
                if (isArrowLambda()) {
                    return arrowLambda();
                }
                context.advance();
                Expression inner = expression();
                context.consume(TokenType.RPAREN, "')' after the expression");
                return inner;
            }
            case FUNC -> {
                context.advance();
                return functionLiteral(token);
            }
            case DOT -> {
                context.advance();
                return shorthand(token);
            }
            case RETURN -> {
                context.advance();
                List<Expression> values = new ArrayList<>();
                if (!context.check(TokenType.NEWLINE) && !context.check(TokenType.DEDENT)
                        && !context.check(TokenType.EXPLAIN) && !context.isAtEnd()) {
                    do {
                        values.add(expression());
                    } while (context.match(TokenType.COMMA));
                }
                return new ReturnExpr(token, values);
            }
            default -> throw context.error(token, "Expected an expression but found " + token.describe());
        }
    }

    private Expression stringLiteral(Token token) {
        List<StringLiteral.Part> parts = new ArrayList<>();
        @SuppressWarnings("unchecked")
        List<StringSegment> segments = (List<StringSegment>) token.value();
        for (StringSegment segment : segments) {
            if (segment instanceof StringSegment.Text text) {
                parts.add(new StringLiteral.Text(text.text()));
            } else if (segment instanceof StringSegment.Embedded embedded) {
                Parser nested = new Parser(embedded.tokens(), context.getDiagnostics(), context.fileName());
                Optional<Expression> expr = nested.parseStandaloneExpression();
                expr.ifPresent(e -> parts.add(new StringLiteral.Interpolation(e)));
            }
        }
        return new StringLiteral(token, parts);
    }

    private Expression identifierOrStructLiteral(Token name) {
        if (context.check(TokenType.LBRACE)) {
            context.advance();
            return new StructLiteralExpr(name, typeFromName(name), bracedFields());
        }
        if (context.check(TokenType.NEWLINE)
                && context.peekAt(1).type() == TokenType.INDENT
                && context.peekAt(2).type() == TokenType.IDENTIFIER
                && context.peekAt(3).type() == TokenType.COLON) {
            context.advance();
            context.advance();
            return new StructLiteralExpr(name, typeFromName(name), indentedFields());
        }
        return new Identifier(name, name.text());
    }

    private static TypeRef typeFromName(Token name) {
        return PrimitiveTypeRef.isPrimitive(name.text())
                ? new PrimitiveTypeRef(name, name.text())
                : new NamedTypeRef(name, name.text());
    }

    /**
     * {@code name: value, ...} up to and including the closing brace.
     */
    private List<StructLiteralExpr.FieldValue> bracedFields() {
        List<StructLiteralExpr.FieldValue> fields = new ArrayList<>();
        while (!context.check(TokenType.RBRACE) && !context.isAtEnd()) {
            fields.add(fieldValue());
            if (!context.match(TokenType.COMMA)) {
                break;
            }
        }
        context.consume(TokenType.RBRACE, "'}' after the struct fields");
        return fields;
    }

    /**
     * One {@code name: value} per line up to and including the closing DEDENT.
     */
    private List<StructLiteralExpr.FieldValue> indentedFields() {
        List<StructLiteralExpr.FieldValue> fields = new ArrayList<>();
        while (!context.check(TokenType.DEDENT) && !context.isAtEnd()) {
            context.skipNewlines();
            if (context.check(TokenType.DEDENT)) {
                break;
            }
            fields.add(fieldValue());
            context.match(TokenType.COMMA);
            context.skipNewlines();
        }
        context.match(TokenType.DEDENT);
        return fields;
    }

    private StructLiteralExpr.FieldValue fieldValue() {
        Token name = context.consumeName("a field name");
        context.consume(TokenType.COLON, "':' after the field name");
        return new StructLiteralExpr.FieldValue(name, name.text(), expression());
    }

    private Expression empty(Token token) {
        TokenType next = context.peek().type();
        if (next == TokenType.WALRUS || next == TokenType.ASSIGN) {
            return new Identifier(token, token.text());
        }
        if (next == TokenType.IDENTIFIER || next == TokenType.LIST || next == TokenType.MAP
                || next == TokenType.FUNC || next == TokenType.CHANNEL || next == TokenType.REFERENCE) {
            return new EmptyExpr(token, context.typeAnnotation());
        }
        return new EmptyExpr(token, null);
    }

    private Expression make(Token token) {
        context.consume(TokenType.LPAREN, "'(' after 'make'");
        TypeRef type = context.typeAnnotation();
        List<Expression> args = new ArrayList<>();
        while (context.match(TokenType.COMMA)) {
            args.add(expression());
        }
        context.consume(TokenType.RPAREN, "')' after the make arguments");
        return new MakeExpr(token, type, args);
    }

    /**
     * {@code list of T{a, b}}, or {@code list of T} alone as a typed empty value.
     */
    private Expression typedList() {
        Token token = context.advance();
        context.consume(TokenType.OF, "'of' after 'list'");
        TypeRef element = context.typeAnnotation();
        if (!context.match(TokenType.LBRACE)) {
            return new EmptyExpr(token, new ListTypeRef(token, element));
        }
        return new ListLiteralExpr(token, element, elements(TokenType.RBRACE, "'}' after the list elements"));
    }

    private Expression typedMap() {
        Token token = context.advance();
        context.consume(TokenType.OF, "'of' after 'map'");
        TypeRef key = context.typeAnnotation();
        context.consume(TokenType.TO, "'to' after the map key type");
        TypeRef value = context.typeAnnotation();
        if (!context.match(TokenType.LBRACE)) {
            return new EmptyExpr(token, new MapTypeRef(token, key, value));
        }
        List<MapLiteralExpr.Entry> entries = new ArrayList<>();
        while (!context.check(TokenType.RBRACE) && !context.isAtEnd()) {
            Expression k = expression();
            context.consume(TokenType.COLON, "':' after the map key");
            entries.add(new MapLiteralExpr.Entry(k, expression()));
            if (!context.match(TokenType.COMMA)) {
                break;
            }
        }
        context.consume(TokenType.RBRACE, "'}' after the map entries");
        return new MapLiteralExpr(token, key, value, entries);
    }

    private List<Expression> elements(TokenType closing, String what) {
        List<Expression> elements = new ArrayList<>();
        while (!context.check(closing) && !context.isAtEnd()) {
            elements.add(expression());
            if (!context.match(TokenType.COMMA)) {
                break;
            }
        }
        context.consume(closing, what);
        return elements;
    }

    private Expression functionLiteral(Token token) {
        context.consume(TokenType.LPAREN, "'(' after 'func'");
        List<Parameter> params = context.parameters();
        context.consume(TokenType.RPAREN, "')' after the parameters");
        List<TypeRef> returns = List.of();
        if (!context.check(TokenType.NEWLINE) && !context.check(TokenType.INDENT)) {
            returns = context.returnTypes();
        }
        BlockStmt body = context.block();
        return new FunctionLiteral(token, params, returns, body);
    }

    /**
     * Looks past a parenthesized group to see whether {@code =>} follows it.
     */
    private boolean isArrowLambda() {
        int depth = 0;
        for (int offset = 0; ; offset++) {
            Token token = context.peekAt(offset);
            switch (token.type()) {
                case LPAREN -> depth++;
                case RPAREN -> {
                    depth--;
                    if (depth == 0) {
                        return context.peekAt(offset + 1).type() == TokenType.FAT_ARROW;
                    }
                }
                case NEWLINE, INDENT, DEDENT, EOF -> {
                    return false;
                }
                default -> {
                }
            }
        }
    }

    /**
     * {@code x => expr}, {@code (x T, y U) => expr} or an arrow followed by an indented block.
     */
    private Expression arrowLambda() {
        Token start = context.peek();
        List<Parameter> params = new ArrayList<>();
        if (context.check(TokenType.IDENTIFIER)) {
            Token name = context.advance();
            params.add(new Parameter(name, name.text(), null, false, null));
        } else {
            context.consume(TokenType.LPAREN, "'(' before the lambda parameters");
            params.addAll(context.parameters());
            context.consume(TokenType.RPAREN, "')' after the lambda parameters");
        }
        context.consume(TokenType.FAT_ARROW, "'=>' in the lambda");
        if (context.check(TokenType.NEWLINE) && context.peekNext().type() == TokenType.INDENT) {
            return new ArrowLambda(start, params, null, context.block());
        }
        return new ArrowLambda(start, params, expression(), null);
    }

    /**
     * {@code .method(args)} or {@code .field}, valid as the right side of a pipe.
     */
    private Expression shorthand(Token dot) {
        Token name = context.consumeName("a method or field name after '.'");
        if (context.match(TokenType.LPAREN)) {
            CallArguments args = callArguments();
            return new MethodCallExpr(dot, null, name.text(), args.values(), args.spread());
        }
        return new SelectorExpr(dot, null, name.text());
    }
}
