package org.kukicha.compiler.frontend.parser;

import org.kukicha.compiler.frontend.parser.ast.ChannelTypeRef;
import org.kukicha.compiler.frontend.parser.ast.Expression;
import org.kukicha.compiler.frontend.parser.ast.FunctionTypeRef;
import org.kukicha.compiler.frontend.parser.ast.ListTypeRef;
import org.kukicha.compiler.frontend.parser.ast.MapTypeRef;
import org.kukicha.compiler.frontend.parser.ast.NamedTypeRef;
import org.kukicha.compiler.frontend.parser.ast.Parameter;
import org.kukicha.compiler.frontend.parser.ast.PrimitiveTypeRef;
import org.kukicha.compiler.frontend.parser.ast.ReferenceTypeRef;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;
import org.kukicha.compiler.model.Token;
import org.kukicha.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses type annotations, parameter lists and result lists.
 * <pre>
 *   list of string            []string
 *   map of string to int      map[string]int
 *   reference User            *User
 *   channel of int            chan int
 *   func(int) (bool, error)   func(int) (bool, error)
 * </pre>
 */
class TypeParser {

    private final ParsingContext context;

    TypeParser(ParsingContext context) {
        this.context = context;
    }

    boolean canStartType() {
        return switch (context.peek().type()) {
            case IDENTIFIER, LIST, MAP, CHANNEL, REFERENCE, FUNC, ERROR -> true;
            default -> false;
        };
    }

    TypeRef typeAnnotation() {
        Token token = context.peek();
        switch (token.type()) {
            case REFERENCE -> {
                context.advance();
                return new ReferenceTypeRef(token, typeAnnotation());
            }
            case LIST -> {
                context.advance();
                context.consume(TokenType.OF, "'of' after 'list'");
                return new ListTypeRef(token, typeAnnotation());
            }
            case MAP -> {
                context.advance();
                context.consume(TokenType.OF, "'of' after 'map'");
                TypeRef key = typeAnnotation();
                context.consume(TokenType.TO, "'to' after the map key type");
                return new MapTypeRef(token, key, typeAnnotation());
            }
            case CHANNEL -> {
                context.advance();
                context.consume(TokenType.OF, "'of' after 'channel'");
                return new ChannelTypeRef(token, typeAnnotation());
            }
            case FUNC -> {
                context.advance();
                return functionType(token);
            }
            case ERROR -> {
                context.advance();
                return new PrimitiveTypeRef(token, "error");
            }
            case IDENTIFIER -> {
                context.advance();
                if (PrimitiveTypeRef.isPrimitive(token.text())) {
                    return new PrimitiveTypeRef(token, token.text());
                }
                String name = token.text();
                if (context.check(TokenType.DOT)) {
                    context.advance();
                    name = name + "." + context.consumeName("a type name after '.'").text();
                }
                return new NamedTypeRef(token, name);
            }
            default -> throw context.error(token, "Expected a type but found " + token.describe());
        }
    }

    private TypeRef functionType(Token token) {
        context.consume(TokenType.LPAREN, "'(' after 'func'");
        List<TypeRef> params = new ArrayList<>();
        if (!context.check(TokenType.RPAREN)) {
            do {
                params.add(typeAnnotation());
            } while (context.match(TokenType.COMMA));
        }
        context.consume(TokenType.RPAREN, "')' after the parameter types");
        List<TypeRef> returns = List.of();
        if (canStartType() || context.check(TokenType.LPAREN)) {
            returns = returnTypes();
        }
        return new FunctionTypeRef(token, params, returns);
    }

    /**
     * {@code [many] name [Type] [= default]}, comma separated. An untyped variadic
     * parameter accepts values of any type.
     */
    List<Parameter> parameters() {
        List<Parameter> params = new ArrayList<>();
        if (context.check(TokenType.RPAREN)) {
            return params;
        }
        do {
            Token start = context.peek();
            boolean variadic = context.match(TokenType.MANY);
            Token name = context.consumeName("a parameter name");
            TypeRef type = null;
            if (!context.check(TokenType.COMMA) && !context.check(TokenType.RPAREN) && !context.check(TokenType.ASSIGN)) {
                type = typeAnnotation();
            } else if (variadic) {
                type = new PrimitiveTypeRef(name, "any");
            }
            Expression defaultValue = null;
            if (context.match(TokenType.ASSIGN)) {
                defaultValue = context.expression();
            }
            params.add(new Parameter(variadic ? start : name, name.text(), type, variadic, defaultValue));
        } while (context.match(TokenType.COMMA));
        return params;
    }

    List<TypeRef> returnTypes() {
        List<TypeRef> returns = new ArrayList<>();
        if (context.match(TokenType.LPAREN)) {
            do {
                returns.add(typeAnnotation());
            } while (context.match(TokenType.COMMA));
            context.consume(TokenType.RPAREN, "')' after the result types");
        } else {
            returns.add(typeAnnotation());
        }
        return returns;
    }
}
