package org.kukicha.compiler.frontend.parser.features;

import org.kukicha.compiler.frontend.parser.IDeclarationHandler;
import org.kukicha.compiler.frontend.parser.ParsingContext;
import org.kukicha.compiler.frontend.parser.ast.Declaration;
import org.kukicha.compiler.frontend.parser.ast.InterfaceDecl;
import org.kukicha.compiler.frontend.parser.ast.MethodSignature;
import org.kukicha.compiler.frontend.parser.ast.Parameter;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;
import org.kukicha.compiler.model.Token;
import org.kukicha.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses an interface with one method signature per line.
 * <pre>
 *   interface Shape
 *       Area() float64
 *       Name() string
 * </pre>
 */
public class InterfaceDeclarationHandler implements IDeclarationHandler {

    @Override
    public Declaration parse(ParsingContext context) {
        Token keyword = context.advance(); // consume interface
        Token name = context.consumeName("an interface name after 'interface'");
        context.consume(TokenType.NEWLINE, "end of line after the interface name");
        context.consume(TokenType.INDENT, "an indented block of method signatures");

        List<MethodSignature> methods = new ArrayList<>();
        while (!context.check(TokenType.DEDENT) && !context.isAtEnd()) {
            context.skipNewlines();
            if (context.check(TokenType.DEDENT)) {
                break;
            }
            Token methodName = context.consumeName("a method name");
            context.consume(TokenType.LPAREN, "'(' after the method name");
            List<Parameter> params = context.parameters();
            context.consume(TokenType.RPAREN, "')' after the method parameters");
            List<TypeRef> returns = List.of();
            if (!context.check(TokenType.NEWLINE) && !context.check(TokenType.DEDENT)) {
                returns = context.returnTypes();
            }
            methods.add(new MethodSignature(methodName, methodName.text(), params, returns));
            context.endOfStatement();
        }
        context.match(TokenType.DEDENT);
        return new InterfaceDecl(keyword, name.text(), methods);
    }
}
