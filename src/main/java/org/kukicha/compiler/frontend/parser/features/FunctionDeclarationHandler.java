package org.kukicha.compiler.frontend.parser.features;

import org.kukicha.compiler.frontend.parser.IDeclarationHandler;
import org.kukicha.compiler.frontend.parser.ParsingContext;
import org.kukicha.compiler.frontend.parser.ast.BlockStmt;
import org.kukicha.compiler.frontend.parser.ast.Declaration;
import org.kukicha.compiler.frontend.parser.ast.FunctionDecl;
import org.kukicha.compiler.frontend.parser.ast.Parameter;
import org.kukicha.compiler.frontend.parser.ast.Receiver;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;
import org.kukicha.compiler.model.Token;
import org.kukicha.compiler.model.TokenType;

import java.util.List;

/**
 * Parses functions and methods.
 * <pre>
 *   func Add(a int, b int) int
 *   func Area on s Square float64
 *   func Greet(name string, greeting string = "Hello") (string, error)
 * </pre>
 * The parameter list may be omitted when there are no parameters.
 */
public class FunctionDeclarationHandler implements IDeclarationHandler {

    @Override
    public Declaration parse(ParsingContext context) {
        Token keyword = context.advance(); // consume func
        Token name = context.consumeName("a function name after '" + keyword.text() + "'");

        Receiver receiver = null;
        if (context.check(TokenType.ON)) {
            Token on = context.advance();
            Token receiverName = context.consumeName("a receiver name after 'on'");
            TypeRef receiverType = context.canStartType() ? context.typeAnnotation() : null;
            receiver = new Receiver(on, receiverName.text(), receiverType);
        }

        List<Parameter> params = List.of();
        if (context.match(TokenType.LPAREN)) {
            params = context.parameters();
            context.consume(TokenType.RPAREN, "')' after the parameters");
        }

        List<TypeRef> returns = List.of();
        if (!context.check(TokenType.NEWLINE) && !context.check(TokenType.INDENT)) {
            returns = context.returnTypes();
        }

        BlockStmt body = context.block();
        return new FunctionDecl(keyword, name.text(), receiver, params, returns, body);
    }
}
