package org.kukicha.compiler.frontend.parser;

import org.kukicha.compiler.frontend.parser.ast.AssignStmt;
import org.kukicha.compiler.frontend.parser.ast.BlockExpr;
import org.kukicha.compiler.frontend.parser.ast.BlockStmt;
import org.kukicha.compiler.frontend.parser.ast.BreakStmt;
import org.kukicha.compiler.frontend.parser.ast.CallExpr;
import org.kukicha.compiler.frontend.parser.ast.ContinueStmt;
import org.kukicha.compiler.frontend.parser.ast.DeferStmt;
import org.kukicha.compiler.frontend.parser.ast.Expression;
import org.kukicha.compiler.frontend.parser.ast.ExpressionStmt;
import org.kukicha.compiler.frontend.parser.ast.ForConditionStmt;
import org.kukicha.compiler.frontend.parser.ast.ForNumericStmt;
import org.kukicha.compiler.frontend.parser.ast.ForRangeStmt;
import org.kukicha.compiler.frontend.parser.ast.GoStmt;
import org.kukicha.compiler.frontend.parser.ast.Identifier;
import org.kukicha.compiler.frontend.parser.ast.IfStmt;
import org.kukicha.compiler.frontend.parser.ast.MethodCallExpr;
import org.kukicha.compiler.frontend.parser.ast.OnErrClause;
import org.kukicha.compiler.frontend.parser.ast.ReturnStmt;
import org.kukicha.compiler.frontend.parser.ast.SendStmt;
import org.kukicha.compiler.frontend.parser.ast.Statement;
import org.kukicha.compiler.frontend.parser.ast.SwitchStmt;
import org.kukicha.compiler.frontend.parser.ast.VarDeclStmt;
import org.kukicha.compiler.frontend.parser.ast.WhenCase;
import org.kukicha.compiler.model.StringSegment;
import org.kukicha.compiler.model.Token;
import org.kukicha.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the statements of a function body.
 */
class StatementParser {

    private final ParsingContext context;

    StatementParser(ParsingContext context) {
        this.context = context;
    }

    Statement statement() {
        Token token = context.peek();
        Statement statement = switch (token.type()) {
            case RETURN -> returnStatement();
            case IF -> ifStatement();
            case FOR -> forStatement();
            case SWITCH -> switchStatement();
            case DEFER -> deferStatement();
            case GO -> goStatement();
            case SEND -> sendStatement();
            case BREAK -> new BreakStmt(context.advance());
            case CONTINUE -> new ContinueStmt(context.advance());
            default -> simpleStatement();
        };
        context.endOfStatement();
        return statement;
    }

    private Statement returnStatement() {
        Token token = context.advance();
        List<Expression> values = new ArrayList<>();
        if (!context.check(TokenType.NEWLINE) && !context.check(TokenType.DEDENT) && !context.isAtEnd()) {
            values = expressionList();
        }
        return new ReturnStmt(token, values);
    }

    private IfStmt ifStatement() {
        Token token = context.advance();
        Expression condition = context.expression();
        BlockStmt consequence = context.block();
        Statement alternative = null;
        if (context.match(TokenType.ELSE)) {
            alternative = context.check(TokenType.IF) ? ifStatement() : context.block();
        }
        return new IfStmt(token, condition, consequence, alternative);
    }

    /**
     * Distinguishes the four loop forms by looking at the tokens after {@code for}:
     * bare {@code for}, {@code for x in c}, {@code for i, x in c},
     * {@code for i from a to|through b} and {@code for cond}.
     */
    private Statement forStatement() {
        Token token = context.advance();
        if (context.check(TokenType.NEWLINE)) {
            return new ForConditionStmt(token, null, context.block());
        }
        if (context.check(TokenType.IDENTIFIER)) {
            TokenType next = context.peekNext().type();
            if (next == TokenType.IN) {
                Identifier value = identifier(context.advance());
                context.advance();
                Expression collection = context.expression();
                return new ForRangeStmt(token, null, value, collection, context.block());
            }
            if (next == TokenType.COMMA) {
                Identifier index = identifier(context.advance());
                context.advance();
                Identifier value = identifier(context.consume(TokenType.IDENTIFIER, "a loop variable after ','"));
                context.consume(TokenType.IN, "'in' after the loop variables");
                Expression collection = context.expression();
                return new ForRangeStmt(token, index, value, collection, context.block());
            }
            if (next == TokenType.FROM) {
                Identifier variable = identifier(context.advance());
                context.advance();
                Expression start = context.expression();
                boolean inclusive;
                if (context.match(TokenType.THROUGH)) {
                    inclusive = true;
                } else {
                    context.consume(TokenType.TO, "'to' or 'through' after the start value");
                    inclusive = false;
                }
                Expression end = context.expression();
                return new ForNumericStmt(token, variable, start, end, inclusive, context.block());
            }
        }
        Expression condition = context.expression();
        return new ForConditionStmt(token, condition, context.block());
    }

    private Statement switchStatement() {
        Token token = context.advance();
        Expression subject = context.check(TokenType.NEWLINE) ? null : context.expression();
        context.consume(TokenType.NEWLINE, "end of line after the switch subject");
        context.consume(TokenType.INDENT, "an indented block of 'when' branches");
        List<WhenCase> cases = new ArrayList<>();
        BlockStmt otherwise = null;
        while (!context.check(TokenType.DEDENT) && !context.isAtEnd()) {
            context.skipNewlines();
            if (context.check(TokenType.DEDENT)) {
                break;
            }
            Token branch = context.peek();
            if (context.match(TokenType.WHEN)) {
                if (otherwise != null) {
                    context.reportError(branch, "'when' branch after 'otherwise' will never execute");
                }
                List<Expression> values = expressionList();
                cases.add(new WhenCase(branch, values, context.block()));
            } else if (context.match(TokenType.OTHERWISE)) {
                if (otherwise != null) {
                    context.reportError(branch, "switch can only have one otherwise branch");
                }
                otherwise = context.block();
            } else {
                throw context.error(branch, "Expected 'when' or 'otherwise' but found " + branch.describe());
            }
        }
        context.match(TokenType.DEDENT);
        return new SwitchStmt(token, subject, cases, otherwise);
    }

    private Statement deferStatement() {
        Token token = context.advance();
        Expression call = context.expression();
        if (!isCall(call)) {
            context.reportError(token, "defer must be followed by a function call");
        }
        return new DeferStmt(token, call);
    }

    private Statement goStatement() {
        Token token = context.advance();
        if (context.check(TokenType.NEWLINE) && context.peekNext().type() == TokenType.INDENT) {
            return new GoStmt(token, null, context.block());
        }
        Expression call = context.expression();
        if (!isCall(call)) {
            context.reportError(token, "go must be followed by a function call or an indented block");
        }
        return new GoStmt(token, call, null);
    }

    private Statement sendStatement() {
        Token token = context.advance();
        Expression value = context.expression();
        context.consume(TokenType.TO, "'to' after the value in send");
        return new SendStmt(token, value, context.expression());
    }

    /**
     * Bindings, assignments and expression statements, each with an optional onerr clause.
     */
    private Statement simpleStatement() {
        Token token = context.peek();
        List<Expression> targets = new ArrayList<>();
        targets.add(context.expression());
        while (context.match(TokenType.COMMA)) {
            targets.add(context.expression());
        }

        if (context.match(TokenType.WALRUS)) {
            List<Identifier> names = new ArrayList<>();
            for (Expression target : targets) {
                if (target instanceof Identifier identifier) {
                    names.add(identifier);
                } else {
                    throw context.error(target.token(), "':=' can only declare plain names");
                }
            }
            List<Expression> values = expressionList();
            return new VarDeclStmt(token, names, values, onErrClause());
        }
        if (context.match(TokenType.ASSIGN)) {
            List<Expression> values = expressionList();
            return new AssignStmt(token, targets, values, onErrClause());
        }
        if (targets.size() > 1) {
            throw context.error(context.peek(), "Expected ':=' or '=' after the list of names but found " + context.peek().describe());
        }
        return new ExpressionStmt(token, targets.get(0), onErrClause());
    }

    /**
     * Parses a trailing onerr clause if one is present.
     * <pre>
     *   onerr &lt;handler&gt; [explain "hint"]
     *   onerr explain "hint"
     *   onerr return
     *   onerr [as e] + indented block
     * </pre>
     */
    private OnErrClause onErrClause() {
        if (!context.check(TokenType.ONERR)) {
            return null;
        }
        Token token = context.advance();
        if (context.match(TokenType.AS)) {
            String alias = context.consume(TokenType.IDENTIFIER, "a name after 'onerr as'").text();
            if (!context.check(TokenType.NEWLINE) || context.peekNext().type() != TokenType.INDENT) {
                throw context.error(context.peek(), "Expected an indented block after 'onerr as " + alias + "' but found "
                        + context.peek().describe());
            }
            BlockStmt block = context.block();
            return new OnErrClause(token, new BlockExpr(block.token(), block), null, alias, false);
        }
        if (context.check(TokenType.NEWLINE) && context.peekNext().type() == TokenType.INDENT) {
            BlockStmt block = context.block();
            return new OnErrClause(token, new BlockExpr(block.token(), block), null, null, false);
        }
        if (context.check(TokenType.RETURN)) {
            TokenType next = context.peekNext().type();
            if (next == TokenType.NEWLINE || next == TokenType.DEDENT || next == TokenType.EOF) {
                context.advance();
                return new OnErrClause(token, null, null, null, true);
            }
        }
        if (context.match(TokenType.EXPLAIN)) {
            return new OnErrClause(token, null, explainHint(), null, false);
        }
        Expression handler = context.expression();
        String explain = context.match(TokenType.EXPLAIN) ? explainHint() : null;
        return new OnErrClause(token, handler, explain, null, false);
    }

    private String explainHint() {
        Token hint = context.consume(TokenType.STRING, "a string after 'explain'");
        @SuppressWarnings("unchecked")
        List<StringSegment> segments = (List<StringSegment>) hint.value();
        StringBuilder text = new StringBuilder();
        for (StringSegment segment : segments) {
            if (segment instanceof StringSegment.Text part) {
                text.append(part.text());
            } else {
                context.reportError(hint, "The explain hint must be a plain string");
            }
        }
        return text.toString();
    }

    private List<Expression> expressionList() {
        List<Expression> values = new ArrayList<>();
        do {
            values.add(context.expression());
        } while (context.match(TokenType.COMMA));
        return values;
    }

    private static Identifier identifier(Token token) {
        return new Identifier(token, token.text());
    }

    private static boolean isCall(Expression expr) {
        return expr instanceof CallExpr || expr instanceof MethodCallExpr;
    }
}
