package org.kukicha.compiler.backend.codegen;

import org.kukicha.compiler.frontend.parser.ast.AssignStmt;
import org.kukicha.compiler.frontend.parser.ast.BlockStmt;
import org.kukicha.compiler.frontend.parser.ast.BreakStmt;
import org.kukicha.compiler.frontend.parser.ast.ContinueStmt;
import org.kukicha.compiler.frontend.parser.ast.DeferStmt;
import org.kukicha.compiler.frontend.parser.ast.EmptyExpr;
import org.kukicha.compiler.frontend.parser.ast.Expression;
import org.kukicha.compiler.frontend.parser.ast.ExpressionStmt;
import org.kukicha.compiler.frontend.parser.ast.ForConditionStmt;
import org.kukicha.compiler.frontend.parser.ast.ForNumericStmt;
import org.kukicha.compiler.frontend.parser.ast.ForRangeStmt;
import org.kukicha.compiler.frontend.parser.ast.GoStmt;
import org.kukicha.compiler.frontend.parser.ast.Identifier;
import org.kukicha.compiler.frontend.parser.ast.IfStmt;
import org.kukicha.compiler.frontend.parser.ast.IntegerLiteral;
import org.kukicha.compiler.frontend.parser.ast.ReturnStmt;
import org.kukicha.compiler.frontend.parser.ast.SendStmt;
import org.kukicha.compiler.frontend.parser.ast.Statement;
import org.kukicha.compiler.frontend.parser.ast.SwitchStmt;
import org.kukicha.compiler.frontend.parser.ast.TypeCastExpr;
import org.kukicha.compiler.frontend.parser.ast.UnaryExpr;
import org.kukicha.compiler.frontend.parser.ast.VarDeclStmt;
import org.kukicha.compiler.frontend.parser.ast.WhenCase;
import org.kukicha.compiler.frontend.semantics.types.ChannelType;
import org.kukicha.compiler.frontend.semantics.types.PrimitiveType;
import org.kukicha.compiler.frontend.semantics.types.Type;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Writes statements to the context's current writer.
 */
final class StatementEmitter {

    private final EmitContext ctx;
    private final ExpressionEmitter expressions;
    private final OnErrLowering onErr;

    StatementEmitter(EmitContext ctx) {
        this.ctx = ctx;
        this.expressions = new ExpressionEmitter(ctx, this);
        this.onErr = new OnErrLowering(ctx, expressions, this);
    }

    ExpressionEmitter expressions() {
        return expressions;
    }

    void statements(BlockStmt block) {
        for (Statement statement : block.statements()) {
            statement(statement);
        }
    }

    void statement(Statement stmt) {
        GoWriter out = ctx.writer();
        if (stmt instanceof VarDeclStmt decl) {
            varDecl(decl);
        } else if (stmt instanceof AssignStmt assign) {
            assign(assign);
        } else if (stmt instanceof ExpressionStmt es) {
            if (es.onErr() != null) {
                onErr.statement(es.expression(), es.onErr());
            } else {
                out.line(expressions.emit(es.expression()));
            }
        } else if (stmt instanceof ReturnStmt ret) {
            out.line(ret.values().isEmpty() ? "return" : "return " + expressions.joined(ret.values()));
        } else if (stmt instanceof IfStmt ifStmt) {
            out.open("if " + expressions.emit(ifStmt.condition()) + " {");
            ifChain(ifStmt);
        } else if (stmt instanceof ForConditionStmt loop) {
            out.open(loop.condition() == null ? "for {" : "for " + expressions.emit(loop.condition()) + " {");
            body(loop.body());
        } else if (stmt instanceof ForNumericStmt loop) {
            numericLoop(loop);
        } else if (stmt instanceof ForRangeStmt loop) {
            rangeLoop(loop);
        } else if (stmt instanceof SwitchStmt switchStmt) {
            switchStatement(switchStmt);
        } else if (stmt instanceof BreakStmt) {
            out.line("break");
        } else if (stmt instanceof ContinueStmt) {
            out.line("continue");
        } else if (stmt instanceof DeferStmt defer) {
            out.line("defer " + expressions.emit(defer.call()));
        } else if (stmt instanceof GoStmt go) {
            if (go.block() != null) {
                out.open("go func() {");
                statements(go.block());
                out.close("}()");
            } else {
                out.line("go " + expressions.emit(go.call()));
            }
        } else if (stmt instanceof SendStmt send) {
            out.line(expressions.emit(send.channel()) + " <- " + expressions.emit(send.value()));
        } else if (stmt instanceof BlockStmt block) {
            out.open("{");
            body(block);
        } else {
            throw new CodeGenException("Cannot generate " + stmt.getClass().getSimpleName(), stmt.token());
        }
    }

    private void body(BlockStmt block) {
        statements(block);
        ctx.writer().close("}");
    }

    private void varDecl(VarDeclStmt decl) {
        List<String> names = decl.names().stream().map(Identifier::name).toList();
        if (decl.onErr() != null) {
            onErr.bind(decl.token(), names, decl.values().get(0), decl.onErr(), true);
            return;
        }
        GoWriter out = ctx.writer();
        if (names.size() == 1 && decl.values().size() == 1 && decl.values().get(0) instanceof EmptyExpr empty) {
            String type = empty.type() == null ? "any" : ctx.types().render(empty.type());
            out.line("var " + names.get(0) + " " + type);
            return;
        }
        String op = names.stream().allMatch("_"::equals) ? " = " : " := ";
        out.line(String.join(", ", names) + op + values(names.size(), decl.values()));
    }

    private void assign(AssignStmt assign) {
        List<String> targets = assign.targets().stream().map(expressions::emit).toList();
        if (assign.onErr() != null) {
            onErr.bind(assign.token(), targets, assign.values().get(0), assign.onErr(), false);
            return;
        }
        ctx.writer().line(String.join(", ", targets) + " = " + values(targets.size(), assign.values()));
    }

    /**
     * The right-hand side of a binding. Two names bound to one cast make a checked assertion.
     */
    private String values(int names, List<Expression> values) {
        if (names == 2 && values.size() == 1 && values.get(0) instanceof TypeCastExpr cast) {
            return expressions.emit(cast.expression()) + ".(" + ctx.types().render(cast.target()) + ")";
        }
        return expressions.joined(values);
    }

    private void ifChain(IfStmt ifStmt) {
        GoWriter out = ctx.writer();
        statements(ifStmt.consequence());
        Statement alternative = ifStmt.alternative();
        if (alternative instanceof IfStmt elseIf) {
            out.dedent();
            out.open("} else if " + expressions.emit(elseIf.condition()) + " {");
            ifChain(elseIf);
            return;
        }
        if (alternative instanceof BlockStmt block) {
            out.dedent();
            out.open("} else {");
            statements(block);
        }
        out.close("}");
    }

    /**
     * Lowers a numeric range. {@code from 0 to n} becomes a range over the integer. Literal bounds
     * fix the direction at compile time; otherwise the step is chosen at run time so a
     * descending range counts down.
     */
    private void numericLoop(ForNumericStmt loop) {
        GoWriter out = ctx.writer();
        String start = expressions.emit(loop.start());
        String end = expressions.emit(loop.end());
        boolean blank = loop.variable().isBlank();

        if (!loop.inclusive() && start.equals("0")) {
            out.open(blank ? "for range " + end + " {" : "for " + loop.variable().name() + " := range " + end + " {");
            body(loop.body());
            return;
        }

        String name = blank ? ctx.fresh("i") : loop.variable().name();
        Long from = integerValue(loop.start());
        Long to = integerValue(loop.end());
        if (from != null && to != null) {
            boolean down = from > to;
            String compare = down ? (loop.inclusive() ? " >= " : " > ") : (loop.inclusive() ? " <= " : " < ");
            out.open("for " + name + " := " + start + "; " + name + compare + end + "; " + name + (down ? "--" : "++") + " {");
            body(loop.body());
            return;
        }

        String startVar = ctx.fresh("start");
        String endVar = ctx.fresh("end");
        String stepVar = ctx.fresh("step");
        out.open("{");
        out.line(startVar + ", " + endVar + ", " + stepVar + " := " + start + ", " + end + ", 1");
        out.open("if " + startVar + " > " + endVar + " {");
        out.line(stepVar + " = -1");
        out.close("}");
        String limit = loop.inclusive() ? endVar + "+" + stepVar : endVar;
        out.open("for " + name + " := " + startVar + "; " + name + " != " + limit + "; " + name + " += " + stepVar + " {");
        body(loop.body());
        out.close("}");
    }

    /**
     * The value of an integer literal, optionally negated, or null for any other expression.
     */
    private static Long integerValue(Expression expr) {
        boolean negative = false;
        Expression literal = expr;
        if (expr instanceof UnaryExpr unary && unary.operator() == UnaryExpr.Operator.NEGATE) {
            negative = true;
            literal = unary.operand();
        }
        if (!(literal instanceof IntegerLiteral integer) || !integer.token().text().matches("\\d{1,18}")) {
            return null;
        }
        long value = Long.parseLong(integer.token().text());
        return negative ? -value : value;
    }

    private void rangeLoop(ForRangeStmt loop) {
        String collection = expressions.emit(loop.collection());
        Type type = ctx.facts().typeOf(loop.collection());
        String value = loop.value() == null ? "_" : loop.value().name();
        String header;
        if (type instanceof ChannelType || type instanceof PrimitiveType p && p.isInteger()) {
            header = "for " + value + " := range " + collection + " {";
        } else if (loop.index() != null) {
            header = value.equals("_")
                    ? "for " + loop.index().name() + " := range " + collection + " {"
                    : "for " + loop.index().name() + ", " + value + " := range " + collection + " {";
        } else if (value.equals("_")) {
            header = "for range " + collection + " {";
        } else {
            header = "for _, " + value + " := range " + collection + " {";
        }
        ctx.writer().open(header);
        body(loop.body());
    }

    private void switchStatement(SwitchStmt switchStmt) {
        GoWriter out = ctx.writer();
        out.line(switchStmt.subject() == null ? "switch {" : "switch " + expressions.emit(switchStmt.subject()) + " {");
        for (WhenCase when : switchStmt.cases()) {
            out.line("case " + when.values().stream().map(expressions::emit).collect(Collectors.joining(", ")) + ":");
            out.indent();
            statements(when.body());
            out.dedent();
        }
        if (switchStmt.otherwise() != null) {
            out.line("default:");
            out.indent();
            statements(switchStmt.otherwise());
            out.dedent();
        }
        out.line("}");
    }
}
