package org.kukicha.compiler.backend.codegen;

import org.kukicha.compiler.frontend.parser.ast.AstNodes;
import org.kukicha.compiler.frontend.parser.ast.BlockExpr;
import org.kukicha.compiler.frontend.parser.ast.DiscardExpr;
import org.kukicha.compiler.frontend.parser.ast.ErrorExpr;
import org.kukicha.compiler.frontend.parser.ast.Expression;
import org.kukicha.compiler.frontend.parser.ast.Identifier;
import org.kukicha.compiler.frontend.parser.ast.OnErrClause;
import org.kukicha.compiler.frontend.parser.ast.PanicExpr;
import org.kukicha.compiler.frontend.parser.ast.PipeExpr;
import org.kukicha.compiler.frontend.parser.ast.ReturnExpr;
import org.kukicha.compiler.frontend.parser.ast.TypeCastExpr;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;
import org.kukicha.compiler.frontend.semantics.AnalysisFacts.ReturnArity;
import org.kukicha.compiler.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lowers {@code onerr} clauses into Go's explicit {@code if err != nil} checks.
 *
 * <pre>
 *   data := os.ReadFile(path) onerr return
 *
 *   data, err_1 := os.ReadFile(path)
 *   if err_1 != nil {
 *       return nil, err_1
 *   }
 * </pre>
 */
final class OnErrLowering {

    private final EmitContext ctx;
    private final ExpressionEmitter expressions;
    private final StatementEmitter statements;

    OnErrLowering(EmitContext ctx, ExpressionEmitter expressions, StatementEmitter statements) {
        this.ctx = ctx;
        this.expressions = expressions;
        this.statements = statements;
    }

    /**
     * Lowers {@code names := value onerr ...} or, when {@code declare} is false, the
     * assignment form {@code targets = value onerr ...}.
     */
    void bind(Token token, List<String> names, Expression value, OnErrClause clause, boolean declare) {
        GoWriter out = ctx.writer();
        String op = declare && !names.stream().allMatch("_"::equals) ? " := " : " = ";

        if (value instanceof TypeCastExpr cast && names.size() == 2) {
            assertion(names, cast, clause, op);
            return;
        }
        if (value instanceof PipeExpr pipe && !expressions.pipes().collapses(pipe)) {
            if (names.size() != 1) {
                throw new CodeGenException("A staged pipe can bind only one name", token);
            }
            String result = expressions.pipes().staged(pipe, (valueVar, errorVar) -> check(clause, errorVar, List.of(valueVar)));
            if (result == null) {
                throw new CodeGenException("The pipe does not produce a value", token);
            }
            out.line(names.get(0) + op + result);
            return;
        }

        int count = arity(value);
        String code = expressions.emit(value);
        if (clause.handler() instanceof DiscardExpr) {
            List<String> targets = new ArrayList<>(names);
            targets.addAll(Collections.nCopies(Math.max(0, count - names.size()), "_"));
            out.line(String.join(", ", targets) + op + code);
            return;
        }
        if (count >= 2 && names.size() == count) {
            out.line(String.join(", ", names) + op + code);
            check(clause, names.get(count - 1), names.subList(0, count - 1));
            return;
        }
        String errorVar = ctx.fresh("err");
        List<String> targets = new ArrayList<>(names);
        targets.addAll(Collections.nCopies(Math.max(0, count - names.size() - 1), "_"));
        targets.add(errorVar);
        if (!declare) {
            out.line("var " + errorVar + " error");
        }
        out.line(String.join(", ", targets) + (declare ? " := " : " = ") + code);
        check(clause, errorVar, names);
    }

    /**
     * Lowers an expression statement whose results, apart from the error, are not used.
     */
    void statement(Expression value, OnErrClause clause) {
        GoWriter out = ctx.writer();
        if (value instanceof PipeExpr pipe && !expressions.pipes().collapses(pipe)) {
            String result = expressions.pipes().staged(pipe, (valueVar, errorVar) -> check(clause, errorVar, List.of(valueVar)));
            if (result != null) {
                out.line("_ = " + result);
            }
            return;
        }
        int count = arity(value);
        String code = expressions.emit(value);
        if (clause.handler() instanceof DiscardExpr) {
            if (count == 0) {
                out.line(code);
            } else {
                out.line(String.join(", ", Collections.nCopies(count, "_")) + " = " + code);
            }
            return;
        }
        String errorVar = ctx.fresh("err");
        List<String> targets = new ArrayList<>(Collections.nCopies(Math.max(0, count - 1), "_"));
        targets.add(errorVar);
        out.open("if " + String.join(", ", targets) + " := " + code + "; " + errorVar + " != nil {");
        handler(clause, errorVar, List.of());
        out.close("}");
    }

    private void assertion(List<String> names, TypeCastExpr cast, OnErrClause clause, String op) {
        GoWriter out = ctx.writer();
        String value = names.get(0);
        String ok = names.get(1).equals("_") ? ctx.fresh("ok") : names.get(1);
        String code = expressions.emit(cast.expression()) + ".(" + ctx.types().render(cast.target()) + ")";
        if (clause.handler() instanceof DiscardExpr) {
            out.line(value + ", _" + op + code);
            return;
        }
        String assign = op.equals(" := ") || !ok.equals(names.get(1)) ? " := " : " = ";
        out.line(value + ", " + ok + assign + code);
        out.open("if !" + ok + " {");
        String errorVar = ctx.fresh("err");
        if (needsErrorValue(clause)) {
            String message = "value is not a " + ctx.types().render(cast.target());
            out.line(errorVar + " := " + ctx.imports().use("errors") + ".New(" + ExpressionEmitter.quote(message) + ")");
        }
        handler(clause, errorVar, value.equals("_") ? List.of() : List.of(value));
        out.close("}");
    }

    private boolean needsErrorValue(OnErrClause clause) {
        if (clause.propagates() || clause.hasExplain()) {
            return true;
        }
        boolean[] found = {false};
        if (clause.handler() != null) {
            AstNodes.walk(clause.handler(), node -> {
                if (node instanceof Identifier id && (id.name().equals("error") || id.name().equals(clause.alias()))) {
                    found[0] = true;
                }
            });
        }
        return found[0];
    }

    private void check(OnErrClause clause, String errorVar, List<String> bound) {
        GoWriter out = ctx.writer();
        out.open("if " + errorVar + " != nil {");
        handler(clause, errorVar, bound);
        out.close("}");
    }

    /**
     * Writes the handler body for a caught error held in {@code errorVar}. A default value is
     * assigned to the first bound name.
     */
    private void handler(OnErrClause clause, String errorVar, List<String> bound) {
        GoWriter out = ctx.writer();
        ctx.enterOnErr(errorVar, clause.alias());
        try {
            if (clause.hasExplain()) {
                String format = ExpressionEmitter.quote(clause.explain().replace("%", "%%") + ": %w");
                out.line(errorVar + " = " + ctx.imports().use("fmt") + ".Errorf(" + format + ", " + errorVar + ")");
            }
            if (clause.propagates()) {
                out.line("return " + zeroResults() + errorVar);
                return;
            }
            Expression handler = clause.handler();
            if (handler instanceof BlockExpr block) {
                statements.statements(block.body());
            } else if (handler instanceof PanicExpr) {
                out.line(expressions.emit(handler));
            } else if (handler instanceof ErrorExpr error) {
                out.line("return " + zeroResults() + expressions.errorValue(error));
            } else if (handler instanceof ReturnExpr ret) {
                out.line(ret.values().isEmpty() ? "return" : "return " + expressions.joined(ret.values()));
            } else if (handler != null && !(handler instanceof DiscardExpr)) {
                if (bound.isEmpty() || bound.get(0).equals("_")) {
                    throw new CodeGenException("A default value needs a name to assign to", handler.token());
                }
                out.line(bound.get(0) + " = " + expressions.emit(handler));
            }
        } finally {
            ctx.exitOnErr();
        }
    }

    /**
     * Zero values for the enclosing function's results except the trailing error, each
     * followed by a comma.
     */
    private String zeroResults() {
        List<TypeRef> returns = ctx.returns();
        if (returns == null || returns.size() < 2) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (TypeRef ref : returns.subList(0, returns.size() - 1)) {
            sb.append(ctx.types().zeroValue(ref)).append(", ");
        }
        return sb.toString();
    }

    private int arity(Expression value) {
        return ctx.facts().arity(value).map(ReturnArity::count).orElse(1);
    }
}
