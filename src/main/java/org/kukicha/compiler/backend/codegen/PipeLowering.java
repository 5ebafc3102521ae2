package org.kukicha.compiler.backend.codegen;

import org.kukicha.compiler.frontend.parser.ast.CallExpr;
import org.kukicha.compiler.frontend.parser.ast.Expression;
import org.kukicha.compiler.frontend.parser.ast.MethodCallExpr;
import org.kukicha.compiler.frontend.parser.ast.PipeExpr;
import org.kukicha.compiler.frontend.parser.ast.SelectorExpr;
import org.kukicha.compiler.frontend.semantics.AnalysisFacts.ReturnArity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lowers {@code a |> f(b)} chains. A chain whose intermediate steps produce one value each
 * becomes nested calls; a chain with a multi-value step under onerr is staged through
 * temporaries with an error check after each such step.
 */
final class PipeLowering {

    /**
     * Writes the error check after a staged step, given the step's value and error temporaries.
     */
    @FunctionalInterface
    interface ErrorCheck {
        void emit(String valueVar, String errorVar);
    }

    private final EmitContext ctx;
    private final ExpressionEmitter expressions;

    PipeLowering(EmitContext ctx, ExpressionEmitter expressions) {
        this.ctx = ctx;
        this.expressions = expressions;
    }

    String inline(PipeExpr pipe) {
        if (arity(pipe.left()) >= 2) {
            throw new CodeGenException("A multi-value pipe source needs onerr", pipe.token());
        }
        return step(pipe.right(), expressions.emit(pipe.left()));
    }

    /**
     * Applies one pipe step to the already emitted piped value.
     */
    String step(Expression right, String piped) {
        if (right instanceof CallExpr call) {
            return expressions.call(call, piped);
        }
        if (right instanceof MethodCallExpr call) {
            return expressions.methodCall(call, piped);
        }
        if (right instanceof SelectorExpr selector && selector.object() == null) {
            return piped + "." + selector.field();
        }
        throw new CodeGenException("The right side of a pipe must be a call", right.token());
    }

    /**
     * True when the chain can be emitted as one nested expression: no step before the last
     * produces more than one value.
     */
    boolean collapses(PipeExpr pipe) {
        List<Expression> stages = stages(pipe);
        for (int i = 0; i < stages.size() - 1; i++) {
            if (arity(stages.get(i)) >= 2) {
                return false;
            }
        }
        return true;
    }

    /**
     * Emits the chain one stage per temporary, checking errors of multi-value stages.
     *
     * @return The temporary holding the chain's value, or null when the last stage has none.
     */
    String staged(PipeExpr pipe, ErrorCheck check) {
        List<Expression> stages = stages(pipe);
        String value = null;
        for (int i = 0; i < stages.size(); i++) {
            Expression stage = stages.get(i);
            String code = i == 0 ? expressions.emit(stage) : step(stage, value);
            int count = arity(stage);
            if (count == 0) {
                ctx.writer().line(code);
                value = null;
                continue;
            }
            value = ctx.fresh("pipe");
            if (count == 1) {
                ctx.writer().line(value + " := " + code);
                continue;
            }
            String errorVar = ctx.fresh("err");
            List<String> targets = new ArrayList<>();
            targets.add(value);
            targets.addAll(Collections.nCopies(count - 2, "_"));
            targets.add(errorVar);
            ctx.writer().line(String.join(", ", targets) + " := " + code);
            check.emit(value, errorVar);
        }
        return value;
    }

    /**
     * The source of the chain followed by each step's right side, in evaluation order.
     */
    static List<Expression> stages(PipeExpr pipe) {
        List<Expression> stages = new ArrayList<>();
        Expression current = pipe;
        while (current instanceof PipeExpr p) {
            stages.add(0, p.right());
            current = p.left();
        }
        stages.add(0, current);
        return stages;
    }

    private int arity(Expression expr) {
        return ctx.facts().arity(expr).map(ReturnArity::count).orElse(1);
    }
}
