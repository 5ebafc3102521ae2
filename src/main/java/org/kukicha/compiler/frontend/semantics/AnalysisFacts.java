package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.frontend.parser.ast.AstNode;
import org.kukicha.compiler.frontend.parser.ast.Expression;
import org.kukicha.compiler.frontend.semantics.types.Type;
import org.kukicha.compiler.frontend.semantics.types.UnknownType;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Facts the semantic analyzer attaches to AST nodes for the code generator: the number of
 * values each call or pipe yields and the inferred type of each expression.
 * <p>
 * AST nodes are records with structural equality, so two textually identical calls would
 * collide in an ordinary map. Facts are therefore keyed by node identity.
 * <p>
 * Written only during analysis; {@link #freeze()} makes the instance read-only before it is
 * handed to the generator.
 */
public final class AnalysisFacts {

    /**
     * The number of values a call yields.
     *
     * @param count   The number of results.
     * @param assumed true if the callee is an external function missing from the signature
     *                registry and the count is the single-result fallback.
     */
    public record ReturnArity(int count, boolean assumed) {

        public static final ReturnArity NONE = new ReturnArity(0, false);
        public static final ReturnArity SINGLE = new ReturnArity(1, false);
        public static final ReturnArity ASSUMED = new ReturnArity(1, true);

        public static ReturnArity of(int count) {
            return new ReturnArity(count, false);
        }

        public boolean isMultiValue() {
            return count >= 2;
        }
    }

    private final Map<AstNode, ReturnArity> arities = new IdentityHashMap<>();
    private final Map<Expression, Type> types = new IdentityHashMap<>();
    private boolean frozen;

    public void recordArity(AstNode node, ReturnArity arity) {
        checkWritable();
        arities.put(node, arity);
    }

    public void recordType(Expression expression, Type type) {
        checkWritable();
        types.put(expression, type);
    }

    /**
     * @return The arity recorded for a call, method call or pipe node, or empty if the node
     *         was not analyzed as a call.
     */
    public Optional<ReturnArity> arity(AstNode node) {
        return Optional.ofNullable(arities.get(node));
    }

    /**
     * @return The inferred type, or {@link UnknownType} if none was recorded.
     */
    public Type typeOf(Expression expression) {
        return types.getOrDefault(expression, UnknownType.INSTANCE);
    }

    public int arityCount() {
        return arities.size();
    }

    void freeze() {
        this.frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkWritable() {
        if (frozen) {
            throw new IllegalStateException("Analysis facts are read-only once analysis has finished");
        }
    }
}
