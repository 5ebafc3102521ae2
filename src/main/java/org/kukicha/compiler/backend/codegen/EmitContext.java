package org.kukicha.compiler.backend.codegen;

import org.kukicha.compiler.frontend.parser.ast.FunctionDecl;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;
import org.kukicha.compiler.frontend.semantics.AnalysisFacts;
import org.kukicha.compiler.frontend.semantics.types.TypeEnvironment;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state shared by the emitters while one file is generated: the current output writer,
 * the enclosing function's results, the active onerr handlers and the temporary name counters.
 */
final class EmitContext {

    /**
     * An onerr handler being emitted. Inside it, {@code error} and the alias name the caught error.
     */
    record OnErrScope(String errorVar, String alias) {
    }

    private final AnalysisFacts facts;
    private final TypeEnvironment environment;
    private final Map<String, FunctionDecl> functions;
    private final ImportTracker imports;
    private final TypeRenderer types;
    private final Deque<OnErrScope> onErr = new ArrayDeque<>();
    private final Map<String, Integer> counters = new HashMap<>();
    private GoWriter writer = new GoWriter();
    private List<TypeRef> returns = List.of();

    EmitContext(AnalysisFacts facts, TypeEnvironment environment, Map<String, FunctionDecl> functions, ImportTracker imports) {
        this.facts = facts;
        this.environment = environment;
        this.functions = functions;
        this.imports = imports;
        this.types = new TypeRenderer(environment);
    }

    AnalysisFacts facts() {
        return facts;
    }

    TypeEnvironment environment() {
        return environment;
    }

    ImportTracker imports() {
        return imports;
    }

    TypeRenderer types() {
        return types;
    }

    FunctionDecl function(String name) {
        return functions.get(name);
    }

    GoWriter writer() {
        return writer;
    }

    /**
     * Redirects output and returns the previous writer, which the caller restores.
     */
    GoWriter swapWriter(GoWriter next) {
        GoWriter previous = writer;
        writer = next;
        return previous;
    }

    List<TypeRef> returns() {
        return returns;
    }

    /**
     * Sets the result annotations of the function being emitted and returns the previous ones.
     * A null list means the results are not annotated, as in arrow lambdas.
     */
    List<TypeRef> swapReturns(List<TypeRef> next) {
        List<TypeRef> previous = returns;
        returns = next;
        return previous;
    }

    /**
     * Starts a new top-level function: temporaries are numbered from one again.
     */
    void resetCounters() {
        counters.clear();
    }

    /**
     * A fresh temporary name such as {@code err_1} or {@code pipe_2}.
     */
    String fresh(String prefix) {
        return prefix + "_" + counters.merge(prefix, 1, Integer::sum);
    }

    void enterOnErr(String errorVar, String alias) {
        onErr.push(new OnErrScope(errorVar, alias));
    }

    void exitOnErr() {
        onErr.pop();
    }

    /**
     * The Go variable an identifier stands for inside an onerr handler, or null when the
     * identifier is not the caught error.
     */
    String caughtError(String name) {
        OnErrScope scope = onErr.peek();
        if (scope == null) {
            return null;
        }
        if (name.equals("error") || name.equals(scope.alias())) {
            return scope.errorVar();
        }
        return null;
    }
}
