package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.kukicha.compiler.frontend.parser.ast.AssignStmt;
import org.kukicha.compiler.frontend.parser.ast.BlockExpr;
import org.kukicha.compiler.frontend.parser.ast.BlockStmt;
import org.kukicha.compiler.frontend.parser.ast.BreakStmt;
import org.kukicha.compiler.frontend.parser.ast.ContinueStmt;
import org.kukicha.compiler.frontend.parser.ast.DeferStmt;
import org.kukicha.compiler.frontend.parser.ast.DiscardExpr;
import org.kukicha.compiler.frontend.parser.ast.ErrorExpr;
import org.kukicha.compiler.frontend.parser.ast.Expression;
import org.kukicha.compiler.frontend.parser.ast.ExpressionStmt;
import org.kukicha.compiler.frontend.parser.ast.ForConditionStmt;
import org.kukicha.compiler.frontend.parser.ast.ForNumericStmt;
import org.kukicha.compiler.frontend.parser.ast.ForRangeStmt;
import org.kukicha.compiler.frontend.parser.ast.FunctionDecl;
import org.kukicha.compiler.frontend.parser.ast.GoStmt;
import org.kukicha.compiler.frontend.parser.ast.Identifier;
import org.kukicha.compiler.frontend.parser.ast.IfStmt;
import org.kukicha.compiler.frontend.parser.ast.OnErrClause;
import org.kukicha.compiler.frontend.parser.ast.PanicExpr;
import org.kukicha.compiler.frontend.parser.ast.Parameter;
import org.kukicha.compiler.frontend.parser.ast.PipeExpr;
import org.kukicha.compiler.frontend.parser.ast.ReturnExpr;
import org.kukicha.compiler.frontend.parser.ast.ReturnStmt;
import org.kukicha.compiler.frontend.parser.ast.SendStmt;
import org.kukicha.compiler.frontend.parser.ast.Statement;
import org.kukicha.compiler.frontend.parser.ast.SwitchStmt;
import org.kukicha.compiler.frontend.parser.ast.TypeCastExpr;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;
import org.kukicha.compiler.frontend.parser.ast.VarDeclStmt;
import org.kukicha.compiler.frontend.parser.ast.WhenCase;
import org.kukicha.compiler.frontend.semantics.AnalysisFacts.ReturnArity;
import org.kukicha.compiler.frontend.semantics.types.ChannelType;
import org.kukicha.compiler.frontend.semantics.types.FunctionType;
import org.kukicha.compiler.frontend.semantics.types.InterfaceType;
import org.kukicha.compiler.frontend.semantics.types.ListType;
import org.kukicha.compiler.frontend.semantics.types.MapType;
import org.kukicha.compiler.frontend.semantics.types.PrimitiveType;
import org.kukicha.compiler.frontend.semantics.types.ReferenceType;
import org.kukicha.compiler.frontend.semantics.types.TupleType;
import org.kukicha.compiler.frontend.semantics.types.Type;
import org.kukicha.compiler.frontend.semantics.types.UnknownType;
import org.kukicha.compiler.model.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Walks function bodies: binds locals, checks statements and onerr clauses. Expression typing
 * is delegated to an {@link ExpressionAnalyzer}.
 */
public class BodyAnalyzer {

    private final AnalysisContext context;
    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbols;
    private final TypeResolver resolver;
    private final AnalysisFacts facts;
    private final ExpressionAnalyzer expressions;

    private FunctionType currentSignature;
    private int loopDepth;
    private int breakableDepth;
    private final Deque<String> onErrAliases = new ArrayDeque<>();
    private int onErrDepth;
    private boolean statementHasOnErr;

    public BodyAnalyzer(AnalysisContext context) {
        this.context = context;
        this.diagnostics = context.diagnostics();
        this.symbols = context.symbolTable();
        this.resolver = context.resolver();
        this.facts = context.facts();
        this.expressions = new ExpressionAnalyzer(this, context);
    }

    /**
     * Analyzes one function or method body in a fresh scope below the current file scope.
     */
    public void analyzeFunction(FunctionDecl decl) {
        currentSignature = context.declaredSignature(decl)
                .orElseGet(() -> resolver.signature(decl.params(), decl.returns()));
        loopDepth = 0;
        breakableDepth = 0;
        symbols.enterScope();
        try {
            if (decl.isMethod()) {
                symbols.define(new Symbol(decl.receiver().name(), Symbol.Kind.PARAMETER,
                        context.receiverType(decl), true, decl.receiver().token()));
            }
            defineParameters(decl.params(), currentSignature.params());
            block(decl.body(), false);
        } finally {
            symbols.leaveScope();
            currentSignature = null;
        }
    }

    /**
     * Analyzes a function literal or arrow lambda. Loop and onerr state of the enclosing body
     * does not carry into the literal.
     * @param returns Declared result types, or null for an arrow lambda.
     * @param block The literal's body, or null for an expression lambda.
     * @param bodyExpr The expression of an expression lambda, or null.
     * @return The literal's function type.
     */
    Type functionLiteral(List<Parameter> params, List<TypeRef> returns, BlockStmt block, Expression bodyExpr) {
        FunctionType saved = currentSignature;
        int savedLoops = loopDepth;
        int savedBreakable = breakableDepth;
        int savedOnErr = onErrDepth;
        boolean savedStatement = statementHasOnErr;
        Deque<String> savedAliases = new ArrayDeque<>(onErrAliases);

        List<Type> paramTypes = new ArrayList<>();
        for (Parameter param : params) {
            paramTypes.add(param.type() == null ? UnknownType.INSTANCE : resolver.resolve(param.type()));
        }
        boolean variadic = !params.isEmpty() && params.get(params.size() - 1).variadic();
        FunctionType signature = returns == null
                ? new FunctionType(paramTypes, List.of(UnknownType.INSTANCE), variadic)
                : new FunctionType(paramTypes, resolver.resolveAll(returns), variadic);

        currentSignature = signature;
        loopDepth = 0;
        breakableDepth = 0;
        onErrDepth = 0;
        statementHasOnErr = false;
        onErrAliases.clear();
        symbols.enterScope();
        try {
            for (int i = 0; i < params.size(); i++) {
                Parameter param = params.get(i);
                Type type = param.variadic() ? new ListType(paramTypes.get(i)) : paramTypes.get(i);
                defineLocal(param.name(), Symbol.Kind.PARAMETER, type, param.token());
            }
            if (bodyExpr != null) {
                Type result = expressions.expression(bodyExpr);
                List<Type> results = result instanceof TupleType tuple ? tuple.elements() : List.of(result);
                signature = new FunctionType(paramTypes, results, variadic);
            } else if (block != null) {
                // results of a block lambda without declared types are not checked
                block(block, false);
            }
        } finally {
            symbols.leaveScope();
            currentSignature = saved;
            loopDepth = savedLoops;
            breakableDepth = savedBreakable;
            onErrDepth = savedOnErr;
            statementHasOnErr = savedStatement;
            onErrAliases.clear();
            onErrAliases.addAll(savedAliases);
        }
        return signature;
    }

    private void defineParameters(List<Parameter> params, List<Type> types) {
        for (int i = 0; i < params.size(); i++) {
            Parameter param = params.get(i);
            Type type = types.get(i);
            if (param.defaultValue() != null) {
                Type defaultType = expressions.value(param.defaultValue());
                expressions.checkAssignable(defaultType, type, param.defaultValue().token(),
                        "default value of parameter '" + param.name() + "'");
            }
            defineLocal(param.name(), Symbol.Kind.PARAMETER, param.variadic() ? new ListType(type) : type, param.token());
        }
    }

    void block(BlockStmt block, boolean newScope) {
        if (newScope) {
            symbols.enterScope();
        }
        try {
            for (Statement statement : block.statements()) {
                statement(statement);
            }
        } finally {
            if (newScope) {
                symbols.leaveScope();
            }
        }
    }

    private void statement(Statement statement) {
        if (statement instanceof VarDeclStmt decl) {
            withOnErr(decl.onErr(), () -> varDecl(decl));
        } else if (statement instanceof AssignStmt assign) {
            withOnErr(assign.onErr(), () -> assign(assign));
        } else if (statement instanceof ExpressionStmt stmt) {
            withOnErr(stmt.onErr(), () -> expressionStatement(stmt));
        } else if (statement instanceof ReturnStmt ret) {
            checkReturn(ret.token(), ret.values());
        } else if (statement instanceof IfStmt ifStmt) {
            ifStatement(ifStmt);
        } else if (statement instanceof ForConditionStmt loop) {
            if (loop.condition() != null) {
                condition(loop.condition(), "for");
            }
            loopBody(loop.body(), () -> { });
        } else if (statement instanceof ForNumericStmt loop) {
            numericLoop(loop);
        } else if (statement instanceof ForRangeStmt loop) {
            rangeLoop(loop);
        } else if (statement instanceof SwitchStmt switchStmt) {
            switchStatement(switchStmt);
        } else if (statement instanceof DeferStmt defer) {
            expressions.expression(defer.call());
        } else if (statement instanceof GoStmt go) {
            if (go.call() != null) {
                expressions.expression(go.call());
            } else {
                int savedLoops = loopDepth;
                int savedBreakable = breakableDepth;
                loopDepth = 0;
                breakableDepth = 0;
                try {
                    block(go.block(), true);
                } finally {
                    loopDepth = savedLoops;
                    breakableDepth = savedBreakable;
                }
            }
        } else if (statement instanceof SendStmt send) {
            Type value = expressions.value(send.value());
            Type channel = expressions.value(send.channel());
            if (channel instanceof ChannelType ch) {
                expressions.checkAssignable(value, ch.elementType(), send.value().token(), "send");
            } else if (!TypeRules.isLenient(channel)) {
                diagnostics.reportError(ErrorKind.SEMANTIC, "send needs a channel, got " + channel.displayName(), send.token());
            }
        } else if (statement instanceof BreakStmt brk) {
            if (breakableDepth == 0) {
                diagnostics.reportError(ErrorKind.SEMANTIC, "break outside of a loop", brk.token());
            }
        } else if (statement instanceof ContinueStmt cont) {
            if (loopDepth == 0) {
                diagnostics.reportError(ErrorKind.SEMANTIC, "continue outside of a loop", cont.token());
            }
        } else if (statement instanceof BlockStmt nested) {
            block(nested, true);
        } else {
            throw new IllegalStateException("Unhandled statement: " + statement.getClass().getSimpleName());
        }
    }

    private void withOnErr(OnErrClause clause, Runnable analysis) {
        boolean saved = statementHasOnErr;
        statementHasOnErr = clause != null;
        try {
            analysis.run();
        } finally {
            statementHasOnErr = saved;
        }
    }

    private void varDecl(VarDeclStmt decl) {
        List<Identifier> names = decl.names();
        List<Type> types = bindingTypes(decl.token(), names.size(), decl.values(), decl.onErr());
        for (int i = 0; i < names.size(); i++) {
            Identifier name = names.get(i);
            if (name.isBlank()) {
                continue;
            }
            Type type = types.get(i);
            defineLocal(name.name(), Symbol.Kind.VARIABLE, type instanceof PrimitiveType p ? p.typed() : type, name.token());
        }
    }

    private void assign(AssignStmt assign) {
        List<Type> targetTypes = new ArrayList<>();
        for (Expression target : assign.targets()) {
            targetTypes.add(assignTarget(target));
        }
        List<Type> types = bindingTypes(assign.token(), assign.targets().size(), assign.values(), assign.onErr());
        for (int i = 0; i < targetTypes.size(); i++) {
            Expression target = assign.targets().get(i);
            if (target instanceof Identifier id && id.isBlank()) {
                continue;
            }
            expressions.checkAssignable(types.get(i), targetTypes.get(i), target.token(), "assignment");
        }
    }

    private Type assignTarget(Expression target) {
        if (target instanceof Identifier id) {
            if (id.isBlank()) {
                return UnknownType.INSTANCE;
            }
            Optional<Symbol> symbol = symbols.resolve(id.name());
            if (symbol.isEmpty()) {
                diagnostics.reportError(ErrorKind.SEMANTIC, "Cannot assign to undeclared variable '" + id.name() + "'",
                        id.token(), "use ':=' to declare a new variable");
                facts.recordType(id, UnknownType.INSTANCE);
                return UnknownType.INSTANCE;
            }
            if (!symbol.get().mutable()) {
                diagnostics.reportError(ErrorKind.SEMANTIC, "Cannot assign to '" + id.name() + "'", id.token());
            }
            facts.recordType(id, symbol.get().type());
            return symbol.get().type();
        }
        return expressions.value(target);
    }

    /**
     * Computes the types bound by {@code names := values} or {@code targets = values}.
     * With onerr, a single value must have one more result than there are names (the error),
     * or exactly as many when the last name binds the error.
     */
    private List<Type> bindingTypes(Token token, int names, List<Expression> values, OnErrClause onErr) {
        List<Type> unknown = Collections.nCopies(names, UnknownType.INSTANCE);
        if (values.size() == 1) {
            Expression value = values.get(0);
            if (value instanceof TypeCastExpr cast && names == 2) {
                Type source = expressions.value(cast.expression());
                Type target = resolver.resolve(cast.target());
                if (!(source instanceof InterfaceType) && !TypeRules.isLenient(source)
                        && !(source instanceof PrimitiveType p && p.equals(PrimitiveType.ERROR))) {
                    diagnostics.reportError(ErrorKind.SEMANTIC,
                            "Type assertion needs an interface value, got " + source.displayName(), cast.token());
                }
                facts.recordType(cast, target);
                onErr(onErr, value, null, 1);
                return List.of(target, PrimitiveType.BOOL);
            }
            Type type = expressions.expression(value);
            Optional<ReturnArity> arity = facts.arity(value);
            if (arity.isPresent() && arity.get().assumed()) {
                // a registry miss keeps its single-result fallback
                onErr(onErr, value, names > 0 ? UnknownType.INSTANCE : null, names + 1);
                return unknown;
            }
            List<Type> results = type instanceof TupleType tuple ? tuple.elements() : List.of(type);
            if (onErr != null) {
                List<Type> bound = onErrBinding(token, names, value, results);
                onErr(onErr, value, bound.isEmpty() ? null : bound.get(0), results.size());
                return bound;
            }
            if (results.size() == names) {
                return results;
            }
            if (results.isEmpty()) {
                diagnostics.reportError(ErrorKind.SEMANTIC, ExpressionAnalyzer.describe(value) + " does not return a value", token);
            } else {
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        "assignment mismatch: " + names + " variable" + (names == 1 ? "" : "s") + " but "
                                + ExpressionAnalyzer.describe(value) + " returns " + results.size() + " value" + (results.size() == 1 ? "" : "s"),
                        token);
            }
            return unknown;
        }
        List<Type> types = new ArrayList<>();
        for (Expression value : values) {
            types.add(expressions.value(value));
        }
        if (onErr != null) {
            diagnostics.reportError(ErrorKind.SEMANTIC, "onerr needs a single value that returns an error", onErr.token());
        }
        if (types.size() != names) {
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    "assignment mismatch: " + names + " variable" + (names == 1 ? "" : "s") + " but " + types.size() + " value"
                            + (types.size() == 1 ? "" : "s"),
                    token);
            return unknown;
        }
        return types;
    }

    private List<Type> onErrBinding(Token token, int names, Expression value, List<Type> results) {
        int count = results.size();
        if (names == count - 1 || names == count) {
            return new ArrayList<>(results.subList(0, names));
        }
        if (count > 0) {
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    "assignment mismatch: " + names + " variable" + (names == 1 ? "" : "s") + " but "
                            + ExpressionAnalyzer.describe(value) + " returns " + count + " value" + (count == 1 ? "" : "s"),
                    token);
        }
        return new ArrayList<>(Collections.nCopies(names, UnknownType.INSTANCE));
    }

    private void expressionStatement(ExpressionStmt stmt) {
        Type type = expressions.expression(stmt.expression());
        if (stmt.onErr() == null) {
            return;
        }
        int results = type instanceof TupleType tuple ? tuple.size() : 1;
        onErr(stmt.onErr(), stmt.expression(), null, results);
    }

    /**
     * Checks an onerr clause and its handler.
     * @param source The value whose error the clause handles.
     * @param boundType The type of the first bound name, used to check a default value.
     * @param results The number of results the source produces.
     */
    private void onErr(OnErrClause clause, Expression source, Type boundType, int results) {
        if (clause == null) {
            return;
        }
        checkErrorSlot(clause, source, results);
        if (clause.propagates() && (currentSignature == null || !currentSignature.returnsError())) {
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    "'onerr return' requires the enclosing function to return an error; use an explicit handler instead",
                    clause.token());
        }
        if (clause.handler() == null) {
            return;
        }
        onErrDepth++;
        onErrAliases.push(clause.alias() == null ? "" : clause.alias());
        symbols.enterScope();
        try {
            symbols.define(new Symbol("error", Symbol.Kind.VARIABLE, PrimitiveType.ERROR, false, clause.token()));
            if (clause.alias() != null && !clause.alias().equals("error")) {
                symbols.define(new Symbol(clause.alias(), Symbol.Kind.VARIABLE, PrimitiveType.ERROR, false, clause.token()));
            }
            handler(clause, boundType);
        } finally {
            symbols.leaveScope();
            onErrAliases.pop();
            onErrDepth--;
        }
    }

    private void checkErrorSlot(OnErrClause clause, Expression source, int results) {
        if (source instanceof PipeExpr) {
            return;
        }
        Optional<ReturnArity> arity = facts.arity(source);
        if (arity.isPresent() && !arity.get().assumed() && arity.get().count() == 0) {
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    ExpressionAnalyzer.describe(source) + " does not return a value, so onerr has no error to handle", clause.token());
            return;
        }
        Optional<FunctionType> known = expressions.knownSignature(source);
        if (known.isPresent() && !known.get().returnsError()) {
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    ExpressionAnalyzer.describe(source) + " does not return an error, so onerr has nothing to handle", clause.token());
        } else if (arity.isEmpty() && results <= 1 && !(source instanceof TypeCastExpr)) {
            Type type = facts.typeOf(source);
            if (!TypeRules.isLenient(type) && !(type instanceof PrimitiveType p && p.equals(PrimitiveType.ERROR))) {
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        "onerr needs an expression that returns an error, got " + type.displayName(), clause.token());
            }
        }
    }

    private void handler(OnErrClause clause, Type boundType) {
        Expression handler = clause.handler();
        if (handler instanceof BlockExpr block) {
            block(block.body(), false);
            facts.recordType(handler, TupleType.EMPTY);
            return;
        }
        if (handler instanceof DiscardExpr) {
            if (!context.currentFile().isTestFile()) {
                diagnostics.reportWarning(ErrorKind.SEMANTIC,
                        "onerr discard silently swallows errors; prefer an explicit handler (use in test files only)", clause.token());
            }
            facts.recordType(handler, UnknownType.INSTANCE);
            return;
        }
        if (handler instanceof PanicExpr) {
            if (!"main".equals(context.currentFile().packageName())) {
                diagnostics.reportWarning(ErrorKind.SEMANTIC,
                        "onerr panic in library code terminates the entire program; prefer returning an error to the caller",
                        clause.token());
            }
            expressions.expression(handler);
            return;
        }
        if (handler instanceof ReturnExpr || handler instanceof ErrorExpr) {
            if (handler instanceof ErrorExpr && (currentSignature == null || !currentSignature.returnsError())) {
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        "'onerr error' requires the enclosing function to return an error; use an explicit handler instead",
                        clause.token());
            }
            expressions.expression(handler);
            return;
        }
        Type value = expressions.value(handler);
        if (boundType == null) {
            diagnostics.reportError(ErrorKind.SEMANTIC, "An onerr default value needs a variable to assign to", handler.token(),
                    "bind the result with ':=' or use a block handler");
        } else {
            expressions.checkAssignable(value, boundType, handler.token(), "onerr default value");
        }
    }

    /**
     * Checks the values of a {@code return} against the enclosing function's results.
     */
    void checkReturn(Token token, List<Expression> values) {
        if (currentSignature == null) {
            diagnostics.reportError(ErrorKind.SEMANTIC, "return outside of a function", token);
            return;
        }
        List<Type> expected = currentSignature.returns();
        if (values.size() == 1 && expected.size() > 1) {
            Type type = expressions.expression(values.get(0));
            if (type instanceof TupleType tuple && tuple.size() == expected.size()) {
                for (int i = 0; i < expected.size(); i++) {
                    expressions.checkAssignable(tuple.elements().get(i), expected.get(i), token, "return value " + (i + 1));
                }
                return;
            }
            if (!TypeRules.isLenient(type)) {
                reportReturnCount(token, expected.size(), type instanceof TupleType tuple ? tuple.size() : 1);
            }
            return;
        }
        List<Type> actual = new ArrayList<>();
        for (Expression value : values) {
            actual.add(expressions.value(value));
        }
        if (expected.size() == 1 && expected.get(0).isUnknown()) {
            return;
        }
        if (actual.size() != expected.size()) {
            reportReturnCount(token, expected.size(), actual.size());
            return;
        }
        for (int i = 0; i < actual.size(); i++) {
            expressions.checkAssignable(actual.get(i), expected.get(i), values.get(i).token(),
                    expected.size() == 1 ? "return value" : "return value " + (i + 1));
        }
    }

    private void reportReturnCount(Token token, int expected, int actual) {
        diagnostics.reportError(ErrorKind.SEMANTIC,
                "Function returns " + expected + " value" + (expected == 1 ? "" : "s") + " but " + actual
                        + (actual == 1 ? " was" : " were") + " given", token);
    }

    private void ifStatement(IfStmt ifStmt) {
        condition(ifStmt.condition(), "if");
        block(ifStmt.consequence(), true);
        if (ifStmt.alternative() != null) {
            statement(ifStmt.alternative());
        }
    }

    private void condition(Expression condition, String where) {
        Type type = expressions.value(condition);
        if (!TypeRules.isBoolish(type)) {
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    "Condition of " + where + " must be a bool, got " + type.displayName(), condition.token());
        }
    }

    private void numericLoop(ForNumericStmt loop) {
        Type start = expressions.value(loop.start());
        Type end = expressions.value(loop.end());
        for (Type bound : List.of(start, end)) {
            if (!TypeRules.isLenient(bound) && !(bound instanceof PrimitiveType p && p.isInteger())) {
                diagnostics.reportError(ErrorKind.SEMANTIC, "Loop bounds must be integers, got " + bound.displayName(), loop.token());
                break;
            }
        }
        Type variable = start instanceof PrimitiveType p && p.isInteger() ? p.typed() : PrimitiveType.INT;
        loopBody(loop.body(), () -> defineLocal(loop.variable().name(), Symbol.Kind.VARIABLE, variable, loop.variable().token()));
    }

    private void rangeLoop(ForRangeStmt loop) {
        Type collection = expressions.value(loop.collection());
        Type key;
        Type element;
        if (collection instanceof ListType list) {
            key = PrimitiveType.INT;
            element = list.elementType();
        } else if (collection instanceof MapType map) {
            key = map.keyType();
            element = map.valueType();
        } else if (collection instanceof PrimitiveType p && p.isString()) {
            key = PrimitiveType.INT;
            element = PrimitiveType.RUNE;
        } else if (collection instanceof ChannelType channel) {
            if (loop.index() != null) {
                diagnostics.reportError(ErrorKind.SEMANTIC, "A loop over a channel takes a single variable", loop.token());
            }
            key = channel.elementType();
            element = channel.elementType();
        } else if (collection instanceof PrimitiveType p && p.isInteger()) {
            key = p.typed();
            element = p.typed();
        } else {
            if (!TypeRules.isLenient(collection) && !(collection instanceof ReferenceType)) {
                diagnostics.reportError(ErrorKind.SEMANTIC, "Cannot loop over a value of type " + collection.displayName(),
                        loop.collection().token());
            }
            key = UnknownType.INSTANCE;
            element = UnknownType.INSTANCE;
        }
        loopBody(loop.body(), () -> {
            if (loop.index() != null && !loop.index().isBlank()) {
                defineLocal(loop.index().name(), Symbol.Kind.VARIABLE, key, loop.index().token());
            }
            if (!loop.value().isBlank()) {
                defineLocal(loop.value().name(), Symbol.Kind.VARIABLE, element, loop.value().token());
            }
        });
    }

    private void loopBody(BlockStmt body, Runnable defineVariables) {
        loopDepth++;
        breakableDepth++;
        symbols.enterScope();
        try {
            defineVariables.run();
            block(body, false);
        } finally {
            symbols.leaveScope();
            breakableDepth--;
            loopDepth--;
        }
    }

    private void switchStatement(SwitchStmt switchStmt) {
        Type subject = switchStmt.subject() == null ? null : expressions.value(switchStmt.subject());
        breakableDepth++;
        try {
            for (WhenCase when : switchStmt.cases()) {
                for (Expression value : when.values()) {
                    if (subject == null) {
                        condition(value, "when");
                    } else {
                        Type type = expressions.value(value);
                        if (!context.rules().isAssignable(type, subject) && !context.rules().isAssignable(subject, type)) {
                            diagnostics.reportError(ErrorKind.SEMANTIC,
                                    "Cannot compare " + type.displayName() + " with switch value of type " + subject.displayName(),
                                    value.token());
                        }
                    }
                }
                block(when.body(), true);
            }
            if (switchStmt.otherwise() != null) {
                block(switchStmt.otherwise(), true);
            }
        } finally {
            breakableDepth--;
        }
    }

    private void defineLocal(String name, Symbol.Kind kind, Type type, Token token) {
        if (name.equals("_")) {
            return;
        }
        symbols.define(new Symbol(name, kind, type, true, token));
    }

    boolean inOnErrHandler() {
        return onErrDepth > 0;
    }

    /**
     * @return The alias of the innermost onerr handler, or null if it has none.
     */
    String onErrAlias() {
        String alias = onErrAliases.peek();
        return alias == null || alias.isEmpty() ? null : alias;
    }

    boolean statementHandlesErrors() {
        return statementHasOnErr;
    }
}
