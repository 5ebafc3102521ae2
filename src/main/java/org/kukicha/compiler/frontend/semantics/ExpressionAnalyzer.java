package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.kukicha.compiler.frontend.parser.ast.AddressOfExpr;
import org.kukicha.compiler.frontend.parser.ast.ArrowLambda;
import org.kukicha.compiler.frontend.parser.ast.BinaryExpr;
import org.kukicha.compiler.frontend.parser.ast.BlockExpr;
import org.kukicha.compiler.frontend.parser.ast.BooleanLiteral;
import org.kukicha.compiler.frontend.parser.ast.CallExpr;
import org.kukicha.compiler.frontend.parser.ast.CloseExpr;
import org.kukicha.compiler.frontend.parser.ast.DerefExpr;
import org.kukicha.compiler.frontend.parser.ast.DiscardExpr;
import org.kukicha.compiler.frontend.parser.ast.EmptyExpr;
import org.kukicha.compiler.frontend.parser.ast.ErrorExpr;
import org.kukicha.compiler.frontend.parser.ast.Expression;
import org.kukicha.compiler.frontend.parser.ast.FloatLiteral;
import org.kukicha.compiler.frontend.parser.ast.FunctionDecl;
import org.kukicha.compiler.frontend.parser.ast.FunctionLiteral;
import org.kukicha.compiler.frontend.parser.ast.Identifier;
import org.kukicha.compiler.frontend.parser.ast.IndexExpr;
import org.kukicha.compiler.frontend.parser.ast.IntegerLiteral;
import org.kukicha.compiler.frontend.parser.ast.ListLiteralExpr;
import org.kukicha.compiler.frontend.parser.ast.MakeExpr;
import org.kukicha.compiler.frontend.parser.ast.MapLiteralExpr;
import org.kukicha.compiler.frontend.parser.ast.MethodCallExpr;
import org.kukicha.compiler.frontend.parser.ast.PanicExpr;
import org.kukicha.compiler.frontend.parser.ast.Parameter;
import org.kukicha.compiler.frontend.parser.ast.PipeExpr;
import org.kukicha.compiler.frontend.parser.ast.PrimitiveTypeRef;
import org.kukicha.compiler.frontend.parser.ast.ReceiveExpr;
import org.kukicha.compiler.frontend.parser.ast.RecoverExpr;
import org.kukicha.compiler.frontend.parser.ast.ReturnExpr;
import org.kukicha.compiler.frontend.parser.ast.SelectorExpr;
import org.kukicha.compiler.frontend.parser.ast.SliceExpr;
import org.kukicha.compiler.frontend.parser.ast.StringLiteral;
import org.kukicha.compiler.frontend.parser.ast.StructLiteralExpr;
import org.kukicha.compiler.frontend.parser.ast.TypeCastExpr;
import org.kukicha.compiler.frontend.parser.ast.UnaryExpr;
import org.kukicha.compiler.frontend.semantics.AnalysisFacts.ReturnArity;
import org.kukicha.compiler.frontend.semantics.types.ChannelType;
import org.kukicha.compiler.frontend.semantics.types.FunctionType;
import org.kukicha.compiler.frontend.semantics.types.InterfaceType;
import org.kukicha.compiler.frontend.semantics.types.ListType;
import org.kukicha.compiler.frontend.semantics.types.MapType;
import org.kukicha.compiler.frontend.semantics.types.NilType;
import org.kukicha.compiler.frontend.semantics.types.PrimitiveType;
import org.kukicha.compiler.frontend.semantics.types.ReferenceType;
import org.kukicha.compiler.frontend.semantics.types.StructType;
import org.kukicha.compiler.frontend.semantics.types.TupleType;
import org.kukicha.compiler.frontend.semantics.types.Type;
import org.kukicha.compiler.frontend.semantics.types.UnknownType;
import org.kukicha.compiler.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Infers expression types, checks calls and records call arities in the {@link AnalysisFacts}.
 * Statement-level state (the enclosing function, onerr handlers) is owned by {@link BodyAnalyzer}.
 */
class ExpressionAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ExpressionAnalyzer.class);

    private final BodyAnalyzer body;
    private final AnalysisContext context;
    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbols;
    private final TypeRules rules;
    private final AnalysisFacts facts;

    /** Signatures of calls to functions and methods whose declaration the analyzer has seen. */
    private final Map<Expression, FunctionType> knownSignatures = new IdentityHashMap<>();

    /** Blank identifiers used as pipe placeholders. */
    private final Set<Expression> placeholders = Collections.newSetFromMap(new IdentityHashMap<>());

    ExpressionAnalyzer(BodyAnalyzer body, AnalysisContext context) {
        this.body = body;
        this.context = context;
        this.diagnostics = context.diagnostics();
        this.symbols = context.symbolTable();
        this.rules = context.rules();
        this.facts = context.facts();
    }

    /**
     * Analyzes an expression that must produce exactly one value.
     * @return The value's type; {@link UnknownType} if it produces zero or several values.
     */
    Type value(Expression expr) {
        Type type = expression(expr);
        if (type instanceof TupleType tuple) {
            if (tuple.size() == 0) {
                diagnostics.reportError(ErrorKind.SEMANTIC, describe(expr) + " does not return a value", expr.token());
            } else {
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        describe(expr) + " returns " + tuple.size() + " values but is used where a single value is expected",
                        expr.token(), "handle the extra results with onerr or bind them with ':='");
            }
            return UnknownType.INSTANCE;
        }
        return type;
    }

    /**
     * Analyzes an expression and records its type.
     * @return The type; a {@link TupleType} for calls with zero or several results.
     */
    Type expression(Expression expr) {
        Type type = infer(expr);
        facts.recordType(expr, type);
        return type;
    }

    /**
     * @return The signature of the function or method a call or pipe invokes, if it is declared
     *         in this compilation unit.
     */
    Optional<FunctionType> knownSignature(Expression expr) {
        if (expr instanceof PipeExpr pipe) {
            return knownSignature(pipe.right());
        }
        return Optional.ofNullable(knownSignatures.get(expr));
    }

    private Type infer(Expression expr) {
        if (expr instanceof Identifier identifier) {
            return identifier(identifier);
        }
        if (expr instanceof IntegerLiteral) {
            return PrimitiveType.UNTYPED_INT;
        }
        if (expr instanceof FloatLiteral) {
            return PrimitiveType.UNTYPED_FLOAT;
        }
        if (expr instanceof BooleanLiteral) {
            return PrimitiveType.BOOL;
        }
        if (expr instanceof StringLiteral string) {
            return string(string);
        }
        if (expr instanceof BinaryExpr binary) {
            return binary(binary);
        }
        if (expr instanceof UnaryExpr unary) {
            return unary(unary);
        }
        if (expr instanceof PipeExpr pipe) {
            return pipe(pipe);
        }
        if (expr instanceof CallExpr call) {
            return call(call, null);
        }
        if (expr instanceof MethodCallExpr call) {
            return methodCall(call, null);
        }
        if (expr instanceof SelectorExpr selector) {
            return selector(selector, null);
        }
        if (expr instanceof IndexExpr index) {
            return index(index);
        }
        if (expr instanceof SliceExpr slice) {
            return slice(slice);
        }
        if (expr instanceof StructLiteralExpr literal) {
            return structLiteral(literal);
        }
        if (expr instanceof ListLiteralExpr literal) {
            return listLiteral(literal);
        }
        if (expr instanceof MapLiteralExpr literal) {
            return mapLiteral(literal);
        }
        if (expr instanceof EmptyExpr empty) {
            return empty.type() == null ? NilType.INSTANCE : context.resolver().resolve(empty.type());
        }
        if (expr instanceof DiscardExpr) {
            return UnknownType.INSTANCE;
        }
        if (expr instanceof ErrorExpr error) {
            if (error.message() != null) {
                value(error.message());
            }
            return PrimitiveType.ERROR;
        }
        if (expr instanceof MakeExpr make) {
            Type type = context.resolver().resolve(make.type());
            for (Expression arg : make.args()) {
                expectInteger(value(arg), arg, "make size");
            }
            return type;
        }
        if (expr instanceof CloseExpr close) {
            Type channel = value(close.channel());
            if (!(channel instanceof ChannelType) && !TypeRules.isLenient(channel)) {
                diagnostics.reportError(ErrorKind.SEMANTIC, "close needs a channel, got " + channel.displayName(), close.token());
            }
            return TupleType.EMPTY;
        }
        if (expr instanceof PanicExpr panic) {
            value(panic.message());
            return TupleType.EMPTY;
        }
        if (expr instanceof RecoverExpr) {
            return PrimitiveType.ANY;
        }
        if (expr instanceof ReceiveExpr receive) {
            Type channel = value(receive.channel());
            if (channel instanceof ChannelType ch) {
                return ch.elementType();
            }
            if (!TypeRules.isLenient(channel)) {
                diagnostics.reportError(ErrorKind.SEMANTIC, "receive needs a channel, got " + channel.displayName(), receive.token());
            }
            return UnknownType.INSTANCE;
        }
        if (expr instanceof TypeCastExpr cast) {
            value(cast.expression());
            return context.resolver().resolve(cast.target());
        }
        if (expr instanceof AddressOfExpr address) {
            return new ReferenceType(value(address.operand()));
        }
        if (expr instanceof DerefExpr deref) {
            Type operand = value(deref.operand());
            if (operand instanceof ReferenceType ref) {
                return ref.target();
            }
            if (!TypeRules.isLenient(operand)) {
                diagnostics.reportError(ErrorKind.SEMANTIC, "Cannot dereference a value of type " + operand.displayName(), deref.token());
            }
            return UnknownType.INSTANCE;
        }
        if (expr instanceof FunctionLiteral literal) {
            return body.functionLiteral(literal.params(), literal.returns(), literal.body(), null);
        }
        if (expr instanceof ArrowLambda lambda) {
            return body.functionLiteral(lambda.params(), null, lambda.block(), lambda.body());
        }
        if (expr instanceof ReturnExpr ret) {
            body.checkReturn(ret.token(), ret.values());
            return TupleType.EMPTY;
        }
        if (expr instanceof BlockExpr block) {
            body.block(block.body(), true);
            return TupleType.EMPTY;
        }
        throw new IllegalStateException("Unhandled expression: " + expr.getClass().getSimpleName());
    }

    private Type identifier(Identifier identifier) {
        if (identifier.isBlank()) {
            return UnknownType.INSTANCE;
        }
        Optional<Symbol> symbol = symbols.resolve(identifier.name());
        if (symbol.isPresent()) {
            Symbol resolved = symbol.get();
            if (resolved.kind() == Symbol.Kind.TYPE) {
                diagnostics.reportError(ErrorKind.SEMANTIC, "Type '" + identifier.name() + "' cannot be used as a value", identifier.token());
                return UnknownType.INSTANCE;
            }
            if (resolved.kind() == Symbol.Kind.IMPORT) {
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        "Package '" + identifier.name() + "' cannot be used as a value", identifier.token());
                return UnknownType.INSTANCE;
            }
            return resolved.type();
        }
        if (identifier.name().equals("error")) {
            diagnostics.reportError(ErrorKind.SEMANTIC, "'error' is only defined inside an onerr handler", identifier.token());
            return UnknownType.INSTANCE;
        }
        diagnostics.reportError(ErrorKind.SEMANTIC, "Undefined identifier '" + identifier.name() + "'", identifier.token());
        return UnknownType.INSTANCE;
    }

    private Type string(StringLiteral literal) {
        for (StringLiteral.Part part : literal.parts()) {
            if (part instanceof StringLiteral.Interpolation interpolation) {
                Expression embedded = interpolation.expression();
                if (body.inOnErrHandler() && embedded instanceof Identifier id && id.name().equals("err")
                        && symbols.resolve("err").isEmpty()) {
                    String alias = body.onErrAlias();
                    String hint = alias != null
                            ? "use {error} or {" + alias + "} via your 'onerr as " + alias + "' alias"
                            : "use {error}, or name it with 'onerr as e' and use {e}";
                    diagnostics.reportError(ErrorKind.SEMANTIC,
                            "'{err}' is not defined inside onerr: the caught error is always named 'error'", literal.token(), hint);
                    facts.recordType(embedded, UnknownType.INSTANCE);
                    continue;
                }
                value(embedded);
            }
        }
        return PrimitiveType.STRING;
    }

    private Type binary(BinaryExpr binary) {
        Type left = value(binary.left());
        Type right = value(binary.right());
        Optional<Type> result = rules.binaryResult(binary.operator(), left, right);
        if (result.isPresent()) {
            return result.get();
        }
        diagnostics.reportError(ErrorKind.SEMANTIC,
                "cannot apply " + binary.operator().surface() + " to " + left.displayName() + " and " + right.displayName(),
                binary.token());
        return binary.operator().isComparison() || binary.operator().isLogical() || binary.operator().isMembership()
                ? PrimitiveType.BOOL : UnknownType.INSTANCE;
    }

    private Type unary(UnaryExpr unary) {
        Type operand = value(unary.operand());
        if (unary.operator() == UnaryExpr.Operator.NOT) {
            if (!TypeRules.isBoolish(operand)) {
                diagnostics.reportError(ErrorKind.SEMANTIC, "cannot apply not to " + operand.displayName(), unary.token());
            }
            return PrimitiveType.BOOL;
        }
        if (TypeRules.isLenient(operand)) {
            return operand;
        }
        if (!(operand instanceof PrimitiveType p) || !p.isNumeric()) {
            diagnostics.reportError(ErrorKind.SEMANTIC, "cannot apply - to " + operand.displayName(), unary.token());
            return UnknownType.INSTANCE;
        }
        return operand;
    }

    /**
     * {@code left |> right}: the left value becomes the first argument of the right call, or
     * the argument in the position of a {@code _} placeholder.
     */
    private Type pipe(PipeExpr pipe) {
        Type source = expression(pipe.left());
        Type piped = pipedValue(pipe.left(), source);

        Expression right = pipe.right();
        Type result;
        if (right instanceof CallExpr call) {
            result = call(call, piped);
        } else if (right instanceof MethodCallExpr call) {
            result = methodCall(call, piped);
        } else if (right instanceof SelectorExpr selector && selector.isShorthand()) {
            result = selector(selector, piped);
            facts.recordArity(selector, ReturnArity.SINGLE);
        } else {
            // rejected by the code generator
            value(right);
            result = UnknownType.INSTANCE;
        }
        facts.recordType(right, result);
        facts.recordArity(pipe, facts.arity(right).orElse(ReturnArity.ASSUMED));
        return result;
    }

    /**
     * Reduces the result of a pipe source to the single value passed on. A source that returns
     * several values is only allowed when the statement handles errors with onerr; the code
     * generator then checks the error before the next step.
     */
    private Type pipedValue(Expression source, Type sourceType) {
        if (!(sourceType instanceof TupleType tuple)) {
            return sourceType;
        }
        if (tuple.size() == 0) {
            diagnostics.reportError(ErrorKind.SEMANTIC, describe(source) + " does not return a value to pipe", source.token());
            return UnknownType.INSTANCE;
        }
        if (!body.statementHandlesErrors()) {
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    describe(source) + " returns " + tuple.size() + " values and cannot be piped without onerr",
                    source.token(), "add an onerr clause to the statement to handle the error");
        }
        return tuple.elements().get(0);
    }

    Type call(CallExpr call, Type piped) {
        List<Expression> args = call.args();
        boolean placeholder = markPlaceholders(args, piped);
        List<Type> argTypes = new ArrayList<>();
        if (piped != null && !placeholder) {
            argTypes.add(piped);
        }
        for (Expression arg : args) {
            argTypes.add(placeholders.contains(arg) ? piped : value(arg));
        }

        if (call.function() instanceof Identifier id && symbols.resolve(id.name()).isEmpty()) {
            if (Builtins.isBuiltin(id.name())) {
                return builtin(call, id.name(), argTypes);
            }
            if (PrimitiveTypeRef.isPrimitive(id.name())) {
                return conversion(call, PrimitiveType.of(id.name()), argTypes);
            }
        }
        if (call.function() instanceof Identifier id
                && symbols.resolve(id.name()).filter(s -> s.kind() == Symbol.Kind.TYPE).isPresent()) {
            return conversion(call, symbols.resolve(id.name()).get().type(), argTypes);
        }

        Type callee = value(call.function());
        if (!(callee instanceof FunctionType signature)) {
            if (!TypeRules.isLenient(callee)) {
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        describe(call.function()) + " is not a function (type " + callee.displayName() + ")", call.token());
            }
            facts.recordArity(call, ReturnArity.ASSUMED);
            return UnknownType.INSTANCE;
        }

        int required = signature.variadic() ? signature.params().size() - 1 : signature.params().size();
        if (call.function() instanceof Identifier id) {
            Optional<FunctionDecl> decl = context.function(id.name())
                    .filter(d -> symbols.resolve(id.name()).map(s -> s.kind() == Symbol.Kind.FUNCTION).orElse(false));
            if (decl.isPresent()) {
                required = requiredArguments(decl.get().params());
                knownSignatures.put(call, signature);
            }
        }
        checkArguments(call.token(), describe(call.function()), signature, required, argTypes, call.spread());
        facts.recordArity(call, ReturnArity.of(signature.returns().size()));
        return signature.resultType();
    }

    Type methodCall(MethodCallExpr call, Type piped) {
        List<Expression> args = call.args();
        Type receiver;
        boolean pipedIsReceiver = call.isShorthand();
        if (pipedIsReceiver) {
            if (piped == null) {
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        "'." + call.method() + "()' shorthand is only valid on the right of a pipe", call.token());
            }
            receiver = piped == null ? UnknownType.INSTANCE : piped;
        } else {
            Optional<String> importPath = importOf(call.object());
            if (importPath.isPresent()) {
                return qualifiedCall(call, importPath.get() + "." + call.method(), piped);
            }
            receiver = value(call.object());
        }

        boolean placeholder = !pipedIsReceiver && markPlaceholders(args, piped);
        List<Type> argTypes = new ArrayList<>();
        if (piped != null && !pipedIsReceiver && !placeholder) {
            argTypes.add(piped);
        }
        for (Expression arg : args) {
            argTypes.add(placeholders.contains(arg) ? piped : value(arg));
        }

        Optional<FunctionType> method = context.environment().method(receiver, call.method());
        if (method.isPresent()) {
            FunctionType signature = method.get();
            knownSignatures.put(call, signature);
            int required = signature.variadic() ? signature.params().size() - 1 : signature.params().size();
            checkArguments(call.token(), "method '" + call.method() + "'", signature, required, argTypes, call.spread());
            facts.recordArity(call, ReturnArity.of(signature.returns().size()));
            return signature.resultType();
        }
        Type base = receiver instanceof ReferenceType ref ? ref.target() : receiver;
        if (base instanceof StructType || base instanceof InterfaceType) {
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    "Type '" + base.displayName() + "' has no method '" + call.method() + "'", call.token());
            facts.recordArity(call, ReturnArity.SINGLE);
            return UnknownType.INSTANCE;
        }
        facts.recordArity(call, ReturnArity.ASSUMED);
        return UnknownType.INSTANCE;
    }

    /**
     * A call through an import. The return count comes from the signature registry; a miss
     * falls back to a single result.
     */
    private Type qualifiedCall(MethodCallExpr call, String qualifiedName, Type piped) {
        markPlaceholders(call.args(), piped);
        for (Expression arg : call.args()) {
            if (!placeholders.contains(arg)) {
                value(arg);
            }
        }
        OptionalInt count = context.signatures().lookup(qualifiedName);
        if (count.isEmpty()) {
            log.debug("No signature for {}, assuming a single return value", qualifiedName);
            facts.recordArity(call, ReturnArity.ASSUMED);
            return UnknownType.INSTANCE;
        }
        int results = count.getAsInt();
        facts.recordArity(call, ReturnArity.of(results));
        if (results == 1) {
            return UnknownType.INSTANCE;
        }
        return new TupleType(Collections.nCopies(results, UnknownType.INSTANCE));
    }

    private Type selector(SelectorExpr selector, Type piped) {
        Type object;
        if (selector.isShorthand()) {
            if (piped == null) {
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        "'." + selector.field() + "' shorthand is only valid on the right of a pipe", selector.token());
                return UnknownType.INSTANCE;
            }
            object = piped;
        } else {
            if (importOf(selector.object()).isPresent()) {
                return UnknownType.INSTANCE;
            }
            object = value(selector.object());
        }
        Type base = object instanceof ReferenceType ref ? ref.target() : object;
        if (base instanceof StructType struct) {
            Optional<StructType.Field> field = struct.field(selector.field());
            if (field.isPresent()) {
                return field.get().type();
            }
            Optional<FunctionType> method = context.environment().method(struct, selector.field());
            if (method.isPresent()) {
                return method.get();
            }
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    "Type '" + struct.name() + "' has no field '" + selector.field() + "'", selector.token());
        }
        return UnknownType.INSTANCE;
    }

    private Type index(IndexExpr index) {
        Type target = value(index.target());
        Type key = value(index.index());
        if (target instanceof MapType map) {
            checkAssignable(key, map.keyType(), index.index().token(), "map key");
            return map.valueType();
        }
        if (target instanceof ListType list) {
            expectInteger(key, index.index(), "list index");
            return list.elementType();
        }
        if (target instanceof PrimitiveType p && p.isString()) {
            expectInteger(key, index.index(), "string index");
            return PrimitiveType.BYTE;
        }
        if (!TypeRules.isLenient(target)) {
            diagnostics.reportError(ErrorKind.SEMANTIC, "Cannot index a value of type " + target.displayName(), index.token());
        }
        return UnknownType.INSTANCE;
    }

    private Type slice(SliceExpr slice) {
        Type target = value(slice.target());
        if (slice.start() != null) {
            expectInteger(value(slice.start()), slice.start(), "slice bound");
        }
        if (slice.end() != null) {
            expectInteger(value(slice.end()), slice.end(), "slice bound");
        }
        if (target instanceof ListType || TypeRules.isLenient(target)
                || (target instanceof PrimitiveType p && p.isString())) {
            return target;
        }
        diagnostics.reportError(ErrorKind.SEMANTIC, "Cannot slice a value of type " + target.displayName(), slice.token());
        return UnknownType.INSTANCE;
    }

    private Type structLiteral(StructLiteralExpr literal) {
        Type type = context.resolver().resolve(literal.type());
        for (StructLiteralExpr.FieldValue field : literal.fields()) {
            Type valueType = value(field.value());
            if (type instanceof StructType struct) {
                Optional<StructType.Field> declared = struct.field(field.name());
                if (declared.isEmpty()) {
                    diagnostics.reportError(ErrorKind.SEMANTIC,
                            "Type '" + struct.name() + "' has no field '" + field.name() + "'", field.token());
                } else {
                    checkAssignable(valueType, declared.get().type(), field.value().token(), "field '" + field.name() + "'");
                }
            }
        }
        if (!(type instanceof StructType) && !TypeRules.isLenient(type)) {
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    "Type '" + type.displayName() + "' is not a struct type", literal.token());
        }
        return type;
    }

    private Type listLiteral(ListLiteralExpr literal) {
        Type element = literal.elementType() == null ? null : context.resolver().resolve(literal.elementType());
        for (Expression item : literal.elements()) {
            Type itemType = value(item);
            if (element == null) {
                element = itemType instanceof PrimitiveType p ? p.typed() : itemType;
            } else {
                checkAssignable(itemType, element, item.token(), "list element");
            }
        }
        return new ListType(element == null ? UnknownType.INSTANCE : element);
    }

    private Type mapLiteral(MapLiteralExpr literal) {
        Type key = context.resolver().resolve(literal.keyType());
        Type valueType = context.resolver().resolve(literal.valueType());
        for (MapLiteralExpr.Entry entry : literal.entries()) {
            checkAssignable(value(entry.key()), key, entry.key().token(), "map key");
            checkAssignable(value(entry.value()), valueType, entry.value().token(), "map value");
        }
        return new MapType(key, valueType);
    }

    private Type builtin(CallExpr call, String name, List<Type> args) {
        ReturnArity arity = switch (name) {
            case "print", "delete", "clear" -> ReturnArity.NONE;
            default -> ReturnArity.SINGLE;
        };
        facts.recordArity(call, arity);
        switch (name) {
            case "len", "cap" -> {
                expectArgumentCount(call, name, args, 1);
                return PrimitiveType.INT;
            }
            case "copy" -> {
                expectArgumentCount(call, name, args, 2);
                return PrimitiveType.INT;
            }
            case "delete" -> {
                expectArgumentCount(call, name, args, 2);
                return TupleType.EMPTY;
            }
            case "append" -> {
                if (args.isEmpty()) {
                    diagnostics.reportError(ErrorKind.SEMANTIC, "append needs a list as its first argument", call.token());
                    return UnknownType.INSTANCE;
                }
                Type list = args.get(0);
                if (list instanceof ListType listType && !call.spread()) {
                    for (int i = 1; i < args.size(); i++) {
                        checkAssignable(args.get(i), listType.elementType(), call.token(), "argument " + (i + 1) + " of append");
                    }
                }
                return list;
            }
            case "min", "max" -> {
                if (args.isEmpty()) {
                    diagnostics.reportError(ErrorKind.SEMANTIC, name + " needs at least one argument", call.token());
                    return UnknownType.INSTANCE;
                }
                return args.get(0) instanceof PrimitiveType p ? p.typed() : args.get(0);
            }
            case "print", "clear" -> {
                return TupleType.EMPTY;
            }
            default -> throw new IllegalStateException("Unhandled builtin: " + name);
        }
    }

    private Type conversion(CallExpr call, Type target, List<Type> args) {
        facts.recordArity(call, ReturnArity.SINGLE);
        expectArgumentCount(call, "conversion to " + target.displayName(), args, 1);
        return target;
    }

    private void checkArguments(Token token, String callee, FunctionType signature, int required, List<Type> args, boolean spread) {
        int declared = signature.params().size();
        if (args.size() < required) {
            String qualifier = required == declared && !signature.variadic() ? "" : "at least ";
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    callee + " expects " + qualifier + required + " argument" + (required == 1 ? "" : "s") + " but got " + args.size(), token);
            return;
        }
        if (!signature.variadic() && args.size() > declared) {
            String qualifier = required == declared ? "" : "at most ";
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    callee + " expects " + qualifier + declared + " argument" + (declared == 1 ? "" : "s") + " but got " + args.size(), token);
            return;
        }
        for (int i = 0; i < args.size(); i++) {
            boolean inVariadicTail = signature.variadic() && i >= declared - 1;
            Type expected = signature.params().get(Math.min(i, declared - 1));
            if (inVariadicTail && spread && i == args.size() - 1) {
                expected = new ListType(expected);
            }
            checkAssignable(args.get(i), expected, token, "argument " + (i + 1) + " of " + callee);
        }
    }

    private void expectArgumentCount(CallExpr call, String callee, List<Type> args, int count) {
        if (args.size() != count) {
            diagnostics.reportError(ErrorKind.SEMANTIC,
                    callee + " expects " + count + " argument" + (count == 1 ? "" : "s") + " but got " + args.size(), call.token());
        }
    }

    private void expectInteger(Type type, Expression expr, String what) {
        if (TypeRules.isLenient(type)) {
            return;
        }
        if (!(type instanceof PrimitiveType p) || !p.isInteger()) {
            diagnostics.reportError(ErrorKind.SEMANTIC, what + " must be an integer, got " + type.displayName(), expr.token());
        }
    }

    /**
     * Reports a value that cannot be used where the target type is required. A struct that
     * does not implement a required interface is reported with the missing methods.
     * @return true if the value is assignable.
     */
    boolean checkAssignable(Type from, Type to, Token token, String where) {
        if (rules.isAssignable(from, to)) {
            return true;
        }
        if (to instanceof InterfaceType iface) {
            Type base = from instanceof ReferenceType ref ? ref.target() : from;
            List<String> missing = context.interfaces().missingMethods(from, iface);
            if (base instanceof StructType && !missing.isEmpty()) {
                String names = String.join("', '", missing);
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        "Type '" + base.displayName() + "' does not implement interface '" + iface.name() + "': missing method"
                                + (missing.size() == 1 ? "" : "s") + " '" + names + "'",
                        token);
                return false;
            }
        }
        diagnostics.reportError(ErrorKind.SEMANTIC,
                "cannot use " + from.displayName() + " as " + to.displayName() + " in " + where, token);
        return false;
    }

    /**
     * Marks {@code _} and {@code discard} arguments as the position of the piped value.
     * @return true if at least one placeholder was found.
     */
    private boolean markPlaceholders(List<Expression> args, Type piped) {
        if (piped == null) {
            return false;
        }
        boolean found = false;
        for (Expression arg : args) {
            if (arg instanceof DiscardExpr || (arg instanceof Identifier id && id.isBlank())) {
                placeholders.add(arg);
                facts.recordType(arg, piped);
                found = true;
            }
        }
        return found;
    }

    /**
     * @return The import path if the expression names an import that no local shadows.
     */
    Optional<String> importOf(Expression expr) {
        if (expr instanceof Identifier id) {
            Optional<Symbol> symbol = symbols.resolve(id.name());
            if (symbol.isPresent() && symbol.get().kind() == Symbol.Kind.IMPORT) {
                return context.currentFile().importPath(id.name());
            }
        }
        return Optional.empty();
    }

    private static int requiredArguments(List<Parameter> params) {
        int required = 0;
        for (Parameter param : params) {
            if (param.defaultValue() == null && !param.variadic()) {
                required++;
            }
        }
        return required;
    }

    static String describe(Expression expr) {
        if (expr instanceof Identifier id) {
            return "'" + id.name() + "'";
        }
        if (expr instanceof CallExpr call) {
            return describe(call.function());
        }
        if (expr instanceof MethodCallExpr call) {
            return "'" + (call.object() instanceof Identifier id ? id.name() + "." : ".") + call.method() + "'";
        }
        if (expr instanceof PipeExpr pipe) {
            return describe(pipe.right());
        }
        return "expression";
    }
}
