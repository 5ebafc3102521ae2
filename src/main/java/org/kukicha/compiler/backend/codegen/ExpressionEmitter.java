package org.kukicha.compiler.backend.codegen;

import org.kukicha.compiler.frontend.parser.ast.AddressOfExpr;
import org.kukicha.compiler.frontend.parser.ast.ArrowLambda;
import org.kukicha.compiler.frontend.parser.ast.AstNodes;
import org.kukicha.compiler.frontend.parser.ast.BinaryExpr;
import org.kukicha.compiler.frontend.parser.ast.BinaryOperator;
import org.kukicha.compiler.frontend.parser.ast.BlockExpr;
import org.kukicha.compiler.frontend.parser.ast.BlockStmt;
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
import org.kukicha.compiler.frontend.parser.ast.ListTypeRef;
import org.kukicha.compiler.frontend.parser.ast.MakeExpr;
import org.kukicha.compiler.frontend.parser.ast.MapLiteralExpr;
import org.kukicha.compiler.frontend.parser.ast.MethodCallExpr;
import org.kukicha.compiler.frontend.parser.ast.NamedTypeRef;
import org.kukicha.compiler.frontend.parser.ast.PanicExpr;
import org.kukicha.compiler.frontend.parser.ast.Parameter;
import org.kukicha.compiler.frontend.parser.ast.PipeExpr;
import org.kukicha.compiler.frontend.parser.ast.PrimitiveTypeRef;
import org.kukicha.compiler.frontend.parser.ast.ReceiveExpr;
import org.kukicha.compiler.frontend.parser.ast.RecoverExpr;
import org.kukicha.compiler.frontend.parser.ast.ReferenceTypeRef;
import org.kukicha.compiler.frontend.parser.ast.ReturnExpr;
import org.kukicha.compiler.frontend.parser.ast.ReturnStmt;
import org.kukicha.compiler.frontend.parser.ast.SelectorExpr;
import org.kukicha.compiler.frontend.parser.ast.SliceExpr;
import org.kukicha.compiler.frontend.parser.ast.StringLiteral;
import org.kukicha.compiler.frontend.parser.ast.StructLiteralExpr;
import org.kukicha.compiler.frontend.parser.ast.TypeCastExpr;
import org.kukicha.compiler.frontend.parser.ast.TypeRef;
import org.kukicha.compiler.frontend.parser.ast.UnaryExpr;
import org.kukicha.compiler.frontend.semantics.types.InterfaceType;
import org.kukicha.compiler.frontend.semantics.types.ListType;
import org.kukicha.compiler.frontend.semantics.types.MapType;
import org.kukicha.compiler.frontend.semantics.types.PrimitiveType;
import org.kukicha.compiler.frontend.semantics.types.TupleType;
import org.kukicha.compiler.frontend.semantics.types.Type;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lowers expressions to Go source text. Pipes are delegated to {@link PipeLowering}; function
 * literal bodies are written through the {@link StatementEmitter} into a nested writer.
 */
final class ExpressionEmitter {

    private static final Set<String> FORMAT_METHODS = Set.of(
            "Printf", "Sprintf", "Errorf", "Fatalf", "Logf", "Panicf", "Skipf",
            "Infof", "Warnf", "Debugf", "Fprintf");

    private final EmitContext ctx;
    private final StatementEmitter statements;
    private final PipeLowering pipes;

    ExpressionEmitter(EmitContext ctx, StatementEmitter statements) {
        this.ctx = ctx;
        this.statements = statements;
        this.pipes = new PipeLowering(ctx, this);
    }

    PipeLowering pipes() {
        return pipes;
    }

    String emit(Expression expr) {
        if (expr instanceof Identifier id) {
            String caught = ctx.caughtError(id.name());
            return caught != null ? caught : id.name();
        }
        if (expr instanceof IntegerLiteral lit) {
            return lit.token().text();
        }
        if (expr instanceof FloatLiteral lit) {
            return lit.token().text();
        }
        if (expr instanceof BooleanLiteral lit) {
            return lit.value() ? "true" : "false";
        }
        if (expr instanceof StringLiteral str) {
            return string(str);
        }
        if (expr instanceof BinaryExpr binary) {
            return binary(binary);
        }
        if (expr instanceof UnaryExpr unary) {
            String operand = operand(unary.operand());
            return (unary.operator() == UnaryExpr.Operator.NOT ? "!" : "-") + operand;
        }
        if (expr instanceof PipeExpr pipe) {
            return pipes.inline(pipe);
        }
        if (expr instanceof CallExpr call) {
            return call(call, null);
        }
        if (expr instanceof MethodCallExpr call) {
            return methodCall(call, null);
        }
        if (expr instanceof SelectorExpr selector) {
            if (selector.object() == null) {
                throw new CodeGenException("'." + selector.field() + "' shorthand needs a piped value", selector.token());
            }
            return operand(selector.object()) + "." + selector.field();
        }
        if (expr instanceof IndexExpr index) {
            String target = emit(index.target());
            if (ctx.facts().typeOf(index.target()) instanceof MapType) {
                return target + "[" + emit(index.index()) + "]";
            }
            return target + "[" + bound(index.target(), target, index.index()) + "]";
        }
        if (expr instanceof SliceExpr slice) {
            String target = emit(slice.target());
            String start = slice.start() == null ? "" : bound(slice.target(), target, slice.start());
            String end = slice.end() == null ? "" : bound(slice.target(), target, slice.end());
            return target + "[" + start + ":" + end + "]";
        }
        if (expr instanceof StructLiteralExpr struct) {
            return structLiteral(struct);
        }
        if (expr instanceof ListLiteralExpr list) {
            String elementType = list.elementType() != null
                    ? ctx.types().render(list.elementType())
                    : inferred(list, "any");
            return "[]" + elementType + "{" + joined(list.elements()) + "}";
        }
        if (expr instanceof MapLiteralExpr map) {
            return mapLiteral(map);
        }
        if (expr instanceof EmptyExpr empty) {
            return empty.type() == null ? "nil" : ctx.types().zeroValue(empty.type());
        }
        if (expr instanceof DiscardExpr) {
            return "_";
        }
        if (expr instanceof ErrorExpr error) {
            return errorValue(error);
        }
        if (expr instanceof MakeExpr make) {
            return make(make);
        }
        if (expr instanceof CloseExpr close) {
            return "close(" + emit(close.channel()) + ")";
        }
        if (expr instanceof PanicExpr panic) {
            return "panic(" + emit(panic.message()) + ")";
        }
        if (expr instanceof RecoverExpr) {
            return "recover()";
        }
        if (expr instanceof ReceiveExpr receive) {
            return "<-" + operand(receive.channel());
        }
        if (expr instanceof TypeCastExpr cast) {
            return cast(cast);
        }
        if (expr instanceof AddressOfExpr address) {
            if (address.operand() instanceof CallExpr || address.operand() instanceof MethodCallExpr) {
                return "new(" + emit(address.operand()) + ")";
            }
            return "&" + operand(address.operand());
        }
        if (expr instanceof DerefExpr deref) {
            return "*" + operand(deref.operand());
        }
        if (expr instanceof FunctionLiteral literal) {
            return functionLiteral(literal.params(), literal.returns(), literal.body());
        }
        if (expr instanceof ArrowLambda lambda) {
            return arrowLambda(lambda);
        }
        if (expr instanceof ReturnExpr || expr instanceof BlockExpr) {
            throw new CodeGenException("This form is only valid as an onerr handler", expr.token());
        }
        throw new CodeGenException("Cannot generate " + expr.getClass().getSimpleName(), expr.token());
    }

    String joined(List<Expression> expressions) {
        return expressions.stream().map(this::emit).collect(Collectors.joining(", "));
    }

    // --- calls ---

    /**
     * Emits a call. A non-null {@code piped} value takes the place of a {@code _} argument, or
     * becomes the first argument when there is none.
     */
    String call(CallExpr call, String piped) {
        List<String> args = arguments(call.args(), piped);
        if (call.function() instanceof Identifier id) {
            FunctionDecl local = ctx.function(id.name());
            if (local == null && id.name().equals("print")) {
                return ctx.imports().use("fmt") + ".Println(" + String.join(", ", args) + ")";
            }
            if (local != null && !call.spread()) {
                fillDefaults(local, args);
            }
        }
        return operand(call.function()) + "(" + String.join(", ", args) + (call.spread() ? "..." : "") + ")";
    }

    String methodCall(MethodCallExpr call, String piped) {
        String receiver;
        List<String> args;
        if (call.object() == null) {
            if (piped == null) {
                throw new CodeGenException("'." + call.method() + "()' shorthand needs a piped value", call.token());
            }
            receiver = piped;
            args = arguments(call.args(), null);
        } else {
            receiver = operand(call.object());
            args = formatArguments(call, piped);
        }
        return receiver + "." + call.method() + "(" + String.join(", ", args) + (call.spread() ? "..." : "") + ")";
    }

    private List<String> formatArguments(MethodCallExpr call, String piped) {
        int formatIndex = call.method().equals("Fprintf") ? 1 : 0;
        if (piped != null || !FORMAT_METHODS.contains(call.method()) || call.args().size() <= formatIndex
                || !(call.args().get(formatIndex) instanceof StringLiteral format) || !format.isInterpolated()) {
            return arguments(call.args(), piped);
        }
        List<String> args = new ArrayList<>();
        for (int i = 0; i < call.args().size(); i++) {
            if (i == formatIndex) {
                Format f = format(format);
                args.add(quote(f.pattern()));
                args.addAll(f.args());
            } else {
                args.add(emit(call.args().get(i)));
            }
        }
        return args;
    }

    private List<String> arguments(List<Expression> source, String piped) {
        List<String> args = new ArrayList<>();
        boolean placed = false;
        for (Expression arg : source) {
            if (piped != null && isPlaceholder(arg)) {
                args.add(piped);
                placed = true;
            } else {
                args.add(emit(arg));
            }
        }
        if (piped != null && !placed) {
            args.add(0, piped);
        }
        return args;
    }

    private static boolean isPlaceholder(Expression arg) {
        return arg instanceof DiscardExpr || (arg instanceof Identifier id && id.isBlank());
    }

    private void fillDefaults(FunctionDecl decl, List<String> args) {
        List<Parameter> params = decl.params();
        for (int i = args.size(); i < params.size(); i++) {
            Parameter param = params.get(i);
            if (param.variadic() || param.defaultValue() == null) {
                return;
            }
            args.add(emit(param.defaultValue()));
        }
    }

    // --- operators ---

    private String binary(BinaryExpr binary) {
        if (binary.operator().isMembership()) {
            String test = membership(binary);
            return binary.operator() == BinaryOperator.NOT_IN ? "!" + test : test;
        }
        return operand(binary.left()) + " " + binary.operator().goSymbol() + " " + operand(binary.right());
    }

    private String membership(BinaryExpr binary) {
        String element = emit(binary.left());
        String container = emit(binary.right());
        Type type = ctx.facts().typeOf(binary.right());
        if (type instanceof MapType) {
            return "func() bool { _, ok := " + container + "[" + element + "]; return ok }()";
        }
        if (type instanceof PrimitiveType p && p.isString()) {
            return ctx.imports().use("strings") + ".Contains(" + container + ", " + element + ")";
        }
        return ctx.imports().use("slices") + ".Contains(" + container + ", " + element + ")";
    }

    /**
     * Emits an operand of an operator, parenthesized when it is itself an operator expression.
     */
    private String operand(Expression expr) {
        String text = emit(expr);
        if (expr instanceof BinaryExpr) {
            return "(" + text + ")";
        }
        return text;
    }

    /**
     * An index or slice bound. A negative literal counts from the end of the target, which must
     * be a variable or field so that it is evaluated once.
     */
    private String bound(Expression targetExpr, String target, Expression index) {
        if (index instanceof UnaryExpr unary && unary.operator() == UnaryExpr.Operator.NEGATE) {
            if (!(unary.operand() instanceof IntegerLiteral literal)) {
                throw new CodeGenException("negative index must be an integer literal", unary.token());
            }
            if (!isNamed(targetExpr)) {
                throw new CodeGenException("negative index needs a variable or field as its target; assign the value first",
                        unary.token());
            }
            return "len(" + target + ")-" + literal.token().text();
        }
        return emit(index);
    }

    private static boolean isNamed(Expression expr) {
        if (expr instanceof Identifier) {
            return true;
        }
        return expr instanceof SelectorExpr selector && selector.object() != null && isNamed(selector.object());
    }

    // --- literals ---

    private String string(StringLiteral str) {
        if (!str.isInterpolated()) {
            return quote(str.plainValue());
        }
        Format format = format(str);
        return ctx.imports().use("fmt") + ".Sprintf(" + quote(format.pattern()) + ", " + String.join(", ", format.args()) + ")";
    }

    private record Format(String pattern, List<String> args) {
    }

    private Format format(StringLiteral str) {
        StringBuilder pattern = new StringBuilder();
        List<String> args = new ArrayList<>();
        for (StringLiteral.Part part : str.parts()) {
            if (part instanceof StringLiteral.Text text) {
                pattern.append(text.value().replace("%", "%%"));
            } else if (part instanceof StringLiteral.Interpolation interpolation) {
                pattern.append("%v");
                args.add(emit(interpolation.expression()));
            }
        }
        return new Format(pattern.toString(), args);
    }

    private String structLiteral(StructLiteralExpr struct) {
        String fields = struct.fields().stream()
                .map(f -> f.name() + ": " + emit(f.value()))
                .collect(Collectors.joining(", "));
        if (struct.type() instanceof ReferenceTypeRef ref) {
            return "&" + ctx.types().render(ref.target()) + "{" + fields + "}";
        }
        return ctx.types().render(struct.type()) + "{" + fields + "}";
    }

    private String mapLiteral(MapLiteralExpr map) {
        String type;
        if (map.keyType() != null && map.valueType() != null) {
            type = "map[" + ctx.types().render(map.keyType()) + "]" + ctx.types().render(map.valueType());
        } else {
            Type inferred = ctx.facts().typeOf(map);
            type = inferred instanceof MapType ? ctx.types().renderType(inferred).orElse("map[any]any") : "map[any]any";
        }
        String entries = map.entries().stream()
                .map(e -> emit(e.key()) + ": " + emit(e.value()))
                .collect(Collectors.joining(", "));
        return type + "{" + entries + "}";
    }

    private String inferred(ListLiteralExpr list, String fallback) {
        if (ctx.facts().typeOf(list) instanceof ListType type) {
            return ctx.types().renderType(type.elementType()).orElse(fallback);
        }
        return fallback;
    }

    String errorValue(ErrorExpr error) {
        if (error.message() instanceof StringLiteral str && str.isInterpolated()) {
            Format format = format(str);
            return ctx.imports().use("fmt") + ".Errorf(" + quote(format.pattern()) + ", " + String.join(", ", format.args()) + ")";
        }
        return ctx.imports().use("errors") + ".New(" + emit(error.message()) + ")";
    }

    private String make(MakeExpr make) {
        String type = ctx.types().render(make.type());
        if (make.args().isEmpty() && make.type() instanceof ListTypeRef) {
            return "make(" + type + ", 0)";
        }
        if (make.args().isEmpty()) {
            return "make(" + type + ")";
        }
        return "make(" + type + ", " + joined(make.args()) + ")";
    }

    // --- conversions ---

    private String cast(TypeCastExpr cast) {
        String type = ctx.types().render(cast.target());
        if (isAssertion(cast)) {
            return operand(cast.expression()) + ".(" + type + ")";
        }
        if (type.startsWith("*") || type.startsWith("func") || type.startsWith("<-")) {
            type = "(" + type + ")";
        }
        return type + "(" + emit(cast.expression()) + ")";
    }

    /**
     * True when a cast must be a type assertion: the target is an interface or a package type,
     * or the value being cast has an interface type.
     */
    boolean isAssertion(TypeCastExpr cast) {
        TypeRef target = cast.target();
        if (target instanceof NamedTypeRef named) {
            if (named.isQualified()) {
                return true;
            }
            if (ctx.environment().lookup(named.name()).orElse(null) instanceof InterfaceType) {
                return true;
            }
        }
        if (target instanceof PrimitiveTypeRef p && (p.name().equals("error") || p.name().equals("any"))) {
            return true;
        }
        Type source = ctx.facts().typeOf(cast.expression());
        return source instanceof InterfaceType
                || source instanceof PrimitiveType p && (p.isAny() || p.equals(PrimitiveType.ERROR));
    }

    // --- function literals ---

    String parameters(List<Parameter> params) {
        return params.stream().map(p -> {
            if (p.type() == null) {
                return p.name();
            }
            return p.name() + " " + (p.variadic() ? "..." : "") + ctx.types().render(p.type());
        }).collect(Collectors.joining(", "));
    }

    private String functionLiteral(List<Parameter> params, List<TypeRef> returns, BlockStmt body) {
        String header = "func(" + parameters(params) + ")" + ctx.types().results(returns);
        return header + " " + body(body, returns);
    }

    private String arrowLambda(ArrowLambda lambda) {
        String params = parameters(lambda.params());
        if (lambda.body() != null) {
            Type result = ctx.facts().typeOf(lambda.body());
            if (result instanceof TupleType tuple && tuple.elements().isEmpty()) {
                return "func(" + params + ") { " + emit(lambda.body()) + " }";
            }
            Optional<String> rendered = ctx.types().renderType(result);
            String returns = rendered.map(r -> " " + r).orElse("");
            return "func(" + params + ")" + returns + " { return " + emit(lambda.body()) + " }";
        }
        String returns = blockResult(lambda.block()).map(r -> " " + r).orElse("");
        return "func(" + params + ")" + returns + " " + body(lambda.block(), null);
    }

    /**
     * The Go result type of a block lambda, taken from its first return statement.
     */
    private Optional<String> blockResult(BlockStmt block) {
        ReturnStmt[] first = {null};
        for (var statement : block.statements()) {
            AstNodes.walk(statement, node -> {
                if (first[0] == null && node instanceof ReturnStmt ret) {
                    first[0] = ret;
                }
            });
            if (first[0] != null) {
                break;
            }
        }
        if (first[0] == null || first[0].values().isEmpty()) {
            return Optional.empty();
        }
        List<Type> types = first[0].values().stream().map(ctx.facts()::typeOf).toList();
        return ctx.types().renderType(types.size() == 1 ? types.get(0) : new TupleType(types));
    }

    private String body(BlockStmt block, List<TypeRef> returns) {
        GoWriter outer = ctx.writer();
        GoWriter inner = outer.nested();
        GoWriter previous = ctx.swapWriter(inner);
        List<TypeRef> previousReturns = ctx.swapReturns(returns);
        try {
            statements.statements(block);
        } finally {
            ctx.swapWriter(previous);
            ctx.swapReturns(previousReturns);
        }
        return "{\n" + inner + outer.padding() + "}";
    }

    // --- Go string literals ---

    static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
