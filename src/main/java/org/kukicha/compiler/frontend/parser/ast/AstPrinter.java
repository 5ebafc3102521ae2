package org.kukicha.compiler.frontend.parser.ast;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints an AST back as canonical Kukicha source. Nested binary operands are always
 * parenthesized and struct literals always use braces, so printing a re-parsed
 * printout yields the same text again.
 */
public final class AstPrinter {

    private static final String INDENT = "    ";

    private AstPrinter() {}

    public static String print(Program program) {
        return program.declarations().stream()
                .map(AstPrinter::declaration)
                .collect(Collectors.joining("\n"));
    }

    public static String declaration(Declaration declaration) {
        if (declaration instanceof PackageDecl p) {
            return "petiole " + p.name() + "\n";
        }
        if (declaration instanceof ImportDecl i) {
            return "import " + quote(i.path()) + (i.alias() != null ? " as " + i.alias() : "") + "\n";
        }
        if (declaration instanceof TypeDecl t) {
            if (t.isAlias()) {
                return "type " + t.name() + " " + type(t.aliasType()) + "\n";
            }
            StringBuilder sb = new StringBuilder("type ").append(t.name()).append('\n');
            for (FieldDecl field : t.fields()) {
                sb.append(INDENT).append(field.name()).append(' ').append(type(field.type()));
                if (field.tag() != null) {
                    sb.append(' ').append(field.tag());
                }
                sb.append('\n');
            }
            return sb.toString();
        }
        if (declaration instanceof InterfaceDecl i) {
            StringBuilder sb = new StringBuilder("interface ").append(i.name()).append('\n');
            for (MethodSignature method : i.methods()) {
                sb.append(INDENT).append(method.name()).append('(').append(parameters(method.params(), 1)).append(')')
                        .append(returns(method.returns())).append('\n');
            }
            return sb.toString();
        }
        if (declaration instanceof FunctionDecl f) {
            StringBuilder sb = new StringBuilder("func ").append(f.name());
            if (f.receiver() != null) {
                sb.append(" on ").append(f.receiver().name());
                if (f.receiver().type() != null) {
                    sb.append(' ').append(type(f.receiver().type()));
                }
            }
            sb.append('(').append(parameters(f.params(), 1)).append(')').append(returns(f.returns())).append('\n');
            sb.append(block(f.body(), 1));
            return sb.toString();
        }
        throw new IllegalStateException("Unknown declaration: " + declaration.getClass().getSimpleName());
    }

    private static String block(BlockStmt block, int level) {
        StringBuilder sb = new StringBuilder();
        for (Statement statement : block.statements()) {
            sb.append(INDENT.repeat(level)).append(statement(statement, level));
        }
        if (block.statements().isEmpty()) {
            // An empty block cannot be written in source; a no-op keeps the printout parseable.
            sb.append(INDENT.repeat(level)).append("_ = 0\n");
        }
        return sb.toString();
    }

    private static String endLine(String text) {
        return text.endsWith("\n") ? text : text + "\n";
    }

    static String statement(Statement statement, int level) {
        if (statement instanceof VarDeclStmt v) {
            String names = v.names().stream().map(Identifier::name).collect(Collectors.joining(", "));
            return endLine(names + " := " + list(v.values(), level) + onErr(v.onErr(), level));
        }
        if (statement instanceof AssignStmt a) {
            return endLine(list(a.targets(), level) + " = " + list(a.values(), level) + onErr(a.onErr(), level));
        }
        if (statement instanceof ExpressionStmt e) {
            return endLine(expression(e.expression(), level) + onErr(e.onErr(), level));
        }
        if (statement instanceof ReturnStmt r) {
            return endLine(r.values().isEmpty() ? "return" : "return " + list(r.values(), level));
        }
        if (statement instanceof IfStmt i) {
            StringBuilder sb = new StringBuilder("if ").append(expression(i.condition(), level)).append('\n');
            sb.append(block(i.consequence(), level + 1));
            if (i.alternative() instanceof IfStmt elseIf) {
                sb.append(INDENT.repeat(level)).append("else ").append(statement(elseIf, level));
            } else if (i.alternative() instanceof BlockStmt elseBlock) {
                sb.append(INDENT.repeat(level)).append("else\n").append(block(elseBlock, level + 1));
            }
            return sb.toString();
        }
        if (statement instanceof ForRangeStmt f) {
            String vars = (f.index() != null ? f.index().name() + ", " : "") + f.value().name();
            return "for " + vars + " in " + expression(f.collection(), level) + "\n" + block(f.body(), level + 1);
        }
        if (statement instanceof ForNumericStmt f) {
            return "for " + f.variable().name() + " from " + expression(f.start(), level)
                    + (f.inclusive() ? " through " : " to ") + expression(f.end(), level) + "\n"
                    + block(f.body(), level + 1);
        }
        if (statement instanceof ForConditionStmt f) {
            String head = f.condition() == null ? "for" : "for " + expression(f.condition(), level);
            return head + "\n" + block(f.body(), level + 1);
        }
        if (statement instanceof SwitchStmt s) {
            StringBuilder sb = new StringBuilder("switch");
            if (s.subject() != null) {
                sb.append(' ').append(expression(s.subject(), level));
            }
            sb.append('\n');
            String armIndent = INDENT.repeat(level + 1);
            for (WhenCase when : s.cases()) {
                sb.append(armIndent).append("when ").append(list(when.values(), level + 1)).append('\n')
                        .append(block(when.body(), level + 2));
            }
            if (s.otherwise() != null) {
                sb.append(armIndent).append("otherwise\n").append(block(s.otherwise(), level + 2));
            }
            return sb.toString();
        }
        if (statement instanceof DeferStmt d) {
            return endLine("defer " + expression(d.call(), level));
        }
        if (statement instanceof GoStmt g) {
            return g.block() != null
                    ? "go\n" + block(g.block(), level + 1)
                    : endLine("go " + expression(g.call(), level));
        }
        if (statement instanceof SendStmt s) {
            return "send " + expression(s.value(), level) + " to " + expression(s.channel(), level) + "\n";
        }
        if (statement instanceof BreakStmt) {
            return "break\n";
        }
        if (statement instanceof ContinueStmt) {
            return "continue\n";
        }
        if (statement instanceof BlockStmt b) {
            return block(b, level);
        }
        throw new IllegalStateException("Unknown statement: " + statement.getClass().getSimpleName());
    }

    private static String onErr(OnErrClause clause, int level) {
        if (clause == null) {
            return "";
        }
        String explain = clause.hasExplain() ? " explain " + quote(clause.explain()) : "";
        if (clause.shorthandReturn()) {
            return " onerr return";
        }
        if (clause.handler() == null) {
            return " onerr" + explain;
        }
        if (clause.handler() instanceof BlockExpr b) {
            String head = clause.alias() != null ? " onerr as " + clause.alias() : " onerr";
            return head + "\n" + block(b.body(), level + 1);
        }
        return " onerr " + expression(clause.handler(), level) + explain;
    }

    private static String list(List<Expression> expressions, int level) {
        return expressions.stream().map(e -> expression(e, level)).collect(Collectors.joining(", "));
    }

    public static String expression(Expression expression) {
        return expression(expression, 0);
    }

    static String expression(Expression expr, int level) {
        if (expr instanceof Identifier i) {
            return i.name();
        }
        if (expr instanceof IntegerLiteral i) {
            return Long.toString(i.value());
        }
        if (expr instanceof FloatLiteral f) {
            return Double.toString(f.value());
        }
        if (expr instanceof BooleanLiteral b) {
            return Boolean.toString(b.value());
        }
        if (expr instanceof StringLiteral s) {
            return string(s, level);
        }
        if (expr instanceof BinaryExpr b) {
            return operand(b.left(), level) + " " + b.operator().surface() + " " + operand(b.right(), level);
        }
        if (expr instanceof UnaryExpr u) {
            return (u.operator() == UnaryExpr.Operator.NOT ? "not " : "-") + operand(u.operand(), level);
        }
        if (expr instanceof PipeExpr p) {
            return operand(p.left(), level) + " |> " + operand(p.right(), level);
        }
        if (expr instanceof CallExpr c) {
            return postfixTarget(c.function(), level) + "(" + arguments(c.args(), c.spread(), level) + ")";
        }
        if (expr instanceof MethodCallExpr m) {
            String object = m.object() == null ? "" : postfixTarget(m.object(), level);
            return object + "." + m.method() + "(" + arguments(m.args(), m.spread(), level) + ")";
        }
        if (expr instanceof SelectorExpr s) {
            return (s.object() == null ? "" : postfixTarget(s.object(), level)) + "." + s.field();
        }
        if (expr instanceof IndexExpr i) {
            return postfixTarget(i.target(), level) + "[" + expression(i.index(), level) + "]";
        }
        if (expr instanceof SliceExpr s) {
            return postfixTarget(s.target(), level) + "["
                    + (s.start() == null ? "" : expression(s.start(), level)) + ":"
                    + (s.end() == null ? "" : expression(s.end(), level)) + "]";
        }
        if (expr instanceof StructLiteralExpr s) {
            return type(s.type()) + "{" + s.fields().stream()
                    .map(f -> f.name() + ": " + expression(f.value(), level))
                    .collect(Collectors.joining(", ")) + "}";
        }
        if (expr instanceof ListLiteralExpr l) {
            return l.elementType() == null
                    ? "[" + list(l.elements(), level) + "]"
                    : "list of " + type(l.elementType()) + "{" + list(l.elements(), level) + "}";
        }
        if (expr instanceof MapLiteralExpr m) {
            return "map of " + type(m.keyType()) + " to " + type(m.valueType()) + "{" + m.entries().stream()
                    .map(e -> expression(e.key(), level) + ": " + expression(e.value(), level))
                    .collect(Collectors.joining(", ")) + "}";
        }
        if (expr instanceof EmptyExpr e) {
            return e.type() == null ? "empty" : "empty " + type(e.type());
        }
        if (expr instanceof DiscardExpr) {
            return "discard";
        }
        if (expr instanceof ErrorExpr e) {
            return "error " + keywordOperand(e.message(), level);
        }
        if (expr instanceof MakeExpr m) {
            StringBuilder sb = new StringBuilder("make(").append(type(m.type()));
            for (Expression arg : m.args()) {
                sb.append(", ").append(expression(arg, level));
            }
            return sb.append(')').toString();
        }
        if (expr instanceof CloseExpr c) {
            return "close " + keywordOperand(c.channel(), level);
        }
        if (expr instanceof PanicExpr p) {
            return "panic " + keywordOperand(p.message(), level);
        }
        if (expr instanceof RecoverExpr) {
            return "recover()";
        }
        if (expr instanceof ReceiveExpr r) {
            return "receive from " + keywordOperand(r.channel(), level);
        }
        if (expr instanceof TypeCastExpr t) {
            return postfixTarget(t.expression(), level) + " as " + type(t.target());
        }
        if (expr instanceof AddressOfExpr a) {
            return "reference of " + operand(a.operand(), level);
        }
        if (expr instanceof DerefExpr d) {
            return "dereference " + operand(d.operand(), level);
        }
        if (expr instanceof FunctionLiteral f) {
            return "func(" + parameters(f.params(), level + 1) + ")" + returns(f.returns()) + "\n"
                    + block(f.body(), level + 1);
        }
        if (expr instanceof ArrowLambda a) {
            String head = "(" + parameters(a.params(), level + 1) + ") =>";
            return a.block() != null
                    ? head + "\n" + block(a.block(), level + 1)
                    : head + " " + expression(a.body(), level);
        }
        if (expr instanceof ReturnExpr r) {
            return r.values().isEmpty() ? "return" : "return " + list(r.values(), level);
        }
        if (expr instanceof BlockExpr b) {
            return "\n" + block(b.body(), level + 1);
        }
        throw new IllegalStateException("Unknown expression: " + expr.getClass().getSimpleName());
    }

    private static String arguments(List<Expression> args, boolean spread, int level) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            if (spread && i == args.size() - 1) {
                sb.append("many ");
            }
            sb.append(expression(args.get(i), level));
        }
        return sb.toString();
    }

    private static boolean isCompound(Expression expr) {
        return expr instanceof BinaryExpr || expr instanceof PipeExpr || expr instanceof UnaryExpr
                || expr instanceof TypeCastExpr || expr instanceof AddressOfExpr || expr instanceof DerefExpr
                || expr instanceof ErrorExpr || expr instanceof PanicExpr || expr instanceof CloseExpr
                || expr instanceof ReceiveExpr || expr instanceof ArrowLambda
                || (expr instanceof EmptyExpr empty && empty.type() != null);
    }

    private static String operand(Expression expr, int level) {
        String text = expression(expr, level);
        return isCompound(expr) ? "(" + text + ")" : text;
    }

    private static String postfixTarget(Expression expr, int level) {
        return operand(expr, level);
    }

    private static String keywordOperand(Expression expr, int level) {
        String text = expression(expr, level);
        return expr instanceof StringLiteral || expr instanceof Identifier ? text : "(" + text + ")";
    }

    private static String parameters(List<Parameter> params, int level) {
        return params.stream().map(p -> {
            StringBuilder sb = new StringBuilder();
            if (p.variadic()) {
                sb.append("many ");
            }
            sb.append(p.name());
            if (p.type() != null) {
                sb.append(' ').append(type(p.type()));
            }
            if (p.defaultValue() != null) {
                sb.append(" = ").append(expression(p.defaultValue(), level));
            }
            return sb.toString();
        }).collect(Collectors.joining(", "));
    }

    private static String returns(List<TypeRef> returns) {
        if (returns.isEmpty()) {
            return "";
        }
        if (returns.size() == 1) {
            return " " + type(returns.get(0));
        }
        return " (" + returns.stream().map(AstPrinter::type).collect(Collectors.joining(", ")) + ")";
    }

    public static String type(TypeRef type) {
        if (type instanceof PrimitiveTypeRef p) {
            return p.name();
        }
        if (type instanceof NamedTypeRef n) {
            return n.name();
        }
        if (type instanceof ListTypeRef l) {
            return "list of " + type(l.elementType());
        }
        if (type instanceof MapTypeRef m) {
            return "map of " + type(m.keyType()) + " to " + type(m.valueType());
        }
        if (type instanceof ChannelTypeRef c) {
            return "channel of " + type(c.elementType());
        }
        if (type instanceof ReferenceTypeRef r) {
            return "reference " + type(r.target());
        }
        if (type instanceof FunctionTypeRef f) {
            String params = f.params().stream().map(AstPrinter::type).collect(Collectors.joining(", "));
            return "func(" + params + ")" + returns(f.returns());
        }
        throw new IllegalStateException("Unknown type: " + type.getClass().getSimpleName());
    }

    private static String string(StringLiteral literal, int level) {
        StringBuilder sb = new StringBuilder("\"");
        for (StringLiteral.Part part : literal.parts()) {
            if (part instanceof StringLiteral.Text text) {
                sb.append(escape(text.value()));
            } else if (part instanceof StringLiteral.Interpolation interpolation) {
                sb.append('{').append(expression(interpolation.expression(), level)).append('}');
            }
        }
        return sb.append('"').toString();
    }

    private static String quote(String text) {
        return "\"" + escape(text) + "\"";
    }

    private static String escape(String text) {
        StringBuilder sb = new StringBuilder();
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '{' -> sb.append("\\{");
                case '}' -> sb.append("\\}");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
