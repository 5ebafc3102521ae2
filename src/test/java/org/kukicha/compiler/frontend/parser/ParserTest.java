package org.kukicha.compiler.frontend.parser;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.kukicha.compiler.frontend.lexer.Lexer;
import org.kukicha.compiler.frontend.parser.ast.BinaryExpr;
import org.kukicha.compiler.frontend.parser.ast.BinaryOperator;
import org.kukicha.compiler.frontend.parser.ast.CallExpr;
import org.kukicha.compiler.frontend.parser.ast.ExpressionStmt;
import org.kukicha.compiler.frontend.parser.ast.ForNumericStmt;
import org.kukicha.compiler.frontend.parser.ast.ForRangeStmt;
import org.kukicha.compiler.frontend.parser.ast.FunctionDecl;
import org.kukicha.compiler.frontend.parser.ast.Identifier;
import org.kukicha.compiler.frontend.parser.ast.ImportDecl;
import org.kukicha.compiler.frontend.parser.ast.InterfaceDecl;
import org.kukicha.compiler.frontend.parser.ast.ListTypeRef;
import org.kukicha.compiler.frontend.parser.ast.MethodCallExpr;
import org.kukicha.compiler.frontend.parser.ast.PanicExpr;
import org.kukicha.compiler.frontend.parser.ast.PipeExpr;
import org.kukicha.compiler.frontend.parser.ast.Program;
import org.kukicha.compiler.frontend.parser.ast.ReturnStmt;
import org.kukicha.compiler.frontend.parser.ast.StringLiteral;
import org.kukicha.compiler.frontend.parser.ast.TypeDecl;
import org.kukicha.compiler.frontend.parser.ast.VarDeclStmt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ParserTest {

    private DiagnosticsEngine diagnostics;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private Program parse(String source) {
        return new Parser(new Lexer(source, diagnostics, "main.kuki").scanTokens(), diagnostics, "main.kuki").parse();
    }

    @Test
    @Tag("unit")
    void parsesFunctionWithParametersAndResults() {
        Program program = parse("""
                func divide(a int, b int) (int, error)
                    return a / b, empty
                """);

        assertThat(diagnostics.hasErrors()).isFalse();
        FunctionDecl function = program.functions().get(0);
        assertThat(function.name()).isEqualTo("divide");
        assertThat(function.isMethod()).isFalse();
        assertThat(function.params()).extracting(p -> p.name()).containsExactly("a", "b");
        assertThat(function.returns()).hasSize(2);
        assertThat(function.body().statements()).singleElement().isInstanceOf(ReturnStmt.class);
    }

    @Test
    @Tag("unit")
    void parsesMethodWithExplicitReceiver() {
        Program program = parse("""
                type Square
                    side float64

                func Area on s Square float64
                    return s.side * s.side
                """);

        assertThat(diagnostics.hasErrors()).isFalse();
        FunctionDecl method = program.functions().get(0);
        assertThat(method.isMethod()).isTrue();
        assertThat(method.receiver().name()).isEqualTo("s");
        assertThat(method.params()).isEmpty();
        assertThat(method.returns()).hasSize(1);
    }

    @Test
    @Tag("unit")
    void parsesStructFieldsWithTags() {
        Program program = parse("""
                type Todo
                    id int64 as "id"
                    title string json:"title,omitempty"
                    tags list of string
                """);

        assertThat(diagnostics.hasErrors()).isFalse();
        TypeDecl todo = (TypeDecl) program.declarations().get(0);
        assertThat(todo.fields()).extracting(f -> f.tag())
                .containsExactly("json:\"id\"", "json:\"title,omitempty\"", null);
        assertThat(todo.fields().get(2).type()).isInstanceOf(ListTypeRef.class);
    }

    @Test
    @Tag("unit")
    void parsesInterfaceMethodSet() {
        Program program = parse("""
                interface Shape
                    Area() float64
                    Scale(factor float64)
                """);

        assertThat(diagnostics.hasErrors()).isFalse();
        InterfaceDecl shape = (InterfaceDecl) program.declarations().get(0);
        assertThat(shape.methods()).extracting(m -> m.name()).containsExactly("Area", "Scale");
        assertThat(shape.methods().get(1).returns()).isEmpty();
    }

    @Test
    @Tag("unit")
    void importWithAlias() {
        Program program = parse("import \"encoding/json\" as js\n");

        ImportDecl decl = program.imports().get(0);
        assertThat(decl.path()).isEqualTo("encoding/json");
        assertThat(decl.effectiveName()).isEqualTo("js");
    }

    @Test
    @Tag("unit")
    void pipeChainIsLeftAssociative() {
        Program program = parse("""
                func main()
                    x := a |> f(1) |> .Trim()
                """);

        assertThat(diagnostics.hasErrors()).isFalse();
        VarDeclStmt decl = (VarDeclStmt) program.functions().get(0).body().statements().get(0);
        PipeExpr outer = (PipeExpr) decl.values().get(0);
        assertThat(outer.right()).isInstanceOfSatisfying(MethodCallExpr.class, m -> assertThat(m.isShorthand()).isTrue());
        PipeExpr inner = (PipeExpr) outer.left();
        assertThat(inner.left()).isEqualTo(new Identifier(inner.left().token(), "a"));
        assertThat(inner.right()).isInstanceOf(CallExpr.class);
    }

    @Test
    @Tag("unit")
    void onerrClauseIsAttachedToBinding() {
        Program program = parse("""
                func main()
                    n := parse(s) onerr panic "bad input"
                    m := parse(s) onerr 0 explain "using zero"
                    data := load() onerr return
                """);

        assertThat(diagnostics.hasErrors()).isFalse();
        var statements = program.functions().get(0).body().statements();
        VarDeclStmt first = (VarDeclStmt) statements.get(0);
        assertThat(first.onErr().handler()).isInstanceOf(PanicExpr.class);
        VarDeclStmt second = (VarDeclStmt) statements.get(1);
        assertThat(second.onErr().explain()).isEqualTo("using zero");
        VarDeclStmt third = (VarDeclStmt) statements.get(2);
        assertThat(third.onErr().propagates()).isTrue();
    }

    @Test
    @Tag("unit")
    void onerrBlockWithAlias() {
        Program program = parse("""
                func main()
                    load() onerr as problem
                        print(problem)
                """);

        assertThat(diagnostics.hasErrors()).isFalse();
        ExpressionStmt statement = (ExpressionStmt) program.functions().get(0).body().statements().get(0);
        assertThat(statement.onErr().alias()).isEqualTo("problem");
    }

    @Test
    @Tag("unit")
    void loopForms() {
        Program program = parse("""
                func main()
                    for i from 0 through 10
                        print(i)
                    for i, item in items
                        print(item)
                """);

        assertThat(diagnostics.hasErrors()).isFalse();
        var statements = program.functions().get(0).body().statements();
        assertThat(statements.get(0)).isInstanceOfSatisfying(ForNumericStmt.class, loop -> assertThat(loop.inclusive()).isTrue());
        assertThat(statements.get(1)).isInstanceOfSatisfying(ForRangeStmt.class, loop -> {
            assertThat(loop.index().name()).isEqualTo("i");
            assertThat(loop.value().name()).isEqualTo("item");
        });
    }

    @Test
    @Tag("unit")
    void englishOperatorsMapToBinaryOperators() {
        Program program = parse("""
                func main()
                    ok := a equals b and c not equals d
                """);

        assertThat(diagnostics.hasErrors()).isFalse();
        VarDeclStmt decl = (VarDeclStmt) program.functions().get(0).body().statements().get(0);
        BinaryExpr and = (BinaryExpr) decl.values().get(0);
        assertThat(and.operator()).isEqualTo(BinaryOperator.AND);
        assertThat(((BinaryExpr) and.right()).operator()).isEqualTo(BinaryOperator.NE);
    }

    @Test
    @Tag("unit")
    void interpolatedStringHoldsParsedExpressions() {
        Program program = parse("""
                func main()
                    s := "total: {a + b}"
                """);

        assertThat(diagnostics.hasErrors()).isFalse();
        VarDeclStmt decl = (VarDeclStmt) program.functions().get(0).body().statements().get(0);
        StringLiteral literal = (StringLiteral) decl.values().get(0);
        assertThat(literal.isInterpolated()).isTrue();
        assertThat(literal.parts().get(1)).isInstanceOfSatisfying(StringLiteral.Interpolation.class,
                part -> assertThat(part.expression()).isInstanceOf(BinaryExpr.class));
    }

    @Test
    @Tag("unit")
    void badStatementIsSkippedAndTheRestOfTheBlockParsed() {
        Program program = parse("""
                func main()
                    x := := 1
                    y := 2
                """);

        assertThat(diagnostics.getErrors(ErrorKind.SYNTAX)).hasSize(1);
        assertThat(program.functions().get(0).body().statements()).singleElement().isInstanceOf(VarDeclStmt.class);
    }

    @Test
    @Tag("unit")
    void badDeclarationIsDroppedAndParsingContinues() {
        Program program = parse("""
                func 123()
                    return

                func ok() int
                    return 1
                """);

        assertThat(diagnostics.getErrors(ErrorKind.SYNTAX)).hasSize(1);
        assertThat(diagnostics.getErrors().get(0).message()).startsWith("Expected");
        assertThat(program.functions()).extracting(FunctionDecl::name).containsExactly("ok");
    }
}
