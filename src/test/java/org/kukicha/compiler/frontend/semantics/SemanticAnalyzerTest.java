package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.diagnostics.Diagnostic;
import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.kukicha.compiler.frontend.lexer.Lexer;
import org.kukicha.compiler.frontend.parser.Parser;
import org.kukicha.compiler.frontend.parser.ast.AstNodes;
import org.kukicha.compiler.frontend.parser.ast.MethodCallExpr;
import org.kukicha.compiler.frontend.parser.ast.Program;
import org.kukicha.compiler.frontend.semantics.AnalysisFacts.ReturnArity;
import org.kukicha.compiler.frontend.semantics.registry.SignatureRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SemanticAnalyzerTest {

    @Mock
    private SignatureRegistry signatures;

    private DiagnosticsEngine diagnostics;
    private Program program;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
    }

    private AnalysisFacts analyze(String source) {
        program = new Parser(new Lexer(source, diagnostics, "main.kuki").scanTokens(), diagnostics, "main.kuki").parse();
        assertThat(diagnostics.hasErrors()).as("parse errors: %s", diagnostics.getDiagnostics()).isFalse();
        return new SemanticAnalyzer(diagnostics, new SymbolTable(diagnostics), signatures).analyze(program);
    }

    private MethodCallExpr firstMethodCall() {
        List<MethodCallExpr> calls = new ArrayList<>();
        AstNodes.walk(program, node -> {
            if (node instanceof MethodCallExpr call) {
                calls.add(call);
            }
        });
        return calls.get(0);
    }

    private List<String> errorMessages() {
        return diagnostics.getErrors().stream().map(Diagnostic::message).toList();
    }

    @Test
    @Tag("unit")
    void registeredArityIsRecordedForExternalCall() {
        when(signatures.lookup("strconv.Atoi")).thenReturn(OptionalInt.of(2));

        AnalysisFacts facts = analyze("""
                import "strconv"

                func parse(s string) int
                    n := strconv.Atoi(s) onerr panic "bad number"
                    return n
                """);

        assertThat(diagnostics.hasErrors()).as("%s", diagnostics.getDiagnostics()).isFalse();
        assertThat(facts.arity(firstMethodCall())).contains(ReturnArity.of(2));
        assertThat(facts.isFrozen()).isTrue();
    }

    @Test
    @Tag("unit")
    void registryMissFallsBackToASingleAssumedResult() {
        when(signatures.lookup("example.com/widgets.Build")).thenReturn(OptionalInt.empty());

        AnalysisFacts facts = analyze("""
                import "example.com/widgets"

                func main()
                    w := widgets.Build("x") onerr panic "no widget"
                    print(w)
                """);

        assertThat(diagnostics.hasErrors()).as("%s", diagnostics.getDiagnostics()).isFalse();
        assertThat(facts.arity(firstMethodCall())).contains(ReturnArity.ASSUMED);
        verify(signatures).lookup("example.com/widgets.Build");
    }

    @Test
    @Tag("unit")
    void unannotatedParameterIsReportedOnceAndAnalysisContinues() {
        analyze("""
                func greet(name) string
                    return "hi"

                func main()
                    print(missing)
                """);

        List<Diagnostic> annotationErrors = diagnostics.getErrors().stream()
                .filter(d -> d.message().contains("requires an explicit type annotation"))
                .toList();
        assertThat(annotationErrors).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(ErrorKind.SEMANTIC);
            assertThat(d.message()).contains("'name'");
            assertThat(d.line()).isEqualTo(1);
            assertThat(d.column()).isEqualTo(12);
        });
        assertThat(errorMessages()).contains("Undefined identifier 'missing'");
    }

    @Test
    @Tag("unit")
    void structMissingAnInterfaceMethodIsReportedByName() {
        analyze("""
                interface Shape
                    Area() float64
                    Name() string

                type Square
                    side float64

                func Area on s Square float64
                    return s.side * s.side

                func describe(shape Shape) string
                    return shape.Name()

                func main()
                    sq := Square{side: 2.0}
                    print(describe(sq))
                """);

        assertThat(errorMessages()).anySatisfy(message -> assertThat(message)
                .contains("'Square' does not implement interface 'Shape'")
                .contains("missing method 'Name'"));
    }

    @Test
    @Tag("unit")
    void structWithAllMethodsSatisfiesTheInterface() {
        analyze("""
                interface Shape
                    Area() float64
                    Name() string

                type Square
                    side float64

                func Area on s Square float64
                    return s.side * s.side

                func Name on s Square string
                    return "square"

                func describe(shape Shape) string
                    return shape.Name()

                func main()
                    sq := Square{side: 2.0}
                    print(describe(sq))
                """);

        assertThat(diagnostics.hasErrors()).as("%s", diagnostics.getDiagnostics()).isFalse();
    }

    @Test
    @Tag("unit")
    void multiValuePipeSourceNeedsOnerr() {
        analyze("""
                func pair() (int, error)
                    return 1, empty

                func double(n int) int
                    return n * 2

                func main()
                    x := pair() |> double()
                    print(x)
                """);

        assertThat(errorMessages()).anySatisfy(message -> assertThat(message).contains("cannot be piped without onerr"));
    }

    @Test
    @Tag("unit")
    void onerrOnACallWithoutAnErrorResultIsRejected() {
        analyze("""
                func double(n int) int
                    return n * 2

                func main()
                    x := double(2) onerr panic "never"
                    print(x)
                """);

        assertThat(errorMessages()).anySatisfy(message -> assertThat(message).contains("does not return an error"));
    }

    @Test
    @Tag("unit")
    void errorsAccumulateAcrossFunctions() {
        analyze("""
                func first()
                    print(a)

                func second()
                    print(b)
                """);

        assertThat(errorMessages()).contains("Undefined identifier 'a'", "Undefined identifier 'b'");
    }
}
