package org.kukicha.compiler.backend.codegen;

import org.kukicha.compiler.Compiler;
import org.kukicha.compiler.api.CompilationResult;
import org.kukicha.compiler.api.SourceUnit;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Checks the Go produced for each onerr handler form.
 */
class OnErrLoweringTest {

    private static Compiler compiler;

    @BeforeAll
    static void setUp() {
        compiler = new Compiler();
    }

    private static String compile(String source) {
        CompilationResult result = compiler.compile(SourceUnit.of("main.kuki", source));
        assertThat(result.hasErrors()).as("%s", result.diagnostics()).isFalse();
        return result.files().get(0).content();
    }

    @Test
    @Tag("unit")
    void panicHandlerChecksTheRegistryKnownErrorResult() {
        String go = compile("""
                import "strconv"

                func parse(s string) int
                    n := strconv.Atoi(s) onerr panic "bad number"
                    return n
                """);

        assertThat(go).contains("""
                \tn, err_1 := strconv.Atoi(s)
                \tif err_1 != nil {
                \t\tpanic("bad number")
                \t}
                \treturn n
                """);
    }

    @Test
    @Tag("unit")
    void aliasNamesTheCaughtErrorInsideABlockHandler() {
        String go = compile("""
                import "strconv"

                func parse(s string) int
                    n := strconv.Atoi(s) onerr as problem
                        print("failed: {problem}")
                        return 0
                    return n
                """);

        assertThat(go).contains("""
                \tif err_1 != nil {
                \t\tfmt.Println(fmt.Sprintf("failed: %v", err_1))
                \t\treturn 0
                \t}
                """);
    }

    @Test
    @Tag("unit")
    void propagationReturnsZeroValuesAndTheError() {
        String go = compile("""
                import "strconv"

                func parse(s string) (int, error)
                    n := strconv.Atoi(s) onerr return
                    return n, empty
                """);

        assertThat(go).contains("""
                \tn, err_1 := strconv.Atoi(s)
                \tif err_1 != nil {
                \t\treturn 0, err_1
                \t}
                """);
    }

    @Test
    @Tag("unit")
    void explainWrapsTheErrorBeforePropagating() {
        String go = compile("""
                import "strconv"

                func parse(s string) (int, error)
                    n := strconv.Atoi(s) onerr explain "parsing count"
                    return n, empty
                """);

        assertThat(go).contains("""
                \tif err_1 != nil {
                \t\terr_1 = fmt.Errorf("parsing count: %w", err_1)
                \t\treturn 0, err_1
                \t}
                """);
    }

    @Test
    @Tag("unit")
    void defaultValueIsAssignedToTheBoundName() {
        String go = compile("""
                import "strconv"

                func parse(s string) int
                    n := strconv.Atoi(s) onerr 0
                    return n
                """);

        assertThat(go).contains("""
                \tn, err_1 := strconv.Atoi(s)
                \tif err_1 != nil {
                \t\tn = 0
                \t}
                """);
    }

    @Test
    @Tag("unit")
    void statementLevelOnErrUsesBlanksForUnusedResults() {
        String go = compile("""
                import "strconv"

                func validate(s string) error
                    strconv.Atoi(s) onerr return
                    return empty
                """);

        assertThat(go).contains("""
                \tif _, err_1 := strconv.Atoi(s); err_1 != nil {
                \t\treturn err_1
                \t}
                """);
    }

    @Test
    @Tag("unit")
    void unknownExternalCallIsAssumedToReturnValueAndError() {
        String go = compile("""
                import "example.com/widgets"

                func main()
                    w := widgets.Build("x") onerr panic "no widget"
                    print(w)
                """);

        assertThat(go).contains("\tw, err_1 := widgets.Build(\"x\")\n")
                .contains("\t\"example.com/widgets\"\n");
    }

    @Test
    @Tag("unit")
    void eachHandlerGetsItsOwnErrorVariable() {
        String go = compile("""
                import "strconv"

                func sum(a string, b string) int
                    x := strconv.Atoi(a) onerr 0
                    y := strconv.Atoi(b) onerr 0
                    return x + y
                """);

        assertThat(go).contains("x, err_1 := strconv.Atoi(a)").contains("y, err_2 := strconv.Atoi(b)");
    }

    @Test
    @Tag("unit")
    void unknownExternalCallAtTheEndOfAPipeStillCollapses() {
        String go = compile("""
                import "example.com/widgets"

                func main()
                    w := "x" |> widgets.Build() onerr panic "no widget"
                    print(w)
                """);

        assertThat(go).contains("\tw, err_1 := widgets.Build(\"x\")\n").doesNotContain("pipe_");
    }
}
