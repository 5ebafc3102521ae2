package org.kukicha.compiler.backend.codegen;

import org.kukicha.compiler.Compiler;
import org.kukicha.compiler.api.CompilationResult;
import org.kukicha.compiler.api.SourceUnit;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PipeLoweringTest {

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
    void pipedValueBecomesTheFirstArgument() {
        String go = compile("""
                func sub(a int, b int) int
                    return a - b

                func main()
                    print(10 |> sub(3))
                """);

        assertThat(go).contains("\tfmt.Println(sub(10, 3))\n");
    }

    @Test
    @Tag("unit")
    void placeholderChoosesTheArgumentPosition() {
        String go = compile("""
                func sub(a int, b int) int
                    return a - b

                func main()
                    print(3 |> sub(10, _))
                """);

        assertThat(go).contains("\tfmt.Println(sub(10, 3))\n");
    }

    @Test
    @Tag("unit")
    void chainedSingleValuePipesNest() {
        String go = compile("""
                import "strings"

                func shout(s string) string
                    return s |> strings.TrimSpace() |> strings.ToUpper()
                """);

        assertThat(go).contains("\treturn strings.ToUpper(strings.TrimSpace(s))\n");
    }

    @Test
    @Tag("unit")
    void multiValueStageIsSplitIntoTemporaries() {
        String go = compile("""
                import "os"

                func load(path string) (string, error)
                    text := os.ReadFile(path) |> string() onerr return
                    return text, empty
                """);

        assertThat(go).contains("\tpipe_1, err_1 := os.ReadFile(path)\n")
                .contains("\t\treturn \"\", err_1\n")
                .contains("\tpipe_2 := string(pipe_1)\n")
                .contains("\ttext := pipe_2\n");
    }

    @Test
    @Tag("unit")
    void multiValuePipeWithoutOnErrIsRejected() {
        CompilationResult result = compiler.compile(SourceUnit.of("main.kuki", """
                import "os"

                func load(path string) string
                    text := os.ReadFile(path) |> string()
                    return text
                """));

        assertThat(result.errors()).anySatisfy(d -> {
            assertThat(d.kind()).isEqualTo(ErrorKind.SEMANTIC);
            assertThat(d.message()).contains("cannot be piped without onerr");
        });
        assertThat(result.files()).isEmpty();
    }

    @Test
    @Tag("unit")
    void rightSideMustBeACall() {
        CompilationResult result = compiler.compile(SourceUnit.of("main.kuki", """
                func main()
                    x := 1 |> 5
                    print(x)
                """));

        assertThat(result.errors()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(ErrorKind.CODEGEN);
            assertThat(d.message()).isEqualTo("The right side of a pipe must be a call");
        });
    }

    @Test
    @Tag("unit")
    void placeholderLetsTheWriterComeFirst() {
        String go = compile("""
                import "fmt"
                import "os"

                func main()
                    "hi" |> fmt.Fprintln(os.Stdout, _)
                """);

        assertThat(go).contains("\tfmt.Fprintln(os.Stdout, \"hi\")\n").doesNotContain(", _)");
    }
}
