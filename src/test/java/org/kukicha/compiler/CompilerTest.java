package org.kukicha.compiler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.kukicha.compiler.api.CompilationResult;
import org.kukicha.compiler.api.GeneratedFile;
import org.kukicha.compiler.api.SourceUnit;
import org.kukicha.compiler.diagnostics.Diagnostic;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompilerTest {

    private static final String PROGRAM = """
            import "strconv"

            type Point
                x int
                y int

            func parse(s string) int
                n := strconv.Atoi(s) onerr 0
                return n

            func main()
                p := Point{x: parse("1"), y: 2}
                print("point {p.x},{p.y}")
            """;

    private Compiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new Compiler();
    }

    @Test
    @Tag("unit")
    @DisplayName("Compiling the same source twice gives byte-identical output")
    void outputIsDeterministic() {
        CompilationResult first = compiler.compile(SourceUnit.of("main.kuki", PROGRAM));
        CompilationResult second = new Compiler().compile(SourceUnit.of("main.kuki", PROGRAM));

        assertThat(first.hasErrors()).as("%s", first.diagnostics()).isFalse();
        assertThat(second.files().get(0).content()).isEqualTo(first.files().get(0).content());
    }

    @Test
    @Tag("unit")
    void frontEndErrorsSuppressCodeGeneration() {
        CompilationResult result = compiler.compile(SourceUnit.of("main.kuki", """
                func main()
                    print(missing)
                """));

        assertThat(result.hasErrors()).isTrue();
        assertThat(result.files()).isEmpty();
        assertThat(result.errors()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(ErrorKind.SEMANTIC);
            assertThat(d.fileName()).isEqualTo("main.kuki");
            assertThat(d.line()).isEqualTo(2);
            assertThat(d.snippet()).isEqualTo("    print(missing)");
        });
    }

    @Test
    @Tag("unit")
    void lexParseAndSemanticErrorsAreCollectedTogether() {
        CompilationResult result = compiler.compile(SourceUnit.of("main.kuki", """
                func broken() int
                    return 1 +

                func main()
                    print(nothing)
                """));

        assertThat(result.errors()).extracting(Diagnostic::kind)
                .contains(ErrorKind.SYNTAX, ErrorKind.SEMANTIC);
    }

    @Test
    @Tag("unit")
    void filesOfOnePackageSeeEachOthersFunctions() {
        CompilationResult result = compiler.compile(List.of(
                SourceUnit.of("app/main.kuki", """
                        func main()
                            print(double(21))
                        """),
                SourceUnit.of("app/math.kuki", """
                        func double(n int) int
                            return n * 2
                        """)));

        assertThat(result.hasErrors()).as("%s", result.diagnostics()).isFalse();
        assertThat(result.files()).extracting(GeneratedFile::goFileName)
                .containsExactly("app/main.go", "app/math.go");
        assertThat(result.files().get(0).content()).contains("fmt.Println(double(21))");
        assertThat(result.files().get(1).content()).contains("func double(n int) int {");
    }

    @Test
    @Tag("unit")
    void petioleDeclarationNamesThePackage() {
        CompilationResult result = compiler.compile(new SourceUnit("helpers.kuki", """
                petiole helpers

                func One() int
                    return 1
                """, "ignored", false));

        assertThat(result.files().get(0).content()).contains("package helpers\n").doesNotContain("ignored");
    }

    @Test
    @Tag("unit")
    void goFileNameReplacesTheKukiExtension() {
        assertThat(GeneratedFile.goFileName("cmd/tool.kuki")).isEqualTo("cmd/tool.go");
        assertThat(GeneratedFile.goFileName("README")).isEqualTo("README.go");
    }

    @Test
    @Tag("unit")
    void windowsLineEndingsCompileLikeUnixOnes() {
        CompilationResult unix = compiler.compile(SourceUnit.of("main.kuki", PROGRAM));
        CompilationResult windows = compiler.compile(SourceUnit.of("main.kuki", PROGRAM.replace("\n", "\r\n")));

        assertThat(windows.hasErrors()).as("%s", windows.diagnostics()).isFalse();
        assertThat(windows.files().get(0).content()).isEqualTo(unix.files().get(0).content());
    }

    @Test
    @Tag("unit")
    void errorLimitTruncatesTheDiagnostics() throws IOException {
        Compiler limited = Compiler.create(new CompilerOptions(2, true, CompilerOptions.defaults().signaturesResource(), null));

        CompilationResult result = limited.compile(SourceUnit.of("main.kuki", """
                func main()
                    print(a)
                    print(b)
                    print(c)
                """));

        assertThat(result.errors()).hasSize(3);
        assertThat(result.errors().get(2).message()).isEqualTo("Too many errors, stopping after 2");
    }

    @Test
    @Tag("unit")
    void signaturesFileReplacesTheBundledTable(@TempDir Path tempDir) throws IOException {
        Path table = tempDir.resolve("signatures.json");
        Files.writeString(table, "{ \"example.com/widgets.Build\": 0 }");

        Compiler custom = Compiler.create(CompilerOptions.defaults().withSignaturesFile(table));
        CompilationResult result = custom.compile(SourceUnit.of("main.kuki", """
                import "example.com/widgets"

                func main()
                    w := widgets.Build("x") onerr panic "no widget"
                    print(w)
                """));

        assertThat(result.errors()).anySatisfy(d ->
                assertThat(d.message()).contains("does not return a value, so onerr has no error to handle"));
    }

    @Test
    @Tag("unit")
    void malformedSignaturesFileFailsCreation(@TempDir Path tempDir) throws IOException {
        Path table = tempDir.resolve("signatures.json");
        Files.writeString(table, "[1, 2]");

        assertThatThrownBy(() -> Compiler.create(CompilerOptions.defaults().withSignaturesFile(table)))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("must be a JSON object");
    }

    @Test
    @Tag("unit")
    void optionsAreReadFromConfig() {
        Config config = ConfigFactory.parseString("""
                kukicha {
                  compiler.max-errors = 3
                  codegen.emit-header = false
                  signatures.resource = "signatures/go-stdlib.json"
                }
                """);

        CompilerOptions options = CompilerOptions.fromConfig(config);

        assertThat(options.maxErrors()).isEqualTo(3);
        assertThat(options.emitHeader()).isFalse();
        assertThat(options.signaturesResource()).isEqualTo("signatures/go-stdlib.json");
        assertThat(options.signaturesFile()).isNull();
    }
}
