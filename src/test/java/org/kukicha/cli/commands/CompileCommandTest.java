package org.kukicha.cli.commands;

import org.kukicha.cli.CommandLineInterface;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the compile command.
 */
@Tag("unit")
public class CompileCommandTest {

    @TempDir
    Path tempDir;

    private CommandLine cmdLine;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        cmdLine = CommandLineInterface.createCommandLine();
        out = new StringWriter();
        err = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
    }

    private Path source(String name, String content) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testCommandParses() {
        assertThat(cmdLine.getSubcommands()).containsKeys("compile", "check");
    }

    @Test
    void testHelpOutput() {
        cmdLine.execute("compile", "--help");

        String output = out.toString() + err.toString();
        assertThat(output).contains("compile").contains("--file").contains("--output").contains("--library");
    }

    @Test
    void testCompilePrintsGoSource() throws Exception {
        Path file = source("hello.kuki", """
                func main()
                    print("hello")
                """);

        int exitCode = cmdLine.execute("compile", "-f", file.toString());

        assertThat(exitCode)
            .describedAs("stderr: %s", err.toString())
            .isEqualTo(CompileCommand.EXIT_OK);
        assertThat(out.toString())
            .startsWith("// Code generated by kukicha. DO NOT EDIT.")
            .contains("func main() {")
            .contains("fmt.Println(\"hello\")");
    }

    @Test
    void testCompileWritesFilesToOutputDirectory() throws Exception {
        Path main = source("main.kuki", """
                func main()
                    print(twice(2))
                """);
        Path helpers = source("helpers.kuki", """
                func twice(n int) int
                    return n * 2
                """);
        Path outputDir = tempDir.resolve("out");

        int exitCode = cmdLine.execute("compile", "-f", main.toString(), helpers.toString(), "-o", outputDir.toString());

        assertThat(exitCode).describedAs("stderr: %s", err.toString()).isEqualTo(CompileCommand.EXIT_OK);
        assertThat(out.toString()).contains("Wrote 2 file(s)");
        assertThat(outputDir.resolve("main.go")).exists();
        assertThat(Files.readString(outputDir.resolve("helpers.go"))).contains("func twice(n int) int {");
    }

    @Test
    void testLibraryAndPackageOptions() throws Exception {
        Path file = source("lookup.kuki", """
                func Lookup(m map of any2 to any, key any2) any
                    return m[key]
                """);

        int exitCode = cmdLine.execute("compile", "-f", file.toString(), "--library", "--package", "collections");

        assertThat(exitCode).describedAs("stderr: %s", err.toString()).isEqualTo(CompileCommand.EXIT_OK);
        assertThat(out.toString())
            .contains("package collections")
            .contains("func Lookup[T any, K comparable](m map[K]T, key K) T {");
    }

    @Test
    void testCompileErrorsReturnDiagnosticsExitCode() throws Exception {
        Path file = source("main.kuki", """
                func main()
                    print(missing)
                """);

        int exitCode = cmdLine.execute("compile", "-f", file.toString());

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_DIAGNOSTICS);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString())
            .contains("main.kuki:2:11: error: Undefined identifier 'missing'")
            .contains("1 error, 0 warnings");
    }

    @Test
    void testCompileNonexistentFileReturnsIoError() {
        int exitCode = cmdLine.execute("compile", "-f", tempDir.resolve("missing.kuki").toString());

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_IO);
        assertThat(err.toString()).startsWith("error: ");
    }

    @Test
    void testMissingRequiredFileOption() {
        int exitCode = cmdLine.execute("compile");

        assertThat(exitCode).isNotEqualTo(0);
        assertThat(err.toString()).contains("--file");
    }
}
