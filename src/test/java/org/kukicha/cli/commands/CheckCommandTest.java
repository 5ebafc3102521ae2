package org.kukicha.cli.commands;

import org.kukicha.cli.CommandLineInterface;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class CheckCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testValidFileReportsOk() throws Exception {
        Path file = tempDir.resolve("ok.kuki");
        Files.writeString(file, """
                func add(a int, b int) int
                    return a + b
                """);
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter out = new StringWriter();
        cmdLine.setOut(new PrintWriter(out));

        int exitCode = cmdLine.execute("check", "-f", file.toString());

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_OK);
        assertThat(out.toString()).contains("1 file(s) OK").doesNotContain("func add");
    }

    @Test
    void testSignaturesOptionChangesTheVerdict() throws Exception {
        Path file = tempDir.resolve("main.kuki");
        Files.writeString(file, """
                import "example.com/widgets"

                func main()
                    w := widgets.Build("x") onerr panic "no widget"
                    print(w)
                """);
        Path table = tempDir.resolve("signatures.json");
        Files.writeString(table, "{ \"example.com/widgets.Build\": 0 }");
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        StringWriter err = new StringWriter();
        cmdLine.setErr(new PrintWriter(err));

        int exitCode = cmdLine.execute("check", "-f", file.toString(), "--signatures", table.toString());

        assertThat(exitCode).isEqualTo(CompileCommand.EXIT_DIAGNOSTICS);
        assertThat(err.toString()).contains("does not return a value");
    }
}
