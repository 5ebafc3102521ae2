package org.kukicha.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.kukicha.cli.CommandLineInterface;
import org.kukicha.compiler.api.CompilationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Reports diagnostics without writing any Go code.
 */
@Command(
    name = "check",
    description = "Check Kukicha source files and report diagnostics"
)
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Option(
        names = {"-f", "--file"},
        required = true,
        arity = "1..*",
        description = "Kukicha source files, checked together as one package"
    )
    private List<Path> files;

    @Option(
        names = {"--signatures"},
        description = "JSON table of external function return counts, replacing the bundled one"
    )
    private Path signatures;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            CompilationResult result = CompileCommand.compile(parent, files, null, false, signatures);
            DiagnosticPrinter.print(result.diagnostics(), err);
            if (result.hasErrors()) {
                return CompileCommand.EXIT_DIAGNOSTICS;
            }
            out.printf("%d file(s) OK%n", files.size());
            out.flush();
            return CompileCommand.EXIT_OK;
        } catch (IOException e) {
            log.error("Check failed: {}", e.getMessage());
            err.println("error: " + e.getMessage());
            err.flush();
            return CompileCommand.EXIT_IO;
        }
    }
}
