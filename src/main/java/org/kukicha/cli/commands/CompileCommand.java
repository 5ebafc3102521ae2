package org.kukicha.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.kukicha.cli.CommandLineInterface;
import org.kukicha.compiler.Compiler;
import org.kukicha.compiler.CompilerOptions;
import org.kukicha.compiler.api.CompilationResult;
import org.kukicha.compiler.api.GeneratedFile;
import org.kukicha.compiler.api.SourceUnit;
import org.kukicha.compiler.frontend.io.SourceLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Compiles Kukicha files to Go. Without {@code --output} the generated code is printed.
 */
@Command(
    name = "compile",
    description = "Compile Kukicha source files to Go"
)
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_DIAGNOSTICS = 1;
    static final int EXIT_IO = 2;

    @Option(
        names = {"-f", "--file"},
        required = true,
        arity = "1..*",
        description = "Kukicha source files, compiled together as one package"
    )
    private List<Path> files;

    @Option(
        names = {"-o", "--output"},
        description = "Directory to write the .go files to (default: print to stdout)"
    )
    private Path outputDir;

    @Option(
        names = {"--library"},
        description = "Compile as a library: 'any' and 'any2' in signatures become type parameters"
    )
    private boolean library;

    @Option(
        names = {"--package"},
        description = "Go package name for files without a 'petiole' declaration (default: main)"
    )
    private String packageName;

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
            CompilationResult result = compile(parent, files, packageName, library, signatures);
            DiagnosticPrinter.print(result.diagnostics(), err);
            if (result.hasErrors()) {
                return EXIT_DIAGNOSTICS;
            }
            if (outputDir != null) {
                write(result.files());
                out.printf("Wrote %d file(s) to %s%n", result.files().size(), outputDir);
            } else {
                for (GeneratedFile file : result.files()) {
                    if (result.files().size() > 1) {
                        out.println("// " + file.goFileName());
                    }
                    out.print(file.content());
                }
            }
            out.flush();
            return EXIT_OK;
        } catch (IOException e) {
            log.error("Compilation failed: {}", e.getMessage());
            err.println("error: " + e.getMessage());
            err.flush();
            return EXIT_IO;
        }
    }

    private void write(List<GeneratedFile> generated) throws IOException {
        Files.createDirectories(outputDir);
        for (GeneratedFile file : generated) {
            Path target = outputDir.resolve(file.goFileName());
            Files.writeString(target, file.content(), StandardCharsets.UTF_8);
            log.debug("Wrote {}", target);
        }
    }

    /**
     * Loads the files and compiles them with options from the parent command's config.
     */
    static CompilationResult compile(CommandLineInterface parent, List<Path> files, String packageName,
                                     boolean library, Path signatures) throws IOException {
        CompilerOptions options = CompilerOptions.fromConfig(parent.getConfig());
        if (signatures != null) {
            options = options.withSignaturesFile(signatures);
        }
        List<SourceUnit> units = new ArrayList<>();
        for (Path file : files) {
            SourceLoader.LoadResult loaded = SourceLoader.loadFile(file);
            units.add(new SourceUnit(loaded.logicalName(), loaded.content(), packageName, library));
        }
        log.debug("Compiling {} file(s)", units.size());
        return Compiler.create(options).compile(units);
    }
}
