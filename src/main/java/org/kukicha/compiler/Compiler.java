package org.kukicha.compiler;

import org.kukicha.compiler.api.CompilationResult;
import org.kukicha.compiler.api.GeneratedFile;
import org.kukicha.compiler.api.SourceUnit;
import org.kukicha.compiler.backend.codegen.GoCodeGenerator;
import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.frontend.io.SourceLoader;
import org.kukicha.compiler.frontend.lexer.Lexer;
import org.kukicha.compiler.frontend.parser.Parser;
import org.kukicha.compiler.frontend.parser.ast.FunctionDecl;
import org.kukicha.compiler.frontend.parser.ast.PackageDecl;
import org.kukicha.compiler.frontend.parser.ast.Program;
import org.kukicha.compiler.frontend.semantics.AnalysisFacts;
import org.kukicha.compiler.frontend.semantics.SemanticAnalyzer;
import org.kukicha.compiler.frontend.semantics.SymbolTable;
import org.kukicha.compiler.frontend.semantics.registry.SignatureRegistry;
import org.kukicha.compiler.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Compiles Kukicha source files to Go.
 *
 * <p>The pipeline runs lexing and parsing per file, semantic analysis over all files as one
 * package, and code generation per file. Each call to {@link #compile(List)} uses fresh state;
 * only the signature registry is shared between calls.
 */
public class Compiler {

    private static final Logger log = LoggerFactory.getLogger(Compiler.class);

    private final CompilerOptions options;
    private final SignatureRegistry signatures;

    /**
     * Creates a compiler with default options and the bundled signature table.
     */
    public Compiler() {
        this(CompilerOptions.defaults(), loadBundled(CompilerOptions.defaults()));
    }

    public Compiler(CompilerOptions options, SignatureRegistry signatures) {
        this.options = Objects.requireNonNull(options, "options");
        this.signatures = Objects.requireNonNull(signatures, "signatures");
    }

    /**
     * Creates a compiler, loading the signature table named by the options.
     *
     * @throws IOException if the signature table cannot be loaded.
     */
    public static Compiler create(CompilerOptions options) throws IOException {
        return new Compiler(options, options.loadSignatures());
    }

    private static SignatureRegistry loadBundled(CompilerOptions options) {
        try {
            return options.loadSignatures();
        } catch (IOException e) {
            throw new UncheckedIOException("Bundled signature table is unavailable", e);
        }
    }

    public CompilationResult compile(SourceUnit unit) {
        return compile(List.of(unit));
    }

    /**
     * Compiles the given files as one Go package.
     *
     * @param units The source files.
     * @return The generated files and all diagnostics. No files are generated if lexing,
     *         parsing or analysis reported an error.
     */
    public CompilationResult compile(List<SourceUnit> units) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine(options.maxErrors());

        List<Program> programs = new ArrayList<>();
        String defaultPackage = null;
        for (SourceUnit unit : units) {
            String content = SourceLoader.normalizeLineEndings(unit.content());
            diagnostics.registerSource(unit.fileName(), content);
            List<Token> tokens = new Lexer(content, diagnostics, unit.fileName()).scanTokens();
            programs.add(new Parser(tokens, diagnostics, unit.fileName()).parse());
            if (defaultPackage == null) {
                defaultPackage = unit.packageName();
            }
        }
        log.debug("Parsed {} file(s) with {} errors", programs.size(), diagnostics.errorCount());

        SemanticAnalyzer analyzer = new SemanticAnalyzer(diagnostics, new SymbolTable(diagnostics), signatures);
        AnalysisFacts facts = analyzer.analyze(programs, defaultPackage);
        if (diagnostics.hasErrors()) {
            log.debug("Front end reported {} errors, skipping code generation", diagnostics.errorCount());
            return new CompilationResult(List.of(), diagnostics.getDiagnostics());
        }

        GoCodeGenerator generator = new GoCodeGenerator(diagnostics, facts, analyzer.getContext().environment(), options.emitHeader());
        Map<String, FunctionDecl> functions = GoCodeGenerator.packageFunctions(programs);
        List<GeneratedFile> files = new ArrayList<>();
        for (int i = 0; i < units.size(); i++) {
            SourceUnit unit = units.get(i);
            Program program = programs.get(i);
            String packageName = program.packageDecl().map(PackageDecl::name)
                    .orElse(unit.packageName() != null ? unit.packageName() : "main");
            String content = generator.generate(program, packageName, unit.library(), functions);
            files.add(new GeneratedFile(unit.fileName(), GeneratedFile.goFileName(unit.fileName()), content));
        }
        log.debug("Generated {} file(s)", files.size());
        return new CompilationResult(files, diagnostics.getDiagnostics());
    }

    public CompilerOptions getOptions() {
        return options;
    }
}
