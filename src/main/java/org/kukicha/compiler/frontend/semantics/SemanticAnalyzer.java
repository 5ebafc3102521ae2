package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.frontend.parser.ast.Declaration;
import org.kukicha.compiler.frontend.parser.ast.Program;
import org.kukicha.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.kukicha.compiler.frontend.semantics.analysis.ISymbolCollector;
import org.kukicha.compiler.frontend.semantics.registry.SignatureRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Performs semantic analysis on all files of a compilation unit. It resolves names and types,
 * checks function bodies and records the facts the code generator needs.
 * It operates by dispatching declarations to the handlers of an {@link AnalysisHandlerRegistry}.
 *
 * <p>Analysis runs in four passes, each over every file, so that declarations may refer to each
 * other regardless of file or order:
 * <ol>
 *   <li>types: type, interface and import names are registered;</li>
 *   <li>signatures: struct fields, interface methods and function signatures are resolved;</li>
 *   <li>interfaces: interface satisfaction is computed for every struct;</li>
 *   <li>bodies: every function body is walked.</li>
 * </ol>
 * Package-level names live in the root scope. Each file gets a scope of its own below the root,
 * holding its imports, and function scopes open below their file's scope.
 */
public class SemanticAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(SemanticAnalyzer.class);

    private final DiagnosticsEngine diagnostics;
    private final SymbolTable symbolTable;
    private final AnalysisContext context;
    private final AnalysisHandlerRegistry registry;

    /**
     * @param diagnostics The diagnostics engine for reporting errors.
     * @param symbolTable The symbol table to use for analysis.
     * @param signatures  Return counts of external functions.
     */
    public SemanticAnalyzer(DiagnosticsEngine diagnostics, SymbolTable symbolTable, SignatureRegistry signatures) {
        this.diagnostics = diagnostics;
        this.symbolTable = symbolTable;
        this.context = new AnalysisContext(diagnostics, symbolTable, signatures);
        this.registry = AnalysisHandlerRegistry.initializeWithDefaults(context);
    }

    /**
     * Analyzes a single file in package {@code main} unless it declares its own.
     */
    public AnalysisFacts analyze(Program program) {
        return analyze(List.of(program), null);
    }

    /**
     * Analyzes the given files as one package. Errors are reported to the diagnostics engine;
     * the facts are returned in any case.
     *
     * @param programs       The parsed files.
     * @param defaultPackage The package name for files without a {@code petiole} declaration,
     *                       or null for {@code main}.
     * @return The frozen facts of this run.
     */
    public AnalysisFacts analyze(List<Program> programs, String defaultPackage) {
        List<FileContext> files = new ArrayList<>();
        for (Program program : programs) {
            symbolTable.resetScope();
            SymbolTable.Scope scope = symbolTable.enterScope();
            files.add(FileContext.of(program, defaultPackage, scope));
        }

        forEachDeclaration(files, (decl, collector) -> collector.collect(decl, symbolTable, diagnostics));
        log.debug("Type pass: {} types, {} interfaces", context.environment().structs().size(),
                context.environment().interfaces().size());

        forEachDeclaration(files, (decl, collector) -> collector.collectSignatures(decl, symbolTable, diagnostics));
        log.debug("Signature pass complete with {} errors", diagnostics.errorCount());

        int satisfied = context.interfaces().precompute();
        log.debug("Interface pass: {} satisfied type/interface pairs", satisfied);

        for (FileContext file : files) {
            enter(file);
            for (Declaration decl : file.program().declarations()) {
                Optional<IAnalysisHandler> handler = registry.resolveHandler(decl.getClass());
                handler.ifPresent(h -> h.analyze(decl, symbolTable, diagnostics));
            }
        }
        symbolTable.resetScope();

        AnalysisFacts facts = context.facts();
        facts.freeze();
        log.debug("Body pass: {} call arities recorded, {} errors", facts.arityCount(), diagnostics.errorCount());
        return facts;
    }

    private void forEachDeclaration(List<FileContext> files, CollectorStep step) {
        for (FileContext file : files) {
            enter(file);
            for (Declaration decl : file.program().declarations()) {
                registry.resolveCollector(decl.getClass()).ifPresent(c -> step.apply(decl, c));
            }
        }
    }

    private void enter(FileContext file) {
        context.setCurrentFile(file);
        symbolTable.setCurrentScope(file.scope());
    }

    @FunctionalInterface
    private interface CollectorStep {
        void apply(Declaration decl, ISymbolCollector collector);
    }

    /**
     * Gets the handler registry for external registration of additional handlers.
     * @return The analysis handler registry
     */
    public AnalysisHandlerRegistry getRegistry() {
        return registry;
    }

    /**
     * @return The analysis state, including the type environment built by the last run.
     */
    public AnalysisContext getContext() {
        return context;
    }
}
