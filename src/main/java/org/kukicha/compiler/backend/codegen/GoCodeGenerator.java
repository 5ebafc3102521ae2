package org.kukicha.compiler.backend.codegen;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.kukicha.compiler.frontend.parser.ast.Declaration;
import org.kukicha.compiler.frontend.parser.ast.FieldDecl;
import org.kukicha.compiler.frontend.parser.ast.FunctionDecl;
import org.kukicha.compiler.frontend.parser.ast.ImportDecl;
import org.kukicha.compiler.frontend.parser.ast.InterfaceDecl;
import org.kukicha.compiler.frontend.parser.ast.MethodSignature;
import org.kukicha.compiler.frontend.parser.ast.PackageDecl;
import org.kukicha.compiler.frontend.parser.ast.Program;
import org.kukicha.compiler.frontend.parser.ast.TypeDecl;
import org.kukicha.compiler.frontend.semantics.AnalysisFacts;
import org.kukicha.compiler.frontend.semantics.types.TypeEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Generates one Go source file per analyzed program.
 *
 * <p>Declarations are rendered one at a time into a writer of their own. A declaration that
 * cannot be lowered is reported as a {@link ErrorKind#CODEGEN} diagnostic and left out, while the
 * rest of the file is still produced. The import block is assembled last, once every
 * declaration has registered the standard packages it needs.
 */
public class GoCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(GoCodeGenerator.class);

    static final String HEADER = "// Code generated by kukicha. DO NOT EDIT.";

    private final DiagnosticsEngine diagnostics;
    private final AnalysisFacts facts;
    private final TypeEnvironment environment;
    private final boolean emitHeader;
    private final GenericTypeSynthesizer generics = new GenericTypeSynthesizer();

    /**
     * @param diagnostics Receives code generation errors.
     * @param facts       The facts recorded by semantic analysis.
     * @param environment The named types of the package.
     * @param emitHeader  Whether to start each file with the generated-code marker.
     */
    public GoCodeGenerator(DiagnosticsEngine diagnostics, AnalysisFacts facts, TypeEnvironment environment, boolean emitHeader) {
        this.diagnostics = diagnostics;
        this.facts = facts;
        this.environment = environment;
        this.emitHeader = emitHeader;
    }

    /**
     * Indexes the package-level functions of all files of a package by name, for default
     * argument filling at call sites.
     */
    public static Map<String, FunctionDecl> packageFunctions(List<Program> programs) {
        Map<String, FunctionDecl> functions = new LinkedHashMap<>();
        for (Program program : programs) {
            for (FunctionDecl decl : program.functions()) {
                if (!decl.isMethod()) {
                    functions.putIfAbsent(decl.name(), decl);
                }
            }
        }
        return functions;
    }

    /**
     * Generates the Go source of one file.
     *
     * @param program     The analyzed file.
     * @param packageName The Go package clause to emit.
     * @param library     Whether placeholder types in signatures become type parameters.
     * @param functions   The package-level functions, see {@link #packageFunctions(List)}.
     * @return The Go source text.
     */
    public String generate(Program program, String packageName, boolean library, Map<String, FunctionDecl> functions) {
        ImportTracker imports = new ImportTracker(program.imports());
        EmitContext ctx = new EmitContext(facts, environment, functions, imports);
        StatementEmitter statements = new StatementEmitter(ctx);

        GoWriter body = new GoWriter();
        int dropped = 0;
        for (Declaration decl : program.declarations()) {
            if (decl instanceof ImportDecl || decl instanceof PackageDecl) {
                continue;
            }
            GoWriter out = new GoWriter();
            ctx.swapWriter(out);
            Set<String> snapshot = imports.snapshot();
            try {
                declaration(decl, ctx, statements, library);
                body.blank().raw(out.toString());
            } catch (CodeGenException e) {
                imports.restore(snapshot);
                dropped++;
                diagnostics.reportError(ErrorKind.CODEGEN, e.getMessage(), e.getToken());
            } finally {
                ctx.types().clearPlaceholders();
            }
        }

        GoWriter file = new GoWriter();
        if (emitHeader) {
            file.line(HEADER).blank();
        }
        file.line("package " + packageName);
        if (!imports.isEmpty()) {
            file.blank();
            imports.render(file);
        }
        file.raw(body.toString());
        log.debug("Generated {} with {} declarations dropped", program.fileName(), dropped);
        return file.toString();
    }

    private void declaration(Declaration decl, EmitContext ctx, StatementEmitter statements, boolean library) {
        if (decl instanceof TypeDecl type) {
            typeDeclaration(type, ctx);
        } else if (decl instanceof InterfaceDecl iface) {
            interfaceDeclaration(iface, ctx, statements);
        } else if (decl instanceof FunctionDecl function) {
            function(function, ctx, statements, library);
        } else {
            throw new CodeGenException("Cannot generate " + decl.getClass().getSimpleName(), decl.token());
        }
    }

    private void typeDeclaration(TypeDecl decl, EmitContext ctx) {
        GoWriter out = ctx.writer();
        if (decl.aliasType() != null) {
            out.line("type " + decl.name() + " " + ctx.types().render(decl.aliasType()));
            return;
        }
        if (decl.fields().isEmpty()) {
            out.line("type " + decl.name() + " struct{}");
            return;
        }
        int nameWidth = 0;
        int typeWidth = 0;
        for (FieldDecl field : decl.fields()) {
            nameWidth = Math.max(nameWidth, field.name().length());
            typeWidth = Math.max(typeWidth, ctx.types().render(field.type()).length());
        }
        out.open("type " + decl.name() + " struct {");
        for (FieldDecl field : decl.fields()) {
            String type = ctx.types().render(field.type());
            StringBuilder line = new StringBuilder(pad(field.name(), nameWidth)).append(' ');
            if (field.tag() != null) {
                line.append(pad(type, typeWidth)).append(" `").append(field.tag()).append('`');
            } else {
                line.append(type);
            }
            out.line(line.toString());
        }
        out.close("}");
    }

    private void interfaceDeclaration(InterfaceDecl decl, EmitContext ctx, StatementEmitter statements) {
        GoWriter out = ctx.writer();
        if (decl.methods().isEmpty()) {
            out.line("type " + decl.name() + " interface{}");
            return;
        }
        out.open("type " + decl.name() + " interface {");
        for (MethodSignature method : decl.methods()) {
            out.line(method.name() + "(" + statements.expressions().parameters(method.params()) + ")"
                    + ctx.types().results(method.returns()));
        }
        out.close("}");
    }

    private void function(FunctionDecl decl, EmitContext ctx, StatementEmitter statements, boolean library) {
        GenericTypeSynthesizer.Generics typeParams = library ? generics.synthesize(decl) : GenericTypeSynthesizer.Generics.NONE;
        ctx.types().setPlaceholders(typeParams.placeholders());
        ctx.resetCounters();
        ctx.swapReturns(decl.returns());

        StringBuilder header = new StringBuilder("func ");
        if (decl.isMethod()) {
            header.append('(').append(decl.receiver().name()).append(' ')
                    .append(ctx.types().render(decl.receiver().type())).append(") ");
        }
        header.append(decl.name()).append(typeParams.declaration())
                .append('(').append(statements.expressions().parameters(decl.params())).append(')')
                .append(ctx.types().results(decl.returns()))
                .append(" {");

        GoWriter out = ctx.writer();
        out.open(header.toString());
        statements.statements(decl.body());
        out.close("}");
    }

    private static String pad(String text, int width) {
        return text.length() >= width ? text : text + " ".repeat(width - text.length());
    }
}
