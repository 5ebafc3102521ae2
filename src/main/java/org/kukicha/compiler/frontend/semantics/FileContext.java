package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.frontend.parser.ast.ImportDecl;
import org.kukicha.compiler.frontend.parser.ast.PackageDecl;
import org.kukicha.compiler.frontend.parser.ast.Program;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-file facts the analyzer needs while walking a file: its package, its imports and the
 * scope holding the file's import symbols.
 *
 * @param program     The file.
 * @param packageName The declared package, or the externally supplied one, or {@code main}.
 * @param importPaths Import name (alias or last path element) to import path.
 * @param scope       The file scope, directly below the package root scope.
 */
public record FileContext(Program program, String packageName, Map<String, String> importPaths, SymbolTable.Scope scope) {

    public FileContext {
        importPaths = Map.copyOf(importPaths);
    }

    public static FileContext of(Program program, String defaultPackage, SymbolTable.Scope scope) {
        Map<String, String> imports = new LinkedHashMap<>();
        for (ImportDecl imp : program.imports()) {
            imports.putIfAbsent(imp.effectiveName(), imp.path());
        }
        String packageName = program.packageDecl().map(PackageDecl::name)
                .orElse(defaultPackage != null ? defaultPackage : "main");
        return new FileContext(program, packageName, imports, scope);
    }

    public String fileName() {
        return program.fileName();
    }

    public boolean isTestFile() {
        return fileName() != null && fileName().endsWith("_test.kuki");
    }

    public Optional<String> importPath(String name) {
        return Optional.ofNullable(importPaths.get(name));
    }
}
