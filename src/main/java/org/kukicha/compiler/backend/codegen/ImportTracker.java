package org.kukicha.compiler.backend.codegen;

import org.kukicha.compiler.frontend.parser.ast.ImportDecl;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Collects the imports of one generated file: the ones the source declares plus the standard
 * packages the generator pulls in while lowering ({@code fmt}, {@code errors}, {@code slices}).
 */
final class ImportTracker {

    private final Map<String, String> declared = new LinkedHashMap<>();
    private final Set<String> added = new TreeSet<>();

    ImportTracker(Iterable<ImportDecl> imports) {
        for (ImportDecl decl : imports) {
            declared.putIfAbsent(decl.path(), decl.alias());
        }
    }

    /**
     * Requires a standard package and returns the name code must use to reach it, which is the
     * alias when the source imported the package under one.
     */
    String use(String path) {
        if (declared.containsKey(path)) {
            String alias = declared.get(path);
            return alias != null ? alias : lastSegment(path);
        }
        added.add(path);
        return lastSegment(path);
    }

    Set<String> snapshot() {
        return Set.copyOf(added);
    }

    void restore(Set<String> snapshot) {
        added.retainAll(snapshot);
    }

    boolean isEmpty() {
        return declared.isEmpty() && added.isEmpty();
    }

    /**
     * Writes the import block, sorted by path.
     */
    void render(GoWriter out) {
        if (isEmpty()) {
            return;
        }
        Map<String, String> all = new TreeMap<>(declared);
        for (String path : added) {
            all.putIfAbsent(path, null);
        }
        out.open("import (");
        all.forEach((path, alias) -> out.line(alias != null ? alias + " \"" + path + "\"" : "\"" + path + "\""));
        out.close(")");
    }

    private static String lastSegment(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
