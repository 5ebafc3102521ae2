package org.kukicha.compiler.api;

import java.util.Objects;

/**
 * One Kukicha source file to compile.
 *
 * @param fileName    The name used in diagnostics and for the generated file.
 * @param content     The source text.
 * @param packageName The Go package for a file without a {@code petiole} declaration, or null
 *                    for {@code main}.
 * @param library     Whether placeholder types in function signatures become Go type parameters.
 */
public record SourceUnit(String fileName, String content, String packageName, boolean library) {

    public SourceUnit {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(content, "content");
    }

    /**
     * A program file in package {@code main}.
     */
    public static SourceUnit of(String fileName, String content) {
        return new SourceUnit(fileName, content, null, false);
    }
}
