package org.kukicha.compiler.frontend.semantics.registry;

import java.util.OptionalInt;

/**
 * Return counts of functions the compiler cannot see the source of, such as the Go standard
 * library. Implementations are immutable and may be shared between compilations.
 */
public interface SignatureRegistry {

    /**
     * Looks up the number of values an external function returns.
     * @param qualifiedName {@code <import path>.<Function>}, e.g. {@code strconv.Atoi} or
     *                      {@code encoding/json.Marshal}.
     * @return The return count, or empty if the function is not in the registry.
     */
    OptionalInt lookup(String qualifiedName);

    /**
     * @return A registry that knows no functions.
     */
    static SignatureRegistry empty() {
        return qualifiedName -> OptionalInt.empty();
    }
}
