package org.kukicha.compiler.frontend.semantics;

import java.util.Set;

/**
 * Functions callable without an import. A local declaration of the same name shadows them.
 */
public final class Builtins {

    public static final Set<String> FUNCTIONS = Set.of(
            "print", "len", "cap", "append", "delete", "copy", "min", "max", "clear");

    private Builtins() {
    }

    public static boolean isBuiltin(String name) {
        return FUNCTIONS.contains(name);
    }
}
