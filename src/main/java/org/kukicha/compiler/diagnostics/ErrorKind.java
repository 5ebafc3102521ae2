package org.kukicha.compiler.diagnostics;

/**
 * The pipeline stage a diagnostic originates from.
 */
public enum ErrorKind {
    /** Illegal character, inconsistent indentation, unterminated literal. */
    LEX,
    /** Grammar mismatch. */
    SYNTAX,
    /** Missing annotation, type incompatibility, unresolved name, unsatisfied interface. */
    SEMANTIC,
    /** Construct the generator cannot lower safely. */
    CODEGEN
}
