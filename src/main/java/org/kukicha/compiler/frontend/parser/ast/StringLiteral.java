package org.kukicha.compiler.frontend.parser.ast;

import org.kukicha.compiler.model.Token;

import java.util.List;

/**
 * A string literal, split into literal text and interpolated expressions.
 */
public record StringLiteral(Token token, List<Part> parts) implements Expression {

    public StringLiteral {
        parts = List.copyOf(parts);
    }

    /**
     * A piece of a string literal.
     */
    public sealed interface Part permits Text, Interpolation {
    }

    /** Literal text with escapes already resolved. */
    public record Text(String value) implements Part {
    }

    /** An embedded {@code {expr}}. */
    public record Interpolation(Expression expression) implements Part {
    }

    /**
     * @return true if at least one part is an interpolated expression.
     */
    public boolean isInterpolated() {
        return parts.stream().anyMatch(Interpolation.class::isInstance);
    }

    /**
     * @return The concatenated literal text. Only meaningful if the literal is not interpolated.
     */
    public String plainValue() {
        StringBuilder sb = new StringBuilder();
        for (Part part : parts) {
            if (part instanceof Text text) {
                sb.append(text.value());
            }
        }
        return sb.toString();
    }
}
