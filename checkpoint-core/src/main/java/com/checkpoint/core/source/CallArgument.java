package com.checkpoint.core.source;

import java.util.Objects;
import java.util.Optional;

/**
 * One positional argument of a call expression.
 *
 * @param text source text of the argument, or the unescaped value for string literals
 * @param stringLiteral whether the argument is a string literal
 */
public record CallArgument(String text, boolean stringLiteral) {

    public CallArgument {
        Objects.requireNonNull(text, "text must not be null");
    }

    public static CallArgument literal(String value) {
        return new CallArgument(value, true);
    }

    public static CallArgument expression(String text) {
        return new CallArgument(text, false);
    }

    /**
     * Returns the literal value.
     *
     * @return value if this argument is a string literal, empty otherwise
     */
    public Optional<String> literalValue() {
        return stringLiteral ? Optional.of(text) : Optional.empty();
    }
}
