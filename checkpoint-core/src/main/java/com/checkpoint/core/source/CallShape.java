package com.checkpoint.core.source;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Shape of a method call expression: receiver, member name and arguments.
 *
 * @param receiver simple name of the receiver, empty for unqualified calls
 * @param name called member name
 * @param arguments positional arguments
 */
public record CallShape(String receiver, String name, List<CallArgument> arguments) {

    public CallShape {
        Objects.requireNonNull(name, "name must not be null");
        if (receiver == null) {
            receiver = "";
        }
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    /**
     * Returns the literal value of the argument at {@code index}.
     *
     * @param index zero-based position
     * @return literal value, empty if out of range or not a string literal
     */
    public Optional<String> literalArgument(int index) {
        if (index < 0 || index >= arguments.size()) {
            return Optional.empty();
        }
        return arguments.get(index).literalValue();
    }
}
