package com.checkpoint.core.source;

import java.util.Objects;

/**
 * A symbol declared in a source file.
 *
 * @param name simple name
 * @param kind type, method or field
 * @param exported whether the symbol is visible outside its package
 * @param documented whether a documentation comment is attached
 * @param line declaration line, 0 when unknown
 */
public record SymbolInfo(String name, SymbolKind kind, boolean exported, boolean documented, int line) {

    public SymbolInfo {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
    }
}
