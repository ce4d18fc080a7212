package com.checkpoint.core.source;

/**
 * Kind of a declared symbol.
 */
public enum SymbolKind {
    TYPE,
    METHOD,
    FIELD
}
