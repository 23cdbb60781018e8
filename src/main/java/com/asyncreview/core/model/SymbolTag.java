package com.asyncreview.core.model;

/**
 * A lightweight symbol found by a best-effort scan of a source file.
 *
 * @param name symbol name as written in the source
 * @param kind one of "function", "class", "method", "variable", "import", "export"
 * @param line 1-based line number of the declaration
 */
public record SymbolTag(
    String name,
    String kind,
    int line
) {}
