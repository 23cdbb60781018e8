package com.asyncreview.core.snapshot;

import com.asyncreview.core.model.SymbolTag;

import java.util.List;

/**
 * Per-language, best-effort symbol tagging. Implementations return tags sorted
 * by (line, name) with no two tags sharing that key.
 */
@FunctionalInterface
public interface SymbolScanner {

    SymbolScanner NONE = content -> List.of();

    List<SymbolTag> scan(String content);
}
