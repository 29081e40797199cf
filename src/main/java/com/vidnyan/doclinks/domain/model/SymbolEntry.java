package com.vidnyan.doclinks.domain.model;

import java.util.Comparator;

/**
 * One definition site of a symbol.
 */
public record SymbolEntry(
    String file,
    int line,
    SymbolKind kind,
    String signature
) {

    public static final Comparator<SymbolEntry> BY_LOCATION =
            Comparator.comparing(SymbolEntry::file).thenComparingInt(SymbolEntry::line);

    /**
     * Format as {@code file:line}, the form used for ambiguity candidates.
     */
    public String location() {
        return file + ":" + line;
    }
}
