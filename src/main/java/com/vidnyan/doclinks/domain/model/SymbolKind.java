package com.vidnyan.doclinks.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of a named definition found by the symbol indexer.
 */
public enum SymbolKind {
    FUNCTION,
    CLASS,
    METHOD,
    CONSTANT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Kind recorded on a link that resolved to a definition of this kind.
     */
    public TargetKind toTargetKind() {
        return switch (this) {
            case FUNCTION -> TargetKind.FUNCTION;
            case CLASS -> TargetKind.CLASS;
            case METHOD -> TargetKind.METHOD;
            case CONSTANT -> TargetKind.CONSTANT;
        };
    }
}
