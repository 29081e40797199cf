package com.vidnyan.doclinks.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of target a resolved link points at: a whole file or a symbol.
 */
public enum TargetKind {
    FILE,
    FUNCTION,
    CLASS,
    METHOD,
    CONSTANT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean symbolic() {
        return this != FILE;
    }
}
