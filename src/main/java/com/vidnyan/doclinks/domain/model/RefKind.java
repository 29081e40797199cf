package com.vidnyan.doclinks.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Shape of a raw reference found in documentation.
 */
public enum RefKind {
    FILE,
    SYMBOL,
    IMPORT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
