package com.vidnyan.doclinks.domain.fix;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum IssueType {
    STALE,
    BROKEN,
    AMBIGUOUS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
