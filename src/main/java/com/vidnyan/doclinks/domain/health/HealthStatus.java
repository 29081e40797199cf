package com.vidnyan.doclinks.domain.health;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Health grade of an index artifact, ordered from best to worst.
 * {@code MISSING} is reported per artifact but never raises the overall grade.
 */
public enum HealthStatus {
    OK,
    WARNING,
    ERROR,
    CRITICAL,
    MISSING;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public HealthStatus worst(HealthStatus other) {
        if (this == MISSING) {
            return other;
        }
        if (other == MISSING) {
            return this;
        }
        return other.ordinal() > ordinal() ? other : this;
    }
}
