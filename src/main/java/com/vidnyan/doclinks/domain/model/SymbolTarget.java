package com.vidnyan.doclinks.domain.model;

import java.util.Optional;

/**
 * Composite link target {@code path::SymbolName}.
 */
public record SymbolTarget(String file, String symbol) {

    public static final String SEPARATOR = "::";

    public static Optional<SymbolTarget> parse(String target) {
        if (target == null) {
            return Optional.empty();
        }
        int idx = target.indexOf(SEPARATOR);
        if (idx <= 0 || idx + SEPARATOR.length() >= target.length()) {
            return Optional.empty();
        }
        return Optional.of(new SymbolTarget(
                target.substring(0, idx),
                target.substring(idx + SEPARATOR.length())));
    }

    public String format() {
        return file + SEPARATOR + symbol;
    }
}
