package com.vidnyan.doclinks.domain.model;

import java.util.List;
import java.util.function.Function;

/**
 * A reference matching several definitions that could not be narrowed to one.
 * Candidates are {@code file:line} locations; there are always at least two.
 */
public record AmbiguousRef(
    String ref,
    int line,
    String reason,
    List<String> candidates
) implements Resolution {

    public AmbiguousRef {
        if (candidates == null || candidates.size() < 2) {
            throw new IllegalArgumentException("ambiguous reference needs at least two candidates: " + ref);
        }
        candidates = List.copyOf(candidates);
    }

    @Override
    public <T> T match(Function<? super ResolvedLink, ? extends T> resolved,
                       Function<? super BrokenRef, ? extends T> broken,
                       Function<? super AmbiguousRef, ? extends T> ambiguous) {
        return ambiguous.apply(this);
    }
}
