package com.vidnyan.doclinks.domain.model;

import java.util.function.Function;

/**
 * A reference with no resolvable target.
 */
public record BrokenRef(
    String ref,
    int line,
    String reason
) implements Resolution {

    @Override
    public <T> T match(Function<? super ResolvedLink, ? extends T> resolved,
                       Function<? super BrokenRef, ? extends T> broken,
                       Function<? super AmbiguousRef, ? extends T> ambiguous) {
        return broken.apply(this);
    }
}
