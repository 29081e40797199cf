package com.vidnyan.doclinks.domain.model;

import java.util.function.Function;

/**
 * Result of resolving one extracted reference: exactly one of a resolved link,
 * a broken reference or an ambiguous reference.
 */
public sealed interface Resolution permits ResolvedLink, BrokenRef, AmbiguousRef {

    String ref();

    int line();

    /**
     * Dispatch on the concrete outcome. Every caller supplies a branch for each case.
     */
    <T> T match(Function<? super ResolvedLink, ? extends T> resolved,
                Function<? super BrokenRef, ? extends T> broken,
                Function<? super AmbiguousRef, ? extends T> ambiguous);
}
