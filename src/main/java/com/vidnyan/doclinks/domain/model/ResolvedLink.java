package com.vidnyan.doclinks.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Optional;
import java.util.function.Function;

/**
 * A reference resolved to a file or symbol, with the fingerprint taken at resolution time.
 * {@code status} stays null until the link has been through a check pass.
 */
public record ResolvedLink(
    String ref,
    String target,
    TargetKind kind,
    String hash,
    int line,
    @JsonInclude(JsonInclude.Include.NON_NULL) LinkStatus status
) implements Resolution {

    public static ResolvedLink unchecked(String ref, String target, TargetKind kind, String hash, int line) {
        return new ResolvedLink(ref, target, kind, hash, line, null);
    }

    public ResolvedLink withStatus(LinkStatus newStatus) {
        return new ResolvedLink(ref, target, kind, hash, line, newStatus);
    }

    public boolean stale() {
        return status == LinkStatus.STALE;
    }

    /**
     * The symbol part of the target, empty for whole-file links.
     */
    public Optional<SymbolTarget> symbolTarget() {
        return kind.symbolic() ? SymbolTarget.parse(target) : Optional.empty();
    }

    @Override
    public <T> T match(Function<? super ResolvedLink, ? extends T> resolved,
                       Function<? super BrokenRef, ? extends T> broken,
                       Function<? super AmbiguousRef, ? extends T> ambiguous) {
        return resolved.apply(this);
    }
}
