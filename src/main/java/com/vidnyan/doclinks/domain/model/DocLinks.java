package com.vidnyan.doclinks.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolution outcomes for a single document.
 */
public record DocLinks(
    List<ResolvedLink> links,
    List<BrokenRef> broken,
    @JsonProperty("errors") List<AmbiguousRef> ambiguous
) {

    public DocLinks {
        links = links == null ? List.of() : List.copyOf(links);
        broken = broken == null ? List.of() : List.copyOf(broken);
        ambiguous = ambiguous == null ? List.of() : List.copyOf(ambiguous);
    }

    /**
     * Partition resolutions by outcome, keeping their order.
     */
    public static DocLinks of(List<Resolution> resolutions) {
        List<ResolvedLink> links = new ArrayList<>();
        List<BrokenRef> broken = new ArrayList<>();
        List<AmbiguousRef> ambiguous = new ArrayList<>();
        for (Resolution r : resolutions) {
            r.<Boolean>match(links::add, broken::add, ambiguous::add);
        }
        return new DocLinks(links, broken, ambiguous);
    }

    public DocLinks withLinks(List<ResolvedLink> newLinks) {
        return new DocLinks(newLinks, broken, ambiguous);
    }
}
