package com.vidnyan.doclinks.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-document resolution results plus aggregate counts.
 * {@code checked} is set once staleness has been evaluated.
 */
public record LinksIndex(
    String schema,
    String generated,
    @JsonInclude(JsonInclude.Include.NON_NULL) String checked,
    @JsonProperty("total_links") int totalLinks,
    @JsonProperty("total_broken") int totalBroken,
    @JsonProperty("total_errors") int totalErrors,
    Map<String, DocLinks> docs
) {

    public static LinksIndex of(String generated, Map<String, DocLinks> docs) {
        return build(generated, null, docs);
    }

    /**
     * A copy of this index carrying re-checked links and the time of the check.
     */
    public LinksIndex withCheck(String checkedAt, Map<String, DocLinks> checkedDocs) {
        return build(generated, checkedAt, checkedDocs);
    }

    public long staleCount() {
        return docs.values().stream()
                .flatMap(d -> d.links().stream())
                .filter(ResolvedLink::stale)
                .count();
    }

    private static LinksIndex build(String generated, String checked, Map<String, DocLinks> docs) {
        Map<String, DocLinks> sorted = new TreeMap<>(docs);
        int links = 0;
        int broken = 0;
        int ambiguous = 0;
        for (DocLinks d : sorted.values()) {
            links += d.links().size();
            broken += d.broken().size();
            ambiguous += d.ambiguous().size();
        }
        return new LinksIndex(ArtifactSchema.VERSION, generated, checked, links, broken, ambiguous,
                Collections.unmodifiableMap(sorted));
    }
}
