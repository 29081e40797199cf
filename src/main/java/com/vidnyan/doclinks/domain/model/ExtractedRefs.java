package com.vidnyan.doclinks.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * References extracted from every scanned document, keyed by document path.
 */
public record ExtractedRefs(
    String schema,
    String generated,
    @JsonProperty("doc_count") int docCount,
    @JsonProperty("ref_count") int refCount,
    Map<String, List<ExtractedRef>> docs
) {

    public static ExtractedRefs of(String generated, Map<String, List<ExtractedRef>> docs) {
        Map<String, List<ExtractedRef>> sorted = new TreeMap<>();
        int refs = 0;
        for (Map.Entry<String, List<ExtractedRef>> e : docs.entrySet()) {
            if (e.getValue().isEmpty()) {
                continue;
            }
            sorted.put(e.getKey(), List.copyOf(e.getValue()));
            refs += e.getValue().size();
        }
        return new ExtractedRefs(ArtifactSchema.VERSION, generated, sorted.size(), refs,
                Collections.unmodifiableMap(sorted));
    }
}
