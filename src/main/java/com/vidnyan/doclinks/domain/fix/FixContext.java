package com.vidnyan.doclinks.domain.fix;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Everything a downstream agent or human needs to repair one documentation reference.
 *
 * @param docSection  nearest heading above the reference, null when there is none
 * @param currentCode current source of the referenced symbol, only for stale symbol links
 * @param candidates  possible targets for broken and ambiguous references, null for stale ones
 */
public record FixContext(
    @JsonProperty("doc_path") String docPath,
    String ref,
    int line,
    @JsonProperty("issue_type") IssueType issueType,
    String reason,
    @JsonProperty("doc_section") String docSection,
    @JsonProperty("current_code") String currentCode,
    List<String> candidates
) {
}
