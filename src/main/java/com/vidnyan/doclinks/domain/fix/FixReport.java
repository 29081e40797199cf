package com.vidnyan.doclinks.domain.fix;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * All issues needing a fix. Counts are always derived from {@code issues}.
 */
public record FixReport(
    @JsonProperty("total_issues") int totalIssues,
    int stale,
    int broken,
    int errors,
    List<FixContext> issues
) {

    public static FixReport of(List<FixContext> issues) {
        return new FixReport(
                issues.size(),
                count(issues, IssueType.STALE),
                count(issues, IssueType.BROKEN),
                count(issues, IssueType.AMBIGUOUS),
                List.copyOf(issues));
    }

    private static int count(List<FixContext> issues, IssueType type) {
        return (int) issues.stream().filter(i -> i.issueType() == type).count();
    }
}
