package com.vidnyan.doclinks.domain.check;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.doclinks.domain.model.LinkStatus;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary of a staleness check pass.
 */
public record CheckReport(
    String checked,
    @JsonProperty("total_checked") int totalChecked,
    int current,
    int stale,
    Map<String, List<CheckResult>> docs
) {

    public static CheckReport of(String checked, Map<String, List<CheckResult>> docs) {
        Map<String, List<CheckResult>> sorted = new TreeMap<>();
        int current = 0;
        int stale = 0;
        for (Map.Entry<String, List<CheckResult>> e : docs.entrySet()) {
            if (e.getValue().isEmpty()) {
                continue;
            }
            sorted.put(e.getKey(), List.copyOf(e.getValue()));
            for (CheckResult r : e.getValue()) {
                if (r.status() == LinkStatus.STALE) {
                    stale++;
                } else {
                    current++;
                }
            }
        }
        return new CheckReport(checked, current + stale, current, stale, Collections.unmodifiableMap(sorted));
    }
}
