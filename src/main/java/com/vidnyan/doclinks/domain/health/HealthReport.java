package com.vidnyan.doclinks.domain.health;

import java.util.List;

public record HealthReport(HealthStatus overall, List<IndexHealth> indexes) {

    public static HealthReport of(List<IndexHealth> indexes) {
        HealthStatus overall = HealthStatus.OK;
        for (IndexHealth h : indexes) {
            overall = overall.worst(h.status());
        }
        return new HealthReport(overall, List.copyOf(indexes));
    }
}
