package com.vidnyan.doclinks.domain.health;

import java.util.List;

/**
 * Health of a single artifact. {@code metrics} is null when the artifact is missing or unreadable.
 */
public record IndexHealth(
    String file,
    HealthStatus status,
    List<String> warnings,
    IndexMetrics metrics
) {
}
