package com.vidnyan.doclinks.domain.check;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vidnyan.doclinks.domain.model.LinkStatus;

/**
 * Audit row for one link: both fingerprints are kept so a reviewer can see what moved.
 * {@code currentHash} is null when the target could not be re-hashed.
 */
public record CheckResult(
    String ref,
    String target,
    LinkStatus status,
    @JsonProperty("stored_hash") String storedHash,
    @JsonProperty("current_hash") String currentHash
) {
}
