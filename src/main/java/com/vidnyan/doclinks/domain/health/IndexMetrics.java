package com.vidnyan.doclinks.domain.health;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Size and load cost of one index artifact.
 */
public record IndexMetrics(
    String path,
    @JsonProperty("size_bytes") long sizeBytes,
    @JsonProperty("entry_count") int entryCount,
    @JsonProperty("avg_entry_size") long avgEntrySize,
    @JsonProperty("load_time_ms") long loadTimeMs
) {

    public double sizeMb() {
        return sizeBytes / (1024.0 * 1024.0);
    }

    public long approxTokens() {
        return sizeBytes / 4;
    }
}
