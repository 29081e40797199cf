package com.vidnyan.doclinks.application.port.in;

import java.nio.file.Path;

/**
 * Report what the persisted artifacts contain, without recomputing anything.
 */
public interface CatalogStatusUseCase {

    CatalogStatus status(Path root);

    /**
     * Catalog status. A summary is null when its artifact does not exist.
     */
    record CatalogStatus(
        Path indexDir,
        SymbolSummary symbols,
        LinkSummary links
    ) {
        public boolean built() {
            return symbols != null && links != null;
        }

        public boolean healthy() {
            return built() && links.broken() == 0 && links.ambiguous() == 0 && links.stale() == 0;
        }
    }

    record SymbolSummary(
        String generated,
        int symbolCount,
        int fileCount
    ) {}

    /**
     * @param checked null when the links were never checked
     */
    record LinkSummary(
        String generated,
        int total,
        int broken,
        int ambiguous,
        long stale,
        String checked
    ) {}
}
