package com.vidnyan.doclinks.application.port.in;

import com.vidnyan.doclinks.domain.check.CheckOutcome;

import java.nio.file.Path;

/**
 * Re-run the staleness check against the persisted links index.
 */
public interface CheckCatalogUseCase {

    /**
     * @throws com.vidnyan.doclinks.application.CatalogArtifactMissingException when no links index exists
     */
    CheckOutcome check(Path root);
}
