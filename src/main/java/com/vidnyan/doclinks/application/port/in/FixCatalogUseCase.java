package com.vidnyan.doclinks.application.port.in;

import com.vidnyan.doclinks.domain.fix.FixReport;

import java.nio.file.Path;

/**
 * Check for staleness, then gather the context needed to fix every issue.
 */
public interface FixCatalogUseCase {

    /**
     * @throws com.vidnyan.doclinks.application.CatalogArtifactMissingException when no links index exists
     */
    FixReport fix(Path root);
}
