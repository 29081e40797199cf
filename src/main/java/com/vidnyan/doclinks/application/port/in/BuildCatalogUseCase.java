package com.vidnyan.doclinks.application.port.in;

import com.vidnyan.doclinks.domain.check.CheckReport;
import com.vidnyan.doclinks.domain.model.ExtractedRefs;
import com.vidnyan.doclinks.domain.model.LinksIndex;
import com.vidnyan.doclinks.domain.model.SymbolIndex;

import java.nio.file.Path;

/**
 * Primary use case: rebuild the whole catalog of a repository.
 * Indexes symbols, extracts references, resolves them and runs a first check pass,
 * persisting each stage's artifact.
 */
public interface BuildCatalogUseCase {

    BuildResult build(Path root);

    /**
     * Artifacts produced by a build.
     */
    record BuildResult(
        SymbolIndex symbols,
        ExtractedRefs refs,
        LinksIndex links,
        CheckReport check
    ) {}
}
