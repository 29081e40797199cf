package com.vidnyan.doclinks.application;

import java.nio.file.Path;

/**
 * A stage was asked to run but the artifact produced by an earlier stage does not exist.
 */
public class CatalogArtifactMissingException extends CatalogException {

    private final Path artifact;

    public CatalogArtifactMissingException(Path artifact, String producedBy) {
        super(artifact.getFileName() + " not found at " + artifact + ". Run '" + producedBy + "' first.");
        this.artifact = artifact;
    }

    public Path getArtifact() {
        return artifact;
    }
}
