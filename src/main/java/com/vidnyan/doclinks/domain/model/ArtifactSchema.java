package com.vidnyan.doclinks.domain.model;

/**
 * Version tag written into every persisted catalog artifact.
 */
public final class ArtifactSchema {

    public static final String VERSION = "doclinks/v1";

    private ArtifactSchema() {
    }
}
