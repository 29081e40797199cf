package com.vidnyan.doclinks.application;

import java.nio.file.Path;

/**
 * An artifact location could not be read or written.
 */
public class CatalogStorageException extends CatalogException {

    private final Path location;

    public CatalogStorageException(Path location, String action, Throwable cause) {
        super("Failed to " + action + " " + location + ": " + cause.getMessage(), cause);
        this.location = location;
    }

    public Path getLocation() {
        return location;
    }
}
