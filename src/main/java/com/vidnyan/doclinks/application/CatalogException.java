package com.vidnyan.doclinks.application;

/**
 * Base class for the hard failures of the catalog pipeline.
 */
public abstract class CatalogException extends RuntimeException {

    protected CatalogException(String message) {
        super(message);
    }

    protected CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
