package com.modelgate.exception;

/**
 * The upstream model listing could not be retrieved or decoded.
 */
public class CatalogFetchException extends RuntimeException {

    public CatalogFetchException(String message) {
        super(message);
    }

    public CatalogFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
