package com.descent.engine.catalog;

/**
 * Exception thrown when catalog operations fail.
 */
public class CatalogException extends Exception {
    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
