package org.mitre.dispersion.catalog;

/** Thrown when a city catalog cannot be read. */
public class CatalogException extends RuntimeException {

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
