package org.lsst.skysim.catalog;

import java.io.IOException;

/**
 * Thrown when a catalog query fails, either because the service could not be
 * reached, returned an error status, or returned a response which could not
 * be understood.
 *
 * @author tonyj
 */
public class CatalogException extends IOException {

    private static final long serialVersionUID = 1L;

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
