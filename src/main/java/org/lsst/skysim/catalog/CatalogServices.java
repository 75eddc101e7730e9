package org.lsst.skysim.catalog;

import java.net.MalformedURLException;
import java.io.UncheckedIOException;

/**
 * Factory for catalog services.
 *
 * @author tonyj
 */
public final class CatalogServices {

    private CatalogServices() {
    }

    /**
     * Create a caching client for the given catalog.
     */
    public static CatalogService create(Catalog catalog) {
        try {
            TapServiceClient client = switch (catalog) {
                case GAIA -> new GaiaServiceClient();
                case SIMBAD -> new SimbadServiceClient();
            };
            return new CachingCatalogService(client);
        } catch (MalformedURLException x) {
            throw new UncheckedIOException("Invalid catalog URL", x);
        }
    }
}
