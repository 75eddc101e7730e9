package org.lsst.skysim.catalog;

import java.util.List;
import org.lsst.skysim.EquatorialCoordinate;

/**
 * A source of catalog stars.
 *
 * @author tonyj
 */
public interface CatalogService {

    /**
     * Find sources within a cone on the sky.
     *
     * @param center The centre of the search cone
     * @param radius The search radius in degrees
     * @param limit The maximum number of sources to return
     * @param magnitudeLimit Only sources brighter than this magnitude are
     * returned
     * @return The matching sources, possibly empty
     * @throws CatalogException If the query fails
     */
    List<CatalogSource> performRadialSearch(EquatorialCoordinate center, double radius, int limit, double magnitudeLimit) throws CatalogException;
}
