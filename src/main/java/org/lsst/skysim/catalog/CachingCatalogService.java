package org.lsst.skysim.catalog;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.skysim.EquatorialCoordinate;

/**
 * Memoizes radial searches on another catalog service. Identical queries are
 * only sent once; failed queries are not cached and are reported with the
 * original exception.
 *
 * @author tonyj
 */
public class CachingCatalogService implements CatalogService {

    private static final Logger LOG = Logger.getLogger(CachingCatalogService.class.getName());

    private final CatalogService delegate;
    private final LoadingCache<CatalogQuery, List<CatalogSource>> cache;

    public CachingCatalogService(CatalogService delegate) {
        this(delegate, Integer.getInteger("org.lsst.skysim.catalogCacheSize", 100));
    }

    public CachingCatalogService(CatalogService delegate, long maximumSize) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build((CatalogQuery query) -> List.copyOf(delegate.performRadialSearch(
                        query.getCenter(), query.getRadius(), query.getLimit(), query.getMagnitudeLimit())));
    }

    @Override
    public List<CatalogSource> performRadialSearch(EquatorialCoordinate center, double radius, int limit, double magnitudeLimit) throws CatalogException {
        CatalogQuery query = new CatalogQuery(center, radius, limit, magnitudeLimit);
        try {
            return cache.get(query);
        } catch (CompletionException x) {
            Throwable cause = x.getCause();
            if (cause instanceof CatalogException) {
                throw (CatalogException) cause;
            }
            throw new CatalogException("Catalog query failed: " + query, cause);
        }
    }

    public CatalogService getDelegate() {
        return delegate;
    }

    public CacheStats stats() {
        return cache.stats();
    }

    public void report() {
        LOG.log(Level.INFO, "catalog Cache size {0} stats {1}", new Object[]{cache.estimatedSize(), cache.stats()});
    }
}
