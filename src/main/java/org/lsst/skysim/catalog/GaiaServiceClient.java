package org.lsst.skysim.catalog;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.Locale;

/**
 * Gaia DR3 through the ESA TAP service. Only sources with gold standard
 * photometry (phot_proc_mode = '0') are returned, flux is the G band mean
 * flux in electrons per second.
 *
 * @author tonyj
 */
public class GaiaServiceClient extends TapServiceClient {

    public static final String DEFAULT_URL = "https://gea.esac.esa.int/tap-server/tap/sync";

    private static final String QUERY
            = "SELECT TOP %d source_id AS uid, designation, ra, dec, pmra, pmdec, parallax, "
            + "phot_g_mean_flux AS flux, phot_g_mean_mag AS magnitude "
            + "FROM gaiadr3.gaia_source "
            + "WHERE CONTAINS(POINT('ICRS', ra, dec), CIRCLE('ICRS', %s, %s, %s)) = 1 "
            + "AND phot_g_mean_mag < %s AND phot_proc_mode = '0' "
            + "ORDER BY phot_g_mean_mag ASC";

    public GaiaServiceClient() throws MalformedURLException {
        this(new URL(DEFAULT_URL));
    }

    public GaiaServiceClient(URL url) {
        super(url);
    }

    @Override
    protected String buildQuery(CatalogQuery query) {
        return String.format(Locale.ROOT, QUERY, query.getLimit(),
                adql(query.getCenter().getRA()), adql(query.getCenter().getDec()),
                adql(query.getRadius()), adql(query.getMagnitudeLimit()));
    }

    static String adql(double value) {
        return Double.toString(value);
    }
}
