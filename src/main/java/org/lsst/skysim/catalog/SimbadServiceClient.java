package org.lsst.skysim.catalog;

import java.net.MalformedURLException;
import java.net.URL;
import java.util.Locale;

/**
 * SIMBAD through the CDS TAP service, using the Gaia G magnitude from the
 * allfluxes table. SIMBAD supplies no flux, so photometry falls back to the
 * magnitude.
 *
 * @author tonyj
 */
public class SimbadServiceClient extends TapServiceClient {

    public static final String DEFAULT_URL = "https://simbad.cds.unistra.fr/simbad/sim-tap/sync";

    private static final String QUERY
            = "SELECT TOP %d basic.oid AS uid, basic.main_id AS designation, basic.ra AS ra, basic.dec AS dec, "
            + "basic.pmra AS pmra, basic.pmdec AS pmdec, basic.plx_value AS parallax, allfluxes.G AS magnitude "
            + "FROM basic JOIN allfluxes ON basic.oid = allfluxes.oidref "
            + "WHERE CONTAINS(POINT('ICRS', basic.ra, basic.dec), CIRCLE('ICRS', %s, %s, %s)) = 1 "
            + "AND allfluxes.G < %s "
            + "ORDER BY allfluxes.G ASC";

    public SimbadServiceClient() throws MalformedURLException {
        this(new URL(DEFAULT_URL));
    }

    public SimbadServiceClient(URL url) {
        super(url);
    }

    @Override
    protected String buildQuery(CatalogQuery query) {
        return String.format(Locale.ROOT, QUERY, query.getLimit(),
                GaiaServiceClient.adql(query.getCenter().getRA()), GaiaServiceClient.adql(query.getCenter().getDec()),
                GaiaServiceClient.adql(query.getRadius()), GaiaServiceClient.adql(query.getMagnitudeLimit()));
    }
}
