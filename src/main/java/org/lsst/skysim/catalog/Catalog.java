package org.lsst.skysim.catalog;

/**
 * The catalogs which can be queried.
 *
 * @author tonyj
 */
public enum Catalog {
    GAIA, SIMBAD;

    /**
     * Case insensitive lookup by name.
     */
    public static Catalog forName(String name) {
        for (Catalog catalog : values()) {
            if (catalog.name().equalsIgnoreCase(name)) {
                return catalog;
            }
        }
        throw new IllegalArgumentException("Unknown catalog: " + name);
    }
}
