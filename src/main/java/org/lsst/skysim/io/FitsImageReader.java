package org.lsst.skysim.io;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.lsst.skysim.DetectorImage;
import org.lsst.skysim.wcs.WCS;
import org.lsst.skysim.wcs.WCSHeader;

/**
 * Reads back images written by {@link FitsImageWriter}.
 *
 * @author tonyj
 */
public class FitsImageReader {

    private static final String[] WCS_STRING_KEYWORDS = {"CTYPE1", "CTYPE2"};
    private static final String[] WCS_NUMERIC_KEYWORDS = {"CRPIX1", "CRPIX2", "CRVAL1", "CRVAL2", "CD1_1", "CD1_2", "CD2_1", "CD2_2"};

    private final Header header;
    private final int[][] data;

    public FitsImageReader(File file) throws IOException {
        try (Fits fits = new Fits(file)) {
            BasicHDU<?> hdu = fits.getHDU(0);
            if (hdu == null) {
                throw new IOException("No HDU in " + file);
            }
            Object kernel = hdu.getKernel();
            if (!(kernel instanceof int[][])) {
                throw new IOException("Unsupported image data in " + file + ": " + (kernel == null ? null : kernel.getClass()));
            }
            this.header = hdu.getHeader();
            this.data = (int[][]) kernel;
        } catch (FitsException x) {
            throw new IOException("Error reading " + file, x);
        }
    }

    public Header getHeader() {
        return header;
    }

    public DetectorImage getImage() {
        return DetectorImage.of(data, header.getIntValue("DATAMAX"));
    }

    public WCS getWCS() {
        Map<String, Object> keywords = new HashMap<>();
        for (String key : WCS_STRING_KEYWORDS) {
            if (header.containsKey(key)) {
                keywords.put(key, header.getStringValue(key));
            }
        }
        for (String key : WCS_NUMERIC_KEYWORDS) {
            if (header.containsKey(key)) {
                keywords.put(key, header.getDoubleValue(key));
            }
        }
        return WCSHeader.fromKeywords(keywords);
    }
}
