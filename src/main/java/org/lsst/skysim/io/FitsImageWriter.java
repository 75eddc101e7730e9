package org.lsst.skysim.io;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.util.BufferedFile;
import org.lsst.skysim.DetectorImage;
import org.lsst.skysim.SensorParams;
import org.lsst.skysim.SimulatedSkyImage;
import org.lsst.skysim.wcs.WCSHeader;

/**
 * Writes a detector image as a single HDU FITS file with 32 bit integer
 * pixels, the WCS of the field and the sensor parameters in the header.
 *
 * @author tonyj
 */
public class FitsImageWriter {

    private static final Logger LOG = Logger.getLogger(FitsImageWriter.class.getName());

    public void write(SimulatedSkyImage sky, DetectorImage image, File file) throws IOException {
        if (image.getWidth() != sky.getWidth() || image.getHeight() != sky.getHeight()) {
            throw new IllegalArgumentException(String.format("Image is %dx%d but field is %dx%d",
                    image.getWidth(), image.getHeight(), sky.getWidth(), sky.getHeight()));
        }
        try {
            Fits fits = new Fits();
            BasicHDU<?> hdu = Fits.makeHDU(image.toArray());
            addHeaders(hdu.getHeader(), sky, image);
            fits.addHDU(hdu);
            Files.deleteIfExists(file.toPath());
            try (BufferedFile bf = new BufferedFile(file, "rw")) {
                fits.write(bf);
            }
        } catch (FitsException x) {
            throw new IOException("Error writing " + file, x);
        }
        LOG.log(Level.INFO, "Wrote {0}", file);
    }

    static void addHeaders(Header header, SimulatedSkyImage sky, DetectorImage image) throws FitsException {
        SensorParams params = sky.getSensorParams();
        header.addValue("BUNIT", "ADU", "Pixel units");
        header.addValue("DATAMIN", 0, "Minimum possible pixel value");
        header.addValue("DATAMAX", image.getMaxADU(), "Maximum possible pixel value");
        header.addValue("EXPTIME", params.getExposure(), "[s] Exposure time");
        header.addValue("GAIN", params.getGain(), "[e-/ADU] Gain");
        header.addValue("PEDESTAL", params.getBiasOffset(), "[ADU] Bias offset");
        header.addValue("RDNOISE", params.getReadNoise(), "[e-] Read noise");
        header.addValue("DARKCURR", params.getDarkCurrent(), "[e-/s/pixel] Dark current");
        header.addValue("XBINNING", params.getBinningX(), "Binning in x");
        header.addValue("YBINNING", params.getBinningY(), "Binning in y");
        header.addValue("XPIXSZ", params.getPixelSizeX() * 1e6, "[um] Pixel size in x");
        header.addValue("YPIXSZ", params.getPixelSizeY() * 1e6, "[um] Pixel size in y");
        header.addValue("FOCALLEN", params.getFocalLength() * 1e3, "[mm] Focal length");
        header.addValue("APTDIA", params.getApertureDiameter() * 1e3, "[mm] Aperture diameter");
        header.addValue("SKYBKG", params.getSkyBackground(), "[photons/s/m2/arcsec2] Sky background");
        header.addValue("SEEING", params.getSeeing(), "[arcsec] Seeing FWHM");
        header.addValue("QE", params.getQuantumEfficiency(), "Quantum efficiency");
        header.addValue("RA", sky.getCenter().getRA(), "[deg] Field centre right ascension");
        header.addValue("DEC", sky.getCenter().getDec(), "[deg] Field centre declination");
        for (Map.Entry<String, Object> entry : WCSHeader.toKeywords(sky.getWCS()).entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String) {
                header.addValue(entry.getKey(), (String) value, null);
            } else if (value instanceof Integer) {
                header.addValue(entry.getKey(), (Integer) value, null);
            } else {
                header.addValue(entry.getKey(), ((Number) value).doubleValue(), null);
            }
        }
    }
}
