package org.lsst.skysim.io;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.io.File;
import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.imageio.ImageIO;

/**
 * Writes a normalized image as a 16 bit greyscale PNG, row 0 at the top.
 *
 * @author tonyj
 */
public class DisplayImageWriter {

    private static final Logger LOG = Logger.getLogger(DisplayImageWriter.class.getName());

    public static BufferedImage toBufferedImage(int[][] normalized) {
        int height = normalized.length;
        int width = height == 0 ? 0 : normalized[0].length;
        if (width == 0 || height == 0) {
            throw new IllegalArgumentException("Empty image");
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_USHORT_GRAY);
        WritableRaster raster = image.getRaster();
        for (int y = 0; y < height; y++) {
            int[] row = normalized[y];
            if (row.length != width) {
                throw new IllegalArgumentException("Ragged image, row " + y + " has " + row.length + " pixels");
            }
            for (int x = 0; x < width; x++) {
                if (row[x] < 0 || row[x] > 0xffff) {
                    throw new IllegalArgumentException("Value " + row[x] + " at (" + x + "," + y + ") is not 16 bit");
                }
            }
            raster.setSamples(0, y, width, 1, 0, row);
        }
        return image;
    }

    public void write(int[][] normalized, File file) throws IOException {
        BufferedImage image = toBufferedImage(normalized);
        if (!ImageIO.write(image, "png", file)) {
            throw new IOException("No PNG writer available");
        }
        LOG.log(Level.INFO, "Wrote {0}", file);
    }
}
