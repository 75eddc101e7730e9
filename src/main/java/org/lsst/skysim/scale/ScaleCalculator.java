package org.lsst.skysim.scale;

import org.lsst.skysim.DetectorImage;

/**
 * Chooses the range of detector values to map onto the display range.
 *
 * @author tonyj
 */
public interface ScaleCalculator {

    /**
     * @return {vmin, vmax}
     */
    double[] computeScale(DetectorImage image);
}
