package org.lsst.fits.reduce.preview;

import java.awt.image.BufferedImage;
import java.util.logging.Logger;
import org.lsst.fits.reduce.cmap.RGBColorMap;

/**
 * Logarithmic intensity scaling of a reduced image for display. Only finite
 * positive values can be shown on a log scale, everything else is drawn in
 * the bad pixel color.
 *
 * @author tonyj
 */
class LogScaling {

    private static final Logger LOG = Logger.getLogger(LogScaling.class.getName());
    static final int BAD_PIXEL_RGB = 0xffffff;

    private double logMin = Double.POSITIVE_INFINITY;
    private double logMax = Double.NEGATIVE_INFINITY;

    LogScaling(float[] values) {
        for (float v : values) {
            if (v > 0 && Float.isFinite(v)) {
                double l = Math.log10(v);
                logMin = Math.min(logMin, l);
                logMax = Math.max(logMax, l);
            }
        }
        LOG.fine(() -> String.format("log10 min=%g max=%g", logMin, logMax));
    }

    boolean isEmpty() {
        return logMin > logMax;
    }

    double getMin() {
        return isEmpty() ? Double.NaN : Math.pow(10, logMin);
    }

    double getMax() {
        return isEmpty() ? Double.NaN : Math.pow(10, logMax);
    }

    /**
     * @param v A pixel value
     * @return The value mapped to [0,1], or NaN if it cannot be shown
     */
    double normalize(float v) {
        if (!(v > 0) || !Float.isFinite(v) || isEmpty()) {
            return Double.NaN;
        }
        if (logMax == logMin) {
            return 1.0;
        }
        return (Math.log10(v) - logMin) / (logMax - logMin);
    }

    BufferedImage render(float[] values, int width, int height, RGBColorMap cmap) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double f = normalize(values[x + y * width]);
                image.setRGB(x, y, Double.isNaN(f) ? BAD_PIXEL_RGB : cmap.getRGB(f));
            }
        }
        return image;
    }
}
