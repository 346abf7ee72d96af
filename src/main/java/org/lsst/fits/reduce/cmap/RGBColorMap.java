package org.lsst.fits.reduce.cmap;

/**
 * Maps normalized intensities onto RGB colors.
 *
 * @author tonyj
 */
public abstract class RGBColorMap {

    private final int size;

    public RGBColorMap(int size) {
        this.size = size;
    }

    /**
     * @param value An index between 0 and <code>getSize()-1</code>
     * @return The color as 0xRRGGBB
     */
    public abstract int getRGB(int value);

    public int getSize() {
        return size;
    }

    /**
     * Color for a value normalized to [0,1], values outside are clamped.
     *
     * @param fraction The normalized value
     * @return The color as 0xRRGGBB
     */
    public int getRGB(double fraction) {
        int index = (int) Math.round(fraction * (size - 1));
        return getRGB(Math.max(0, Math.min(size - 1, index)));
    }
}
