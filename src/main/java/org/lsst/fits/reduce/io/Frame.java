package org.lsst.fits.reduce.io;

import java.util.Arrays;

/**
 * Pixel data of one detector image, stored row major as 32 bit floats.
 *
 * @author tonyj
 */
public class Frame {

    private final int width;
    private final int height;
    private final float[] pixels;

    /**
     * Create a frame from row major pixel data
     *
     * @param width The number of columns
     * @param height The number of rows
     * @param pixels The pixel values, <code>width*height</code> of them
     */
    public Frame(int width, int height, float[] pixels) {
        if (pixels.length != width * height) {
            throw new IllegalArgumentException("Expected " + width * height + " pixels, got " + pixels.length);
        }
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getPixelCount() {
        return pixels.length;
    }

    /**
     * The underlying pixel array. Callers must not modify it.
     *
     * @return The pixels
     */
    public float[] getPixels() {
        return pixels;
    }

    public float getPixel(int x, int y) {
        return pixels[x + y * width];
    }

    public boolean hasShape(int width, int height) {
        return this.width == width && this.height == height;
    }

    @Override
    public String toString() {
        return "Frame{" + "width=" + width + ", height=" + height + '}';
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 79 * hash + width;
        hash = 79 * hash + height;
        hash = 79 * hash + Arrays.hashCode(pixels);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null) {
            return false;
        }
        if (getClass() != obj.getClass()) {
            return false;
        }
        final Frame other = (Frame) obj;
        return width == other.width && height == other.height && Arrays.equals(pixels, other.pixels);
    }
}
