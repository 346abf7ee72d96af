package org.lsst.fits.reduce.stack;

import java.util.Arrays;

/**
 * An ordered stack of equally sized frames, indexed by acquisition order.
 * Frames which could not be loaded are entirely NaN. Instances are immutable,
 * reducers only read from them.
 *
 * @author tonyj
 */
public class FrameStack {

    private final int width;
    private final int height;
    private final float[][] planes;

    FrameStack(int width, int height, float[][] planes) {
        this.width = width;
        this.height = height;
        this.planes = planes;
    }

    /**
     * Create a stack from a copy of the given frames.
     *
     * @param width The frame width
     * @param height The frame height
     * @param frames Row major pixel data, one array per frame
     * @return The stack
     */
    public static FrameStack of(int width, int height, float[]... frames) {
        if (frames.length == 0) {
            throw new IllegalArgumentException("A stack needs at least one frame");
        }
        float[][] planes = new float[frames.length][];
        for (int i = 0; i < frames.length; i++) {
            if (frames[i].length != width * height) {
                throw new IllegalArgumentException("Frame " + i + " has " + frames[i].length + " pixels, expected " + width * height);
            }
            planes[i] = frames[i].clone();
        }
        return new FrameStack(width, height, planes);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getFrameCount() {
        return planes.length;
    }

    public int getPixelCount() {
        return width * height;
    }

    public float getValue(int frame, int pixel) {
        return planes[frame][pixel];
    }

    public float[] copyFrame(int frame) {
        return planes[frame].clone();
    }

    /**
     * Copy the values of one pixel in frames <code>from</code> (inclusive) to
     * <code>to</code> (exclusive) into a buffer.
     *
     * @param pixel The pixel index
     * @param from The first frame
     * @param to The frame after the last frame
     * @param buffer The buffer, at least <code>to-from</code> long
     */
    public void samples(int pixel, int from, int to, double[] buffer) {
        for (int i = from; i < to; i++) {
            buffer[i - from] = planes[i][pixel];
        }
    }

    /**
     * @return A copy of this stack in which every negative value is NaN
     */
    public FrameStack maskNegatives() {
        float[][] masked = new float[planes.length][];
        for (int i = 0; i < planes.length; i++) {
            float[] plane = planes[i].clone();
            for (int p = 0; p < plane.length; p++) {
                if (plane[p] < 0) {
                    plane[p] = Float.NaN;
                }
            }
            masked[i] = plane;
        }
        return new FrameStack(width, height, masked);
    }

    /**
     * Valid detector pixels, i.e. those which are finite and not negative in
     * the first frame.
     *
     * @return 1 for valid pixels, 0 otherwise
     */
    public float[] validPixelMask() {
        float[] mask = new float[getPixelCount()];
        float[] first = planes[0];
        for (int p = 0; p < mask.length; p++) {
            mask[p] = Float.isFinite(first[p]) && first[p] >= 0 ? 1f : 0f;
        }
        return mask;
    }

    @Override
    public String toString() {
        return "FrameStack{" + "frames=" + planes.length + ", width=" + width + ", height=" + height + '}';
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 37 * hash + width;
        hash = 37 * hash + height;
        hash = 37 * hash + Arrays.deepHashCode(planes);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final FrameStack other = (FrameStack) obj;
        return width == other.width && height == other.height && Arrays.deepEquals(planes, other.planes);
    }
}
