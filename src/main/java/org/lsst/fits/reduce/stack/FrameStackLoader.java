package org.lsst.fits.reduce.stack;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.reduce.io.CachingFrameReader;
import org.lsst.fits.reduce.io.Frame;
import org.lsst.fits.reduce.io.FrameFormat;

/**
 * Loads an ordered list of frame files into a {@link FrameStack}. The first
 * frame fixes the shape of the stack, frames of any other shape are replaced
 * by NaN. Frames are decoded a few ahead of the one being copied into the
 * stack.
 *
 * @author tonyj
 */
public class FrameStackLoader {

    private static final Logger LOG = Logger.getLogger(FrameStackLoader.class.getName());

    private final CachingFrameReader reader;
    private final int readAhead;

    public FrameStackLoader(CachingFrameReader reader) {
        this(reader, Integer.getInteger("org.lsst.fits.reduce.readAhead", 8));
    }

    public FrameStackLoader(CachingFrameReader reader, int readAhead) {
        this.reader = reader;
        this.readAhead = Math.max(0, readAhead);
    }

    /**
     * Load frames into a stack, preserving their order.
     *
     * @param files The frame files, in acquisition order
     * @param format The format of the files
     * @return The stack
     * @throws IOException If a frame cannot be read
     */
    public FrameStack load(List<Path> files, FrameFormat format) throws IOException {
        if (files.isEmpty()) {
            throw new IllegalArgumentException("No frames to load");
        }
        LOG.info("Starting file input...");
        int n = files.size();
        for (int i = 0; i < Math.min(n, readAhead + 1); i++) {
            reader.prefetch(files.get(i), format);
        }
        Frame first = reader.read(files.get(0), format);
        int width = first.getWidth();
        int height = first.getHeight();
        LOG.log(Level.FINE, "Canonical frame shape {0}x{1}", new Object[]{width, height});
        float[][] planes = new float[n][];
        planes[0] = first.getPixels().clone();
        int nextProgress = 1;
        for (int i = 1; i < n; i++) {
            if (i + readAhead < n) {
                reader.prefetch(files.get(i + readAhead), format);
            }
            Path file = files.get(i);
            Frame frame = reader.read(file, format);
            if (frame.hasShape(width, height)) {
                planes[i] = frame.getPixels().clone();
            } else {
                LOG.log(Level.WARNING, "Image with a different size detected: {0} is {1}x{2}, expected {3}x{4}. Sort the images and run the program again.",
                        new Object[]{file.getFileName(), frame.getWidth(), frame.getHeight(), width, height});
                float[] nan = new float[width * height];
                Arrays.fill(nan, Float.NaN);
                planes[i] = nan;
            }
            int percent = (int) ((i + 1) * 100L / n);
            if (percent >= nextProgress * 10) {
                LOG.log(Level.INFO, "Loaded {0}/{1} images ({2}%)", new Object[]{i + 1, n, percent});
                nextProgress = percent / 10 + 1;
            }
        }
        reader.report();
        reader.invalidateAll();
        return new FrameStack(width, height, planes);
    }
}
