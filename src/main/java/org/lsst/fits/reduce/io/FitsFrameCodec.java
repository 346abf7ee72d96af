package org.lsst.fits.reduce.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.ImageHDU;
import nom.tam.fits.header.Standard;
import nom.tam.util.BufferedFile;

/**
 * Reads the first two dimensional image HDU of a FITS file, and writes frames
 * as a single 32 bit float primary HDU.
 *
 * @author tonyj
 */
class FitsFrameCodec implements FrameCodec {

    static {
        FitsFactory.setUseHierarch(true);
    }

    @Override
    public Frame read(Path file) throws IOException {
        try (Fits fits = new Fits(file.toFile())) {
            for (;;) {
                BasicHDU<?> hdu = fits.readHDU();
                if (hdu == null) {
                    throw new IOException("No 2-D image found in " + file);
                }
                Header header = hdu.getHeader();
                if (hdu instanceof ImageHDU && header.getIntValue(Standard.NAXIS) == 2) {
                    int width = header.getIntValue(Standard.NAXIS1);
                    int height = header.getIntValue(Standard.NAXIS2);
                    double bscale = header.getDoubleValue(Standard.BSCALE, 1.0);
                    double bzero = header.getDoubleValue(Standard.BZERO, 0.0);
                    float[] pixels = flatten(hdu.getKernel(), width, height, bscale, bzero, file);
                    return new Frame(width, height, pixels);
                }
            }
        } catch (FitsException x) {
            throw new IOException("Error reading FITS file " + file, x);
        }
    }

    // FITS kernels are indexed [NAXIS2][NAXIS1], i.e. [row][column]
    private static float[] flatten(Object kernel, int width, int height, double bscale, double bzero, Path file) throws IOException {
        float[] pixels = new float[width * height];
        int p = 0;
        if (kernel instanceof float[][]) {
            float[][] rows = (float[][]) kernel;
            for (float[] row : rows) {
                for (float v : row) {
                    pixels[p++] = (float) (bzero + bscale * v);
                }
            }
        } else if (kernel instanceof double[][]) {
            double[][] rows = (double[][]) kernel;
            for (double[] row : rows) {
                for (double v : row) {
                    pixels[p++] = (float) (bzero + bscale * v);
                }
            }
        } else if (kernel instanceof int[][]) {
            int[][] rows = (int[][]) kernel;
            for (int[] row : rows) {
                for (int v : row) {
                    pixels[p++] = (float) (bzero + bscale * v);
                }
            }
        } else if (kernel instanceof short[][]) {
            short[][] rows = (short[][]) kernel;
            for (short[] row : rows) {
                for (short v : row) {
                    pixels[p++] = (float) (bzero + bscale * v);
                }
            }
        } else if (kernel instanceof long[][]) {
            long[][] rows = (long[][]) kernel;
            for (long[] row : rows) {
                for (long v : row) {
                    pixels[p++] = (float) (bzero + bscale * v);
                }
            }
        } else if (kernel instanceof byte[][]) {
            byte[][] rows = (byte[][]) kernel;
            // FITS bytes are unsigned
            for (byte[] row : rows) {
                for (byte v : row) {
                    pixels[p++] = (float) (bzero + bscale * (v & 0xff));
                }
            }
        } else {
            throw new IOException("Unsupported FITS pixel type " + (kernel == null ? null : kernel.getClass().getSimpleName()) + " in " + file);
        }
        if (p != pixels.length) {
            throw new IOException("Truncated image data in " + file);
        }
        return pixels;
    }

    @Override
    public void write(Path file, Frame frame) throws IOException {
        float[][] data = new float[frame.getHeight()][frame.getWidth()];
        float[] pixels = frame.getPixels();
        for (int y = 0; y < frame.getHeight(); y++) {
            System.arraycopy(pixels, y * frame.getWidth(), data[y], 0, frame.getWidth());
        }
        // BufferedFile does not truncate an existing file
        Files.deleteIfExists(file);
        try (Fits fits = new Fits(); BufferedFile bf = new BufferedFile(file.toFile(), "rw")) {
            fits.addHDU(Fits.makeHDU(data));
            fits.write(bf);
        } catch (FitsException x) {
            throw new IOException("Error writing FITS file " + file, x);
        }
    }
}
