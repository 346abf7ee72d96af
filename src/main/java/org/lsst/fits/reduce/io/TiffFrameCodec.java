package org.lsst.fits.reduce.io;

import java.awt.Transparency;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ComponentColorModel;
import java.awt.image.DataBuffer;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.imageio.ImageIO;

/**
 * TIFF frames via the JDK image I/O TIFF plugin. Detector TIFFs are single
 * band 32 bit integer or float images, only band 0 is used.
 *
 * @author tonyj
 */
class TiffFrameCodec implements FrameCodec {

    @Override
    public Frame read(Path file) throws IOException {
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("No TIFF reader could decode " + file);
        }
        Raster raster = image.getRaster();
        int width = raster.getWidth();
        int height = raster.getHeight();
        float[] pixels = raster.getSamples(raster.getMinX(), raster.getMinY(), width, height, 0, (float[]) null);
        return new Frame(width, height, pixels);
    }

    @Override
    public void write(Path file, Frame frame) throws IOException {
        ComponentColorModel cm = new ComponentColorModel(ColorSpace.getInstance(ColorSpace.CS_GRAY),
                false, false, Transparency.OPAQUE, DataBuffer.TYPE_FLOAT);
        WritableRaster raster = cm.createCompatibleWritableRaster(frame.getWidth(), frame.getHeight());
        raster.setSamples(0, 0, frame.getWidth(), frame.getHeight(), 0, frame.getPixels());
        BufferedImage image = new BufferedImage(cm, raster, false, null);
        Files.deleteIfExists(file);
        if (!ImageIO.write(image, "TIFF", file.toFile())) {
            throw new IOException("No TIFF writer available for " + file);
        }
    }
}
