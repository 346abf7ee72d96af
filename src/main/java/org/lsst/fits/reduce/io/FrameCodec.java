package org.lsst.fits.reduce.io;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads and writes detector frames in one file format.
 *
 * @author tonyj
 */
public interface FrameCodec {

    Frame read(Path file) throws IOException;

    /**
     * Write a frame, replacing any existing file.
     *
     * @param file The file to write
     * @param frame The data to write
     * @throws IOException If the file cannot be written
     */
    void write(Path file, Frame frame) throws IOException;
}
