package org.lsst.fits.reduce.input;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.lsst.fits.reduce.io.FrameFormat;

/**
 * The frames found in one input location, in acquisition order.
 *
 * @author tonyj
 */
public class ResolvedInput {

    private final Path frameLocation;
    private final FrameFormat format;
    private final String extension;
    private final List<Path> frames;
    private final ScratchDirectory scratch;

    ResolvedInput(Path frameLocation, FrameFormat format, String extension, List<Path> frames, ScratchDirectory scratch) {
        this.frameLocation = frameLocation;
        this.format = format;
        this.extension = extension;
        this.frames = Collections.unmodifiableList(new ArrayList<>(frames));
        this.scratch = scratch;
    }

    /**
     * The directory the frames were read from, which is the scratch directory
     * if an archive was extracted.
     *
     * @return The frame directory
     */
    public Path getFrameLocation() {
        return frameLocation;
    }

    public FrameFormat getFormat() {
        return format;
    }

    /**
     * @return The frame file extension including the leading dot, e.g.
     * <code>.tif</code>
     */
    public String getExtension() {
        return extension;
    }

    public List<Path> getFrames() {
        return frames;
    }

    public Optional<ScratchDirectory> getScratchDirectory() {
        return Optional.ofNullable(scratch);
    }

    public String getFirstFrameName() {
        return frames.get(0).getFileName().toString();
    }

    public String getLastFrameName() {
        return frames.get(frames.size() - 1).getFileName().toString();
    }

    @Override
    public String toString() {
        return "ResolvedInput{" + "frameLocation=" + frameLocation + ", format=" + format + ", frames=" + frames.size() + ", scratch=" + scratch + '}';
    }
}
