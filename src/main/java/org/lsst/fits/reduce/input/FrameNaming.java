package org.lsst.fits.reduce.input;

import java.io.IOException;
import java.util.Locale;

/**
 * The detector file naming convention,
 * <code>prefix_..._&lt;marker&gt;_&lt;index&gt;.ext</code>, where the
 * acquisition marker (<code>ct</code> for counting detectors) is the second
 * to last underscore separated token.
 *
 * @author tonyj
 */
public class FrameNaming {

    public static final String DEFAULT_ACQUISITION_MARKER = "ct";

    private final String acquisitionMarker;

    public FrameNaming() {
        this(DEFAULT_ACQUISITION_MARKER);
    }

    public FrameNaming(String acquisitionMarker) {
        this.acquisitionMarker = acquisitionMarker;
    }

    public String getAcquisitionMarker() {
        return acquisitionMarker;
    }

    public boolean isAcquisitionFrame(String fileName) {
        String[] tokens = fileName.split("_", -1);
        return tokens.length >= 2 && tokens[tokens.length - 2].equals(acquisitionMarker);
    }

    /**
     * Derive the base name of reduced outputs from the first and last frame
     * of a run, e.g. <code>sample_ct_00001.tif</code> and
     * <code>sample_ct_00010.tif</code> give
     * <code>sample_ct_00001_to_00010</code>.
     *
     * @param firstFrame The file name of the first frame
     * @param lastFrame The file name of the last frame
     * @param extension The frame file extension, including the dot
     * @return The base name, without extension
     * @throws IOException If either name does not follow the convention
     */
    public String outputBaseName(String firstFrame, String lastFrame, String extension) throws IOException {
        String firstStem = stem(firstFrame, extension);
        String lastStem = stem(lastFrame, extension);
        String[] lastTokens = lastStem.split("_", -1);
        String index = lastTokens[lastTokens.length - 1];
        if (lastTokens.length < 2 || index.isEmpty() || firstStem.split("_", -1).length < 2) {
            throw new IOException("Cannot derive output name, frame names do not follow the prefix_..._index" + extension + " convention: " + firstFrame + ", " + lastFrame);
        }
        return firstStem + "_to_" + index;
    }

    private static String stem(String fileName, String extension) throws IOException {
        if (!fileName.toLowerCase(Locale.ROOT).endsWith(extension.toLowerCase(Locale.ROOT)) || fileName.length() == extension.length()) {
            throw new IOException("Frame " + fileName + " does not have extension " + extension);
        }
        return fileName.substring(0, fileName.length() - extension.length());
    }
}
