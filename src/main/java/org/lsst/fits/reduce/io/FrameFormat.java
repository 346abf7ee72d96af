package org.lsst.fits.reduce.io;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The detector frame formats we can read and write.
 *
 * @author tonyj
 */
public enum FrameFormat {

    FITS(new FitsFrameCodec(), ".fits", ".fit", ".fts"),
    TIFF(new TiffFrameCodec(), ".tif", ".tiff");

    private final FrameCodec codec;
    private final List<String> suffixes;

    FrameFormat(FrameCodec codec, String... suffixes) {
        this.codec = codec;
        this.suffixes = Collections.unmodifiableList(Arrays.asList(suffixes));
    }

    public FrameCodec getCodec() {
        return codec;
    }

    public List<String> getSuffixes() {
        return suffixes;
    }

    /**
     * Look up the format for a file type token such as <code>.tif</code> or
     * <code>fits</code>.
     *
     * @param token The file type token, with or without the leading dot
     * @return The format, or empty if the token is not a frame type
     */
    public static Optional<FrameFormat> forToken(String token) {
        String suffix = normalize(token);
        for (FrameFormat format : values()) {
            if (format.suffixes.contains(suffix)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }

    static String normalize(String token) {
        String lower = token.toLowerCase(Locale.ROOT);
        return lower.startsWith(".") ? lower : "." + lower;
    }
}
