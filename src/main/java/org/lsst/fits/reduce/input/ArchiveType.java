package org.lsst.fits.reduce.input;

import java.util.Locale;
import java.util.Optional;

/**
 * Archive formats frames may be delivered in.
 *
 * @author tonyj
 */
public enum ArchiveType {

    ZIP(".zip"), TAR_GZ(".tar.gz");

    private final String suffix;

    ArchiveType(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    public static Optional<ArchiveType> forToken(String token) {
        String lower = token.toLowerCase(Locale.ROOT);
        String suffix = lower.startsWith(".") ? lower : "." + lower;
        for (ArchiveType type : values()) {
            if (type.suffix.equals(suffix)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
