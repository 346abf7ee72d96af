package org.lsst.fits.reduce.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Objects;

/**
 * Cache key for a decoded frame. Includes the file size and modification time
 * so that a file rewritten in place (for example by re-extracting an archive)
 * is decoded again.
 *
 * @author tonyj
 */
class FrameKey {

    private final Path file;
    private final FrameFormat format;
    private final long size;
    private final long lastModified;

    private FrameKey(Path file, FrameFormat format, long size, long lastModified) {
        this.file = file;
        this.format = format;
        this.size = size;
        this.lastModified = lastModified;
    }

    static FrameKey of(Path file, FrameFormat format) throws IOException {
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        return new FrameKey(file.toAbsolutePath().normalize(), format, attributes.size(), attributes.lastModifiedTime().toMillis());
    }

    Path getFile() {
        return file;
    }

    FrameFormat getFormat() {
        return format;
    }

    @Override
    public String toString() {
        return "FrameKey{" + "file=" + file + ", format=" + format + '}';
    }

    @Override
    public int hashCode() {
        int hash = 5;
        hash = 71 * hash + Objects.hashCode(this.file);
        hash = 71 * hash + Objects.hashCode(this.format);
        hash = 71 * hash + (int) (this.size ^ (this.size >>> 32));
        hash = 71 * hash + (int) (this.lastModified ^ (this.lastModified >>> 32));
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
        final FrameKey other = (FrameKey) obj;
        if (this.size != other.size || this.lastModified != other.lastModified) {
            return false;
        }
        return this.format == other.format && Objects.equals(this.file, other.file);
    }
}
