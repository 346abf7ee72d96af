package org.lsst.fits.reduce.input;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Enumeration;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;

/**
 * Unpacks an archive of frames into a directory.
 *
 * @author tonyj
 */
class ArchiveExtractor {

    private ArchiveExtractor() {
    }

    static int extract(ArchiveType type, Path archive, Path target) throws IOException {
        Files.createDirectories(target);
        switch (type) {
            case ZIP:
                return extractZip(archive, target);
            case TAR_GZ:
                return extractTarGz(archive, target);
            default:
                throw new IOException("Unsupported archive type: " + type);
        }
    }

    private static int extractZip(Path archive, Path target) throws IOException {
        int count = 0;
        try (ZipFile zip = new ZipFile(archive.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                Path destination = resolveEntry(target, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(destination);
                } else {
                    try (InputStream in = zip.getInputStream(entry)) {
                        copy(in, destination);
                    }
                    count++;
                }
            }
        }
        return count;
    }

    private static int extractTarGz(Path archive, Path target) throws IOException {
        int count = 0;
        try (TarArchiveInputStream tar = new TarArchiveInputStream(new GzipCompressorInputStream(new BufferedInputStream(Files.newInputStream(archive))))) {
            for (TarArchiveEntry entry = tar.getNextTarEntry(); entry != null; entry = tar.getNextTarEntry()) {
                Path destination = resolveEntry(target, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(destination);
                } else if (entry.isFile()) {
                    copy(tar, destination);
                    count++;
                }
                // links and devices are not frames, skip them
            }
        }
        return count;
    }

    private static void copy(InputStream in, Path destination) throws IOException {
        Path parent = destination.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.copy(in, destination);
    }

    private static Path resolveEntry(Path target, String name) throws IOException {
        Path root = target.toAbsolutePath().normalize();
        Path destination = root.resolve(name).normalize();
        if (!destination.startsWith(root)) {
            throw new IOException("Archive entry outside of extraction directory: " + name);
        }
        return destination;
    }
}
