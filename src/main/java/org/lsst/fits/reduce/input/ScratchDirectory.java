package org.lsst.fits.reduce.input;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A temporary directory an archive was extracted into. Closing it removes the
 * directory, unless the operator chose to reuse one left by an earlier run.
 *
 * @author tonyj
 */
public class ScratchDirectory implements Closeable {

    private static final Logger LOG = Logger.getLogger(ScratchDirectory.class.getName());

    private final Path path;
    private final boolean reused;
    private boolean closed;

    ScratchDirectory(Path path, boolean reused) {
        this.path = path;
        this.reused = reused;
    }

    public Path getPath() {
        return path;
    }

    public boolean isReused() {
        return reused;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        if (reused) {
            LOG.log(Level.INFO, "Keeping reused temporary folder {0}.", path);
        } else {
            deleteTree(path);
            LOG.log(Level.INFO, "Deleted temporary folder {0}.", path);
        }
    }

    static void deleteTree(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<Path>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException x) throws IOException {
                if (x != null) {
                    throw x;
                }
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    @Override
    public String toString() {
        return "ScratchDirectory{" + "path=" + path + ", reused=" + reused + '}';
    }
}
