package org.lsst.fits.reduce.io;

import com.github.benmanes.caffeine.cache.AsyncLoadingCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.reduce.Timed;

/**
 * Decodes frames through a Caffeine cache, so that frames can be decoded
 * ahead of the point where they are needed, on the cache's executor, while
 * the caller consumes earlier frames in order. The cache is bounded by the
 * total number of pixels it holds.
 *
 * @author tonyj
 */
public class CachingFrameReader {

    private static final Logger LOG = Logger.getLogger(CachingFrameReader.class.getName());

    private final AsyncLoadingCache<FrameKey, Frame> frameCache;

    public CachingFrameReader() {
        this(Long.getLong("org.lsst.fits.reduce.frameCacheWeight", 64L << 20));
    }

    /**
     * Create a reader with the given cache bound
     *
     * @param maximumPixels The maximum number of pixels held in the cache
     */
    public CachingFrameReader(long maximumPixels) {
        frameCache = Caffeine.newBuilder()
                .maximumWeight(maximumPixels)
                .weigher((FrameKey key, Frame frame) -> frame.getPixelCount())
                .recordStats()
                .buildAsync((FrameKey key, Executor executor) -> CompletableFuture.supplyAsync(() -> decode(key), executor));
    }

    private static Frame decode(FrameKey key) {
        try {
            return Timed.execute(() -> key.getFormat().getCodec().read(key.getFile()), "Decoding %s took %dms", key.getFile());
        } catch (IOException x) {
            throw new CompletionException(x);
        }
    }

    /**
     * Start decoding a frame without waiting for it.
     *
     * @param file The frame file
     * @param format The format of the file
     * @throws IOException If the file attributes cannot be read
     */
    public void prefetch(Path file, FrameFormat format) throws IOException {
        frameCache.get(FrameKey.of(file, format));
    }

    /**
     * Read a frame, waiting for a decode already in progress if there is
     * one.
     *
     * @param file The frame file
     * @param format The format of the file
     * @return The decoded frame
     * @throws IOException If the frame cannot be decoded
     */
    public Frame read(Path file, FrameFormat format) throws IOException {
        try {
            return frameCache.get(FrameKey.of(file, format)).join();
        } catch (CompletionException x) {
            Throwable cause = x.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            } else if (cause instanceof UncheckedIOException) {
                throw ((UncheckedIOException) cause).getCause();
            } else {
                throw new IOException("Unexpected exception while decoding " + file, cause);
            }
        }
    }

    public void invalidateAll() {
        frameCache.synchronous().invalidateAll();
    }

    public void report() {
        LoadingCache<FrameKey, Frame> cache = frameCache.synchronous();
        LOG.log(Level.FINE, "frame Cache size {0} stats {1}", new Object[]{cache.estimatedSize(), cache.stats()});
    }
}
