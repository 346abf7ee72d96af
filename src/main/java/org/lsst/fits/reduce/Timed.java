package org.lsst.fits.reduce;

import java.io.IOException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility for logging how long each processing stage takes.
 *
 * @author tonyj
 */
public class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());
    private static final Level DEFAULT_LOG_LEVEL = Level.FINE;

    private Timed() {
    }

    public static <T> T execute(Stage<T> stage, String message, Object... args) throws IOException {
        return execute(DEFAULT_LOG_LEVEL, stage, message, args);
    }

    /**
     * Run a stage and log its elapsed time.
     *
     * @param <T> The type returned by the stage
     * @param logLevel The level at which the time is logged
     * @param stage The work to perform
     * @param message A format string, the elapsed milliseconds are appended
     * to <code>args</code>
     * @param args The format arguments
     * @return The value returned by the stage
     * @throws IOException If the stage fails
     */
    public static <T> T execute(Level logLevel, Stage<T> stage, String message, Object... args) throws IOException {
        long start = System.currentTimeMillis();
        try {
            return stage.call();
        } finally {
            long elapsed = System.currentTimeMillis() - start;
            LOG.log(logLevel, () -> String.format(message, append(args, elapsed)));
        }
    }

    private static Object[] append(Object[] args, Object... arg) {
        Object[] result = new Object[args.length + arg.length];
        System.arraycopy(args, 0, result, 0, args.length);
        System.arraycopy(arg, 0, result, args.length, arg.length);
        return result;
    }

    /**
     * A unit of work which may fail with an I/O error.
     *
     * @param <T> The result type
     */
    @FunctionalInterface
    public interface Stage<T> {

        T call() throws IOException;
    }
}
