package org.lsst.fits.reduce;

/**
 * Thrown for command line arguments which cannot be understood.
 *
 * @author tonyj
 */
public class CommandLineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CommandLineException(String message) {
        super(message);
    }

    public CommandLineException(String message, Throwable cause) {
        super(message, cause);
    }
}
