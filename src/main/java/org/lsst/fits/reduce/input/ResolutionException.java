package org.lsst.fits.reduce.input;

import java.io.IOException;

/**
 * Thrown when an input location contains nothing we can process.
 *
 * @author tonyj
 */
public class ResolutionException extends IOException {

    private static final long serialVersionUID = 1L;

    public ResolutionException(String message) {
        super(message);
    }
}
