package org.lsst.fits.reduce.reducer;

/**
 * Thrown when a reducer parameter is out of range. Only the offending reducer
 * fails, the rest of the queue still runs.
 *
 * @author tonyj
 */
public class ReducerValidationException extends Exception {

    private static final long serialVersionUID = 1L;

    public ReducerValidationException(String message) {
        super(message);
    }
}
