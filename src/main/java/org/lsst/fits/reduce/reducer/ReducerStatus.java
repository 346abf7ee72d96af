package org.lsst.fits.reduce.reducer;

/**
 *
 * @author tonyj
 */
public enum ReducerStatus {
    SUCCESS, SKIPPED, FAILED
}
