package org.lsst.fits.reduce.reducer;

/**
 * The statistical reducers which can collapse a frame stack.
 *
 * @author tonyj
 */
public enum ReducerKind {
    SUM, MEAN, GROUPED_MEDIAN, TRIMMED_MEAN
}
