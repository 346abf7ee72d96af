package org.lsst.fits.reduce.output;

/**
 * What happened to one output file.
 *
 * @author tonyj
 */
public enum WriteOutcome {
    WRITTEN, DECLINED
}
