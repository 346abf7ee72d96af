package org.lsst.fits.reduce.reducer;

import java.math.BigDecimal;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.reduce.stack.FrameStack;

/**
 * Removes cosmic rays and stray scatter by averaging, per pixel, only the
 * lowest <code>round(retainFraction * n)</code> of the n valid samples. At
 * least one sample is kept, and at least one high sample is always dropped.
 * When a single sample is kept the result is the per pixel minimum and the
 * variance image repeats it, as for the sum.
 *
 * @author tonyj
 */
class TrimmedMeanReducer implements Reducer {

    private static final Logger LOG = Logger.getLogger(TrimmedMeanReducer.class.getName());

    private final double retainFraction;

    TrimmedMeanReducer(double retainFraction) {
        this.retainFraction = retainFraction;
    }

    @Override
    public ReducerKind getKind() {
        return ReducerKind.TRIMMED_MEAN;
    }

    @Override
    public String getLabel(int frameCount) {
        return "DC2D_" + formatFraction(retainFraction);
    }

    static String formatFraction(double fraction) {
        if (!Double.isFinite(fraction)) {
            return String.valueOf(fraction);
        }
        return BigDecimal.valueOf(fraction).stripTrailingZeros().toPlainString();
    }

    /**
     * The number of lowest samples kept out of n valid samples.
     *
     * @param n The number of valid samples
     * @return The number kept, between 1 and <code>max(1, n-1)</code>
     */
    int keepCount(int n) {
        int nKeep = (int) Math.round(retainFraction * n);
        if (nKeep <= 1) {
            return 1;
        }
        return nKeep >= n ? n - 1 : nKeep;
    }

    @Override
    public ReducerResult reduce(FrameStack stack, boolean uncertaintyWanted) throws ReducerValidationException {
        if (!(retainFraction > 0 && retainFraction <= 1)) {
            throw new ReducerValidationException("The retained fraction must be in (0,1], got " + retainFraction);
        }
        int nFrames = stack.getFrameCount();
        int nominal = keepCount(nFrames);
        if (nominal == 1) {
            LOG.info("Keeping only the lowest intensity values per pixel.");
        } else {
            LOG.log(Level.INFO, "Averaging the lowest {0} pixel intensities.", nominal);
        }
        double[] samples = new double[nFrames];
        float[] mean = new float[stack.getPixelCount()];
        float[] variance = uncertaintyWanted ? new float[mean.length] : null;
        for (int p = 0; p < mean.length; p++) {
            stack.samples(p, 0, nFrames, samples);
            int valid = PixelStatistics.compact(samples, nFrames);
            double m;
            double v;
            if (valid == 0) {
                m = v = Double.NaN;
            } else {
                int nKeep = keepCount(valid);
                if (nKeep == 1) {
                    m = v = PixelStatistics.min(samples, valid);
                } else {
                    PixelStatistics.selectLowest(samples, valid, nKeep);
                    m = PixelStatistics.mean(samples, nKeep);
                    v = PixelStatistics.variance(samples, nKeep);
                }
            }
            mean[p] = (float) m;
            if (variance != null) {
                variance[p] = (float) v;
            }
        }
        return ReducerResult.success(getKind(), getLabel(nFrames), stack.getWidth(), stack.getHeight(), mean, variance);
    }
}
