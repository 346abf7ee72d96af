package org.lsst.fits.reduce.reducer;

import org.lsst.fits.reduce.stack.FrameStack;

/**
 * Per pixel arithmetic mean over all frames, NaN ignored, with the population
 * variance as uncertainty.
 *
 * @author tonyj
 */
class MeanReducer implements Reducer {

    @Override
    public ReducerKind getKind() {
        return ReducerKind.MEAN;
    }

    @Override
    public String getLabel(int frameCount) {
        return "AVG";
    }

    @Override
    public ReducerResult reduce(FrameStack stack, boolean uncertaintyWanted) {
        int nFrames = stack.getFrameCount();
        double[] samples = new double[nFrames];
        float[] mean = new float[stack.getPixelCount()];
        float[] variance = uncertaintyWanted ? new float[mean.length] : null;
        for (int p = 0; p < mean.length; p++) {
            stack.samples(p, 0, nFrames, samples);
            int valid = PixelStatistics.compact(samples, nFrames);
            mean[p] = (float) PixelStatistics.mean(samples, valid);
            if (variance != null) {
                variance[p] = (float) PixelStatistics.variance(samples, valid);
            }
        }
        return ReducerResult.success(getKind(), getLabel(nFrames), stack.getWidth(), stack.getHeight(), mean, variance);
    }
}
