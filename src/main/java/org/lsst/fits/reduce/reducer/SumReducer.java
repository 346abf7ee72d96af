package org.lsst.fits.reduce.reducer;

import org.lsst.fits.reduce.stack.FrameStack;

/**
 * Per pixel sum over all frames, NaN ignored. The variance image is the sum
 * image itself (Poisson counting statistics), not a computed variance.
 *
 * @author tonyj
 */
class SumReducer implements Reducer {

    @Override
    public ReducerKind getKind() {
        return ReducerKind.SUM;
    }

    @Override
    public String getLabel(int frameCount) {
        return "SUM";
    }

    @Override
    public ReducerResult reduce(FrameStack stack, boolean uncertaintyWanted) {
        int nFrames = stack.getFrameCount();
        double[] samples = new double[nFrames];
        float[] sum = new float[stack.getPixelCount()];
        for (int p = 0; p < sum.length; p++) {
            stack.samples(p, 0, nFrames, samples);
            sum[p] = (float) PixelStatistics.nanSum(samples, nFrames);
        }
        float[] variance = uncertaintyWanted ? sum.clone() : null;
        return ReducerResult.success(getKind(), getLabel(nFrames), stack.getWidth(), stack.getHeight(), sum, variance);
    }
}
