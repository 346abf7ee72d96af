package org.lsst.fits.reduce.reducer;

import java.util.OptionalInt;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.reduce.stack.FrameStack;

/**
 * Median over the sums of contiguous groups of frames. The stack is split
 * into <code>groups</code> groups of <code>floor(N/groups)</code> frames,
 * trailing frames which do not fill a group are left out. Negative group sums
 * are treated as missing. Without an explicit group count the median is
 * taken over the frames themselves.
 *
 * @author tonyj
 */
class GroupedMedianReducer implements Reducer {

    private static final Logger LOG = Logger.getLogger(GroupedMedianReducer.class.getName());

    private final OptionalInt groups;

    GroupedMedianReducer(OptionalInt groups) {
        this.groups = groups;
    }

    @Override
    public ReducerKind getKind() {
        return ReducerKind.GROUPED_MEDIAN;
    }

    @Override
    public String getLabel(int frameCount) {
        return "MED_OF_" + groups.orElse(frameCount);
    }

    @Override
    public ReducerResult reduce(FrameStack stack, boolean uncertaintyWanted) {
        int nFrames = stack.getFrameCount();
        String label = getLabel(nFrames);
        if (uncertaintyWanted) {
            LOG.fine("No uncertainty is computed for the median");
        }
        if (!groups.isPresent()) {
            LOG.log(Level.INFO, "Using the median of {0} images.", nFrames);
            return ReducerResult.success(getKind(), label, stack.getWidth(), stack.getHeight(), frameMedian(stack), null);
        }
        int nGroups = groups.getAsInt();
        if (nGroups <= 1) {
            String message = "More than one group of files is required for the median. Skipping.";
            LOG.info(message);
            return ReducerResult.skipped(getKind(), label, message);
        }
        if (nGroups > nFrames) {
            String message = String.format("%d groups requested but only %d images available. Skipping.", nGroups, nFrames);
            LOG.info(message);
            return ReducerResult.skipped(getKind(), label, message);
        }
        int perGroup = nFrames / nGroups;
        int remainder = nFrames % nGroups;
        for (int g = 0; g < nGroups; g++) {
            LOG.log(Level.FINE, "Taking the sum of group {0}: Images {1} to {2}", new Object[]{g, g * perGroup, g * perGroup + perGroup - 1});
        }
        if (remainder == 1) {
            LOG.info("One file at the end will be omitted.");
        } else if (remainder > 1) {
            LOG.log(Level.INFO, "{0} files at the end will be omitted.", remainder);
        }
        LOG.log(Level.INFO, "Using the median of {0} summed images.", nGroups);

        double[] samples = new double[perGroup];
        double[] groupSums = new double[nGroups];
        float[] median = new float[stack.getPixelCount()];
        for (int p = 0; p < median.length; p++) {
            for (int g = 0; g < nGroups; g++) {
                stack.samples(p, g * perGroup, (g + 1) * perGroup, samples);
                groupSums[g] = groupSum(samples, perGroup);
            }
            median[p] = (float) PixelStatistics.nanMedian(groupSums, nGroups);
        }
        return ReducerResult.success(getKind(), label, stack.getWidth(), stack.getHeight(), median, null);
    }

    // A group without any valid sample has no sum, rather than a sum of zero
    private static double groupSum(double[] samples, int n) {
        int valid = PixelStatistics.compact(samples, n);
        if (valid == 0) {
            return Double.NaN;
        }
        double sum = PixelStatistics.nanSum(samples, valid);
        return sum < 0 ? Double.NaN : sum;
    }

    private static float[] frameMedian(FrameStack stack) {
        int nFrames = stack.getFrameCount();
        double[] samples = new double[nFrames];
        float[] median = new float[stack.getPixelCount()];
        for (int p = 0; p < median.length; p++) {
            stack.samples(p, 0, nFrames, samples);
            median[p] = (float) PixelStatistics.nanMedian(samples, nFrames);
        }
        return median;
    }
}
