package org.lsst.fits.reduce.reducer;

import java.util.Arrays;

/**
 * NaN ignoring statistics over the samples of one pixel. Every method works on
 * the first <code>n</code> entries of the array and may reorder them.
 *
 * @author tonyj
 */
final class PixelStatistics {

    private PixelStatistics() {
    }

    /**
     * Move the non-NaN samples to the front of the array.
     *
     * @return The number of non-NaN samples
     */
    static int compact(double[] values, int n) {
        int valid = 0;
        for (int i = 0; i < n; i++) {
            if (!Double.isNaN(values[i])) {
                values[valid++] = values[i];
            }
        }
        return valid;
    }

    /**
     * Sum of the non-NaN samples, zero if there are none.
     */
    static double nanSum(double[] values, int n) {
        double sum = 0;
        for (int i = 0; i < n; i++) {
            if (!Double.isNaN(values[i])) {
                sum += values[i];
            }
        }
        return sum;
    }

    static double nanMean(double[] values, int n) {
        int valid = compact(values, n);
        return mean(values, valid);
    }

    /**
     * Population variance (divisor n) of the non-NaN samples.
     */
    static double nanVariance(double[] values, int n) {
        int valid = compact(values, n);
        return variance(values, valid);
    }

    static double nanMedian(double[] values, int n) {
        int valid = compact(values, n);
        if (valid == 0) {
            return Double.NaN;
        }
        Arrays.sort(values, 0, valid);
        int center = (valid - 1) / 2;
        return valid % 2 == 1 ? values[center] : 0.5 * (values[center] + values[center + 1]);
    }

    static double min(double[] values, int n) {
        double min = Double.POSITIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            min = Math.min(min, values[i]);
        }
        return n == 0 ? Double.NaN : min;
    }

    /**
     * Mean of the first n samples, which must not contain NaN.
     */
    static double mean(double[] values, int n) {
        if (n == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = 0; i < n; i++) {
            sum += values[i];
        }
        return sum / n;
    }

    /**
     * Population variance of the first n samples, which must not contain NaN.
     */
    static double variance(double[] values, int n) {
        if (n == 0) {
            return Double.NaN;
        }
        double mean = mean(values, n);
        double sum = 0;
        for (int i = 0; i < n; i++) {
            double d = values[i] - mean;
            sum += d * d;
        }
        return sum / n;
    }

    /**
     * Partially order the first n samples so that the k smallest occupy
     * positions 0 to k-1, in no particular order (quick select).
     */
    static void selectLowest(double[] values, int n, int k) {
        int left = 0;
        int right = n - 1;
        while (left < right) {
            int pivotIndex = partition(values, left, right, left + (right - left) / 2);
            if (pivotIndex == k - 1 || pivotIndex == k) {
                return;
            } else if (pivotIndex < k) {
                left = pivotIndex + 1;
            } else {
                right = pivotIndex - 1;
            }
        }
    }

    private static int partition(double[] values, int left, int right, int pivotIndex) {
        double pivot = values[pivotIndex];
        swap(values, pivotIndex, right);
        int store = left;
        for (int i = left; i < right; i++) {
            if (values[i] < pivot) {
                swap(values, store++, i);
            }
        }
        swap(values, right, store);
        return store;
    }

    private static void swap(double[] values, int i, int j) {
        double t = values[i];
        values[i] = values[j];
        values[j] = t;
    }
}
