package org.lsst.fits.reduce.reducer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import java.util.Arrays;
import java.util.Random;
import org.junit.Test;

/**
 *
 * @author tonyj
 */
public class PixelStatisticsTest {

    @Test
    public void testNaNIgnoringKernels() {
        double[] values = {2, Double.NaN, 4, Double.NaN, 9};
        assertEquals(15, PixelStatistics.nanSum(values.clone(), 5), 0);
        assertEquals(5, PixelStatistics.nanMean(values.clone(), 5), 1e-12);
        assertEquals(26.0 / 3, PixelStatistics.nanVariance(values.clone(), 5), 1e-12);
        assertEquals(4, PixelStatistics.nanMedian(values.clone(), 5), 0);
    }

    @Test
    public void testAllNaN() {
        double[] values = {Double.NaN, Double.NaN};
        assertEquals(0, PixelStatistics.nanSum(values, 2), 0);
        assertTrue(Double.isNaN(PixelStatistics.nanMean(values, 2)));
        assertTrue(Double.isNaN(PixelStatistics.nanMedian(values, 2)));
        assertTrue(Double.isNaN(PixelStatistics.min(values, 0)));
    }

    @Test
    public void testMedianOfEvenCount() {
        assertEquals(2.5, PixelStatistics.nanMedian(new double[]{4, 1, 3, 2}, 4), 0);
    }

    @Test
    public void testSelectLowest() {
        Random random = new Random(42);
        for (int trial = 0; trial < 200; trial++) {
            int n = 1 + random.nextInt(30);
            int k = 1 + random.nextInt(n);
            double[] values = new double[n];
            for (int i = 0; i < n; i++) {
                // small range so that there are plenty of ties
                values[i] = random.nextInt(8);
            }
            double[] sorted = values.clone();
            Arrays.sort(sorted);
            PixelStatistics.selectLowest(values, n, k);
            double[] lowest = Arrays.copyOf(values, k);
            Arrays.sort(lowest);
            assertEquals(Arrays.toString(sorted) + " k=" + k, Arrays.toString(Arrays.copyOf(sorted, k)), Arrays.toString(lowest));
        }
    }
}
