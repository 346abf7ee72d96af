package org.lsst.fits.reduce.reducer;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import java.util.Arrays;
import org.junit.Test;
import org.lsst.fits.reduce.stack.FrameStack;

/**
 *
 * @author tonyj
 */
public class ReducerTest {

    private static final float DELTA = 1e-5f;

    private static ReducerResult reduce(ReducerSpec spec, FrameStack stack) throws ReducerValidationException {
        return spec.createReducer().reduce(stack, spec.isUncertaintyWanted());
    }

    /**
     * One frame per value, every pixel of frame i equal to values[i].
     */
    private static FrameStack constantStack(int width, int height, float... values) {
        float[][] frames = new float[values.length][];
        for (int i = 0; i < values.length; i++) {
            frames[i] = new float[width * height];
            Arrays.fill(frames[i], values[i]);
        }
        return FrameStack.of(width, height, frames);
    }

    @Test
    public void testSumIsFrameCountTimesMean() throws ReducerValidationException {
        FrameStack stack = FrameStack.of(2, 2,
                new float[]{1, 2, 3, 4},
                new float[]{0.5f, 7, 11, 2},
                new float[]{9, 1, 0, 3});
        ReducerResult sum = reduce(ReducerSpec.sum(false), stack);
        ReducerResult mean = reduce(ReducerSpec.mean(false), stack);
        for (int p = 0; p < 4; p++) {
            assertEquals(3 * mean.getValue()[p], sum.getValue()[p], DELTA);
        }
        assertEquals(10.5f, sum.getValue()[0], DELTA);
    }

    @Test
    public void testSumVarianceIsTheSum() throws ReducerValidationException {
        FrameStack stack = constantStack(2, 1, 1, 2, 3);
        ReducerResult sum = reduce(ReducerSpec.sum(true), stack);
        assertTrue(sum.getVariance().isPresent());
        assertArrayEquals(sum.getValue(), sum.getVariance().get(), 0f);
        assertFalse(reduce(ReducerSpec.sum(false), stack).getVariance().isPresent());
    }

    @Test
    public void testMeanAndPopulationVariance() throws ReducerValidationException {
        ReducerResult mean = reduce(ReducerSpec.mean(true), constantStack(4, 4, 0, 1, 2, 3, 4, 5, 6, 7, 8, 9));
        for (int p = 0; p < 16; p++) {
            assertEquals(4.5f, mean.getValue()[p], DELTA);
            assertEquals(8.25f, mean.getVariance().get()[p], DELTA);
        }
        assertEquals("AVG", mean.getLabel());
    }

    @Test
    public void testMeanIgnoresNaN() throws ReducerValidationException {
        FrameStack stack = FrameStack.of(2, 1,
                new float[]{1, Float.NaN},
                new float[]{3, Float.NaN});
        ReducerResult mean = reduce(ReducerSpec.mean(false), stack);
        assertEquals(2f, mean.getValue()[0], DELTA);
        assertTrue(Float.isNaN(mean.getValue()[1]));
    }

    @Test
    public void testTrimmedMeanAlwaysDropsTheHighest() throws ReducerValidationException {
        ReducerResult result = reduce(ReducerSpec.trimmedMean(1.0, false), constantStack(3, 2, 3, 5, 1, 4, 2));
        for (float v : result.getValue()) {
            assertEquals(2.5f, v, DELTA);
        }
        assertEquals("DC2D_1", result.getLabel());
    }

    @Test
    public void testTrimmedMeanKeepingOneIsTheMinimum() throws ReducerValidationException {
        int n = 100;
        float[][] frames = new float[n][];
        for (int i = 0; i < n; i++) {
            frames[i] = new float[3];
            for (int p = 0; p < 3; p++) {
                frames[i][p] = ((i * 37 + p * 11) % n) + 10 * p + 1;
            }
        }
        ReducerResult result = reduce(ReducerSpec.trimmedMean(0.01, true), FrameStack.of(3, 1, frames));
        assertArrayEquals(new float[]{1, 11, 21}, result.getValue(), DELTA);
        assertArrayEquals(result.getValue(), result.getVariance().get(), 0f);
    }

    @Test
    public void testTrimmedMeanVariance() throws ReducerValidationException {
        // keep round(0.5*6) = 3 lowest of 6
        ReducerResult result = reduce(ReducerSpec.trimmedMean(0.5, true), constantStack(1, 1, 100, 2, 4, 50, 6, 70));
        assertEquals(4f, result.getValue()[0], DELTA);
        assertEquals(8f / 3, result.getVariance().get()[0], DELTA);
    }

    @Test
    public void testTrimmedMeanKeepCount() {
        TrimmedMeanReducer reducer = new TrimmedMeanReducer(0.9999);
        assertEquals(1, reducer.keepCount(1));
        assertEquals(1, reducer.keepCount(2));
        assertEquals(9, reducer.keepCount(10));
        assertEquals(9999, reducer.keepCount(10000));
        assertEquals(1, new TrimmedMeanReducer(0.01).keepCount(20));
        assertEquals(3, new TrimmedMeanReducer(0.3).keepCount(10));
    }

    @Test
    public void testTrimmedMeanRejectsInvalidFraction() {
        for (double f : new double[]{0, -0.5, 1.5, Double.NaN}) {
            try {
                reduce(ReducerSpec.trimmedMean(f, false), constantStack(1, 1, 1, 2, 3));
                fail("Fraction " + f + " should be rejected");
            } catch (ReducerValidationException x) {
                assertTrue(x.getMessage().contains("(0,1]"));
            }
        }
    }

    @Test
    public void testTrimmedMeanLabels() {
        assertEquals("DC2D_0.9999", new TrimmedMeanReducer(0.9999).getLabel(10));
        assertEquals("DC2D_0.5", new TrimmedMeanReducer(0.5).getLabel(10));
        assertEquals("DC2D_1", new TrimmedMeanReducer(1.0).getLabel(10));
    }

    @Test
    public void testNaNFrameIsTheSameAsARemovedFrame() throws ReducerValidationException {
        float[] a = {1, 8, 3, 0.25f};
        float[] b = {4, 2, 9, 7};
        float[] c = {6, 6, 1, 2};
        float[] d = {2, 5, 5, 12};
        float[] nan = new float[4];
        Arrays.fill(nan, Float.NaN);
        FrameStack withNaN = FrameStack.of(2, 2, a, b, nan, c, d);
        FrameStack without = FrameStack.of(2, 2, a, b, c, d);
        ReducerSpec[] specs = {ReducerSpec.sum(true), ReducerSpec.mean(true), ReducerSpec.trimmedMean(0.5, true), ReducerSpec.trimmedMean(0.9999, true)};
        for (ReducerSpec spec : specs) {
            ReducerResult expected = reduce(spec, without);
            ReducerResult actual = reduce(spec, withNaN);
            assertArrayEquals(spec.toString(), expected.getValue(), actual.getValue(), DELTA);
            assertArrayEquals(spec.toString(), expected.getVariance().get(), actual.getVariance().get(), DELTA);
        }
    }

    @Test
    public void testFrameMedianOfSingleFrame() throws ReducerValidationException {
        float[] frame = {3, -1, 7, 2.5f};
        ReducerResult result = reduce(ReducerSpec.frameMedian(false), FrameStack.of(2, 2, frame));
        assertEquals(ReducerStatus.SUCCESS, result.getStatus());
        assertArrayEquals(frame, result.getValue(), 0f);
        assertEquals("MED_OF_1", result.getLabel());
    }

    @Test
    public void testGroupedMedianNeedsTwoGroups() throws ReducerValidationException {
        ReducerResult result = reduce(ReducerSpec.groupedMedian(1, false), constantStack(1, 1, 1, 2, 3));
        assertEquals(ReducerStatus.SKIPPED, result.getStatus());
        assertEquals("MED_OF_1", result.getLabel());
        assertEquals(ReducerStatus.SKIPPED, reduce(ReducerSpec.groupedMedian(0, false), constantStack(1, 1, 1, 2, 3)).getStatus());
    }

    @Test
    public void testGroupedMedianMoreGroupsThanFrames() throws ReducerValidationException {
        ReducerResult result = reduce(ReducerSpec.groupedMedian(4, false), constantStack(1, 1, 1, 2, 3));
        assertEquals(ReducerStatus.SKIPPED, result.getStatus());
    }

    @Test
    public void testGroupedMedianOfSingleFrameGroups() throws ReducerValidationException {
        FrameStack stack = FrameStack.of(2, 1,
                new float[]{-1, 4},
                new float[]{2, 1},
                new float[]{5, 9});
        ReducerResult result = reduce(ReducerSpec.groupedMedian(3, false), stack);
        // the negative sum is dropped, leaving the median of 2 and 5
        assertArrayEquals(new float[]{3.5f, 4}, result.getValue(), DELTA);
        assertEquals("MED_OF_3", result.getLabel());
    }

    @Test
    public void testGroupedMedianOmitsTrailingFrames() throws ReducerValidationException {
        ReducerResult result = reduce(ReducerSpec.groupedMedian(2, true), constantStack(1, 1, 1, 2, 3, 4, 100));
        // groups {1,2} and {3,4}, the last frame is left out
        assertEquals(5f, result.getValue()[0], DELTA);
        assertFalse(result.getVariance().isPresent());
    }

    @Test
    public void testGroupedMedianOfEmptyGroupIsNaN() throws ReducerValidationException {
        FrameStack stack = FrameStack.of(1, 1,
                new float[]{Float.NaN},
                new float[]{Float.NaN},
                new float[]{1},
                new float[]{2});
        ReducerResult result = reduce(ReducerSpec.groupedMedian(2, false), stack);
        assertEquals(3f, result.getValue()[0], DELTA);
    }

    @Test
    public void testFrameMedianLabelUsesFrameCount() throws ReducerValidationException {
        ReducerResult result = reduce(ReducerSpec.frameMedian(false), constantStack(1, 1, 1, 7, 3, 5));
        assertEquals("MED_OF_4", result.getLabel());
        assertEquals(4f, result.getValue()[0], DELTA);
    }

    @Test
    public void testSpecEquality() {
        assertEquals(ReducerSpec.groupedMedian(3, true), ReducerSpec.groupedMedian(3, true));
        assertFalse(ReducerSpec.groupedMedian(3, true).equals(ReducerSpec.groupedMedian(4, true)));
        assertFalse(ReducerSpec.groupedMedian(3, true).equals(ReducerSpec.frameMedian(true)));
        assertEquals(ReducerSpec.trimmedMean(0.5, false), ReducerSpec.trimmedMean(0.5, false));
        assertFalse(ReducerSpec.sum(true).equals(ReducerSpec.sum(false)));
        assertFalse(ReducerSpec.sum(true).equals(ReducerSpec.mean(true)));
        assertEquals("median=3", ReducerSpec.groupedMedian(3, false).describeParameter());
        assertEquals("decosmic2d=0.9999", ReducerSpec.trimmedMean(0.9999, false).describeParameter());
    }
}
