package org.lsst.fits.reduce.output;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lsst.fits.reduce.FixedConfirmationProvider;
import org.lsst.fits.reduce.FrameFixtures;
import org.lsst.fits.reduce.ScriptedConfirmationProvider;
import org.lsst.fits.reduce.input.FrameNaming;
import org.lsst.fits.reduce.input.InputResolver;
import org.lsst.fits.reduce.input.ResolvedInput;
import org.lsst.fits.reduce.io.Frame;
import org.lsst.fits.reduce.io.FrameFormat;
import org.lsst.fits.reduce.preview.PreviewDisplay;
import org.lsst.fits.reduce.reducer.ReducerEngine;
import org.lsst.fits.reduce.reducer.ReducerResult;
import org.lsst.fits.reduce.reducer.ReducerSpec;
import org.lsst.fits.reduce.stack.FrameStack;

/**
 *
 * @author tonyj
 */
public class OutputManagerTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private ResolvedInput input(Path dir) throws IOException {
        FrameFixtures.writeIndexFrames(dir, "popc", 3, 2, 2, FrameFormat.FITS, ".fits");
        return new InputResolver(new FrameNaming(), FixedConfirmationProvider.ASSUME_YES).resolve(dir, ".fits");
    }

    private static List<ReducerResult> results(boolean uncertainty) throws InterruptedException {
        FrameStack stack = FrameStack.of(2, 2, new float[]{0, 0, 0, 0}, new float[]{1, 1, 1, 1}, new float[]{2, 2, 2, 8});
        List<ReducerSpec> queue = Arrays.asList(ReducerSpec.mean(uncertainty), ReducerSpec.groupedMedian(1, uncertainty), ReducerSpec.frameMedian(uncertainty));
        return new ReducerEngine(true, false, PreviewDisplay.NONE).run(stack, queue);
    }

    @Test
    public void testWriteResults() throws IOException, InterruptedException {
        Path dir = folder.getRoot().toPath();
        ResolvedInput input = input(dir);
        Path out = dir.resolve("reduced");
        Map<Path, WriteOutcome> outcomes = new OutputManager(new FrameNaming(), new ScriptedConfirmationProvider()).writeResults(input, out, results(true));
        Path avg = out.resolve("popc_ct_00000_to_00002_AVG.fits");
        Path avgVar = out.resolve("popc_ct_00000_to_00002_AVG_VAR.fits");
        Path median = out.resolve("popc_ct_00000_to_00002_MED_OF_3.fits");
        assertEquals(Arrays.asList(avg, avgVar, median), new ArrayList<>(outcomes.keySet()));
        for (WriteOutcome outcome : outcomes.values()) {
            assertEquals(WriteOutcome.WRITTEN, outcome);
        }
        Frame mean = FrameFormat.FITS.getCodec().read(avg);
        assertArrayEquals(new float[]{1, 1, 1, 3}, mean.getPixels(), 1e-6f);
        Frame variance = FrameFormat.FITS.getCodec().read(avgVar);
        assertEquals(2f / 3, variance.getPixel(0, 0), 1e-6f);
        assertFalse(Files.exists(out.resolve("popc_ct_00000_to_00002_MED_OF_1.fits")));
        assertFalse(Files.exists(out.resolve("popc_ct_00000_to_00002_MED_OF_3_VAR.fits")));
    }

    @Test
    public void testNoVarianceWithoutUncertainty() throws IOException, InterruptedException {
        Path dir = folder.getRoot().toPath();
        ResolvedInput input = input(dir);
        Map<Path, WriteOutcome> outcomes = new OutputManager(new FrameNaming(), new ScriptedConfirmationProvider()).writeResults(input, dir, results(false));
        assertEquals(2, outcomes.size());
        assertFalse(Files.exists(dir.resolve("popc_ct_00000_to_00002_AVG_VAR.fits")));
    }

    @Test
    public void testDeclinedOverwriteLeavesFileUntouched() throws IOException, InterruptedException {
        Path dir = folder.getRoot().toPath();
        ResolvedInput input = input(dir);
        Path avg = dir.resolve("popc_ct_00000_to_00002_AVG.fits");
        byte[] original = "previous result".getBytes(StandardCharsets.US_ASCII);
        Files.write(avg, original);

        ScriptedConfirmationProvider confirmation = new ScriptedConfirmationProvider(false);
        Map<Path, WriteOutcome> outcomes = new OutputManager(new FrameNaming(), confirmation).writeResults(input, dir, results(false));
        assertEquals(WriteOutcome.DECLINED, outcomes.get(avg));
        assertEquals(WriteOutcome.WRITTEN, outcomes.get(dir.resolve("popc_ct_00000_to_00002_MED_OF_3.fits")));
        assertArrayEquals(original, Files.readAllBytes(avg));
        assertEquals(Arrays.asList("File popc_ct_00000_to_00002_AVG.fits exists and will be overwritten. Continue?"), confirmation.getQuestions());
    }

    @Test
    public void testConfirmedOverwrite() throws IOException {
        Path file = folder.getRoot().toPath().resolve("x_ct_1_to_2_SUM.fits");
        Files.write(file, new byte[20000]);
        OutputManager output = new OutputManager(new FrameNaming(), new ScriptedConfirmationProvider(true));
        assertEquals(WriteOutcome.WRITTEN, output.save(file, FrameFixtures.constant(3, 3, 7), FrameFormat.FITS));
        assertEquals(7, FrameFormat.FITS.getCodec().read(file).getPixel(2, 2), 0);
    }

    @Test
    public void testWriteMask() throws IOException {
        Path dir = folder.getRoot().toPath();
        ResolvedInput input = input(dir);
        Map.Entry<Path, WriteOutcome> written = new OutputManager(new FrameNaming(), new ScriptedConfirmationProvider())
                .writeMask(input, dir, new Frame(2, 1, new float[]{1, 0}));
        assertEquals(dir.resolve("popc_ct_00000_to_00002_MASK.fits"), written.getKey());
        assertEquals(WriteOutcome.WRITTEN, written.getValue());
        assertTrue(Files.exists(written.getKey()));
    }
}
