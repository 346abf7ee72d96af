package org.lsst.fits.reduce.output;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.reduce.ConfirmationProvider;
import org.lsst.fits.reduce.Timed;
import org.lsst.fits.reduce.input.FrameNaming;
import org.lsst.fits.reduce.input.ResolvedInput;
import org.lsst.fits.reduce.io.Frame;
import org.lsst.fits.reduce.io.FrameFormat;
import org.lsst.fits.reduce.reducer.ReducerResult;

/**
 * Writes reduced images next to each other in an output directory, named
 * after the range of input frames and the reducer which produced them, for
 * example <code>sample_ct_00001_to_00010_AVG.tif</code>. Existing files are
 * only replaced once the operator agrees.
 *
 * @author tonyj
 */
public class OutputManager {

    private static final Logger LOG = Logger.getLogger(OutputManager.class.getName());
    public static final String VARIANCE_SUFFIX = "_VAR";
    public static final String MASK_SUFFIX = "_MASK";

    private final FrameNaming naming;
    private final ConfirmationProvider confirmation;

    public OutputManager(FrameNaming naming, ConfirmationProvider confirmation) {
        this.naming = naming;
        this.confirmation = confirmation;
    }

    /**
     * Write every successful result, and its variance image if it has one.
     *
     * @param input The frames the results were computed from
     * @param outputDirectory Where to write, created if missing
     * @param results The reducer results, in order
     * @return The outcome for each file, in the order written
     * @throws IOException If the frame names do not allow an output name to
     * be derived, or a file cannot be written
     */
    public Map<Path, WriteOutcome> writeResults(ResolvedInput input, Path outputDirectory, List<ReducerResult> results) throws IOException {
        LOG.info("Starting file output...");
        String base = baseName(input);
        Map<Path, WriteOutcome> outcomes = new LinkedHashMap<>();
        for (ReducerResult result : results) {
            if (!result.isSuccess()) {
                LOG.log(Level.FINE, "Nothing to write for {0}", result);
                continue;
            }
            Path file = outputDirectory.resolve(base + "_" + result.getLabel() + input.getExtension());
            outcomes.put(file, save(file, new Frame(result.getWidth(), result.getHeight(), result.getValue()), input.getFormat()));
            Optional<float[]> variance = result.getVariance();
            if (variance.isPresent()) {
                Path varFile = outputDirectory.resolve(base + "_" + result.getLabel() + VARIANCE_SUFFIX + input.getExtension());
                outcomes.put(varFile, save(varFile, new Frame(result.getWidth(), result.getHeight(), variance.get()), input.getFormat()));
            }
        }
        return outcomes;
    }

    /**
     * Write the valid pixel mask of a run.
     *
     * @param input The frames the mask was computed from
     * @param outputDirectory Where to write, created if missing
     * @param mask The mask image
     * @return The file written and what happened to it
     * @throws IOException If the file cannot be written
     */
    public Map.Entry<Path, WriteOutcome> writeMask(ResolvedInput input, Path outputDirectory, Frame mask) throws IOException {
        Path file = outputDirectory.resolve(baseName(input) + MASK_SUFFIX + input.getExtension());
        return Map.entry(file, save(file, mask, input.getFormat()));
    }

    String baseName(ResolvedInput input) throws IOException {
        return naming.outputBaseName(input.getFirstFrameName(), input.getLastFrameName(), input.getExtension());
    }

    /**
     * Save one image, asking first if the file already exists.
     *
     * @param file The target file
     * @param frame The image
     * @param format The format to write
     * @return Whether the file was written
     * @throws IOException If the file cannot be written
     */
    public WriteOutcome save(Path file, Frame frame, FrameFormat format) throws IOException {
        String name = file.getFileName().toString();
        if (Files.exists(file) && !confirmation.confirm("File " + name + " exists and will be overwritten. Continue?", true)) {
            LOG.log(Level.INFO, "Output file {0} was not written.", name);
            return WriteOutcome.DECLINED;
        }
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Timed.execute(() -> {
            format.getCodec().write(file, frame);
            return null;
        }, "Writing %s took %dms", name);
        LOG.log(Level.INFO, "File {0} was written.", name);
        return WriteOutcome.WRITTEN;
    }
}
