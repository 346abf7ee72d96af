package org.lsst.fits.reduce;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.reduce.input.InputResolver;
import org.lsst.fits.reduce.input.ResolutionException;
import org.lsst.fits.reduce.input.ResolvedInput;
import org.lsst.fits.reduce.io.CachingFrameReader;
import org.lsst.fits.reduce.io.Frame;
import org.lsst.fits.reduce.output.OutputManager;
import org.lsst.fits.reduce.output.WriteOutcome;
import org.lsst.fits.reduce.preview.PreviewDisplay;
import org.lsst.fits.reduce.reducer.ReducerEngine;
import org.lsst.fits.reduce.reducer.ReducerResult;
import org.lsst.fits.reduce.stack.FrameStack;
import org.lsst.fits.reduce.stack.FrameStackLoader;

/**
 * Runs resolve, load, reduce and output for each input location in turn. A
 * location which fails does not stop the following ones, and a scratch
 * directory created for a location is always cleaned up before moving on.
 *
 * @author tonyj
 */
public class Orchestrator {

    private static final Logger LOG = Logger.getLogger(Orchestrator.class.getName());

    private final RunConfiguration config;
    private final InputResolver resolver;
    private final FrameStackLoader loader;
    private final ReducerEngine engine;
    private final OutputManager output;

    public Orchestrator(RunConfiguration config, ConfirmationProvider confirmation, PreviewDisplay preview) {
        this(config, confirmation, preview, new CachingFrameReader());
    }

    Orchestrator(RunConfiguration config, ConfirmationProvider confirmation, PreviewDisplay preview, CachingFrameReader reader) {
        this.config = config;
        this.resolver = new InputResolver(config.getFrameNaming(), confirmation);
        this.loader = new FrameStackLoader(reader);
        this.engine = new ReducerEngine(config.isNegativeToNaN(), config.isParallel(), preview);
        this.output = new OutputManager(config.getFrameNaming(), confirmation);
    }

    /**
     * Process every configured input location.
     *
     * @return One summary per location, in order
     * @throws InterruptedException If interrupted while waiting for the
     * preview to be dismissed
     */
    public List<LocationSummary> run() throws InterruptedException {
        List<LocationSummary> summaries = new ArrayList<>();
        for (Path location : config.getInputLocations()) {
            LocationSummary summary = process(location);
            LOG.info(summary::toString);
            summaries.add(summary);
        }
        return summaries;
    }

    LocationSummary process(Path location) throws InterruptedException {
        LOG.log(Level.INFO, "Processing {0}", location);
        Path outputLocation = config.getOutputLocation().orElse(location);
        List<ReducerResult> results = Collections.emptyList();
        Map<Path, WriteOutcome> outputs = new LinkedHashMap<>();
        LocationSummary.Status status = LocationSummary.Status.COMPLETED;
        String message = null;
        try (RunContext context = new RunContext(location, outputLocation)) {
            try {
                ResolvedInput input = resolver.resolve(location, config.getFileType());
                context.setInput(input);
                FrameStack stack = Timed.execute(Level.INFO, () -> loader.load(input.getFrames(), input.getFormat()),
                        "File input finished in %dms.");
                context.setStack(stack);
                results = engine.run(stack, config.getReducers());
                outputs.putAll(output.writeResults(input, context.getOutputLocation(), results));
                if (config.isWriteMask()) {
                    Frame mask = new Frame(stack.getWidth(), stack.getHeight(), stack.validPixelMask());
                    Map.Entry<Path, WriteOutcome> written = output.writeMask(input, context.getOutputLocation(), mask);
                    outputs.put(written.getKey(), written.getValue());
                }
                LOG.info("File output finished.");
            } catch (ResolutionException x) {
                LOG.log(Level.WARNING, "{0}. Skipping {1}.", new Object[]{x.getMessage(), location});
                status = LocationSummary.Status.NO_INPUT;
                message = x.getMessage();
            } catch (IOException x) {
                LOG.log(Level.SEVERE, "Processing of " + location + " failed", x);
                status = LocationSummary.Status.FAILED;
                message = String.valueOf(x.getMessage());
            }
        } catch (IOException x) {
            LOG.log(Level.SEVERE, "Cleaning up after " + location + " failed", x);
            status = LocationSummary.Status.FAILED;
            message = "Cleanup failed: " + x.getMessage();
        }
        return new LocationSummary(location, status, message, results, outputs);
    }
}
