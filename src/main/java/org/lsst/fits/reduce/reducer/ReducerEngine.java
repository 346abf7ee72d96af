package org.lsst.fits.reduce.reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.reduce.preview.PreviewDisplay;
import org.lsst.fits.reduce.stack.FrameStack;

/**
 * Runs a queue of reducers over one frame stack. Results come back in
 * submission order whether the reducers ran one after another or
 * concurrently. A failing reducer never stops the others.
 *
 * @author tonyj
 */
public class ReducerEngine {

    private static final Logger LOG = Logger.getLogger(ReducerEngine.class.getName());

    private final boolean negativeToNaN;
    private final boolean parallel;
    private final PreviewDisplay preview;

    public ReducerEngine(boolean negativeToNaN, boolean parallel, PreviewDisplay preview) {
        this.negativeToNaN = negativeToNaN;
        this.parallel = parallel;
        this.preview = preview;
    }

    /**
     * Run every reducer in the queue.
     *
     * @param input The stack to reduce, not modified
     * @param queue The reducers to run, in order
     * @return One result per queue entry, in the same order
     * @throws InterruptedException If interrupted while waiting for the
     * preview to be dismissed
     */
    public List<ReducerResult> run(FrameStack input, List<ReducerSpec> queue) throws InterruptedException {
        LOG.info("Starting averaging...");
        final FrameStack stack = negativeToNaN ? input.maskNegatives() : input;
        List<ReducerResult> results = new ArrayList<>(queue.size());
        if (parallel && queue.size() > 1) {
            int nThreads = Math.min(queue.size(), Integer.getInteger("org.lsst.fits.reduce.reducerThreads", Runtime.getRuntime().availableProcessors()));
            ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, nThreads));
            try {
                List<CompletableFuture<ReducerResult>> futures = new ArrayList<>(queue.size());
                for (ReducerSpec spec : queue) {
                    futures.add(CompletableFuture.supplyAsync(() -> runReducer(spec, stack), executor));
                }
                for (CompletableFuture<ReducerResult> future : futures) {
                    publish(future.join(), results);
                }
            } finally {
                executor.shutdown();
            }
        } else {
            for (ReducerSpec spec : queue) {
                publish(runReducer(spec, stack), results);
            }
        }
        if (results.stream().anyMatch(ReducerResult::isSuccess)) {
            LOG.info("Averaging finished.");
        }
        preview.awaitDismissal();
        return results;
    }

    private void publish(ReducerResult result, List<ReducerResult> results) {
        results.add(result);
        if (result.isSuccess()) {
            preview.show(result);
        }
    }

    ReducerResult runReducer(ReducerSpec spec, FrameStack stack) {
        Reducer reducer = spec.createReducer();
        String label = reducer.getLabel(stack.getFrameCount());
        LOG.log(Level.INFO, "Running {0} with {1}...", new Object[]{spec.getKind(), spec.describeParameter()});
        long start = System.currentTimeMillis();
        try {
            ReducerResult result = reducer.reduce(stack, spec.isUncertaintyWanted());
            if (result.isSuccess()) {
                LOG.log(Level.INFO, "{0} finished in {1}ms.", new Object[]{label, System.currentTimeMillis() - start});
            }
            return result;
        } catch (ReducerValidationException x) {
            LOG.log(Level.WARNING, "{0}: {1}. Skipping.", new Object[]{label, x.getMessage()});
            return ReducerResult.failed(spec.getKind(), label, x.getMessage());
        } catch (RuntimeException x) {
            LOG.log(Level.SEVERE, "Reducer " + label + " failed", x);
            return ReducerResult.failed(spec.getKind(), label, String.valueOf(x));
        }
    }
}
