package org.lsst.fits.reduce.preview;

import java.awt.GraphicsEnvironment;
import java.util.logging.Logger;
import org.lsst.fits.reduce.reducer.ReducerResult;

/**
 * Shows reduced images while the reducer queue is running. Showing a result
 * never blocks, {@link #awaitDismissal()} waits until the operator has closed
 * everything shown.
 *
 * @author tonyj
 */
public interface PreviewDisplay {

    PreviewDisplay NONE = new PreviewDisplay() {
        @Override
        public void show(ReducerResult result) {
        }

        @Override
        public void awaitDismissal() {
        }
    };

    void show(ReducerResult result);

    void awaitDismissal() throws InterruptedException;

    /**
     * Create the preview display for a run.
     *
     * @param enabled Whether preview was requested
     * @return A Swing preview, or {@link #NONE} if disabled or no display is
     * available
     */
    static PreviewDisplay create(boolean enabled) {
        if (!enabled) {
            return NONE;
        }
        if (GraphicsEnvironment.isHeadless()) {
            Logger.getLogger(PreviewDisplay.class.getName()).warning("No display available, preview disabled");
            return NONE;
        }
        return new SwingPreview();
    }
}
