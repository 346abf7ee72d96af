package org.lsst.fits.reduce.reducer;

import org.lsst.fits.reduce.stack.FrameStack;

/**
 * Collapses a frame stack along the frame axis into a single image, and
 * optionally a variance image.
 *
 * @author tonyj
 */
public interface Reducer {

    ReducerKind getKind();

    /**
     * The display label for this reducer applied to a stack of the given
     * size.
     *
     * @param frameCount The number of frames in the stack
     * @return The label, e.g. <code>DC2D_0.9999</code>
     */
    String getLabel(int frameCount);

    ReducerResult reduce(FrameStack stack, boolean uncertaintyWanted) throws ReducerValidationException;
}
