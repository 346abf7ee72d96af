package org.lsst.fits.reduce;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.lsst.fits.reduce.input.ResolvedInput;
import org.lsst.fits.reduce.input.ScratchDirectory;
import org.lsst.fits.reduce.stack.FrameStack;

/**
 * State of the run for one input location. Closing it tears down the scratch
 * directory, if an archive was extracted.
 *
 * @author tonyj
 */
public class RunContext implements Closeable {

    private final Path inputLocation;
    private final Path outputLocation;
    private ResolvedInput input;
    private FrameStack stack;

    RunContext(Path inputLocation, Path outputLocation) {
        this.inputLocation = inputLocation;
        this.outputLocation = outputLocation;
    }

    public Path getInputLocation() {
        return inputLocation;
    }

    public Path getOutputLocation() {
        return outputLocation;
    }

    public ResolvedInput getInput() {
        return input;
    }

    void setInput(ResolvedInput input) {
        this.input = input;
    }

    public FrameStack getStack() {
        return stack;
    }

    void setStack(FrameStack stack) {
        this.stack = stack;
    }

    public Optional<ScratchDirectory> getScratchDirectory() {
        return input == null ? Optional.empty() : input.getScratchDirectory();
    }

    @Override
    public void close() throws IOException {
        // Release the stack before the next location is loaded
        stack = null;
        Optional<ScratchDirectory> scratch = getScratchDirectory();
        if (scratch.isPresent()) {
            scratch.get().close();
        }
    }

    @Override
    public String toString() {
        return "RunContext{" + "inputLocation=" + inputLocation + ", outputLocation=" + outputLocation + ", input=" + input + ", stack=" + stack + '}';
    }
}
