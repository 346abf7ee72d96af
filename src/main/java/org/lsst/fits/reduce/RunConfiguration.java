package org.lsst.fits.reduce;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import org.lsst.fits.reduce.input.FrameNaming;
import org.lsst.fits.reduce.reducer.ReducerSpec;

/**
 * The settings of one run, fixed before the first location is processed.
 *
 * @author tonyj
 */
public class RunConfiguration {

    public static final String DEFAULT_FILE_TYPE = ".tif";
    public static final String DEFAULT_INPUT_LOCATION = "./";

    private final List<Path> inputLocations;
    private final Path outputLocation;
    private final String fileType;
    private final List<ReducerSpec> reducers;
    private final boolean negativeToNaN;
    private final boolean preview;
    private final boolean parallel;
    private final boolean writeMask;
    private final int verbosity;
    private final String acquisitionMarker;
    private final Boolean fixedAnswer;

    private RunConfiguration(Builder builder) {
        this.inputLocations = builder.inputLocations.isEmpty()
                ? Collections.singletonList(Paths.get(DEFAULT_INPUT_LOCATION))
                : Collections.unmodifiableList(new ArrayList<>(builder.inputLocations));
        this.outputLocation = builder.outputLocation;
        this.fileType = builder.fileType;
        this.reducers = Collections.unmodifiableList(new ArrayList<>(builder.reducers));
        this.negativeToNaN = builder.negativeToNaN;
        this.preview = builder.preview;
        this.parallel = builder.parallel;
        this.writeMask = builder.writeMask;
        this.verbosity = builder.verbosity;
        this.acquisitionMarker = builder.acquisitionMarker;
        this.fixedAnswer = builder.fixedAnswer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<Path> getInputLocations() {
        return inputLocations;
    }

    /**
     * @return The output directory, or empty to write into each input
     * location
     */
    public Optional<Path> getOutputLocation() {
        return Optional.ofNullable(outputLocation);
    }

    public String getFileType() {
        return fileType;
    }

    public List<ReducerSpec> getReducers() {
        return reducers;
    }

    public boolean isNegativeToNaN() {
        return negativeToNaN;
    }

    public boolean isPreview() {
        return preview;
    }

    public boolean isParallel() {
        return parallel;
    }

    public boolean isWriteMask() {
        return writeMask;
    }

    public int getVerbosity() {
        return verbosity;
    }

    public String getAcquisitionMarker() {
        return acquisitionMarker;
    }

    /**
     * @return The answer given to every confirmation, or empty to ask on the
     * console
     */
    public Optional<Boolean> getFixedAnswer() {
        return Optional.ofNullable(fixedAnswer);
    }

    public FrameNaming getFrameNaming() {
        return new FrameNaming(acquisitionMarker);
    }

    @Override
    public String toString() {
        return "RunConfiguration{" + "inputLocations=" + inputLocations + ", outputLocation=" + outputLocation + ", fileType=" + fileType
                + ", reducers=" + reducers + ", negativeToNaN=" + negativeToNaN + ", preview=" + preview + ", parallel=" + parallel
                + ", writeMask=" + writeMask + ", verbosity=" + verbosity + ", acquisitionMarker=" + acquisitionMarker + ", fixedAnswer=" + fixedAnswer + '}';
    }

    public static class Builder {

        private final List<Path> inputLocations = new ArrayList<>();
        private Path outputLocation;
        private String fileType = DEFAULT_FILE_TYPE;
        private final List<ReducerSpec> reducers = new ArrayList<>();
        private boolean negativeToNaN = true;
        private boolean preview = true;
        private boolean parallel = false;
        private boolean writeMask = false;
        private int verbosity = 1;
        private String acquisitionMarker = FrameNaming.DEFAULT_ACQUISITION_MARKER;
        private Boolean fixedAnswer;

        private Builder() {
        }

        public Builder inputLocation(Path location) {
            inputLocations.add(location);
            return this;
        }

        public Builder outputLocation(Path location) {
            this.outputLocation = location;
            return this;
        }

        public Builder fileType(String fileType) {
            this.fileType = fileType;
            return this;
        }

        public Builder reducer(ReducerSpec spec) {
            reducers.add(spec);
            return this;
        }

        public Builder negativeToNaN(boolean negativeToNaN) {
            this.negativeToNaN = negativeToNaN;
            return this;
        }

        public Builder preview(boolean preview) {
            this.preview = preview;
            return this;
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public Builder writeMask(boolean writeMask) {
            this.writeMask = writeMask;
            return this;
        }

        public Builder verbosity(int verbosity) {
            this.verbosity = verbosity;
            return this;
        }

        public Builder acquisitionMarker(String marker) {
            this.acquisitionMarker = marker;
            return this;
        }

        public Builder fixedAnswer(Boolean answer) {
            this.fixedAnswer = answer;
            return this;
        }

        public RunConfiguration build() {
            return new RunConfiguration(this);
        }
    }
}
