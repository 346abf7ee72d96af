package org.lsst.fits.reduce.reducer;

import java.util.Optional;

/**
 * The outcome of running one reducer over a frame stack.
 *
 * @author tonyj
 */
public class ReducerResult {

    private final ReducerKind kind;
    private final String label;
    private final ReducerStatus status;
    private final String message;
    private final int width;
    private final int height;
    private final float[] value;
    private final float[] variance;

    private ReducerResult(ReducerKind kind, String label, ReducerStatus status, String message, int width, int height, float[] value, float[] variance) {
        this.kind = kind;
        this.label = label;
        this.status = status;
        this.message = message;
        this.width = width;
        this.height = height;
        this.value = value;
        this.variance = variance;
    }

    static ReducerResult success(ReducerKind kind, String label, int width, int height, float[] value, float[] variance) {
        return new ReducerResult(kind, label, ReducerStatus.SUCCESS, null, width, height, value, variance);
    }

    static ReducerResult skipped(ReducerKind kind, String label, String message) {
        return new ReducerResult(kind, label, ReducerStatus.SKIPPED, message, 0, 0, null, null);
    }

    static ReducerResult failed(ReducerKind kind, String label, String message) {
        return new ReducerResult(kind, label, ReducerStatus.FAILED, message, 0, 0, null, null);
    }

    public ReducerKind getKind() {
        return kind;
    }

    /**
     * The display label, e.g. <code>MED_OF_3</code>. Output file names are
     * built from it.
     *
     * @return The label
     */
    public String getLabel() {
        return label;
    }

    public ReducerStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == ReducerStatus.SUCCESS;
    }

    /**
     * @return Why the reducer was skipped or failed, null on success
     */
    public String getMessage() {
        return message;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * @return The reduced image, row major, null unless successful
     */
    public float[] getValue() {
        return value;
    }

    public Optional<float[]> getVariance() {
        return Optional.ofNullable(variance);
    }

    @Override
    public String toString() {
        return "ReducerResult{" + "label=" + label + ", status=" + status + (message == null ? "" : ", message=" + message) + '}';
    }
}
