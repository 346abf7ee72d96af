package org.lsst.fits.reduce;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.lsst.fits.reduce.output.WriteOutcome;
import org.lsst.fits.reduce.reducer.ReducerResult;
import org.lsst.fits.reduce.reducer.ReducerStatus;

/**
 * What happened to one input location.
 *
 * @author tonyj
 */
public class LocationSummary {

    public enum Status {
        /**
         * Every stage ran, whatever the individual reducers did.
         */
        COMPLETED,
        /**
         * Nothing to process was found.
         */
        NO_INPUT,
        /**
         * An I/O error stopped the location.
         */
        FAILED
    }

    private final Path location;
    private final Status status;
    private final String message;
    private final Map<ReducerStatus, Integer> reducerCounts = new EnumMap<>(ReducerStatus.class);
    private final Map<Path, WriteOutcome> outputs;

    LocationSummary(Path location, Status status, String message, List<ReducerResult> results, Map<Path, WriteOutcome> outputs) {
        this.location = location;
        this.status = status;
        this.message = message;
        for (ReducerStatus s : ReducerStatus.values()) {
            reducerCounts.put(s, 0);
        }
        for (ReducerResult result : results) {
            reducerCounts.merge(result.getStatus(), 1, Integer::sum);
        }
        this.outputs = Collections.unmodifiableMap(outputs);
    }

    public Path getLocation() {
        return location;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return Why the location did not complete, or null
     */
    public String getMessage() {
        return message;
    }

    public int getReducerCount(ReducerStatus status) {
        return reducerCounts.get(status);
    }

    public Map<Path, WriteOutcome> getOutputs() {
        return outputs;
    }

    public long getCount(WriteOutcome outcome) {
        return outputs.values().stream().filter(o -> o == outcome).count();
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        result.append(location).append(": ").append(status);
        if (message != null) {
            result.append(" (").append(message).append(')');
        }
        result.append(", reducers ");
        for (Map.Entry<ReducerStatus, Integer> entry : reducerCounts.entrySet()) {
            result.append(entry.getKey()).append('=').append(entry.getValue()).append(' ');
        }
        result.append("files written=").append(getCount(WriteOutcome.WRITTEN));
        result.append(" declined=").append(getCount(WriteOutcome.DECLINED));
        return result.toString();
    }
}
