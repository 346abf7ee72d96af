package org.lsst.fits.reduce.reducer;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A request to run one reducer, with its typed parameter and whether an
 * uncertainty image is wanted. One subclass per {@link ReducerKind}.
 *
 * @author tonyj
 */
public abstract class ReducerSpec {

    public static final int DEFAULT_GROUPS = 3;
    public static final double DEFAULT_RETAIN_FRACTION = 0.9999;

    private final ReducerKind kind;
    private final boolean uncertaintyWanted;

    private ReducerSpec(ReducerKind kind, boolean uncertaintyWanted) {
        this.kind = kind;
        this.uncertaintyWanted = uncertaintyWanted;
    }

    public static ReducerSpec sum(boolean uncertaintyWanted) {
        return new Sum(uncertaintyWanted);
    }

    public static ReducerSpec mean(boolean uncertaintyWanted) {
        return new Mean(uncertaintyWanted);
    }

    public static ReducerSpec groupedMedian(int groups, boolean uncertaintyWanted) {
        return new GroupedMedian(OptionalInt.of(groups), uncertaintyWanted);
    }

    /**
     * A median over the individual frames, i.e. one group per frame.
     */
    public static ReducerSpec frameMedian(boolean uncertaintyWanted) {
        return new GroupedMedian(OptionalInt.empty(), uncertaintyWanted);
    }

    public static ReducerSpec trimmedMean(double retainFraction, boolean uncertaintyWanted) {
        return new TrimmedMean(retainFraction, uncertaintyWanted);
    }

    public ReducerKind getKind() {
        return kind;
    }

    public boolean isUncertaintyWanted() {
        return uncertaintyWanted;
    }

    /**
     * @return The parameter for logging, e.g. <code>median=3</code>
     */
    public abstract String describeParameter();

    abstract Reducer createReducer();

    @Override
    public String toString() {
        return kind + "{" + describeParameter() + (uncertaintyWanted ? ", uncertainty" : "") + "}";
    }

    public static final class Sum extends ReducerSpec {

        private Sum(boolean uncertaintyWanted) {
            super(ReducerKind.SUM, uncertaintyWanted);
        }

        @Override
        public String describeParameter() {
            return "sum=true";
        }

        @Override
        Reducer createReducer() {
            return new SumReducer();
        }
    }

    public static final class Mean extends ReducerSpec {

        private Mean(boolean uncertaintyWanted) {
            super(ReducerKind.MEAN, uncertaintyWanted);
        }

        @Override
        public String describeParameter() {
            return "average=true";
        }

        @Override
        Reducer createReducer() {
            return new MeanReducer();
        }
    }

    public static final class GroupedMedian extends ReducerSpec {

        private final OptionalInt groups;

        private GroupedMedian(OptionalInt groups, boolean uncertaintyWanted) {
            super(ReducerKind.GROUPED_MEDIAN, uncertaintyWanted);
            this.groups = groups;
        }

        public OptionalInt getGroups() {
            return groups;
        }

        @Override
        public String describeParameter() {
            return "median=" + (groups.isPresent() ? String.valueOf(groups.getAsInt()) : "all");
        }

        @Override
        Reducer createReducer() {
            return new GroupedMedianReducer(groups);
        }

        @Override
        public boolean equals(Object obj) {
            return super.equals(obj) && groups.equals(((GroupedMedian) obj).groups);
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + groups.hashCode();
        }
    }

    public static final class TrimmedMean extends ReducerSpec {

        private final double retainFraction;

        private TrimmedMean(double retainFraction, boolean uncertaintyWanted) {
            super(ReducerKind.TRIMMED_MEAN, uncertaintyWanted);
            this.retainFraction = retainFraction;
        }

        public double getRetainFraction() {
            return retainFraction;
        }

        @Override
        public String describeParameter() {
            return "decosmic2d=" + TrimmedMeanReducer.formatFraction(retainFraction);
        }

        @Override
        Reducer createReducer() {
            return new TrimmedMeanReducer(retainFraction);
        }

        @Override
        public boolean equals(Object obj) {
            return super.equals(obj) && Double.compare(retainFraction, ((TrimmedMean) obj).retainFraction) == 0;
        }

        @Override
        public int hashCode() {
            return 31 * super.hashCode() + Double.hashCode(retainFraction);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final ReducerSpec other = (ReducerSpec) obj;
        return kind == other.kind && uncertaintyWanted == other.uncertaintyWanted;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, uncertaintyWanted);
    }
}
