package org.mitre.dispersion;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Decorates a DistanceMetric. Every call to "distanceBtw" is counted and (optionally) checked
 * for NaN or negative results.
 *
 * @param <KEY> The type being measured
 */
public class InstrumentedMetric<KEY> implements DistanceMetric<KEY> {

    private final DistanceMetric<KEY> metric;

    private final boolean verifying;

    private long numExecutions;

    private InstrumentedMetric(DistanceMetric<KEY> metric, boolean verifying) {
        this.metric = requireNonNull(metric);
        this.verifying = verifying;
        this.numExecutions = 0;
    }

    /** Wrap this metric so calls are counted. */
    public static <T> InstrumentedMetric<T> instrument(DistanceMetric<T> metric) {
        return new InstrumentedMetric<>(metric, false);
    }

    /** Wrap this metric so calls are counted AND every result is checked. */
    public static <T> InstrumentedMetric<T> instrumentAndVerify(DistanceMetric<T> metric) {
        return new InstrumentedMetric<>(metric, true);
    }

    /**
     * @throws IllegalStateException if verification is on and the distance was negative or NaN
     */
    @Override
    public double distanceBtw(KEY k1, KEY k2) {
        numExecutions++;
        double dist = metric.distanceBtw(k1, k2);

        if (verifying) {
            checkState(!Double.isNaN(dist), "A distance measurement was NaN.");
            checkState(dist >= 0, "A negative distance measurement was observed: %s", dist);
        }
        return dist;
    }

    /**
     * @return The number of times distanceBtw was called. This is useful when measuring how much
     *     work the greedy selection and the repair loop perform.
     */
    public long numExecutions() {
        return numExecutions;
    }

    public boolean isVerifying() {
        return verifying;
    }

    /** @return The DistanceMetric provided at construction time. */
    public DistanceMetric<KEY> innerMetric() {
        return metric;
    }
}
