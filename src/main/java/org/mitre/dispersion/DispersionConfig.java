package org.mitre.dispersion;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static org.mitre.dispersion.HaversineDistance.haversine;
import static org.mitre.dispersion.InstrumentedMetric.instrument;
import static org.mitre.dispersion.InstrumentedMetric.instrumentAndVerify;

import org.mitre.caasd.commons.LatLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class DispersionConfig {

    static final Logger LOGGER = LoggerFactory.getLogger(DispersionConfig.class);

    /** The number of records the selection should contain. */
    final int nCities;

    /** The separation floor the repair loop enforces. */
    final double minDistanceKm;

    /** The most violations the repair loop acts on before giving up. */
    final int maxRepairIterations;

    /** The DistanceMetric that measures the space between candidate locations. */
    final DistanceMetric<LatLong> distMetric;

    /** When true NaN or negative distances throw IllegalStateExceptions. */
    final boolean verifyDistances;

    /** Receives size-reduction, repair trace, convergence, and unresolved-violation notices. */
    final SelectionListener listener;

    public DispersionConfig() {
        this(builder());
    }

    private DispersionConfig(Builder builder) {
        this.nCities = builder.nCities;
        this.minDistanceKm = builder.minDistanceKm;
        this.maxRepairIterations = builder.maxRepairIterations;
        this.distMetric = builder.distMetric;
        this.verifyDistances = builder.verifyDistances;
        this.listener = builder.listener;

        LOGGER.atInfo()
                .setMessage("DispersionConfig.nCities: {}")
                .addArgument(nCities)
                .log();
        LOGGER.atInfo()
                .setMessage("DispersionConfig.minDistanceKm: {}")
                .addArgument(minDistanceKm)
                .log();
        LOGGER.atInfo()
                .setMessage("DispersionConfig.maxRepairIterations: {}")
                .addArgument(maxRepairIterations)
                .log();
        LOGGER.atInfo()
                .setMessage("DispersionConfig.distMetric: {}")
                .addArgument(distMetric.getClass().getSimpleName())
                .log();
        LOGGER.atInfo()
                .setMessage("DispersionConfig.verifyDistances: {}")
                .addArgument(verifyDistances)
                .log();
        LOGGER.atInfo()
                .setMessage("DispersionConfig.listener: {}")
                .addArgument(listener.getClass().getSimpleName())
                .log();
    }

    public int nCities() {
        return nCities;
    }

    public double minDistanceKm() {
        return minDistanceKm;
    }

    public int maxRepairIterations() {
        return maxRepairIterations;
    }

    /** @return The DistanceMetric provided at construction. */
    public DistanceMetric<LatLong> distMetric() {
        return distMetric;
    }

    public boolean verifyDistances() {
        return verifyDistances;
    }

    /**
     * @return A fresh InstrumentedMetric (with a zeroed call counter) that wraps the DistanceMetric
     *     provided at construction. Each selection run gets its own.
     */
    public InstrumentedMetric<LatLong> newInstrumentedMetric() {
        return verifyDistances ? instrumentAndVerify(distMetric) : instrument(distMetric);
    }

    public SelectionListener listener() {
        return listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        int nCities = 200;
        double minDistanceKm = 500;
        int maxRepairIterations = 10_000;
        boolean verifyDistances = true;
        DistanceMetric<LatLong> distMetric = haversine();
        SelectionListener listener = new LoggingSelectionListener();

        public Builder nCities(int nCities) {
            checkArgument(nCities > 0, "nCities must be positive: %s", nCities);
            this.nCities = nCities;
            return this;
        }

        public Builder minDistanceKm(double minDistanceKm) {
            checkArgument(minDistanceKm > 0, "minDistanceKm must be positive: %s", minDistanceKm);
            this.minDistanceKm = minDistanceKm;
            return this;
        }

        /** Bound the repair loop, when exhausted the best-effort selection is returned. */
        public Builder maxRepairIterations(int maxRepairIterations) {
            checkArgument(maxRepairIterations > 0, "maxRepairIterations must be positive: %s", maxRepairIterations);
            this.maxRepairIterations = maxRepairIterations;
            return this;
        }

        public Builder distMetric(DistanceMetric<LatLong> distMetric) {
            this.distMetric = requireNonNull(distMetric);
            return this;
        }

        /** When true (the default) NaN or negative distances throw IllegalStateExceptions. */
        public Builder verifyDistances(boolean verifyDistances) {
            this.verifyDistances = verifyDistances;
            return this;
        }

        public Builder listener(SelectionListener listener) {
            this.listener = requireNonNull(listener);
            return this;
        }

        public DispersionConfig build() {
            return new DispersionConfig(this);
        }

        /** Equivalent to "new DispersedCitySelector(this.build());" */
        public DispersedCitySelector buildSelector() {
            return new DispersedCitySelector(build());
        }
    }
}
