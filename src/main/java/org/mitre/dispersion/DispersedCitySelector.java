package org.mitre.dispersion;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.LongAdder;

import org.mitre.caasd.commons.LatLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DispersedCitySelector is the public facing entry point of this library. It chains the two
 * selection phases: a greedy max-min pick of nCities records followed by a local repair pass that
 * enforces the minimum distance.
 * <p>
 * Each call to select owns its SelectionSet, its instrumented DistanceMetric, and its warning
 * list exclusively, so one instance may serve concurrent callers. Each selection itself is
 * synchronous and single-threaded.
 */
public class DispersedCitySelector {

    static final Logger LOGGER = LoggerFactory.getLogger(DispersedCitySelector.class);

    final DispersionConfig config;

    /** Distance computations made by every completed selection. */
    private final LongAdder totalDistanceCalls = new LongAdder();

    public DispersedCitySelector(DispersionConfig config) {
        this.config = requireNonNull(config);
    }

    /** Select a dispersed subset of these (already validated) candidates. */
    public DispersionResult select(List<CandidateRecord> candidates) {
        return select(new CandidatePool(candidates));
    }

    /** Select a dispersed subset of this pool. */
    public DispersionResult select(CandidatePool pool) {
        requireNonNull(pool);

        InstrumentedMetric<LatLong> metric = config.newInstrumentedMetric();
        WarningCollector collector = new WarningCollector(config.listener());

        SelectionSet selection = new GreedyDispersionSelector(metric, collector)
                .select(pool, config.nCities());

        RepairOutcome outcome = new LocalRepairOptimizer(metric, collector, config.maxRepairIterations())
                .repair(selection, pool, config.minDistanceKm());

        long distanceCalls = metric.numExecutions();
        totalDistanceCalls.add(distanceCalls);
        SelectionStats stats = SelectionStats.of(selection.locations(), config.distMetric());

        LOGGER.atInfo()
                .setMessage("Post-processing complete after {} iterations ({}), {} distance computations")
                .addArgument(outcome.iterations())
                .addArgument(outcome.status())
                .addArgument(distanceCalls)
                .log();
        LOGGER.atInfo().setMessage("Selection stats:\n{}").addArgument(stats).log();

        return new DispersionResult(selection.records(), collector.warnings, outcome, stats, distanceCalls);
    }

    public DispersionConfig config() {
        return config;
    }

    /** @return The total number of distance computations made by every completed selection. */
    public long distMetricExecutionCount() {
        return totalDistanceCalls.sum();
    }

    /** Forwards every notice to the configured listener while keeping the warnings. */
    private static class WarningCollector implements SelectionListener {

        private final SelectionListener delegate;

        private final List<SelectionWarning> warnings = new ArrayList<>();

        WarningCollector(SelectionListener delegate) {
            this.delegate = delegate;
        }

        @Override
        public void onInsufficientCandidates(InsufficientCandidatesWarning warning) {
            warnings.add(warning);
            delegate.onInsufficientCandidates(warning);
        }

        @Override
        public void onViolation(int iteration, CandidateRecord first, CandidateRecord second, double distanceKm) {
            delegate.onViolation(iteration, first, second, distanceKm);
        }

        @Override
        public void onReplacement(RepairStep step) {
            delegate.onReplacement(step);
        }

        @Override
        public void onConverged(int iterations, double closestDistanceKm) {
            delegate.onConverged(iterations, closestDistanceKm);
        }

        @Override
        public void onUnresolvedViolation(UnresolvedViolationWarning warning) {
            warnings.add(warning);
            delegate.onUnresolvedViolation(warning);
        }
    }
}
