package org.mitre.dispersion;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static org.mitre.dispersion.GreedyDispersionSelector.beats;
import static org.mitre.dispersion.RepairOutcome.Status.*;

import java.util.ArrayList;
import java.util.List;

import org.mitre.caasd.commons.LatLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repairs a selection so that no two members are closer than a minimum distance.
 * <p>
 * Each iteration finds the closest pair in the selection. If that pair is too close, the less
 * populous member is swapped for the unselected candidate that is farthest from every other
 * member. The swap is only accepted when the newcomer's nearest-member distance strictly beats the
 * violating distance. The loop ends when the selection is CONVERGED, when no candidate improves
 * the violation (STALLED), or when the iteration budget runs out (BUDGET_EXHAUSTED).
 * <p>
 * The selection's size never changes, records are only swapped in place.
 */
public class LocalRepairOptimizer {

    static final Logger LOGGER = LoggerFactory.getLogger(LocalRepairOptimizer.class);

    private final DistanceMetric<LatLong> metric;

    private final SelectionListener listener;

    private final int maxIterations;

    public LocalRepairOptimizer(DistanceMetric<LatLong> metric, SelectionListener listener, int maxIterations) {
        checkArgument(maxIterations > 0, "maxIterations must be positive");
        this.metric = requireNonNull(metric);
        this.listener = requireNonNull(listener);
        this.maxIterations = maxIterations;
    }

    /**
     * Mutate this selection until every pair of members is at least minDistanceKm apart (or no
     * further improvement is possible).
     *
     * @param selection     The selection to repair in place, every member must be in the pool
     * @param pool          The candidates that may be swapped in
     * @param minDistanceKm The separation floor
     *
     * @return How the repair ended. Anything other than CONVERGED is also reported to the
     *     listener as an UnresolvedViolationWarning.
     */
    public RepairOutcome repair(SelectionSet selection, CandidatePool pool, double minDistanceKm) {
        requireNonNull(selection);
        requireNonNull(pool);
        checkArgument(minDistanceKm > 0, "minDistanceKm must be positive: %s", minDistanceKm);
        for (String id : selection.ids()) {
            checkArgument(pool.contains(id), "Selected id %s is not in the candidate pool", id);
        }

        LOGGER.atInfo()
                .setMessage("Starting post-processing to ensure minimum distance of {} km between cities")
                .addArgument(minDistanceKm)
                .log();

        List<RepairStep> steps = new ArrayList<>();
        int iteration = 0;

        while (true) {
            ClosestPair pair = ClosestPair.find(selection, metric);

            if (pair == null || pair.distance() >= minDistanceKm) {
                double closest = (pair == null) ? Double.POSITIVE_INFINITY : pair.distance();
                listener.onConverged(iteration, closest);
                return new RepairOutcome(CONVERGED, iteration, closest, steps);
            }

            CandidateRecord first = selection.get(pair.first());
            CandidateRecord second = selection.get(pair.second());

            if (iteration >= maxIterations) {
                return unresolved(first, second, pair, BUDGET_EXHAUSTED, iteration, steps);
            }

            iteration++;
            listener.onViolation(iteration, first, second, pair.distance());

            int target = removalTarget(selection, pair);
            Replacement best = bestReplacement(selection, pool, target);

            if (best == null || best.score <= pair.distance()) {
                return unresolved(first, second, pair, STALLED, iteration, steps);
            }

            CandidateRecord removed = selection.replace(target, best.candidate);
            RepairStep step = new RepairStep(iteration, removed, best.candidate, pair.distance(), best.score);
            steps.add(step);
            listener.onReplacement(step);
        }
    }

    private RepairOutcome unresolved(
            CandidateRecord first,
            CandidateRecord second,
            ClosestPair pair,
            RepairOutcome.Status status,
            int iteration,
            List<RepairStep> steps) {

        listener.onUnresolvedViolation(new UnresolvedViolationWarning(first, second, pair.distance(), status));
        return new RepairOutcome(status, iteration, pair.distance(), steps);
    }

    /**
     * @return The position of the member to drop: the less populous one. On equal population the
     *     member whose id sorts later is dropped.
     */
    static int removalTarget(SelectionSet selection, ClosestPair pair) {
        CandidateRecord a = selection.get(pair.first());
        CandidateRecord b = selection.get(pair.second());

        if (a.population() != b.population()) {
            return a.population() < b.population() ? pair.first() : pair.second();
        }
        return a.id().compareTo(b.id()) > 0 ? pair.first() : pair.second();
    }

    /**
     * Find the unselected candidate whose distance to its nearest member (ignoring the member at
     * freeSlot) is largest. Ties go to the smaller id.
     *
     * @return The best replacement, or null when every candidate is already selected
     */
    private Replacement bestReplacement(SelectionSet selection, CandidatePool pool, int freeSlot) {
        List<LatLong> others = selection.locationsExcluding(freeSlot);

        Replacement best = null;
        for (CandidateRecord candidate : pool.records()) {
            if (selection.contains(candidate.id())) {
                continue;
            }
            double score = metric.isolationScore(candidate.location(), others);
            if (best == null || beats(candidate, score, best.candidate, best.score)) {
                best = new Replacement(candidate, score);
            }
        }
        return best;
    }

    private record Replacement(CandidateRecord candidate, double score) {}
}
