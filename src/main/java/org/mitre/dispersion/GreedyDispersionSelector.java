package org.mitre.dispersion;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Arrays;
import java.util.List;

import org.mitre.caasd.commons.LatLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds an initial selection with the max-min (farthest-point) heuristic.
 * <p>
 * The most populous candidate seeds the selection. Each following round appends the unselected
 * candidate whose distance to its nearest selected record (its "isolation score") is largest.
 * Ties (on population or on isolation score) go to the candidate with the smaller id, so results
 * never depend on input order.
 * <p>
 * Isolation scores are kept as running minimums that are only updated against the newest
 * selected record. A full run costs O(n * |pool|) distance computations.
 */
public class GreedyDispersionSelector {

    static final Logger LOGGER = LoggerFactory.getLogger(GreedyDispersionSelector.class);

    private final DistanceMetric<LatLong> metric;

    private final SelectionListener listener;

    public GreedyDispersionSelector(DistanceMetric<LatLong> metric, SelectionListener listener) {
        this.metric = requireNonNull(metric);
        this.listener = requireNonNull(listener);
    }

    /**
     * @param pool The candidates to choose from (all have valid coordinates)
     * @param n    The number of records to select
     *
     * @return A new SelectionSet with min(n, pool.size()) records. A shortfall is reported to the
     *     listener as an InsufficientCandidatesWarning, it is never an error.
     */
    public SelectionSet select(CandidatePool pool, int n) {
        requireNonNull(pool);
        checkArgument(n > 0, "The number of cities to select must be positive: %s", n);

        int target = n;
        if (pool.size() < n) {
            listener.onInsufficientCandidates(new InsufficientCandidatesWarning(n, pool.size()));
            target = pool.size();
        }

        LOGGER.atInfo()
                .setMessage("Selecting {} geographically dispersed cities from {} candidates")
                .addArgument(target)
                .addArgument(pool.size())
                .log();

        SelectionSet selection = new SelectionSet();
        if (target == 0) {
            return selection;
        }

        List<CandidateRecord> ranked = pool.rankedByPopulation();
        boolean[] taken = new boolean[ranked.size()];
        double[] isolation = new double[ranked.size()];
        Arrays.fill(isolation, Double.POSITIVE_INFINITY);

        int newest = 0; // ranked.get(0) is the most populous candidate
        taken[newest] = true;
        selection.add(ranked.get(newest));

        while (selection.size() < target) {
            LatLong newestLocation = ranked.get(newest).location();

            int best = -1;
            for (int i = 0; i < ranked.size(); i++) {
                if (taken[i]) {
                    continue;
                }
                isolation[i] = Math.min(isolation[i], metric.distanceBtw(ranked.get(i).location(), newestLocation));

                if (best == -1 || beats(ranked.get(i), isolation[i], ranked.get(best), isolation[best])) {
                    best = i;
                }
            }

            taken[best] = true;
            selection.add(ranked.get(best));
            newest = best;

            LOGGER.atTrace()
                    .setMessage("Round {}: picked {} (isolation score: {} km)")
                    .addArgument(selection.size())
                    .addArgument(ranked.get(best).name())
                    .addArgument(isolation[best])
                    .log();
        }

        return selection;
    }

    /** @return True when candidate "a" with score "aScore" should be preferred over "b". */
    static boolean beats(CandidateRecord a, double aScore, CandidateRecord b, double bScore) {
        if (aScore != bScore) {
            return aScore > bScore;
        }
        return a.id().compareTo(b.id()) < 0;
    }
}
