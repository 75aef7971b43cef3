package org.mitre.dispersion;

import static com.google.common.base.Preconditions.checkArgument;

import java.text.MessageFormat;
import java.util.List;

import org.mitre.caasd.commons.LatLong;

import com.google.common.math.StatsAccumulator;

/**
 * Contains statistics that describe how well-spread (or not) a selection is.
 *
 * @param size                 The number of selected records
 * @param minPairwiseKm        The smallest distance between any two members (positive infinity
 *                             when size < 2)
 * @param meanNearestKm        The average distance from a member to its nearest fellow member (NaN
 *                             when size < 2)
 * @param stdDevNearestKm      The standard deviation of those nearest-member distances (NaN when
 *                             size < 2)
 */
public record SelectionStats(int size, double minPairwiseKm, double meanNearestKm, double stdDevNearestKm) {

    public SelectionStats {
        checkArgument(size >= 0);
        checkArgument(minPairwiseKm >= 0);
    }

    /** Measure every member's distance to its nearest fellow member. */
    public static SelectionStats of(List<LatLong> members, DistanceMetric<LatLong> metric) {

        if (members.size() < 2) {
            return new SelectionStats(members.size(), Double.POSITIVE_INFINITY, Double.NaN, Double.NaN);
        }

        StatsAccumulator nearest = new StatsAccumulator();
        for (int i = 0; i < members.size(); i++) {
            double minDist = Double.POSITIVE_INFINITY;
            for (int j = 0; j < members.size(); j++) {
                if (i != j) {
                    minDist = Math.min(minDist, metric.distanceBtw(members.get(i), members.get(j)));
                }
            }
            nearest.add(minDist);
        }

        return new SelectionStats(
                members.size(), nearest.min(), nearest.mean(), nearest.populationStandardDeviation());
    }

    public String toString() {
        return MessageFormat.format(
                "size: {0}\nclosest pair distance (km): {1}\nmean nearest-member distance (km): {2}\nstandard dev of nearest-member distance (km): {3}\n",
                size, minPairwiseKm, meanNearestKm, stdDevNearestKm);
    }
}
