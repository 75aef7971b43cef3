package org.mitre.dispersion;

import static com.google.common.base.Preconditions.checkArgument;

import org.mitre.caasd.commons.LatLong;

/**
 * The two positions within a SelectionSet that are nearest to each other.
 *
 * @param first    The lower of the two positions
 * @param second   The higher of the two positions
 * @param distance The distance between the records at those positions
 */
public record ClosestPair(int first, int second, double distance) {

    public ClosestPair {
        checkArgument(0 <= first && first < second, "positions must satisfy 0 <= first < second");
        checkArgument(distance >= 0, "distance cannot be negative");
    }

    /**
     * Scan every pair of positions, (0,1), (0,2), ... (1,2), ..., and return the closest one. When
     * several pairs share the minimum distance the first pair in that enumeration wins.
     *
     * @return The closest pair, or null when the selection has fewer than 2 members
     */
    public static ClosestPair find(SelectionSet selection, DistanceMetric<LatLong> metric) {

        ClosestPair best = null;
        for (int i = 0; i < selection.size(); i++) {
            for (int j = i + 1; j < selection.size(); j++) {
                double dist = metric.distanceBtw(
                        selection.get(i).location(), selection.get(j).location());
                if (best == null || dist < best.distance) {
                    best = new ClosestPair(i, j, dist);
                }
            }
        }
        return best;
    }
}
