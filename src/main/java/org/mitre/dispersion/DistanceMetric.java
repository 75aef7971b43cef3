package org.mitre.dispersion;

import java.util.List;

/**
 * The DistanceMetric must define a true Metric Space (in the strict algebraic sense) for KEY
 * objects. This means the following should be true:
 * <p>
 * <pre>{@code
 * (1) d(x,y) >= 0
 * (2) d(x,y) = d(y,x)
 * (3) d(x,z) <= d(x,y) + d(y,z)
 * }</pre>
 */
@FunctionalInterface
public interface DistanceMetric<KEY> {

    /**
     * @param item1 The first of two items
     * @param item2 The second of two items
     *
     * @return The distance between the 2 objects in a Metric Space (this method must define a
     *     proper Metric Space in the strict algebraic sense).
     */
    double distanceBtw(KEY item1, KEY item2);

    /**
     * Compute the "isolation score" of an item, i.e., the distance from the item to the closest
     * of these other items.
     *
     * @param item       The item being scored
     * @param otherItems The items the score is measured against
     *
     * @return The minimum distance btw item and otherItems (positive infinity when otherItems is
     *     empty because nothing constrains the item)
     */
    default double isolationScore(KEY item, List<KEY> otherItems) {

        double minDist = Double.POSITIVE_INFINITY;
        for (KEY other : otherItems) {
            minDist = Math.min(minDist, distanceBtw(item, other));
        }
        return minDist;
    }
}
