package org.mitre.dispersion;

/**
 * Receives progress notices and warnings while a dispersed selection is built. Notices are
 * informational, they are never part of the returned selection.
 * <p>
 * Every method has a no-op default so implementations only override what they care about.
 */
public interface SelectionListener {

    /** The greedy phase had to shrink its target to the number of available candidates. */
    default void onInsufficientCandidates(InsufficientCandidatesWarning warning) {}

    /** The repair loop found two members closer than the minimum distance. */
    default void onViolation(int iteration, CandidateRecord first, CandidateRecord second, double distanceKm) {}

    /** The repair loop swapped one member of a violating pair for a better separated candidate. */
    default void onReplacement(RepairStep step) {}

    /** Every pair of members honors the minimum distance. */
    default void onConverged(int iterations, double closestDistanceKm) {}

    /** The repair loop stopped while a violation remained. */
    default void onUnresolvedViolation(UnresolvedViolationWarning warning) {}

    /** @return A listener that ignores everything. */
    static SelectionListener silent() {
        return new SelectionListener() {};
    }
}
