package org.mitre.dispersion;

/**
 * Describes one accepted swap made by the LocalRepairOptimizer.
 *
 * @param iteration         The repair iteration (starting at 1)
 * @param removed           The member of the violating pair that was dropped
 * @param added             The candidate that took its place
 * @param violatingDistance The closest-pair distance that triggered the swap
 * @param replacementScore  The added candidate's distance to its nearest fellow member (always
 *                          strictly greater than violatingDistance)
 */
public record RepairStep(
        int iteration,
        CandidateRecord removed,
        CandidateRecord added,
        double violatingDistance,
        double replacementScore) {}
