package org.mitre.dispersion;

import static java.util.Objects.requireNonNull;

import java.util.List;

/**
 * Summarizes how a call to LocalRepairOptimizer.repair ended.
 *
 * @param status          The terminal state of the repair loop
 * @param iterations      The number of violations that were acted upon
 * @param closestDistance The closest pairwise distance in the final selection (positive
 *                        infinity when the selection has fewer than 2 members)
 * @param steps           Every accepted swap, in order
 */
public record RepairOutcome(Status status, int iterations, double closestDistance, List<RepairStep> steps) {

    /**
     * CONVERGED = every pair honors the minimum distance. STALLED = a violation remains and no
     * candidate improves it. BUDGET_EXHAUSTED = the iteration budget ran out while a violation
     * remained.
     */
    public enum Status {
        CONVERGED,
        STALLED,
        BUDGET_EXHAUSTED
    }

    public RepairOutcome {
        requireNonNull(status);
        steps = List.copyOf(steps);
    }

    public boolean converged() {
        return status == Status.CONVERGED;
    }
}
