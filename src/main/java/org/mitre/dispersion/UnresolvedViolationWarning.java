package org.mitre.dispersion;

import static java.util.Objects.requireNonNull;

import java.util.Locale;

/**
 * The repair loop ended while two selected records were still closer than the minimum distance.
 *
 * @param first      One record of the offending pair
 * @param second     The other record of the offending pair
 * @param distanceKm The distance between them
 * @param status     Why the repair loop stopped (STALLED or BUDGET_EXHAUSTED)
 */
public record UnresolvedViolationWarning(
        CandidateRecord first, CandidateRecord second, double distanceKm, RepairOutcome.Status status)
        implements SelectionWarning {

    public UnresolvedViolationWarning {
        requireNonNull(first);
        requireNonNull(second);
        requireNonNull(status);
    }

    @Override
    public String message() {
        return String.format(
                Locale.ROOT,
                "%s and %s remain only %.1f km apart (%s)", first.name(), second.name(), distanceKm, status);
    }
}
