package org.mitre.dispersion;

import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes every selection notice to SLF4J (warnings at WARN, progress at INFO). */
public class LoggingSelectionListener implements SelectionListener {

    static final Logger LOGGER = LoggerFactory.getLogger(LoggingSelectionListener.class);

    @Override
    public void onInsufficientCandidates(InsufficientCandidatesWarning warning) {
        LOGGER.atWarn().setMessage(warning.message()).log();
    }

    @Override
    public void onViolation(int iteration, CandidateRecord first, CandidateRecord second, double distanceKm) {
        LOGGER.atInfo()
                .setMessage("Iteration {}: Found {} and {} only {} km apart")
                .addArgument(iteration)
                .addArgument(first.name())
                .addArgument(second.name())
                .addArgument(() -> String.format(Locale.ROOT, "%.1f", distanceKm))
                .log();
    }

    @Override
    public void onReplacement(RepairStep step) {
        LOGGER.atInfo()
                .setMessage("  Replaced {} (pop: {}) with {} (min distance: {} km)")
                .addArgument(step.removed().name())
                .addArgument(step.removed().population())
                .addArgument(step.added().name())
                .addArgument(() -> String.format(Locale.ROOT, "%.1f", step.replacementScore()))
                .log();
    }

    @Override
    public void onConverged(int iterations, double closestDistanceKm) {
        LOGGER.atInfo()
                .setMessage("All cities honor the minimum distance after {} repair iterations (closest: {} km)")
                .addArgument(iterations)
                .addArgument(() -> String.format(Locale.ROOT, "%.1f", closestDistanceKm))
                .log();
    }

    @Override
    public void onUnresolvedViolation(UnresolvedViolationWarning warning) {
        String reason = warning.status() == RepairOutcome.Status.STALLED
                ? "Could not find a better replacement, keeping original cities"
                : "Repair iteration budget exhausted";

        LOGGER.atWarn()
                .setMessage("{}: {}")
                .addArgument(reason)
                .addArgument(warning.message())
                .log();
    }
}
