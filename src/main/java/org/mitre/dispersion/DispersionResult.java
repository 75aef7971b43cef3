package org.mitre.dispersion;

import static java.util.Objects.requireNonNull;

import java.util.List;

/**
 * The outcome of one dispersed selection.
 * <p>
 * Treat the records as "constraint satisfied unless a warning says otherwise". The selection
 * always holds min(nCities, number of candidates) distinct records drawn from the input.
 *
 * @param records       The selected records, in selection order
 * @param warnings      Every non-fatal shortfall (insufficient candidates, unresolved violation)
 * @param repair        How the repair loop ended
 * @param stats         Spread statistics of the final selection
 * @param distanceCalls The number of distance computations the selection required
 */
public record DispersionResult(
        List<CandidateRecord> records,
        List<SelectionWarning> warnings,
        RepairOutcome repair,
        SelectionStats stats,
        long distanceCalls) {

    public DispersionResult {
        records = List.copyOf(records);
        warnings = List.copyOf(warnings);
        requireNonNull(repair);
        requireNonNull(stats);
    }

    public int size() {
        return records.size();
    }

    public List<String> ids() {
        return records.stream().map(CandidateRecord::id).toList();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    /** @return The warnings of one particular type. */
    public <W extends SelectionWarning> List<W> warningsOfType(Class<W> type) {
        return warnings.stream().filter(type::isInstance).map(type::cast).toList();
    }
}
