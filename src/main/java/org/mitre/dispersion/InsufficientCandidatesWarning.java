package org.mitre.dispersion;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Fewer valid candidates were available than the selection requested, so the selection was
 * reduced to the available count.
 */
public record InsufficientCandidatesWarning(int requested, int available) implements SelectionWarning {

    public InsufficientCandidatesWarning {
        checkArgument(available < requested, "not a shortfall: %s >= %s", available, requested);
    }

    @Override
    public String message() {
        return "Only " + available + " candidates available, less than requested " + requested;
    }
}
