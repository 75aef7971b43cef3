package org.mitre.dispersion;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mitre.dispersion.MiscTestUtils.city;
import static org.mitre.dispersion.RepairOutcome.Status.STALLED;

import java.util.Locale;

import org.junit.jupiter.api.Test;

class SelectionWarningTest {

    @Test
    void distancesUseADotRegardlessOfDefaultLocale() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.GERMANY);

            UnresolvedViolationWarning warning = new UnresolvedViolationWarning(
                    city("Essen", 51.45, 7.01, 580_000), city("Bochum", 51.48, 7.22, 360_000), 12.345, STALLED);

            assertThat(warning.message(), is("Essen and Bochum remain only 12.3 km apart (STALLED)"));
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void shortfallMessageNamesBothCounts() {
        InsufficientCandidatesWarning warning = new InsufficientCandidatesWarning(50, 10);

        assertThat(warning.message(), is("Only 10 candidates available, less than requested 50"));
        assertThrows(IllegalArgumentException.class, () -> new InsufficientCandidatesWarning(10, 10));
    }
}
