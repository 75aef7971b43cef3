package org.mitre.dispersion;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import java.util.Comparator;

import org.mitre.caasd.commons.LatLong;

/**
 * A CandidateRecord is one geolocated entity (a "city") that may be chosen for a dispersed
 * selection. Records are owned by the catalog that produced them, the selection code only reads
 * them.
 *
 * @param id         A unique, stable identifier
 * @param name       A human-readable name
 * @param location   The record's coordinates (LatLong rejects out-of-range values)
 * @param population A non-negative population count
 */
public record CandidateRecord(String id, String name, LatLong location, long population) {

    /** Descending population, ties broken by ascending id. */
    public static final Comparator<CandidateRecord> BY_POPULATION_DESC =
            Comparator.comparingLong(CandidateRecord::population).reversed().thenComparing(CandidateRecord::id);

    public static final Comparator<CandidateRecord> BY_ID = Comparator.comparing(CandidateRecord::id);

    public CandidateRecord {
        requireNonNull(id, "id");
        requireNonNull(name, "name");
        requireNonNull(location, "location");
        checkArgument(population >= 0, "population cannot be negative: %s", population);
    }

    public static CandidateRecord of(String id, String name, double latitude, double longitude, long population) {
        return new CandidateRecord(id, name, LatLong.of(latitude, longitude), population);
    }

    public double latitude() {
        return location.latitude();
    }

    public double longitude() {
        return location.longitude();
    }
}
