package org.mitre.dispersion;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A CandidatePool is the read-only, ordered sequence of every CandidateRecord a selection may draw
 * from. Record ids must be unique.
 */
public class CandidatePool {

    private final List<CandidateRecord> records;

    private final Map<String, CandidateRecord> byId;

    /** The same records sorted by descending population (ties by ascending id). */
    private final List<CandidateRecord> ranked;

    public CandidatePool(Collection<CandidateRecord> records) {
        requireNonNull(records);

        Map<String, CandidateRecord> map = new LinkedHashMap<>();
        for (CandidateRecord rec : records) {
            requireNonNull(rec, "null records are not allowed");
            CandidateRecord prior = map.put(rec.id(), rec);
            checkArgument(prior == null, "Duplicate candidate id: %s", rec.id());
        }

        this.records = List.copyOf(records);
        this.byId = unmodifiableMap(map);
        this.ranked = this.records.stream().sorted(CandidateRecord.BY_POPULATION_DESC).toList();
    }

    public static CandidatePool of(CandidateRecord... records) {
        return new CandidatePool(List.of(records));
    }

    /** @return The records in the order they were provided. */
    public List<CandidateRecord> records() {
        return records;
    }

    /** @return The records sorted by descending population, ties broken by ascending id. */
    public List<CandidateRecord> rankedByPopulation() {
        return ranked;
    }

    public Optional<CandidateRecord> find(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
