package org.mitre.dispersion;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.mitre.caasd.commons.LatLong;

/**
 * A SelectionSet is the ordered, duplicate-free list of CandidateRecords chosen so far.
 * <p>
 * The position list and the id index are only ever changed together, by {@code add} or by
 * {@code replace}. Once the greedy phase is done the size never changes again: the repair phase
 * only swaps records in place.
 */
public class SelectionSet {

    private final ArrayList<CandidateRecord> members;

    /** Maps a selected record's id to its position in "members". */
    private final Map<String, Integer> positionOf;

    public SelectionSet() {
        this.members = new ArrayList<>();
        this.positionOf = new HashMap<>();
    }

    /** Build a SelectionSet holding these records (in this order). */
    public static SelectionSet of(List<CandidateRecord> records) {
        SelectionSet set = new SelectionSet();
        records.forEach(set::add);
        return set;
    }

    /** Append a record to the end of the selection. */
    public void add(CandidateRecord rec) {
        requireNonNull(rec);
        checkArgument(!contains(rec.id()), "%s is already selected", rec.id());

        positionOf.put(rec.id(), members.size());
        members.add(rec);
    }

    /**
     * Swap the record at this position for a new record.
     *
     * @return The record that was removed from the selection
     */
    public CandidateRecord replace(int position, CandidateRecord replacement) {
        checkElementIndex(position, members.size());
        requireNonNull(replacement);
        checkArgument(!contains(replacement.id()), "%s is already selected", replacement.id());

        CandidateRecord removed = members.set(position, replacement);
        positionOf.remove(removed.id());
        positionOf.put(replacement.id(), position);
        return removed;
    }

    public boolean contains(String id) {
        return positionOf.containsKey(id);
    }

    /** @return The position of this id, or -1 if the id is not selected. */
    public int positionOf(String id) {
        return positionOf.getOrDefault(id, -1);
    }

    public CandidateRecord get(int position) {
        return members.get(position);
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    /** @return An unmodifiable snapshot of the selected records. */
    public List<CandidateRecord> records() {
        return unmodifiableList(new ArrayList<>(members));
    }

    public List<String> ids() {
        return members.stream().map(CandidateRecord::id).toList();
    }

    public List<LatLong> locations() {
        return members.stream().map(CandidateRecord::location).toList();
    }

    /** @return The locations of every member except the one at this position. */
    List<LatLong> locationsExcluding(int position) {
        List<LatLong> out = new ArrayList<>(members.size());
        for (int i = 0; i < members.size(); i++) {
            if (i != position) {
                out.add(members.get(i).location());
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "SelectionSet" + ids();
    }
}
