package org.mitre.dispersion;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mitre.dispersion.MiscTestUtils.city;

import java.util.List;

import org.junit.jupiter.api.Test;

class SelectionSetTest {

    final CandidateRecord a = city("a", 0, 0, 10);
    final CandidateRecord b = city("b", 0, 1, 10);
    final CandidateRecord c = city("c", 0, 2, 10);

    @Test
    void addKeepsOrderAndIndex() {
        SelectionSet set = SelectionSet.of(List.of(a, b));

        assertThat(set.ids(), contains("a", "b"));
        assertThat(set.positionOf("b"), is(1));
        assertThat(set.positionOf("c"), is(-1));
    }

    @Test
    void addingTheSameIdTwiceFails() {
        SelectionSet set = SelectionSet.of(List.of(a));
        assertThrows(IllegalArgumentException.class, () -> set.add(city("a", 5, 5, 5)));
    }

    @Test
    void replaceSwapsInPlace() {
        SelectionSet set = SelectionSet.of(List.of(a, b));

        CandidateRecord removed = set.replace(0, c);

        assertThat(removed, is(a));
        assertThat(set.ids(), contains("c", "b"));
        assertThat(set.contains("a"), is(false));
        assertThat(set.positionOf("c"), is(0));
        assertThat(set.size(), is(2));
    }

    @Test
    void replaceRejectsAnAlreadySelectedRecord() {
        SelectionSet set = SelectionSet.of(List.of(a, b));

        assertThrows(IllegalArgumentException.class, () -> set.replace(0, b));
        assertThrows(IndexOutOfBoundsException.class, () -> set.replace(2, c));
        assertThat(set.ids(), contains("a", "b"));
    }

    @Test
    void recordsIsAnUnmodifiableSnapshot() {
        SelectionSet set = SelectionSet.of(List.of(a, b));
        List<CandidateRecord> snapshot = set.records();

        set.replace(1, c);

        assertThat(snapshot, contains(a, b));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(c));
    }

    @Test
    void locationsCanExcludeOnePosition() {
        SelectionSet set = SelectionSet.of(List.of(a, b, c));
        assertThat(set.locationsExcluding(1), contains(a.location(), c.location()));
    }
}
