package org.mitre.dispersion;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mitre.dispersion.MiscTestUtils.*;
import static org.mitre.dispersion.RepairOutcome.Status.CONVERGED;
import static org.mitre.dispersion.RepairOutcome.Status.STALLED;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.mitre.caasd.commons.LatLong;

import org.junit.jupiter.api.Test;

class DispersedCitySelectorTest {

    static final CandidateRecord C1 = city("c1", 40.0, -100.0, 1000);
    static final CandidateRecord C2 = city("c2", 40.1, -100.0, 900);
    static final CandidateRecord C3 = city("c3", 40.0, -100.1, 800);
    static final CandidateRecord C4 = city("c4", 40.1, -100.1, 700);
    static final CandidateRecord ISOLATED = city("iso", 40.0, -76.5, 5);
    static final CandidateRecord FAR = city("far", -30.0, 20.0, 5);

    static DispersedCitySelector selector(int nCities, double minDistanceKm) {
        return DispersionConfig.builder()
                .nCities(nCities)
                .minDistanceKm(minDistanceKm)
                .buildSelector();
    }

    @Test
    void mostPopulousThenFarthest() {
        List<CandidateRecord> candidates =
                List.of(city("A", 0, 0, 100), city("B", 0, 1, 50), city("C", 0, 10, 10));

        DispersionResult result = selector(2, 500).select(candidates);

        assertThat(result.ids(), contains("A", "C"));
        assertThat(result.hasWarnings(), is(false));
        assertThat(result.repair().status(), is(CONVERGED));
    }

    @Test
    void clusterIsReducedToOneMemberWhenFarCandidatesExist() {
        DispersionResult result = selector(3, 500).select(List.of(C1, C2, C3, C4, ISOLATED, FAR));

        assertThat(result.ids(), containsInAnyOrder("c1", "iso", "far"));
        assertThat(result.repair().status(), is(CONVERGED));
        assertThat(result.hasWarnings(), is(false));
    }

    @Test
    void unavoidableViolationIsReportedNotThrown() {
        // only 2 "spread out" places exist, so a third city must come from the cluster
        DispersionResult result = selector(3, 500).select(List.of(C1, C2, C3, C4, ISOLATED));

        assertThat(result.size(), is(3));
        assertThat(result.repair().status(), is(STALLED));

        List<UnresolvedViolationWarning> warnings = result.warningsOfType(UnresolvedViolationWarning.class);
        assertThat(warnings, hasSize(1));
        assertThat(warnings.get(0).distanceKm(), lessThan(500.0));
        assertThat(result.warningsOfType(InsufficientCandidatesWarning.class), empty());
    }

    @Test
    void tooFewCandidatesReturnsAllOfThem() {
        List<CandidateRecord> candidates = randomGlobalCandidates(10);

        DispersionResult result = selector(50, 500).select(candidates);

        assertThat(result.size(), is(10));
        assertThat(result.ids(), containsInAnyOrder(candidates.stream().map(CandidateRecord::id).toArray()));

        List<InsufficientCandidatesWarning> shortfalls = result.warningsOfType(InsufficientCandidatesWarning.class);
        assertThat(shortfalls, hasSize(1));
        assertThat(shortfalls.get(0), is(new InsufficientCandidatesWarning(50, 10)));
    }

    @Test
    void outputSizeAndMembershipHoldForManyInputs() {
        List<CandidateRecord> candidates = randomGlobalCandidates(120);
        Set<String> inputIds = new HashSet<>();
        candidates.forEach(c -> inputIds.add(c.id()));

        for (int n : new int[] {1, 2, 7, 40, 120, 500}) {
            DispersionResult result = selector(n, 1_000).select(candidates);

            assertThat(result.size(), is(Math.min(n, candidates.size())));
            assertThat(new HashSet<>(result.ids()), hasSize(result.size()));
            assertThat(inputIds.containsAll(result.ids()), is(true));
            assertThat(result.stats().size(), is(result.size()));
        }
    }

    @Test
    void satisfiedSelectionsHonorTheMinimumDistance() {
        List<CandidateRecord> candidates = randomGlobalCandidates(400);

        DispersionResult result = selector(30, 1_500).select(candidates);

        if (!result.hasWarnings()) {
            assertThat(minPairwiseKm(result.records()), greaterThanOrEqualTo(1_500.0));
        }
        assertThat(result.stats().minPairwiseKm(), closeTo(minPairwiseKm(result.records()), 1E-9));
    }

    @Test
    void selectionIsReproducible() {
        List<CandidateRecord> candidates = randomCandidates(300);
        List<CandidateRecord> shuffled = new ArrayList<>(candidates);
        Collections.shuffle(shuffled, new Random(99L));

        DispersionResult r1 = selector(20, 600).select(candidates);
        DispersionResult r2 = selector(20, 600).select(shuffled);

        assertThat(r1.ids(), is(r2.ids()));
    }

    @Test
    void distanceCallsAreCounted() {
        ManualCountingDM metric = new ManualCountingDM();

        DispersedCitySelector selector = DispersionConfig.builder()
                .nCities(15)
                .minDistanceKm(300)
                .distMetric(metric)
                .buildSelector();

        DispersionResult result = selector.select(randomCandidates(200));

        // SelectionStats measures with the raw metric, so it adds to the manual count only
        long statsCalls = 15L * 14L;
        assertThat(selector.distMetricExecutionCount(), is(metric.callCount - statsCalls));
        assertThat(result.distanceCalls(), is(selector.distMetricExecutionCount()));
    }

    @Test
    void concurrentSelectionsCountTheirOwnDistanceCalls() throws Exception {
        List<CandidateRecord> first = randomGlobalCandidates(400);
        List<CandidateRecord> second = randomCandidates(250);

        DispersionConfig config = DispersionConfig.builder()
                .nCities(25)
                .minDistanceKm(800)
                .listener(SelectionListener.silent())
                .build();

        // selections are deterministic, so isolated runs give the expected counts
        long expectedFirst = new DispersedCitySelector(config).select(first).distanceCalls();
        long expectedSecond = new DispersedCitySelector(config).select(second).distanceCalls();

        DispersedCitySelector shared = new DispersedCitySelector(config);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        int numRounds = 5;

        try {
            for (int i = 0; i < numRounds; i++) {
                CountDownLatch startGate = new CountDownLatch(1);

                Future<DispersionResult> f1 = executor.submit(() -> {
                    startGate.await();
                    return shared.select(first);
                });
                Future<DispersionResult> f2 = executor.submit(() -> {
                    startGate.await();
                    return shared.select(second);
                });
                startGate.countDown();

                assertThat(f1.get().distanceCalls(), is(expectedFirst));
                assertThat(f2.get().distanceCalls(), is(expectedSecond));
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(shared.distMetricExecutionCount(), is(numRounds * (expectedFirst + expectedSecond)));
    }

    @Test
    void duplicateIdsAreRejected() {
        assertThrows(
                IllegalArgumentException.class,
                () -> selector(2, 500).select(List.of(city("a", 0, 0, 1), city("a", 10, 10, 2))));
    }

    @Test
    void configuredListenerHearsEverything() {
        RecordingListener listener = new RecordingListener();

        DispersionConfig.builder()
                .nCities(3)
                .minDistanceKm(500)
                .listener(listener)
                .buildSelector()
                .select(List.of(C1, C2, C3, C4, ISOLATED));

        assertThat(listener.violations, contains("c1-c4"));
        assertThat(listener.unresolved, hasSize(1));
        assertThat(listener.convergedCount, is(0));
    }

    static class ManualCountingDM implements DistanceMetric<LatLong> {

        long callCount = 0;

        @Override
        public double distanceBtw(LatLong item1, LatLong item2) {
            callCount++;
            return HaversineDistance.haversineKm(item1, item2);
        }
    }
}
