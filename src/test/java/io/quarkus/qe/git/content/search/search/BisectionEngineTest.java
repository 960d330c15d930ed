package io.quarkus.qe.git.content.search.search;

import io.quarkus.qe.git.content.search.history.Commit;
import io.quarkus.qe.git.content.search.history.RevisionNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BisectionEngineTest {

    @Test
    void findsBoundariesOfEveryContiguousRun() {
        for (int size = 1; size <= 12; size++) {
            CommitTimeline timeline = timeline(size);
            for (int first = 0; first < size; first++) {
                for (int last = first; last < size; last++) {
                    BisectionEngine engine = new BisectionEngine(presentIn(first, last), event -> {
                    }, true);

                    SearchOutcome outcome = engine.search(timeline, tracker());

                    String run = "size " + size + ", run [" + first + ", " + last + "]";
                    assertEquals(OptionalInt.of(first), outcome.firstMatchIndex(), "First match for " + run);
                    assertEquals(OptionalInt.of(last), outcome.lastMatchIndex(), "Last match for " + run);
                }
            }
        }
    }

    @Test
    void reportsNothingWhenNoCommitMatches() {
        for (int size = 1; size <= 12; size++) {
            BisectionEngine engine = new BisectionEngine(commit -> ProbeOutcome.of(false), event -> {
            }, true);

            SearchOutcome outcome = engine.search(timeline(size), tracker());

            assertFalse(outcome.isFound());
            assertTrue(outcome.lastMatchIndex().isEmpty());
        }
    }

    @Test
    void reportsWholeTimelineWhenEveryCommitMatches() {
        BisectionEngine engine = new BisectionEngine(commit -> ProbeOutcome.of(true), event -> {
        }, true);

        SearchOutcome outcome = engine.search(timeline(9), tracker());

        assertEquals(OptionalInt.of(0), outcome.firstMatchIndex());
        assertEquals(OptionalInt.of(8), outcome.lastMatchIndex());
    }

    @Test
    void emptyTimelineIsNeverProbed() {
        AtomicInteger probes = new AtomicInteger();
        BisectionEngine engine = new BisectionEngine(commit -> {
            probes.incrementAndGet();
            return ProbeOutcome.of(true);
        }, event -> {
        }, true);

        SearchOutcome outcome = engine.search(CommitTimeline.empty(), tracker());

        assertFalse(outcome.isFound());
        assertEquals(0, probes.get());
    }

    @Test
    void probesMiddleCommitsFirst() {
        List<ProbeEvent> events = new ArrayList<>();
        BisectionEngine engine = new BisectionEngine(presentIn(2, 3), events::add, true);

        SearchOutcome outcome = engine.search(timeline(5), tracker());

        assertEquals(OptionalInt.of(2), outcome.firstMatchIndex());
        assertEquals(OptionalInt.of(3), outcome.lastMatchIndex());
        assertEquals(List.of(2, 3, 4, 1, 2), indices(events));
        assertEquals(List.of(ProbePhase.LAST_MATCH, ProbePhase.LAST_MATCH, ProbePhase.LAST_MATCH,
                ProbePhase.FIRST_MATCH, ProbePhase.FIRST_MATCH), phases(events));
    }

    @Test
    void linearFallbackRecoversRunRightOfNegativeProbe() {
        List<ProbeEvent> events = new ArrayList<>();
        BisectionEngine engine = new BisectionEngine(presentIn(5, 6), events::add, true);

        SearchOutcome outcome = engine.search(timeline(8), tracker());

        assertEquals(OptionalInt.of(5), outcome.firstMatchIndex());
        assertEquals(OptionalInt.of(6), outcome.lastMatchIndex());
        assertEquals(List.of(3, 7, 6, 3, 5, 4), indices(events));
        assertEquals(ProbePhase.LAST_MATCH, events.get(0).phase());
        assertEquals(ProbePhase.LINEAR_FALLBACK, events.get(1).phase());
        assertEquals(ProbePhase.LINEAR_FALLBACK, events.get(2).phase());
        assertEquals(ProbePhase.FIRST_MATCH, events.get(3).phase());
    }

    @Test
    void withoutLinearFallbackRunRightOfNegativeProbeHasNoLastMatch() {
        BisectionEngine engine = new BisectionEngine(presentIn(5, 6), event -> {
        }, false);

        SearchOutcome outcome = engine.search(timeline(8), tracker());

        assertEquals(OptionalInt.of(5), outcome.firstMatchIndex());
        assertTrue(outcome.lastMatchIndex().isEmpty());
    }

    @Test
    void withoutLinearFallbackProbeCountIsLogarithmic() {
        AtomicInteger probes = new AtomicInteger();
        CommitProbe presence = presentIn(0, 700);
        BisectionEngine engine = new BisectionEngine(commit -> {
            probes.incrementAndGet();
            return presence.probe(commit);
        }, event -> {
        }, false);

        SearchOutcome outcome = engine.search(timeline(1024), tracker());

        assertEquals(OptionalInt.of(0), outcome.firstMatchIndex());
        assertEquals(OptionalInt.of(700), outcome.lastMatchIndex());
        int perSearch = ProgressTracker.expectedProbes(1024) + 1;
        assertTrue(probes.get() <= 2 * perSearch, "Too many probes: " + probes.get());
    }

    @Test
    void disjointRunsReportOnlyTheMostRecentRun() {
        Set<String> present = Set.of("C1", "C6");
        BisectionEngine engine = new BisectionEngine(commit -> ProbeOutcome.of(present.contains(commit.hash())),
                event -> {
                }, true);

        SearchOutcome outcome = engine.search(timeline(9), tracker());

        assertEquals(OptionalInt.of(6), outcome.firstMatchIndex());
        assertEquals(OptionalInt.of(6), outcome.lastMatchIndex());
    }

    @Test
    void retrievalFailureOutsideRunDoesNotMoveBoundaries() {
        CommitProbe presence = presentIn(2, 5);
        List<ProbeEvent> events = new ArrayList<>();
        BisectionEngine engine = new BisectionEngine(commit -> {
            if (commit.hash().equals("C8")) {
                return ProbeOutcome.failed(new RevisionNotFoundException("path 'a.txt' does not exist in 'C8'"));
            }
            return presence.probe(commit);
        }, events::add, true);

        SearchOutcome outcome = engine.search(timeline(10), tracker());

        assertEquals(OptionalInt.of(2), outcome.firstMatchIndex());
        assertEquals(OptionalInt.of(5), outcome.lastMatchIndex());
        ProbeEvent failed = events.stream().filter(event -> event.index() == 8).findFirst().orElseThrow();
        assertTrue(failed.outcome().hasError());
        assertFalse(failed.outcome().found());
    }

    @Test
    void cancellationStopsBeforeNextProbe() {
        AtomicInteger probes = new AtomicInteger();
        BisectionEngine engine = new BisectionEngine(commit -> {
            probes.incrementAndGet();
            return ProbeOutcome.of(true);
        }, event -> {
        }, true, () -> probes.get() >= 2);

        assertThrows(SearchCancelledException.class, () -> engine.search(timeline(16), tracker()));
        assertEquals(2, probes.get());
    }

    @Test
    void progressIncreasesAndStaysBelowCompletion() {
        List<Double> reported = new ArrayList<>();
        ProgressTracker progress = new ProgressTracker(reported::add);
        progress.started();
        progress.timelineResolved();
        BisectionEngine engine = new BisectionEngine(presentIn(3, 40), event -> {
        }, true);

        engine.search(timeline(64), progress);

        for (int i = 1; i < reported.size(); i++) {
            assertTrue(reported.get(i) > reported.get(i - 1), "Progress decreased: " + reported);
        }
        assertTrue(reported.get(reported.size() - 1) < 1.0);
        assertTrue(reported.contains(ProgressTracker.LAST_MATCH_COMPLETED));
    }

    @Test
    void lastMatchSearchHonoursStartIndex() {
        BisectionEngine engine = new BisectionEngine(presentIn(0, 9), event -> {
        }, false);

        OptionalInt lastMatch = engine.findLastMatchIndex(timeline(10), 4, tracker());

        assertEquals(OptionalInt.of(9), lastMatch);
    }

    @Test
    void firstMatchSearchHonoursUpperBound() {
        BisectionEngine engine = new BisectionEngine(presentIn(6, 9), event -> {
        }, false);

        OptionalInt firstMatch = engine.findFirstMatchIndex(timeline(10), 4, tracker());

        assertTrue(firstMatch.isEmpty());
    }

    private static CommitTimeline timeline(int size) {
        return CommitTimeline.ofOldestFirst(IntStream.range(0, size)
                .mapToObj(i -> new Commit("C" + i, "a.txt"))
                .collect(Collectors.toList()));
    }

    private static CommitProbe presentIn(int first, int last) {
        return commit -> {
            int index = Integer.parseInt(commit.hash().substring(1));
            return ProbeOutcome.of(index >= first && index <= last);
        };
    }

    private static ProgressTracker tracker() {
        return new ProgressTracker(ProgressSink.NONE);
    }

    private static List<Integer> indices(List<ProbeEvent> events) {
        return events.stream().map(ProbeEvent::index).collect(Collectors.toList());
    }

    private static List<ProbePhase> phases(List<ProbeEvent> events) {
        return events.stream().map(ProbeEvent::phase).collect(Collectors.toList());
    }
}
