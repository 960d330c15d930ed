package io.quarkus.qe.git.content.search.search;

import io.quarkus.qe.git.content.search.history.Commit;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.function.BooleanSupplier;

/**
 * Finds the first and the last commit of a timeline containing the search string.
 * <p>
 * Both searches assume that the commits containing the string form a single contiguous run. The
 * last-match search runs first over the whole timeline; the first-match search is then bounded by the
 * last match, because the run cannot start after its own end.
 * <p>
 * When a last-match probe is negative, the remaining commits right of it are scanned linearly, most
 * recent first, before the window is narrowed to the left. This recovers from a probe landing just
 * outside a run that starts later than the probe, at the cost of one linear scan per negative probe.
 * Runs that are split into several disjoint intervals are not detected.
 * <p>
 * The engine performs no I/O itself: every probe is delegated to a {@link CommitProbe} and reported to a
 * {@link ProbeListener}.
 */
public final class BisectionEngine {

    private final CommitProbe commitProbe;
    private final ProbeListener probeListener;
    private final boolean linearFallback;
    private final BooleanSupplier cancellation;

    public BisectionEngine(CommitProbe commitProbe, ProbeListener probeListener, boolean linearFallback,
            BooleanSupplier cancellation) {
        this.commitProbe = Objects.requireNonNull(commitProbe);
        this.probeListener = Objects.requireNonNull(probeListener);
        this.linearFallback = linearFallback;
        this.cancellation = Objects.requireNonNull(cancellation);
    }

    public BisectionEngine(CommitProbe commitProbe, ProbeListener probeListener, boolean linearFallback) {
        this(commitProbe, probeListener, linearFallback, () -> false);
    }

    /**
     * Run the last-match search followed by the first-match search.
     *
     * @throws SearchCancelledException if the cancellation was signalled before a probe
     */
    public SearchOutcome search(CommitTimeline timeline, ProgressTracker progress) {
        if (timeline.isEmpty()) {
            return SearchOutcome.notFound();
        }

        OptionalInt lastMatchIndex = findLastMatchIndex(timeline, 0, progress);
        progress.lastMatchCompleted();

        int upperBound = lastMatchIndex.orElse(timeline.lastIndex());
        OptionalInt firstMatchIndex = findFirstMatchIndex(timeline, upperBound, progress);

        return new SearchOutcome(firstMatchIndex, lastMatchIndex);
    }

    /**
     * Binary search for the most recent commit containing the string, with the linear fallback unless
     * disabled.
     *
     * @param searchStartIndex lowest index to consider, 0 for a fresh search
     */
    public OptionalInt findLastMatchIndex(CommitTimeline timeline, int searchStartIndex, ProgressTracker progress) {
        int left = Math.max(0, searchStartIndex);
        int right = timeline.lastIndex();
        OptionalInt lastMatchIndex = OptionalInt.empty();

        int expectedProbes = ProgressTracker.expectedProbes(right - left + 1);
        int probesDone = 0;

        while (left <= right) {
            int mid = left + (right - left) / 2;
            boolean found = probe(timeline, mid, ProbePhase.LAST_MATCH);
            progress.lastMatchProgress(++probesDone, expectedProbes);

            if (found) {
                lastMatchIndex = OptionalInt.of(mid);
                left = mid + 1;
                continue;
            }

            if (linearFallback) {
                OptionalInt fallbackMatch = scanDescending(timeline, mid + 1, right, progress);
                if (fallbackMatch.isPresent()) {
                    progress.lastMatchCompleted();
                    return fallbackMatch;
                }
            }
            right = mid - 1;
        }

        return lastMatchIndex;
    }

    /**
     * Binary search for the oldest commit containing the string within {@code [0, upperBound]}.
     */
    public OptionalInt findFirstMatchIndex(CommitTimeline timeline, int upperBound, ProgressTracker progress) {
        int left = 0;
        int right = Math.min(upperBound, timeline.lastIndex());
        OptionalInt firstMatchIndex = OptionalInt.empty();

        int expectedProbes = ProgressTracker.expectedProbes(right - left + 1);
        int probesDone = 0;

        while (left <= right) {
            int mid = left + (right - left) / 2;
            boolean found = probe(timeline, mid, ProbePhase.FIRST_MATCH);
            progress.firstMatchProgress(++probesDone, expectedProbes);

            if (found) {
                firstMatchIndex = OptionalInt.of(mid);
                right = mid - 1;
            } else {
                left = mid + 1;
            }
        }

        return firstMatchIndex;
    }

    private OptionalInt scanDescending(CommitTimeline timeline, int from, int to, ProgressTracker progress) {
        int totalProbes = to - from + 1;
        int probesDone = 0;

        for (int i = to; i >= from; i--) {
            boolean found = probe(timeline, i, ProbePhase.LINEAR_FALLBACK);
            progress.lastMatchProgress(++probesDone, totalProbes);
            if (found) {
                return OptionalInt.of(i);
            }
        }
        return OptionalInt.empty();
    }

    private boolean probe(CommitTimeline timeline, int index, ProbePhase phase) {
        if (cancellation.getAsBoolean()) {
            throw new SearchCancelledException("Search cancelled before probing commit at index " + index);
        }

        Commit commit = timeline.get(index);
        ProbeOutcome outcome = commitProbe.probe(commit);
        probeListener.onProbe(new ProbeEvent(phase, index, commit, outcome));
        return outcome.found();
    }
}
