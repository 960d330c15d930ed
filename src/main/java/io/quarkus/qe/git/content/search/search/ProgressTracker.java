package io.quarkus.qe.git.content.search.search;

import java.util.Objects;

/**
 * Progress of a single search invocation.
 * <p>
 * Each phase owns a part of [0,1]: 5% once started, 25% when the commit timeline is resolved, the
 * last-match search fills 25% to 62.5% and the first-match search fills 62.5% to 100%. Reported values
 * never decrease and only {@link #completed()} reports 1.0, exactly once.
 * <p>
 * Not thread-safe; one tracker belongs to one search.
 */
public final class ProgressTracker {

    public static final double STARTED = 0.05;
    public static final double TIMELINE_RESOLVED = 0.25;
    public static final double LAST_MATCH_COMPLETED = 0.625;
    public static final double COMPLETED = 1.0;

    private final ProgressSink sink;
    private double current = 0;
    private boolean completed = false;

    public ProgressTracker(ProgressSink sink) {
        this.sink = Objects.requireNonNull(sink);
    }

    public void started() {
        advance(STARTED);
    }

    public void timelineResolved() {
        advance(TIMELINE_RESOLVED);
    }

    public void lastMatchProgress(int probesDone, int expectedProbes) {
        advance(fill(TIMELINE_RESOLVED, LAST_MATCH_COMPLETED, probesDone, expectedProbes));
    }

    public void lastMatchCompleted() {
        advance(LAST_MATCH_COMPLETED);
    }

    public void firstMatchProgress(int probesDone, int expectedProbes) {
        advance(fill(LAST_MATCH_COMPLETED, COMPLETED, probesDone, expectedProbes));
    }

    /**
     * Report 1.0. Later calls, and any other report after this one, are ignored.
     */
    public void completed() {
        if (completed) {
            return;
        }
        completed = true;
        current = COMPLETED;
        sink.report(COMPLETED);
    }

    public double current() {
        return current;
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * Number of probes a binary search over the window is expected to make: ceil(log2(n)), at least 1.
     */
    public static int expectedProbes(int windowSize) {
        if (windowSize <= 2) {
            return 1;
        }
        return Integer.SIZE - Integer.numberOfLeadingZeros(windowSize - 1);
    }

    private static double fill(double phaseStart, double phaseEnd, int probesDone, int expectedProbes) {
        double fraction = Math.min(1.0, (double) probesDone / Math.max(1, expectedProbes));
        return phaseStart + fraction * (phaseEnd - phaseStart);
    }

    private void advance(double value) {
        if (completed) {
            return;
        }
        // 1.0 is reserved for completed()
        double bounded = Math.min(value, Math.nextDown(COMPLETED));
        if (bounded > current) {
            current = bounded;
            sink.report(bounded);
        }
    }
}
