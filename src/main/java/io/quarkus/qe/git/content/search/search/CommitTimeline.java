package io.quarkus.qe.git.content.search.search;

import io.quarkus.qe.git.content.search.history.Commit;
import io.quarkus.qe.git.content.search.history.CommitRange;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Commits touching the searched file, oldest first, without duplicates. Never modified once built.
 */
public final class CommitTimeline {

    private static final CommitTimeline EMPTY = new CommitTimeline(List.of());

    private final List<Commit> commits;

    private CommitTimeline(List<Commit> commits) {
        this.commits = commits;
    }

    public static CommitTimeline empty() {
        return EMPTY;
    }

    public static CommitTimeline ofOldestFirst(List<Commit> commits) {
        Set<String> seenHashes = new HashSet<>();
        List<Commit> timeline = new ArrayList<>(commits.size());
        for (Commit commit : commits) {
            if (seenHashes.add(commit.hash())) {
                timeline.add(commit);
            }
        }
        return new CommitTimeline(List.copyOf(timeline));
    }

    /**
     * Build the timeline from commits listed the way {@code git log} lists them.
     */
    public static CommitTimeline ofNewestFirst(List<Commit> commits) {
        List<Commit> reversed = new ArrayList<>(commits);
        Collections.reverse(reversed);
        return ofOldestFirst(reversed);
    }

    public int size() {
        return commits.size();
    }

    public boolean isEmpty() {
        return commits.isEmpty();
    }

    public int lastIndex() {
        return commits.size() - 1;
    }

    public Commit get(int index) {
        return commits.get(index);
    }

    public List<Commit> commits() {
        return commits;
    }

    /**
     * Index of the first commit matching the reference (full or abbreviated hash), or -1.
     */
    public int indexOf(String reference) {
        for (int i = 0; i < commits.size(); i++) {
            if (commits.get(i).matchesReference(reference)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Whether both boundaries are in this timeline and the earliest one comes after the latest one.
     */
    public boolean isInverted(CommitRange range) {
        if (!range.isBounded()) {
            return false;
        }
        int earliestIndex = indexOf(range.earliest());
        int latestIndex = indexOf(range.latest());
        return earliestIndex >= 0 && latestIndex >= 0 && earliestIndex > latestIndex;
    }

    @Override
    public String toString() {
        return "CommitTimeline[size=" + commits.size() + "]";
    }
}
