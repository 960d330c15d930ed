package io.quarkus.qe.git.content.search.search;

import java.util.List;

/**
 * Everything a single search produced.
 *
 * @param status how the search ended
 * @param timeline the searched commits, empty if the search stopped before resolving them
 * @param outcome boundary indices into the timeline
 * @param summary user facing summary
 * @param checkedCommits every probe performed, in order
 */
public record SearchResult(SearchStatus status, CommitTimeline timeline, SearchOutcome outcome,
                           SearchSummary summary, List<CheckedCommit> checkedCommits) {

    public SearchResult {
        checkedCommits = List.copyOf(checkedCommits);
    }

    public static SearchResult aborted(SearchStatus status, CommitTimeline timeline, String message) {
        return new SearchResult(status, timeline, SearchOutcome.notFound(), SearchSummary.aborted(message), List.of());
    }

    public int probeCount() {
        return checkedCommits.size();
    }
}
