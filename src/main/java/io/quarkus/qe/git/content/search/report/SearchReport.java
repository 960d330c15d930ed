package io.quarkus.qe.git.content.search.report;

import io.quarkus.qe.git.content.search.history.Commit;
import io.quarkus.qe.git.content.search.search.CheckedCommit;
import io.quarkus.qe.git.content.search.search.SearchRequest;
import io.quarkus.qe.git.content.search.search.SearchResult;
import io.quarkus.qe.git.content.search.search.SearchStatus;
import io.quarkus.runtime.annotations.RegisterForReflection;

import java.time.Instant;
import java.util.List;

/**
 * Persisted form of a search result.
 */
@RegisterForReflection
public record SearchReport(
        String filePath,
        String searchString,
        String earliestCommit,
        String latestCommit,
        boolean followRenames,
        SearchStatus status,
        List<String> summary,
        String firstAppearance,
        String lastAppearance,
        String disappearedIn,
        int timelineSize,
        List<CheckedCommit> checkedCommits,
        Instant completedAt) {

    public SearchReport {
        summary = List.copyOf(summary);
        checkedCommits = List.copyOf(checkedCommits);
    }

    public static SearchReport of(SearchRequest request, SearchResult result, Instant completedAt) {
        return new SearchReport(
                request.filePath(),
                request.searchString(),
                request.range().earliest(),
                request.range().latest(),
                request.followRenames(),
                result.status(),
                result.summary().lines(),
                hashOf(result.summary().firstAppearance()),
                hashOf(result.summary().lastAppearance()),
                hashOf(result.summary().disappearedIn()),
                result.timeline().size(),
                result.checkedCommits(),
                completedAt
        );
    }

    private static String hashOf(Commit commit) {
        return commit == null ? null : commit.hash();
    }
}
