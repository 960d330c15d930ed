package io.quarkus.qe.git.content.search.search;

import io.quarkus.qe.git.content.search.history.Commit;

import java.util.List;

/**
 * Human readable result of a search.
 *
 * @param firstAppearance commit where the string first appears, or null
 * @param lastAppearance commit where the string last appears, or null
 * @param disappearedIn commit following the last appearance, or null
 * @param lines summary lines written to the search log
 */
public record SearchSummary(Commit firstAppearance, Commit lastAppearance, Commit disappearedIn, List<String> lines) {

    public SearchSummary {
        lines = List.copyOf(lines);
    }

    /**
     * Summary of a search that stopped before probing any commit.
     */
    public static SearchSummary aborted(String message) {
        return new SearchSummary(null, null, null, List.of(message));
    }
}
