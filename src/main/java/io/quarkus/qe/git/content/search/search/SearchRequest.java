package io.quarkus.qe.git.content.search.search;

import io.quarkus.qe.git.content.search.history.CommitRange;

/**
 * What to look for, and where.
 *
 * @param filePath repository relative path of the searched file
 * @param searchString literal string whose presence is searched
 * @param range optional commit boundaries
 * @param followRenames whether the history follows the file across renames
 */
public record SearchRequest(String filePath, String searchString, CommitRange range, boolean followRenames) {

    public SearchRequest {
        if (filePath == null || filePath.isBlank()) {
            throw new IllegalArgumentException("File path must not be empty");
        }
        if (searchString == null || searchString.isEmpty()) {
            throw new IllegalArgumentException("Search string must not be empty");
        }
        if (range == null) {
            range = CommitRange.unbounded();
        }
    }
}
