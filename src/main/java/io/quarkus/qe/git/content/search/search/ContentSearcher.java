package io.quarkus.qe.git.content.search.search;

import java.util.function.BooleanSupplier;

/**
 * Searches the history of a file for the commits containing a string.
 */
public interface ContentSearcher {

    /**
     * Run one search. Failures never escape as exceptions; they end the search with the matching
     * {@link SearchStatus}.
     *
     * @param progressSink receives progress, ending with exactly one 1.0
     * @param cancellation checked before every probe
     */
    SearchResult search(SearchRequest request, ProgressSink progressSink, BooleanSupplier cancellation);

    default SearchResult search(SearchRequest request, ProgressSink progressSink) {
        return search(request, progressSink, () -> false);
    }

}
