package io.quarkus.qe.git.content.search.report;

import io.quarkus.qe.git.content.search.search.SearchRequest;
import io.quarkus.qe.git.content.search.search.SearchResult;

/**
 * Stores the result of a search, if the user asked for it.
 */
@FunctionalInterface
public interface SearchReportWriter {

    SearchReportWriter NONE = (request, result) -> {
    };

    void write(SearchRequest request, SearchResult result);

}
