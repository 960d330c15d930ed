package io.quarkus.qe.git.content.search.search;

public class SearchCancelledException extends RuntimeException {

    public SearchCancelledException(String message) {
        super(message);
    }
}
