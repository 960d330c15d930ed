package io.quarkus.qe.git.content.search.history;

/**
 * The latest boundary of a commit range is an ancestor of the earliest one.
 */
public class InvertedRangeException extends HistoryReaderException {

    public InvertedRangeException(String message) {
        super(message);
    }
}
