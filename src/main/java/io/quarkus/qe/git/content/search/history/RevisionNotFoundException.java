package io.quarkus.qe.git.content.search.history;

/**
 * The requested revision, or the file within it, does not exist.
 */
public class RevisionNotFoundException extends HistoryReaderException {

    public RevisionNotFoundException(String message) {
        super(message);
    }
}
