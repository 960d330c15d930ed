package io.quarkus.qe.git.content.search.history;

public class HistoryReaderException extends RuntimeException {

    public HistoryReaderException(String message) {
        super(message);
    }

    public HistoryReaderException(String message, Throwable cause) {
        super(message, cause);
    }
}
