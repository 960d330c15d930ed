package io.quarkus.qe.git.content.search.match;

public class ContentMatchException extends RuntimeException {

    public ContentMatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
