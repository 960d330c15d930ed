package io.quarkus.qe.git.content.search.logger;

public interface Logger {

    void info(String logMessage);

    void error(String logMessage);

    default void debug(String logMessage) {
    }

}
