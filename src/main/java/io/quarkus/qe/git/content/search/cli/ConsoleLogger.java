package io.quarkus.qe.git.content.search.cli;

import io.quarkus.qe.git.content.search.logger.Logger;
import jakarta.inject.Singleton;

import java.io.PrintWriter;

@Singleton
final class ConsoleLogger implements Logger {

    private PrintWriter stdOutWriter = null;
    private PrintWriter stdErrWriter = null;
    private boolean debug = false;

    void setWriters(PrintWriter stdOutWriter, PrintWriter stdErrWriter, boolean debug) {
        this.stdOutWriter = stdOutWriter;
        this.stdErrWriter = stdErrWriter;
        this.debug = debug;
    }

    public void info(String logMessage) {
        stdOutWriter.println(logMessage);
        stdOutWriter.flush();
    }

    public void error(String logMessage) {
        stdErrWriter.println(logMessage);
        stdErrWriter.flush();
    }

    @Override
    public void debug(String logMessage) {
        if (debug) {
            stdOutWriter.println("DEBUG: " + logMessage);
            stdOutWriter.flush();
        }
    }
}
