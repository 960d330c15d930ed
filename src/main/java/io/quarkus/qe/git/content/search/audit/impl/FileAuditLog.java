package io.quarkus.qe.git.content.search.audit.impl;

import io.quarkus.qe.git.content.search.audit.AuditLog;
import io.quarkus.qe.git.content.search.configuration.AppConfig;
import io.quarkus.qe.git.content.search.lifecycle.OnCommandExit;
import io.quarkus.qe.git.content.search.logger.Logger;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes the search log to the console and appends it to {@code search_log.txt} in the log directory.
 * After a failed write the file is dropped and the log continues on the console only.
 */
@Singleton
final class FileAuditLog implements AuditLog {

    static final String LOG_FILE_NAME = "search_log.txt";

    private final Logger logger;
    private BufferedWriter fileWriter;
    private Path logFile;

    FileAuditLog(Logger logger) {
        this.logger = logger;
    }

    void updateConfiguration(@Observes AppConfig appConfig) {
        close();
        logFile = null;
        if (appConfig.logDirectory() == null) {
            return;
        }

        logFile = appConfig.logDirectory().resolve(LOG_FILE_NAME);
        try {
            Files.createDirectories(appConfig.logDirectory());
            fileWriter = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            logger.error("Failed to open search log " + logFile + ": " + e.getMessage());
            throw new UncheckedIOException("Failed to open search log " + logFile, e);
        }
    }

    @Override
    public synchronized void append(String line) {
        logger.info(line);

        if (fileWriter == null) {
            return;
        }
        try {
            fileWriter.write(line);
            fileWriter.newLine();
            fileWriter.flush();
        } catch (IOException e) {
            logger.error("Failed to write to search log " + logFile + ": " + e.getMessage()
                    + ". Further lines are written to the console only.");
            close();
            logFile = null;
        }
    }

    Path getLogFile() {
        return logFile;
    }

    void closeOnExit(@Observes OnCommandExit ignored) {
        close();
    }

    private synchronized void close() {
        if (fileWriter == null) {
            return;
        }
        try {
            fileWriter.close();
        } catch (IOException e) {
            logger.error("Failed to close search log " + logFile + ": " + e.getMessage());
        } finally {
            fileWriter = null;
        }
    }
}
