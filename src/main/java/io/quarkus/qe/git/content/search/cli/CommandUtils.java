package io.quarkus.qe.git.content.search.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

final class CommandUtils {

    static final String SEPARATOR = "=".repeat(50);
    static final String DEFAULT_LOG_DIRECTORY_NAME = "GitContentSearch";

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private CommandUtils() {
    }

    /**
     * The git repository to read; the current directory unless given.
     */
    static Path resolveWorkingDirectory(Path workingDirectory) {
        Path directory = workingDirectory == null ? Path.of("") : workingDirectory;
        directory = directory.toAbsolutePath().normalize();
        if (!Files.isDirectory(directory)) {
            throw new IllegalArgumentException("Working directory '" + directory + "' does not exist");
        }
        return directory;
    }

    /**
     * Directory for the search log and the temporary file versions. Defaults to a
     * {@value #DEFAULT_LOG_DIRECTORY_NAME} directory in the system temporary directory; created if missing.
     */
    static Path resolveLogDirectory(Path logDirectory) {
        Path directory = logDirectory == null
                ? Path.of(System.getProperty("java.io.tmpdir"), DEFAULT_LOG_DIRECTORY_NAME)
                : logDirectory;
        directory = directory.toAbsolutePath().normalize();
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new RuntimeException("Failed to create log directory: " + directory, e);
        }
        return directory;
    }

    static String now() {
        return LocalDateTime.now().format(TIME_FORMAT);
    }

    static String formatProgress(double fraction) {
        return String.format(Locale.ROOT, "Progress: %.1f%%", fraction * 100);
    }
}
