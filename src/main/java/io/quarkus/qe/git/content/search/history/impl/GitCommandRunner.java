package io.quarkus.qe.git.content.search.history.impl;

import io.quarkus.qe.git.content.search.configuration.AppConfig;
import io.quarkus.qe.git.content.search.history.GitInvocationException;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Runs git commands in the configured repository directory.
 */
@Singleton
public final class GitCommandRunner {

    private static final String GIT = "git";

    private Path workingDirectory;

    GitCommandRunner() {
        this(Path.of("."));
    }

    public GitCommandRunner(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    void updateConfiguration(@Observes AppConfig appConfig) {
        if (appConfig.workingDirectory() != null) {
            this.workingDirectory = appConfig.workingDirectory();
        }
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    /**
     * Run a git command and return its standard output. Standard error is kept for the failure message only.
     *
     * @throws GitInvocationException if git cannot be started or exits with a non-zero code
     */
    public String run(String... arguments) {
        List<String> command = command(arguments);
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(workingDirectory.toFile());

            Process process = pb.start();
            CompletableFuture<String> errorOutput = CompletableFuture.supplyAsync(() -> readErrorOutput(process));
            String output = readAll(process.getInputStream());

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw failure(command, exitCode, errorOutput.join());
            }
            return output;
        } catch (IOException e) {
            throw new GitInvocationException("Failed to execute command: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitInvocationException("Interrupted while executing command: " + String.join(" ", command), e);
        }
    }

    /**
     * Run a git command writing its standard output into the target file.
     *
     * @throws GitInvocationException carrying the standard error output if git fails
     */
    public void runToFile(Path target, String... arguments) {
        List<String> command = command(arguments);
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.directory(workingDirectory.toFile());
            pb.redirectOutput(target.toFile());

            Process process = pb.start();
            String errorOutput = readAll(process.getErrorStream());

            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw failure(command, exitCode, errorOutput);
            }
        } catch (IOException e) {
            throw new GitInvocationException("Failed to execute command: " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitInvocationException("Interrupted while executing command: " + String.join(" ", command), e);
        }
    }

    private static String readAll(InputStream stream) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
            }
        }
        return output.toString();
    }

    private static String readErrorOutput(Process process) {
        try {
            return readAll(process.getErrorStream());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static GitInvocationException failure(List<String> command, int exitCode, String output) {
        String firstLine = output.lines().filter(line -> !line.isBlank()).findFirst().orElse("");
        String message = "Command failed with exit code " + exitCode + ": " + String.join(" ", command);
        if (!firstLine.isEmpty()) {
            message += " (" + firstLine.trim() + ")";
        }
        return new GitInvocationException(message, exitCode, output);
    }

    private static List<String> command(String... arguments) {
        List<String> command = new ArrayList<>(arguments.length + 3);
        command.add(GIT);
        // paths with non-ASCII characters are listed as they are
        command.add("-c");
        command.add("core.quotePath=false");
        command.addAll(List.of(arguments));
        return command;
    }
}
