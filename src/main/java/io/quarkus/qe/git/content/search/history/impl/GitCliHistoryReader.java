package io.quarkus.qe.git.content.search.history.impl;

import io.quarkus.qe.git.content.search.configuration.AppConfig;
import io.quarkus.qe.git.content.search.history.Commit;
import io.quarkus.qe.git.content.search.history.CommitRange;
import io.quarkus.qe.git.content.search.history.GitInvocationException;
import io.quarkus.qe.git.content.search.history.HistoryReader;
import io.quarkus.qe.git.content.search.history.HistoryReaderException;
import io.quarkus.qe.git.content.search.history.InvertedRangeException;
import io.quarkus.qe.git.content.search.history.RetrievedContent;
import io.quarkus.qe.git.content.search.history.RevisionNotFoundException;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * {@link HistoryReader} backed by the git command line.
 * <p>
 * File versions are written with {@code git show <commit>:<path>} into the configured temporary directory,
 * named after the commit and the original file name so that the extension is preserved.
 */
@Singleton
final class GitCliHistoryReader implements HistoryReader {

    private static final List<String> NOT_FOUND_MARKERS = List.of(
            "does not exist in",
            "exists on disk, but not in",
            "invalid object name",
            "not a valid object name",
            "bad revision",
            "unknown revision");

    private final GitCommandRunner gitCommandRunner;
    private Path temporaryDirectory;

    GitCliHistoryReader(GitCommandRunner gitCommandRunner) {
        this.gitCommandRunner = gitCommandRunner;
        this.temporaryDirectory = Path.of(System.getProperty("java.io.tmpdir"));
    }

    void updateConfiguration(@Observes AppConfig appConfig) {
        if (appConfig.logDirectory() != null) {
            this.temporaryDirectory = appConfig.logDirectory();
        }
    }

    @Override
    public List<Commit> listCommits(CommitRange range, String filePath, boolean followRenames) {
        String gitPath = toGitPath(filePath);
        String tip = range.latestReference().orElse("HEAD");
        String earliest = range.earliest();

        if (range.isBounded() && isStrictAncestor(range.latest(), range.earliest())) {
            throw new InvertedRangeException("Commit " + range.earliest() + " is more recent than commit "
                    + range.latest());
        }

        List<String> arguments = new ArrayList<>(List.of("log", GitLogOutput.FORMAT, "--name-only"));
        if (followRenames) {
            arguments.add("--follow");
        }
        arguments.add(tip);
        if (earliest != null) {
            // parents of the earliest commit are excluded, the earliest commit itself is kept
            arguments.add("--not");
            arguments.add(earliest + "^@");
        }
        arguments.add("--");
        arguments.add(gitPath);

        String output = gitCommandRunner.run(arguments.toArray(String[]::new));
        return parseLog(output, gitPath);
    }

    @Override
    public RetrievedContent materialize(Commit commit) {
        Path target = temporaryFile(commit);
        try {
            Files.createDirectories(target.getParent());
            gitCommandRunner.runToFile(target, "show", commit.hash() + ":" + toGitPath(commit.filePath()));
            return new TemporaryFileContent(target);
        } catch (GitInvocationException e) {
            deleteQuietly(target);
            if (isNotFound(e.getOutput())) {
                throw new RevisionNotFoundException("File '" + commit.filePath() + "' does not exist in commit "
                        + commit.hash());
            }
            throw e;
        } catch (IOException e) {
            deleteQuietly(target);
            throw new HistoryReaderException("Failed to create temporary file " + target, e);
        }
    }

    @Override
    public String timestamp(String commitHash) {
        return gitCommandRunner.run("show", "-s", "--format=%ci", commitHash).trim();
    }

    @Override
    public String resolveReference(String reference) {
        try {
            return gitCommandRunner.run("rev-parse", "--verify", "--quiet", reference + "^{commit}").trim();
        } catch (GitInvocationException e) {
            if (e.getExitCode() == 1 || isNotFound(e.getOutput())) {
                throw new RevisionNotFoundException("Reference '" + reference + "' does not name a commit");
            }
            throw e;
        }
    }

    /**
     * Commits of the log output, with the requested path for commits listing no path (merges).
     */
    static List<Commit> parseLog(String output, String requestedPath) {
        List<Commit> commits = new ArrayList<>();
        for (GitLogOutput.Entry entry : GitLogOutput.parse(output)) {
            String path = entry.paths().isEmpty() ? requestedPath : entry.paths().get(0);
            commits.add(new Commit(entry.hash(), path));
        }
        return commits;
    }

    static String toGitPath(String filePath) {
        String gitPath = filePath.replace('\\', '/');
        while (gitPath.startsWith("./")) {
            gitPath = gitPath.substring(2);
        }
        return gitPath;
    }

    private boolean isStrictAncestor(String ancestor, String descendant) {
        String ancestorHash = resolveReference(ancestor);
        String descendantHash = resolveReference(descendant);
        if (ancestorHash.equals(descendantHash)) {
            return false;
        }
        try {
            gitCommandRunner.run("merge-base", "--is-ancestor", ancestorHash, descendantHash);
            return true;
        } catch (GitInvocationException e) {
            if (e.getExitCode() == 1) {
                return false;
            }
            throw e;
        }
    }

    private Path temporaryFile(Commit commit) {
        String fileName = Path.of(commit.filePath()).getFileName().toString();
        return temporaryDirectory.resolve(commit.hash() + "_" + fileName);
    }

    private static boolean isNotFound(String gitOutput) {
        String output = gitOutput.toLowerCase(Locale.ROOT);
        return NOT_FOUND_MARKERS.stream().anyMatch(output::contains);
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            file.toFile().deleteOnExit();
        }
    }
}
