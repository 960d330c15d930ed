package io.quarkus.qe.git.content.search.locate.impl;

import io.quarkus.qe.git.content.search.history.impl.GitCommandRunner;
import io.quarkus.qe.git.content.search.history.impl.GitLogOutput;
import io.quarkus.qe.git.content.search.locate.FileLocator;
import io.quarkus.qe.git.content.search.locate.LocatedFile;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Looks through the file names touched by any commit reachable from any ref.
 */
@Singleton
final class GitFileLocator implements FileLocator {

    private final GitCommandRunner gitCommandRunner;

    GitFileLocator(GitCommandRunner gitCommandRunner) {
        this.gitCommandRunner = gitCommandRunner;
    }

    @Override
    public List<LocatedFile> locate(String fileName) {
        String query = fileName.replace('\\', '/').toLowerCase(Locale.ROOT);
        String output = gitCommandRunner.run("log", "--all", GitLogOutput.FORMAT, "--name-only");

        // git log lists newest first, so the first commit seen for a path is its most recent one
        Map<String, String> lastCommitByPath = new LinkedHashMap<>();
        for (GitLogOutput.Entry entry : GitLogOutput.parse(output)) {
            entry.paths().forEach(path -> lastCommitByPath.putIfAbsent(path, entry.hash()));
        }

        List<LocatedFile> located = new ArrayList<>();
        lastCommitByPath.forEach((path, commit) -> {
            if (path.toLowerCase(Locale.ROOT).contains(query)) {
                located.add(new LocatedFile(path, commit));
            }
        });

        located.sort(Comparator.comparing((LocatedFile file) -> !isExactFileName(file.path(), query))
                .thenComparing(LocatedFile::path));
        return located;
    }

    private static boolean isExactFileName(String path, String query) {
        String lowerCasePath = path.toLowerCase(Locale.ROOT);
        return lowerCasePath.equals(query) || lowerCasePath.endsWith("/" + query);
    }
}
