package io.quarkus.qe.git.content.search.locate;

/**
 * A path found in the repository history.
 *
 * @param path repository relative path
 * @param lastCommit most recent commit touching the path
 */
public record LocatedFile(String path, String lastCommit) {
}
