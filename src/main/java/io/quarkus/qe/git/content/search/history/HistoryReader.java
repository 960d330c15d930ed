package io.quarkus.qe.git.content.search.history;

import java.util.List;

/**
 * Reads the history of a single file from a version-control repository.
 * All failures are reported as {@link HistoryReaderException}.
 */
public interface HistoryReader {

    /**
     * List the commits touching the file within the range, inclusive, in the reader's native order
     * (newest first for git).
     *
     * @return commits, empty when no commit touches the file in the range
     * @throws InvertedRangeException if the latest boundary is an ancestor of the earliest one
     */
    List<Commit> listCommits(CommitRange range, String filePath, boolean followRenames);

    /**
     * Write the commit's version of its file to a temporary location. The caller owns the returned handle
     * and must close it.
     *
     * @throws RevisionNotFoundException if the file does not exist in the commit
     * @throws GitInvocationException if the version-control tool failed
     */
    RetrievedContent materialize(Commit commit);

    /**
     * Commit time suitable for display.
     */
    String timestamp(String commitHash);

    /**
     * Resolve a user supplied reference (abbreviated hash, branch, tag, relative ref) to a full commit hash.
     *
     * @throws RevisionNotFoundException if the reference does not name a commit
     */
    String resolveReference(String reference);

}
