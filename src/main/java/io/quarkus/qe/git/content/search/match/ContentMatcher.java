package io.quarkus.qe.git.content.search.match;

import io.quarkus.qe.git.content.search.history.RetrievedContent;

/**
 * Decides whether a search string occurs in a retrieved file version.
 */
public interface ContentMatcher {

    /**
     * @throws ContentMatchException if the content cannot be read in this matcher's format
     */
    boolean contains(RetrievedContent content, String query);

    /**
     * Whether this matcher understands files with the given path.
     */
    boolean supports(String filePath);

    /**
     * Fallback matchers are used only when no other matcher supports a file.
     */
    default boolean isFallback() {
        return false;
    }

}
