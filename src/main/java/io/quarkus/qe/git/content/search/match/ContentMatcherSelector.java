package io.quarkus.qe.git.content.search.match;

public interface ContentMatcherSelector {

    /**
     * Select the matcher for the searched file, based on its extension.
     */
    ContentMatcher select(String filePath);

}
