package io.quarkus.qe.git.content.search.search;

import java.util.OptionalInt;

/**
 * Boundaries of the run of commits containing the search string, as timeline indices.
 */
public record SearchOutcome(OptionalInt firstMatchIndex, OptionalInt lastMatchIndex) {

    public static SearchOutcome notFound() {
        return new SearchOutcome(OptionalInt.empty(), OptionalInt.empty());
    }

    public boolean isFound() {
        return firstMatchIndex.isPresent();
    }
}
