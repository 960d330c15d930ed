package io.quarkus.qe.git.content.search.search;

public enum SearchStatus {
    /** Both searches ran; the outcome may still be "not found" */
    COMPLETED,
    /** No commit touches the file in the requested range */
    NO_COMMITS_IN_RANGE,
    /** The earliest commit is more recent than the latest commit */
    INVERTED_RANGE,
    /** A boundary reference does not name a commit */
    UNKNOWN_REFERENCE,
    /** The history could not be read at all */
    HISTORY_UNAVAILABLE,
    /** The caller cancelled the search */
    CANCELLED
}
