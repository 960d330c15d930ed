package io.quarkus.qe.git.content.search.history;

import java.util.Optional;

/**
 * Inclusive boundaries of a search; each boundary is optional.
 */
public record CommitRange(String earliest, String latest) {

    public CommitRange {
        earliest = normalize(earliest);
        latest = normalize(latest);
    }

    public static CommitRange unbounded() {
        return new CommitRange(null, null);
    }

    public Optional<String> earliestReference() {
        return Optional.ofNullable(earliest);
    }

    public Optional<String> latestReference() {
        return Optional.ofNullable(latest);
    }

    public boolean isBounded() {
        return earliest != null && latest != null;
    }

    private static String normalize(String reference) {
        return reference == null || reference.isBlank() ? null : reference.trim();
    }
}
