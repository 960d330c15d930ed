package io.quarkus.qe.git.content.search.history;

import java.util.Objects;

/**
 * A commit touching the searched file.
 *
 * @param hash commit identifier, unique within a timeline
 * @param filePath path of the searched file in this commit; differs from the requested path when renames are followed
 */
public record Commit(String hash, String filePath) {

    private static final int MIN_ABBREVIATED_HASH_LENGTH = 4;

    public Commit {
        Objects.requireNonNull(hash, "Commit hash must not be null");
        Objects.requireNonNull(filePath, "Commit file path must not be null");
    }

    /**
     * Whether the reference is this commit's hash or an abbreviation of it.
     */
    public boolean matchesReference(String reference) {
        if (reference == null || reference.isBlank()) {
            return false;
        }
        if (hash.equals(reference)) {
            return true;
        }
        return reference.length() >= MIN_ABBREVIATED_HASH_LENGTH && hash.startsWith(reference);
    }
}
