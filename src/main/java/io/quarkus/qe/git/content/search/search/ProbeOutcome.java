package io.quarkus.qe.git.content.search.search;

/**
 * Result of probing one commit. A probe that failed is never a match.
 *
 * @param found whether the search string was found
 * @param error why the probe failed, or null
 */
public record ProbeOutcome(boolean found, Throwable error) {

    public ProbeOutcome {
        if (error != null && found) {
            throw new IllegalArgumentException("A failed probe cannot be a match");
        }
    }

    public static ProbeOutcome of(boolean found) {
        return new ProbeOutcome(found, null);
    }

    public static ProbeOutcome failed(Throwable error) {
        return new ProbeOutcome(false, error);
    }

    public boolean hasError() {
        return error != null;
    }
}
