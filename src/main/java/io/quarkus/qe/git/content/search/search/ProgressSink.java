package io.quarkus.qe.git.content.search.search;

/**
 * Receives search progress as a fraction in [0,1]. Values never decrease and exactly one 1.0 is
 * reported per search.
 */
@FunctionalInterface
public interface ProgressSink {

    ProgressSink NONE = fraction -> {
    };

    void report(double fraction);

}
