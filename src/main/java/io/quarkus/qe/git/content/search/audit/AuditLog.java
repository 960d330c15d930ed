package io.quarkus.qe.git.content.search.audit;

/**
 * Append-only search log. Every line is flushed before {@link #append(String)} returns, so an interrupted
 * search leaves a complete trail of the commits checked so far.
 */
@FunctionalInterface
public interface AuditLog {

    void append(String line);

}
