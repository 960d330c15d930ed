package io.quarkus.qe.git.content.search.search;

import io.quarkus.qe.git.content.search.history.Commit;

/**
 * Tests one commit for the presence of the search string. Implementations must not throw;
 * failures are returned as {@link ProbeOutcome#failed(Throwable)}.
 */
@FunctionalInterface
public interface CommitProbe {

    ProbeOutcome probe(Commit commit);

}
