package io.quarkus.qe.git.content.search.search;

import io.quarkus.qe.git.content.search.history.Commit;

/**
 * One probe performed by the {@link BisectionEngine}.
 */
public record ProbeEvent(ProbePhase phase, int index, Commit commit, ProbeOutcome outcome) {
}
