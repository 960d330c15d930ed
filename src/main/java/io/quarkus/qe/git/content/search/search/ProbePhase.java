package io.quarkus.qe.git.content.search.search;

public enum ProbePhase {
    LAST_MATCH,
    LINEAR_FALLBACK,
    FIRST_MATCH
}
