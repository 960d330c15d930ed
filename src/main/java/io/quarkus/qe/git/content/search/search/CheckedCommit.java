package io.quarkus.qe.git.content.search.search;

import io.quarkus.runtime.annotations.RegisterForReflection;

/**
 * Audit record of one probed commit.
 */
@RegisterForReflection
public record CheckedCommit(int index, String hash, String filePath, String timestamp, boolean found, String error) {
}
