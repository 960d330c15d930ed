package io.quarkus.qe.git.content.search.history;

import java.nio.file.Path;

/**
 * A file version retrieved from history, valid until closed.
 */
public interface RetrievedContent extends AutoCloseable {

    Path path();

    /**
     * Releases the retrieved file.
     */
    @Override
    void close();

}
