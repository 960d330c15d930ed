package io.quarkus.qe.git.content.search.history.impl;

import io.quarkus.qe.git.content.search.history.RetrievedContent;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Temporary file holding one file version; deleted on close.
 */
record TemporaryFileContent(Path path) implements RetrievedContent {

    @Override
    public void close() {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            // the file may still be held open on some platforms
            path.toFile().deleteOnExit();
        }
    }
}
