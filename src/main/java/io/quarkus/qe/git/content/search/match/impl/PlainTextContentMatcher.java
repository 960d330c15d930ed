package io.quarkus.qe.git.content.search.match.impl;

import io.quarkus.qe.git.content.search.history.RetrievedContent;
import io.quarkus.qe.git.content.search.match.ContentMatchException;
import io.quarkus.qe.git.content.search.match.ContentMatcher;
import jakarta.inject.Singleton;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Reads the file as UTF-8 text; malformed input is replaced, so binary files are searched as well.
 */
@Singleton
final class PlainTextContentMatcher implements ContentMatcher {

    @Override
    public boolean contains(RetrievedContent content, String query) {
        try {
            byte[] bytes = Files.readAllBytes(content.path());
            return new String(bytes, StandardCharsets.UTF_8).contains(query);
        } catch (IOException e) {
            throw new ContentMatchException("Failed to read " + content.path() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean supports(String filePath) {
        return true;
    }

    @Override
    public boolean isFallback() {
        return true;
    }
}
