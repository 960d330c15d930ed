package io.quarkus.qe.git.content.search.match.impl;

import io.quarkus.arc.All;
import io.quarkus.qe.git.content.search.match.ContentMatcher;
import io.quarkus.qe.git.content.search.match.ContentMatcherSelector;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.List;

@Singleton
final class ContentMatcherSelectorImpl implements ContentMatcherSelector {

    @All
    @Inject
    List<ContentMatcher> contentMatchers;

    @Override
    public ContentMatcher select(String filePath) {
        return contentMatchers.stream()
                .filter(matcher -> !matcher.isFallback())
                .filter(matcher -> matcher.supports(filePath))
                .findFirst()
                .or(() -> contentMatchers.stream().filter(ContentMatcher::isFallback).findFirst())
                .orElseThrow(() -> new IllegalStateException("No content matcher available for " + filePath));
    }
}
