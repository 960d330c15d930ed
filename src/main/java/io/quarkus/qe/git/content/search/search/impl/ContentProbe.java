package io.quarkus.qe.git.content.search.search.impl;

import io.quarkus.qe.git.content.search.history.Commit;
import io.quarkus.qe.git.content.search.history.HistoryReader;
import io.quarkus.qe.git.content.search.history.HistoryReaderException;
import io.quarkus.qe.git.content.search.history.RetrievedContent;
import io.quarkus.qe.git.content.search.match.ContentMatchException;
import io.quarkus.qe.git.content.search.match.ContentMatcher;
import io.quarkus.qe.git.content.search.search.CommitProbe;
import io.quarkus.qe.git.content.search.search.ProbeOutcome;

/**
 * Retrieves the commit's version of the file, looks for the search string and releases the file again.
 */
final class ContentProbe implements CommitProbe {

    private final HistoryReader historyReader;
    private final ContentMatcher contentMatcher;
    private final String searchString;

    ContentProbe(HistoryReader historyReader, ContentMatcher contentMatcher, String searchString) {
        this.historyReader = historyReader;
        this.contentMatcher = contentMatcher;
        this.searchString = searchString;
    }

    @Override
    public ProbeOutcome probe(Commit commit) {
        try (RetrievedContent content = historyReader.materialize(commit)) {
            return ProbeOutcome.of(contentMatcher.contains(content, searchString));
        } catch (HistoryReaderException | ContentMatchException e) {
            return ProbeOutcome.failed(e);
        }
    }
}
