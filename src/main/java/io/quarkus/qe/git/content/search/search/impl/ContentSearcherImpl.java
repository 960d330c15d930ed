package io.quarkus.qe.git.content.search.search.impl;

import io.quarkus.qe.git.content.search.audit.AuditLog;
import io.quarkus.qe.git.content.search.configuration.AppConfig;
import io.quarkus.qe.git.content.search.history.Commit;
import io.quarkus.qe.git.content.search.history.CommitRange;
import io.quarkus.qe.git.content.search.history.HistoryReader;
import io.quarkus.qe.git.content.search.history.HistoryReaderException;
import io.quarkus.qe.git.content.search.history.InvertedRangeException;
import io.quarkus.qe.git.content.search.history.RetrievedContent;
import io.quarkus.qe.git.content.search.history.RevisionNotFoundException;
import io.quarkus.qe.git.content.search.match.ContentMatcher;
import io.quarkus.qe.git.content.search.match.ContentMatcherSelector;
import io.quarkus.qe.git.content.search.search.BisectionEngine;
import io.quarkus.qe.git.content.search.search.CommitTimeline;
import io.quarkus.qe.git.content.search.search.ContentSearcher;
import io.quarkus.qe.git.content.search.search.ProgressSink;
import io.quarkus.qe.git.content.search.search.ProgressTracker;
import io.quarkus.qe.git.content.search.search.ResultReporter;
import io.quarkus.qe.git.content.search.search.SearchCancelledException;
import io.quarkus.qe.git.content.search.search.SearchOutcome;
import io.quarkus.qe.git.content.search.search.SearchRequest;
import io.quarkus.qe.git.content.search.search.SearchResult;
import io.quarkus.qe.git.content.search.search.SearchStatus;
import io.quarkus.qe.git.content.search.search.SearchSummary;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Singleton;

import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Runs one search: resolves the commit timeline, drives the {@link BisectionEngine} and writes the summary
 * to the search log. Every exit path reports 100% progress.
 */
@Singleton
final class ContentSearcherImpl implements ContentSearcher {

    private static final String INVERTED_RANGE_MESSAGE =
            "Error: The earliest commit is more recent than the latest commit.";

    private final HistoryReader historyReader;
    private final ContentMatcherSelector contentMatcherSelector;
    private final AuditLog auditLog;
    private final ResultReporter resultReporter = new ResultReporter();

    private boolean linearFallback = true;

    ContentSearcherImpl(HistoryReader historyReader, ContentMatcherSelector contentMatcherSelector,
            AuditLog auditLog) {
        this.historyReader = historyReader;
        this.contentMatcherSelector = contentMatcherSelector;
        this.auditLog = auditLog;
    }

    void updateConfiguration(@Observes AppConfig appConfig) {
        this.linearFallback = appConfig.linearFallback();
    }

    @Override
    public SearchResult search(SearchRequest request, ProgressSink progressSink, BooleanSupplier cancellation) {
        ProgressTracker progress = new ProgressTracker(progressSink);
        progress.started();
        try {
            return runSearch(request, progress, cancellation);
        } finally {
            progress.completed();
        }
    }

    private SearchResult runSearch(SearchRequest request, ProgressTracker progress, BooleanSupplier cancellation) {
        warnIfMissingInCurrentCommit(request.filePath());

        CommitRange range;
        try {
            range = resolveRange(request.range());
        } catch (RevisionNotFoundException e) {
            return abort(SearchStatus.UNKNOWN_REFERENCE, CommitTimeline.empty(), "Error: " + e.getMessage());
        } catch (HistoryReaderException e) {
            return abort(SearchStatus.HISTORY_UNAVAILABLE, CommitTimeline.empty(),
                    "Error: Failed to resolve the commit range: " + e.getMessage());
        }

        CommitTimeline timeline;
        try {
            List<Commit> commits = historyReader.listCommits(range, request.filePath(), request.followRenames());
            timeline = CommitTimeline.ofNewestFirst(commits);
        } catch (InvertedRangeException e) {
            return abort(SearchStatus.INVERTED_RANGE, CommitTimeline.empty(), INVERTED_RANGE_MESSAGE);
        } catch (HistoryReaderException e) {
            return abort(SearchStatus.HISTORY_UNAVAILABLE, CommitTimeline.empty(),
                    "Error: Failed to list commits: " + e.getMessage());
        }

        if (timeline.isEmpty()) {
            return abort(SearchStatus.NO_COMMITS_IN_RANGE, timeline, "No commits found in the specified range.");
        }

        progress.timelineResolved();

        if (timeline.isInverted(range)) {
            return abort(SearchStatus.INVERTED_RANGE, timeline, INVERTED_RANGE_MESSAGE);
        }

        ContentMatcher contentMatcher = contentMatcherSelector.select(request.filePath());
        ProbeAuditor probeAuditor = new ProbeAuditor(auditLog, historyReader);
        BisectionEngine engine = new BisectionEngine(
                new ContentProbe(historyReader, contentMatcher, request.searchString()),
                probeAuditor, linearFallback, cancellation);

        SearchOutcome outcome;
        try {
            outcome = engine.search(timeline, progress);
        } catch (SearchCancelledException e) {
            String message = "Search cancelled after checking " + probeAuditor.getCheckedCommits().size()
                    + " commit(s).";
            auditLog.append(message);
            return new SearchResult(SearchStatus.CANCELLED, timeline, SearchOutcome.notFound(),
                    SearchSummary.aborted(message), probeAuditor.getCheckedCommits());
        }

        SearchSummary summary = resultReporter.summarize(request.searchString(), timeline, outcome);
        summary.lines().forEach(auditLog::append);

        return new SearchResult(SearchStatus.COMPLETED, timeline, outcome, summary, probeAuditor.getCheckedCommits());
    }

    private CommitRange resolveRange(CommitRange range) {
        String earliest = range.earliestReference().map(historyReader::resolveReference).orElse(null);
        String latest = range.latestReference().map(historyReader::resolveReference).orElse(null);
        return new CommitRange(earliest, latest);
    }

    private void warnIfMissingInCurrentCommit(String filePath) {
        try (RetrievedContent ignored = historyReader.materialize(new Commit("HEAD", filePath))) {
            // present in HEAD
        } catch (HistoryReaderException e) {
            auditLog.append("Warning: The file '" + filePath + "' does not exist in the current commit.");
            auditLog.append("The search will not include commits where the file path was not found.");
            auditLog.append("Please enter a file path that exists in the latest commit for accurate results.");
            auditLog.append("");
        }
    }

    private SearchResult abort(SearchStatus status, CommitTimeline timeline, String message) {
        auditLog.append(message);
        return SearchResult.aborted(status, timeline, message);
    }
}
