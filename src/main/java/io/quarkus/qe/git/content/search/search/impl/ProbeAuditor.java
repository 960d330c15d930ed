package io.quarkus.qe.git.content.search.search.impl;

import io.quarkus.qe.git.content.search.audit.AuditLog;
import io.quarkus.qe.git.content.search.history.Commit;
import io.quarkus.qe.git.content.search.history.HistoryReader;
import io.quarkus.qe.git.content.search.history.HistoryReaderException;
import io.quarkus.qe.git.content.search.search.CheckedCommit;
import io.quarkus.qe.git.content.search.search.ProbeEvent;
import io.quarkus.qe.git.content.search.search.ProbeListener;

import java.util.ArrayList;
import java.util.List;

/**
 * Writes one search log line per probe and remembers the probed commits for the result.
 */
final class ProbeAuditor implements ProbeListener {

    static final String UNKNOWN_TIME = "unknown time";

    private final AuditLog auditLog;
    private final HistoryReader historyReader;
    private final List<CheckedCommit> checkedCommits = new ArrayList<>();

    ProbeAuditor(AuditLog auditLog, HistoryReader historyReader) {
        this.auditLog = auditLog;
        this.historyReader = historyReader;
    }

    @Override
    public void onProbe(ProbeEvent event) {
        Commit commit = event.commit();
        String error = null;

        if (event.outcome().hasError()) {
            error = event.outcome().error().getMessage();
            auditLog.append("Error retrieving file at commit " + commit.hash() + ": " + error);
        }

        String commitTime = commitTime(commit.hash());
        boolean found = event.outcome().found();
        auditLog.append("Checked commit: " + commit.hash() + " at " + commitTime + ", found: " + found);

        checkedCommits.add(new CheckedCommit(event.index(), commit.hash(), commit.filePath(), commitTime, found, error));
    }

    List<CheckedCommit> getCheckedCommits() {
        return List.copyOf(checkedCommits);
    }

    private String commitTime(String commitHash) {
        try {
            return historyReader.timestamp(commitHash);
        } catch (HistoryReaderException e) {
            auditLog.append("Error retrieving commit time for " + commitHash + ": " + e.getMessage());
            return UNKNOWN_TIME;
        }
    }
}
