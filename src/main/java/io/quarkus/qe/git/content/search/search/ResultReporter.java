package io.quarkus.qe.git.content.search.search;

import io.quarkus.qe.git.content.search.history.Commit;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns the boundary indices of a search into the commits and sentences shown to the user.
 */
public final class ResultReporter {

    public SearchSummary summarize(String searchString, CommitTimeline timeline, SearchOutcome outcome) {
        List<String> lines = new ArrayList<>();
        String quoted = "Search string \"" + searchString + "\"";

        if (outcome.firstMatchIndex().isEmpty()) {
            lines.add(quoted + " does not appear in any of the checked commits.");
            return new SearchSummary(null, null, null, lines);
        }

        Commit firstAppearance = timeline.get(outcome.firstMatchIndex().getAsInt());
        Commit lastAppearance = null;
        Commit disappearedIn = null;
        lines.add(quoted + " first appears in commit " + firstAppearance.hash() + ".");

        if (outcome.lastMatchIndex().isPresent()) {
            int lastMatchIndex = outcome.lastMatchIndex().getAsInt();
            lastAppearance = timeline.get(lastMatchIndex);
            lines.add(quoted + " last appears in commit " + lastAppearance.hash() + ".");

            if (lastMatchIndex < timeline.lastIndex()) {
                disappearedIn = timeline.get(lastMatchIndex + 1);
                lines.add(quoted + " disappeared in commit " + disappearedIn.hash() + ".");
            }
        }

        return new SearchSummary(firstAppearance, lastAppearance, disappearedIn, lines);
    }
}
