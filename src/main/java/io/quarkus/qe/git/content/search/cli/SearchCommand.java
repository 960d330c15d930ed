package io.quarkus.qe.git.content.search.cli;

import io.quarkus.qe.git.content.search.audit.AuditLog;
import io.quarkus.qe.git.content.search.configuration.AppConfig;
import io.quarkus.qe.git.content.search.history.CommitRange;
import io.quarkus.qe.git.content.search.lifecycle.OnCommandExit;
import io.quarkus.qe.git.content.search.report.SearchReportWriter;
import io.quarkus.qe.git.content.search.search.ContentSearcher;
import io.quarkus.qe.git.content.search.search.SearchRequest;
import io.quarkus.qe.git.content.search.search.SearchResult;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.nio.file.Path;

import static io.quarkus.qe.git.content.search.cli.CommandUtils.SEPARATOR;
import static io.quarkus.qe.git.content.search.cli.CommandUtils.formatProgress;
import static io.quarkus.qe.git.content.search.cli.CommandUtils.now;

@CommandLine.Command(name = "search", mixinStandardHelpOptions = true,
        description = "Search the history of a file for the commits containing a string.")
public class SearchCommand implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE_PATH", description = """
            Path of the searched file, relative to the repository root.
            The file should exist in the latest commit.
            """)
    String filePath;

    @CommandLine.Parameters(index = "1", paramLabel = "SEARCH_STRING", description = """
            Literal string to look for. For .xlsx and .xlsm workbooks, the string must occur within a cell value.
            """)
    String searchString;

    @CommandLine.Option(order = 1, names = { "--earliest-commit" }, description = """
            Oldest commit to consider (hash, branch, tag or relative reference), inclusive.
            Default: the first commit touching the file
            """)
    String earliestCommit;

    @CommandLine.Option(order = 2, names = { "--latest-commit" }, description = """
            Most recent commit to consider, inclusive.
            Default: HEAD
            """)
    String latestCommit;

    @CommandLine.Option(order = 3, names = { "--working-directory" }, description = """
            Git repository to search.
            Default: the current directory
            """)
    Path workingDirectory;

    @CommandLine.Option(order = 4, names = { "--log-directory" }, description = """
            Where the search log (search_log.txt) and temporary file versions are created.
            Default: GitContentSearch in the system temporary directory
            """)
    Path logDirectory;

    @CommandLine.Option(order = 5, names = { "--follow" }, description = "Follow the file across renames",
            defaultValue = "false")
    boolean follow = false;

    @CommandLine.Option(order = 6, names = { "--no-linear-fallback" }, description = """
            Use plain binary search when looking for the last commit containing the string.
            Faster, but may miss the end of the run when a probe lands just before it.
            """, defaultValue = "false")
    boolean noLinearFallback = false;

    @CommandLine.Option(order = 7, names = { "--result-file" }, description = """
            Also write the result as JSON to this file. It replaces a previous file on this very path.
            """)
    String resultFilePath;

    @CommandLine.Option(order = 8, names = { "--debug" }, description = "Log debug messages, including progress",
            defaultValue = "false")
    boolean debug = false;

    @Inject
    ContentSearcher contentSearcher;

    @Inject
    SearchReportWriter searchReportWriter;

    @Inject
    AuditLog auditLog;

    @Inject
    ConsoleLogger consoleLogger;

    @Inject
    Event<AppConfig> appConfigEvent;

    @Inject
    Event<OnCommandExit> onCommandExitEvent;

    @Override
    public void run() {
        consoleLogger.setWriters(spec.commandLine().getOut(), spec.commandLine().getErr(), debug);

        Path repository = CommandUtils.resolveWorkingDirectory(workingDirectory);
        Path logs = CommandUtils.resolveLogDirectory(logDirectory);
        appConfigEvent.fire(new AppConfig(repository, logs, !noLinearFallback, resultFilePath));

        try {
            auditLog.append(SEPARATOR);
            auditLog.append("GitContentSearch started at " + now());
            auditLog.append("Working Directory (Git Repo): " + repository);
            auditLog.append("Logs and temporary files will be created in: " + logs);
            auditLog.append(SEPARATOR);

            SearchRequest request = new SearchRequest(filePath, searchString,
                    new CommitRange(earliestCommit, latestCommit), follow);
            SearchResult result = contentSearcher.search(request,
                    fraction -> consoleLogger.debug(formatProgress(fraction)));
            consoleLogger.debug("Search finished with status " + result.status() + " after "
                    + result.probeCount() + " probe(s)");

            searchReportWriter.write(request, result);

            auditLog.append("GitContentSearch completed at " + now());
            auditLog.append(SEPARATOR);
        } finally {
            onCommandExitEvent.fire(new OnCommandExit());
        }
    }
}
