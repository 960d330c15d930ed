package io.quarkus.qe.git.content.search.cli;

import io.quarkus.qe.git.content.search.configuration.AppConfig;
import io.quarkus.qe.git.content.search.history.HistoryReaderException;
import io.quarkus.qe.git.content.search.locate.FileLocator;
import io.quarkus.qe.git.content.search.locate.LocatedFile;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.List;

@CommandLine.Command(name = "locate", mixinStandardHelpOptions = true,
        description = "List the paths a file has had in the repository history.")
public class LocateCommand implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "FILE_NAME", description = """
            File name, or part of a path, to look for. Matching ignores case.
            """)
    String fileName;

    @CommandLine.Option(order = 1, names = { "--working-directory" }, description = """
            Git repository to search.
            Default: the current directory
            """)
    Path workingDirectory;

    @Inject
    FileLocator fileLocator;

    @Inject
    ConsoleLogger consoleLogger;

    @Inject
    Event<AppConfig> appConfigEvent;

    @Override
    public void run() {
        consoleLogger.setWriters(spec.commandLine().getOut(), spec.commandLine().getErr(), false);
        appConfigEvent.fire(new AppConfig(CommandUtils.resolveWorkingDirectory(workingDirectory), null, true, null));

        List<LocatedFile> locatedFiles;
        try {
            locatedFiles = fileLocator.locate(fileName);
        } catch (HistoryReaderException e) {
            consoleLogger.error("Failed to read the repository history: " + e.getMessage());
            return;
        }

        if (locatedFiles.isEmpty()) {
            consoleLogger.info("No files matching '" + fileName + "' found in the repository history.");
            return;
        }

        consoleLogger.info("Found " + locatedFiles.size() + " path(s) matching '" + fileName + "':");
        for (LocatedFile locatedFile : locatedFiles) {
            consoleLogger.info("  " + locatedFile.path() + " (last changed in commit " + locatedFile.lastCommit() + ")");
        }
    }
}
