package io.quarkus.qe.git.content.search.cli;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine;

@TopCommand
@CommandLine.Command(name = "git-content-search", mixinStandardHelpOptions = true,
        subcommands = { SearchCommand.class, LocateCommand.class },
        description = "Finds the commits in which a string appeared in and disappeared from a file.")
public class GitContentSearchCommand implements Runnable {

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
