package io.quarkus.qe.git.content.search.history;

/**
 * The git process could not be started or exited with an error.
 */
public class GitInvocationException extends HistoryReaderException {

    private final int exitCode;
    private final String output;

    public GitInvocationException(String message, int exitCode, String output) {
        super(message);
        this.exitCode = exitCode;
        this.output = output;
    }

    public GitInvocationException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
        this.output = "";
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }
}
