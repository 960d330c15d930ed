package io.quarkus.qe.git.content.search.history.impl;

import io.quarkus.qe.git.content.search.TestGitRepository;
import io.quarkus.qe.git.content.search.history.GitInvocationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class GitCommandRunnerTest {

    @TempDir
    Path tempDir;

    private TestGitRepository repository;
    private GitCommandRunner runner;

    @BeforeEach
    void setUp() throws Exception {
        assumeTrue(TestGitRepository.isGitAvailable(), "git is not installed");
        repository = TestGitRepository.init(tempDir.resolve("repo"));
        repository.commit("config.txt", "v0", "Initial");
        runner = new GitCommandRunner(repository.directory());
    }

    @Test
    void standardErrorIsNotPartOfOutput() {
        // git reports the branch switch on standard error only
        String output = runner.run("checkout", "-b", "feature");

        assertEquals("", output);
    }

    @Test
    void failureCarriesStandardError() {
        GitInvocationException e = assertThrows(GitInvocationException.class,
                () -> runner.run("rev-parse", "--verify", "no-such-branch"));

        assertEquals(128, e.getExitCode());
        assertTrue(e.getOutput().startsWith("fatal: "), e.getOutput());
        assertTrue(e.getMessage().contains("(fatal: "), e.getMessage());
    }
}
