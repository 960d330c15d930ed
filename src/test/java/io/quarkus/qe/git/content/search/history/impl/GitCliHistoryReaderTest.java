package io.quarkus.qe.git.content.search.history.impl;

import io.quarkus.qe.git.content.search.TestGitRepository;
import io.quarkus.qe.git.content.search.configuration.AppConfig;
import io.quarkus.qe.git.content.search.history.Commit;
import io.quarkus.qe.git.content.search.history.CommitRange;
import io.quarkus.qe.git.content.search.history.InvertedRangeException;
import io.quarkus.qe.git.content.search.history.RetrievedContent;
import io.quarkus.qe.git.content.search.history.RevisionNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class GitCliHistoryReaderTest {

    @TempDir
    Path tempDir;

    private TestGitRepository repository;
    private GitCliHistoryReader reader;
    private Path temporaryFiles;

    @BeforeEach
    void setUp() throws Exception {
        assumeTrue(TestGitRepository.isGitAvailable(), "git is not installed");
        repository = TestGitRepository.init(tempDir.resolve("repo"));
        temporaryFiles = tempDir.resolve("tmp");
        reader = new GitCliHistoryReader(new GitCommandRunner(repository.directory()));
        reader.updateConfiguration(new AppConfig(repository.directory(), temporaryFiles, true, null));
    }

    @Test
    void listsCommitsNewestFirst() throws Exception {
        List<String> hashes = repository.commitVersions("config.txt", List.of("v0", "v1", "v2"));
        repository.commit("other.txt", "unrelated", "Unrelated change");

        List<Commit> commits = reader.listCommits(CommitRange.unbounded(), "config.txt", false);

        assertEquals(List.of(hashes.get(2), hashes.get(1), hashes.get(0)), hashesOf(commits));
        assertTrue(commits.stream().allMatch(commit -> commit.filePath().equals("config.txt")));
    }

    @Test
    void rangeIsInclusive() throws Exception {
        List<String> hashes = repository.commitVersions("config.txt", List.of("v0", "v1", "v2", "v3", "v4"));

        List<Commit> commits = reader.listCommits(new CommitRange(hashes.get(1), hashes.get(3)), "config.txt", false);

        assertEquals(List.of(hashes.get(3), hashes.get(2), hashes.get(1)), hashesOf(commits));
    }

    @Test
    void invertedRangeIsRejected() throws Exception {
        List<String> hashes = repository.commitVersions("config.txt", List.of("v0", "v1", "v2", "v3"));

        assertThrows(InvertedRangeException.class,
                () -> reader.listCommits(new CommitRange(hashes.get(3), hashes.get(1)), "config.txt", false));
    }

    @Test
    void invertedRangeIsRejectedWhenBoundariesDoNotTouchFile() throws Exception {
        repository.commit("config.txt", "A", "A");
        String b = repository.commit("other.txt", "B", "B");
        repository.commit("config.txt", "C", "C");
        String d = repository.commit("other.txt", "D", "D");
        repository.commit("config.txt", "E", "E");

        assertThrows(InvertedRangeException.class,
                () -> reader.listCommits(new CommitRange(d, b), "config.txt", false));

        List<Commit> inOrder = reader.listCommits(new CommitRange(b, d), "config.txt", false);
        assertEquals(1, inOrder.size());
    }

    @Test
    void nonAsciiFileName() throws Exception {
        assumeTrue(TestGitRepository.supportsFileName("données/résumé.txt"), "platform encoding is not Unicode");
        List<String> hashes = repository.commitVersions("données/résumé.txt", List.of("v0", "v1", "v2"));

        List<Commit> commits = reader.listCommits(CommitRange.unbounded(), "données/résumé.txt", false);

        assertEquals(List.of(hashes.get(2), hashes.get(1), hashes.get(0)), hashesOf(commits));
        assertEquals("données/résumé.txt", commits.get(1).filePath());
        try (RetrievedContent content = reader.materialize(commits.get(1))) {
            assertEquals("v1", Files.readString(content.path(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void pathLookingLikeCommitHeader() throws Exception {
        List<String> hashes = repository.commitVersions("commit notes.txt", List.of("first", "second"));

        List<Commit> commits = reader.listCommits(CommitRange.unbounded(), "commit notes.txt", false);

        assertEquals(List.of(hashes.get(1), hashes.get(0)), hashesOf(commits));
        assertTrue(commits.stream().allMatch(commit -> commit.filePath().equals("commit notes.txt")));
    }

    @Test
    void followsRenames() throws Exception {
        String first = repository.commit("old/name.txt", "MARKER\n", "Add file");
        String second = repository.commit("old/name.txt", "MARKER\nmore\n", "Edit file");
        String renamed = repository.rename("old/name.txt", "new/name.txt", "Move file");

        List<Commit> withoutFollow = reader.listCommits(CommitRange.unbounded(), "new/name.txt", false);
        List<Commit> withFollow = reader.listCommits(CommitRange.unbounded(), "new/name.txt", true);

        assertEquals(List.of(renamed), hashesOf(withoutFollow));
        assertEquals(List.of(renamed, second, first), hashesOf(withFollow));
        assertEquals("new/name.txt", withFollow.get(0).filePath());
        assertEquals("old/name.txt", withFollow.get(2).filePath());

        try (RetrievedContent content = reader.materialize(withFollow.get(2))) {
            assertEquals("MARKER\n", Files.readString(content.path(), StandardCharsets.UTF_8));
        }
    }

    @Test
    void materializeWritesTemporaryFileAndCloseDeletesIt() throws Exception {
        String hash = repository.commit("data/values.csv", "id,value\n1,42\n", "Add values");

        Path path;
        try (RetrievedContent content = reader.materialize(new Commit(hash, "data/values.csv"))) {
            path = content.path();
            assertEquals(temporaryFiles.resolve(hash + "_values.csv"), path);
            assertEquals("id,value\n1,42\n", Files.readString(path, StandardCharsets.UTF_8));
        }
        assertFalse(Files.exists(path));
    }

    @Test
    void materializeMissingFile() throws Exception {
        String hash = repository.commit("config.txt", "v0", "Initial");

        assertThrows(RevisionNotFoundException.class, () -> reader.materialize(new Commit(hash, "missing.txt")));
        assertThrows(RevisionNotFoundException.class, () -> reader.materialize(new Commit("HEAD", "missing.txt")));
        assertFalse(Files.exists(temporaryFiles.resolve(hash + "_missing.txt")));
    }

    @Test
    void resolvesReferences() throws Exception {
        List<String> hashes = repository.commitVersions("config.txt", List.of("v0", "v1"));

        assertEquals(hashes.get(1), reader.resolveReference("HEAD"));
        assertEquals(hashes.get(0), reader.resolveReference("HEAD~1"));
        assertEquals(hashes.get(0), reader.resolveReference(hashes.get(0).substring(0, 8)));
        assertThrows(RevisionNotFoundException.class, () -> reader.resolveReference("no-such-branch"));
    }

    @Test
    void timestampOfCommit() throws Exception {
        String hash = repository.commit("config.txt", "v0", "Initial");

        String timestamp = reader.timestamp(hash);

        assertTrue(timestamp.matches("\\d{4}-\\d{2}-\\d{2} \\d{2}:\\d{2}:\\d{2} [+-]\\d{4}"), timestamp);
    }

    @Test
    void parseLogUsesRequestedPathWhenNoneListed() {
        String output = "\u0001aaaa1111\n\nsrc/App.java\n\n\u0001bbbb2222\n\n\u0001cccc3333\n\nsrc/Old.java\n";

        List<Commit> commits = GitCliHistoryReader.parseLog(output, "src/App.java");

        assertEquals(List.of(
                new Commit("aaaa1111", "src/App.java"),
                new Commit("bbbb2222", "src/App.java"),
                new Commit("cccc3333", "src/Old.java")), commits);
    }

    @Test
    void gitPathUsesForwardSlashes() {
        assertEquals("src/main/App.java", GitCliHistoryReader.toGitPath("src\\main\\App.java"));
        assertEquals("docs/index.md", GitCliHistoryReader.toGitPath("./docs/index.md"));
    }

    private static List<String> hashesOf(List<Commit> commits) {
        return commits.stream().map(Commit::hash).collect(Collectors.toList());
    }
}
