package io.github.jbellis.ticketsync.git;

import io.github.jbellis.ticketsync.TicketLayout;
import org.eclipse.jgit.api.Git;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

public class GitCheckoutTest {
    private Path folder;
    private GitCheckout checkout;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws Exception {
        folder = Files.createDirectories(tempDir.resolve("PROJ-1"));
        Files.createDirectories(folder.resolve(TicketLayout.METADATA_DIR));
        TicketHistory.initPrimary(folder);
        checkout = TicketHistory.openPrimary(folder);
    }

    @AfterEach
    void tearDown() {
        if (checkout != null) {
            checkout.close();
        }
    }

    private void commitFile(String name, String content, String message) throws Exception {
        Files.writeString(folder.resolve(name), content);
        checkout.stageAll();
        assertTrue(checkout.commit(message).isPresent());
    }

    @Test
    void testCommitWithNothingStagedIsEmpty() throws Exception {
        checkout.stageAll();
        assertEquals(Optional.empty(), checkout.commit("nothing"));
    }

    @Test
    void testStageAllIncludesDeletions() throws Exception {
        commitFile("a.txt", "A", "add a");
        commitFile("b.txt", "B", "add b");

        Files.delete(folder.resolve("a.txt"));
        Files.writeString(folder.resolve("b.txt"), "B2");
        Files.writeString(folder.resolve("c.txt"), "C");
        checkout.stageAll();
        assertTrue(checkout.commit("change all").isPresent());

        assertEquals(Optional.empty(), checkout.readFile("HEAD", "a.txt"));
        assertEquals(Optional.of("B2"), checkout.readFile("HEAD", "b.txt"));
        assertEquals(Optional.of("C"), checkout.readFile("HEAD", "c.txt"));
        assertEquals(Optional.of("A"), checkout.readFile("HEAD~1", "a.txt"));
    }

    @Test
    void testReadFileOfUnknownRevisionIsEmpty() throws Exception {
        assertEquals(Optional.empty(), checkout.readFile("no-such-branch", "a.txt"));
    }

    @Test
    void testMetadataDirectoryIsExcluded() throws Exception {
        Files.writeString(folder.resolve(TicketLayout.METADATA_DIR).resolve("scratch"), "x");
        Files.writeString(folder.resolve("new.txt"), "n");

        assertEquals(Set.of("new.txt"), checkout.untrackedFiles());
    }

    @Test
    void testUntrackedAndModified() throws Exception {
        commitFile("tracked.txt", "v1", "add tracked");
        Files.writeString(folder.resolve("tracked.txt"), "v2");
        Files.createDirectories(folder.resolve("sub"));
        Files.writeString(folder.resolve("sub/new.txt"), "n");

        assertEquals(Set.of("tracked.txt"), checkout.modifiedFiles());
        assertEquals(Set.of("sub/new.txt"), checkout.untrackedFiles());
    }

    @Test
    void testStashAndPopRestoreChanges() throws Exception {
        commitFile("tracked.txt", "v1", "add tracked");
        Files.writeString(folder.resolve("tracked.txt"), "v2");
        Files.writeString(folder.resolve("untracked.txt"), "u");

        assertTrue(checkout.stash("test stash"));
        assertEquals("v1", Files.readString(folder.resolve("tracked.txt")));
        assertFalse(Files.exists(folder.resolve("untracked.txt")));

        assertTrue(checkout.popStash());
        assertEquals("v2", Files.readString(folder.resolve("tracked.txt")));
        assertEquals("u", Files.readString(folder.resolve("untracked.txt")));
    }

    @Test
    void testStashWithNothingToStash() throws Exception {
        assertFalse(checkout.stash("empty"));
        assertFalse(checkout.popStash(), "popping without a stash fails quietly");
    }

    @Test
    void testMergeReportsConflictsAndLeavesMarkers() throws Exception {
        commitFile("a.txt", "base\n", "base");
        try (var git = Git.wrap(checkout.getRepository())) {
            git.branchCreate().setName("other").call();
            commitFile("a.txt", "local\n", "local edit");
            git.checkout().setName("other").call();
            commitFile("a.txt", "remote\n", "remote edit");
            git.checkout().setName(TicketLayout.LOCAL_BRANCH).call();
        }

        var conflicts = checkout.merge("other");

        assertEquals(List.of("a.txt"), conflicts);
        var merged = Files.readString(folder.resolve("a.txt"));
        assertTrue(merged.contains("<<<<<<<"), merged);
        assertTrue(merged.contains("local"));
        assertTrue(merged.contains("remote"));
    }

    @Test
    void testCleanMergeAndMergeBase() throws Exception {
        commitFile("a.txt", "base\n", "base");
        var base = checkout.resolve("HEAD").getName();
        try (var git = Git.wrap(checkout.getRepository())) {
            git.branchCreate().setName("other").call();
            git.checkout().setName("other").call();
            commitFile("b.txt", "from other\n", "other edit");
            git.checkout().setName(TicketLayout.LOCAL_BRANCH).call();
        }
        commitFile("c.txt", "from master\n", "master edit");

        assertEquals(Optional.of(base), checkout.mergeBase(TicketLayout.LOCAL_BRANCH, "other"));
        assertEquals(List.of(), checkout.merge("other"));
        assertEquals("from other\n", Files.readString(folder.resolve("b.txt")));
        assertEquals(Optional.of(checkout.resolve("other").getName()),
                     checkout.mergeBase(TicketLayout.LOCAL_BRANCH, "other"));
    }

    @Test
    void testShadowPushesIntoPrimaryWithoutTakingLocalCommits() throws Exception {
        try (var shadow = TicketHistory.cloneShadow(folder)) {
            shadow.write(Map.of("remote.txt", "from remote\n".getBytes(UTF_8)));
            assertTrue(shadow.commit("remote change").isPresent());
            assertTrue(shadow.commit("again").isEmpty());
            shadow.pushTo(TicketLayout.TRACKING_BRANCH);

            assertEquals(Optional.of("from remote\n"),
                         checkout.readFile(TicketLayout.TRACKING_BRANCH, "remote.txt"));

            assertEquals(List.of(), checkout.merge(TicketLayout.TRACKING_BRANCH));
            commitFile("local.txt", "from local\n", "local change");

            shadow.fetch();
            assertFalse(Files.exists(shadow.root().resolve("local.txt")));
            shadow.write(Map.of("remote.txt", "newer remote\n".getBytes(UTF_8)));
            assertTrue(shadow.commit("second remote change").isPresent());
            shadow.pushTo(TicketLayout.TRACKING_BRANCH);

            assertEquals(List.of(), checkout.merge(TicketLayout.TRACKING_BRANCH));
            assertEquals("newer remote\n", Files.readString(folder.resolve("remote.txt")));
            assertEquals("from local\n", Files.readString(folder.resolve("local.txt")));
        }
    }

    @Test
    void testCloneShadowReusesInterruptedClone() throws Exception {
        try (var shadow = TicketHistory.cloneShadow(folder);
             var git = Git.open(shadow.root().toFile())) {
            git.checkout().setName(TicketLayout.LOCAL_BRANCH).call();
        }

        try (var shadow = TicketHistory.cloneShadow(folder);
             var git = Git.open(shadow.root().toFile())) {
            assertEquals(TicketLayout.TRACKING_BRANCH, git.getRepository().getBranch());
            shadow.pushTo(TicketLayout.TRACKING_BRANCH);
        }
        assertNotNull(checkout.resolve(TicketLayout.TRACKING_BRANCH));
    }
}
