package io.github.jbellis.ticketsync.git;

import org.eclipse.jgit.api.errors.GitAPIException;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The version-control operations a ticket folder needs from one checkout (work tree plus history).
 * Paths are relative to {@link #workTree()} and use '/' separators.
 */
public interface TicketCheckout extends AutoCloseable {
    Path workTree();

    /**
     * Stages every change in the work tree, deletions included.
     */
    void stageAll() throws GitAPIException;

    /**
     * Commits whatever is staged.
     *
     * @return the new commit id, or empty if there was nothing to commit
     */
    Optional<String> commit(String message) throws GitAPIException;

    /**
     * Three-way merges {@code ref} into the current branch. Conflicting files are left on disk with
     * conflict markers.
     *
     * @return the conflicting paths, empty for a clean merge
     */
    List<String> merge(String ref) throws GitAPIException;

    /**
     * Updates {@code remoteBranch} on the {@code origin} remote from the local {@code localBranch}.
     */
    void push(String localBranch, String remoteBranch) throws GitAPIException;

    /**
     * Fetches every branch of {@code origin} into {@code refs/remotes/origin/*}.
     */
    void fetch() throws GitAPIException;

    /**
     * @return the file's text at {@code rev}, or empty if either does not exist
     */
    Optional<String> readFile(String rev, String path) throws GitAPIException;

    Set<String> untrackedFiles() throws GitAPIException;

    /**
     * Tracked files whose work tree content differs from the index.
     */
    Set<String> modifiedFiles() throws GitAPIException;

    /**
     * Stashes uncommitted changes, untracked files included.
     *
     * @return false if there was nothing to stash
     */
    boolean stash(String message) throws GitAPIException;

    /**
     * Restores and drops the most recent stash. Never throws: a failed pop leaves the stash in place.
     *
     * @return true if the stash was restored
     */
    boolean popStash();

    Optional<String> mergeBase(String first, String second) throws GitAPIException;

    @Override
    void close();

    class GitCheckoutException extends GitAPIException {
        public GitCheckoutException(String message) {
            super(message);
        }

        public GitCheckoutException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
